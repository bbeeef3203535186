package nl.bytesoflife.deltacad.snap;

import nl.bytesoflife.deltacad.geometry.Point;
import nl.bytesoflife.deltacad.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IntersectionsTest {

    private static void assertPoint(double x, double y, SnapPoint actual) {
        assertEquals(x, actual.x(), 1e-9, "x of " + actual);
        assertEquals(y, actual.y(), 1e-9, "y of " + actual);
    }

    @Test
    void crossingSegments() {
        Segment a = new Segment(new Point(0, 0), new Point(10, 10));
        Segment b = new Segment(new Point(0, 10), new Point(10, 0));
        List<SnapPoint> points = Intersections.between(a, b);
        assertEquals(1, points.size());
        assertPoint(5, 5, points.get(0));
        assertEquals(SnapType.INTERSECTION, points.get(0).type());
        assertSame(a, points.get(0).source());
    }

    @Test
    void segmentsThatMissOrOverlap() {
        Segment a = new Segment(new Point(0, 0), new Point(10, 0));
        assertTrue(Intersections.between(a, new Segment(new Point(0, 1), new Point(10, 1))).isEmpty());
        assertTrue(Intersections.between(a, new Segment(new Point(11, -1), new Point(11, 1))).isEmpty());
        assertTrue(Intersections.between(a, new Segment(new Point(5, 0), new Point(15, 0))).isEmpty());
    }

    @Test
    void segmentThroughCircle() {
        Segment line = new Segment(new Point(-10, 0), new Point(10, 0));
        Circle circle = new Circle(Point.ORIGIN, 5);
        List<SnapPoint> points = Intersections.between(line, circle);
        assertEquals(2, points.size());
        assertPoint(-5, 0, points.get(0));
        assertPoint(5, 0, points.get(1));

        List<SnapPoint> reversed = Intersections.between(circle, line);
        assertEquals(2, reversed.size());
        assertSame(circle, reversed.get(0).source());
    }

    @Test
    void segmentEndingInsideCircleCrossesOnce() {
        Segment line = new Segment(new Point(0, 0), new Point(10, 0));
        List<SnapPoint> points = Intersections.between(line, new Circle(Point.ORIGIN, 5));
        assertEquals(1, points.size());
        assertPoint(5, 0, points.get(0));
    }

    @Test
    void arcSweepFiltersPoints() {
        Arc quarter = new Arc(Point.ORIGIN, 5, 0, 90);
        Segment line = new Segment(new Point(-10, 3), new Point(10, 3));
        List<SnapPoint> points = Intersections.between(line, quarter);
        assertEquals(1, points.size());
        assertPoint(4, 3, points.get(0));
    }

    @Test
    void segmentThroughEllipse() {
        Ellipse ellipse = new Ellipse(Point.ORIGIN, 4, 2);
        List<SnapPoint> horizontal = Intersections.between(
                new Segment(new Point(-10, 0), new Point(10, 0)), ellipse);
        assertEquals(2, horizontal.size());
        assertPoint(-4, 0, horizontal.get(0));
        assertPoint(4, 0, horizontal.get(1));

        List<SnapPoint> vertical = Intersections.between(
                ellipse, new Segment(new Point(0, -10), new Point(0, 10)));
        assertEquals(2, vertical.size());
        assertPoint(0, -2, vertical.get(0));
        assertPoint(0, 2, vertical.get(1));
    }

    @Test
    void overlappingCircles() {
        Circle a = new Circle(Point.ORIGIN, 5);
        Circle b = new Circle(new Point(8, 0), 5);
        List<SnapPoint> points = Intersections.between(a, b);
        assertEquals(2, points.size());
        assertPoint(4, -3, points.get(0));
        assertPoint(4, 3, points.get(1));
    }

    @Test
    void circlesWithoutCrossing() {
        Circle a = new Circle(Point.ORIGIN, 5);
        assertTrue(Intersections.between(a, new Circle(Point.ORIGIN, 3)).isEmpty());
        assertTrue(Intersections.between(a, new Circle(new Point(20, 0), 5)).isEmpty());
        assertTrue(Intersections.between(a, new Circle(new Point(1, 0), 1)).isEmpty());
    }

    @Test
    void circleAndArcHonourBothSweeps() {
        Circle circle = new Circle(new Point(8, 0), 5);
        Arc upper = new Arc(Point.ORIGIN, 5, 0, 180);
        List<SnapPoint> points = Intersections.between(upper, circle);
        assertEquals(1, points.size());
        assertPoint(4, 3, points.get(0));
    }

    @Test
    void rectangleSidesAreSegments() {
        Rectangle rect = new Rectangle(new Point(0, 0), new Point(10, 10));
        Segment line = new Segment(new Point(-5, 5), new Point(15, 5));
        List<SnapPoint> points = Intersections.between(rect, line);
        assertEquals(2, points.size());
        assertTrue(points.stream().anyMatch(p -> Math.abs(p.x()) < 1e-9 && Math.abs(p.y() - 5) < 1e-9));
        assertTrue(points.stream().anyMatch(p -> Math.abs(p.x() - 10) < 1e-9 && Math.abs(p.y() - 5) < 1e-9));
        assertTrue(points.stream().allMatch(p -> p.source() == rect));
    }

    @Test
    void splinesDoNotIntersect() {
        Spline spline = new Spline(List.of(new Point(-5, -5), new Point(0, 5), new Point(5, -5)), false);
        Segment line = new Segment(new Point(-10, 0), new Point(10, 0));
        assertTrue(Intersections.between(spline, line).isEmpty());
        assertTrue(Intersections.between(line, spline).isEmpty());
    }

    @Test
    void tangentContactYieldsSinglePoint() {
        Circle circle = new Circle(Point.ORIGIN, 5);
        List<SnapPoint> touching = Intersections.between(new Segment(new Point(-10, 5), new Point(10, 5)), circle);
        assertEquals(1, touching.size());
        assertPoint(0, 5, touching.get(0));

        List<SnapPoint> kissing = Intersections.between(circle, new Circle(new Point(10, 0), 5));
        assertEquals(1, kissing.size());
        assertPoint(5, 0, kissing.get(0));

        List<SnapPoint> ellipseTop = Intersections.between(
                new Segment(new Point(-10, 2), new Point(10, 2)), new Ellipse(Point.ORIGIN, 4, 2));
        assertEquals(1, ellipseTop.size());
        assertPoint(0, 2, ellipseTop.get(0));
    }
}
