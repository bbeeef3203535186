package nl.bytesoflife.deltacad.snap;

import nl.bytesoflife.deltacad.geometry.Point;
import nl.bytesoflife.deltacad.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ContextSnapsTest {

    private static final double SIN_60 = Math.sqrt(3) / 2;

    @Test
    void tangentsFromOutsideCircle() {
        Circle circle = new Circle(Point.ORIGIN, 5);
        List<SnapPoint> tangents = ContextSnaps.tangents(new Point(10, 0), circle);
        assertEquals(2, tangents.size());
        for (SnapPoint t : tangents) {
            assertEquals(SnapType.TANGENT, t.type());
            assertEquals(2.5, t.x(), 1e-9);
            assertEquals(5 * SIN_60, Math.abs(t.y()), 1e-9);
            // radius is perpendicular to the tangent line
            double dot = t.x() * (10 - t.x()) + t.y() * (0 - t.y());
            assertEquals(0.0, dot, 1e-9);
        }
        assertNotEquals(Math.signum(tangents.get(0).y()), Math.signum(tangents.get(1).y()));
    }

    @Test
    void noTangentsFromInsideOrCenter() {
        Circle circle = new Circle(Point.ORIGIN, 5);
        assertTrue(ContextSnaps.tangents(new Point(1, 0), circle).isEmpty());
        assertTrue(ContextSnaps.tangents(Point.ORIGIN, circle).isEmpty());
    }

    @Test
    void tangentFromPointOnCircleIsThePoint() {
        List<SnapPoint> tangents = ContextSnaps.tangents(new Point(5, 0), new Circle(Point.ORIGIN, 5));
        assertFalse(tangents.isEmpty());
        for (SnapPoint t : tangents) {
            assertEquals(5.0, t.x(), 1e-9);
            assertEquals(0.0, t.y(), 1e-9);
        }
    }

    @Test
    void arcTangentsOutsideSweepAreDropped() {
        Arc quarter = new Arc(Point.ORIGIN, 5, 0, 90);
        List<SnapPoint> tangents = ContextSnaps.tangents(new Point(10, 0), quarter);
        assertEquals(1, tangents.size());
        assertEquals(5 * SIN_60, tangents.get(0).y(), 1e-9);
    }

    @Test
    void otherShapesHaveNoTangents() {
        assertTrue(ContextSnaps.tangents(new Point(10, 0), new Ellipse(Point.ORIGIN, 4, 2)).isEmpty());
        assertTrue(ContextSnaps.tangents(new Point(10, 0),
                new Segment(Point.ORIGIN, new Point(0, 5))).isEmpty());
    }

    @Test
    void perpendicularOnSegmentUsesCarrierLine() {
        Segment wall = new Segment(new Point(0, 0), new Point(10, 0));
        SnapPoint foot = ContextSnaps.perpendicular(new Point(4, 8), wall).orElseThrow();
        assertEquals(SnapType.PERPENDICULAR, foot.type());
        assertEquals(4.0, foot.x(), 1e-12);
        assertEquals(0.0, foot.y(), 1e-12);

        SnapPoint beyond = ContextSnaps.perpendicular(new Point(15, 3), wall).orElseThrow();
        assertEquals(15.0, beyond.x(), 1e-12);
        assertEquals(0.0, beyond.y(), 1e-12);
    }

    @Test
    void perpendicularOnRectanglePicksNearestSide() {
        Rectangle rect = new Rectangle(new Point(0, 0), new Point(10, 10));
        SnapPoint foot = ContextSnaps.perpendicular(new Point(5, 20), rect).orElseThrow();
        assertEquals(5.0, foot.x(), 1e-9);
        assertEquals(10.0, foot.y(), 1e-9);
        assertSame(rect, foot.source());

        // diagonal from the corner: every foot falls off its side
        assertTrue(ContextSnaps.perpendicular(new Point(20, 20), rect).isEmpty());
    }

    @Test
    void perpendicularOnPolygonSide() {
        RegularPolygon square = new RegularPolygon(Point.ORIGIN, 10, 4);
        Optional<SnapPoint> foot = ContextSnaps.perpendicular(new Point(20, 20), square);
        SnapPoint p = foot.orElseThrow();
        assertEquals(5.0, p.x(), 1e-9);
        assertEquals(5.0, p.y(), 1e-9);
    }

    @Test
    void perpendicularOnCircleFacesTheReference() {
        SnapPoint foot = ContextSnaps.perpendicular(new Point(10, 0), new Circle(Point.ORIGIN, 5)).orElseThrow();
        assertEquals(SnapType.PERPENDICULAR, foot.type());
        assertEquals(5.0, foot.x(), 1e-9);
        assertEquals(0.0, foot.y(), 1e-9);
    }

    @Test
    void noPerpendicularOnEllipseOrSpline() {
        assertTrue(ContextSnaps.perpendicular(new Point(10, 0), new Ellipse(Point.ORIGIN, 4, 2)).isEmpty());
        Spline spline = new Spline(List.of(new Point(0, 0), new Point(5, 5)), false);
        assertTrue(ContextSnaps.perpendicular(new Point(10, 0), spline).isEmpty());
    }

    @Test
    void nearestIsClampedToSegment() {
        Segment segment = new Segment(new Point(0, 0), new Point(10, 0));
        SnapPoint p = ContextSnaps.nearest(-3, 1, segment).orElseThrow();
        assertEquals(SnapType.NEAREST, p.type());
        assertEquals(0.0, p.x(), 1e-12);
        assertEquals(0.0, p.y(), 1e-12);

        SnapPoint inside = ContextSnaps.nearest(3, 1, segment).orElseThrow();
        assertEquals(3.0, inside.x(), 1e-12);
        assertEquals(0.0, inside.y(), 1e-12);
    }

    @Test
    void nearestOnArcAndUnsupportedShapes() {
        Arc quarter = new Arc(Point.ORIGIN, 5, 0, 90);
        SnapPoint p = ContextSnaps.nearest(4, 4, quarter).orElseThrow();
        assertEquals(5.0, Math.hypot(p.x(), p.y()), 1e-9);
        assertEquals(p.x(), p.y(), 1e-9);

        assertTrue(ContextSnaps.nearest(0, 0, new Rectangle(Point.ORIGIN, new Point(1, 1))).isEmpty());
    }
}
