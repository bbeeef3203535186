package nl.bytesoflife.deltacad.geometry;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PointTest {

    @Test
    void distanceAndMidpoint() {
        Point a = new Point(0, 0);
        Point b = new Point(3, 4);
        assertEquals(5.0, a.distanceTo(b), 1e-12);
        assertEquals(new Point(1.5, 2), a.midpoint(b));
    }

    @Test
    void equalityToleratesRoundingNoise() {
        Point p = new Point(0.1 + 0.2, 1.0);
        assertEquals(new Point(0.3, 1.0), p);
        assertNotEquals(new Point(0.3001, 1.0), p);
    }

    @Test
    void rotateAroundCenterIsCounterClockwise() {
        Point p = new Point(2, 1).rotateAround(new Point(1, 1), Math.PI / 2);
        assertEquals(1.0, p.x(), 1e-12);
        assertEquals(2.0, p.y(), 1e-12);
    }

    @Test
    void movePolarAndAngleTo() {
        Point origin = Point.ORIGIN;
        Point p = origin.movePolar(2, Math.PI);
        assertEquals(-2.0, p.x(), 1e-12);
        assertEquals(0.0, p.y(), 1e-12);
        assertEquals(Math.PI, origin.angleTo(p), 1e-12);
    }

    @Test
    void vectorArithmetic() {
        Point p = new Point(1, 2).plus(new Point(3, 4)).times(2).minus(new Point(1, 1)).dividedBy(2);
        assertEquals(new Point(3.5, 5.5), p);
        assertEquals(new Point(-1, -2), new Point(1, 2).negate());
        assertTrue(new Point(1, 1).isCloseTo(new Point(1.05, 0.95), 0.1));
    }

    @Test
    void equalPointsShareHashCode() {
        assertEquals(new Point(1.25, -3.5).hashCode(), new Point(1.25, -3.5).hashCode());
    }

    @Test
    void nearlyEqualLargeCoordinatesHashAlike() {
        Point a = new Point(1e6, 0);
        Point b = new Point(1e6 + 5e-4, 0);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());

        Set<Point> set = new HashSet<>();
        set.add(a);
        assertTrue(set.contains(b));
        assertFalse(set.contains(new Point(1e6 + 1, 0)));
    }
}
