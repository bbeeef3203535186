package nl.bytesoflife.deltacad.geometry;

import java.util.Locale;

/**
 * Immutable 2D coordinate with vector arithmetic.
 *
 * Equality is tolerance-based (relative 1e-9, absolute 1e-12) because most points come out of
 * trigonometric construction. A tolerance band has no hash that separates unequal points while
 * keeping equal ones together, so {@link #hashCode()} is constant: points work as hash keys, but
 * every point shares one bucket. Use {@link #isCloseTo} for explicit tolerances.
 */
public record Point(double x, double y) {

    public static final Point ORIGIN = new Point(0, 0);

    private static final double REL_TOLERANCE = 1e-9;
    private static final double ABS_TOLERANCE = 1e-12;

    public double distanceTo(Point other) {
        return distanceTo(other.x, other.y);
    }

    public double distanceTo(double px, double py) {
        return Math.hypot(x - px, y - py);
    }

    public Point midpoint(Point other) {
        return new Point((x + other.x) / 2, (y + other.y) / 2);
    }

    /**
     * Direction towards another point in radians, in (-pi, pi].
     */
    public double angleTo(Point other) {
        return Math.atan2(other.y - y, other.x - x);
    }

    public Point movePolar(double distance, double angleRad) {
        return new Point(x + distance * Math.cos(angleRad), y + distance * Math.sin(angleRad));
    }

    /**
     * Rotates this point around a center; positive angles turn counter-clockwise.
     */
    public Point rotateAround(Point center, double angleRad) {
        double cos = Math.cos(angleRad);
        double sin = Math.sin(angleRad);
        double dx = x - center.x;
        double dy = y - center.y;
        return new Point(center.x + dx * cos - dy * sin, center.y + dx * sin + dy * cos);
    }

    public Point plus(Point other) {
        return new Point(x + other.x, y + other.y);
    }

    public Point minus(Point other) {
        return new Point(x - other.x, y - other.y);
    }

    public Point times(double scalar) {
        return new Point(x * scalar, y * scalar);
    }

    public Point dividedBy(double scalar) {
        return new Point(x / scalar, y / scalar);
    }

    public Point negate() {
        return new Point(-x, -y);
    }

    public Point translate(double dx, double dy) {
        return new Point(x + dx, y + dy);
    }

    public boolean isCloseTo(Point other, double tolerance) {
        return Math.abs(x - other.x) <= tolerance && Math.abs(y - other.y) <= tolerance;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Point other)) return false;
        return isClose(x, other.x) && isClose(y, other.y);
    }

    @Override
    public int hashCode() {
        return 0;
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "(%.4f, %.4f)", x, y);
    }

    private static boolean isClose(double a, double b) {
        if (a == b) return true;
        double diff = Math.abs(a - b);
        return diff <= Math.max(REL_TOLERANCE * Math.max(Math.abs(a), Math.abs(b)), ABS_TOLERANCE);
    }
}
