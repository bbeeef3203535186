package nl.bytesoflife.deltacad.geometry;

import java.util.List;

/**
 * Shared scalar helpers for distance and angle arithmetic.
 */
public final class GeometryMath {

    public static final double TWO_PI = 2 * Math.PI;

    private GeometryMath() {
    }

    /**
     * Distance from (x, y) to the segment a-b. The projection parameter is clamped to [0, 1];
     * a zero-length segment degrades to point distance.
     */
    public static double distanceToSegment(double x, double y, Point a, Point b) {
        double dx = b.x() - a.x();
        double dy = b.y() - a.y();
        double lenSq = dx * dx + dy * dy;
        if (lenSq == 0) {
            return Math.hypot(x - a.x(), y - a.y());
        }
        double t = ((x - a.x()) * dx + (y - a.y()) * dy) / lenSq;
        t = Math.max(0, Math.min(1, t));
        return Math.hypot(x - (a.x() + t * dx), y - (a.y() + t * dy));
    }

    /**
     * Distance from (x, y) to a polyline, optionally closing it back to its first vertex.
     */
    public static double distanceToPolyline(double x, double y, List<Point> points, boolean closed) {
        if (points.isEmpty()) return Double.POSITIVE_INFINITY;
        if (points.size() == 1) return points.get(0).distanceTo(x, y);

        double min = Double.POSITIVE_INFINITY;
        int n = points.size();
        int edges = closed ? n : n - 1;
        for (int i = 0; i < edges; i++) {
            min = Math.min(min, distanceToSegment(x, y, points.get(i), points.get((i + 1) % n)));
        }
        return min;
    }

    /** Normalizes degrees into [0, 360). */
    public static double normalizeDegrees(double degrees) {
        double a = degrees % 360.0;
        if (a < 0) a += 360.0;
        return a >= 360.0 ? 0.0 : a;
    }

    /** Normalizes degrees into (-180, 180]. */
    public static double normalizeSignedDegrees(double degrees) {
        double a = normalizeDegrees(degrees);
        return a > 180.0 ? a - 360.0 : a;
    }

    /** Normalizes radians into [0, 2pi). */
    public static double normalizeRadians(double radians) {
        double a = radians % TWO_PI;
        if (a < 0) a += TWO_PI;
        return a >= TWO_PI ? 0.0 : a;
    }

    /**
     * Whether the angle lies on the sweep that starts at {@code startDeg} and turns by
     * {@code spanDeg} (negative = clockwise). Sweeps of 360 degrees or more contain every angle.
     */
    public static boolean isAngleInSweep(double angleDeg, double startDeg, double spanDeg) {
        if (Math.abs(spanDeg) >= 360.0) return true;
        double eps = 1e-9;
        if (spanDeg >= 0) {
            double rel = normalizeDegrees(angleDeg - startDeg);
            return rel <= spanDeg + eps || rel >= 360.0 - eps;
        }
        double rel = normalizeDegrees(startDeg - angleDeg);
        return rel <= -spanDeg + eps || rel >= 360.0 - eps;
    }
}
