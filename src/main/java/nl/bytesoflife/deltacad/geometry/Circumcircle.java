package nl.bytesoflife.deltacad.geometry;

import java.util.Optional;

/**
 * The unique circle through three non-collinear points.
 */
public record Circumcircle(Point center, double radius) {

    /** Below this absolute determinant the three points are treated as collinear. */
    public static final double COLLINEAR_EPSILON = 1e-10;

    /**
     * Solves the 2x2 circumcenter system. Returns empty when the points are collinear
     * (|D| &lt; {@link #COLLINEAR_EPSILON}).
     */
    public static Optional<Circumcircle> through(Point p1, Point p2, Point p3) {
        double d = 2 * (p1.x() * (p2.y() - p3.y())
                + p2.x() * (p3.y() - p1.y())
                + p3.x() * (p1.y() - p2.y()));
        if (Math.abs(d) < COLLINEAR_EPSILON) {
            return Optional.empty();
        }

        double s1 = p1.x() * p1.x() + p1.y() * p1.y();
        double s2 = p2.x() * p2.x() + p2.y() * p2.y();
        double s3 = p3.x() * p3.x() + p3.y() * p3.y();

        double cx = (s1 * (p2.y() - p3.y()) + s2 * (p3.y() - p1.y()) + s3 * (p1.y() - p2.y())) / d;
        double cy = (s1 * (p3.x() - p2.x()) + s2 * (p1.x() - p3.x()) + s3 * (p2.x() - p1.x())) / d;

        Point center = new Point(cx, cy);
        return Optional.of(new Circumcircle(center, center.distanceTo(p1)));
    }
}
