package nl.bytesoflife.deltacad.snap;

import nl.bytesoflife.deltacad.geometry.GeometryMath;
import nl.bytesoflife.deltacad.geometry.Point;
import nl.bytesoflife.deltacad.model.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Snaps that depend on a point outside the primitive: the previous construction point
 * (perpendicular, tangent) or the cursor itself (nearest).
 */
public final class ContextSnaps {

    private static final double ON_SIDE_EPSILON = 1e-5;

    private ContextSnaps() {
    }

    /**
     * Foot of the perpendicular dropped from {@code from}.
     * <ul>
     *   <li>segment: foot on the carrier line, which may extend past the segment</li>
     *   <li>rectangle, polygon: the nearest foot that lands on one of the sides</li>
     *   <li>circle, arc: the boundary point on the ray from the center towards {@code from}</li>
     * </ul>
     * Ellipses and splines have no perpendicular snap.
     */
    public static Optional<SnapPoint> perpendicular(Point from, Primitive target) {
        if (target instanceof Segment segment) {
            return Optional.of(snap(segment.perpendicularFoot(from), SnapType.PERPENDICULAR, target));
        } else if (target instanceof Rectangle rect) {
            return perpendicularToRing(from, rect.getCorners(), target);
        } else if (target instanceof RegularPolygon polygon) {
            return perpendicularToRing(from, polygon.getVertices(), target);
        } else if (target instanceof Circle circle) {
            return Optional.of(retype(circle.nearestPoint(from.x(), from.y()), SnapType.PERPENDICULAR));
        } else if (target instanceof Arc arc) {
            return Optional.of(retype(arc.nearestPoint(from.x(), from.y()), SnapType.PERPENDICULAR));
        }
        return Optional.empty();
    }

    private static Optional<SnapPoint> perpendicularToRing(Point from, List<Point> ring, Primitive target) {
        SnapPoint best = null;
        double bestDistance = Double.POSITIVE_INFINITY;
        int n = ring.size();
        for (int i = 0; i < n; i++) {
            Point a = ring.get(i);
            Point b = ring.get((i + 1) % n);
            Point foot = new Segment(a, b).perpendicularFoot(from);
            if (GeometryMath.distanceToSegment(foot.x(), foot.y(), a, b) >= ON_SIDE_EPSILON) {
                continue;
            }
            double d = foot.distanceTo(from);
            if (d < bestDistance) {
                bestDistance = d;
                best = snap(foot, SnapType.PERPENDICULAR, target);
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Tangent points on a circle or arc as seen from {@code from}. A point inside the circle has
     * none; a point on the circle has the point itself (twice). Arc tangents outside the sweep are
     * dropped.
     */
    public static List<SnapPoint> tangents(Point from, Primitive target) {
        Point center;
        double radius;
        Arc arc = null;
        if (target instanceof Circle circle) {
            center = circle.getCenter();
            radius = circle.getRadius();
        } else if (target instanceof Arc a) {
            center = a.getCenter();
            radius = a.getRadius();
            arc = a;
        } else {
            return List.of();
        }

        double dx = center.x() - from.x();
        double dy = center.y() - from.y();
        double dist = Math.hypot(dx, dy);
        if (dist == 0 || dist < radius) {
            return List.of();
        }

        double toCenter = Math.atan2(dy, dx);
        double alpha = Math.acos(Math.min(1.0, radius / dist));
        List<SnapPoint> result = new ArrayList<>(2);
        // seen from the center, the tangent points lie alpha either side of the direction back to from
        double back = toCenter + Math.PI;
        for (double angle : new double[]{back + alpha, back - alpha}) {
            Point p = center.movePolar(radius, angle);
            if (arc != null && !arc.containsAngle(Math.toDegrees(angle))) {
                continue;
            }
            result.add(snap(p, SnapType.TANGENT, target));
        }
        return result;
    }

    /**
     * Closest boundary point of a segment, circle or arc to the cursor.
     */
    public static Optional<SnapPoint> nearest(double x, double y, Primitive target) {
        if (target instanceof Segment segment) {
            double lenSq = segment.getDx() * segment.getDx() + segment.getDy() * segment.getDy();
            double t = lenSq == 0 ? 0
                    : ((x - segment.getStart().x()) * segment.getDx() + (y - segment.getStart().y()) * segment.getDy()) / lenSq;
            return Optional.of(snap(segment.pointAt(Math.max(0, Math.min(1, t))), SnapType.NEAREST, target));
        } else if (target instanceof Circle circle) {
            return Optional.of(circle.nearestPoint(x, y));
        } else if (target instanceof Arc arc) {
            return Optional.of(arc.nearestPoint(x, y));
        }
        return Optional.empty();
    }

    private static SnapPoint snap(Point p, SnapType type, Primitive source) {
        return new SnapPoint(p.x(), p.y(), type, source);
    }

    private static SnapPoint retype(SnapPoint p, SnapType type) {
        return new SnapPoint(p.x(), p.y(), type, p.source());
    }
}
