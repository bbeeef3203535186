package nl.bytesoflife.deltacad.model;

import nl.bytesoflife.deltacad.geometry.BoundingBox;
import nl.bytesoflife.deltacad.geometry.Circumcircle;
import nl.bytesoflife.deltacad.geometry.GeometryMath;
import nl.bytesoflife.deltacad.geometry.Point;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Circular arc: center, radius, start angle and signed span, both in degrees.
 * A positive span runs counter-clockwise, a negative one clockwise; |span| never exceeds 360.
 *
 * A negative radius is coerced to its absolute value and an out-of-range span is clamped
 * to [-360, 360].
 */
public final class Arc extends Primitive {

    public static final int CENTER = 0;
    public static final int START = 1;
    public static final int END = 2;
    public static final int RADIUS = 3;

    private static final int[] QUADRANT_ANGLES = {0, 90, 180, 270};

    private Point center;
    private double radius;
    private double startAngle;
    private double spanAngle;

    public Arc(Point center, double radius, double startAngle, double spanAngle) {
        this(center, radius, startAngle, spanAngle, DEFAULT_STYLE);
    }

    public Arc(Point center, double radius, double startAngle, double spanAngle, String styleName) {
        super(styleName);
        this.center = center;
        this.radius = Math.abs(radius);
        this.startAngle = startAngle;
        this.spanAngle = Math.max(-360.0, Math.min(360.0, spanAngle));
    }

    /**
     * Arc from a start and an end angle (degrees).
     *
     * @param shortestPath when true the span is normalised into (-180, 180], so the shorter way
     *                     round is taken in either direction. When false the arc always runs
     *                     counter-clockwise with a span in [0, 360), and a zero span means a full circle.
     */
    public static Arc fromCenterAndAngles(Point center, double radius, double startAngle, double endAngle,
                                          boolean shortestPath, String styleName) {
        double span;
        if (shortestPath) {
            span = GeometryMath.normalizeSignedDegrees(endAngle - startAngle);
        } else {
            span = GeometryMath.normalizeDegrees(endAngle - startAngle);
            if (span == 0) {
                span = 360.0;
            }
        }
        return new Arc(center, radius, startAngle, span, styleName);
    }

    /**
     * Arc starting at {@code start}, passing through {@code onArc} and ending at {@code end}.
     * Empty when the three points are collinear.
     *
     * The direction is chosen by walking counter-clockwise from start: if the on-arc point is
     * reached no later than the end point the arc is counter-clockwise, otherwise it is the
     * clockwise complement.
     */
    public static Optional<Arc> fromThreePoints(Point start, Point onArc, Point end, String styleName) {
        Optional<Circumcircle> circle = Circumcircle.through(start, onArc, end);
        if (circle.isEmpty()) {
            return Optional.empty();
        }
        Point c = circle.get().center();

        double aStart = GeometryMath.normalizeRadians(Math.atan2(start.y() - c.y(), start.x() - c.x()));
        double aMid = GeometryMath.normalizeRadians(Math.atan2(onArc.y() - c.y(), onArc.x() - c.x()));
        double aEnd = GeometryMath.normalizeRadians(Math.atan2(end.y() - c.y(), end.x() - c.x()));

        double spanCcw = GeometryMath.normalizeRadians(aEnd - aStart);
        double midCcw = GeometryMath.normalizeRadians(aMid - aStart);

        double span = midCcw <= spanCcw ? spanCcw : -(GeometryMath.TWO_PI - spanCcw);

        return Optional.of(new Arc(c, circle.get().radius(),
                Math.toDegrees(aStart), Math.toDegrees(span), styleName));
    }

    public Point getCenter() {
        return center;
    }

    public double getRadius() {
        return radius;
    }

    public double getStartAngle() {
        return startAngle;
    }

    public double getSpanAngle() {
        return spanAngle;
    }

    public double getEndAngle() {
        return startAngle + spanAngle;
    }

    public boolean isFullCircle() {
        return Math.abs(spanAngle) >= 360.0;
    }

    public Point getStartPoint() {
        return pointAtAngle(startAngle);
    }

    public Point getEndPoint() {
        return pointAtAngle(getEndAngle());
    }

    public Point getMidPoint() {
        return pointAtAngle(startAngle + spanAngle / 2);
    }

    public double getArcLength() {
        return Math.abs(radius * Math.toRadians(spanAngle));
    }

    public Point pointAtAngle(double angleDeg) {
        return center.movePolar(radius, Math.toRadians(angleDeg));
    }

    public boolean containsAngle(double angleDeg) {
        return GeometryMath.isAngleInSweep(angleDeg, startAngle, spanAngle);
    }

    /**
     * Closest point of the arc to (x, y): the radial projection when it falls on the sweep,
     * otherwise the nearer end point.
     */
    public SnapPoint nearestPoint(double x, double y) {
        double angle = Math.toDegrees(Math.atan2(y - center.y(), x - center.x()));
        Point p;
        if (containsAngle(angle)) {
            p = pointAtAngle(angle);
        } else {
            Point s = getStartPoint();
            Point e = getEndPoint();
            p = s.distanceTo(x, y) <= e.distanceTo(x, y) ? s : e;
        }
        return new SnapPoint(p.x(), p.y(), SnapType.NEAREST, this);
    }

    /**
     * Polyline along the arc from start to end, {@code segments + 1} points.
     */
    public List<Point> curvePoints(int segments) {
        int n = Math.max(1, segments);
        List<Point> points = new ArrayList<>(n + 1);
        for (int i = 0; i <= n; i++) {
            points.add(pointAtAngle(startAngle + spanAngle * i / n));
        }
        return points;
    }

    @Override
    public PrimitiveType getType() {
        return PrimitiveType.ARC;
    }

    @Override
    public List<SnapPoint> getSnapPoints() {
        Point start = getStartPoint();
        Point end = getEndPoint();
        Point mid = getMidPoint();

        List<SnapPoint> points = new ArrayList<>(8);
        points.add(new SnapPoint(center.x(), center.y(), SnapType.CENTER, this));
        points.add(new SnapPoint(start.x(), start.y(), SnapType.ENDPOINT, this));
        points.add(new SnapPoint(end.x(), end.y(), SnapType.ENDPOINT, this));
        points.add(new SnapPoint(mid.x(), mid.y(), SnapType.MIDPOINT, this));
        for (int angle : QUADRANT_ANGLES) {
            if (containsAngle(angle)) {
                Point q = pointAtAngle(angle);
                points.add(new SnapPoint(q.x(), q.y(), SnapType.QUADRANT, this));
            }
        }
        return points;
    }

    @Override
    public List<ControlPoint> getControlPoints() {
        Point start = getStartPoint();
        Point end = getEndPoint();
        Point mid = getMidPoint();
        return List.of(
                new ControlPoint(center.x(), center.y(), "Center", CENTER),
                new ControlPoint(start.x(), start.y(), "Start", START),
                new ControlPoint(end.x(), end.y(), "End", END),
                new ControlPoint(mid.x(), mid.y(), "Radius", RADIUS));
    }

    /**
     * Start and end handles keep the opposite end fixed and keep the sweep direction; a move
     * that would collapse the span to zero is refused.
     */
    @Override
    public boolean moveControlPoint(int index, double newX, double newY) {
        switch (index) {
            case CENTER -> {
                center = new Point(newX, newY);
                return true;
            }
            case START -> {
                double newStart = Math.toDegrees(Math.atan2(newY - center.y(), newX - center.x()));
                double newSpan = sweepBetween(newStart, getEndAngle());
                if (newSpan == 0) return false;
                startAngle = newStart;
                spanAngle = newSpan;
                return true;
            }
            case END -> {
                double newEnd = Math.toDegrees(Math.atan2(newY - center.y(), newX - center.x()));
                double newSpan = sweepBetween(startAngle, newEnd);
                if (newSpan == 0) return false;
                spanAngle = newSpan;
                return true;
            }
            case RADIUS -> {
                double newRadius = center.distanceTo(newX, newY);
                if (newRadius > 0) {
                    radius = newRadius;
                    return true;
                }
                return false;
            }
            default -> {
                return false;
            }
        }
    }

    private double sweepBetween(double from, double to) {
        if (spanAngle >= 0) {
            return GeometryMath.normalizeDegrees(to - from);
        }
        return -GeometryMath.normalizeDegrees(from - to);
    }

    @Override
    public BoundingBox getBoundingBox() {
        BoundingBox bbox = new BoundingBox().extend(getStartPoint()).extend(getEndPoint());
        for (int angle : QUADRANT_ANGLES) {
            if (containsAngle(angle)) {
                bbox.extend(pointAtAngle(angle));
            }
        }
        return bbox;
    }

    @Override
    public double distanceToPoint(double x, double y) {
        double angle = Math.toDegrees(Math.atan2(y - center.y(), x - center.x()));
        if (containsAngle(angle)) {
            return Math.abs(center.distanceTo(x, y) - radius);
        }
        return Math.min(getStartPoint().distanceTo(x, y), getEndPoint().distanceTo(x, y));
    }

    @Override
    public void translate(double dx, double dy) {
        center = center.translate(dx, dy);
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "Arc[%s, r=%.4f, start=%.2f, span=%.2f, style=%s]",
                center, radius, startAngle, spanAngle, getStyleName());
    }
}
