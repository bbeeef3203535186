package nl.bytesoflife.deltacad.model;

import nl.bytesoflife.deltacad.geometry.BoundingBox;
import nl.bytesoflife.deltacad.geometry.GeometryMath;
import nl.bytesoflife.deltacad.geometry.Point;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Interpolating spline through an ordered list of control points, built from cubic Hermite
 * spans with Catmull-Rom tangents. Open splines use one-sided tangents at both ends; closed
 * splines wrap indices around.
 *
 * The tessellation is cached per segment count and dropped by every control point mutation.
 */
public final class Spline extends Primitive {

    public static final int MIN_POINTS = 2;
    public static final int DEFAULT_SEGMENTS_PER_SPAN = 20;

    private final List<Point> controlPoints;
    private final boolean closed;

    private List<Point> cachedCurve;
    private int cachedSegments;

    public Spline(List<Point> controlPoints, boolean closed) {
        this(controlPoints, closed, DEFAULT_STYLE);
    }

    public Spline(List<Point> controlPoints, boolean closed, String styleName) {
        super(styleName);
        if (controlPoints == null || controlPoints.size() < MIN_POINTS) {
            throw new IllegalArgumentException("Spline needs at least " + MIN_POINTS + " control points");
        }
        this.controlPoints = new ArrayList<>(controlPoints);
        this.closed = closed;
    }

    public List<Point> getControlPointList() {
        return Collections.unmodifiableList(controlPoints);
    }

    public int getPointCount() {
        return controlPoints.size();
    }

    public boolean isClosed() {
        return closed;
    }

    public void addPoint(Point point) {
        controlPoints.add(point);
        invalidate();
    }

    /**
     * Inserts a control point; an index outside [0, size] is rejected.
     */
    public boolean addPoint(int index, Point point) {
        if (index < 0 || index > controlPoints.size()) {
            return false;
        }
        controlPoints.add(index, point);
        invalidate();
        return true;
    }

    /**
     * Removes a control point. Refuses when it would leave fewer than two points.
     */
    public boolean removePoint(int index) {
        if (controlPoints.size() <= MIN_POINTS || index < 0 || index >= controlPoints.size()) {
            return false;
        }
        controlPoints.remove(index);
        invalidate();
        return true;
    }

    public boolean movePoint(int index, double newX, double newY) {
        if (index < 0 || index >= controlPoints.size()) {
            return false;
        }
        controlPoints.set(index, new Point(newX, newY));
        invalidate();
        return true;
    }

    private void invalidate() {
        cachedCurve = null;
    }

    public List<Point> curvePoints() {
        return curvePoints(DEFAULT_SEGMENTS_PER_SPAN);
    }

    /**
     * Tessellates the spline. Open splines end exactly on their last control point, closed ones
     * repeat the first curve point at the end.
     */
    public List<Point> curvePoints(int segmentsPerSpan) {
        int segments = Math.max(1, segmentsPerSpan);
        if (cachedCurve != null && cachedSegments == segments) {
            return cachedCurve;
        }

        int n = controlPoints.size();
        int spans = closed ? n : n - 1;
        List<Point> result = new ArrayList<>(spans * segments + 1);

        for (int i = 0; i < spans; i++) {
            Point p0 = controlPoints.get(i);
            Point p1 = controlPoints.get((i + 1) % n);

            Point m0;
            if (i == 0 && !closed) {
                m0 = p1.minus(p0).times(0.5);
            } else {
                m0 = p1.minus(controlPoints.get((i - 1 + n) % n)).times(0.5);
            }

            Point m1;
            if (i == n - 2 && !closed) {
                m1 = p1.minus(p0).times(0.5);
            } else {
                m1 = controlPoints.get((i + 2) % n).minus(p0).times(0.5);
            }

            for (int j = 0; j < segments; j++) {
                result.add(hermite(p0, p1, m0, m1, (double) j / segments));
            }
        }

        if (closed) {
            result.add(result.get(0));
        } else {
            result.add(controlPoints.get(n - 1));
        }

        cachedCurve = Collections.unmodifiableList(result);
        cachedSegments = segments;
        return cachedCurve;
    }

    private static Point hermite(Point p0, Point p1, Point m0, Point m1, double t) {
        double t2 = t * t;
        double t3 = t2 * t;
        double h00 = 2 * t3 - 3 * t2 + 1;
        double h10 = t3 - 2 * t2 + t;
        double h01 = -2 * t3 + 3 * t2;
        double h11 = t3 - t2;
        return new Point(
                h00 * p0.x() + h10 * m0.x() + h01 * p1.x() + h11 * m1.x(),
                h00 * p0.y() + h10 * m0.y() + h01 * p1.y() + h11 * m1.y());
    }

    /**
     * Length of the default tessellation.
     */
    public double getApproximateLength() {
        List<Point> curve = curvePoints();
        double length = 0;
        for (int i = 0; i + 1 < curve.size(); i++) {
            length += curve.get(i).distanceTo(curve.get(i + 1));
        }
        return length;
    }

    @Override
    public PrimitiveType getType() {
        return PrimitiveType.SPLINE;
    }

    @Override
    public List<SnapPoint> getSnapPoints() {
        List<SnapPoint> points = new ArrayList<>(controlPoints.size() + 2);
        for (Point cp : controlPoints) {
            points.add(new SnapPoint(cp.x(), cp.y(), SnapType.NODE, this));
        }
        if (!closed) {
            Point first = controlPoints.get(0);
            Point last = controlPoints.get(controlPoints.size() - 1);
            points.add(new SnapPoint(first.x(), first.y(), SnapType.ENDPOINT, this));
            points.add(new SnapPoint(last.x(), last.y(), SnapType.ENDPOINT, this));
        }
        return points;
    }

    @Override
    public List<ControlPoint> getControlPoints() {
        List<ControlPoint> handles = new ArrayList<>(controlPoints.size());
        for (int i = 0; i < controlPoints.size(); i++) {
            Point cp = controlPoints.get(i);
            handles.add(new ControlPoint(cp.x(), cp.y(), "Point " + (i + 1), i));
        }
        return handles;
    }

    @Override
    public boolean moveControlPoint(int index, double newX, double newY) {
        return movePoint(index, newX, newY);
    }

    @Override
    public BoundingBox getBoundingBox() {
        return BoundingBox.of(curvePoints());
    }

    @Override
    public double distanceToPoint(double x, double y) {
        return GeometryMath.distanceToPolyline(x, y, curvePoints(), false);
    }

    @Override
    public void translate(double dx, double dy) {
        for (int i = 0; i < controlPoints.size(); i++) {
            controlPoints.set(i, controlPoints.get(i).translate(dx, dy));
        }
        invalidate();
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "Spline[%d points, closed=%s, style=%s]",
                controlPoints.size(), closed, getStyleName());
    }
}
