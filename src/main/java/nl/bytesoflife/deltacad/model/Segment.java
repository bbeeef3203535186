package nl.bytesoflife.deltacad.model;

import nl.bytesoflife.deltacad.geometry.BoundingBox;
import nl.bytesoflife.deltacad.geometry.GeometryMath;
import nl.bytesoflife.deltacad.geometry.Point;

import java.util.List;

/**
 * Straight line segment between two points.
 */
public final class Segment extends Primitive {

    public static final int START = 0;
    public static final int END = 1;
    public static final int MIDDLE = 2;

    private Point start;
    private Point end;

    public Segment(Point start, Point end) {
        this(start, end, DEFAULT_STYLE);
    }

    public Segment(Point start, Point end, String styleName) {
        super(styleName);
        this.start = start;
        this.end = end;
    }

    public Point getStart() {
        return start;
    }

    public Point getEnd() {
        return end;
    }

    public double getLength() {
        return start.distanceTo(end);
    }

    public Point getMidpoint() {
        return start.midpoint(end);
    }

    /**
     * Direction from start to end in radians.
     */
    public double getAngle() {
        return start.angleTo(end);
    }

    public double getDx() {
        return end.x() - start.x();
    }

    public double getDy() {
        return end.y() - start.y();
    }

    /**
     * Point at parameter t; t=0 is the start, t=1 the end.
     */
    public Point pointAt(double t) {
        return new Point(start.x() + t * getDx(), start.y() + t * getDy());
    }

    /**
     * Foot of the perpendicular from {@code from} onto the infinite carrier line. May lie outside
     * the segment. A zero-length segment returns its start.
     */
    public Point perpendicularFoot(Point from) {
        double dx = getDx();
        double dy = getDy();
        double lenSq = dx * dx + dy * dy;
        if (lenSq == 0) {
            return start;
        }
        double t = ((from.x() - start.x()) * dx + (from.y() - start.y()) * dy) / lenSq;
        return pointAt(t);
    }

    @Override
    public PrimitiveType getType() {
        return PrimitiveType.SEGMENT;
    }

    @Override
    public List<SnapPoint> getSnapPoints() {
        Point mid = getMidpoint();
        return List.of(
                new SnapPoint(start.x(), start.y(), SnapType.ENDPOINT, this),
                new SnapPoint(end.x(), end.y(), SnapType.ENDPOINT, this),
                new SnapPoint(mid.x(), mid.y(), SnapType.MIDPOINT, this));
    }

    @Override
    public List<ControlPoint> getControlPoints() {
        Point mid = getMidpoint();
        return List.of(
                new ControlPoint(start.x(), start.y(), "Start", START),
                new ControlPoint(end.x(), end.y(), "End", END),
                new ControlPoint(mid.x(), mid.y(), "Middle", MIDDLE));
    }

    @Override
    public boolean moveControlPoint(int index, double newX, double newY) {
        switch (index) {
            case START -> start = new Point(newX, newY);
            case END -> end = new Point(newX, newY);
            case MIDDLE -> {
                Point mid = getMidpoint();
                translate(newX - mid.x(), newY - mid.y());
            }
            default -> {
                return false;
            }
        }
        return true;
    }

    @Override
    public BoundingBox getBoundingBox() {
        return new BoundingBox().extend(start).extend(end);
    }

    @Override
    public double distanceToPoint(double x, double y) {
        return GeometryMath.distanceToSegment(x, y, start, end);
    }

    @Override
    public void translate(double dx, double dy) {
        start = start.translate(dx, dy);
        end = end.translate(dx, dy);
    }

    @Override
    public String toString() {
        return "Segment[" + start + " -> " + end + ", style=" + getStyleName() + "]";
    }
}
