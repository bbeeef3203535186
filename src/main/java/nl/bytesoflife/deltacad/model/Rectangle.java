package nl.bytesoflife.deltacad.model;

import nl.bytesoflife.deltacad.geometry.BoundingBox;
import nl.bytesoflife.deltacad.geometry.GeometryMath;
import nl.bytesoflife.deltacad.geometry.Point;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Axis-aligned rectangle given by two opposite corners. Edges are derived from the min/max of the
 * corner coordinates, so it does not matter which corner comes first.
 *
 * {@code cornerRadius} and {@code chamferSize} are cosmetic and do not enter any geometry
 * computation. Both are clamped to >= 0 and are mutually exclusive: when both are positive the
 * corner radius is kept and the chamfer dropped.
 */
public final class Rectangle extends Primitive {

    public static final int BOTTOM_LEFT = 0;
    public static final int BOTTOM_RIGHT = 1;
    public static final int TOP_RIGHT = 2;
    public static final int TOP_LEFT = 3;
    public static final int CENTER = 4;

    private Point p1;
    private Point p2;
    private final double cornerRadius;
    private final double chamferSize;

    public Rectangle(Point p1, Point p2) {
        this(p1, p2, DEFAULT_STYLE, 0, 0);
    }

    public Rectangle(Point p1, Point p2, String styleName, double cornerRadius, double chamferSize) {
        super(styleName);
        this.p1 = p1;
        this.p2 = p2;
        this.cornerRadius = Math.max(0, cornerRadius);
        this.chamferSize = this.cornerRadius > 0 ? 0 : Math.max(0, chamferSize);
    }

    /**
     * Rectangle from its origin (first corner) and signed size.
     */
    public static Rectangle fromPointAndSize(Point origin, double width, double height, String styleName) {
        return new Rectangle(origin, new Point(origin.x() + width, origin.y() + height), styleName, 0, 0);
    }

    public static Rectangle fromCenterAndSize(Point center, double width, double height, String styleName) {
        double hw = width / 2;
        double hh = height / 2;
        return new Rectangle(new Point(center.x() - hw, center.y() - hh),
                new Point(center.x() + hw, center.y() + hh), styleName, 0, 0);
    }

    public Point getP1() {
        return p1;
    }

    public Point getP2() {
        return p2;
    }

    public double getCornerRadius() {
        return cornerRadius;
    }

    public double getChamferSize() {
        return chamferSize;
    }

    public double getLeft() {
        return Math.min(p1.x(), p2.x());
    }

    public double getRight() {
        return Math.max(p1.x(), p2.x());
    }

    public double getTop() {
        return Math.max(p1.y(), p2.y());
    }

    public double getBottom() {
        return Math.min(p1.y(), p2.y());
    }

    public double getWidth() {
        return Math.abs(p1.x() - p2.x());
    }

    public double getHeight() {
        return Math.abs(p1.y() - p2.y());
    }

    public Point getCenter() {
        return new Point((getLeft() + getRight()) / 2, (getBottom() + getTop()) / 2);
    }

    public double getArea() {
        return getWidth() * getHeight();
    }

    public double getPerimeter() {
        return 2 * (getWidth() + getHeight());
    }

    /**
     * Corners counter-clockwise starting at bottom-left.
     */
    public List<Point> getCorners() {
        double l = getLeft();
        double r = getRight();
        double b = getBottom();
        double t = getTop();
        return List.of(new Point(l, b), new Point(r, b), new Point(r, t), new Point(l, t));
    }

    public boolean isPointInside(double x, double y) {
        return x >= getLeft() && x <= getRight() && y >= getBottom() && y <= getTop();
    }

    @Override
    public PrimitiveType getType() {
        return PrimitiveType.RECTANGLE;
    }

    @Override
    public List<SnapPoint> getSnapPoints() {
        List<Point> corners = getCorners();
        Point center = getCenter();

        List<SnapPoint> points = new ArrayList<>(9);
        points.add(new SnapPoint(center.x(), center.y(), SnapType.CENTER, this));
        for (Point c : corners) {
            points.add(new SnapPoint(c.x(), c.y(), SnapType.ENDPOINT, this));
        }
        for (int i = 0; i < 4; i++) {
            Point mid = corners.get(i).midpoint(corners.get((i + 1) % 4));
            points.add(new SnapPoint(mid.x(), mid.y(), SnapType.MIDPOINT, this));
        }
        return points;
    }

    @Override
    public List<ControlPoint> getControlPoints() {
        List<Point> corners = getCorners();
        Point center = getCenter();
        return List.of(
                new ControlPoint(corners.get(0).x(), corners.get(0).y(), "Bottom left", BOTTOM_LEFT),
                new ControlPoint(corners.get(1).x(), corners.get(1).y(), "Bottom right", BOTTOM_RIGHT),
                new ControlPoint(corners.get(2).x(), corners.get(2).y(), "Top right", TOP_RIGHT),
                new ControlPoint(corners.get(3).x(), corners.get(3).y(), "Top left", TOP_LEFT),
                new ControlPoint(center.x(), center.y(), "Center", CENTER));
    }

    /**
     * Corner handles move the two edges that meet at that corner; the opposite corner stays put.
     * After a corner move p1 is the bottom-left and p2 the top-right corner.
     */
    @Override
    public boolean moveControlPoint(int index, double newX, double newY) {
        double l = getLeft();
        double r = getRight();
        double b = getBottom();
        double t = getTop();
        switch (index) {
            case BOTTOM_LEFT -> { l = newX; b = newY; }
            case BOTTOM_RIGHT -> { r = newX; b = newY; }
            case TOP_RIGHT -> { r = newX; t = newY; }
            case TOP_LEFT -> { l = newX; t = newY; }
            case CENTER -> {
                Point center = getCenter();
                translate(newX - center.x(), newY - center.y());
                return true;
            }
            default -> {
                return false;
            }
        }
        p1 = new Point(Math.min(l, r), Math.min(b, t));
        p2 = new Point(Math.max(l, r), Math.max(b, t));
        return true;
    }

    @Override
    public BoundingBox getBoundingBox() {
        return new BoundingBox(getLeft(), getBottom(), getRight(), getTop());
    }

    @Override
    public double distanceToPoint(double x, double y) {
        return GeometryMath.distanceToPolyline(x, y, getCorners(), true);
    }

    @Override
    public void translate(double dx, double dy) {
        p1 = p1.translate(dx, dy);
        p2 = p2.translate(dx, dy);
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "Rectangle[%s, %s, style=%s]", p1, p2, getStyleName());
    }
}
