package nl.bytesoflife.deltacad.model;

import nl.bytesoflife.deltacad.geometry.BoundingBox;
import nl.bytesoflife.deltacad.geometry.Circumcircle;
import nl.bytesoflife.deltacad.geometry.Point;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Circle defined by center and radius.
 *
 * A negative radius handed to any constructor is coerced to its absolute value.
 */
public final class Circle extends Primitive {

    public static final int CENTER = 0;
    public static final int RADIUS = 1;

    private Point center;
    private double radius;

    public Circle(Point center, double radius) {
        this(center, radius, DEFAULT_STYLE);
    }

    public Circle(Point center, double radius, String styleName) {
        super(styleName);
        this.center = center;
        this.radius = Math.abs(radius);
    }

    public static Circle fromCenterDiameter(Point center, double diameter, String styleName) {
        return new Circle(center, diameter / 2, styleName);
    }

    /**
     * Circle with the two points as the ends of a diameter.
     */
    public static Circle fromTwoPoints(Point p1, Point p2, String styleName) {
        return new Circle(p1.midpoint(p2), p1.distanceTo(p2) / 2, styleName);
    }

    /**
     * Circumcircle of three points; empty when they are collinear.
     */
    public static Optional<Circle> fromThreePoints(Point p1, Point p2, Point p3, String styleName) {
        return Circumcircle.through(p1, p2, p3)
                .map(cc -> new Circle(cc.center(), cc.radius(), styleName));
    }

    public Point getCenter() {
        return center;
    }

    public double getRadius() {
        return radius;
    }

    public double getDiameter() {
        return radius * 2;
    }

    public double getCircumference() {
        return 2 * Math.PI * radius;
    }

    public double getArea() {
        return Math.PI * radius * radius;
    }

    public Point pointAtAngle(double angleRad) {
        return center.movePolar(radius, angleRad);
    }

    /**
     * Closest point on the circle to (x, y). For the exact center the 0-degree point is used.
     */
    public SnapPoint nearestPoint(double x, double y) {
        double angle = (x == center.x() && y == center.y()) ? 0 : Math.atan2(y - center.y(), x - center.x());
        Point p = pointAtAngle(angle);
        return new SnapPoint(p.x(), p.y(), SnapType.NEAREST, this);
    }

    public boolean isPointInside(double x, double y) {
        double dx = x - center.x();
        double dy = y - center.y();
        return dx * dx + dy * dy <= radius * radius;
    }

    @Override
    public PrimitiveType getType() {
        return PrimitiveType.CIRCLE;
    }

    @Override
    public List<SnapPoint> getSnapPoints() {
        List<SnapPoint> points = new ArrayList<>(5);
        points.add(new SnapPoint(center.x(), center.y(), SnapType.CENTER, this));
        for (int deg = 0; deg < 360; deg += 90) {
            Point q = pointAtAngle(Math.toRadians(deg));
            points.add(new SnapPoint(q.x(), q.y(), SnapType.QUADRANT, this));
        }
        return points;
    }

    @Override
    public List<ControlPoint> getControlPoints() {
        return List.of(
                new ControlPoint(center.x(), center.y(), "Center", CENTER),
                new ControlPoint(center.x() + radius, center.y(), "Radius", RADIUS));
    }

    @Override
    public boolean moveControlPoint(int index, double newX, double newY) {
        if (index == CENTER) {
            center = new Point(newX, newY);
            return true;
        }
        if (index == RADIUS) {
            double newRadius = center.distanceTo(newX, newY);
            if (newRadius > 0) {
                radius = newRadius;
                return true;
            }
        }
        return false;
    }

    @Override
    public BoundingBox getBoundingBox() {
        return new BoundingBox(center.x() - radius, center.y() - radius, center.x() + radius, center.y() + radius);
    }

    @Override
    public double distanceToPoint(double x, double y) {
        return Math.abs(center.distanceTo(x, y) - radius);
    }

    @Override
    public void translate(double dx, double dy) {
        center = center.translate(dx, dy);
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "Circle[%s, r=%.4f, style=%s]", center, radius, getStyleName());
    }
}
