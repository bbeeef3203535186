package nl.bytesoflife.deltacad.model;

import nl.bytesoflife.deltacad.geometry.BoundingBox;
import nl.bytesoflife.deltacad.geometry.Point;

import java.util.List;
import java.util.Locale;

/**
 * Ellipse with axes parallel to the coordinate axes.
 *
 * Negative radii are coerced to their absolute value. Zero radii are accepted and describe a
 * degenerate (flat or point) ellipse.
 */
public final class Ellipse extends Primitive {

    public static final int CENTER = 0;
    public static final int AXIS_X = 1;
    public static final int AXIS_Y = 2;

    // Bisection on doubles halves the bracket each step; this bounds it well past full precision.
    private static final int MAX_BISECTION_STEPS = 1100;

    private Point center;
    private double radiusX;
    private double radiusY;

    public Ellipse(Point center, double radiusX, double radiusY) {
        this(center, radiusX, radiusY, DEFAULT_STYLE);
    }

    public Ellipse(Point center, double radiusX, double radiusY, String styleName) {
        super(styleName);
        this.center = center;
        this.radiusX = Math.abs(radiusX);
        this.radiusY = Math.abs(radiusY);
    }

    /**
     * Ellipse from its center and the end points of its horizontal and vertical semi-axes.
     * Only the x offset of {@code axisPointX} and the y offset of {@code axisPointY} are used.
     */
    public static Ellipse fromCenterAndAxisPoints(Point center, Point axisPointX, Point axisPointY, String styleName) {
        return new Ellipse(center,
                Math.abs(axisPointX.x() - center.x()),
                Math.abs(axisPointY.y() - center.y()),
                styleName);
    }

    /**
     * Ellipse inscribed in the axis-aligned rectangle spanned by two opposite corners.
     */
    public static Ellipse fromBoundingRectangle(Point p1, Point p2, String styleName) {
        return new Ellipse(p1.midpoint(p2),
                Math.abs(p2.x() - p1.x()) / 2,
                Math.abs(p2.y() - p1.y()) / 2,
                styleName);
    }

    public Point getCenter() {
        return center;
    }

    public double getRadiusX() {
        return radiusX;
    }

    public double getRadiusY() {
        return radiusY;
    }

    public double getMajorRadius() {
        return Math.max(radiusX, radiusY);
    }

    public double getMinorRadius() {
        return Math.min(radiusX, radiusY);
    }

    public double getEccentricity() {
        double a = getMajorRadius();
        if (a == 0) return 0;
        double ratio = getMinorRadius() / a;
        return Math.sqrt(1 - ratio * ratio);
    }

    public double getArea() {
        return Math.PI * radiusX * radiusY;
    }

    /**
     * Ramanujan's second approximation of the perimeter.
     */
    public double getCircumference() {
        double a = radiusX;
        double b = radiusY;
        if (a + b == 0) return 0;
        double h = ((a - b) / (a + b)) * ((a - b) / (a + b));
        return Math.PI * (a + b) * (1 + 3 * h / (10 + Math.sqrt(4 - 3 * h)));
    }

    /**
     * Point for the parametric angle (radians), not the polar angle.
     */
    public Point pointAtAngle(double angleRad) {
        return new Point(center.x() + radiusX * Math.cos(angleRad), center.y() + radiusY * Math.sin(angleRad));
    }

    public boolean isPointInside(double x, double y) {
        if (radiusX == 0 || radiusY == 0) return false;
        double nx = (x - center.x()) / radiusX;
        double ny = (y - center.y()) / radiusY;
        return nx * nx + ny * ny <= 1;
    }

    @Override
    public PrimitiveType getType() {
        return PrimitiveType.ELLIPSE;
    }

    @Override
    public List<SnapPoint> getSnapPoints() {
        return List.of(
                new SnapPoint(center.x(), center.y(), SnapType.CENTER, this),
                new SnapPoint(center.x() + radiusX, center.y(), SnapType.QUADRANT, this),
                new SnapPoint(center.x(), center.y() + radiusY, SnapType.QUADRANT, this),
                new SnapPoint(center.x() - radiusX, center.y(), SnapType.QUADRANT, this),
                new SnapPoint(center.x(), center.y() - radiusY, SnapType.QUADRANT, this));
    }

    @Override
    public List<ControlPoint> getControlPoints() {
        return List.of(
                new ControlPoint(center.x(), center.y(), "Center", CENTER),
                new ControlPoint(center.x() + radiusX, center.y(), "X axis", AXIS_X),
                new ControlPoint(center.x(), center.y() + radiusY, "Y axis", AXIS_Y));
    }

    @Override
    public boolean moveControlPoint(int index, double newX, double newY) {
        switch (index) {
            case CENTER -> {
                center = new Point(newX, newY);
                return true;
            }
            case AXIS_X -> {
                double r = Math.abs(newX - center.x());
                if (r <= 0) return false;
                radiusX = r;
                return true;
            }
            case AXIS_Y -> {
                double r = Math.abs(newY - center.y());
                if (r <= 0) return false;
                radiusY = r;
                return true;
            }
            default -> {
                return false;
            }
        }
    }

    @Override
    public BoundingBox getBoundingBox() {
        return new BoundingBox(center.x() - radiusX, center.y() - radiusY, center.x() + radiusX, center.y() + radiusY);
    }

    /**
     * Distance to the ellipse outline. The problem is folded into the first quadrant of an
     * ellipse whose first semi-axis is the major one, then the closest point is found by bisection
     * on the Lagrange multiplier, which always converges.
     */
    @Override
    public double distanceToPoint(double x, double y) {
        double dx = x - center.x();
        double dy = y - center.y();

        if (radiusX == 0 && radiusY == 0) {
            return Math.hypot(dx, dy);
        }

        double e0;
        double e1;
        double y0;
        double y1;
        if (radiusX >= radiusY) {
            e0 = radiusX;
            e1 = radiusY;
            y0 = Math.abs(dx);
            y1 = Math.abs(dy);
        } else {
            e0 = radiusY;
            e1 = radiusX;
            y0 = Math.abs(dy);
            y1 = Math.abs(dx);
        }

        if (e1 == 0) {
            // Flat ellipse: the outline is the major-axis segment.
            return Math.hypot(Math.max(0, y0 - e0), y1);
        }
        return distanceInFirstQuadrant(e0, e1, y0, y1);
    }

    private static double distanceInFirstQuadrant(double e0, double e1, double y0, double y1) {
        if (y1 > 0) {
            if (y0 > 0) {
                double z0 = y0 / e0;
                double z1 = y1 / e1;
                double g = z0 * z0 + z1 * z1 - 1;
                if (g == 0) {
                    return 0;
                }
                double r0 = (e0 / e1) * (e0 / e1);
                double s = findRoot(r0, z0, z1, g);
                double x0 = r0 * y0 / (s + r0);
                double x1 = y1 / (s + 1);
                return Math.hypot(x0 - y0, x1 - y1);
            }
            return Math.abs(y1 - e1);
        }

        double numer0 = e0 * y0;
        double denom0 = e0 * e0 - e1 * e1;
        if (numer0 < denom0) {
            double xde0 = numer0 / denom0;
            double x0 = e0 * xde0;
            double x1 = e1 * Math.sqrt(1 - xde0 * xde0);
            return Math.hypot(x0 - y0, x1);
        }
        return Math.abs(y0 - e0);
    }

    private static double findRoot(double r0, double z0, double z1, double g) {
        double n0 = r0 * z0;
        double s0 = z1 - 1;
        double s1 = g < 0 ? 0 : Math.hypot(n0, z1) - 1;
        double s = 0;
        for (int i = 0; i < MAX_BISECTION_STEPS; i++) {
            s = (s0 + s1) / 2;
            if (s == s0 || s == s1) {
                break;
            }
            double ratio0 = n0 / (s + r0);
            double ratio1 = z1 / (s + 1);
            double value = ratio0 * ratio0 + ratio1 * ratio1 - 1;
            if (value > 0) {
                s0 = s;
            } else if (value < 0) {
                s1 = s;
            } else {
                break;
            }
        }
        return s;
    }

    @Override
    public void translate(double dx, double dy) {
        center = center.translate(dx, dy);
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "Ellipse[%s, rx=%.4f, ry=%.4f, style=%s]", center, radiusX, radiusY, getStyleName());
    }
}
