package nl.bytesoflife.deltacad.model;

import nl.bytesoflife.deltacad.geometry.BoundingBox;
import nl.bytesoflife.deltacad.geometry.GeometryMath;
import nl.bytesoflife.deltacad.geometry.Point;
import org.locationtech.jts.algorithm.PointLocation;
import org.locationtech.jts.geom.Coordinate;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Regular polygon around a center. For {@link PolygonVariant#INSCRIBED} the radius is the
 * circumradius; for {@link PolygonVariant#CIRCUMSCRIBED} it is the apothem and the vertices sit
 * at {@code radius / cos(pi / n)}.
 *
 * Negative radius is coerced to its absolute value, fewer than 3 sides to 3.
 */
public final class RegularPolygon extends Primitive {

    public static final int CENTER = 0;
    public static final int RADIUS = 1;

    public static final int MIN_SIDES = 3;
    public static final int DEFAULT_SIDES = 6;
    public static final int MAX_RECORD_SIDES = 10_000;

    private Point center;
    private double radius;
    private final int numSides;
    private final PolygonVariant variant;
    private double rotation;

    public RegularPolygon(Point center, double radius, int numSides) {
        this(center, radius, numSides, PolygonVariant.INSCRIBED, 0, DEFAULT_STYLE);
    }

    /**
     * @param rotation angle of the first vertex in degrees
     */
    public RegularPolygon(Point center, double radius, int numSides, PolygonVariant variant,
                          double rotation, String styleName) {
        super(styleName);
        this.center = center;
        this.radius = Math.abs(radius);
        this.numSides = Math.max(MIN_SIDES, numSides);
        this.variant = variant != null ? variant : PolygonVariant.INSCRIBED;
        this.rotation = rotation;
    }

    /**
     * Copy with a different side count, keeping radius interpretation and rotation.
     */
    public RegularPolygon withNumSides(int sides) {
        return new RegularPolygon(center, radius, sides, variant, rotation, getStyleName());
    }

    /**
     * Copy with a different radius interpretation. The stored radius is kept, so the outline
     * grows or shrinks.
     */
    public RegularPolygon withVariant(PolygonVariant newVariant) {
        return new RegularPolygon(center, radius, numSides, newVariant, rotation, getStyleName());
    }

    public Point getCenter() {
        return center;
    }

    public double getRadius() {
        return radius;
    }

    public int getNumSides() {
        return numSides;
    }

    public PolygonVariant getVariant() {
        return variant;
    }

    public double getRotation() {
        return rotation;
    }

    /**
     * Circumradius: distance from the center to each vertex.
     */
    public double getEffectiveRadius() {
        if (variant == PolygonVariant.CIRCUMSCRIBED) {
            return radius / Math.cos(Math.PI / numSides);
        }
        return radius;
    }

    public List<Point> getVertices() {
        double r = getEffectiveRadius();
        double step = GeometryMath.TWO_PI / numSides;
        double start = Math.toRadians(rotation);
        List<Point> vertices = new ArrayList<>(numSides);
        for (int i = 0; i < numSides; i++) {
            vertices.add(center.movePolar(r, start + i * step));
        }
        return vertices;
    }

    public double getSideLength() {
        return 2 * getEffectiveRadius() * Math.sin(Math.PI / numSides);
    }

    public double getApothem() {
        if (variant == PolygonVariant.CIRCUMSCRIBED) {
            return radius;
        }
        return radius * Math.cos(Math.PI / numSides);
    }

    public double getArea() {
        return 0.5 * numSides * getSideLength() * getApothem();
    }

    public double getPerimeter() {
        return numSides * getSideLength();
    }

    /**
     * Points on the outline count as inside.
     */
    public boolean isPointInside(double x, double y) {
        List<Point> vertices = getVertices();
        Coordinate[] ring = new Coordinate[vertices.size() + 1];
        for (int i = 0; i < vertices.size(); i++) {
            ring[i] = new Coordinate(vertices.get(i).x(), vertices.get(i).y());
        }
        ring[vertices.size()] = ring[0];
        return PointLocation.isInRing(new Coordinate(x, y), ring);
    }

    @Override
    public PrimitiveType getType() {
        return PrimitiveType.POLYGON;
    }

    @Override
    public List<SnapPoint> getSnapPoints() {
        List<Point> vertices = getVertices();
        List<SnapPoint> points = new ArrayList<>(1 + 2 * vertices.size());
        points.add(new SnapPoint(center.x(), center.y(), SnapType.CENTER, this));
        for (Point v : vertices) {
            points.add(new SnapPoint(v.x(), v.y(), SnapType.ENDPOINT, this));
        }
        for (int i = 0; i < vertices.size(); i++) {
            Point mid = vertices.get(i).midpoint(vertices.get((i + 1) % vertices.size()));
            points.add(new SnapPoint(mid.x(), mid.y(), SnapType.MIDPOINT, this));
        }
        return points;
    }

    @Override
    public List<ControlPoint> getControlPoints() {
        Point first = getVertices().get(0);
        return List.of(
                new ControlPoint(center.x(), center.y(), "Center", CENTER),
                new ControlPoint(first.x(), first.y(), "Radius", RADIUS));
    }

    /**
     * The radius handle is the first vertex: dragging it sets both rotation and radius. For the
     * circumscribed variant the dragged circumradius is converted back to an apothem.
     */
    @Override
    public boolean moveControlPoint(int index, double newX, double newY) {
        if (index == CENTER) {
            center = new Point(newX, newY);
            return true;
        }
        if (index == RADIUS) {
            double newRadius = center.distanceTo(newX, newY);
            if (variant == PolygonVariant.CIRCUMSCRIBED) {
                newRadius *= Math.cos(Math.PI / numSides);
            }
            if (newRadius > 0) {
                radius = newRadius;
                rotation = Math.toDegrees(Math.atan2(newY - center.y(), newX - center.x()));
                return true;
            }
        }
        return false;
    }

    @Override
    public BoundingBox getBoundingBox() {
        return BoundingBox.of(getVertices());
    }

    @Override
    public double distanceToPoint(double x, double y) {
        return GeometryMath.distanceToPolyline(x, y, getVertices(), true);
    }

    @Override
    public void translate(double dx, double dy) {
        center = center.translate(dx, dy);
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "RegularPolygon[%s, r=%.4f, sides=%d, %s, rot=%.2f, style=%s]",
                center, radius, numSides, variant.getRecordName(), rotation, getStyleName());
    }
}
