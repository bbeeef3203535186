package nl.bytesoflife.deltacad.geometry;

import org.locationtech.jts.geom.Envelope;

import java.util.Locale;

/**
 * Axis-aligned bounding box in scene units. A freshly created box is empty and grows through
 * {@link #extend(double, double)}.
 */
public class BoundingBox {

    private double minX = Double.POSITIVE_INFINITY;
    private double minY = Double.POSITIVE_INFINITY;
    private double maxX = Double.NEGATIVE_INFINITY;
    private double maxY = Double.NEGATIVE_INFINITY;

    public BoundingBox() {
    }

    public BoundingBox(double minX, double minY, double maxX, double maxY) {
        extend(minX, minY);
        extend(maxX, maxY);
    }

    public static BoundingBox of(Iterable<Point> points) {
        BoundingBox bbox = new BoundingBox();
        for (Point p : points) {
            bbox.extend(p);
        }
        return bbox;
    }

    public BoundingBox extend(double x, double y) {
        minX = Math.min(minX, x);
        minY = Math.min(minY, y);
        maxX = Math.max(maxX, x);
        maxY = Math.max(maxY, y);
        return this;
    }

    public BoundingBox extend(Point p) {
        return extend(p.x(), p.y());
    }

    public BoundingBox extend(BoundingBox other) {
        if (!other.isEmpty()) {
            extend(other.minX, other.minY);
            extend(other.maxX, other.maxY);
        }
        return this;
    }

    public boolean isEmpty() {
        return minX > maxX || minY > maxY;
    }

    public double getMinX() {
        return minX;
    }

    public double getMinY() {
        return minY;
    }

    public double getMaxX() {
        return maxX;
    }

    public double getMaxY() {
        return maxY;
    }

    public double getWidth() {
        return isEmpty() ? 0 : maxX - minX;
    }

    public double getHeight() {
        return isEmpty() ? 0 : maxY - minY;
    }

    public Point getCenter() {
        return new Point((minX + maxX) / 2, (minY + maxY) / 2);
    }

    public boolean contains(double x, double y) {
        return x >= minX && x <= maxX && y >= minY && y <= maxY;
    }

    /**
     * Returns (min_x, min_y, max_x, max_y).
     */
    public double[] toArray() {
        return new double[]{minX, minY, maxX, maxY};
    }

    public Envelope toEnvelope() {
        return isEmpty() ? new Envelope() : new Envelope(minX, maxX, minY, maxY);
    }

    public static BoundingBox fromEnvelope(Envelope envelope) {
        if (envelope.isNull()) {
            return new BoundingBox();
        }
        return new BoundingBox(envelope.getMinX(), envelope.getMinY(), envelope.getMaxX(), envelope.getMaxY());
    }

    @Override
    public String toString() {
        if (isEmpty()) return "BoundingBox[empty]";
        return String.format(Locale.US, "BoundingBox[%.4f,%.4f -> %.4f,%.4f]", minX, minY, maxX, maxY);
    }
}
