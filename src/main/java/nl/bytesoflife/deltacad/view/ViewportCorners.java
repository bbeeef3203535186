package nl.bytesoflife.deltacad.view;

import nl.bytesoflife.deltacad.geometry.BoundingBox;
import nl.bytesoflife.deltacad.geometry.Point;

import java.util.List;

/**
 * The four viewport corners mapped into scene space. Under rotation they form a rotated
 * rectangle, so renderers should range over {@link #bounds()} rather than two corners.
 */
public record ViewportCorners(Point topLeft, Point topRight, Point bottomLeft, Point bottomRight) {

    public List<Point> asList() {
        return List.of(topLeft, topRight, bottomRight, bottomLeft);
    }

    public BoundingBox bounds() {
        return BoundingBox.of(asList());
    }
}
