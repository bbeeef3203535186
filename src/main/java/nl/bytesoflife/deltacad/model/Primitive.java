package nl.bytesoflife.deltacad.model;

import nl.bytesoflife.deltacad.codec.PrimitiveCodec;
import nl.bytesoflife.deltacad.geometry.BoundingBox;

import java.util.List;
import java.util.Map;

/**
 * Base class for the closed set of geometric primitives.
 *
 * Every primitive is built through one of its named constructors and afterwards changes geometry
 * only through {@link #moveControlPoint(int, double, double)} or {@link #translate(double, double)}.
 * Primitives are owned by an external collection; the kernel never discards one.
 */
public abstract sealed class Primitive
        permits Segment, Circle, Arc, Rectangle, Ellipse, RegularPolygon, Spline {

    public static final String DEFAULT_STYLE = "solid-primary";

    private String styleName;

    protected Primitive(String styleName) {
        this.styleName = styleName != null ? styleName : DEFAULT_STYLE;
    }

    /**
     * Cosmetic line style tag, passed through unmodified.
     */
    public String getStyleName() {
        return styleName;
    }

    public void setStyleName(String styleName) {
        this.styleName = styleName != null ? styleName : DEFAULT_STYLE;
    }

    public abstract PrimitiveType getType();

    /**
     * Discrete anchors offered for object snapping.
     */
    public abstract List<SnapPoint> getSnapPoints();

    /**
     * Editable handles; their indices are accepted by {@link #moveControlPoint}.
     */
    public abstract List<ControlPoint> getControlPoints();

    /**
     * Moves the handle with the given index.
     *
     * @return false when the index is unknown or the move would degenerate the primitive;
     *         the primitive is then left unchanged
     */
    public abstract boolean moveControlPoint(int index, double newX, double newY);

    public abstract BoundingBox getBoundingBox();

    /**
     * Distance from (x, y) to the primitive's boundary; interior points are not at distance 0.
     */
    public abstract double distanceToPoint(double x, double y);

    /**
     * Moves the whole primitive rigidly.
     */
    public abstract void translate(double dx, double dy);

    public boolean containsPoint(double x, double y, double tolerance) {
        return distanceToPoint(x, y) <= tolerance;
    }

    public Map<String, Object> toRecord() {
        return PrimitiveCodec.encode(this);
    }
}
