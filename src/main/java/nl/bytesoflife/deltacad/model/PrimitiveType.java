package nl.bytesoflife.deltacad.model;

/**
 * Record tag of each primitive variant.
 */
public enum PrimitiveType {
    SEGMENT("line"),
    CIRCLE("circle"),
    ARC("arc"),
    RECTANGLE("rectangle"),
    ELLIPSE("ellipse"),
    POLYGON("polygon"),
    SPLINE("spline");

    private final String tag;

    PrimitiveType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static PrimitiveType fromTag(String tag) {
        if (tag == null) return null;
        for (PrimitiveType type : values()) {
            if (type.tag.equals(tag)) {
                return type;
            }
        }
        return null;
    }
}
