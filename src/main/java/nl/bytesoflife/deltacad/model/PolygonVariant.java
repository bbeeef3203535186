package nl.bytesoflife.deltacad.model;

import java.util.Locale;

/**
 * How a regular polygon's radius is interpreted.
 * INSCRIBED: radius is the circumradius (vertices lie on the circle).
 * CIRCUMSCRIBED: radius is the apothem (the circle touches every side).
 */
public enum PolygonVariant {
    INSCRIBED("inscribed"),
    CIRCUMSCRIBED("circumscribed");

    private final String recordName;

    PolygonVariant(String recordName) {
        this.recordName = recordName;
    }

    public String getRecordName() {
        return recordName;
    }

    /**
     * Returns null for unrecognised names so callers can decide how to fail.
     */
    public static PolygonVariant fromRecordName(String name) {
        if (name == null) return null;
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "inscribed" -> INSCRIBED;
            case "circumscribed" -> CIRCUMSCRIBED;
            default -> null;
        };
    }
}
