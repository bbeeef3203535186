package nl.bytesoflife.deltacad.model;

/**
 * Kinds of object snap a primitive or the snap engine can offer.
 */
public enum SnapType {
    ENDPOINT,
    MIDPOINT,
    CENTER,
    INTERSECTION,
    PERPENDICULAR,
    TANGENT,
    QUADRANT,
    NODE,
    NEAREST
}
