package nl.bytesoflife.deltacad.model;

import java.util.Locale;

/**
 * A candidate anchor emitted by a primitive. {@code source} is a non-owning reference.
 */
public record SnapPoint(double x, double y, SnapType type, Primitive source) {

    public double distanceTo(double px, double py) {
        return Math.hypot(x - px, y - py);
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "SnapPoint[%s %.4f,%.4f]", type, x, y);
    }
}
