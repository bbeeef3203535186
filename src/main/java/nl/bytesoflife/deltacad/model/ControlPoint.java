package nl.bytesoflife.deltacad.model;

/**
 * An editable handle. {@code index} is what {@link Primitive#moveControlPoint} expects back.
 */
public record ControlPoint(double x, double y, String label, int index) {

    public double distanceTo(double px, double py) {
        return Math.hypot(x - px, y - py);
    }
}
