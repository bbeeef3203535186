package nl.bytesoflife.deltacad.snap;

import nl.bytesoflife.deltacad.model.SnapPoint;

/**
 * A snap found from a screen-space query; {@code distance} is in scene units.
 */
public record SnapResult(SnapPoint point, double distance) {
}
