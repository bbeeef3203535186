package nl.bytesoflife.deltacad.snap;

import nl.bytesoflife.deltacad.model.SnapType;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SnapSettingsTest {

    @Test
    void defaults() {
        SnapSettings settings = SnapSettings.defaults();
        assertTrue(settings.isEnabled());
        assertEquals(15.0, settings.getSnapRadius());
        assertEquals(EnumSet.of(SnapType.ENDPOINT, SnapType.MIDPOINT, SnapType.CENTER,
                SnapType.INTERSECTION, SnapType.PERPENDICULAR, SnapType.TANGENT), settings.getActiveKinds());
        assertFalse(settings.isActive(SnapType.QUADRANT));
        assertFalse(settings.isActive(SnapType.NEAREST));
    }

    @Test
    void copiesLeaveOriginalUntouched() {
        SnapSettings original = SnapSettings.defaults();
        SnapSettings changed = original.withEnabled(false).withSnapRadius(25).withKind(SnapType.QUADRANT, true)
                .withKind(SnapType.ENDPOINT, false);

        assertEquals(SnapSettings.defaults(), original);
        assertFalse(changed.isEnabled());
        assertEquals(25.0, changed.getSnapRadius());
        assertTrue(changed.isActive(SnapType.QUADRANT));
        assertFalse(changed.isActive(SnapType.ENDPOINT));
    }

    @Test
    void allAndNoKinds() {
        assertEquals(EnumSet.allOf(SnapType.class), SnapSettings.defaults().withAllKinds().getActiveKinds());
        assertTrue(SnapSettings.defaults().withNoKinds().getActiveKinds().isEmpty());
    }

    @Test
    void activeKindsAreReadOnly() {
        assertThrows(UnsupportedOperationException.class,
                () -> SnapSettings.defaults().getActiveKinds().add(SnapType.NODE));
    }

    @Test
    void rejectsNonPositiveRadius() {
        assertThrows(IllegalArgumentException.class, () -> SnapSettings.defaults().withSnapRadius(0));
        assertThrows(IllegalArgumentException.class, () -> SnapSettings.defaults().withSnapRadius(-3));
        assertThrows(IllegalArgumentException.class, () -> SnapSettings.defaults().withSnapRadius(Double.NaN));
    }

    @Test
    void toleranceScalesWithZoom() {
        SnapSettings settings = SnapSettings.defaults();
        assertEquals(15.0, settings.toleranceFor(1.0), 1e-12);
        assertEquals(7.5, settings.toleranceFor(2.0), 1e-12);
        assertEquals(150.0, settings.toleranceFor(0.1), 1e-9);
        assertThrows(IllegalArgumentException.class, () -> settings.toleranceFor(0));
    }

    @Test
    void recordRoundTrip() {
        SnapSettings settings = SnapSettings.of(false, 12.5, List.of(SnapType.NODE, SnapType.ENDPOINT));
        Map<String, Object> record = settings.toRecord();
        assertEquals(false, record.get("enabled"));
        assertEquals(12.5, record.get("snap_radius"));
        assertEquals(List.of("ENDPOINT", "NODE"), record.get("active_snaps"));
        assertEquals(settings, SnapSettings.fromRecord(record));
    }

    @Test
    void recordReadingIsForgiving() {
        SnapSettings settings = SnapSettings.fromRecord(Map.of(
                "snap_radius", 20,
                "active_snaps", List.of("CENTER", "GRID", "bogus", 7)));
        assertTrue(settings.isEnabled());
        assertEquals(20.0, settings.getSnapRadius());
        assertEquals(EnumSet.of(SnapType.CENTER), settings.getActiveKinds());

        assertEquals(SnapSettings.defaults().getSnapRadius(), SnapSettings.fromRecord(Map.of()).getSnapRadius());
    }

    @Test
    void recordWithWrongShapesIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> SnapSettings.fromRecord(Map.of("enabled", "yes")));
        assertThrows(IllegalArgumentException.class, () -> SnapSettings.fromRecord(Map.of("snap_radius", "big")));
        assertThrows(IllegalArgumentException.class, () -> SnapSettings.fromRecord(Map.of("snap_radius", 0)));
        assertThrows(IllegalArgumentException.class, () -> SnapSettings.fromRecord(Map.of("active_snaps", "ENDPOINT")));
    }
}
