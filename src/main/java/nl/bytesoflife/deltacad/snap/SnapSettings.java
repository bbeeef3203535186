package nl.bytesoflife.deltacad.snap;

import nl.bytesoflife.deltacad.model.SnapType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Object snap configuration: master switch, capture radius in screen pixels and the enabled kinds.
 * Instances are immutable; the {@code withX} methods return modified copies.
 */
public final class SnapSettings {

    public static final double DEFAULT_SNAP_RADIUS = 15.0;

    private static final Set<SnapType> DEFAULT_KINDS = Collections.unmodifiableSet(EnumSet.of(
            SnapType.ENDPOINT, SnapType.MIDPOINT, SnapType.CENTER,
            SnapType.INTERSECTION, SnapType.PERPENDICULAR, SnapType.TANGENT));

    private final boolean enabled;
    private final double snapRadius;
    private final Set<SnapType> activeKinds;

    private SnapSettings(boolean enabled, double snapRadius, Collection<SnapType> activeKinds) {
        if (!(snapRadius > 0) || Double.isInfinite(snapRadius)) {
            throw new IllegalArgumentException("Snap radius must be positive, got " + snapRadius);
        }
        this.enabled = enabled;
        this.snapRadius = snapRadius;
        EnumSet<SnapType> kinds = EnumSet.noneOf(SnapType.class);
        kinds.addAll(activeKinds);
        this.activeKinds = Collections.unmodifiableSet(kinds);
    }

    public static SnapSettings defaults() {
        return new SnapSettings(true, DEFAULT_SNAP_RADIUS, DEFAULT_KINDS);
    }

    public static SnapSettings of(boolean enabled, double snapRadius, Collection<SnapType> kinds) {
        return new SnapSettings(enabled, snapRadius, kinds);
    }

    public SnapSettings withEnabled(boolean enabled) {
        return new SnapSettings(enabled, snapRadius, activeKinds);
    }

    public SnapSettings withSnapRadius(double radius) {
        return new SnapSettings(enabled, radius, activeKinds);
    }

    public SnapSettings withKinds(Collection<SnapType> kinds) {
        return new SnapSettings(enabled, snapRadius, kinds);
    }

    public SnapSettings withKind(SnapType kind, boolean active) {
        EnumSet<SnapType> kinds = EnumSet.noneOf(SnapType.class);
        kinds.addAll(activeKinds);
        if (active) {
            kinds.add(kind);
        } else {
            kinds.remove(kind);
        }
        return new SnapSettings(enabled, snapRadius, kinds);
    }

    public SnapSettings withAllKinds() {
        return new SnapSettings(enabled, snapRadius, EnumSet.allOf(SnapType.class));
    }

    public SnapSettings withNoKinds() {
        return new SnapSettings(enabled, snapRadius, EnumSet.noneOf(SnapType.class));
    }

    public boolean isEnabled() {
        return enabled;
    }

    public double getSnapRadius() {
        return snapRadius;
    }

    public Set<SnapType> getActiveKinds() {
        return activeKinds;
    }

    public boolean isActive(SnapType kind) {
        return activeKinds.contains(kind);
    }

    /**
     * Capture radius in scene units at the given zoom.
     */
    public double toleranceFor(double zoom) {
        if (!(zoom > 0)) {
            throw new IllegalArgumentException("zoom must be positive, got " + zoom);
        }
        return snapRadius / zoom;
    }

    public Map<String, Object> toRecord() {
        List<Object> names = new ArrayList<>();
        for (SnapType kind : activeKinds) {
            names.add(kind.name());
        }
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("enabled", enabled);
        record.put("snap_radius", snapRadius);
        record.put("active_snaps", names);
        return record;
    }

    /**
     * Reads a record written by {@link #toRecord()}. Missing fields take their defaults; unknown
     * kind names are ignored.
     *
     * @throws IllegalArgumentException if a present field has the wrong shape
     */
    public static SnapSettings fromRecord(Map<String, ?> record) {
        Object enabledValue = record.get("enabled");
        boolean enabled = true;
        if (enabledValue != null) {
            if (!(enabledValue instanceof Boolean b)) {
                throw new IllegalArgumentException("enabled must be a boolean, got " + enabledValue);
            }
            enabled = b;
        }

        Object radiusValue = record.get("snap_radius");
        double radius = DEFAULT_SNAP_RADIUS;
        if (radiusValue != null) {
            if (!(radiusValue instanceof Number n)) {
                throw new IllegalArgumentException("snap_radius must be a number, got " + radiusValue);
            }
            radius = n.doubleValue();
        }

        EnumSet<SnapType> kinds = EnumSet.noneOf(SnapType.class);
        Object names = record.get("active_snaps");
        if (names instanceof List<?> list) {
            for (Object name : list) {
                SnapType kind = kindByName(name);
                if (kind != null) {
                    kinds.add(kind);
                }
            }
        } else if (names != null) {
            throw new IllegalArgumentException("active_snaps must be a list, got " + names);
        }
        return new SnapSettings(enabled, radius, kinds);
    }

    private static SnapType kindByName(Object name) {
        if (!(name instanceof String s)) return null;
        for (SnapType kind : SnapType.values()) {
            if (kind.name().equals(s)) {
                return kind;
            }
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SnapSettings other)) return false;
        return enabled == other.enabled
                && Double.compare(snapRadius, other.snapRadius) == 0
                && activeKinds.equals(other.activeKinds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enabled, snapRadius, activeKinds);
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "SnapSettings[enabled=%s, radius=%.1fpx, kinds=%s]",
                enabled, snapRadius, activeKinds);
    }
}
