package nl.bytesoflife.deltacad.codec;

import nl.bytesoflife.deltacad.model.Primitive;
import nl.bytesoflife.deltacad.snap.SnapSettings;
import nl.bytesoflife.deltacad.view.ViewTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A saved drawing: {@code {version, view_state, snap_settings, objects:[...]}}.
 * <p>
 * Strict decoding fails on the first bad object. Lenient decoding logs a warning, skips that
 * object and keeps the rest.
 */
public class ProjectRecord {

    private static final Logger log = LoggerFactory.getLogger(ProjectRecord.class);

    public static final String VERSION = "1.0";

    private final String version;
    private final List<Primitive> objects;
    private final Map<String, Object> viewState;
    private final SnapSettings snapSettings;
    private final int skippedObjects;

    public ProjectRecord(List<? extends Primitive> objects, Map<String, Object> viewState, SnapSettings snapSettings) {
        this(VERSION, new ArrayList<>(objects), viewState, snapSettings, 0);
    }

    private ProjectRecord(String version, List<Primitive> objects, Map<String, Object> viewState,
                          SnapSettings snapSettings, int skippedObjects) {
        this.version = version;
        this.objects = Collections.unmodifiableList(objects);
        this.viewState = viewState;
        this.snapSettings = snapSettings != null ? snapSettings : SnapSettings.defaults();
        this.skippedObjects = skippedObjects;
    }

    public static ProjectRecord capture(List<? extends Primitive> objects, ViewTransform view, SnapSettings snapSettings) {
        return new ProjectRecord(objects, view.viewState(), snapSettings);
    }

    public Map<String, Object> toRecord() {
        List<Object> encoded = new ArrayList<>(objects.size());
        for (Primitive p : objects) {
            encoded.add(PrimitiveCodec.encode(p));
        }
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("version", version);
        if (viewState != null) {
            record.put("view_state", viewState);
        }
        record.put("snap_settings", snapSettings.toRecord());
        record.put("objects", encoded);
        return record;
    }

    public String toJson() {
        return RecordJson.write(toRecord());
    }

    public static ProjectRecord fromJson(String json, boolean lenient) throws DecodeException {
        return decode(RecordJson.parseObject(json), lenient);
    }

    @SuppressWarnings("unchecked")
    public static ProjectRecord decode(Map<String, ?> record, boolean lenient) throws DecodeException {
        Object versionValue = record.get("version");
        String version = versionValue != null ? versionValue.toString() : VERSION;
        if (!VERSION.equals(version)) {
            log.warn("Project version {} differs from {}, reading anyway", version, VERSION);
        }

        Map<String, Object> viewState = null;
        Object view = record.get("view_state");
        if (view instanceof Map) {
            viewState = (Map<String, Object>) view;
        } else if (view != null) {
            throw new DecodeException("view_state must be an object", null, "view_state");
        }

        SnapSettings snap = null;
        Object snapValue = record.get("snap_settings");
        if (snapValue instanceof Map) {
            try {
                snap = SnapSettings.fromRecord((Map<String, ?>) snapValue);
            } catch (IllegalArgumentException e) {
                if (!lenient) {
                    throw new DecodeException("Invalid snap_settings: " + e.getMessage(), e);
                }
                log.warn("Ignoring invalid snap settings: {}", e.getMessage());
            }
        }

        List<Primitive> objects = new ArrayList<>();
        int skipped = 0;
        Object list = record.get("objects");
        if (list != null && !(list instanceof List)) {
            throw new DecodeException("objects must be a list", null, "objects");
        }
        if (list != null) {
            int index = 0;
            for (Object item : (List<?>) list) {
                try {
                    if (!(item instanceof Map)) {
                        throw new DecodeException("Object " + index + " is not a record");
                    }
                    objects.add(PrimitiveCodec.decode((Map<String, ?>) item));
                } catch (DecodeException e) {
                    if (!lenient) {
                        throw e;
                    }
                    skipped++;
                    log.warn("Skipping object {}: {}", index, e.getMessage());
                }
                index++;
            }
        }
        log.debug("Decoded project with {} objects ({} skipped)", objects.size(), skipped);
        return new ProjectRecord(version, objects, viewState, snap, skipped);
    }

    /**
     * Restores the saved camera, zoom and rotation onto {@code view}; a record without view state
     * leaves it untouched.
     */
    public void applyViewState(ViewTransform view) throws DecodeException {
        if (viewState == null) {
            return;
        }
        try {
            view.applyViewState(viewState);
        } catch (IllegalArgumentException e) {
            throw new DecodeException("Invalid view_state: " + e.getMessage(), e);
        }
    }

    public String getVersion() {
        return version;
    }

    public List<Primitive> getObjects() {
        return objects;
    }

    public Map<String, Object> getViewState() {
        return viewState;
    }

    public SnapSettings getSnapSettings() {
        return snapSettings;
    }

    /**
     * Number of objects dropped by lenient decoding.
     */
    public int getSkippedObjects() {
        return skippedObjects;
    }
}
