package nl.bytesoflife.deltacad.codec;

import nl.bytesoflife.deltacad.geometry.Point;
import nl.bytesoflife.deltacad.model.*;
import nl.bytesoflife.deltacad.snap.SnapSettings;
import nl.bytesoflife.deltacad.view.ViewTransform;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProjectRecordTest {

    @Test
    void savesAndRestoresDrawing() {
        List<Primitive> objects = List.of(
                new Segment(new Point(0, 0), new Point(10, 0)),
                new Circle(new Point(5, 5), 2),
                new Spline(List.of(new Point(0, 0), new Point(1, 2), new Point(3, 1)), false));
        ViewTransform view = new ViewTransform(800, 600, new Point(12, -4), 2.5, 30);
        SnapSettings snap = SnapSettings.defaults().withSnapRadius(20).withKind(SnapType.TANGENT, false);

        String json = ProjectRecord.capture(objects, view, snap).toJson();
        ProjectRecord loaded = ProjectRecord.fromJson(json, false);

        assertEquals("1.0", loaded.getVersion());
        assertEquals(3, loaded.getObjects().size());
        for (int i = 0; i < objects.size(); i++) {
            assertEquals(objects.get(i).toRecord(), loaded.getObjects().get(i).toRecord());
        }
        assertEquals(snap, loaded.getSnapSettings());

        ViewTransform restored = new ViewTransform(800, 600);
        loaded.applyViewState(restored);
        assertEquals(new Point(12, -4), restored.getCamera());
        assertEquals(2.5, restored.getZoom(), 0);
        assertEquals(30, restored.getRotation(), 0);
    }

    private static Map<String, Object> projectWithBadObject() {
        List<Object> objects = new ArrayList<>();
        objects.add(new Circle(Point.ORIGIN, 1).toRecord());
        objects.add(Map.of("type", "hyperbola"));
        objects.add("not a record");
        objects.add(new Segment(Point.ORIGIN, new Point(1, 1)).toRecord());
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("version", "1.0");
        record.put("objects", objects);
        return record;
    }

    @Test
    void strictDecodingFailsOnBadObject() {
        DecodeException e = assertThrows(DecodeException.class,
                () -> ProjectRecord.decode(projectWithBadObject(), false));
        assertEquals("hyperbola", e.getRecordType());
    }

    @Test
    void lenientDecodingSkipsBadObjects() {
        ProjectRecord project = ProjectRecord.decode(projectWithBadObject(), true);
        assertEquals(2, project.getObjects().size());
        assertEquals(2, project.getSkippedObjects());
        assertInstanceOf(Circle.class, project.getObjects().get(0));
        assertInstanceOf(Segment.class, project.getObjects().get(1));
        assertEquals(SnapSettings.defaults(), project.getSnapSettings());
        assertNull(project.getViewState());
    }

    @Test
    void missingViewStateLeavesViewAlone() {
        ProjectRecord project = ProjectRecord.decode(Map.of("objects", List.of()), false);
        ViewTransform view = new ViewTransform(100, 100, new Point(3, 3), 4, 0);
        project.applyViewState(view);
        assertEquals(new Point(3, 3), view.getCamera());
        assertEquals(4, view.getZoom(), 0);
    }

    @Test
    void invalidViewStateIsADecodeError() {
        ProjectRecord project = ProjectRecord.decode(
                Map.of("view_state", Map.of("zoom_factor", 0)), false);
        assertThrows(DecodeException.class, () -> project.applyViewState(new ViewTransform(100, 100)));
    }

    @Test
    void wrongShapesAreRejected() {
        assertThrows(DecodeException.class, () -> ProjectRecord.decode(Map.of("objects", "none"), true));
        assertThrows(DecodeException.class, () -> ProjectRecord.decode(Map.of("view_state", 5), true));
        assertThrows(DecodeException.class,
                () -> ProjectRecord.decode(Map.of("snap_settings", Map.of("snap_radius", -1)), false));
        assertEquals(SnapSettings.defaults(),
                ProjectRecord.decode(Map.of("snap_settings", Map.of("snap_radius", -1)), true).getSnapSettings());
    }
}
