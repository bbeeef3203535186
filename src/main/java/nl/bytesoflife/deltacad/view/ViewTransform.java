package nl.bytesoflife.deltacad.view;

import nl.bytesoflife.deltacad.geometry.BoundingBox;
import nl.bytesoflife.deltacad.geometry.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps between screen space (pixels, origin top-left, Y down) and scene space (Y up).
 * <p>
 * {@code toScene}: center on the viewport, flip Y, rotate by -rotation, divide by zoom, add camera.
 * {@code fromScene} applies the exact inverse.
 */
public class ViewTransform {

    private static final Logger log = LoggerFactory.getLogger(ViewTransform.class);

    public static final double MIN_ZOOM = 0.1;
    public static final double MAX_ZOOM = 10.0;
    public static final double FIT_PADDING = 0.1;
    private static final double MIN_FIT_EXTENT = 0.01;
    private static final double DEGENERATE_FIT_EXTENT = 10.0;

    private Point camera = Point.ORIGIN;
    private double zoom = 1.0;
    private double rotationDeg = 0.0;
    private double viewportWidth;
    private double viewportHeight;

    public ViewTransform(double viewportWidth, double viewportHeight) {
        setViewportSize(viewportWidth, viewportHeight);
    }

    public ViewTransform(double viewportWidth, double viewportHeight, Point camera, double zoom, double rotationDeg) {
        this(viewportWidth, viewportHeight);
        setCamera(camera);
        setZoom(zoom);
        setRotation(rotationDeg);
    }

    public Point toScene(Point screen) {
        return toScene(screen.x(), screen.y());
    }

    public Point toScene(double screenX, double screenY) {
        double cx = screenX - viewportWidth / 2;
        double cy = viewportHeight / 2 - screenY;

        double rad = -Math.toRadians(rotationDeg);
        double cos = Math.cos(rad);
        double sin = Math.sin(rad);
        double rx = cx * cos - cy * sin;
        double ry = cx * sin + cy * cos;

        return new Point(rx / zoom + camera.x(), ry / zoom + camera.y());
    }

    public Point fromScene(Point scene) {
        return fromScene(scene.x(), scene.y());
    }

    public Point fromScene(double sceneX, double sceneY) {
        double sx = (sceneX - camera.x()) * zoom;
        double sy = (sceneY - camera.y()) * zoom;

        double rad = Math.toRadians(rotationDeg);
        double cos = Math.cos(rad);
        double sin = Math.sin(rad);
        double rx = sx * cos - sy * sin;
        double ry = sx * sin + sy * cos;

        return new Point(rx + viewportWidth / 2, viewportHeight / 2 - ry);
    }

    public ViewportCorners sceneCorners() {
        return new ViewportCorners(
                toScene(0, 0),
                toScene(viewportWidth, 0),
                toScene(0, viewportHeight),
                toScene(viewportWidth, viewportHeight));
    }

    /**
     * Axis-aligned scene extent of the (possibly rotated) viewport.
     */
    public BoundingBox visibleBounds() {
        return sceneCorners().bounds();
    }

    /**
     * Scene length covered by {@code pixels} screen pixels at the current zoom.
     */
    public double screenToSceneDistance(double pixels) {
        return pixels / zoom;
    }

    /**
     * Moves the camera so that content follows a pointer drag of {@code (dx, dy)} screen pixels.
     */
    public void panByScreenDelta(double dx, double dy) {
        double sdx = dx / zoom;
        double sdy = -dy / zoom;

        double rad = -Math.toRadians(rotationDeg);
        double cos = Math.cos(rad);
        double sin = Math.sin(rad);
        double rdx = sdx * cos - sdy * sin;
        double rdy = sdx * sin + sdy * cos;

        camera = new Point(camera.x() - rdx, camera.y() - rdy);
    }

    /**
     * Changes zoom (clamped to [{@value #MIN_ZOOM}, {@value #MAX_ZOOM}]) while keeping the scene
     * point under {@code screenAnchor} at the same screen position.
     */
    public void zoomAt(Point screenAnchor, double newZoom) {
        Point before = toScene(screenAnchor);
        setZoom(clampZoom(newZoom));
        Point after = toScene(screenAnchor);
        camera = camera.minus(after.minus(before));
    }

    /**
     * Centers the camera on {@code bounds} and picks the largest zoom that shows it with
     * {@value #FIT_PADDING} padding on each side. An empty box resets to zoom 1 at the origin.
     */
    public void zoomToFit(BoundingBox bounds) {
        if (bounds == null || bounds.isEmpty()) {
            log.debug("Zoom to fit on empty scene, resetting view");
            camera = Point.ORIGIN;
            zoom = 1.0;
            return;
        }

        double width = bounds.getWidth() * (1 + FIT_PADDING * 2);
        double height = bounds.getHeight() * (1 + FIT_PADDING * 2);
        if (width < MIN_FIT_EXTENT) width = DEGENERATE_FIT_EXTENT;
        if (height < MIN_FIT_EXTENT) height = DEGENERATE_FIT_EXTENT;

        double rad = Math.toRadians(rotationDeg);
        double cos = Math.abs(Math.cos(rad));
        double sin = Math.abs(Math.sin(rad));
        double effectiveWidth = viewportWidth * cos + viewportHeight * sin;
        double effectiveHeight = viewportWidth * sin + viewportHeight * cos;

        double fitZoom = clampZoom(Math.min(effectiveWidth / width, effectiveHeight / height));
        camera = bounds.getCenter();
        zoom = fitZoom;
        log.debug("Zoom to fit {} -> zoom {}, camera {}", bounds, fitZoom, camera);
    }

    public static double clampZoom(double zoom) {
        return Math.max(MIN_ZOOM, Math.min(MAX_ZOOM, zoom));
    }

    // --- persisted view state ---

    public Map<String, Object> viewState() {
        Map<String, Object> cameraRecord = new LinkedHashMap<>();
        cameraRecord.put("x", camera.x());
        cameraRecord.put("y", camera.y());

        Map<String, Object> state = new LinkedHashMap<>();
        state.put("camera_pos", cameraRecord);
        state.put("zoom_factor", zoom);
        state.put("rotation_angle", rotationDeg);
        return state;
    }

    /**
     * Restores a record written by {@link #viewState()}. Missing zoom and rotation default to
     * 1 and 0; a missing camera keeps the current one.
     *
     * @throws IllegalArgumentException if a value is not numeric or the zoom is not positive
     */
    public void applyViewState(Map<String, ?> state) {
        Object cam = state.get("camera_pos");
        Point newCamera = camera;
        if (cam != null) {
            if (!(cam instanceof Map<?, ?> camMap)) {
                throw new IllegalArgumentException("camera_pos must be an {x, y} object");
            }
            newCamera = new Point(number(camMap.get("x"), "camera_pos.x"), number(camMap.get("y"), "camera_pos.y"));
        }
        Object z = state.get("zoom_factor");
        double newZoom = z == null ? 1.0 : number(z, "zoom_factor");
        Object r = state.get("rotation_angle");
        double newRotation = r == null ? 0.0 : number(r, "rotation_angle");

        setZoom(newZoom);
        camera = newCamera;
        rotationDeg = newRotation;
    }

    private static double number(Object value, String name) {
        if (value instanceof Number n && Double.isFinite(n.doubleValue())) {
            return n.doubleValue();
        }
        throw new IllegalArgumentException(name + " must be a finite number, got " + value);
    }

    // --- state ---

    public Point getCamera() {
        return camera;
    }

    public void setCamera(Point camera) {
        if (camera == null) {
            throw new IllegalArgumentException("camera must not be null");
        }
        this.camera = camera;
    }

    public double getZoom() {
        return zoom;
    }

    public void setZoom(double zoom) {
        if (!(zoom > 0) || Double.isInfinite(zoom)) {
            throw new IllegalArgumentException("zoom must be positive and finite, got " + zoom);
        }
        this.zoom = zoom;
    }

    public double getRotation() {
        return rotationDeg;
    }

    public void setRotation(double rotationDeg) {
        this.rotationDeg = rotationDeg;
    }

    public double getViewportWidth() {
        return viewportWidth;
    }

    public double getViewportHeight() {
        return viewportHeight;
    }

    public void setViewportSize(double width, double height) {
        if (!(width > 0) || !(height > 0)) {
            throw new IllegalArgumentException(
                    String.format(Locale.US, "viewport must be positive, got %.1f x %.1f", width, height));
        }
        this.viewportWidth = width;
        this.viewportHeight = height;
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "ViewTransform[camera=%s, zoom=%.4f, rotation=%.2f, viewport=%.0fx%.0f]",
                camera, zoom, rotationDeg, viewportWidth, viewportHeight);
    }
}
