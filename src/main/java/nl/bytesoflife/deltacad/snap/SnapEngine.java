package nl.bytesoflife.deltacad.snap;

import nl.bytesoflife.deltacad.geometry.Point;
import nl.bytesoflife.deltacad.model.*;
import nl.bytesoflife.deltacad.view.ViewTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds the object snap nearest to a cursor position.
 * <p>
 * Candidates are visited in a fixed order: the primitives' own snap points (primitive by primitive),
 * then pairwise intersections, then snaps relative to a reference point (perpendicular, tangent)
 * and nearest-on-object. A candidate replaces the current best only when it is strictly closer,
 * so equal distances keep the first one visited.
 */
public class SnapEngine {

    private static final Logger log = LoggerFactory.getLogger(SnapEngine.class);

    private final SnapSettings settings;

    public SnapEngine() {
        this(SnapSettings.defaults());
    }

    public SnapEngine(SnapSettings settings) {
        this.settings = settings;
    }

    public SnapSettings getSettings() {
        return settings;
    }

    public Optional<SnapPoint> findSnap(double x, double y, List<? extends Primitive> primitives,
                                        double tolerance, Primitive exclude) {
        return findSnap(x, y, primitives, tolerance, exclude, null);
    }

    /**
     * @param tolerance capture radius in scene units; only candidates strictly closer are accepted
     * @param exclude   primitive to skip (by identity), typically the one being drawn; may be null
     * @param reference previous construction point for perpendicular and tangent snaps; may be null
     */
    public Optional<SnapPoint> findSnap(double x, double y, List<? extends Primitive> primitives,
                                        double tolerance, Primitive exclude, Point reference) {
        if (!settings.isEnabled() || settings.getActiveKinds().isEmpty()) {
            return Optional.empty();
        }

        List<Primitive> nearby = nearbyPrimitives(x, y, primitives, tolerance, exclude);
        Best best = new Best(x, y, tolerance);

        for (Primitive primitive : nearby) {
            for (SnapPoint sp : primitive.getSnapPoints()) {
                if (settings.isActive(sp.type())) {
                    best.offer(sp);
                }
            }
        }

        if (settings.isActive(SnapType.INTERSECTION)) {
            for (int i = 0; i < nearby.size(); i++) {
                for (int j = i + 1; j < nearby.size(); j++) {
                    for (SnapPoint sp : Intersections.between(nearby.get(i), nearby.get(j))) {
                        best.offer(sp);
                    }
                }
            }
        }

        boolean perpendicular = reference != null && settings.isActive(SnapType.PERPENDICULAR);
        boolean tangent = reference != null && settings.isActive(SnapType.TANGENT);
        boolean nearest = settings.isActive(SnapType.NEAREST);
        if (perpendicular || tangent || nearest) {
            for (Primitive primitive : nearby) {
                if (perpendicular) {
                    ContextSnaps.perpendicular(reference, primitive).ifPresent(best::offer);
                }
                if (tangent) {
                    for (SnapPoint sp : ContextSnaps.tangents(reference, primitive)) {
                        best.offer(sp);
                    }
                }
                if (nearest) {
                    ContextSnaps.nearest(x, y, primitive).ifPresent(best::offer);
                }
            }
        }

        if (best.point != null) {
            log.debug("Snap {} at distance {} from ({}, {})", best.point, best.distance, x, y);
        }
        return Optional.ofNullable(best.point);
    }

    /**
     * Screen-space variant: converts the cursor with {@code view} and the pixel radius with its zoom.
     */
    public Optional<SnapResult> findSnapScreen(Point screenPoint, List<? extends Primitive> primitives,
                                               ViewTransform view, Primitive exclude, Point reference) {
        if (!settings.isEnabled()) {
            return Optional.empty();
        }
        Point scene = view.toScene(screenPoint);
        double tolerance = settings.toleranceFor(view.getZoom());
        return findSnap(scene.x(), scene.y(), primitives, tolerance, exclude, reference)
                .map(sp -> new SnapResult(sp, sp.distanceTo(scene.x(), scene.y())));
    }

    /**
     * Primitives whose boundary lies within twice the tolerance, or whose center does when
     * CENTER snapping is on. Snap points on a boundary or at a center always pass. A perpendicular
     * foot on a segment's extension can lie near the cursor while the segment itself does not, so
     * such feet are missed.
     */
    List<Primitive> nearbyPrimitives(double x, double y, List<? extends Primitive> primitives,
                                     double tolerance, Primitive exclude) {
        double searchRadius = tolerance * 2;
        boolean checkCenter = settings.isActive(SnapType.CENTER);
        List<Primitive> nearby = new ArrayList<>();
        for (Primitive primitive : primitives) {
            if (primitive == exclude) {
                continue;
            }
            if (primitive.distanceToPoint(x, y) <= searchRadius) {
                nearby.add(primitive);
            } else if (checkCenter) {
                Point center = centerOf(primitive);
                if (center != null && center.distanceTo(x, y) <= searchRadius) {
                    nearby.add(primitive);
                }
            }
        }
        log.trace("{} of {} primitives near ({}, {})", nearby.size(), primitives.size(), x, y);
        return nearby;
    }

    private static Point centerOf(Primitive primitive) {
        if (primitive instanceof Circle c) return c.getCenter();
        if (primitive instanceof Arc a) return a.getCenter();
        if (primitive instanceof Rectangle r) return r.getCenter();
        if (primitive instanceof Ellipse e) return e.getCenter();
        if (primitive instanceof RegularPolygon p) return p.getCenter();
        return null;
    }

    private static final class Best {
        private final double x;
        private final double y;
        private SnapPoint point;
        private double distance;

        Best(double x, double y, double tolerance) {
            this.x = x;
            this.y = y;
            this.distance = tolerance;
        }

        void offer(SnapPoint candidate) {
            double d = candidate.distanceTo(x, y);
            if (d < distance) {
                distance = d;
                point = candidate;
            }
        }
    }
}
