package nl.bytesoflife.deltacad.select;

import nl.bytesoflife.deltacad.geometry.Point;
import nl.bytesoflife.deltacad.model.Primitive;
import nl.bytesoflife.deltacad.view.ViewTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Picks the primitive whose boundary is nearest to a point. Serves hover highlighting as well as
 * click-to-select and click-to-delete; callers differ only in what they do with the result.
 */
public class HitTester {

    private static final Logger log = LoggerFactory.getLogger(HitTester.class);

    public static final double DEFAULT_THRESHOLD_PX = 10.0;

    private final double thresholdPx;

    public HitTester() {
        this(DEFAULT_THRESHOLD_PX);
    }

    public HitTester(double thresholdPx) {
        if (!(thresholdPx > 0)) {
            throw new IllegalArgumentException("Hit threshold must be positive, got " + thresholdPx);
        }
        this.thresholdPx = thresholdPx;
    }

    public HitTester withThreshold(double thresholdPx) {
        return new HitTester(thresholdPx);
    }

    public double getThreshold() {
        return thresholdPx;
    }

    /**
     * Nearest primitive strictly closer than {@code tolerance} (scene units). On equal distances
     * the earlier primitive in iteration order wins.
     */
    public Optional<Primitive> findNearest(double x, double y, List<? extends Primitive> primitives, double tolerance) {
        Primitive nearest = null;
        double best = tolerance;
        for (Primitive primitive : primitives) {
            double d = primitive.distanceToPoint(x, y);
            if (d < best) {
                best = d;
                nearest = primitive;
            }
        }
        if (nearest != null) {
            log.debug("Hit {} at distance {}", nearest.getType(), best);
        }
        return Optional.ofNullable(nearest);
    }

    /**
     * Hit test at a screen position, with the pixel threshold converted through the view's zoom.
     */
    public Optional<Primitive> findAtScreen(Point screenPoint, List<? extends Primitive> primitives, ViewTransform view) {
        Point scene = view.toScene(screenPoint);
        return findNearest(scene.x(), scene.y(), primitives, view.screenToSceneDistance(thresholdPx));
    }
}
