package nl.bytesoflife.deltacad.select;

import nl.bytesoflife.deltacad.geometry.Point;
import nl.bytesoflife.deltacad.model.Primitive;
import nl.bytesoflife.deltacad.view.ViewTransform;

import java.util.List;
import java.util.Optional;

/**
 * Hovered and selected primitive of an editing session. Both hold non-owning references; the
 * update methods report whether the reference changed so callers know when to repaint.
 */
public class SelectionState {

    private final HitTester hitTester;
    private Primitive hovered;
    private Primitive selected;

    public SelectionState(HitTester hitTester) {
        this.hitTester = hitTester;
    }

    public boolean updateHover(Point screenPoint, List<? extends Primitive> primitives, ViewTransform view) {
        Primitive previous = hovered;
        hovered = hitTester.findAtScreen(screenPoint, primitives, view).orElse(null);
        return previous != hovered;
    }

    public boolean updateSelection(Point screenPoint, List<? extends Primitive> primitives, ViewTransform view) {
        Primitive previous = selected;
        selected = hitTester.findAtScreen(screenPoint, primitives, view).orElse(null);
        return previous != selected;
    }

    public Optional<Primitive> getHovered() {
        return Optional.ofNullable(hovered);
    }

    public Optional<Primitive> getSelected() {
        return Optional.ofNullable(selected);
    }

    public void clearHover() {
        hovered = null;
    }

    public void clearSelection() {
        selected = null;
    }

    /**
     * Drops references to a primitive that the owner removed from its collection.
     */
    public void forget(Primitive primitive) {
        if (hovered == primitive) hovered = null;
        if (selected == primitive) selected = null;
    }
}
