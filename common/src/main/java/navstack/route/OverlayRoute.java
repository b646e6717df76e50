package navstack.route;

import navstack.*;
import navstack.overlay.*;

import javax.annotation.*;
import java.util.*;

import static com.google.common.base.Preconditions.*;

/** A route that displays layers in the navigator's {@link Overlay}. */
public abstract class OverlayRoute<T> extends Route<T> {
    /** Creates the entries for this route, bottom first. Called once, from {@link #install}. */
    protected abstract Collection<Overlay.Entry> createOverlayEntries();

    /**
     * Controls whether {@link #didPop} finalizes the route straight away. Subclasses that animate their exit return
     * false and call {@link Navigator#finalizeRoute(Route)} themselves once the animation is over.
     */
    protected boolean isFinishedWhenPopped() {
        return true;
    }

    @Override
    public void install(@Nullable Overlay.Entry insertionPoint) {
        checkState(overlayEntries().isEmpty(), "%s is already installed", this);
        Navigator navigator = checkNotNull(getNavigator(), "%s must be given to a navigator before install", this);
        List<Overlay.Entry> entries = new ArrayList<>(createOverlayEntries());
        navigator.getOverlay().insertAll(entries, insertionPoint);
        overlayEntries().addAll(entries);
        super.install(insertionPoint);
    }

    @Override
    public boolean didPop(@Nullable T result) {
        boolean popped = super.didPop(result);
        Navigator navigator = getNavigator();
        if (popped && isFinishedWhenPopped() && navigator != null)
            navigator.finalizeRoute(this);
        return popped;
    }
}
