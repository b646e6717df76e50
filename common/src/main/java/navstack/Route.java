package navstack;

import navstack.overlay.*;

import javax.annotation.*;
import java.util.*;
import java.util.concurrent.*;

import static com.google.common.base.Preconditions.*;

/**
 * An entry managed by a {@link Navigator}: a screen, page or dialog.
 *
 * This class defines the interface between the navigator and the routes that are pushed on and popped off it. Most
 * routes have visual affordances, which they place in the navigator's {@link Overlay} using one or more
 * {@link Overlay.Entry} objects.
 *
 * Lifecycle: a route is installed, then either pushed or swapped in by a replace. While it is in the history it gets
 * neighbour notifications. When popped it completes its {@link #getPopped()} future, and once any exit effect is done
 * the navigator finalizes it, which disposes it. A route is disposed exactly once and cannot be reused.
 *
 * @param <T> the type of the result the route is popped with
 */
public abstract class Route<T> {
    @Nullable private Navigator navigator;
    private final List<Overlay.Entry> overlayEntries = new ArrayList<>();
    private final CompletableFuture<T> popped = new CompletableFuture<>();
    private boolean disposed;

    /** The navigator the route is in, if any. Also set while the route is popped but not yet finalized. */
    @Nullable
    public Navigator getNavigator() {
        return navigator;
    }

    void setNavigator(@Nullable Navigator navigator) {
        this.navigator = navigator;
    }

    /** The overlay entries for this route, bottom first. */
    public List<Overlay.Entry> getOverlayEntries() {
        return Collections.unmodifiableList(overlayEntries);
    }

    /** Mutable access to the overlay entries for subclasses that populate them in {@link #install}. */
    protected List<Overlay.Entry> overlayEntries() {
        return overlayEntries;
    }

    /** Completes with the value given to {@link Navigator#pop(Object)}, when this route is popped. */
    public CompletableFuture<T> getPopped() {
        return popped;
    }

    /** The value to complete {@link #getPopped()} with when a pop doesn't supply one. */
    @Nullable
    public T getCurrentResult() {
        return null;
    }

    /** Whether calling {@link #didPop} would return false. */
    public boolean willHandlePopInternally() {
        return false;
    }

    /** Whether this route is the top-most route on the navigator. Implies {@link #isActive()}. */
    public boolean isCurrent() {
        return navigator != null && navigator.currentRoute() == this;
    }

    /** Whether this route is the bottom-most route on the navigator. */
    public boolean isFirst() {
        return navigator != null && navigator.firstRoute() == this;
    }

    /** Whether this route is in the navigator's history. False once popped, even before finalization. */
    public boolean isActive() {
        return navigator != null && navigator.containsRoute(this);
    }

    public boolean isDisposed() {
        return disposed;
    }

    /**
     * Called when the route is inserted into the navigator. Routes with visuals populate their overlay entries here
     * and insert them just above insertionPoint, which is null when nothing below has any entries. The route is
     * responsible for this, rather than the navigator, because it is also responsible for removing them.
     */
    public void install(@Nullable Overlay.Entry insertionPoint) {
    }

    /**
     * Called after {@link #install} when the route is pushed onto the navigator. The returned future is a completion
     * signal only: it resolves when the push transition is complete.
     */
    public CompletableFuture<Void> didPush() {
        return CompletableFuture.completedFuture(null);
    }

    /** Called after {@link #install} when the route replaced another one in the navigator. */
    public void didReplace(@Nullable Route<?> oldRoute) {
    }

    /**
     * Asked by {@link Navigator#maybePop(Object)} before popping. By default the first route bubbles, so that the
     * user isn't stranded at a blank screen, and every other route pops.
     */
    public CompletableFuture<PopDisposition> willPop() {
        return CompletableFuture.completedFuture(isFirst() ? PopDisposition.BUBBLE : PopDisposition.POP);
    }

    /**
     * A request was made to pop this route. If the route can handle it internally, for example because it has its
     * own stack of internal state, it returns false and stays where it is. Otherwise it returns true and the
     * navigator removes it from the history but does not dispose it yet: the route calls
     * {@link Navigator#finalizeRoute(Route)} once any exit effect has finished. That call may also be made directly
     * from inside this method when it is about to return true.
     */
    public boolean didPop(@Nullable T result) {
        didComplete(result);
        return true;
    }

    /** The given route, which came after this one, has been popped off the navigator. */
    public void didPopNext(Route<?> nextRoute) {
    }

    /**
     * This route's next route has changed. Called whenever the next route changes for any reason other than a pop
     * (see {@link #didPopNext}), so long as this route is in the history. Null means this route is now on top.
     */
    public void didChangeNext(@Nullable Route<?> nextRoute) {
    }

    /**
     * This route's previous route has changed, except right after this route was pushed or swapped in. Null means
     * this route is now at the bottom.
     */
    public void didChangePrevious(@Nullable Route<?> previousRoute) {
    }

    /** The route was popped or otherwise removed gracefully. Completes {@link #getPopped()}; callable once. */
    public void didComplete(@Nullable T result) {
        checkState(!popped.isDone(), "%s was already completed", this);
        popped.complete(result);
    }

    /**
     * Removes the route's overlay entries from the overlay and clears them, then detaches the route from its
     * navigator. Subclasses free any other resources they hold and call super. Callable once.
     */
    public void dispose() {
        checkState(!disposed, "%s was already disposed", this);
        for (Overlay.Entry entry : overlayEntries) {
            if (entry.getOverlay() != null)
                entry.remove();
        }
        overlayEntries.clear();
        disposed = true;
        navigator = null;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "@" + Integer.toHexString(System.identityHashCode(this));
    }

    /** The answer to {@link Route#willPop()}. */
    public enum PopDisposition {
        /** Pop the route. */
        POP,
        /** Do not pop the route: the back request is ignored. */
        DO_NOT_POP,
        /** Delegate to the next level of navigation, which will usually close the application. */
        BUBBLE
    }
}
