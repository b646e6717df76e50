package navstack.route;

import com.google.common.collect.*;
import navstack.*;
import navstack.overlay.*;

import javax.annotation.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;

import static com.google.common.base.Preconditions.*;

/**
 * A route that blocks interaction with the routes below it. It puts two entries into the overlay: a barrier that
 * swallows input to everything underneath (and may dismiss the route when tapped), and the page itself on top.
 *
 * Modal routes also carry a local history, so that for example a panel opened inside a dialog is closed by the back
 * button before the dialog is.
 */
public abstract class ModalRoute<T> extends TransitionRoute<T> {
    private final RouteSettings settings;
    private final LocalHistory localHistory = new LocalHistory(this, this::changedInternalState);

    protected ModalRoute(RouteSettings settings) {
        this.settings = checkNotNull(settings);
    }

    protected ModalRoute() {
        this(new RouteSettings(null, false));
    }

    /** The settings this route was created with. Gives the route's name, if any. */
    public RouteSettings getSettings() {
        return settings;
    }

    /** Whether tapping the barrier pops the route. */
    public abstract boolean isBarrierDismissible();

    /** Builds the layer that sits between the routes below and the page. */
    protected abstract Layer buildBarrier(LayerHost host);

    /** Builds the page content. */
    protected abstract Layer buildPage(LayerHost host);

    @Override
    protected Collection<Overlay.Entry> createOverlayEntries() {
        return ImmutableList.of(new Overlay.Entry(this::buildBarrier, false), new Overlay.Entry(this::buildPage, false));
    }

    /** The initial route of a navigator appears without an entrance. */
    @Override
    protected boolean skipsEnterTransition() {
        return settings.isInitialRoute();
    }

    /**
     * Called by the barrier layer when it is tapped. Pops the route with a null result if the barrier is dismissible
     * and the route is on top.
     *
     * @return whether the tap dismissed the route
     */
    public boolean handleBarrierTap() {
        Navigator navigator = getNavigator();
        if (!isBarrierDismissible() || !isCurrent() || navigator == null)
            return false;
        return navigator.pop(null);
    }

    //region Local history

    public void addLocalHistoryEntry(LocalHistoryEntry entry) {
        localHistory.add(entry);
    }

    public void removeLocalHistoryEntry(LocalHistoryEntry entry) {
        localHistory.remove(entry);
    }

    public LocalHistory getLocalHistory() {
        return localHistory;
    }

    /** The answer to willHandlePopInternally may have changed, so anything showing a back affordance must refresh. */
    protected void changedInternalState() {
        Navigator navigator = getNavigator();
        if (navigator != null)
            navigator.invalidate();
    }

    @Override
    public boolean willHandlePopInternally() {
        return !localHistory.isEmpty() || super.willHandlePopInternally();
    }

    @Override
    public CompletableFuture<PopDisposition> willPop() {
        if (!localHistory.isEmpty())
            return CompletableFuture.completedFuture(PopDisposition.POP);
        return super.willPop();
    }

    @Override
    public boolean didPop(@Nullable T result) {
        if (localHistory.pop())
            return false;
        return super.didPop(result);
    }

    //endregion

    @Override
    public void didChangePrevious(@Nullable Route<?> previousRoute) {
        super.didChangePrevious(previousRoute);
        // Whether a back affordance should show depends on what's below us.
        changedInternalState();
    }

    /** Returns a predicate that matches modal routes with the given name, for use with {@link Navigator#popUntil}. */
    public static Predicate<Route<?>> withName(String name) {
        checkNotNull(name);
        return route -> route instanceof ModalRoute && name.equals(((ModalRoute<?>) route).getSettings().getName());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + settings.getName() + ")";
    }
}
