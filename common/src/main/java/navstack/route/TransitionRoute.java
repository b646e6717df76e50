package navstack.route;

import navstack.*;
import navstack.overlay.*;
import org.slf4j.*;

import javax.annotation.*;
import java.util.*;
import java.util.concurrent.*;

/**
 * A route with entrance and exit transitions.
 *
 * While either transition runs the route's bottom entry is kept non-opaque, so whatever is below stays visible. When
 * the entrance finishes the bottom entry takes on {@link #isOpaque()}, letting the overlay hide the routes underneath.
 * When the route is popped the entrance is cancelled and the exit plays; once it is over (finished or cancelled) the
 * route asks the navigator to finalize it, which removes its entries and completes {@link #getCompleted()}.
 */
public abstract class TransitionRoute<T> extends OverlayRoute<T> {
    private static final Logger log = LoggerFactory.getLogger(TransitionRoute.class);

    private final CompletableFuture<T> completed = new CompletableFuture<>();
    @Nullable private T result;
    @Nullable private Transition enterTransition;
    @Nullable private Transition exitTransition;

    /** Whether the route obscures the routes below it once its entrance transition is complete. */
    public abstract boolean isOpaque();

    protected Transition createEnterTransition() {
        return Transition.NONE;
    }

    protected Transition createExitTransition() {
        return Transition.NONE;
    }

    /** Whether to go straight to the entered state without playing the entrance. */
    protected boolean skipsEnterTransition() {
        return false;
    }

    /** Whether this route can perform a transition to the given route. Narrow this to restrict coordination. */
    public boolean canTransitionTo(TransitionRoute<?> nextRoute) {
        return true;
    }

    /** Whether this route can perform a transition from the given route. Narrow this to restrict coordination. */
    public boolean canTransitionFrom(TransitionRoute<?> previousRoute) {
        return true;
    }

    /**
     * Completes once the exit transition is over and the overlay entries have been removed, which is always at or
     * after the moment {@link #getPopped()} completes. A route that is disposed without ever completing its popped
     * future (removed, replaced, or torn down with the navigator) never completes this one either.
     */
    public CompletableFuture<T> getCompleted() {
        return completed;
    }

    @Override
    protected boolean isFinishedWhenPopped() {
        return false;
    }

    @Override
    public CompletableFuture<Void> didPush() {
        return playEnterTransition(routeBelow());
    }

    @Override
    public void didReplace(@Nullable Route<?> oldRoute) {
        playEnterTransition(oldRoute);
        super.didReplace(oldRoute);
    }

    @Override
    public boolean didPop(@Nullable T result) {
        Transition enter = enterTransition;
        enterTransition = null;
        if (enter != null)
            enter.cancel();
        boolean popped = super.didPop(result);
        if (popped)
            playExitTransition();
        return popped;
    }

    @Override
    public void didComplete(@Nullable T result) {
        this.result = result;
        super.didComplete(result);
    }

    @Override
    public void dispose() {
        Transition enter = enterTransition, exit = exitTransition;
        enterTransition = null;
        exitTransition = null;
        super.dispose();
        if (enter != null)
            enter.cancel();
        if (exit != null)
            exit.cancel();
        if (getPopped().isDone())
            completed.complete(result);
    }

    private CompletableFuture<Void> playEnterTransition(@Nullable Route<?> from) {
        Transition transition = chooseEnterTransition(from);
        enterTransition = transition;
        setBottomEntryOpaque(false);
        CompletableFuture<Void> entered = new CompletableFuture<>();
        transition.play().whenComplete((ignored, error) -> {
            if (error == null && enterTransition == transition) {
                enterTransition = null;
                setBottomEntryOpaque(isOpaque());
            }
            entered.complete(null);
        });
        return entered;
    }

    private Transition chooseEnterTransition(@Nullable Route<?> from) {
        if (skipsEnterTransition())
            return Transition.NONE;
        if (from instanceof TransitionRoute) {
            TransitionRoute<?> previous = (TransitionRoute<?>) from;
            if (!previous.canTransitionTo(this) || !canTransitionFrom(previous)) {
                log.debug("{} cannot transition from {}, skipping entrance", this, previous);
                return Transition.NONE;
            }
        }
        return createEnterTransition();
    }

    private void playExitTransition() {
        Transition transition = createExitTransition();
        exitTransition = transition;
        setBottomEntryOpaque(false);
        transition.play().whenComplete((ignored, error) -> {
            // A null navigator means we were disposed some other way while exiting.
            Navigator navigator = getNavigator();
            if (navigator != null)
                navigator.finalizeRoute(this);
        });
    }

    private void setBottomEntryOpaque(boolean opaque) {
        List<Overlay.Entry> entries = getOverlayEntries();
        if (!entries.isEmpty() && entries.get(0).getOverlay() != null)
            entries.get(0).setOpaque(opaque);
    }

    @Nullable
    private Route<?> routeBelow() {
        Navigator navigator = getNavigator();
        if (navigator == null)
            return null;
        List<Route<?>> history = navigator.getHistory();
        int index = history.indexOf(this);
        return index > 0 ? history.get(index - 1) : null;
    }
}
