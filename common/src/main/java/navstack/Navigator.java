package navstack;

import com.google.common.collect.*;
import navstack.overlay.*;
import navstack.threading.*;
import net.jcip.annotations.*;
import org.slf4j.*;

import javax.annotation.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;

import static com.google.common.base.Preconditions.*;
import static navstack.utils.NavUtils.*;

/**
 * Manages a set of routes with a stack discipline.
 *
 * A navigator owns one {@link Overlay} and displays its logical history in it, the most recently visited routes
 * visually on top of the older ones. Routes are pushed with {@link #push(Route)} and popped with {@link #pop(Object)};
 * the future returned by push completes with the value the route is eventually popped with, which is how a screen
 * returns a result to whoever opened it.
 *
 * Routes can also be generated by name: {@link #pushNamed(String)} passes a {@link RouteSettings} to the route
 * generator, falling back to the unknown route handler when the generator doesn't know the name. On the first
 * {@link #attach()} the navigator pushes its initial route. An initial route containing slashes is treated as a deep
 * link: "/stocks/HOOLI" pushes "/", "/stocks" and "/stocks/HOOLI" in turn, so the user can still go back up.
 *
 * All operations must be called on the navigator's {@link AffinityExecutor}. Stack mutations are synchronous; the
 * futures handed out are points where callers may choose to wait, the navigator itself never blocks.
 */
@NotThreadSafe
public class Navigator {
    private static final Logger log = LoggerFactory.getLogger(Navigator.class);

    /** The name of the route shown when no initial route is given. */
    public static final String DEFAULT_ROUTE_NAME = "/";

    private final Overlay overlay;
    private final RouteFactory onGenerateRoute;
    private final RouteFactory onUnknownRoute;
    private final AffinityExecutor executor;

    // Index 0 is the bottom of the stack, the last element is the current route.
    private final List<Route<?>> history = new ArrayList<>();
    private final List<NavigatorObserver> observers = new ArrayList<>();
    private final Set<Route<?>> poppedRoutes = new LinkedHashSet<>();
    private final List<Runnable> invalidationListeners = new ArrayList<>();

    @Nullable private String initialRoute;
    private boolean attached;

    public Navigator(LayerHost host, RouteFactory onGenerateRoute, RouteFactory onUnknownRoute) {
        this(host, onGenerateRoute, onUnknownRoute, AffinityExecutor.SAME_THREAD);
    }

    public Navigator(LayerHost host, RouteFactory onGenerateRoute, RouteFactory onUnknownRoute,
                     AffinityExecutor executor) {
        this.overlay = new Overlay(host);
        this.onGenerateRoute = checkNotNull(onGenerateRoute);
        this.onUnknownRoute = checkNotNull(onUnknownRoute);
        this.executor = checkNotNull(executor);
    }

    //region Configuration and bootstrap

    /** The name of the first route to show, {@link #DEFAULT_ROUTE_NAME} if never set. Only read by attach. */
    @Nullable
    public String getInitialRoute() {
        return initialRoute;
    }

    public void setInitialRoute(@Nullable String initialRoute) {
        checkState(!attached, "The initial route must be set before the navigator is attached");
        this.initialRoute = initialRoute;
    }

    public boolean isAttached() {
        return attached;
    }

    /**
     * Called when the navigator's overlay is realized for the first time: hands the registered observers their
     * navigator, pushes the initial route(s) and attaches the overlay. Later calls do nothing.
     */
    public void attach() {
        executor.checkOnThread();
        if (attached)
            return;
        attached = true;
        for (NavigatorObserver observer : observers) {
            checkState(observer.getNavigator() == null, "Observer %s already belongs to a navigator", observer);
            observer.setNavigator(this);
        }
        String initialRouteName = initialRoute != null ? initialRoute : DEFAULT_ROUTE_NAME;
        log.info("Attaching navigator, initial route is {}", initialRouteName);
        for (Route<?> route : planInitialRoutes(initialRouteName))
            push(route);
        overlay.attach();
    }

    private List<Route<?>> planInitialRoutes(String initialRouteName) {
        if (initialRouteName.startsWith(DEFAULT_ROUTE_NAME) && initialRouteName.length() > 1) {
            List<Route<?>> planned = new ArrayList<>();
            List<String> missing = new ArrayList<>();
            List<String> names = new ArrayList<>();
            names.add(DEFAULT_ROUTE_NAME);
            names.addAll(cumulativeRouteNames(initialRouteName));
            for (String name : names) {
                Route<?> route = generateRoute(name);
                if (route == null)
                    missing.add(name);
                else
                    planned.add(route);
            }
            if (missing.isEmpty())
                return planned;
            log.warn("Could not navigate to initial route {}: no routes for {}. Starting at {} instead.",
                    initialRouteName, missing, DEFAULT_ROUTE_NAME);
            return ImmutableList.of(routeNamed(DEFAULT_ROUTE_NAME));
        }
        Route<?> route = null;
        if (!initialRouteName.equals(DEFAULT_ROUTE_NAME))
            route = generateRoute(initialRouteName);
        if (route == null)
            route = routeNamed(DEFAULT_ROUTE_NAME);
        return ImmutableList.of(route);
    }

    //endregion

    //region Stack operations

    /**
     * Adds the given route to the history and transitions to it. The new route and the previous one are notified,
     * then the observers.
     *
     * @return a future that completes with the result the route is popped with
     */
    public <T> CompletableFuture<T> push(Route<T> route) {
        executor.checkOnThread();
        checkArgument(route.getNavigator() == null, "%s already belongs to a navigator", route);
        checkArgument(!route.isDisposed(), "%s was disposed and cannot be pushed again", route);
        Route<?> oldRoute = currentRoute();
        installRoute(route, currentOverlayEntry());
        history.add(route);
        route.didPush();
        route.didChangeNext(null);
        if (oldRoute != null)
            oldRoute.didChangeNext(route);
        for (NavigatorObserver observer : ImmutableList.copyOf(observers))
            observer.didPush(route, oldRoute);
        return route.getPopped();
    }

    /** Generates the route with the given name and pushes it. */
    @SuppressWarnings("unchecked")
    public <T> CompletableFuture<T> pushNamed(String name) {
        return push((Route<T>) routeNamed(name));
    }

    /**
     * Replaces a route that is not necessarily visible with a new one, in the same position in the history. The new
     * route and its neighbours are notified; observers are not. The old route is disposed.
     */
    public void replace(Route<?> oldRoute, Route<?> newRoute) {
        executor.checkOnThread();
        if (oldRoute == newRoute)
            return;
        checkArgument(oldRoute.getNavigator() == this, "%s is not in this navigator", oldRoute);
        checkArgument(newRoute.getNavigator() == null, "%s already belongs to a navigator", newRoute);
        checkArgument(!oldRoute.getOverlayEntries().isEmpty(), "%s has no overlay entries to replace", oldRoute);
        checkArgument(newRoute.getOverlayEntries().isEmpty(), "%s is already installed", newRoute);
        int index = history.indexOf(oldRoute);
        checkArgument(index >= 0, "%s is not in the history", oldRoute);
        installRoute(newRoute, Iterables.getLast(oldRoute.getOverlayEntries()));
        history.set(index, newRoute);
        newRoute.didReplace(oldRoute);
        if (index + 1 < history.size()) {
            Route<?> next = history.get(index + 1);
            newRoute.didChangeNext(next);
            next.didChangePrevious(newRoute);
        } else {
            newRoute.didChangeNext(null);
        }
        if (index > 0)
            history.get(index - 1).didChangeNext(newRoute);
        oldRoute.dispose();
    }

    /**
     * Pushes newRoute in place of the current route. The old route is completed with result (or its own current
     * result) and disposed only once the new route's push transition has finished. Observers see a push.
     */
    public <T> CompletableFuture<T> pushReplacement(Route<T> newRoute, @Nullable Object result) {
        executor.checkOnThread();
        checkState(!history.isEmpty(), "There is no current route to replace");
        Route<?> oldRoute = Iterables.getLast(history);
        checkState(oldRoute.getNavigator() == this, "%s is not in this navigator", oldRoute);
        checkState(!oldRoute.getOverlayEntries().isEmpty(), "%s has no overlay entries to replace", oldRoute);
        checkArgument(newRoute.getNavigator() == null, "%s already belongs to a navigator", newRoute);
        checkArgument(newRoute.getOverlayEntries().isEmpty(), "%s is already installed", newRoute);
        int index = history.size() - 1;
        installRoute(newRoute, currentOverlayEntry());
        history.set(index, newRoute);
        newRoute.didPush().whenComplete((ignored, error) -> ignoreAndLog(() -> {
            completeRoute(oldRoute, result);
            oldRoute.dispose();
        }));
        newRoute.didChangeNext(null);
        if (index > 0)
            history.get(index - 1).didChangeNext(newRoute);
        for (NavigatorObserver observer : ImmutableList.copyOf(observers))
            observer.didPush(newRoute, oldRoute);
        return newRoute.getPopped();
    }

    public <T> CompletableFuture<T> pushReplacement(Route<T> newRoute) {
        return pushReplacement(newRoute, null);
    }

    /** Generates the route with the given name and pushes it in place of the current route. */
    @SuppressWarnings("unchecked")
    public <T> CompletableFuture<T> pushReplacementNamed(String name, @Nullable Object result) {
        return pushReplacement((Route<T>) routeNamed(name), result);
    }

    /** Replaces the route just below anchorRoute, which must not be the first route. Otherwise acts like replace. */
    public void replaceRouteBelow(Route<?> anchorRoute, Route<?> newRoute) {
        executor.checkOnThread();
        checkArgument(anchorRoute.getNavigator() == this, "%s is not in this navigator", anchorRoute);
        int anchorIndex = history.indexOf(anchorRoute);
        checkArgument(anchorIndex > 0, "There is no route below %s", anchorRoute);
        replace(history.get(anchorIndex - 1), newRoute);
    }

    /**
     * Removes the route just below anchorRoute. That route must already be visually finished, meaning it has no
     * overlay entries left. Its neighbours are notified and it is disposed; observers are not notified.
     */
    public void removeRouteBelow(Route<?> anchorRoute) {
        executor.checkOnThread();
        checkArgument(anchorRoute.getNavigator() == this, "%s is not in this navigator", anchorRoute);
        int index = history.indexOf(anchorRoute) - 1;
        checkArgument(index >= 0, "There is no route below %s", anchorRoute);
        Route<?> targetRoute = history.get(index);
        checkState(targetRoute.getNavigator() == this, "%s is not in this navigator", targetRoute);
        checkState(targetRoute.getOverlayEntries().isEmpty(), "%s still has live overlay entries", targetRoute);
        history.remove(index);
        Route<?> nextRoute = routeAt(index);
        Route<?> previousRoute = routeAt(index - 1);
        if (previousRoute != null)
            previousRoute.didChangeNext(nextRoute);
        if (nextRoute != null)
            nextRoute.didChangePrevious(previousRoute);
        targetRoute.dispose();
    }

    /**
     * Removes routes from the top until predicate matches the current route, then pushes newRoute. Removal is
     * forced: routes get no say in it. The removed routes are disposed once newRoute's push transition has finished.
     * To remove every route below the new one, pass a predicate that always returns false.
     */
    public <T> CompletableFuture<T> pushAndRemoveUntil(Route<T> newRoute, Predicate<Route<?>> predicate) {
        executor.checkOnThread();
        checkArgument(newRoute.getNavigator() == null, "%s already belongs to a navigator", newRoute);
        checkArgument(newRoute.getOverlayEntries().isEmpty(), "%s is already installed", newRoute);
        int keep = history.size();
        while (keep > 0 && !predicate.test(history.get(keep - 1))) {
            Route<?> doomed = history.get(keep - 1);
            checkState(doomed.getNavigator() == this, "%s is not in this navigator", doomed);
            checkState(!doomed.getOverlayEntries().isEmpty(), "%s is already being removed", doomed);
            keep--;
        }
        List<Route<?>> removedRoutes = new ArrayList<>();
        while (history.size() > keep)
            removedRoutes.add(history.remove(history.size() - 1));
        Route<?> oldRoute = currentRoute();
        try {
            installRoute(newRoute, currentOverlayEntry());
        } catch (RuntimeException e) {
            history.addAll(Lists.reverse(removedRoutes));
            throw e;
        }
        history.add(newRoute);
        newRoute.didPush().whenComplete((ignored, error) -> {
            for (Route<?> route : removedRoutes)
                ignoreAndLog(route::dispose);
        });
        newRoute.didChangeNext(null);
        if (oldRoute != null)
            oldRoute.didChangeNext(newRoute);
        for (NavigatorObserver observer : ImmutableList.copyOf(observers))
            observer.didPush(newRoute, oldRoute);
        return newRoute.getPopped();
    }

    /** Generates the route with the given name, then acts like {@link #pushAndRemoveUntil}. */
    @SuppressWarnings("unchecked")
    public <T> CompletableFuture<T> pushNamedAndRemoveUntil(String name, Predicate<Route<?>> predicate) {
        return pushAndRemoveUntil((Route<T>) routeNamed(name), predicate);
    }

    /**
     * Tries to pop the current route, first giving it the chance to veto with {@link Route#willPop()}. This is what a
     * back button should call.
     *
     * @return a future that is false if the request should bubble to the enclosing system (usually meaning the app
     * should close), or true if it was dealt with here, whether by popping or by ignoring it
     */
    public CompletableFuture<Boolean> maybePop(@Nullable Object result) {
        executor.checkOnThread();
        Route<?> route = checkNotNull(currentRoute(), "Cannot pop an empty navigator");
        return route.willPop().thenApplyAsync(disposition -> {
            if (disposition == Route.PopDisposition.BUBBLE)
                return false;
            if (disposition == Route.PopDisposition.POP)
                pop(result);
            return true;
        }, executor.asap());
    }

    public CompletableFuture<Boolean> maybePop() {
        return maybePop(null);
    }

    /**
     * Pops the current route off the history. If result is null the route's current result is used instead.
     *
     * If the route handles the pop internally (see {@link Route#willHandlePopInternally()}) the history is left alone
     * and this returns true. Otherwise the route is removed, the new current route gets {@link Route#didPopNext} and
     * the observers are notified. The popped route keeps its navigator until it is finalized.
     *
     * @return false if the current route is the only one and cannot be popped, true otherwise
     */
    public boolean pop(@Nullable Object result) {
        executor.checkOnThread();
        checkState(!history.isEmpty(), "Cannot pop an empty navigator");
        Route<?> route = Iterables.getLast(history);
        checkState(route.getNavigator() == this, "%s is not in this navigator", route);
        if (history.size() == 1 && !route.willHandlePopInternally())
            return false;
        if (!popRoute(route, result))
            return true;
        if (history.size() == 1)
            return false;
        history.remove(history.size() - 1);
        // The route may already have finalized itself from inside didPop.
        if (route.getNavigator() != null)
            poppedRoutes.add(route);
        Route<?> newCurrent = Iterables.getLast(history);
        newCurrent.didPopNext(route);
        for (NavigatorObserver observer : ImmutableList.copyOf(observers))
            observer.didPop(route, newCurrent);
        return true;
    }

    public boolean pop() {
        return pop(null);
    }

    /** Pops the current route and then pushes the route with the given name. */
    public <T> CompletableFuture<T> popAndPushNamed(String name, @Nullable Object result) {
        pop(result);
        return pushNamed(name);
    }

    /**
     * Immediately removes route from anywhere in the history and disposes it. No transition runs and the route's
     * popped future never completes. Observers get {@link NavigatorObserver#didRemove}.
     */
    public void removeRoute(Route<?> route) {
        executor.checkOnThread();
        checkArgument(route.getNavigator() == this, "%s is not in this navigator", route);
        int index = history.indexOf(route);
        checkArgument(index >= 0, "%s is not in the history", route);
        Route<?> previousRoute = routeAt(index - 1);
        Route<?> nextRoute = routeAt(index + 1);
        history.remove(index);
        if (previousRoute != null)
            previousRoute.didChangeNext(nextRoute);
        if (nextRoute != null)
            nextRoute.didChangePrevious(previousRoute);
        for (NavigatorObserver observer : ImmutableList.copyOf(observers))
            observer.didRemove(route, previousRoute);
        route.dispose();
    }

    /**
     * Completes the lifecycle of a route that has been popped: the route calls this once its exit effect is over,
     * and gets disposed. It may also be called from inside {@link Route#didPop} when that is about to return true.
     * Calling it for a route that has not been popped, or twice, is a programming error.
     */
    public void finalizeRoute(Route<?> route) {
        executor.checkOnThread();
        checkArgument(route.getNavigator() == this, "%s is not in this navigator", route);
        poppedRoutes.remove(route);
        route.dispose();
    }

    /**
     * Calls {@link #pop()} until predicate matches the current route. Popping is not negotiated: willPop is not
     * consulted. The predicate may see the same route more than once when that route handles pops internally.
     *
     * @throws Ex.PopUntilExhausted if the first route is reached, cannot be popped, and still doesn't match. The
     * routes popped until then stay popped.
     */
    public void popUntil(Predicate<Route<?>> predicate) {
        executor.checkOnThread();
        while (!predicate.test(currentRoute())) {
            Route<?> current = checkNotNull(currentRoute(), "Cannot pop an empty navigator");
            if (!pop())
                throw new Ex.PopUntilExhausted(current);
        }
    }

    /**
     * Whether this navigator can be popped: true when there is more than one route, or when the only route handles
     * pops internally.
     */
    public boolean canPop() {
        checkState(!history.isEmpty(), "canPop called on an empty navigator");
        return history.size() > 1 || history.get(0).willHandlePopInternally();
    }

    /**
     * Disposes every route, popped or not, top first. Used when the navigator itself is torn down; it must not be
     * used afterwards.
     */
    public void dispose() {
        executor.checkOnThread();
        List<Route<?>> routes = new ArrayList<>(Lists.reverse(history));
        routes.addAll(poppedRoutes);
        history.clear();
        poppedRoutes.clear();
        for (Route<?> route : routes)
            ignoreAndLog(route::dispose);
        for (NavigatorObserver observer : observers)
            observer.setNavigator(null);
    }

    //endregion

    //region Observers and invalidation

    /** Adds an observer. Observers registered before {@link #attach()} also see the initial pushes. */
    public void addObserver(NavigatorObserver observer) {
        executor.checkOnThread();
        checkArgument(observer.getNavigator() == null || observer.getNavigator() == this,
                "Observer %s already belongs to another navigator", observer);
        if (attached)
            observer.setNavigator(this);
        observers.add(observer);
    }

    public boolean removeObserver(NavigatorObserver observer) {
        executor.checkOnThread();
        boolean removed = observers.remove(observer);
        if (removed)
            observer.setNavigator(null);
        return removed;
    }

    public void clearObservers() {
        executor.checkOnThread();
        for (NavigatorObserver observer : observers)
            observer.setNavigator(null);
        observers.clear();
    }

    /** Registers a callback run whenever a route asks for the navigator to be redrawn. */
    public void addInvalidationListener(Runnable listener) {
        invalidationListeners.add(checkNotNull(listener));
    }

    public boolean removeInvalidationListener(Runnable listener) {
        return invalidationListeners.remove(listener);
    }

    /** Asks the rendering side to redraw, for instance because a route's internal state changed. */
    public void invalidate() {
        for (Runnable listener : ImmutableList.copyOf(invalidationListeners))
            listener.run();
    }

    //endregion

    //region Accessors

    public Overlay getOverlay() {
        return overlay;
    }

    public AffinityExecutor getExecutor() {
        return executor;
    }

    /** A read-only live view of the history, bottom first. */
    public List<Route<?>> getHistory() {
        return Collections.unmodifiableList(history);
    }

    /** Routes that were popped but have not been finalized yet. */
    public Set<Route<?>> getPoppedRoutes() {
        return Collections.unmodifiableSet(poppedRoutes);
    }

    @Nullable
    public Route<?> currentRoute() {
        return history.isEmpty() ? null : Iterables.getLast(history);
    }

    @Nullable
    Route<?> firstRoute() {
        return history.isEmpty() ? null : history.get(0);
    }

    boolean containsRoute(Route<?> route) {
        return history.contains(route);
    }

    //endregion

    //region Name resolution

    /**
     * Generates the route with the given name, falling back to the unknown route handler.
     *
     * @throws Ex.UnknownRouteNotHandled if the unknown route handler returns null
     */
    public Route<?> routeNamed(String name) {
        Route<?> route = generateRoute(name);
        if (route != null)
            return route;
        log.info("No route generated for {}, asking the unknown route handler", name);
        route = onUnknownRoute.create(new RouteSettings(name, history.isEmpty()));
        if (route == null)
            throw new Ex.UnknownRouteNotHandled(name, this);
        return route;
    }

    @Nullable
    private Route<?> generateRoute(String name) {
        return onGenerateRoute.create(new RouteSettings(name, history.isEmpty()));
    }

    //endregion

    @Nullable
    private Route<?> routeAt(int index) {
        return index >= 0 && index < history.size() ? history.get(index) : null;
    }

    // The last entry of the top-most route that has any.
    @Nullable
    private Overlay.Entry currentOverlayEntry() {
        for (Route<?> route : Lists.reverse(history)) {
            if (!route.getOverlayEntries().isEmpty())
                return Iterables.getLast(route.getOverlayEntries());
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private static <T> boolean popRoute(Route<T> route, @Nullable Object result) {
        T resolved = result != null ? (T) result : route.getCurrentResult();
        return route.didPop(resolved);
    }

    // A route whose install fails is left without a navigator, as if it had never been offered.
    private void installRoute(Route<?> route, @Nullable Overlay.Entry insertionPoint) {
        route.setNavigator(this);
        try {
            route.install(insertionPoint);
        } catch (RuntimeException e) {
            route.setNavigator(null);
            throw e;
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> void completeRoute(Route<T> route, @Nullable Object result) {
        route.didComplete(result != null ? (T) result : route.getCurrentResult());
    }

    @Override
    public String toString() {
        return "Navigator{routes=" + history.size() + ", popped=" + poppedRoutes.size() + ", attached=" + attached + "}";
    }
}
