package navstack;

import javax.annotation.*;

/**
 * Listens to the stack changes of a {@link Navigator}. Callbacks arrive synchronously on the navigator's thread, in
 * registration order, after the change has been fully applied.
 */
public abstract class NavigatorObserver {
    @Nullable private Navigator navigator;

    /** The navigator this observer is attached to, or null before the navigator's first attach. */
    @Nullable
    public Navigator getNavigator() {
        return navigator;
    }

    void setNavigator(@Nullable Navigator navigator) {
        this.navigator = navigator;
    }

    /** The navigator pushed route. previousRoute is the route that was on top before, if any. */
    public void didPush(Route<?> route, @Nullable Route<?> previousRoute) {
    }

    /** The navigator popped route. previousRoute is the route now on top. */
    public void didPop(Route<?> route, @Nullable Route<?> previousRoute) {
    }

    /** The navigator removed route without popping it. previousRoute is the route that was below it, if any. */
    public void didRemove(Route<?> route, @Nullable Route<?> previousRoute) {
    }
}
