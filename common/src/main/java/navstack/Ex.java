package navstack;

// Gather all exception definitions in one file, for convenience. Plain precondition violations are reported with
// the usual IllegalArgumentException/IllegalStateException instead.
public class Ex extends RuntimeException {
    public Ex() {
    }

    public Ex(String message) {
        super(message);
    }

    /** The unknown route handler returned null, which means the host app misconfigured its fallback. */
    public static class UnknownRouteNotHandled extends Ex {
        public final String routeName;
        public final Navigator navigator;

        public UnknownRouteNotHandled(String routeName, Navigator navigator) {
            super("Navigator.onUnknownRoute returned null when requested to build route \"" + routeName +
                    "\". The unknown route handler must never return null. Navigator: " + navigator);
            this.routeName = routeName;
            this.navigator = navigator;
        }
    }

    /** popUntil reached a route it could not pop before its predicate matched. */
    public static class PopUntilExhausted extends Ex {
        public final Route<?> stuckAt;

        public PopUntilExhausted(Route<?> stuckAt) {
            super("popUntil could not pop " + stuckAt + " and the predicate never matched");
            this.stuckAt = stuckAt;
        }
    }
}
