package navstack.route;

import java.util.concurrent.*;

/**
 * An entrance or exit effect played by a {@link TransitionRoute}. Implementations wrap whatever animation system the
 * rendering side uses; the route only needs to know when it ends.
 */
public interface Transition {
    /**
     * Starts the transition. The returned future completes normally when it finishes, or is cancelled if
     * {@link #cancel()} stops it first. It may already be complete when returned.
     */
    CompletableFuture<Void> play();

    /** Stops the transition where it is. Does nothing if it is not running. */
    void cancel();

    /** A transition that finishes as soon as it is played. */
    Transition NONE = new Transition() {
        @Override
        public CompletableFuture<Void> play() {
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void cancel() {
        }

        @Override
        public String toString() {
            return "Transition.NONE";
        }
    };
}
