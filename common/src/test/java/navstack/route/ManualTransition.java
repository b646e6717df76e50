package navstack.route;

import java.util.concurrent.CompletableFuture;

/** A transition that only ends when the test says so. */
public class ManualTransition implements Transition {
    private CompletableFuture<Void> future;
    public int plays;
    public boolean cancelled;

    @Override
    public CompletableFuture<Void> play() {
        plays++;
        future = new CompletableFuture<>();
        return future;
    }

    @Override
    public void cancel() {
        if (future != null && !future.isDone()) {
            cancelled = true;
            future.cancel(false);
        }
    }

    public boolean isRunning() {
        return future != null && !future.isDone();
    }

    public void finish() {
        future.complete(null);
    }
}
