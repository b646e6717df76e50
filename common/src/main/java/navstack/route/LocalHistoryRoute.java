package navstack.route;

import navstack.*;

import javax.annotation.*;
import java.util.concurrent.*;

/**
 * A route that can handle back navigation internally by popping a list. When asked to pop while it has local history
 * entries, the newest one is removed and its callback runs; the route stays on the navigator. Use this for things
 * like a search field or an expanded panel that the back button should close first.
 */
public abstract class LocalHistoryRoute<T> extends Route<T> {
    private final LocalHistory localHistory = new LocalHistory(this, this::changedInternalState);

    /**
     * Adds a local history entry, which must not already be part of another route's local history. The next pop will
     * remove it rather than the route.
     */
    public void addLocalHistoryEntry(LocalHistoryEntry entry) {
        localHistory.add(entry);
    }

    /** Removes a local history entry of this route. The entry's callback is called synchronously. */
    public void removeLocalHistoryEntry(LocalHistoryEntry entry) {
        localHistory.remove(entry);
    }

    public LocalHistory getLocalHistory() {
        return localHistory;
    }

    /**
     * Called whenever {@link #willHandlePopInternally()} and {@link #didPop} might have started returning something
     * different.
     */
    protected void changedInternalState() {
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
}
