package navstack.route;

import navstack.*;

import java.util.*;

import static com.google.common.base.Preconditions.*;

/**
 * A stack of {@link LocalHistoryEntry} objects held by a route, letting it absorb back navigation before the route
 * itself is popped. Routes compose this rather than inherit it: their willPop, didPop and willHandlePopInternally
 * consult it first and fall back to their own behaviour when it is empty.
 */
public final class LocalHistory {
    private final Route<?> route;
    private final Runnable onChangedInternalState;
    private final List<LocalHistoryEntry> entries = new ArrayList<>();

    /**
     * @param onChangedInternalState run whenever the history goes from empty to non-empty or back, which is when the
     *                               route's answer to willHandlePopInternally changes
     */
    public LocalHistory(Route<?> route, Runnable onChangedInternalState) {
        this.route = checkNotNull(route);
        this.onChangedInternalState = checkNotNull(onChangedInternalState);
    }

    public Route<?> getRoute() {
        return route;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    /** Adds an entry, which must not already belong to a route. */
    public void add(LocalHistoryEntry entry) {
        checkArgument(entry.owner == null, "Local history entry already belongs to %s", entry.getOwner());
        entry.owner = this;
        boolean wasEmpty = entries.isEmpty();
        entries.add(entry);
        if (wasEmpty)
            onChangedInternalState.run();
    }

    /** Removes an entry of this history. Its removal callback runs synchronously. */
    public void remove(LocalHistoryEntry entry) {
        checkArgument(entry.owner == this, "Local history entry does not belong to %s", route);
        checkState(entries.remove(entry));
        entry.owner = null;
        entry.notifyRemoved();
        if (entries.isEmpty())
            onChangedInternalState.run();
    }

    /**
     * Removes the newest entry, running its callback.
     *
     * @return false if there was nothing to remove
     */
    public boolean pop() {
        if (entries.isEmpty())
            return false;
        LocalHistoryEntry entry = entries.remove(entries.size() - 1);
        checkState(entry.owner == this);
        entry.owner = null;
        entry.notifyRemoved();
        if (entries.isEmpty())
            onChangedInternalState.run();
        return true;
    }
}
