package navstack.route;

import navstack.*;

import javax.annotation.*;

import static com.google.common.base.Preconditions.*;

/**
 * An entry in the local history of a route. When the route is asked to pop while it holds entries, the newest entry
 * is removed instead and its removal callback runs.
 */
public class LocalHistoryEntry {
    @Nullable private final Runnable onRemove;
    @Nullable LocalHistory owner;

    public LocalHistoryEntry(@Nullable Runnable onRemove) {
        this.onRemove = onRemove;
    }

    /** The route holding this entry, if any. */
    @Nullable
    public Route<?> getOwner() {
        return owner == null ? null : owner.getRoute();
    }

    /** Removes this entry from the local history of its route. Does nothing if it isn't in one. */
    public void remove() {
        if (owner != null)
            owner.remove(this);
        checkState(owner == null);
    }

    void notifyRemoved() {
        if (onRemove != null)
            onRemove.run();
    }
}
