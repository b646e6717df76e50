package navstack.overlay;

import com.google.common.collect.*;
import net.jcip.annotations.*;
import org.slf4j.*;

import javax.annotation.*;
import java.util.*;

import static com.google.common.base.Preconditions.*;

/**
 * An ordered stack of entries that can be managed independently.
 *
 * Overlays let independent parts of the app "float" visual layers on top of each other by inserting them as
 * {@link Entry} objects. Each entry owns one realized {@link Layer} in the {@link LayerHost}. Visibility is derived:
 * scanning from the top, every layer down to and including the first opaque entry is visible, everything below that
 * is gone (kept attached, but not drawn).
 *
 * Although you can use an overlay directly, it's most common to use the one owned by a navigator, which manages the
 * visual appearance of its routes this way.
 */
@NotThreadSafe
public class Overlay {
    private static final Logger log = LoggerFactory.getLogger(Overlay.class);

    private final LayerHost host;
    private final List<Entry> entries = new ArrayList<>();
    private final ImmutableList<Entry> initialEntries;
    private boolean attached;

    public Overlay(LayerHost host) {
        this(host, ImmutableList.of());
    }

    /** The initial entries are inserted the first time {@link #attach()} is called. */
    public Overlay(LayerHost host, Collection<Entry> initialEntries) {
        this.host = checkNotNull(host);
        this.initialEntries = ImmutableList.copyOf(initialEntries);
    }

    /** Signals that the overlay has been realized for the first time. Later calls do nothing. */
    public void attach() {
        if (attached)
            return;
        attached = true;
        insertAll(initialEntries);
    }

    public boolean isAttached() {
        return attached;
    }

    public LayerHost getHost() {
        return host;
    }

    /** Inserts the given entry on top of the overlay. */
    public void insert(Entry entry) {
        insert(entry, null);
    }

    /**
     * Inserts the given entry into the overlay. If above is non-null the entry is inserted just above it, otherwise
     * it goes on top.
     */
    public void insert(Entry entry, @Nullable Entry above) {
        checkArgument(entry.overlay == null, "Entry is already in an overlay");
        int index = insertionIndex(above);
        entry.overlay = this;
        entries.add(index, entry);
        realize(entry, index);
        updateVisibility();
    }

    /** Inserts all the given entries on top of the overlay, in order. */
    public void insertAll(Collection<Entry> newEntries) {
        insertAll(newEntries, null);
    }

    /**
     * Inserts all the given entries, keeping their order. If above is non-null they go just above it, otherwise on
     * top. Visibility is recomputed once, after the last entry has been realized.
     */
    public void insertAll(Collection<Entry> newEntries, @Nullable Entry above) {
        int index = insertionIndex(above);
        Set<Entry> seen = Sets.newIdentityHashSet();
        for (Entry entry : newEntries) {
            checkArgument(entry.overlay == null, "Entry is already in an overlay");
            checkArgument(seen.add(entry), "Entry appears twice in the same batch");
        }
        if (newEntries.isEmpty())
            return;
        int i = index;
        for (Entry entry : newEntries) {
            entry.overlay = this;
            entries.add(i, entry);
            realize(entry, i);
            i++;
        }
        log.debug("Inserted {} entries at {}, overlay now has {}", newEntries.size(), index, entries.size());
        updateVisibility();
    }

    /** Returns a snapshot of the entries, bottom first. */
    public List<Entry> getEntries() {
        return ImmutableList.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    private int insertionIndex(@Nullable Entry above) {
        if (above == null)
            return entries.size();
        int index = indexOf(above);
        checkArgument(above.overlay == this && index >= 0, "Entry to insert above is not in this overlay");
        return index + 1;
    }

    private int indexOf(Entry entry) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i) == entry)
                return i;
        }
        return -1;
    }

    private void realize(Entry entry, int index) {
        Layer layer = checkNotNull(entry.builder.build(host), "Layer builder returned null");
        entry.layer = layer;
        host.addLayer(layer, index);
    }

    private void remove(Entry entry) {
        int index = indexOf(entry);
        checkState(index >= 0, "Entry is not in this overlay");
        entries.remove(index);
        host.removeLayer(entry.layer, index);
        entry.layer = null;
        updateVisibility();
    }

    private void updateVisibility() {
        boolean onstage = true;
        for (Entry entry : Lists.reverse(entries)) {
            entry.layer.setVisibility(onstage ? Visibility.VISIBLE : Visibility.GONE);
            if (entry.opaque)
                onstage = false;
        }
    }

    /**
     * A place in an {@link Overlay} that can contain a layer. An entry can be in at most one overlay at a time. To
     * remove an entry from its overlay, call {@link #remove()} on the entry.
     */
    public static class Entry {
        private final LayerBuilder builder;
        private boolean opaque;
        @Nullable private Overlay overlay;
        @Nullable private Layer layer;

        public Entry(LayerBuilder builder, boolean opaque) {
            this.builder = checkNotNull(builder);
            this.opaque = opaque;
        }

        /** Whether this entry occludes the entire overlay. */
        public boolean isOpaque() {
            return opaque;
        }

        /** Changes the opacity, recomputing the owning overlay's visibility. The entry must be in an overlay. */
        public void setOpaque(boolean opaque) {
            if (this.opaque == opaque)
                return;
            checkState(overlay != null, "Entry is not in an overlay");
            this.opaque = opaque;
            overlay.updateVisibility();
        }

        @Nullable
        public Overlay getOverlay() {
            return overlay;
        }

        /** The realized layer, or null while the entry is not in an overlay. */
        @Nullable
        public Layer getLayer() {
            return layer;
        }

        /** Removes this entry from its overlay. Must only be called once per insertion. */
        public void remove() {
            checkState(overlay != null, "Entry is not in an overlay");
            Overlay owner = overlay;
            overlay = null;
            owner.remove(this);
        }

        @Override
        public String toString() {
            return "Entry{opaque=" + opaque + ", inOverlay=" + (overlay != null) + "}";
        }
    }
}
