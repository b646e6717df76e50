package navstack.overlay;

/**
 * The rendering surface behind an {@link Overlay}. Child order in the host always equals entry order in the overlay,
 * index 0 being the bottom.
 */
public interface LayerHost {
    /** Attaches a freshly built layer at the given index, shifting everything at or above it up by one. */
    void addLayer(Layer layer, int index);

    /** Detaches the layer currently at the given index. */
    void removeLayer(Layer layer, int index);
}
