package navstack.overlay;

/** Realizes the layer for an entry. Invoked exactly once, when the entry is inserted into an overlay. */
@FunctionalInterface
public interface LayerBuilder {
    Layer build(LayerHost host);
}
