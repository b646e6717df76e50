package navstack.overlay;

/**
 * The realized visual representation of an {@link Overlay.Entry}. The overlay only ever toggles its visibility; how it
 * is drawn is up to the {@link LayerHost} that created it.
 */
public interface Layer {
    void setVisibility(Visibility visibility);

    Visibility getVisibility();
}
