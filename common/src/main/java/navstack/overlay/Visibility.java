package navstack.overlay;

/** Whether a realized layer is drawn. GONE layers are hidden but stay attached to their host. */
public enum Visibility {
    VISIBLE,
    GONE
}
