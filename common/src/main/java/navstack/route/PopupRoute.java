package navstack.route;

import navstack.*;

/** A modal route that floats over the current page, which stays visible underneath. Dismissible by default. */
public abstract class PopupRoute<T> extends ModalRoute<T> {
    protected PopupRoute(RouteSettings settings) {
        super(settings);
    }

    protected PopupRoute() {
    }

    @Override
    public boolean isOpaque() {
        return false;
    }

    @Override
    public boolean isBarrierDismissible() {
        return true;
    }
}
