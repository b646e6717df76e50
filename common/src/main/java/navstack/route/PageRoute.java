package navstack.route;

import navstack.*;

/**
 * A modal route that replaces the whole screen. Page routes are opaque once their entrance is done and their barrier
 * cannot be tapped away. A page only plays its entrance when it comes in over another page (or over nothing): a page
 * pushed over a popup just appears.
 */
public abstract class PageRoute<T> extends ModalRoute<T> {
    protected PageRoute(RouteSettings settings) {
        super(settings);
    }

    protected PageRoute() {
    }

    @Override
    public boolean isOpaque() {
        return true;
    }

    @Override
    public boolean isBarrierDismissible() {
        return false;
    }

    @Override
    public boolean canTransitionFrom(TransitionRoute<?> previousRoute) {
        return previousRoute instanceof PageRoute;
    }
}
