package navstack.fx;

import javafx.scene.*;
import javafx.util.Duration;
import navstack.*;
import navstack.overlay.*;
import navstack.route.*;

import javax.annotation.*;
import java.util.function.*;

import static com.google.common.base.Preconditions.*;

/**
 * A full screen page whose content comes from a node factory. The barrier beneath it is invisible; the page node is
 * expected to paint its own background, since once it has entered everything below is hidden.
 */
public class FxPageRoute<T> extends PageRoute<T> {
    private final Function<LayerHost, Node> builder;
    private final Duration duration;
    @Nullable private Node page;

    public FxPageRoute(RouteSettings settings, Duration duration, Function<LayerHost, Node> builder) {
        super(settings);
        this.builder = checkNotNull(builder);
        this.duration = checkNotNull(duration);
    }

    @Nullable
    public Node getPage() {
        return page;
    }

    @Override
    protected Layer buildBarrier(LayerHost host) {
        return NodeLayer.barrier("", this::handleBarrierTap);
    }

    @Override
    protected Layer buildPage(LayerHost host) {
        page = checkNotNull(builder.apply(host), "Page builder for %s returned null", this);
        return new NodeLayer(page);
    }

    @Override
    protected Transition createEnterTransition() {
        return page == null ? Transition.NONE : FxTransitions.fadeAndZoomIn(page, duration);
    }

    @Override
    protected Transition createExitTransition() {
        return page == null ? Transition.NONE : FxTransitions.fadeAndExplodeOut(page, duration);
    }
}
