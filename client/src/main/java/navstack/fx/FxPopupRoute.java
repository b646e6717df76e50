package navstack.fx;

import javafx.animation.ParallelTransition;
import javafx.geometry.*;
import javafx.scene.*;
import javafx.scene.layout.*;
import javafx.util.Duration;
import navstack.*;
import navstack.overlay.*;
import navstack.route.*;

import javax.annotation.*;
import java.util.function.*;

import static com.google.common.base.Preconditions.*;

/** A dialog centered over the current page. Clicking the dimmed area around it dismisses it with a null result. */
public class FxPopupRoute<T> extends PopupRoute<T> {
    public static final String BARRIER_STYLE = "-fx-background-color: rgba(0, 0, 0, 0.4);";

    private final Function<LayerHost, Node> builder;
    private final Duration duration;
    @Nullable private Node content;
    @Nullable private Node barrier;

    public FxPopupRoute(RouteSettings settings, Duration duration, Function<LayerHost, Node> builder) {
        super(settings);
        this.builder = checkNotNull(builder);
        this.duration = checkNotNull(duration);
    }

    @Override
    protected Layer buildBarrier(LayerHost host) {
        NodeLayer layer = NodeLayer.barrier(BARRIER_STYLE, this::handleBarrierTap);
        barrier = layer.getNode();
        return layer;
    }

    @Override
    protected Layer buildPage(LayerHost host) {
        content = checkNotNull(builder.apply(host), "Popup builder for %s returned null", this);
        StackPane holder = new StackPane(content);
        StackPane.setAlignment(content, Pos.CENTER);
        // Let clicks beside the content fall through to the barrier.
        holder.setPickOnBounds(false);
        return new NodeLayer(holder);
    }

    @Override
    protected Transition createEnterTransition() {
        if (content == null || barrier == null)
            return Transition.NONE;
        return new FxTransition(new ParallelTransition(FxTransitions.fadeIn(barrier, duration).getAnimation(),
                FxTransitions.fadeAndZoomIn(content, duration).getAnimation()));
    }

    @Override
    protected Transition createExitTransition() {
        if (content == null || barrier == null)
            return Transition.NONE;
        return new FxTransition(new ParallelTransition(FxTransitions.fadeOut(barrier, duration).getAnimation(),
                FxTransitions.fadeAndExplodeOut(content, duration).getAnimation()));
    }
}
