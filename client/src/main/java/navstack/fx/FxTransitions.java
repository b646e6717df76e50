package navstack.fx;

import javafx.animation.*;
import javafx.scene.*;
import javafx.util.Duration;

/** Stock route transitions: pages fade and zoom in, then fade and explode out. */
public class FxTransitions {
    public static final int UI_ANIMATION_TIME_MSEC = 500;

    public static FxTransition fadeAndZoomIn(Node ui, Duration duration) {
        ui.setOpacity(0.0);
        return new FxTransition(new ParallelTransition(fade(ui, duration, 0.0, 1.0), scale(ui, duration, 0.95, 1.0)));
    }

    public static FxTransition fadeAndExplodeOut(Node ui, Duration duration) {
        return new FxTransition(new ParallelTransition(fade(ui, duration, ui.getOpacity(), 0.0),
                scale(ui, duration, 1.0, 1.05)));
    }

    public static FxTransition fadeIn(Node ui, Duration duration) {
        ui.setOpacity(0.0);
        return new FxTransition(fade(ui, duration, 0.0, 1.0));
    }

    public static FxTransition fadeOut(Node ui, Duration duration) {
        return new FxTransition(fade(ui, duration, ui.getOpacity(), 0.0));
    }

    private static FadeTransition fade(Node ui, Duration duration, double from, double to) {
        ui.setCache(true);
        ui.setCacheHint(CacheHint.SPEED);
        FadeTransition ft = new FadeTransition(duration, ui);
        ft.setFromValue(from);
        ft.setToValue(to);
        ft.setOnFinished(ev -> ui.setCache(false));
        return ft;
    }

    private static ScaleTransition scale(Node node, Duration duration, double from, double to) {
        ScaleTransition scale = new ScaleTransition(duration, node);
        scale.setFromX(from);
        scale.setFromY(from);
        scale.setToX(to);
        scale.setToY(to);
        return scale;
    }
}
