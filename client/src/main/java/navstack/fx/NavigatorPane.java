package navstack.fx;

import javafx.beans.property.*;
import javafx.scene.layout.*;
import navstack.*;

import javax.annotation.*;

/**
 * A {@link StackPane} that displays a navigator. The navigator runs on the JavaFX thread and is attached, pushing its
 * initial route, the first time the pane is placed in a scene. Set the initial route before that.
 */
public class NavigatorPane extends StackPane {
    private final Navigator navigator;
    private final ReadOnlyBooleanWrapper canPop = new ReadOnlyBooleanWrapper(this, "canPop", false);

    public NavigatorPane(RouteFactory onGenerateRoute, RouteFactory onUnknownRoute) {
        navigator = new Navigator(new StackPaneLayerHost(this), onGenerateRoute, onUnknownRoute, FxAffinity.UI_THREAD);
        navigator.addObserver(new NavigatorObserver() {
            @Override
            public void didPush(Route<?> route, @Nullable Route<?> previousRoute) {
                updateCanPop();
            }

            @Override
            public void didPop(Route<?> route, @Nullable Route<?> previousRoute) {
                updateCanPop();
            }

            @Override
            public void didRemove(Route<?> route, @Nullable Route<?> previousRoute) {
                updateCanPop();
            }
        });
        navigator.addInvalidationListener(this::updateCanPop);
        sceneProperty().addListener((observable, oldScene, newScene) -> {
            if (newScene != null)
                navigator.attach();
        });
    }

    public Navigator getNavigator() {
        return navigator;
    }

    /** Whether a back button would pop anything right now. */
    public ReadOnlyBooleanProperty canPopProperty() {
        return canPop.getReadOnlyProperty();
    }

    private void updateCanPop() {
        canPop.set(!navigator.getHistory().isEmpty() && navigator.canPop());
    }
}
