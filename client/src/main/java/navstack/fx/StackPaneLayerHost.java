package navstack.fx;

import javafx.collections.*;
import javafx.scene.*;
import javafx.scene.layout.*;
import navstack.overlay.*;

import static com.google.common.base.Preconditions.*;
import static navstack.fx.FxAffinity.*;

/** Puts overlay layers into a {@link StackPane}, so later entries are drawn over earlier ones. */
public class StackPaneLayerHost implements LayerHost {
    private final StackPane pane;

    public StackPaneLayerHost(StackPane pane) {
        this.pane = checkNotNull(pane);
    }

    public StackPane getPane() {
        return pane;
    }

    @Override
    public void addLayer(Layer layer, int index) {
        checkGuiThread();
        pane.getChildren().add(index, nodeOf(layer));
    }

    @Override
    public void removeLayer(Layer layer, int index) {
        checkGuiThread();
        ObservableList<Node> children = pane.getChildren();
        checkState(children.get(index) == nodeOf(layer), "Layer %s is not at index %s", layer, index);
        children.remove(index);
    }

    private static Node nodeOf(Layer layer) {
        checkArgument(layer instanceof NodeLayer, "Only node layers can be hosted in a StackPane: %s", layer);
        return ((NodeLayer) layer).getNode();
    }
}
