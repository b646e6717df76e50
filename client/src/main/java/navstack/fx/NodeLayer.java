package navstack.fx;

import javafx.scene.*;
import javafx.scene.layout.*;
import navstack.overlay.*;

import static com.google.common.base.Preconditions.*;

/** A layer backed by a JavaFX node. A GONE layer is neither drawn nor laid out, but stays in the scene graph. */
public class NodeLayer implements Layer {
    private final Node node;

    public NodeLayer(Node node) {
        this.node = checkNotNull(node);
    }

    public Node getNode() {
        return node;
    }

    @Override
    public void setVisibility(Visibility visibility) {
        boolean visible = visibility == Visibility.VISIBLE;
        node.setVisible(visible);
        node.setManaged(visible);
    }

    @Override
    public Visibility getVisibility() {
        return node.isVisible() ? Visibility.VISIBLE : Visibility.GONE;
    }

    /**
     * A full size pane that stops clicks reaching the layers below and runs onTap when clicked. An empty style
     * makes it invisible.
     */
    public static NodeLayer barrier(String style, Runnable onTap) {
        Pane barrier = new Pane();
        barrier.setStyle(style);
        barrier.setPickOnBounds(true);
        barrier.setOnMouseClicked(ev -> onTap.run());
        return new NodeLayer(barrier);
    }

    @Override
    public String toString() {
        return "NodeLayer{" + node + "}";
    }
}
