package navstack.overlay;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.Assert.assertSame;

/** A layer host that keeps its layers in a list, so tests can check order and visibility. */
public class FakeLayerHost implements LayerHost {
    public final List<FakeLayer> layers = new ArrayList<>();

    public static LayerBuilder named(String name) {
        return host -> new FakeLayer(name);
    }

    @Override
    public void addLayer(Layer layer, int index) {
        layers.add(index, (FakeLayer) layer);
    }

    @Override
    public void removeLayer(Layer layer, int index) {
        assertSame(layers.get(index), layer);
        layers.remove(index);
    }

    public List<String> names() {
        return layers.stream().map(layer -> layer.name).collect(Collectors.toList());
    }

    public List<String> visibleNames() {
        return layers.stream()
                .filter(layer -> layer.getVisibility() == Visibility.VISIBLE)
                .map(layer -> layer.name)
                .collect(Collectors.toList());
    }

    public static class FakeLayer implements Layer {
        public final String name;
        private Visibility visibility = Visibility.VISIBLE;

        public FakeLayer(String name) {
            this.name = name;
        }

        @Override
        public void setVisibility(Visibility visibility) {
            this.visibility = visibility;
        }

        @Override
        public Visibility getVisibility() {
            return visibility;
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
