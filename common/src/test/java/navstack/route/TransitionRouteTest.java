package navstack.route;

import com.google.common.collect.ImmutableList;
import navstack.Navigator;
import navstack.Route;
import navstack.RouteSettings;
import navstack.overlay.FakeLayerHost;
import navstack.overlay.Layer;
import navstack.overlay.LayerHost;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class TransitionRouteTest {
    private FakeLayerHost host;
    private Navigator navigator;

    @Before
    public void setup() {
        host = new FakeLayerHost();
        navigator = new Navigator(host, settings -> new Page(settings), settings -> new Page(settings));
    }

    private static class Page extends PageRoute<String> {
        final ManualTransition enter = new ManualTransition();
        final ManualTransition exit = new ManualTransition();

        Page(RouteSettings settings) {
            super(settings);
        }

        Page(String name) {
            this(new RouteSettings(name, false));
        }

        @Override
        protected Transition createEnterTransition() {
            return enter;
        }

        @Override
        protected Transition createExitTransition() {
            return exit;
        }

        @Override
        protected Layer buildBarrier(LayerHost host) {
            return new FakeLayerHost.FakeLayer(getSettings().getName() + " barrier");
        }

        @Override
        protected Layer buildPage(LayerHost host) {
            return new FakeLayerHost.FakeLayer(getSettings().getName());
        }
    }

    private static class Popup extends PopupRoute<String> {
        final ManualTransition enter = new ManualTransition();

        Popup(String name) {
            super(new RouteSettings(name, false));
        }

        @Override
        protected Transition createEnterTransition() {
            return enter;
        }

        @Override
        protected Layer buildBarrier(LayerHost host) {
            return new FakeLayerHost.FakeLayer(getSettings().getName() + " barrier");
        }

        @Override
        protected Layer buildPage(LayerHost host) {
            return new FakeLayerHost.FakeLayer(getSettings().getName());
        }
    }

    private Page pushEntered(String name) {
        Page page = new Page(name);
        navigator.push(page);
        page.enter.finish();
        return page;
    }

    @Test
    public void entranceKeepsRouteBelowVisible() throws Exception {
        pushEntered("A");
        assertEquals(ImmutableList.of("A barrier", "A"), host.visibleNames());
        Page b = new Page("B");
        navigator.push(b);
        assertTrue(b.enter.isRunning());
        assertEquals(ImmutableList.of("A barrier", "A", "B barrier", "B"), host.visibleNames());
        b.enter.finish();
        assertEquals(ImmutableList.of("B barrier", "B"), host.visibleNames());
        assertTrue(b.getOverlayEntries().get(0).isOpaque());
    }

    @Test
    public void poppedCompletesBeforeCompleted() throws Exception {
        pushEntered("A");
        Page b = pushEntered("B");
        List<String> order = new ArrayList<>();
        b.getPopped().thenAccept(result -> order.add("popped " + result));
        b.getCompleted().thenAccept(result -> order.add("completed " + result));

        assertTrue(navigator.pop("r"));
        assertEquals(ImmutableList.of("popped r"), order);
        assertTrue(b.exit.isRunning());
        assertTrue(navigator.getPoppedRoutes().contains(b));
        assertSame(navigator, b.getNavigator());
        assertFalse(b.isActive());
        // B's layers stay until the exit is over, and no longer hide A.
        assertEquals(ImmutableList.of("A barrier", "A", "B barrier", "B"), host.visibleNames());

        b.exit.finish();
        assertEquals(ImmutableList.of("popped r", "completed r"), order);
        assertTrue(b.isDisposed());
        assertTrue(navigator.getPoppedRoutes().isEmpty());
        assertEquals(ImmutableList.of("A barrier", "A"), host.names());
    }

    @Test
    public void popDuringEntranceCancelsIt() throws Exception {
        pushEntered("A");
        Page b = new Page("B");
        navigator.push(b);
        navigator.pop();
        assertTrue(b.enter.cancelled);
        assertTrue(b.exit.isRunning());
        // A cancelled exit still finalizes.
        b.exit.cancel();
        assertTrue(b.isDisposed());
        assertTrue(b.getCompleted().isDone());
    }

    @Test
    public void disposeCancelsRunningTransitions() throws Exception {
        pushEntered("A");
        Page b = new Page("B");
        navigator.push(b);
        navigator.dispose();
        assertTrue(b.enter.cancelled);
        assertTrue(b.isDisposed());
        // Torn down, not popped.
        assertFalse(b.getPopped().isDone());
        assertFalse(b.getCompleted().isDone());
        assertTrue(host.layers.isEmpty());
    }

    @Test
    public void removedRouteIsNeverCompleted() throws Exception {
        pushEntered("A");
        Page b = pushEntered("B");
        pushEntered("C");
        navigator.removeRoute(b);
        assertTrue(b.isDisposed());
        assertFalse(b.getPopped().isDone());
        assertFalse(b.getCompleted().isDone());
    }

    @Test
    public void pushAndRemoveUntilDisposesAfterEntrance() throws Exception {
        Page a = pushEntered("A");
        Page b = pushEntered("B");
        Page c = new Page("C");
        navigator.pushAndRemoveUntil(c, route -> route == a);
        assertTrue(c.enter.isRunning());
        assertFalse(b.isDisposed());
        assertEquals(ImmutableList.of("A barrier", "A", "B barrier", "B", "C barrier", "C"), host.names());

        c.enter.finish();
        assertTrue(b.isDisposed());
        assertFalse(b.getPopped().isDone());
        assertFalse(b.getCompleted().isDone());
        assertEquals(ImmutableList.of("A barrier", "A", "C barrier", "C"), host.names());
    }

    @Test
    public void initialRouteSkipsEntrance() throws Exception {
        navigator.attach();
        Page first = (Page) navigator.currentRoute();
        assertTrue(first.getSettings().isInitialRoute());
        assertEquals(0, first.enter.plays);
        assertTrue(first.getOverlayEntries().get(0).isOpaque());
    }

    @Test
    public void incompatibleRoutesSkipEntrance() throws Exception {
        pushEntered("A");
        Popup popup = new Popup("popup");
        navigator.push(popup);
        assertEquals(1, popup.enter.plays);
        popup.enter.finish();
        // Popups leave the page below on screen.
        assertEquals(ImmutableList.of("A barrier", "A", "popup barrier", "popup"), host.visibleNames());

        Page over = new Page("over");
        navigator.push(over);
        assertEquals(0, over.enter.plays);
        assertEquals(ImmutableList.of("over barrier", "over"), host.visibleNames());
    }

    @Test
    public void replacePlaysEntrance() throws Exception {
        Page a = pushEntered("A");
        Page b = new Page("B");
        navigator.replace(a, b);
        assertTrue(b.enter.isRunning());
        assertTrue(a.isDisposed());
        b.enter.finish();
        assertEquals(ImmutableList.of("B barrier", "B"), host.visibleNames());
    }

    @Test
    public void pushReplacementWaitsForEntrance() throws Exception {
        pushEntered("A");
        Page b = pushEntered("B");
        Page c = new Page("C");
        navigator.pushReplacement(c, "replaced");
        assertFalse(b.getPopped().isDone());
        assertFalse(b.isDisposed());
        c.enter.finish();
        assertEquals("replaced", b.getPopped().get());
        assertTrue(b.isDisposed());
        assertEquals(ImmutableList.of("A barrier", "A", "C barrier", "C"), host.names());
    }

    @Test
    public void barrierTapDismissesPopup() throws Exception {
        Page page = pushEntered("A");
        assertFalse(page.handleBarrierTap());
        Popup popup = new Popup("popup");
        navigator.push(popup);
        assertTrue(popup.handleBarrierTap());
        assertTrue(popup.getPopped().isDone());
        assertNull(popup.getPopped().get());
        assertSame(page, navigator.currentRoute());
    }

    @Test
    public void barrierTapCannotDismissOnlyRoute() throws Exception {
        Popup popup = new Popup("popup");
        navigator.push(popup);
        popup.enter.finish();
        assertFalse(popup.handleBarrierTap());
        assertFalse(popup.getPopped().isDone());
        assertSame(popup, navigator.currentRoute());
    }

    @Test
    public void modalLocalHistoryInvalidatesNavigator() throws Exception {
        List<String> redraws = new ArrayList<>();
        navigator.addInvalidationListener(() -> redraws.add("redraw"));
        Page page = pushEntered("A");
        redraws.clear();
        LocalHistoryEntry entry = new LocalHistoryEntry(null);
        page.addLocalHistoryEntry(entry);
        assertEquals(1, redraws.size());
        assertTrue(page.willHandlePopInternally());
        assertEquals(Route.PopDisposition.POP, page.willPop().get());
        assertTrue(navigator.pop());
        assertEquals(2, redraws.size());
        assertSame(page, navigator.currentRoute());
        assertFalse(page.getPopped().isDone());
    }

    @Test
    public void withNameMatchesSettings() throws Exception {
        pushEntered("/");
        pushEntered("/a");
        pushEntered("/a/b");
        navigator.popUntil(ModalRoute.withName("/"));
        assertEquals(1, navigator.getHistory().size());
        assertFalse(ModalRoute.withName("/").test(null));
    }
}
