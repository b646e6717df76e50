package navstack;

import com.google.common.collect.ImmutableList;
import navstack.overlay.FakeLayerHost;
import navstack.overlay.Overlay;
import navstack.route.LocalHistory;
import navstack.route.LocalHistoryEntry;
import navstack.route.OverlayRoute;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A route with a single opaque layer that writes every lifecycle callback to a shared event list. It carries a local
 * history so tests can exercise internally handled pops.
 */
public class TestRoute extends OverlayRoute<String> {
    private final String name;
    private final List<String> events;
    private final LocalHistory localHistory = new LocalHistory(this, () -> {});
    public PopDisposition disposition;

    public TestRoute(String name, List<String> events) {
        this.name = name;
        this.events = events;
    }

    public void addLocalHistoryEntry(LocalHistoryEntry entry) {
        localHistory.add(entry);
    }

    @Override
    protected Collection<Overlay.Entry> createOverlayEntries() {
        return ImmutableList.of(new Overlay.Entry(FakeLayerHost.named(name), true));
    }

    @Override
    public boolean willHandlePopInternally() {
        return !localHistory.isEmpty();
    }

    @Override
    public CompletableFuture<PopDisposition> willPop() {
        if (disposition != null)
            return CompletableFuture.completedFuture(disposition);
        return super.willPop();
    }

    @Override
    public CompletableFuture<Void> didPush() {
        events.add(name + " didPush");
        return super.didPush();
    }

    @Override
    public void didReplace(Route<?> oldRoute) {
        events.add(name + " didReplace " + oldRoute);
    }

    @Override
    public boolean didPop(String result) {
        events.add(name + " didPop " + result);
        if (localHistory.pop())
            return false;
        return super.didPop(result);
    }

    @Override
    public void didPopNext(Route<?> nextRoute) {
        events.add(name + " didPopNext " + nextRoute);
    }

    @Override
    public void didChangeNext(Route<?> nextRoute) {
        events.add(name + " didChangeNext " + nextRoute);
    }

    @Override
    public void didChangePrevious(Route<?> previousRoute) {
        events.add(name + " didChangePrevious " + previousRoute);
    }

    @Override
    public void dispose() {
        events.add(name + " dispose");
        super.dispose();
    }

    @Override
    public String toString() {
        return name;
    }
}
