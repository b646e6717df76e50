package navstack.route;

import com.google.common.collect.ImmutableList;
import navstack.Route;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class LocalHistoryTest {
    private Route<String> route;
    private LocalHistory history;
    private List<String> events;

    @Before
    public void setup() {
        events = new ArrayList<>();
        route = new Route<String>() {
        };
        history = new LocalHistory(route, () -> events.add("changed"));
    }

    private LocalHistoryEntry entry(String name) {
        return new LocalHistoryEntry(() -> events.add("removed " + name));
    }

    @Test
    public void popRemovesNewestFirst() throws Exception {
        history.add(entry("a"));
        history.add(entry("b"));
        assertEquals(2, history.size());
        assertTrue(history.pop());
        assertTrue(history.pop());
        assertFalse(history.pop());
        // Only the transitions between empty and non-empty count as a change.
        assertEquals(ImmutableList.of("changed", "removed b", "removed a", "changed"), events);
    }

    @Test
    public void entryRemovesItself() throws Exception {
        LocalHistoryEntry a = entry("a");
        history.add(a);
        assertSame(route, a.getOwner());
        a.remove();
        assertNull(a.getOwner());
        assertTrue(history.isEmpty());
        assertEquals(ImmutableList.of("changed", "removed a", "changed"), events);
        // Removing again is harmless.
        a.remove();
        assertEquals(3, events.size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void entryBelongsToOneRoute() throws Exception {
        LocalHistoryEntry a = entry("a");
        history.add(a);
        new LocalHistory(route, () -> {}).add(a);
    }

    @Test(expected = IllegalArgumentException.class)
    public void cannotRemoveForeignEntry() throws Exception {
        history.remove(entry("stranger"));
    }

    @Test
    public void localHistoryRouteHandlesPopInternally() throws Exception {
        LocalHistoryRoute<String> searching = new LocalHistoryRoute<String>() {
            @Override
            protected void changedInternalState() {
                events.add("route changed");
            }
        };
        assertFalse(searching.willHandlePopInternally());
        searching.addLocalHistoryEntry(entry("search"));
        assertTrue(searching.willHandlePopInternally());
        assertEquals(Route.PopDisposition.POP, searching.willPop().get());
        assertFalse(searching.didPop("ignored"));
        assertFalse(searching.getPopped().isDone());
        assertTrue(searching.didPop("done"));
        assertEquals("done", searching.getPopped().get());
        assertEquals(ImmutableList.of("route changed", "removed search", "route changed"), events);
    }
}
