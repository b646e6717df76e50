package navstack.utils;

import com.google.common.collect.ImmutableList;
import org.junit.Test;

import java.io.IOException;

import static org.junit.Assert.*;

public class NavUtilsTest {
    @Test
    public void cumulativeRouteNames() throws Exception {
        assertEquals(ImmutableList.of("/stocks", "/stocks/HOOLI"), NavUtils.cumulativeRouteNames("/stocks/HOOLI"));
        assertEquals(ImmutableList.of("/a", "/a/b"), NavUtils.cumulativeRouteNames("//a//b/"));
        assertEquals(ImmutableList.of(), NavUtils.cumulativeRouteNames("/"));
    }

    @Test
    public void uncheckedWrapsCheckedExceptions() throws Exception {
        try {
            NavUtils.unchecked(() -> {
                throw new IOException("disk");
            });
            fail();
        } catch (RuntimeException e) {
            assertTrue(e.getCause() instanceof IOException);
        }
        try {
            NavUtils.uncheck(() -> {
                throw new IllegalStateException("as is");
            });
            fail();
        } catch (IllegalStateException e) {
            assertEquals("as is", e.getMessage());
        }
        assertEquals("ok", NavUtils.unchecked(() -> "ok"));
    }

    @Test
    public void ignoreAndLogSwallows() throws Exception {
        NavUtils.ignoreAndLog(() -> {
            throw new IOException("logged");
        });
    }
}
