package navstack.utils;

import com.google.common.base.*;
import com.google.common.collect.*;
import org.slf4j.*;

import java.util.*;

public class NavUtils {
    private static final Logger log = LoggerFactory.getLogger(NavUtils.class);

    public static final char ROUTE_SEPARATOR = '/';

    /**
     * Splits a slash delimited route name into the cumulative names leading up to it: "/stocks/HOOLI" becomes
     * ["/stocks", "/stocks/HOOLI"]. The root "/" itself is not included. Empty segments are dropped.
     */
    public static List<String> cumulativeRouteNames(String routeName) {
        List<String> names = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String part : Splitter.on(ROUTE_SEPARATOR).omitEmptyStrings().split(routeName)) {
            current.append(ROUTE_SEPARATOR).append(part);
            names.add(current.toString());
        }
        return ImmutableList.copyOf(names);
    }

    //region Generic Java 8 enhancements
    public interface UncheckedRun<T> {
        T run() throws Throwable;
    }

    public interface UncheckedRunnable {
        void run() throws Throwable;
    }

    public static <T> T unchecked(UncheckedRun<T> run) {
        try {
            return run.run();
        } catch (Throwable throwable) {
            Throwables.throwIfUnchecked(throwable);
            throw new RuntimeException(throwable);
        }
    }

    public static void uncheck(UncheckedRunnable run) {
        try {
            run.run();
        } catch (Throwable throwable) {
            Throwables.throwIfUnchecked(throwable);
            throw new RuntimeException(throwable);
        }
    }

    public static void ignoreAndLog(UncheckedRunnable runnable) {
        try {
            runnable.run();
        } catch (Throwable t) {
            log.error("Ignoring error", t);
        }
    }
    //endregion
}
