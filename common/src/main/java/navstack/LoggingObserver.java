package navstack;

import org.slf4j.*;

import javax.annotation.*;

/** Writes every stack change of the navigator it observes to the log. */
public class LoggingObserver extends NavigatorObserver {
    private static final Logger log = LoggerFactory.getLogger(LoggingObserver.class);

    @Override
    public void didPush(Route<?> route, @Nullable Route<?> previousRoute) {
        log.info("Pushed {} over {}", route, previousRoute);
    }

    @Override
    public void didPop(Route<?> route, @Nullable Route<?> previousRoute) {
        log.info("Popped {}, back to {}", route, previousRoute);
    }

    @Override
    public void didRemove(Route<?> route, @Nullable Route<?> previousRoute) {
        log.info("Removed {} from above {}", route, previousRoute);
    }
}
