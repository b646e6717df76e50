package navstack.fx;

import javafx.application.*;
import navstack.threading.*;
import org.slf4j.*;

/** Thread affinity for the JavaFX application thread. */
public class FxAffinity {
    private static final Logger log = LoggerFactory.getLogger(FxAffinity.class);

    /** Runs commands on the JavaFX application thread. Navigators shown on screen are pinned to this. */
    public static final AffinityExecutor UI_THREAD = new AffinityExecutor.BaseAffinityExecutor() {
        @Override
        public boolean isOnThread() {
            return Platform.isFxApplicationThread();
        }

        @Override
        public void execute(Runnable command) {
            Platform.runLater(command);
        }
    };

    public static void checkGuiThread() {
        if (!Platform.isFxApplicationThread()) {
            // Log before throwing so buggy code that swallows the exception doesn't hide the problem.
            IllegalStateException ex = new IllegalStateException("Not on the FX application thread");
            log.error("Threading violation", ex);
            throw ex;
        }
    }
}
