package navstack.fx;

import javafx.animation.*;
import navstack.route.Transition;

import javax.annotation.*;
import java.util.concurrent.*;

import static com.google.common.base.Preconditions.*;
import static navstack.fx.FxAffinity.*;

/** Plays a JavaFX {@link Animation} as a route transition. */
public class FxTransition implements Transition {
    private final Animation animation;
    @Nullable private CompletableFuture<Void> running;

    public FxTransition(Animation animation) {
        this.animation = checkNotNull(animation);
    }

    public Animation getAnimation() {
        return animation;
    }

    @Override
    public CompletableFuture<Void> play() {
        checkGuiThread();
        CompletableFuture<Void> future = new CompletableFuture<>();
        running = future;
        animation.setOnFinished(ev -> future.complete(null));
        animation.playFromStart();
        return future;
    }

    @Override
    public void cancel() {
        CompletableFuture<Void> future = running;
        if (future == null || future.isDone())
            return;
        // Stopping doesn't fire onFinished.
        animation.stop();
        future.cancel(false);
    }
}
