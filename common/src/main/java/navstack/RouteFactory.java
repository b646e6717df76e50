package navstack;

import javax.annotation.*;

/**
 * Creates a route for the given settings. A navigator's route generator may return null for names it doesn't know;
 * its unknown route handler must not.
 */
@FunctionalInterface
public interface RouteFactory {
    @Nullable
    Route<?> create(RouteSettings settings);
}
