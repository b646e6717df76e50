package navstack;

import com.google.common.base.*;

import javax.annotation.*;

/** Data that might be useful in constructing a {@link Route}. */
public final class RouteSettings {
    @Nullable private final String name;
    private final boolean initialRoute;

    public RouteSettings(@Nullable String name, boolean initialRoute) {
        this.name = name;
        this.initialRoute = initialRoute;
    }

    /** The name of the route, e.g. "/settings". Null means the route is anonymous. */
    @Nullable
    public String getName() {
        return name;
    }

    /**
     * Whether this route is the very first route being pushed onto the navigator. The initial route typically skips
     * any entrance transition to speed startup.
     */
    public boolean isInitialRoute() {
        return initialRoute;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RouteSettings other = (RouteSettings) o;
        return initialRoute == other.initialRoute && Objects.equal(name, other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(name, initialRoute);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("name", name).add("initialRoute", initialRoute).toString();
    }
}
