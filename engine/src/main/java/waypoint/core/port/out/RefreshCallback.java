package waypoint.core.port.out;

import io.smallrye.mutiny.Uni;

/**
 * Fetches fresh data for a route from the network or data layer.
 */
@FunctionalInterface
public interface RefreshCallback {

    /**
     * Fetches data for the route.
     *
     * @param route the route to fetch
     * @return Uni with the fresh payload; a failure triggers a retry
     */
    Uni<Object> fetch(String route);
}
