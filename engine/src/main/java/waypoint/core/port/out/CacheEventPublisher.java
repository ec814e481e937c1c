package waypoint.core.port.out;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import waypoint.core.model.cache.CacheEvent;

/**
 * Channel for exchanging cache notifications with other execution contexts.
 *
 * <p>Delivery is best-effort; the cache works without any subscriber.
 * All operations MUST be non-blocking.
 */
public interface CacheEventPublisher {

    /**
     * Publishes an event to every subscriber.
     *
     * @param event the event
     * @return Uni completing when the event is handed to the channel
     */
    Uni<Void> publish(CacheEvent event);

    /**
     * Streams events published after subscription.
     *
     * @return Multi of events
     */
    Multi<CacheEvent> subscribe();
}
