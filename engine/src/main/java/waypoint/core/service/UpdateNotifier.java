package waypoint.core.service;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.function.Consumer;

import io.smallrye.mutiny.subscription.Cancellable;
import org.jboss.logging.Logger;

/**
 * Delivers refreshed data to subscribers of a cache key.
 *
 * <p>A subscriber that throws is logged and does not affect the others.
 */
public class UpdateNotifier {

    private static final Logger LOG = Logger.getLogger(UpdateNotifier.class);

    private final Map<String, Set<Consumer<Object>>> subscribers = new ConcurrentHashMap<>();

    /**
     * Registers a callback for updates to a key.
     *
     * @param key the cache key
     * @param callback receives the new data
     * @return handle whose {@code cancel()} removes the subscription
     */
    public Cancellable subscribe(String key, Consumer<Object> callback) {
        subscribers.computeIfAbsent(key, k -> new CopyOnWriteArraySet<>()).add(callback);
        return () -> subscribers.computeIfPresent(key, (k, callbacks) -> {
            callbacks.remove(callback);
            return callbacks.isEmpty() ? null : callbacks;
        });
    }

    /**
     * Notifies every subscriber of the key.
     *
     * @return number of subscribers that handled the update without error
     */
    public int notifySubscribers(String key, Object data) {
        Set<Consumer<Object>> callbacks = subscribers.get(key);
        if (callbacks == null) {
            return 0;
        }
        int delivered = 0;
        for (Consumer<Object> callback : List.copyOf(callbacks)) {
            try {
                callback.accept(data);
                delivered++;
            } catch (RuntimeException e) {
                LOG.errorf(e, "Subscriber for %s failed", key);
            }
        }
        return delivered;
    }

    public int subscriberCount(String key) {
        Set<Consumer<Object>> callbacks = subscribers.get(key);
        return callbacks == null ? 0 : callbacks.size();
    }

    public void clear() {
        subscribers.clear();
    }
}
