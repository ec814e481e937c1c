package waypoint.core.model.cache;

import java.util.List;
import java.util.Set;

/**
 * Notifications exchanged with other execution contexts sharing the cache.
 *
 * <p>{@link EntrySet}, {@link Invalidated} and {@link Warm} are published by the
 * orchestrator; {@link Updated} flows back in when another context refreshed an entry.
 */
public sealed interface CacheEvent {

    /**
     * An entry was written.
     *
     * @param key the cache key
     * @param tags tags attached to the entry
     */
    record EntrySet(String key, Set<String> tags) implements CacheEvent {}

    /**
     * Entries were removed, either a single key or everything matching the tags.
     *
     * @param key the removed key, null for tag invalidation
     * @param tags the invalidated tags, empty for key invalidation
     */
    record Invalidated(String key, Set<String> tags) implements CacheEvent {}

    /**
     * Routes were requested to be prefetched.
     *
     * @param routes routes to warm
     */
    record Warm(List<String> routes) implements CacheEvent {}

    /**
     * An entry was refreshed elsewhere and subscribers should re-render.
     *
     * @param key the cache key
     * @param data the new payload
     */
    record Updated(String key, Object data) implements CacheEvent {}
}
