package waypoint.core.model.cache;

/**
 * Where the data held by a cache entry was last obtained from.
 */
public enum EntrySource {
    NETWORK,
    DURABLE,
    VOLATILE
}
