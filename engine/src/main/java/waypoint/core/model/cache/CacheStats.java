package waypoint.core.model.cache;

/**
 * Point-in-time counters for a cache tier.
 *
 * @param hits successful lookups
 * @param misses lookups that found nothing usable
 * @param sets writes
 * @param evictions entries removed to satisfy the byte budget
 * @param entryCount entries currently held
 * @param totalBytes sum of {@link CacheEntry#sizeBytes()} of held entries
 * @param maxBytes the byte budget
 * @param staleEntries entries currently flagged stale
 * @param thrashingEvents keys re-admitted shortly after being evicted
 */
public record CacheStats(
        long hits,
        long misses,
        long sets,
        long evictions,
        int entryCount,
        long totalBytes,
        long maxBytes,
        int staleEntries,
        long thrashingEvents) {

    public static CacheStats empty(long maxBytes) {
        return new CacheStats(0, 0, 0, 0, 0, 0, maxBytes, 0, 0);
    }

    /**
     * Hit rate over all lookups, 0 when nothing has been looked up yet.
     */
    public double hitRate() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }

    public double utilization() {
        return maxBytes <= 0 ? 0.0 : (double) totalBytes / maxBytes;
    }
}
