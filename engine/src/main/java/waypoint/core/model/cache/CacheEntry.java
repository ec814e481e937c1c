package waypoint.core.model.cache;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A cached page payload together with its freshness and retention data.
 *
 * <p>Entries are immutable; every read or re-scoring produces a new instance
 * that replaces the stored one.
 *
 * @param data the cached content
 * @param timestamp when the data was produced
 * @param expiresAt end of the freshness window
 * @param priority retention priority, always within [0, 100]
 * @param sizeBytes approximate serialized size
 * @param tags grouping tags for bulk invalidation
 * @param stale whether the entry should be revalidated
 * @param metadata access bookkeeping and classification
 * @param <T> the payload type
 */
public record CacheEntry<T>(
        T data,
        Instant timestamp,
        Instant expiresAt,
        double priority,
        long sizeBytes,
        Set<String> tags,
        boolean stale,
        EntryMetadata metadata) {

    public static final double MIN_PRIORITY = 0.0;
    public static final double MAX_PRIORITY = 100.0;

    public CacheEntry {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (expiresAt == null) {
            expiresAt = timestamp;
        }
        priority = clampPriority(priority);
        sizeBytes = Math.max(0, sizeBytes);
        tags = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        if (metadata == null) {
            metadata = new EntryMetadata(timestamp, timestamp, 0, EntrySource.NETWORK, null, null, false);
        }
    }

    /**
     * Clamps a raw score into the valid priority range. NaN maps to the minimum.
     */
    public static double clampPriority(double raw) {
        if (Double.isNaN(raw)) {
            return MIN_PRIORITY;
        }
        return Math.min(MAX_PRIORITY, Math.max(MIN_PRIORITY, raw));
    }

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }

    /**
     * An entry is stale when it has been flagged or was produced more than {@code staleTtlMillis} ago.
     */
    public boolean isStale(Instant now, long staleTtlMillis) {
        return stale || (now.toEpochMilli() - timestamp.toEpochMilli()) > staleTtlMillis;
    }

    public boolean hasUnsavedChanges() {
        return metadata.hasUnsavedChanges();
    }

    public CacheEntry<T> withPriority(double priority) {
        return new CacheEntry<>(data, timestamp, expiresAt, priority, sizeBytes, tags, stale, metadata);
    }

    public CacheEntry<T> withStale(boolean stale) {
        return new CacheEntry<>(data, timestamp, expiresAt, priority, sizeBytes, tags, stale, metadata);
    }

    public CacheEntry<T> withSizeBytes(long sizeBytes) {
        return new CacheEntry<>(data, timestamp, expiresAt, priority, sizeBytes, tags, stale, metadata);
    }

    public CacheEntry<T> withMetadata(EntryMetadata metadata) {
        return new CacheEntry<>(data, timestamp, expiresAt, priority, sizeBytes, tags, stale, metadata);
    }

    public CacheEntry<T> withTimestamp(Instant timestamp) {
        return new CacheEntry<>(data, timestamp, expiresAt, priority, sizeBytes, tags, stale, metadata);
    }

    public CacheEntry<T> withExpiresAt(Instant expiresAt) {
        return new CacheEntry<>(data, timestamp, expiresAt, priority, sizeBytes, tags, stale, metadata);
    }
}
