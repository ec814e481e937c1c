package waypoint.core.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

import org.jboss.logging.Logger;

import waypoint.core.config.CacheSettings;
import waypoint.core.model.cache.CacheEntry;
import waypoint.core.model.cache.CacheStats;

/**
 * Fast, size-bounded in-memory cache tier.
 *
 * <p>Eviction order is ascending priority, then least recently accessed, then
 * insertion order. Entries with priority above {@value #CRITICAL_PRIORITY} or with
 * unsaved changes are never evicted.
 *
 * <p>Expired entries are kept on lookup so they can still be served offline;
 * they are only removed by {@link #cleanupExpired()} or eviction.
 *
 * <p>All operations are synchronized on the store.
 */
public class VolatileStore {

    private static final Logger LOG = Logger.getLogger(VolatileStore.class);

    static final double CRITICAL_PRIORITY = 80.0;
    static final double CLEANUP_TARGET_RATIO = 0.8;
    static final Duration THRASHING_WINDOW = Duration.ofSeconds(60);

    private final Map<String, Slot> entries = new HashMap<>();
    private final Map<String, Set<String>> tagIndex = new HashMap<>();
    private final Map<String, Instant> recentlyEvicted = new LinkedHashMap<>();
    private final PriorityCalculator calculator;

    private CacheSettings settings;
    private long totalBytes;
    private long sequence;
    private long hits;
    private long misses;
    private long sets;
    private long evictions;
    private long thrashingEvents;

    public VolatileStore(CacheSettings settings, PriorityCalculator calculator) {
        this.settings = settings;
        this.calculator = calculator;
    }

    public <T> Optional<CacheEntry<T>> get(String key) {
        return get(key, false);
    }

    /**
     * Looks up an entry and records the access.
     *
     * <p>A hit increments the access count, refreshes the last access time,
     * recomputes the base priority and re-evaluates staleness.
     *
     * @param key the cache key
     * @param ignoreExpiry true to serve entries whose freshness window has passed
     * @return the updated entry, or empty on a miss
     */
    @SuppressWarnings("unchecked")
    public synchronized <T> Optional<CacheEntry<T>> get(String key, boolean ignoreExpiry) {
        Slot slot = entries.get(key);
        Instant now = calculator.now();
        if (slot == null || (!ignoreExpiry && slot.entry.isExpired(now))) {
            misses++;
            return Optional.empty();
        }

        CacheEntry<?> current = slot.entry;
        var metadata = current.metadata().withAccess(now);
        double priority = calculator.basePriority(
                metadata.accessCount(),
                metadata.lastAccessedAt(),
                settings.frequencyWeight(),
                settings.recencyWeight());
        CacheEntry<?> updated = current.withMetadata(metadata).withPriority(priority);
        updated = updated.withStale(updated.isStale(now, settings.staleTtl().toMillis()));
        slot.entry = updated;
        hits++;
        return Optional.of((CacheEntry<T>) updated);
    }

    /**
     * Reads an entry without recording an access.
     */
    @SuppressWarnings("unchecked")
    public synchronized <T> Optional<CacheEntry<T>> peek(String key) {
        Slot slot = entries.get(key);
        return slot == null ? Optional.empty() : Optional.of((CacheEntry<T>) slot.entry);
    }

    /**
     * Stores an entry, replacing any existing entry for the key.
     *
     * <p>Runs {@link #cleanup()} immediately when the byte budget is exceeded.
     */
    public synchronized void set(String key, CacheEntry<?> entry) {
        Instant now = calculator.now();
        removeInternal(key);
        trackThrashing(key, now);

        entries.put(key, new Slot(entry, sequence++));
        for (String tag : entry.tags()) {
            tagIndex.computeIfAbsent(tag, t -> new HashSet<>()).add(key);
        }
        totalBytes += entry.sizeBytes();
        sets++;

        if (totalBytes > settings.maxVolatileBytes()) {
            cleanup();
        }
    }

    /**
     * Stores an entry unless the key already holds one written at the same time or later.
     *
     * @return the entry held for the key afterwards
     */
    @SuppressWarnings("unchecked")
    public synchronized <T> CacheEntry<T> setIfNewer(String key, CacheEntry<T> entry) {
        Slot slot = entries.get(key);
        if (slot != null && !slot.entry.timestamp().isBefore(entry.timestamp())) {
            return (CacheEntry<T>) slot.entry;
        }
        set(key, entry);
        return entry;
    }

    /**
     * Replaces the priority of a held entry.
     *
     * @return true if the key was present
     */
    public synchronized boolean reprioritize(String key, double priority) {
        Slot slot = entries.get(key);
        if (slot == null) {
            return false;
        }
        slot.entry = slot.entry.withPriority(priority);
        return true;
    }

    public synchronized boolean delete(String key) {
        return removeInternal(key);
    }

    public synchronized void clear() {
        entries.clear();
        tagIndex.clear();
        recentlyEvicted.clear();
        totalBytes = 0;
    }

    /**
     * Removes every entry carrying at least one of the tags. Unknown tags are ignored.
     *
     * @return number of entries removed
     */
    public synchronized int invalidateByTags(Collection<String> tags) {
        Set<String> keys = new HashSet<>();
        for (String tag : tags) {
            Set<String> tagged = tagIndex.get(tag);
            if (tagged != null) {
                keys.addAll(tagged);
            }
        }
        keys.forEach(this::removeInternal);
        if (!keys.isEmpty()) {
            LOG.debugf("Invalidated %d entries for tags %s", keys.size(), tags);
        }
        return keys.size();
    }

    /**
     * Evicts down to 80% of the byte budget.
     *
     * @return number of evicted entries
     */
    public synchronized int cleanup() {
        return evictToTarget((long) (settings.maxVolatileBytes() * CLEANUP_TARGET_RATIO), entry -> false);
    }

    /**
     * Evicts entries until the held bytes are at or below the target.
     *
     * <p>Critical entries, entries with unsaved changes and pinned entries are skipped,
     * so the target may not be reached.
     *
     * @param targetBytes byte total to reach
     * @param pinned matches entries that must not be evicted
     * @return number of evicted entries
     */
    public synchronized int evictToTarget(long targetBytes, Predicate<CacheEntry<?>> pinned) {
        if (totalBytes <= targetBytes) {
            return 0;
        }

        List<Map.Entry<String, Slot>> candidates = new ArrayList<>(entries.entrySet());
        candidates.sort(Comparator.comparingDouble((Map.Entry<String, Slot> e) -> e.getValue().entry.priority())
                .thenComparing(e -> e.getValue().entry.metadata().lastAccessedAt())
                .thenComparingLong(e -> e.getValue().sequence));

        Instant now = calculator.now();
        int evicted = 0;
        for (Map.Entry<String, Slot> candidate : candidates) {
            if (totalBytes <= targetBytes) {
                break;
            }
            CacheEntry<?> entry = candidate.getValue().entry;
            String key = candidate.getKey();
            if (entry.priority() > CRITICAL_PRIORITY || entry.hasUnsavedChanges() || pinned.test(entry)) {
                continue;
            }
            removeInternal(key);
            recentlyEvicted.put(key, now);
            evictions++;
            evicted++;
        }

        if (evicted > 0) {
            LOG.debugf("Evicted %d entries, %d bytes held (target %d)", evicted, totalBytes, targetBytes);
        }
        if (totalBytes > targetBytes) {
            LOG.debugf("Eviction target %d not reached, remaining entries are protected", targetBytes);
        }
        return evicted;
    }

    /**
     * Flags every entry older than the stale TTL.
     *
     * @return keys of all stale entries
     */
    public synchronized List<String> markStaleEntries() {
        Instant now = calculator.now();
        long staleTtl = settings.staleTtl().toMillis();
        List<String> staleKeys = new ArrayList<>();
        for (Map.Entry<String, Slot> e : entries.entrySet()) {
            Slot slot = e.getValue();
            if (slot.entry.isStale(now, staleTtl)) {
                slot.entry = slot.entry.withStale(true);
                staleKeys.add(e.getKey());
            }
        }
        return staleKeys;
    }

    /**
     * Removes entries whose freshness window has passed.
     *
     * @return number of removed entries
     */
    public synchronized int cleanupExpired() {
        Instant now = calculator.now();
        List<String> expired = entries.entrySet().stream()
                .filter(e -> e.getValue().entry.isExpired(now))
                .map(Map.Entry::getKey)
                .toList();
        expired.forEach(this::removeInternal);
        return expired.size();
    }

    public synchronized List<String> getEntriesByTag(String tag) {
        Set<String> keys = tagIndex.get(tag);
        return keys == null ? List.of() : List.copyOf(keys);
    }

    public synchronized List<String> getAllKeys() {
        return List.copyOf(entries.keySet());
    }

    public synchronized boolean has(String key) {
        return entries.containsKey(key);
    }

    public synchronized int getSize() {
        return entries.size();
    }

    public synchronized long getTotalBytes() {
        return totalBytes;
    }

    public synchronized CacheSettings settings() {
        return settings;
    }

    /**
     * Applies new settings, evicting immediately if the budget shrank below the held bytes.
     */
    public synchronized void updateSettings(CacheSettings newSettings) {
        boolean shrunk = newSettings.maxVolatileBytes() < settings.maxVolatileBytes();
        this.settings = newSettings;
        if (shrunk && totalBytes > newSettings.maxVolatileBytes()) {
            cleanup();
        }
    }

    public synchronized CacheStats getStats() {
        int stale = (int) entries.values().stream().filter(s -> s.entry.stale()).count();
        return new CacheStats(
                hits,
                misses,
                sets,
                evictions,
                entries.size(),
                totalBytes,
                settings.maxVolatileBytes(),
                stale,
                thrashingEvents);
    }

    private boolean removeInternal(String key) {
        Slot removed = entries.remove(key);
        if (removed == null) {
            return false;
        }
        totalBytes -= removed.entry.sizeBytes();
        for (String tag : removed.entry.tags()) {
            Set<String> keys = tagIndex.get(tag);
            if (keys != null) {
                keys.remove(key);
                if (keys.isEmpty()) {
                    tagIndex.remove(tag);
                }
            }
        }
        return true;
    }

    private void trackThrashing(String key, Instant now) {
        Instant cutoff = now.minus(THRASHING_WINDOW);
        Iterator<Map.Entry<String, Instant>> it = recentlyEvicted.entrySet().iterator();
        while (it.hasNext()) {
            if (it.next().getValue().isBefore(cutoff)) {
                it.remove();
            }
        }
        Instant evictedAt = recentlyEvicted.remove(key);
        if (evictedAt != null) {
            thrashingEvents++;
            LOG.debugf("Key %s re-admitted %d ms after eviction", key, now.toEpochMilli() - evictedAt.toEpochMilli());
        }
    }

    private static final class Slot {
        private CacheEntry<?> entry;
        private final long sequence;

        private Slot(CacheEntry<?> entry, long sequence) {
            this.entry = entry;
            this.sequence = sequence;
        }
    }
}
