package waypoint.core.cache;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import waypoint.core.model.cache.CacheEntry;
import waypoint.core.model.cache.EntrySource;
import waypoint.core.port.out.PersistentStorageEngine;

/**
 * Persistent second-chance cache tier.
 *
 * <p>Entries are stored as serialized blobs in a {@link PersistentStorageEngine}.
 * Like the volatile tier, expired entries are retained on lookup so they can be
 * served offline. Housekeeping operations scan every stored entry and are meant
 * for periodic use, not the navigation path.
 */
public class DurableStore {

    private static final Logger LOG = Logger.getLogger(DurableStore.class);

    private final PersistentStorageEngine engine;
    private final EntryCodec codec;
    private final PriorityCalculator calculator;
    private final Uni<Void> initialization;

    public DurableStore(PersistentStorageEngine engine, EntryCodec codec, PriorityCalculator calculator) {
        this.engine = engine;
        this.codec = codec;
        this.calculator = calculator;
        this.initialization = engine.init()
                .invoke(() -> LOG.infof("Durable cache tier ready (%s)", engine.name()))
                .memoize()
                .indefinitely();
    }

    /**
     * Initializes the underlying engine. Subsequent calls reuse the first outcome.
     */
    public Uni<Void> init() {
        return initialization;
    }

    /**
     * Looks up an entry and records the access.
     *
     * <p>The updated access metadata is written back without waiting for the write,
     * and only if the stored value has not been replaced in the meantime.
     *
     * @param key the cache key
     * @param ignoreExpiry true to return entries whose freshness window has passed
     * @return Uni with the entry, or empty on a miss
     */
    public Uni<Optional<CacheEntry<Object>>> get(String key, boolean ignoreExpiry) {
        return engine.get(key).map(blob -> {
            if (blob.isEmpty()) {
                return Optional.<CacheEntry<Object>>empty();
            }
            Optional<CacheEntry<Object>> decoded = codec.decode(key, blob.get());
            if (decoded.isEmpty()) {
                deleteQuietly(key);
                return Optional.<CacheEntry<Object>>empty();
            }

            Instant now = calculator.now();
            CacheEntry<Object> entry = decoded.get();
            if (!ignoreExpiry && entry.isExpired(now)) {
                return Optional.<CacheEntry<Object>>empty();
            }

            CacheEntry<Object> updated = entry.withMetadata(
                    entry.metadata().withAccess(now).withSource(EntrySource.DURABLE));
            recordAccess(key, blob.get(), updated);
            return Optional.of(updated);
        });
    }

    public Uni<Void> set(String key, CacheEntry<?> entry) {
        return Uni.createFrom().item(() -> codec.encode(entry)).flatMap(blob -> engine.set(key, blob));
    }

    public Uni<Void> delete(String key) {
        return engine.delete(key);
    }

    public Uni<Void> clear() {
        return engine.clear();
    }

    public Uni<List<String>> getAllKeys() {
        return engine.keys();
    }

    /**
     * Sums the recorded size of every stored entry.
     */
    public Uni<Long> getSize() {
        return loadAll().map(entries -> entries.stream()
                .mapToLong(stored -> stored.entry().sizeBytes())
                .sum());
    }

    /**
     * Evicts entries until the stored size fits the budget.
     *
     * <p>Lowest priority and least recently accessed go first. Entries with unsaved
     * changes are kept.
     *
     * @param maxBytes the byte budget
     * @return Uni with the number of evicted entries
     */
    public Uni<Integer> cleanup(long maxBytes) {
        return loadAll().flatMap(entries -> {
            long currentSize =
                    entries.stream().mapToLong(s -> s.entry().sizeBytes()).sum();
            if (currentSize <= maxBytes) {
                return Uni.createFrom().item(0);
            }

            List<StoredEntry> candidates = new ArrayList<>(entries);
            candidates.sort(Comparator.comparingDouble((StoredEntry s) -> s.entry().priority())
                    .thenComparing(s -> s.entry().metadata().lastAccessedAt()));

            long bytesToRemove = currentSize - maxBytes;
            List<String> victims = new ArrayList<>();
            for (StoredEntry candidate : candidates) {
                if (bytesToRemove <= 0) {
                    break;
                }
                if (candidate.entry().hasUnsavedChanges()) {
                    continue;
                }
                victims.add(candidate.key());
                bytesToRemove -= candidate.entry().sizeBytes();
            }

            LOG.debugf("Evicting %d durable entries (%d bytes over budget)", victims.size(), currentSize - maxBytes);
            return deleteAll(victims);
        });
    }

    /**
     * Removes every stored entry carrying at least one of the tags.
     *
     * @return Uni with the number of removed entries
     */
    public Uni<Integer> invalidateByTags(Collection<String> tags) {
        if (tags.isEmpty()) {
            return Uni.createFrom().item(0);
        }
        return loadAll().flatMap(entries -> {
            List<String> matching = entries.stream()
                    .filter(stored -> stored.entry().tags().stream().anyMatch(tags::contains))
                    .map(StoredEntry::key)
                    .toList();
            return deleteAll(matching);
        });
    }

    private Uni<Integer> deleteAll(List<String> keys) {
        return Multi.createFrom()
                .iterable(keys)
                .onItem()
                .transformToUniAndConcatenate(key -> engine.delete(key).replaceWith(key))
                .collect()
                .asList()
                .replaceWith(keys.size());
    }

    private Uni<List<StoredEntry>> loadAll() {
        return engine.keys()
                .onItem()
                .transformToMulti(keys -> Multi.createFrom().iterable(keys))
                .onItem()
                .transformToUniAndConcatenate(key -> engine.get(key)
                        .map(blob -> blob.flatMap(b -> codec.decode(key, b))
                                .map(entry -> new StoredEntry(key, entry))))
                .select()
                .where(Optional::isPresent)
                .map(Optional::get)
                .collect()
                .asList();
    }

    /**
     * Writes the access metadata back only while the stored value is still the one that was read.
     */
    private void recordAccess(String key, String readBlob, CacheEntry<Object> updated) {
        engine.get(key)
                .flatMap(current -> {
                    if (!current.equals(Optional.of(readBlob))) {
                        LOG.debugf("Skipping access update for %s: entry was replaced", key);
                        return Uni.createFrom().voidItem();
                    }
                    return set(key, updated);
                })
                .subscribe()
                .with(
                        ignored -> {},
                        error -> LOG.warnf("Failed to record access for %s: %s", key, error.getMessage()));
    }

    private void deleteQuietly(String key) {
        engine.delete(key)
                .subscribe()
                .with(
                        ignored -> {},
                        error -> LOG.debugf("Failed to delete unreadable entry %s: %s", key, error.getMessage()));
    }

    private record StoredEntry(String key, CacheEntry<Object> entry) {}
}
