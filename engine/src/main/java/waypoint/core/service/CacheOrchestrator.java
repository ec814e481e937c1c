package waypoint.core.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import waypoint.core.cache.DurableStore;
import waypoint.core.cache.PriorityCalculator;
import waypoint.core.cache.PriorityWeights;
import waypoint.core.cache.SizeEstimator;
import waypoint.core.cache.VolatileStore;
import waypoint.core.config.CacheSettings;
import waypoint.core.model.cache.CacheEntry;
import waypoint.core.model.cache.CacheEvent;
import waypoint.core.model.cache.CacheStats;
import waypoint.core.model.cache.EntryMetadata;
import waypoint.core.model.cache.EntrySource;
import waypoint.core.model.cache.StorageQuota;
import waypoint.core.model.navigation.PageDescriptor;
import waypoint.core.port.out.CacheEventPublisher;
import waypoint.core.port.out.StorageQuotaEstimator;

/**
 * Single entry point to the two-tier page cache.
 *
 * <p>Reads try the volatile tier first and fall back to the durable tier, promoting
 * durable hits. Writes go to both tiers. Durable tier failures never propagate:
 * they are logged, recorded as {@link #lastError()} and the call continues with
 * the volatile tier only. If the durable engine cannot be initialized the durable
 * tier stays disabled.
 */
public class CacheOrchestrator {

    private static final Logger LOG = Logger.getLogger(CacheOrchestrator.class);

    static final int RECENT_ROUTE_LIMIT = 3;
    static final double PRESSURE_TARGET_RATIO = 0.5;
    static final double FLAT_PRIORITY = 50.0;
    private static final int MIN_ENTRIES_FOR_ADAPTATION = 10;

    private final CacheSettings settings;
    private final VolatileStore volatileStore;
    private final DurableStore durableStore;
    private final PriorityCalculator calculator;
    private final SizeEstimator sizeEstimator;
    private final StorageQuotaEstimator quotaEstimator;
    private final CacheEventPublisher eventPublisher;

    private final Deque<String> recentRoutes = new ArrayDeque<>();
    private final AtomicReference<Throwable> lastError = new AtomicReference<>();
    private volatile PriorityWeights priorityWeights = PriorityWeights.DEFAULT;
    private volatile boolean offlineMode;
    private volatile boolean durableEnabled;

    /**
     * @param durableStore the persistent tier, or null to run volatile-only
     */
    public CacheOrchestrator(
            CacheSettings settings,
            VolatileStore volatileStore,
            DurableStore durableStore,
            PriorityCalculator calculator,
            SizeEstimator sizeEstimator,
            StorageQuotaEstimator quotaEstimator,
            CacheEventPublisher eventPublisher) {
        this.settings = settings;
        this.volatileStore = volatileStore;
        this.durableStore = durableStore;
        this.calculator = calculator;
        this.sizeEstimator = sizeEstimator;
        this.quotaEstimator = quotaEstimator;
        this.eventPublisher = eventPublisher;
        this.durableEnabled = settings.enablePersistence() && durableStore != null;
    }

    /**
     * Initializes the durable tier. A failure disables it instead of failing the Uni.
     */
    public Uni<Void> initialize() {
        if (!durableEnabled) {
            LOG.info("Page cache running without durable tier");
            return Uni.createFrom().voidItem();
        }
        return durableStore
                .init()
                .onFailure()
                .recoverWithUni(error -> {
                    disableDurable(error);
                    return Uni.createFrom().voidItem();
                });
    }

    /**
     * Looks up an entry in the volatile tier, then the durable tier.
     *
     * <p>A volatile hit resolves immediately. A durable hit is re-scored and
     * written back into the volatile tier before being returned, unless a newer
     * entry was set while the durable read was in flight. The newer entry wins.
     *
     * @param key the cache key
     * @return Uni with the entry, or empty on a miss
     */
    @SuppressWarnings("unchecked")
    public <T> Uni<Optional<CacheEntry<T>>> get(String key) {
        Optional<CacheEntry<T>> volatileHit = getSync(key);
        if (volatileHit.isPresent()) {
            return Uni.createFrom().item(volatileHit);
        }

        boolean ignoreExpiry = offlineMode;
        return withDurable("get", Optional.<CacheEntry<Object>>empty(), durable -> durable.get(key, ignoreExpiry))
                .map(found -> found.map(entry -> (CacheEntry<T>) promote(key, entry)));
    }

    /**
     * Looks up an entry in the volatile tier only.
     */
    public <T> Optional<CacheEntry<T>> getSync(String key) {
        Optional<CacheEntry<T>> hit = volatileStore.get(key, offlineMode);
        return hit.map(entry -> {
            CacheEntry<T> rescored = rescore(entry);
            if (rescored != entry) {
                volatileStore.reprioritize(key, rescored.priority());
            }
            return rescored;
        });
    }

    public <T> Uni<Void> set(String key, T data, PageDescriptor descriptor) {
        return set(key, data, descriptor, settings.defaultTtl());
    }

    /**
     * Caches freshly fetched data in both tiers.
     *
     * <p>The durable write is skipped when the TTL is not positive or the entry
     * alone exceeds the durable budget.
     *
     * @param key the cache key
     * @param data the payload
     * @param descriptor route and classification of the page
     * @param ttl freshness window
     * @return Uni completing once both tiers have been written
     */
    public <T> Uni<Void> set(String key, T data, PageDescriptor descriptor, Duration ttl) {
        return Uni.createFrom()
                .item(() -> storeVolatile(key, data, descriptor, ttl))
                .flatMap(entry -> {
                    if (ttl.isZero() || ttl.isNegative()) {
                        LOG.debugf("Not persisting %s: non-positive TTL", key);
                        return Uni.createFrom().voidItem();
                    }
                    if (entry.sizeBytes() > settings.maxDurableBytes()) {
                        LOG.debugf("Not persisting %s: %d bytes exceeds durable budget", key, entry.sizeBytes());
                        return Uni.createFrom().voidItem();
                    }
                    return withDurable("set", null, durable -> durable.set(key, entry));
                });
    }

    /**
     * Removes a key from both tiers. Unknown keys are ignored.
     */
    public Uni<Void> invalidate(String key) {
        return Uni.createFrom()
                .item(() -> volatileStore.delete(key))
                .invoke(() -> publish(new CacheEvent.Invalidated(key, Set.of())))
                .flatMap(removed -> withDurable("invalidate", null, durable -> durable.delete(key)));
    }

    /**
     * Removes every entry carrying one of the tags from both tiers.
     */
    public Uni<Void> invalidateTags(Collection<String> tags) {
        Set<String> tagSet = Set.copyOf(tags);
        return Uni.createFrom()
                .item(() -> volatileStore.invalidateByTags(tagSet))
                .invoke(() -> publish(new CacheEvent.Invalidated(null, tagSet)))
                .flatMap(removed -> withDurable(
                        "invalidateTags", null, durable -> durable.invalidateByTags(tagSet).replaceWithVoid()));
    }

    /**
     * Routes most recently written through {@link #set}, most recent first.
     */
    public List<String> getRecentRoutes() {
        synchronized (recentRoutes) {
            return List.copyOf(recentRoutes);
        }
    }

    /**
     * Frees memory in both tiers.
     *
     * <p>Under pressure the volatile tier is cut to half its budget, keeping critical
     * entries, entries with unsaved changes and the most recent routes. Otherwise the
     * volatile tier applies its own rule and weights may adapt; this normal cleanup
     * is skipped while offline. Stale entries are flagged afterwards.
     *
     * @param underPressure true when memory or storage is running out
     */
    public Uni<Void> cleanup(boolean underPressure) {
        if (underPressure) {
            long target = (long) (settings.maxVolatileBytes() * PRESSURE_TARGET_RATIO);
            int evicted = volatileStore.evictToTarget(target, this::isRecentRouteEntry);
            LOG.infof("Pressure cleanup evicted %d entries", evicted);
        } else if (offlineMode) {
            LOG.debug("Skipping cleanup while offline");
            return Uni.createFrom().voidItem();
        } else {
            volatileStore.cleanup();
            adaptPriorityWeights();
        }

        return withDurable("cleanup", null, durable -> durable.cleanup(settings.maxDurableBytes())
                        .replaceWithVoid())
                .invoke(this::markStaleEntries);
    }

    public List<String> markStaleEntries() {
        return volatileStore.markStaleEntries();
    }

    /**
     * Switches offline mode. While offline, expired entries are served.
     */
    public void setOfflineMode(boolean offline) {
        if (this.offlineMode != offline) {
            LOG.infof("Page cache offline mode %s", offline ? "enabled" : "disabled");
        }
        this.offlineMode = offline;
    }

    public boolean isOfflineMode() {
        return offlineMode;
    }

    /**
     * Asks the hosting environment for storage usage.
     *
     * @return Uni with the quota, or empty if it cannot be determined
     */
    public Uni<Optional<StorageQuota>> checkStorageQuota() {
        return quotaEstimator.estimate().onFailure().recoverWithItem(error -> {
            LOG.warnf("Failed to estimate storage quota: %s", error.getMessage());
            return Optional.empty();
        });
    }

    /**
     * Announces routes that should be prefetched to other contexts.
     */
    public Uni<Void> warm(List<String> routes) {
        return Uni.createFrom().voidItem().invoke(() -> publish(new CacheEvent.Warm(List.copyOf(routes))));
    }

    public CacheStats getStats() {
        return volatileStore.getStats();
    }

    public Optional<Throwable> lastError() {
        return Optional.ofNullable(lastError.get());
    }

    public void clearError() {
        lastError.set(null);
    }

    /**
     * Empties both tiers and forgets recent routes.
     */
    public Uni<Void> clear() {
        volatileStore.clear();
        synchronized (recentRoutes) {
            recentRoutes.clear();
        }
        return withDurable("clear", null, DurableStore::clear);
    }

    public PriorityWeights priorityWeights() {
        return priorityWeights;
    }

    /**
     * Replaces the extended weights; frequency and recency also drive the volatile tier.
     */
    public void updatePriorityWeights(PriorityWeights weights) {
        this.priorityWeights = weights;
        volatileStore.updateSettings(volatileStore.settings().withWeights(weights.frequency(), weights.recency()));
    }

    public Clock clock() {
        return calculator.clock();
    }

    public boolean isDurableEnabled() {
        return durableEnabled;
    }

    private <T> CacheEntry<T> storeVolatile(String key, T data, PageDescriptor descriptor, Duration ttl) {
        Instant now = calculator.now();
        double priority = settings.advancedPriority()
                ? calculator.extendedPriority(
                        descriptor.pageKind(), descriptor.contentKind(), 1, now, priorityWeights)
                : FLAT_PRIORITY;
        EntryMetadata metadata = new EntryMetadata(
                now,
                now,
                1,
                EntrySource.NETWORK,
                descriptor.pageKind(),
                descriptor.contentKind(),
                descriptor.hasUnsavedChanges());
        CacheEntry<T> entry = new CacheEntry<>(
                data, now, now.plus(ttl), priority, sizeEstimator.estimate(data), tagsFor(descriptor), false, metadata);

        volatileStore.set(key, entry);
        updateRecentRoutes(descriptor.route());
        publish(new CacheEvent.EntrySet(key, entry.tags()));
        return entry;
    }

    private CacheEntry<Object> promote(String key, CacheEntry<Object> entry) {
        CacheEntry<Object> rescored = rescore(entry);
        CacheEntry<Object> held = volatileStore.setIfNewer(key, rescored);
        if (held != rescored) {
            LOG.debugf("Not promoting %s: superseded while reading the durable tier", key);
            return held;
        }
        LOG.debugf("Promoted %s from durable tier", key);
        return rescored;
    }

    private <T> CacheEntry<T> rescore(CacheEntry<T> entry) {
        EntryMetadata metadata = entry.metadata();
        if (!settings.advancedPriority() || !metadata.hasClassification()) {
            return entry;
        }
        double priority = calculator.extendedPriority(
                metadata.pageKind(),
                metadata.contentKind(),
                metadata.accessCount(),
                metadata.lastAccessedAt(),
                priorityWeights);
        return entry.withPriority(priority);
    }

    private Set<String> tagsFor(PageDescriptor descriptor) {
        Set<String> tags = new LinkedHashSet<>();
        tags.add(RouteKeys.PAGE_TAG_PREFIX + descriptor.pageKind().id());
        tags.add(RouteKeys.CONTENT_TAG_PREFIX + descriptor.contentKind().id());
        tags.add(RouteKeys.routeTag(descriptor.route()));
        return tags;
    }

    private void updateRecentRoutes(String route) {
        synchronized (recentRoutes) {
            recentRoutes.remove(route);
            recentRoutes.addFirst(route);
            while (recentRoutes.size() > RECENT_ROUTE_LIMIT) {
                recentRoutes.removeLast();
            }
        }
    }

    private boolean isRecentRouteEntry(CacheEntry<?> entry) {
        List<String> recent = getRecentRoutes();
        return entry.tags().stream()
                .filter(tag -> tag.startsWith(RouteKeys.ROUTE_TAG_PREFIX))
                .map(tag -> tag.substring(RouteKeys.ROUTE_TAG_PREFIX.length()))
                .anyMatch(recent::contains);
    }

    private void adaptPriorityWeights() {
        if (!settings.adaptiveWeights()) {
            return;
        }
        CacheStats stats = volatileStore.getStats();
        if (stats.hitRate() < settings.minHitRateForAdaptation() && stats.entryCount() > MIN_ENTRIES_FOR_ADAPTATION) {
            PriorityWeights adapted = priorityWeights.favourFrequency();
            LOG.infof(
                    "Hit rate %.2f below %.2f, adapting weights to frequency=%.2f recency=%.2f",
                    stats.hitRate(),
                    settings.minHitRateForAdaptation(),
                    adapted.frequency(),
                    adapted.recency());
            updatePriorityWeights(adapted);
        }
    }

    private <R> Uni<R> withDurable(String operation, R fallback, Function<DurableStore, Uni<R>> action) {
        if (!durableEnabled) {
            return Uni.createFrom().item(fallback);
        }
        return durableStore
                .init()
                .onFailure()
                .invoke(this::disableDurable)
                .flatMap(ignored -> action.apply(durableStore))
                .onFailure()
                .recoverWithItem(error -> {
                    lastError.set(error);
                    LOG.errorf(error, "Durable cache %s failed, continuing with volatile tier", operation);
                    return fallback;
                });
    }

    private void disableDurable(Throwable error) {
        if (durableEnabled) {
            durableEnabled = false;
            lastError.set(error);
            LOG.errorf(error, "Durable cache tier disabled: initialization failed");
        }
    }

    private void publish(CacheEvent event) {
        eventPublisher
                .publish(event)
                .subscribe()
                .with(
                        ignored -> {},
                        error -> LOG.debugf("Failed to publish %s: %s", event.getClass().getSimpleName(), error.getMessage()));
    }
}
