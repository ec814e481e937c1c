package waypoint.core.service;

import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.subscription.Cancellable;
import org.jboss.logging.Logger;

import waypoint.core.model.cache.CacheEntry;
import waypoint.core.model.cache.CacheEvent;
import waypoint.core.model.navigation.PageDescriptor;
import waypoint.core.port.out.CacheEventPublisher;

/**
 * The page cache components of one application, created once and passed to
 * whatever needs them.
 *
 * <p>Also owns the subscriber notification path: direct writes through
 * {@link #setCacheEntry}, successful background refreshes and {@link CacheEvent.Updated}
 * events arriving from other contexts all notify subscribers of the key.
 *
 * <p>Helper operations never fail; errors are kept as {@link #lastError()}.
 */
public class PageCacheContext implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(PageCacheContext.class);

    private final CacheOrchestrator orchestrator;
    private final StateManager stateManager;
    private final NavigationGuard navigationGuard;
    private final BackgroundRefreshManager refreshManager;
    private final UpdateNotifier notifier;
    private final CacheEventPublisher eventPublisher;

    private final AtomicReference<Throwable> lastError = new AtomicReference<>();
    private Cancellable eventSubscription;

    public PageCacheContext(
            CacheOrchestrator orchestrator,
            StateManager stateManager,
            NavigationGuard navigationGuard,
            BackgroundRefreshManager refreshManager,
            UpdateNotifier notifier,
            CacheEventPublisher eventPublisher) {
        this.orchestrator = orchestrator;
        this.stateManager = stateManager;
        this.navigationGuard = navigationGuard;
        this.refreshManager = refreshManager;
        this.notifier = notifier;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Initializes the cache tiers and starts relaying update events from other contexts.
     */
    public synchronized Uni<Void> start() {
        if (eventSubscription == null) {
            eventSubscription = eventPublisher
                    .subscribe()
                    .subscribe()
                    .with(this::onEvent, error -> LOG.warnf("Cache event channel failed: %s", error.getMessage()));
        }
        return orchestrator.initialize();
    }

    public CacheOrchestrator cacheOrchestrator() {
        return orchestrator;
    }

    public StateManager stateManager() {
        return stateManager;
    }

    public NavigationGuard navigationGuard() {
        return navigationGuard;
    }

    public BackgroundRefreshManager refreshManager() {
        return refreshManager;
    }

    public <T> Uni<Optional<CacheEntry<T>>> getCacheEntry(String key) {
        return orchestrator.<T>get(key).onFailure().recoverWithItem(error -> {
            recordError("read " + key, error);
            return Optional.empty();
        });
    }

    /**
     * Caches data and notifies subscribers of the key.
     */
    public <T> Uni<Void> setCacheEntry(String key, T data, PageDescriptor descriptor) {
        return orchestrator
                .set(key, data, descriptor)
                .invoke(() -> notifier.notifySubscribers(key, data))
                .onFailure()
                .recoverWithUni(error -> {
                    recordError("write " + key, error);
                    return Uni.createFrom().voidItem();
                });
    }

    public Uni<Void> invalidateCache(String key) {
        return orchestrator.invalidate(key).onFailure().recoverWithUni(error -> {
            recordError("invalidate " + key, error);
            return Uni.createFrom().voidItem();
        });
    }

    public Uni<Void> invalidateCache(Collection<String> tags) {
        return orchestrator.invalidateTags(tags).onFailure().recoverWithUni(error -> {
            recordError("invalidate tags " + tags, error);
            return Uni.createFrom().voidItem();
        });
    }

    /**
     * Subscribes to fresh data for a key.
     *
     * @return handle that removes the subscription
     */
    public Cancellable subscribeToUpdates(String key, Consumer<Object> callback) {
        return notifier.subscribe(key, callback);
    }

    /**
     * The most recent error of this context or of the cache tiers.
     */
    public Optional<Throwable> lastError() {
        Throwable own = lastError.get();
        return own != null ? Optional.of(own) : orchestrator.lastError();
    }

    public void clearError() {
        lastError.set(null);
        orchestrator.clearError();
    }

    @Override
    public synchronized void close() {
        if (eventSubscription != null) {
            eventSubscription.cancel();
            eventSubscription = null;
        }
        refreshManager.shutdown();
        notifier.clear();
    }

    private void onEvent(CacheEvent event) {
        if (event instanceof CacheEvent.Updated updated) {
            LOG.debugf("Received update for %s from another context", updated.key());
            notifier.notifySubscribers(updated.key(), updated.data());
        }
    }

    private void recordError(String operation, Throwable error) {
        lastError.set(error);
        LOG.errorf(error, "Page cache failed to %s", operation);
    }
}
