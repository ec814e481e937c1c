package waypoint.config;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Default;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.arc.DefaultBean;
import org.jboss.logging.Logger;

import waypoint.adapter.out.surface.HeadlessRenderingSurface;
import waypoint.adapter.out.sync.InMemoryCacheEventPublisher;
import waypoint.core.cache.DurableStore;
import waypoint.core.cache.EntryCodec;
import waypoint.core.cache.PriorityCalculator;
import waypoint.core.cache.SizeEstimator;
import waypoint.core.cache.VolatileStore;
import waypoint.core.config.CacheSettings;
import waypoint.core.config.NavigationConfig;
import waypoint.core.config.PageCacheConfig;
import waypoint.core.config.RefreshConfig;
import waypoint.core.config.RefreshSettings;
import waypoint.core.config.StateConfig;
import waypoint.core.port.out.CacheEventPublisher;
import waypoint.core.port.out.PersistentStorageEngine;
import waypoint.core.port.out.RenderingSurface;
import waypoint.core.port.out.StorageQuotaEstimator;
import waypoint.core.service.BackgroundRefreshManager;
import waypoint.core.service.CacheOrchestrator;
import waypoint.core.service.NavigationGuard;
import waypoint.core.service.PageCacheContext;
import waypoint.core.service.StateManager;
import waypoint.core.service.UpdateNotifier;

/**
 * Wires the page cache components from configuration.
 *
 * <p>The rendering surface, event channel and clock are default beans; an
 * application replaces them by producing its own.
 */
@ApplicationScoped
public class PageCacheProducer {

    private static final Logger LOG = Logger.getLogger(PageCacheProducer.class);

    @Produces
    @Singleton
    @DefaultBean
    @Default
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Produces
    @Singleton
    @DefaultBean
    @Default
    public RenderingSurface renderingSurface() {
        return new HeadlessRenderingSurface();
    }

    @Produces
    @Singleton
    @DefaultBean
    @Default
    public CacheEventPublisher cacheEventPublisher() {
        return new InMemoryCacheEventPublisher();
    }

    @Produces
    @Singleton
    public CacheSettings cacheSettings(PageCacheConfig config) {
        return CacheSettings.from(config);
    }

    @Produces
    @ApplicationScoped
    public PriorityCalculator priorityCalculator(Clock clock) {
        return new PriorityCalculator(clock);
    }

    @Produces
    @ApplicationScoped
    public CacheOrchestrator cacheOrchestrator(
            CacheSettings settings,
            PriorityCalculator calculator,
            ObjectMapper objectMapper,
            PersistentStorageEngine engine,
            StorageQuotaEstimator quotaEstimator,
            CacheEventPublisher eventPublisher) {
        VolatileStore volatileStore = new VolatileStore(settings, calculator);
        DurableStore durableStore = settings.enablePersistence()
                ? new DurableStore(engine, new EntryCodec(objectMapper), calculator)
                : null;
        LOG.infof(
                "Page cache configured: volatile budget %d bytes, durable budget %d bytes, persistence %s",
                settings.maxVolatileBytes(),
                settings.maxDurableBytes(),
                settings.enablePersistence() ? "enabled" : "disabled");
        return new CacheOrchestrator(
                settings,
                volatileStore,
                durableStore,
                calculator,
                new SizeEstimator(objectMapper),
                quotaEstimator,
                eventPublisher);
    }

    @Produces
    @ApplicationScoped
    public UpdateNotifier updateNotifier() {
        return new UpdateNotifier();
    }

    @Produces
    @ApplicationScoped
    public StateManager stateManager(RenderingSurface surface, StateConfig config) {
        return new StateManager(surface, config);
    }

    @Produces
    @ApplicationScoped
    public BackgroundRefreshManager backgroundRefreshManager(
            CacheOrchestrator orchestrator, UpdateNotifier notifier, RefreshConfig config) {
        return new BackgroundRefreshManager(orchestrator, notifier, RefreshSettings.from(config));
    }

    void shutdownRefreshManager(@Disposes BackgroundRefreshManager refreshManager) {
        refreshManager.shutdown();
    }

    @Produces
    @ApplicationScoped
    public NavigationGuard navigationGuard(
            CacheOrchestrator orchestrator,
            StateManager stateManager,
            BackgroundRefreshManager refreshManager,
            NavigationConfig config) {
        return new NavigationGuard(orchestrator, stateManager, refreshManager, config);
    }

    @Produces
    @ApplicationScoped
    public PageCacheContext pageCacheContext(
            CacheOrchestrator orchestrator,
            StateManager stateManager,
            NavigationGuard navigationGuard,
            BackgroundRefreshManager refreshManager,
            UpdateNotifier notifier,
            CacheEventPublisher eventPublisher) {
        return new PageCacheContext(
                orchestrator, stateManager, navigationGuard, refreshManager, notifier, eventPublisher);
    }

    void closeContext(@Disposes PageCacheContext context) {
        context.close();
    }
}
