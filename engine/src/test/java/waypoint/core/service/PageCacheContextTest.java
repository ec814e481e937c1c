package waypoint.core.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static waypoint.support.TestObjects.TIMEOUT;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import waypoint.adapter.out.storage.memory.InMemoryStorageEngine;
import waypoint.adapter.out.surface.HeadlessRenderingSurface;
import waypoint.adapter.out.sync.InMemoryCacheEventPublisher;
import waypoint.core.cache.DurableStore;
import waypoint.core.cache.EntryCodec;
import waypoint.core.cache.PriorityCalculator;
import waypoint.core.cache.SizeEstimator;
import waypoint.core.cache.VolatileStore;
import waypoint.core.config.CacheSettings;
import waypoint.core.config.RefreshSettings;
import waypoint.core.model.cache.CacheEvent;
import waypoint.core.model.navigation.PageDescriptor;
import waypoint.core.port.out.StorageQuotaEstimator;
import waypoint.support.TestNavigationConfig;
import waypoint.support.TestObjects;

@DisplayName("PageCacheContext")
class PageCacheContextTest {

    private InMemoryCacheEventPublisher publisher;
    private UpdateNotifier notifier;
    private PageCacheContext context;

    @BeforeEach
    void setUp() {
        var settings = CacheSettings.defaults();
        var calculator = new PriorityCalculator(Clock.systemUTC());
        var mapper = TestObjects.objectMapper();
        publisher = new InMemoryCacheEventPublisher();
        notifier = new UpdateNotifier();
        var orchestrator = new CacheOrchestrator(
                settings,
                new VolatileStore(settings, calculator),
                new DurableStore(new InMemoryStorageEngine(), new EntryCodec(mapper), calculator),
                calculator,
                new SizeEstimator(mapper),
                StorageQuotaEstimator.unsupported(),
                publisher);
        context = create(orchestrator);
        context.start().await().atMost(TIMEOUT);
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    private PageCacheContext create(CacheOrchestrator orchestrator) {
        var stateManager = new StateManager(new HeadlessRenderingSurface(), 10);
        var refreshManager = new BackgroundRefreshManager(orchestrator, notifier, RefreshSettings.defaults());
        var guard = new NavigationGuard(orchestrator, stateManager, refreshManager, TestNavigationConfig.defaults());
        return new PageCacheContext(orchestrator, stateManager, guard, refreshManager, notifier, publisher);
    }

    @Nested
    @DisplayName("Cache helpers")
    class HelperTests {

        @Test
        @DisplayName("Should cache data and notify subscribers")
        void shouldSetAndNotify() {
            List<Object> received = new ArrayList<>();
            context.subscribeToUpdates("page:/home", received::add);

            context.setCacheEntry("page:/home", "welcome", PageDescriptor.of("/home", null, null))
                    .await()
                    .atMost(TIMEOUT);

            assertEquals(List.of("welcome"), received);
            assertEquals(
                    "welcome",
                    context.<String>getCacheEntry("page:/home")
                            .await()
                            .atMost(TIMEOUT)
                            .orElseThrow()
                            .data());
        }

        @Test
        @DisplayName("Should invalidate by key and by tag")
        void shouldInvalidate() {
            context.setCacheEntry("page:/a", "a", PageDescriptor.of("/a", null, null)).await().atMost(TIMEOUT);
            context.setCacheEntry("page:/b", "b", PageDescriptor.of("/b", null, null)).await().atMost(TIMEOUT);

            context.invalidateCache("page:/a").await().atMost(TIMEOUT);
            context.invalidateCache(Set.of("route:/b")).await().atMost(TIMEOUT);

            assertTrue(context.getCacheEntry("page:/a").await().atMost(TIMEOUT).isEmpty());
            assertTrue(context.getCacheEntry("page:/b").await().atMost(TIMEOUT).isEmpty());
        }

        @Test
        @DisplayName("Should relay updates published by other contexts")
        void shouldRelayRemoteUpdates() {
            List<Object> received = new ArrayList<>();
            context.subscribeToUpdates("page:/home", received::add);

            publisher.publish(new CacheEvent.Updated("page:/home", "remote")).await().atMost(TIMEOUT);

            assertEquals(List.of("remote"), received);
        }
    }

    @Nested
    @DisplayName("Errors")
    class ErrorTests {

        @Test
        @DisplayName("Should record read failures instead of propagating them")
        void shouldRecordReadFailures() {
            var failing = mock(CacheOrchestrator.class);
            when(failing.get("page:/home")).thenReturn(Uni.createFrom().failure(new IllegalStateException("boom")));
            when(failing.lastError()).thenReturn(Optional.empty());
            var failingContext = create(failing);

            var result = failingContext.getCacheEntry("page:/home").await().atMost(TIMEOUT);

            assertTrue(result.isEmpty());
            assertInstanceOf(IllegalStateException.class, failingContext.lastError().orElseThrow());

            failingContext.clearError();
            assertTrue(failingContext.lastError().isEmpty());
            failingContext.close();
        }
    }
}
