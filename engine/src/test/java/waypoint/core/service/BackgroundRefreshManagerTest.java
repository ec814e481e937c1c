package waypoint.core.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import waypoint.adapter.out.sync.InMemoryCacheEventPublisher;
import waypoint.core.cache.PriorityCalculator;
import waypoint.core.cache.SizeEstimator;
import waypoint.core.cache.VolatileStore;
import waypoint.core.config.CacheSettings;
import waypoint.core.config.RefreshSettings;
import waypoint.core.model.cache.ContentKind;
import waypoint.core.model.cache.PageKind;
import waypoint.core.port.out.RefreshCallback;
import waypoint.core.port.out.StorageQuotaEstimator;
import waypoint.support.TestObjects;

@DisplayName("BackgroundRefreshManager")
class BackgroundRefreshManagerTest {

    private static final Duration INITIAL_DELAY = Duration.ofMillis(200);

    private CacheOrchestrator orchestrator;
    private UpdateNotifier notifier;
    private BackgroundRefreshManager manager;

    @BeforeEach
    void setUp() {
        var settings = CacheSettings.defaults().withPersistence(false);
        var calculator = new PriorityCalculator(Clock.systemUTC());
        orchestrator = new CacheOrchestrator(
                settings,
                new VolatileStore(settings, calculator),
                null,
                calculator,
                new SizeEstimator(TestObjects.objectMapper()),
                StorageQuotaEstimator.unsupported(),
                new InMemoryCacheEventPublisher());
        notifier = new UpdateNotifier();
        manager = create(true);
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    private BackgroundRefreshManager create(boolean autoRefresh) {
        return new BackgroundRefreshManager(
                orchestrator,
                notifier,
                new RefreshSettings(3, INITIAL_DELAY, Duration.ofSeconds(5), Duration.ofMillis(100), autoRefresh));
    }

    @Nested
    @DisplayName("Successful refresh")
    class SuccessTests {

        @Test
        @DisplayName("Should cache fresh data and notify subscribers")
        void shouldCacheAndNotify() throws InterruptedException {
            var delivered = new AtomicReference<Object>();
            var latch = new CountDownLatch(2);
            notifier.subscribe("page:/dashboard", data -> latch.countDown());

            boolean scheduled = manager.scheduleRefresh(
                    "/dashboard",
                    route -> Uni.createFrom().item("fresh"),
                    PageKind.DASHBOARD,
                    ContentKind.PERSONALIZED,
                    data -> {
                        delivered.set(data);
                        latch.countDown();
                    });

            assertTrue(scheduled);
            assertTrue(latch.await(2, TimeUnit.SECONDS));
            assertEquals("fresh", delivered.get());
            assertEquals("fresh", orchestrator.getSync("page:/dashboard").orElseThrow().data());
            assertFalse(manager.isRefreshScheduled("/dashboard"));
        }

        @Test
        @DisplayName("Should ignore schedule requests when auto refresh is disabled")
        void shouldIgnoreWhenDisabled() {
            var disabled = create(false);
            try {
                assertFalse(disabled.scheduleRefresh(
                        "/dashboard", route -> Uni.createFrom().item("fresh"), PageKind.DASHBOARD, ContentKind.GENERIC));
                assertFalse(disabled.isRefreshScheduled("/dashboard"));
            } finally {
                disabled.shutdown();
            }
        }
    }

    @Nested
    @DisplayName("Retries")
    class RetryTests {

        @Test
        @DisplayName("Should retry with exponential backoff and give up after max retries")
        void shouldBackOffExponentially() throws InterruptedException {
            List<Long> attempts = new CopyOnWriteArrayList<>();
            var latch = new CountDownLatch(3);
            RefreshCallback failing = route -> {
                attempts.add(System.nanoTime());
                latch.countDown();
                return Uni.createFrom().failure(new IllegalStateException("offline"));
            };

            manager.scheduleRefresh("/timetable", failing, PageKind.TIMETABLE, ContentKind.PERSONALIZED);

            assertTrue(latch.await(5, TimeUnit.SECONDS));
            Thread.sleep(INITIAL_DELAY.toMillis() * 5);

            assertEquals(3, attempts.size());
            long firstGap = attempts.get(1) - attempts.get(0);
            long secondGap = attempts.get(2) - attempts.get(1);
            assertTrue(firstGap >= TimeUnit.MILLISECONDS.toNanos(INITIAL_DELAY.toMillis()));
            assertTrue((double) secondGap / firstGap >= 1.5, "second gap should roughly double the first");
            assertFalse(manager.isRefreshScheduled("/timetable"));
        }

        @Test
        @DisplayName("Should treat a throwing callback as a failed attempt")
        void shouldHandleThrowingCallback() throws InterruptedException {
            var calls = new AtomicInteger();
            var latch = new CountDownLatch(1);
            RefreshCallback throwing = route -> {
                calls.incrementAndGet();
                latch.countDown();
                throw new IllegalStateException("boom");
            };

            manager.scheduleRefresh("/settings", throwing, PageKind.SETTINGS, ContentKind.GENERIC);

            assertTrue(latch.await(2, TimeUnit.SECONDS));
            Thread.sleep(50);
            assertEquals(1, manager.getRetryCount("/settings"));
        }
    }

    @Nested
    @DisplayName("Interaction gating")
    class InteractionTests {

        @Test
        @DisplayName("Should defer refreshes while the user is interacting")
        void shouldDeferWhileInteracting() throws InterruptedException {
            var calls = new AtomicInteger();
            var latch = new CountDownLatch(1);
            manager.setUserInteracting(true);

            manager.scheduleRefresh(
                    "/profile",
                    route -> {
                        calls.incrementAndGet();
                        latch.countDown();
                        return Uni.createFrom().item("fresh");
                    },
                    PageKind.PROFILE,
                    ContentKind.USER_GENERATED);

            Thread.sleep(200);
            assertEquals(0, calls.get());
            assertEquals(List.of("/profile"), manager.getDeferredRefreshes());
            assertTrue(manager.getStats().userInteracting());

            manager.setUserInteracting(false);

            assertTrue(latch.await(2, TimeUnit.SECONDS));
            assertTrue(manager.getDeferredRefreshes().isEmpty());
        }

        @Test
        @DisplayName("Should drop deferred refreshes when cancelled")
        void shouldCancelDeferred() {
            manager.setUserInteracting(true);
            manager.scheduleRefresh(
                    "/profile", route -> Uni.createFrom().item("fresh"), PageKind.PROFILE, ContentKind.GENERIC);

            manager.cancelRefresh("/profile");

            assertFalse(manager.isRefreshScheduled("/profile"));
            assertTrue(manager.getDeferredRefreshes().isEmpty());
        }

        @Test
        @DisplayName("Should not cache data fetched for a refresh cancelled before the fetch resolved")
        void shouldDropResultCancelledDuringFetch() throws InterruptedException {
            var fetched = new CountDownLatch(1);
            var updates = new AtomicInteger();

            manager.scheduleRefresh(
                    "/orders",
                    route -> {
                        manager.cancelRefresh(route);
                        fetched.countDown();
                        return Uni.createFrom().item("late");
                    },
                    PageKind.OTHER,
                    ContentKind.GENERIC,
                    data -> updates.incrementAndGet());

            assertTrue(fetched.await(2, TimeUnit.SECONDS));
            Thread.sleep(100);

            assertTrue(orchestrator.getSync("page:/orders").isEmpty());
            assertEquals(0, updates.get());
            assertFalse(manager.isRefreshScheduled("/orders"));
        }

        @Test
        @DisplayName("Should keep one task per route")
        void shouldReplaceExistingTask() {
            manager.setUserInteracting(true);
            manager.scheduleRefresh("/a", route -> Uni.createFrom().item("1"), PageKind.OTHER, ContentKind.GENERIC);
            manager.scheduleRefresh("/a", route -> Uni.createFrom().item("2"), PageKind.OTHER, ContentKind.GENERIC);

            assertEquals(1, manager.getStats().scheduledRefreshes());
            assertEquals(1, manager.getStats().deferredRefreshes());
        }
    }
}
