package waypoint.core.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static waypoint.support.TestObjects.entry;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import waypoint.core.config.CacheSettings;
import waypoint.core.model.cache.CacheEntry;
import waypoint.support.MutableClock;

@DisplayName("VolatileStore")
class VolatileStoreTest {

    private static final long BUDGET = CacheSettings.MIN_BYTES;
    private static final long ENTRY_BYTES = 250_000;

    private MutableClock clock;
    private VolatileStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpochDay();
        store = new VolatileStore(CacheSettings.defaults().withMaxVolatileBytes(BUDGET), new PriorityCalculator(clock));
    }

    @Nested
    @DisplayName("Lookup")
    class LookupTests {

        @Test
        @DisplayName("Should record access on hit")
        void shouldRecordAccess() {
            store.set("page:/home", entry(clock.instant(), 10, 100));
            clock.advance(Duration.ofSeconds(30));

            CacheEntry<Object> hit = store.<Object>get("page:/home").orElseThrow();

            assertEquals(2, hit.metadata().accessCount());
            assertEquals(clock.instant(), hit.metadata().lastAccessedAt());
            assertTrue(hit.priority() > 10);
            assertEquals(1, store.getStats().hits());
        }

        @Test
        @DisplayName("Should count unknown keys as misses")
        void shouldCountMisses() {
            assertTrue(store.get("page:/missing").isEmpty());
            assertEquals(1, store.getStats().misses());
        }

        @Test
        @DisplayName("Should keep expired entries but only serve them when expiry is ignored")
        void shouldRetainExpiredEntries() {
            store.set("page:/home", entry(clock.instant(), 10, 100));
            clock.advance(Duration.ofMinutes(6));

            assertTrue(store.get("page:/home").isEmpty());
            assertTrue(store.has("page:/home"));
            assertTrue(store.get("page:/home", true).isPresent());
        }

        @Test
        @DisplayName("Should not record access on peek")
        void shouldNotRecordAccessOnPeek() {
            store.set("page:/home", entry(clock.instant(), 10, 100));

            store.peek("page:/home");

            assertEquals(0, store.getStats().hits());
        }
    }

    @Nested
    @DisplayName("Eviction")
    class EvictionTests {

        @Test
        @DisplayName("Should evict lowest priority entries when over budget")
        void shouldEvictLowestPriority() {
            store.set("a", entry(clock.instant(), 10, ENTRY_BYTES));
            store.set("b", entry(clock.instant(), 20, ENTRY_BYTES));
            store.set("c", entry(clock.instant(), 30, ENTRY_BYTES));
            store.set("d", entry(clock.instant(), 40, ENTRY_BYTES));
            store.set("e", entry(clock.instant(), 50, ENTRY_BYTES));

            assertFalse(store.has("a"));
            assertFalse(store.has("b"));
            assertTrue(store.has("c"));
            assertTrue(store.has("e"));
            assertTrue(store.getTotalBytes() <= (long) (BUDGET * VolatileStore.CLEANUP_TARGET_RATIO));
            assertEquals(2, store.getStats().evictions());
        }

        @Test
        @DisplayName("Should break priority ties by least recent access")
        void shouldBreakTiesByRecency() {
            store.set("older", entry(clock.instant(), 30, ENTRY_BYTES));
            clock.advance(Duration.ofSeconds(1));
            store.set("newer", entry(clock.instant(), 30, ENTRY_BYTES));

            store.evictToTarget(ENTRY_BYTES, entry -> false);

            assertFalse(store.has("older"));
            assertTrue(store.has("newer"));
        }

        @Test
        @DisplayName("Should never evict critical entries even when over budget")
        void shouldProtectCriticalEntries() {
            for (int i = 0; i < 5; i++) {
                store.set("critical-" + i, entry(clock.instant(), 90, ENTRY_BYTES));
            }

            assertEquals(5, store.getSize());
            assertTrue(store.getTotalBytes() > BUDGET);
            assertEquals(0, store.getStats().evictions());
        }

        @Test
        @DisplayName("Should never evict entries with unsaved changes")
        void shouldProtectUnsavedChanges() {
            CacheEntry<Object> draft = entry(clock.instant(), 1, ENTRY_BYTES);
            store.set("draft", draft.withMetadata(draft.metadata().withUnsavedChanges(true)));
            store.set("b", entry(clock.instant(), 20, ENTRY_BYTES));
            store.set("c", entry(clock.instant(), 30, ENTRY_BYTES));
            store.set("d", entry(clock.instant(), 40, ENTRY_BYTES));
            store.set("e", entry(clock.instant(), 50, ENTRY_BYTES));

            assertTrue(store.has("draft"));
            assertFalse(store.has("b"));
        }

        @Test
        @DisplayName("Should skip pinned entries")
        void shouldSkipPinnedEntries() {
            store.set("pinned", entry(clock.instant(), 1, ENTRY_BYTES, "route:/inbox"));
            store.set("loose", entry(clock.instant(), 50, ENTRY_BYTES, "route:/other"));

            int evicted = store.evictToTarget(0, e -> e.tags().contains("route:/inbox"));

            assertEquals(1, evicted);
            assertTrue(store.has("pinned"));
        }

        @Test
        @DisplayName("Should evict when the budget shrinks")
        void shouldEvictWhenBudgetShrinks() {
            var roomy = new VolatileStore(CacheSettings.defaults(), new PriorityCalculator(clock));
            for (int i = 0; i < 8; i++) {
                roomy.set("k" + i, entry(clock.instant(), 10 + i, ENTRY_BYTES));
            }

            roomy.updateSettings(roomy.settings().withMaxVolatileBytes(BUDGET));

            assertTrue(roomy.getTotalBytes() <= BUDGET);
        }

        @Test
        @DisplayName("Should count re-admission shortly after eviction as thrashing")
        void shouldDetectThrashing() {
            store.set("a", entry(clock.instant(), 10, ENTRY_BYTES));
            store.evictToTarget(0, e -> false);
            clock.advance(Duration.ofSeconds(10));
            store.set("a", entry(clock.instant(), 10, ENTRY_BYTES));

            store.evictToTarget(0, e -> false);
            clock.advance(Duration.ofMinutes(2));
            store.set("a", entry(clock.instant(), 10, ENTRY_BYTES));

            assertEquals(1, store.getStats().thrashingEvents());
        }
    }

    @Nested
    @DisplayName("Tags")
    class TagTests {

        @Test
        @DisplayName("Should invalidate every entry carrying a tag")
        void shouldInvalidateByTag() {
            store.set("page:/dashboard", entry(clock.instant(), 10, 100, "page:dashboard", "route:/dashboard"));
            store.set("page:/profile", entry(clock.instant(), 10, 100, "page:profile", "route:/profile"));

            int removed = store.invalidateByTags(Set.of("page:dashboard"));

            assertEquals(1, removed);
            assertFalse(store.has("page:/dashboard"));
            assertTrue(store.has("page:/profile"));
            assertTrue(store.getEntriesByTag("page:dashboard").isEmpty());
        }

        @Test
        @DisplayName("Should be idempotent and ignore unknown tags")
        void shouldBeIdempotent() {
            store.set("page:/dashboard", entry(clock.instant(), 10, 100, "page:dashboard"));

            store.invalidateByTags(Set.of("page:dashboard"));

            assertEquals(0, store.invalidateByTags(Set.of("page:dashboard", "unknown")));
            assertEquals(0, store.getTotalBytes());
        }

        @Test
        @DisplayName("Should drop stale tag associations when a key is overwritten")
        void shouldReindexOnOverwrite() {
            store.set("k", entry(clock.instant(), 10, 100, "old"));
            store.set("k", entry(clock.instant(), 10, 100, "new"));

            assertTrue(store.getEntriesByTag("old").isEmpty());
            assertEquals(List.of("k"), store.getEntriesByTag("new"));
            assertEquals(100, store.getTotalBytes());
        }
    }

    @Nested
    @DisplayName("Maintenance")
    class MaintenanceTests {

        @Test
        @DisplayName("Should flag entries older than the stale TTL")
        void shouldMarkStaleEntries() {
            store.set("old", entry(clock.instant(), 10, 100));
            clock.advance(Duration.ofMinutes(31));
            store.set("fresh", entry(clock.instant(), 10, 100));

            List<String> stale = store.markStaleEntries();

            assertEquals(List.of("old"), stale);
            assertEquals(1, store.getStats().staleEntries());
        }

        @Test
        @DisplayName("Should remove expired entries")
        void shouldCleanupExpired() {
            store.set("old", entry(clock.instant(), 10, 100));
            clock.advance(Duration.ofMinutes(6));
            store.set("fresh", entry(clock.instant(), 10, 100));

            assertEquals(1, store.cleanupExpired());
            assertEquals(List.of("fresh"), store.getAllKeys());
        }
    }
}
