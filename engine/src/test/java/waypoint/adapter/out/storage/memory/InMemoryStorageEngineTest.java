package waypoint.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static waypoint.support.TestObjects.TIMEOUT;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import waypoint.core.model.cache.StorageQuota;
import waypoint.support.MapStorageAdapterConfig;

@DisplayName("InMemoryStorageEngine")
class InMemoryStorageEngineTest {

    private InMemoryStorageEngine engine;

    @BeforeEach
    void setUp() {
        engine = new InMemoryStorageEngine();
        engine.init().await().atMost(TIMEOUT);
    }

    @Nested
    @DisplayName("Key-value operations")
    class KeyValueTests {

        @Test
        @DisplayName("Should store and read values")
        void shouldStoreAndRead() {
            engine.set("page:/a", "{\"v\":1}").await().atMost(TIMEOUT);

            assertEquals(Optional.of("{\"v\":1}"), engine.get("page:/a").await().atMost(TIMEOUT));
            assertEquals(List.of("page:/a"), engine.keys().await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("Should return empty for unknown keys")
        void shouldReturnEmptyForUnknown() {
            assertTrue(engine.get("missing").await().atMost(TIMEOUT).isEmpty());
        }

        @Test
        @DisplayName("Should complete when deleting an absent key")
        void shouldDeleteAbsentKey() {
            engine.delete("missing").await().atMost(TIMEOUT);

            assertTrue(engine.keys().await().atMost(TIMEOUT).isEmpty());
        }

        @Test
        @DisplayName("Should clear every key")
        void shouldClear() {
            engine.set("a", "1").await().atMost(TIMEOUT);
            engine.set("b", "2").await().atMost(TIMEOUT);

            engine.clear().await().atMost(TIMEOUT);

            assertTrue(engine.keys().await().atMost(TIMEOUT).isEmpty());
            assertEquals(0, engine.usedBytes());
        }
    }

    @Nested
    @DisplayName("Provider")
    class ProviderTests {

        @Test
        @DisplayName("Should report usage of the created engine against the configured quota")
        void shouldReportQuota() {
            var provider = new InMemoryStorageEngineProvider();
            var config = new MapStorageAdapterConfig().with("waypoint.storage.memory.quota-bytes", "1000");
            var created = provider.createEngine(config);
            var estimator = provider.createQuotaEstimator(config).orElseThrow();

            created.set("ab", "cd").await().atMost(TIMEOUT);

            assertEquals(
                    Optional.of(new StorageQuota(8, 1000)),
                    estimator.estimate().await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("Should use the lowest priority")
        void shouldUseLowestPriority() {
            var provider = new InMemoryStorageEngineProvider();

            assertEquals("memory", provider.name());
            assertEquals(0, provider.priority());
        }
    }
}
