package waypoint.core.config;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CacheSettings")
class CacheSettingsTest {

    private static CacheSettings settings(long volatileBytes, double frequency, double recency, double pressure) {
        return new CacheSettings(
                volatileBytes,
                CacheSettings.DEFAULT_DURABLE_BYTES,
                Duration.ofMinutes(5),
                Duration.ofMinutes(30),
                true,
                frequency,
                recency,
                0.3,
                50,
                true,
                true,
                pressure);
    }

    @Test
    @DisplayName("Should raise byte budgets to the minimum")
    void shouldRaiseBudgets() {
        var settings = settings(10, 0.6, 0.4, 90);

        assertEquals(CacheSettings.MIN_BYTES, settings.maxVolatileBytes());
    }

    @Test
    @DisplayName("Should reset weights whose sum is out of range")
    void shouldResetInvalidWeights() {
        var zero = settings(CacheSettings.DEFAULT_VOLATILE_BYTES, 0, 0, 90);

        assertEquals(CacheSettings.DEFAULT_FREQUENCY_WEIGHT, zero.frequencyWeight());
        assertEquals(CacheSettings.DEFAULT_RECENCY_WEIGHT, zero.recencyWeight());
    }

    @Test
    @DisplayName("Should clamp individual weights into the unit range")
    void shouldClampWeights() {
        var settings = settings(CacheSettings.DEFAULT_VOLATILE_BYTES, 1.5, -0.2, 90);

        assertEquals(1.0, settings.frequencyWeight());
        assertEquals(0.0, settings.recencyWeight());
    }

    @Test
    @DisplayName("Should keep stale TTL at or above the default TTL")
    void shouldKeepStaleTtlAboveDefaultTtl() {
        var settings = new CacheSettings(
                CacheSettings.DEFAULT_VOLATILE_BYTES,
                CacheSettings.DEFAULT_DURABLE_BYTES,
                Duration.ofMinutes(10),
                Duration.ofMinutes(1),
                true,
                0.6,
                0.4,
                0.3,
                50,
                true,
                true,
                90);

        assertEquals(Duration.ofMinutes(10), settings.staleTtl());
    }

    @Test
    @DisplayName("Should clamp quota pressure percentage")
    void shouldClampQuotaPressure() {
        assertEquals(1.0, settings(CacheSettings.DEFAULT_VOLATILE_BYTES, 0.6, 0.4, 0).quotaPressurePercentage());
        assertEquals(100.0, settings(CacheSettings.DEFAULT_VOLATILE_BYTES, 0.6, 0.4, 300).quotaPressurePercentage());
    }
}
