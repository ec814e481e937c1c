package waypoint.spi;

import java.time.Duration;
import java.util.Optional;

/**
 * Configuration access for storage engine providers.
 *
 * <p>Abstracts the configuration source so providers need no compile-time
 * dependency on the configuration framework.
 */
public interface StorageAdapterConfig {

    /**
     * Get an optional configuration value.
     *
     * @param key The configuration key
     * @return The value if present
     */
    Optional<String> get(String key);

    /**
     * Get a configuration value with default.
     *
     * @param key The configuration key
     * @param defaultValue Value returned when the key is absent
     * @return The value or default
     */
    default String getOrDefault(String key, String defaultValue) {
        return get(key).orElse(defaultValue);
    }

    Optional<Long> getLong(String key);

    /**
     * Get an ISO-8601 duration value (e.g. "PT5S").
     */
    Optional<Duration> getDuration(String key);
}
