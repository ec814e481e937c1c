package waypoint.spi;

import java.util.Optional;

import waypoint.core.port.out.PersistentStorageEngine;
import waypoint.core.port.out.StorageQuotaEstimator;

/**
 * Service Provider Interface for durable tier storage engines.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}. Register a
 * provider in {@code META-INF/services/waypoint.spi.StorageEngineProvider}.
 *
 * <p>Selection:
 * <ol>
 *   <li>If {@code waypoint.storage.engine.provider} is set, that provider is used</li>
 *   <li>Otherwise the available provider with the highest {@link #priority()} wins</li>
 * </ol>
 */
public interface StorageEngineProvider {

    /**
     * Unique name identifying this provider.
     *
     * <p>Used in configuration: waypoint.storage.engine.provider={name}
     *
     * @return The provider name
     */
    String name();

    default String description() {
        return name() + " storage engine";
    }

    /**
     * Priority for auto-selection when no explicit provider is configured.
     *
     * <p>Built-in providers use:
     * <ul>
     *   <li>memory: 0 (fallback default)</li>
     *   <li>file: 5</li>
     *   <li>redis: 10</li>
     * </ul>
     *
     * @return The provider priority, higher wins
     */
    default int priority() {
        return 0;
    }

    /**
     * Check if this provider can be used (dependencies present, etc.).
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Create the engine. Called once at startup.
     *
     * @param config Access to configuration properties
     * @return a thread-safe engine
     * @throws StorageProviderException if the engine cannot be created
     */
    PersistentStorageEngine createEngine(StorageAdapterConfig config);

    /**
     * Optionally provide a quota estimator for the storage behind this engine.
     *
     * @param config Access to configuration properties
     * @return estimator, or empty if the backend cannot report usage
     */
    default Optional<StorageQuotaEstimator> createQuotaEstimator(StorageAdapterConfig config) {
        return Optional.empty();
    }
}
