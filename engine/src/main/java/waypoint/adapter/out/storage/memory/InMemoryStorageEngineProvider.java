package waypoint.adapter.out.storage.memory;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import waypoint.core.model.cache.StorageQuota;
import waypoint.core.port.out.PersistentStorageEngine;
import waypoint.core.port.out.StorageQuotaEstimator;
import waypoint.spi.StorageAdapterConfig;
import waypoint.spi.StorageEngineProvider;

/**
 * Default in-memory storage engine provider.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>waypoint.storage.memory.quota-bytes - quota reported for usage checks (default: 50 MiB)</li>
 * </ul>
 */
public class InMemoryStorageEngineProvider implements StorageEngineProvider {

    static final long DEFAULT_QUOTA_BYTES = 50L * 1024 * 1024;

    private InMemoryStorageEngine engine;

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public String description() {
        return "In-memory storage (non-persistent)";
    }

    @Override
    public int priority() {
        return 0; // Lowest priority - only used if nothing else available
    }

    @Override
    public PersistentStorageEngine createEngine(StorageAdapterConfig config) {
        engine = new InMemoryStorageEngine();
        return engine;
    }

    @Override
    public Optional<StorageQuotaEstimator> createQuotaEstimator(StorageAdapterConfig config) {
        long quota = config.getLong("waypoint.storage.memory.quota-bytes").orElse(DEFAULT_QUOTA_BYTES);
        return Optional.of(() -> Uni.createFrom()
                .item(() -> engine == null
                        ? Optional.<StorageQuota>empty()
                        : Optional.of(new StorageQuota(engine.usedBytes(), quota))));
    }
}
