package waypoint.adapter.out.storage.file;

import java.nio.file.Path;
import java.util.Optional;

import waypoint.core.port.out.PersistentStorageEngine;
import waypoint.core.port.out.StorageQuotaEstimator;
import waypoint.spi.StorageAdapterConfig;
import waypoint.spi.StorageEngineProvider;

/**
 * File system storage engine provider.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>waypoint.storage.file.directory - directory holding entries (default: ${java.io.tmpdir}/waypoint-cache)</li>
 *   <li>waypoint.storage.file.quota-bytes - quota reported for usage checks (default: 100 MiB)</li>
 * </ul>
 */
public class FileStorageEngineProvider implements StorageEngineProvider {

    static final long DEFAULT_QUOTA_BYTES = 100L * 1024 * 1024;

    private FileStorageEngine engine;

    @Override
    public String name() {
        return "file";
    }

    @Override
    public String description() {
        return "File system storage (one file per entry)";
    }

    @Override
    public int priority() {
        return 5;
    }

    @Override
    public PersistentStorageEngine createEngine(StorageAdapterConfig config) {
        engine = new FileStorageEngine(directory(config));
        return engine;
    }

    @Override
    public Optional<StorageQuotaEstimator> createQuotaEstimator(StorageAdapterConfig config) {
        if (engine == null) {
            engine = new FileStorageEngine(directory(config));
        }
        long quota = config.getLong("waypoint.storage.file.quota-bytes").orElse(DEFAULT_QUOTA_BYTES);
        return Optional.of(new FileStoreQuotaEstimator(engine, quota));
    }

    private static Path directory(StorageAdapterConfig config) {
        return config.get("waypoint.storage.file.directory")
                .map(Path::of)
                .orElseGet(() -> Path.of(System.getProperty("java.io.tmpdir"), "waypoint-cache"));
    }
}
