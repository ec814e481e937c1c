package waypoint.adapter.out.storage.file;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import waypoint.core.model.cache.StorageQuota;
import waypoint.core.port.out.StorageQuotaEstimator;

/**
 * Reports the size of the entry files against a configured quota.
 */
public class FileStoreQuotaEstimator implements StorageQuotaEstimator {

    private final FileStorageEngine engine;
    private final long quotaBytes;

    public FileStoreQuotaEstimator(FileStorageEngine engine, long quotaBytes) {
        this.engine = engine;
        this.quotaBytes = quotaBytes;
    }

    @Override
    public Uni<Optional<StorageQuota>> estimate() {
        return engine.usedBytes().map(used -> Optional.of(new StorageQuota(used, quotaBytes)));
    }
}
