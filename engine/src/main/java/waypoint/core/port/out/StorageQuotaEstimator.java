package waypoint.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import waypoint.core.model.cache.StorageQuota;

/**
 * Reports how much storage the hosting environment has used and has available.
 */
@FunctionalInterface
public interface StorageQuotaEstimator {

    /**
     * Estimates current storage usage.
     *
     * @return Uni with the estimate, or empty when the environment cannot tell
     */
    Uni<Optional<StorageQuota>> estimate();

    static StorageQuotaEstimator unsupported() {
        return () -> Uni.createFrom().item(Optional.empty());
    }
}
