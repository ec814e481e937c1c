package waypoint.core.model.cache;

/**
 * Storage usage reported by the hosting environment.
 *
 * @param usage bytes in use
 * @param quota bytes available in total
 */
public record StorageQuota(long usage, long quota) {

    public StorageQuota {
        if (usage < 0 || quota < 0) {
            throw new IllegalArgumentException("usage and quota must be non-negative");
        }
    }

    /**
     * Usage as a percentage of the quota, 0 when the quota is unknown.
     */
    public double percentage() {
        return quota == 0 ? 0.0 : (usage * 100.0) / quota;
    }
}
