package waypoint.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the two-tier page cache.
 *
 * <p>Configuration prefix: {@code waypoint.cache}
 *
 * <p>Values are not validated here. {@link CacheSettings#from(PageCacheConfig)} clamps
 * out-of-range values instead of failing startup.
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code WAYPOINT_CACHE_MAX_VOLATILE_BYTES} - e.g., "52428800"</li>
 *   <li>{@code WAYPOINT_CACHE_DEFAULT_TTL} - e.g., "PT5M"</li>
 *   <li>{@code WAYPOINT_CACHE_STALE_TTL} - e.g., "PT30M"</li>
 *   <li>{@code WAYPOINT_CACHE_ENABLE_PERSISTENCE} - "true" or "false"</li>
 * </ul>
 */
@ConfigMapping(prefix = "waypoint.cache")
public interface PageCacheConfig {

    /**
     * Byte budget of the in-memory tier.
     *
     * @return budget in bytes (default: 50 MiB)
     */
    @WithDefault("52428800")
    long maxVolatileBytes();

    /**
     * Byte budget of the persistent tier.
     *
     * @return budget in bytes (default: 100 MiB)
     */
    @WithDefault("104857600")
    long maxDurableBytes();

    /**
     * Freshness window of a newly cached entry.
     *
     * @return TTL (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration defaultTtl();

    /**
     * Age after which an entry is flagged for revalidation. Never below {@link #defaultTtl()}.
     *
     * @return stale TTL (default: 30 minutes)
     */
    @WithDefault("PT30M")
    Duration staleTtl();

    /**
     * Whether the persistent tier is used at all.
     *
     * @return true to enable persistence (default: true)
     */
    @WithDefault("true")
    boolean enablePersistence();

    PriorityWeights priorityWeights();

    /**
     * Hit rate under which priority weights are adapted towards frequency.
     *
     * @return rate in [0, 1] (default: 0.3)
     */
    @WithDefault("0.3")
    double minHitRateForAdaptation();

    /**
     * Number of thrashing events considered unhealthy.
     *
     * @return threshold (default: 50)
     */
    @WithDefault("50")
    int thrashingThreshold();

    /**
     * Whether page and content classification contribute to priority.
     *
     * <p>When disabled new entries receive a flat priority of 50.
     *
     * @return true to use classification (default: true)
     */
    @WithDefault("true")
    boolean advancedPriority();

    /**
     * Whether priority weights adapt to a poor hit rate during cleanup.
     *
     * @return true to adapt (default: true)
     */
    @WithDefault("true")
    boolean adaptiveWeights();

    /**
     * Storage usage percentage at which maintenance switches to pressure cleanup.
     *
     * @return percentage (default: 90)
     */
    @WithDefault("90")
    double quotaPressurePercentage();

    /**
     * Interval of the periodic maintenance job, in scheduler syntax.
     *
     * @return interval (default: 60s)
     */
    @WithDefault("60s")
    String maintenanceInterval();

    /**
     * Weights of the base priority formula.
     */
    interface PriorityWeights {

        @WithDefault("0.6")
        double frequency();

        @WithDefault("0.4")
        double recency();
    }
}
