package waypoint.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for cache-first navigation.
 *
 * <p>Configuration prefix: {@code waypoint.navigation}
 */
@ConfigMapping(prefix = "waypoint.navigation")
public interface NavigationConfig {

    /**
     * Age after which a served entry triggers a background refresh.
     *
     * @return threshold (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration staleThreshold();

    @WithDefault("true")
    boolean enableBackgroundRefresh();

    /**
     * Lookup time above which a cache hit is logged as slow.
     *
     * @return budget (default: 50 milliseconds)
     */
    @WithDefault("PT0.05S")
    Duration maxCacheLookupTime();
}
