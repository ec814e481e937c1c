package waypoint.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for background refresh.
 *
 * <p>Configuration prefix: {@code waypoint.refresh}
 *
 * <p>Retry delay for attempt {@code n} (1-based retry count) is
 * {@code min(initialRetryDelay * 2^(n-1), maxRetryDelay)}.
 */
@ConfigMapping(prefix = "waypoint.refresh")
public interface RefreshConfig {

    /**
     * Total attempts per refresh, including the first.
     *
     * @return attempts (default: 3)
     */
    @WithDefault("3")
    int maxRetries();

    @WithDefault("PT1S")
    Duration initialRetryDelay();

    @WithDefault("PT30S")
    Duration maxRetryDelay();

    /**
     * Grace period after interaction ends before deferred refreshes run.
     *
     * @return delay (default: 2 seconds)
     */
    @WithDefault("PT2S")
    Duration interactionDeferDelay();

    /**
     * Master switch; when false scheduled refreshes are ignored.
     *
     * @return true to allow refreshes (default: true)
     */
    @WithDefault("true")
    boolean enableAutoRefresh();
}
