package waypoint.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for page state retention.
 *
 * <p>Configuration prefix: {@code waypoint.state}
 */
@ConfigMapping(prefix = "waypoint.state")
public interface StateConfig {

    /**
     * Number of routes whose state is retained before the least recently used is dropped.
     *
     * @return maximum retained routes (default: 10)
     */
    @WithDefault("10")
    int maxStates();
}
