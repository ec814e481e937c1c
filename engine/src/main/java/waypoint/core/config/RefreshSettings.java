package waypoint.core.config;

import java.time.Duration;

/**
 * Validated background refresh settings.
 *
 * @param maxRetries total attempts including the first, at least 1
 * @param initialRetryDelay delay before the first retry
 * @param maxRetryDelay upper bound on any retry delay, never below {@code initialRetryDelay}
 * @param interactionDeferDelay grace period after interaction ends
 * @param enableAutoRefresh whether refreshes run at all
 */
public record RefreshSettings(
        int maxRetries,
        Duration initialRetryDelay,
        Duration maxRetryDelay,
        Duration interactionDeferDelay,
        boolean enableAutoRefresh) {

    public RefreshSettings {
        maxRetries = Math.max(1, maxRetries);
        initialRetryDelay = nonNegative(initialRetryDelay);
        maxRetryDelay = nonNegative(maxRetryDelay);
        if (maxRetryDelay.compareTo(initialRetryDelay) < 0) {
            maxRetryDelay = initialRetryDelay;
        }
        interactionDeferDelay = nonNegative(interactionDeferDelay);
    }

    public static RefreshSettings from(RefreshConfig config) {
        return new RefreshSettings(
                config.maxRetries(),
                config.initialRetryDelay(),
                config.maxRetryDelay(),
                config.interactionDeferDelay(),
                config.enableAutoRefresh());
    }

    public static RefreshSettings defaults() {
        return new RefreshSettings(3, Duration.ofSeconds(1), Duration.ofSeconds(30), Duration.ofSeconds(2), true);
    }

    /**
     * Delay before the given retry.
     *
     * @param retryCount number of failed attempts so far, starting at 1
     * @return {@code min(initialRetryDelay * 2^(retryCount-1), maxRetryDelay)}
     */
    public Duration retryDelay(int retryCount) {
        int exponent = Math.max(0, Math.min(retryCount - 1, 30));
        long millis = initialRetryDelay.toMillis() * (1L << exponent);
        if (millis < 0 || millis > maxRetryDelay.toMillis()) {
            return maxRetryDelay;
        }
        return Duration.ofMillis(millis);
    }

    private static Duration nonNegative(Duration value) {
        return value == null || value.isNegative() ? Duration.ZERO : value;
    }
}
