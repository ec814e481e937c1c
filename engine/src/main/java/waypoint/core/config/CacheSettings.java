package waypoint.core.config;

import java.time.Duration;

import org.jboss.logging.Logger;

/**
 * Validated cache settings.
 *
 * <p>Invalid input is clamped or reset to defaults, never rejected.
 *
 * @param maxVolatileBytes in-memory byte budget, at least 1 MiB
 * @param maxDurableBytes persistent byte budget, at least 1 MiB
 * @param defaultTtl freshness window, at least 1 second
 * @param staleTtl revalidation window, never below {@code defaultTtl}
 * @param enablePersistence whether the persistent tier is used
 * @param frequencyWeight base formula frequency weight in [0, 1]
 * @param recencyWeight base formula recency weight in [0, 1]
 * @param minHitRateForAdaptation hit rate in [0, 1]
 * @param thrashingThreshold non-negative event count
 * @param advancedPriority whether classification contributes to priority
 * @param adaptiveWeights whether weights adapt during cleanup
 * @param quotaPressurePercentage storage usage percentage in [1, 100] that triggers pressure cleanup
 */
public record CacheSettings(
        long maxVolatileBytes,
        long maxDurableBytes,
        Duration defaultTtl,
        Duration staleTtl,
        boolean enablePersistence,
        double frequencyWeight,
        double recencyWeight,
        double minHitRateForAdaptation,
        int thrashingThreshold,
        boolean advancedPriority,
        boolean adaptiveWeights,
        double quotaPressurePercentage) {

    private static final Logger LOG = Logger.getLogger(CacheSettings.class);

    public static final long MIN_BYTES = 1024L * 1024L;
    public static final long DEFAULT_VOLATILE_BYTES = 50L * 1024L * 1024L;
    public static final long DEFAULT_DURABLE_BYTES = 100L * 1024L * 1024L;
    public static final Duration MIN_TTL = Duration.ofSeconds(1);
    public static final double DEFAULT_FREQUENCY_WEIGHT = 0.6;
    public static final double DEFAULT_RECENCY_WEIGHT = 0.4;

    public CacheSettings {
        if (maxVolatileBytes < MIN_BYTES) {
            LOG.warnf("maxVolatileBytes %d below minimum, using %d", maxVolatileBytes, MIN_BYTES);
            maxVolatileBytes = MIN_BYTES;
        }
        if (maxDurableBytes < MIN_BYTES) {
            LOG.warnf("maxDurableBytes %d below minimum, using %d", maxDurableBytes, MIN_BYTES);
            maxDurableBytes = MIN_BYTES;
        }
        if (defaultTtl == null || defaultTtl.compareTo(MIN_TTL) < 0) {
            defaultTtl = MIN_TTL;
        }
        if (staleTtl == null || staleTtl.compareTo(defaultTtl) < 0) {
            staleTtl = defaultTtl;
        }
        frequencyWeight = clampUnit(frequencyWeight);
        recencyWeight = clampUnit(recencyWeight);
        double sum = frequencyWeight + recencyWeight;
        if (sum <= 0 || sum > 2) {
            LOG.warnf("Priority weights sum %.2f out of range, resetting to defaults", sum);
            frequencyWeight = DEFAULT_FREQUENCY_WEIGHT;
            recencyWeight = DEFAULT_RECENCY_WEIGHT;
        }
        minHitRateForAdaptation = clampUnit(minHitRateForAdaptation);
        thrashingThreshold = Math.max(0, thrashingThreshold);
        if (Double.isNaN(quotaPressurePercentage)) {
            quotaPressurePercentage = 90;
        }
        quotaPressurePercentage = Math.min(100, Math.max(1, quotaPressurePercentage));
    }

    public static CacheSettings from(PageCacheConfig config) {
        return new CacheSettings(
                config.maxVolatileBytes(),
                config.maxDurableBytes(),
                config.defaultTtl(),
                config.staleTtl(),
                config.enablePersistence(),
                config.priorityWeights().frequency(),
                config.priorityWeights().recency(),
                config.minHitRateForAdaptation(),
                config.thrashingThreshold(),
                config.advancedPriority(),
                config.adaptiveWeights(),
                config.quotaPressurePercentage());
    }

    public static CacheSettings defaults() {
        return new CacheSettings(
                DEFAULT_VOLATILE_BYTES,
                DEFAULT_DURABLE_BYTES,
                Duration.ofMinutes(5),
                Duration.ofMinutes(30),
                true,
                DEFAULT_FREQUENCY_WEIGHT,
                DEFAULT_RECENCY_WEIGHT,
                0.3,
                50,
                true,
                true,
                90);
    }

    public CacheSettings withMaxVolatileBytes(long maxVolatileBytes) {
        return new CacheSettings(
                maxVolatileBytes,
                maxDurableBytes,
                defaultTtl,
                staleTtl,
                enablePersistence,
                frequencyWeight,
                recencyWeight,
                minHitRateForAdaptation,
                thrashingThreshold,
                advancedPriority,
                adaptiveWeights,
                quotaPressurePercentage);
    }

    public CacheSettings withPersistence(boolean enablePersistence) {
        return new CacheSettings(
                maxVolatileBytes,
                maxDurableBytes,
                defaultTtl,
                staleTtl,
                enablePersistence,
                frequencyWeight,
                recencyWeight,
                minHitRateForAdaptation,
                thrashingThreshold,
                advancedPriority,
                adaptiveWeights,
                quotaPressurePercentage);
    }

    public CacheSettings withWeights(double frequencyWeight, double recencyWeight) {
        return new CacheSettings(
                maxVolatileBytes,
                maxDurableBytes,
                defaultTtl,
                staleTtl,
                enablePersistence,
                frequencyWeight,
                recencyWeight,
                minHitRateForAdaptation,
                thrashingThreshold,
                advancedPriority,
                adaptiveWeights,
                quotaPressurePercentage);
    }

    private static double clampUnit(double value) {
        if (Double.isNaN(value)) {
            return 0;
        }
        return Math.min(1, Math.max(0, value));
    }
}
