package waypoint.core.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import waypoint.core.model.cache.CacheEntry;
import waypoint.core.model.cache.ContentKind;
import waypoint.core.model.cache.PageKind;

/**
 * Computes retention priority from access frequency, recency and classification.
 *
 * <ul>
 *   <li>frequency score: {@code min(100, log10(accessCount + 1) * 50)}</li>
 *   <li>recency score: {@code max(0, 100 * e^(-ageHours / 24))}</li>
 * </ul>
 *
 * <p>All results are clamped to [0, 100].
 */
public class PriorityCalculator {

    private static final double MILLIS_PER_HOUR = Duration.ofHours(1).toMillis();
    private static final double DECAY_HOURS = 24.0;

    private final Clock clock;

    public PriorityCalculator(Clock clock) {
        this.clock = clock;
    }

    public Clock clock() {
        return clock;
    }

    public Instant now() {
        return clock.instant();
    }

    public double frequencyScore(long accessCount) {
        return Math.min(100.0, Math.log10(Math.max(0, accessCount) + 1.0) * 50.0);
    }

    public double recencyScore(Instant lastAccessedAt) {
        double ageHours = Math.max(0, clock.millis() - lastAccessedAt.toEpochMilli()) / MILLIS_PER_HOUR;
        return Math.max(0.0, 100.0 * Math.exp(-ageHours / DECAY_HOURS));
    }

    /**
     * Base priority blending frequency and recency only.
     */
    public double basePriority(long accessCount, Instant lastAccessedAt, double frequencyWeight, double recencyWeight) {
        double raw = frequencyScore(accessCount) * frequencyWeight + recencyScore(lastAccessedAt) * recencyWeight;
        return CacheEntry.clampPriority(raw);
    }

    /**
     * Priority that additionally accounts for page and content classification.
     */
    public double extendedPriority(
            PageKind pageKind,
            ContentKind contentKind,
            long accessCount,
            Instant lastAccessedAt,
            PriorityWeights weights) {
        double raw = frequencyScore(accessCount) * weights.frequency()
                + recencyScore(lastAccessedAt) * weights.recency()
                + pageKind.score() * weights.pageKind()
                + contentKind.score() * weights.contentKind();
        return CacheEntry.clampPriority(raw);
    }
}
