package waypoint.core.cache;

/**
 * Weights of the extended priority formula.
 *
 * <p>Frequency and recency scores are blended with the static page and content
 * scores. The weights normally sum to 1.
 */
public record PriorityWeights(double frequency, double recency, double pageKind, double contentKind) {

    public static final PriorityWeights DEFAULT = new PriorityWeights(0.3, 0.2, 0.3, 0.2);

    private static final double MAX_FREQUENCY = 0.9;
    private static final double MIN_RECENCY = 0.1;
    private static final double ADAPTATION_STEP = 0.1;

    /**
     * Shifts weight towards access frequency, used when the hit rate is poor.
     */
    public PriorityWeights favourFrequency() {
        double newFrequency = Math.min(MAX_FREQUENCY, frequency + ADAPTATION_STEP);
        double newRecency = Math.max(MIN_RECENCY, 1 - newFrequency - pageKind - contentKind);
        return new PriorityWeights(newFrequency, newRecency, pageKind, contentKind);
    }
}
