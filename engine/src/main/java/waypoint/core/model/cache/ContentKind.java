package waypoint.core.model.cache;

/**
 * Classification of page content used for retention priority.
 *
 * <p>Ordering: user-generated &gt; personalized &gt; generic.
 */
public enum ContentKind {
    USER_GENERATED("user-generated", 100),
    PERSONALIZED("personalized", 70),
    GENERIC("generic", 30);

    private final String id;
    private final int score;

    ContentKind(String id, int score) {
        this.id = id;
        this.score = score;
    }

    public String id() {
        return id;
    }

    public int score() {
        return score;
    }

    /**
     * Resolves a kind from its identifier, falling back to {@link #GENERIC}.
     *
     * @param id the identifier (case-insensitive), may be null
     * @return the matching kind
     */
    public static ContentKind fromId(String id) {
        if (id == null) {
            return GENERIC;
        }
        for (ContentKind kind : values()) {
            if (kind.id.equalsIgnoreCase(id) || kind.name().equalsIgnoreCase(id)) {
                return kind;
            }
        }
        return GENERIC;
    }
}
