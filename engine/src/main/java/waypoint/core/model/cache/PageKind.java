package waypoint.core.model.cache;

/**
 * Classification of a page used for retention priority.
 *
 * <p>Scores are on a 0-100 scale; dashboard and profile pages hold the
 * user's own working context and are retained longest.
 */
public enum PageKind {
    DASHBOARD("dashboard", 100),
    PROFILE("profile", 90),
    TIMETABLE("timetable", 70),
    SETTINGS("settings", 60),
    PUBLIC_PROFILE("public-profile", 50),
    OTHER("other", 30);

    private final String id;
    private final int score;

    PageKind(String id, int score) {
        this.id = id;
        this.score = score;
    }

    /**
     * Stable identifier used in tags and serialized entries.
     */
    public String id() {
        return id;
    }

    public int score() {
        return score;
    }

    /**
     * Resolves a kind from its identifier, falling back to {@link #OTHER}.
     *
     * @param id the identifier (case-insensitive), may be null
     * @return the matching kind
     */
    public static PageKind fromId(String id) {
        if (id == null) {
            return OTHER;
        }
        for (PageKind kind : values()) {
            if (kind.id.equalsIgnoreCase(id) || kind.name().equalsIgnoreCase(id)) {
                return kind;
            }
        }
        return OTHER;
    }
}
