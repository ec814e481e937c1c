package waypoint.core.model.state;

/**
 * Scroll offset of the page.
 */
public record ScrollPosition(double x, double y) {

    public static final ScrollPosition ORIGIN = new ScrollPosition(0, 0);
}
