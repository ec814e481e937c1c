package waypoint.core.port.out;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import waypoint.core.model.state.ScrollPosition;

/**
 * The environment that displays pages and holds their interactive state.
 *
 * <p>Read methods take selector patterns; apply methods update matching controls
 * and notify the hosting UI of the change. Implementations exist per target
 * environment, including a no-op one for headless use.
 */
public interface RenderingSurface {

    ScrollPosition readScrollPosition();

    /**
     * Reads values of filter-bearing controls.
     *
     * @param selectors selector patterns of the controls
     * @return values keyed by control name
     */
    Map<String, Object> readFilters(List<String> selectors);

    /**
     * Reads identifiers of expanded regions, in document order.
     */
    List<String> readExpandedSections(List<String> selectors);

    /**
     * Reads the value of the first search input matched.
     */
    Optional<String> readSearchTerm(List<String> selectors);

    /**
     * Reads persisted form field values.
     *
     * @return field values keyed by form identifier
     */
    Map<String, Object> readFormData(List<String> selectors);

    void applyFilters(Map<String, Object> filters);

    void applyExpandedSections(List<String> sectionIds);

    void applyFormData(Map<String, Object> formData);

    void applySearchTerm(String searchTerm);

    void applyScrollPosition(ScrollPosition position);

    /**
     * Runs the task once layout of the next frame has settled.
     */
    void onNextFrame(Runnable task);
}
