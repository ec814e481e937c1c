package waypoint.core.model.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of the interactive state of a page.
 *
 * <p>Every field is always present; missing values default to empty or zero.
 * Map values may be null, so maps are copied into insertion-ordered
 * unmodifiable views rather than {@link Map#copyOf}.
 *
 * @param scrollPosition scroll offset
 * @param filters filter control values keyed by control name
 * @param searchTerm value of the primary search input
 * @param expandedSections identifiers of expanded regions, in document order
 * @param formData persisted form field values keyed by form then field
 * @param customState application-defined extra state
 */
public record PageState(
        ScrollPosition scrollPosition,
        Map<String, Object> filters,
        String searchTerm,
        List<String> expandedSections,
        Map<String, Object> formData,
        Map<String, Object> customState) {

    private static final PageState EMPTY = new PageState(null, null, null, null, null, null);

    public PageState {
        scrollPosition = scrollPosition == null ? ScrollPosition.ORIGIN : scrollPosition;
        filters = copy(filters);
        searchTerm = searchTerm == null ? "" : searchTerm;
        expandedSections = expandedSections == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(expandedSections));
        formData = copy(formData);
        customState = copy(customState);
    }

    public static PageState empty() {
        return EMPTY;
    }

    public PageState withScrollPosition(ScrollPosition scrollPosition) {
        return new PageState(scrollPosition, filters, searchTerm, expandedSections, formData, customState);
    }

    public PageState withCustomState(Map<String, Object> customState) {
        return new PageState(scrollPosition, filters, searchTerm, expandedSections, formData, customState);
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
