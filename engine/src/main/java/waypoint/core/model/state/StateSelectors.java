package waypoint.core.model.state;

import java.util.List;

/**
 * Selector patterns telling a rendering surface which elements carry page state.
 *
 * @param filters selectors for filter-bearing controls
 * @param expandedSections selectors for expandable regions
 * @param searchInputs selectors for the primary search input, first match wins
 * @param forms selectors for forms whose fields are persisted
 */
public record StateSelectors(
        List<String> filters, List<String> expandedSections, List<String> searchInputs, List<String> forms) {

    private static final StateSelectors DEFAULTS = new StateSelectors(
            List.of("[data-filter]", "select[name*=filter]", "input[type=checkbox]", "input[type=radio]"),
            List.of("[data-expanded]", "[aria-expanded]", "details"),
            List.of("input[type=search]", "[data-search]"),
            List.of("form[data-persist]"));

    public StateSelectors {
        filters = filters == null ? List.of() : List.copyOf(filters);
        expandedSections = expandedSections == null ? List.of() : List.copyOf(expandedSections);
        searchInputs = searchInputs == null ? List.of() : List.copyOf(searchInputs);
        forms = forms == null ? List.of() : List.copyOf(forms);
    }

    public static StateSelectors defaults() {
        return DEFAULTS;
    }
}
