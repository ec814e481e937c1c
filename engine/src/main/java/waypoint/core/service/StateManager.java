package waypoint.core.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

import org.jboss.logging.Logger;

import waypoint.core.config.StateConfig;
import waypoint.core.model.state.PageState;
import waypoint.core.model.state.ScrollPosition;
import waypoint.core.model.state.StateSelectors;
import waypoint.core.port.out.RenderingSurface;

/**
 * Captures and restores the interactive state of pages, keyed by route.
 *
 * <p>Retains state for a bounded number of routes and drops the least recently
 * used route when the bound is exceeded. Reading a state counts as a use.
 *
 * <p>Restoration always applies filters, expanded sections, form data and the
 * search term, in that order, then the scroll position on the next frame.
 */
public class StateManager {

    private static final Logger LOG = Logger.getLogger(StateManager.class);

    private final RenderingSurface surface;
    private final int maxStates;
    private final Map<String, PageState> states;

    public StateManager(RenderingSurface surface, StateConfig config) {
        this(surface, config.maxStates());
    }

    public StateManager(RenderingSurface surface, int maxStates) {
        this.surface = surface;
        this.maxStates = Math.max(1, maxStates);
        this.states = new LinkedHashMap<>(this.maxStates + 1, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, PageState> eldest) {
                boolean evict = size() > StateManager.this.maxStates;
                if (evict) {
                    LOG.debugf("Dropping page state of least recently used route %s", eldest.getKey());
                }
                return evict;
            }
        };
    }

    public PageState captureState(String route) {
        return captureState(route, StateSelectors.defaults());
    }

    /**
     * Reads the current page state from the rendering surface and stores it.
     *
     * <p>A part that cannot be read is logged and left empty.
     *
     * @param route the route the state belongs to
     * @param selectors which controls carry state
     * @return the captured state
     */
    public PageState captureState(String route, StateSelectors selectors) {
        PageState state = new PageState(
                read("scroll position", surface::readScrollPosition, ScrollPosition.ORIGIN),
                read("filters", () -> surface.readFilters(selectors.filters()), Map.of()),
                read("search term", () -> surface.readSearchTerm(selectors.searchInputs()), Optional.<String>empty())
                        .orElse(""),
                read("expanded sections", () -> surface.readExpandedSections(selectors.expandedSections()), List.of()),
                read("form data", () -> surface.readFormData(selectors.forms()), Map.of()),
                Map.of());
        setState(route, state);
        return state;
    }

    public boolean restoreState(String route) {
        return restoreState(route, null);
    }

    /**
     * Applies a state to the rendering surface.
     *
     * @param route the route whose stored state is used when {@code state} is null
     * @param state the state to apply, or null to use the stored one
     * @return false if there was nothing to restore
     */
    public boolean restoreState(String route, PageState state) {
        PageState toRestore = state != null ? state : getState(route).orElse(null);
        if (toRestore == null) {
            return false;
        }

        apply("filters", () -> surface.applyFilters(toRestore.filters()));
        apply("expanded sections", () -> surface.applyExpandedSections(toRestore.expandedSections()));
        apply("form data", () -> surface.applyFormData(toRestore.formData()));
        if (!toRestore.searchTerm().isEmpty()) {
            apply("search term", () -> surface.applySearchTerm(toRestore.searchTerm()));
        }
        surface.onNextFrame(() -> apply("scroll position", () -> surface.applyScrollPosition(toRestore.scrollPosition())));
        return true;
    }

    public synchronized Optional<PageState> getState(String route) {
        return Optional.ofNullable(states.get(route));
    }

    public synchronized void setState(String route, PageState state) {
        states.put(route, state == null ? PageState.empty() : state);
    }

    public synchronized boolean clearState(String route) {
        return states.remove(route) != null;
    }

    public synchronized void clearAllStates() {
        states.clear();
    }

    /**
     * Routes with stored state, least recently used first.
     */
    public synchronized List<String> getStoredRoutes() {
        return List.copyOf(states.keySet());
    }

    public synchronized int getStateCount() {
        return states.size();
    }

    private <T> T read(String part, Supplier<T> reader, T fallback) {
        try {
            T value = reader.get();
            return value == null ? fallback : value;
        } catch (RuntimeException e) {
            LOG.warnf("Failed to capture %s: %s", part, e.getMessage());
            return fallback;
        }
    }

    private void apply(String part, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            LOG.warnf("Failed to restore %s: %s", part, e.getMessage());
        }
    }
}
