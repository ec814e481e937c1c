package waypoint.core.model.navigation;

import java.time.Duration;
import java.util.Optional;

import waypoint.core.model.state.PageState;

/**
 * Outcome of a cache-first navigation.
 *
 * @param usedCache true if cached data was served
 * @param backgroundRefreshScheduled true if a refresh of stale data was scheduled
 * @param pageData the cached payload, null on a miss
 * @param pageState the restored page state, null on a miss or when none was captured
 * @param displayTime time spent from the start of the lookup until the result was ready
 */
public record NavigationResult(
        boolean usedCache,
        boolean backgroundRefreshScheduled,
        Object pageData,
        PageState pageState,
        Duration displayTime) {

    public static NavigationResult miss(Duration displayTime) {
        return new NavigationResult(false, false, null, null, displayTime);
    }

    public static NavigationResult hit(
            Object pageData, PageState pageState, boolean refreshScheduled, Duration displayTime) {
        return new NavigationResult(true, refreshScheduled, pageData, pageState, displayTime);
    }

    public Optional<PageState> restoredState() {
        return Optional.ofNullable(pageState);
    }
}
