package waypoint.core.model.navigation;

/**
 * Snapshot of background refresh activity.
 *
 * @param scheduledRefreshes refreshes waiting on a timer or retry
 * @param executingRefreshes refreshes whose data fetch is in flight
 * @param deferredRefreshes refreshes held back by user interaction
 * @param userInteracting whether interaction gating is active
 */
public record RefreshStats(
        int scheduledRefreshes, int executingRefreshes, int deferredRefreshes, boolean userInteracting) {}
