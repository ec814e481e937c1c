package waypoint.core.service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import waypoint.core.config.NavigationConfig;
import waypoint.core.model.cache.CacheEntry;
import waypoint.core.model.cache.ContentKind;
import waypoint.core.model.cache.PageKind;
import waypoint.core.model.navigation.NavigationResult;
import waypoint.core.model.navigation.PageDescriptor;
import waypoint.core.model.state.PageState;
import waypoint.core.port.out.RefreshCallback;

/**
 * Cache-first navigation protocol, invoked on every route change.
 *
 * <p>A usable cached entry is returned at once together with the restored page
 * state. If the entry is older than the stale threshold, a background refresh is
 * handed to the {@link BackgroundRefreshManager}; navigation never waits for it.
 * On a miss the caller fetches the data and hands it back through
 * {@link #cacheFreshData}.
 */
public class NavigationGuard {

    private static final Logger LOG = Logger.getLogger(NavigationGuard.class);

    private final CacheOrchestrator orchestrator;
    private final StateManager stateManager;
    private final BackgroundRefreshManager refreshManager;
    private final Duration staleThreshold;
    private final boolean backgroundRefreshEnabled;
    private final Duration maxCacheLookupTime;

    private final Map<String, RefreshCallback> refreshCallbacks = new ConcurrentHashMap<>();
    private volatile String currentRoute;
    private volatile boolean offlineMode;

    public NavigationGuard(
            CacheOrchestrator orchestrator,
            StateManager stateManager,
            BackgroundRefreshManager refreshManager,
            NavigationConfig config) {
        this.orchestrator = orchestrator;
        this.stateManager = stateManager;
        this.refreshManager = refreshManager;
        this.staleThreshold = config.staleThreshold();
        this.backgroundRefreshEnabled = config.enableBackgroundRefresh();
        this.maxCacheLookupTime = config.maxCacheLookupTime();
    }

    /**
     * Handles a route change.
     *
     * @param to the route being navigated to
     * @param from the route being left, may be null
     * @param pageKind classification used if the page is refreshed
     * @param contentKind classification used if the page is refreshed
     * @return Uni with the navigation result; a hit from the volatile tier resolves immediately
     */
    public Uni<NavigationResult> handleNavigation(String to, String from, PageKind pageKind, ContentKind contentKind) {
        long start = System.nanoTime();
        return orchestrator.<Object>get(RouteKeys.cacheKey(to)).map(found -> {
            NavigationResult result;
            if (found.isPresent() && isUsable(found.get())) {
                CacheEntry<Object> entry = found.get();
                PageState pageState = stateManager.getState(to).orElse(null);
                if (pageState != null) {
                    stateManager.restoreState(to, pageState);
                }
                boolean refreshScheduled = isStale(entry) && scheduleBackgroundRefresh(to, pageKind, contentKind);
                Duration displayTime = Duration.ofNanos(System.nanoTime() - start);
                if (displayTime.compareTo(maxCacheLookupTime) > 0) {
                    LOG.warnf("Cache lookup for %s took %d ms", to, displayTime.toMillis());
                }
                result = NavigationResult.hit(entry.data(), pageState, refreshScheduled, displayTime);
            } else {
                LOG.debugf("Cache miss navigating %s -> %s", from, to);
                result = NavigationResult.miss(Duration.ofNanos(System.nanoTime() - start));
            }
            currentRoute = to;
            return result;
        });
    }

    public void registerRefreshCallback(String route, RefreshCallback callback) {
        refreshCallbacks.put(route, callback);
    }

    public void unregisterRefreshCallback(String route) {
        refreshCallbacks.remove(route);
    }

    /**
     * Caches data fetched by the caller after a miss.
     */
    public Uni<Void> cacheFreshData(String route, Object data, PageKind pageKind, ContentKind contentKind) {
        return orchestrator.set(RouteKeys.cacheKey(route), data, PageDescriptor.of(route, pageKind, contentKind));
    }

    /**
     * Drops the cached data and page state of a route and cancels its refresh.
     */
    public Uni<Void> invalidateRoute(String route) {
        refreshManager.cancelRefresh(route);
        stateManager.clearState(route);
        return orchestrator.invalidate(RouteKeys.cacheKey(route));
    }

    public Uni<Boolean> hasCachedData(String route) {
        return orchestrator.get(RouteKeys.cacheKey(route)).map(found -> found.isPresent() && isUsable(found.get()));
    }

    /**
     * Switches offline mode for subsequent navigations. In-flight work is not cancelled.
     */
    public void setOfflineMode(boolean offline) {
        this.offlineMode = offline;
        orchestrator.setOfflineMode(offline);
    }

    /**
     * Schedules background fetches for routes with a registered callback and no usable entry.
     *
     * @return Uni with the routes for which a fetch was scheduled
     */
    public Uni<List<String>> warmRoutes(List<String> routes, PageKind pageKind, ContentKind contentKind) {
        return Multi.createFrom()
                .iterable(routes)
                .filter(refreshCallbacks::containsKey)
                .onItem()
                .transformToUniAndConcatenate(route -> hasCachedData(route)
                        .map(cached -> cached ? Optional.<String>empty() : Optional.of(route)))
                .filter(Optional::isPresent)
                .map(Optional::get)
                .collect()
                .asList()
                .invoke(toWarm -> toWarm.forEach(route -> scheduleBackgroundRefresh(route, pageKind, contentKind)))
                .call(toWarm -> toWarm.isEmpty() ? Uni.createFrom().voidItem() : orchestrator.warm(toWarm));
    }

    public Optional<String> getCurrentRoute() {
        return Optional.ofNullable(currentRoute);
    }

    public boolean isRefreshActive(String route) {
        return refreshManager.isRefreshScheduled(route);
    }

    /**
     * Forgets the current route and callbacks and cancels all refreshes.
     */
    public void clear() {
        currentRoute = null;
        refreshCallbacks.clear();
        refreshManager.clear();
    }

    private boolean scheduleBackgroundRefresh(String route, PageKind pageKind, ContentKind contentKind) {
        if (!backgroundRefreshEnabled || offlineMode) {
            return false;
        }
        if (refreshManager.isRefreshScheduled(route)) {
            LOG.debugf("Refresh of %s already active", route);
            return true;
        }
        RefreshCallback callback = refreshCallbacks.get(route);
        if (callback == null) {
            LOG.debugf("No refresh callback registered for %s", route);
            return false;
        }
        return refreshManager.scheduleRefresh(route, callback, pageKind, contentKind);
    }

    private boolean isUsable(CacheEntry<?> entry) {
        return offlineMode || !entry.isExpired(orchestrator.clock().instant());
    }

    private boolean isStale(CacheEntry<?> entry) {
        Instant now = orchestrator.clock().instant();
        return entry.stale() || Duration.between(entry.timestamp(), now).compareTo(staleThreshold) > 0;
    }
}
