package waypoint.core.service;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.subscription.Cancellable;
import org.jboss.logging.Logger;

import waypoint.core.config.RefreshSettings;
import waypoint.core.model.cache.ContentKind;
import waypoint.core.model.cache.PageKind;
import waypoint.core.model.navigation.PageDescriptor;
import waypoint.core.model.navigation.RefreshStats;
import waypoint.core.port.out.RefreshCallback;

/**
 * Fetches fresh data for routes in the background and writes it back into the cache.
 *
 * <p>At most one refresh task exists per route; scheduling again cancels the
 * previous one. While the user is interacting, tasks are deferred and released
 * after a grace period once interaction ends. Failed fetches are retried with
 * exponential backoff and dropped after the configured number of attempts.
 *
 * <p>Timers run on a single daemon thread. Failures never reach the caller.
 */
public class BackgroundRefreshManager {

    private static final Logger LOG = Logger.getLogger(BackgroundRefreshManager.class);

    private final CacheOrchestrator orchestrator;
    private final UpdateNotifier notifier;
    private final RefreshSettings settings;
    private final ScheduledExecutorService executor;
    private final boolean ownsExecutor;

    private final Map<String, RefreshTask> tasks = new HashMap<>();
    private final Set<String> deferred = new LinkedHashSet<>();
    private boolean userInteracting;
    private ScheduledFuture<?> interactionTimer;

    public BackgroundRefreshManager(
            CacheOrchestrator orchestrator, UpdateNotifier notifier, RefreshSettings settings) {
        this(orchestrator, notifier, settings, createExecutor(), true);
    }

    public BackgroundRefreshManager(
            CacheOrchestrator orchestrator,
            UpdateNotifier notifier,
            RefreshSettings settings,
            ScheduledExecutorService executor) {
        this(orchestrator, notifier, settings, executor, false);
    }

    private BackgroundRefreshManager(
            CacheOrchestrator orchestrator,
            UpdateNotifier notifier,
            RefreshSettings settings,
            ScheduledExecutorService executor,
            boolean ownsExecutor) {
        this.orchestrator = orchestrator;
        this.notifier = notifier;
        this.settings = settings;
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
    }

    private static ScheduledExecutorService createExecutor() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "waypoint-refresh");
            t.setDaemon(true);
            return t;
        });
    }

    public boolean scheduleRefresh(String route, RefreshCallback callback, PageKind pageKind, ContentKind contentKind) {
        return scheduleRefresh(route, callback, pageKind, contentKind, null);
    }

    /**
     * Schedules a refresh of the route, replacing any pending or running one.
     *
     * <p>Runs as soon as possible unless the user is interacting, in which case the
     * route is deferred.
     *
     * @param route the route to refresh
     * @param callback fetches fresh data
     * @param pageKind page classification for the refreshed entry
     * @param contentKind content classification for the refreshed entry
     * @param onUpdate receives the new data after it has been cached, may be null
     * @return false if auto refresh is disabled
     */
    public synchronized boolean scheduleRefresh(
            String route,
            RefreshCallback callback,
            PageKind pageKind,
            ContentKind contentKind,
            Consumer<Object> onUpdate) {
        if (!settings.enableAutoRefresh()) {
            LOG.debugf("Auto refresh disabled, ignoring refresh of %s", route);
            return false;
        }

        cancelRefresh(route);
        RefreshTask task = new RefreshTask(route, callback, PageDescriptor.of(route, pageKind, contentKind), onUpdate);
        tasks.put(route, task);

        if (userInteracting) {
            deferred.add(route);
            LOG.debugf("Deferred refresh of %s while user is interacting", route);
        } else {
            submit(task, Duration.ZERO);
        }
        return true;
    }

    /**
     * Cancels any pending, deferred or running refresh of the route.
     */
    public synchronized void cancelRefresh(String route) {
        RefreshTask task = tasks.remove(route);
        if (task != null) {
            task.cancel();
        }
        deferred.remove(route);
    }

    /**
     * Turns interaction gating on or off.
     *
     * <p>Turning it off releases deferred refreshes after the interaction defer delay.
     * Toggling again before the delay elapses restarts the wait.
     */
    public synchronized void setUserInteracting(boolean interacting) {
        this.userInteracting = interacting;
        if (interactionTimer != null) {
            interactionTimer.cancel(false);
            interactionTimer = null;
        }
        if (!interacting && !deferred.isEmpty()) {
            interactionTimer = schedule(this::executeDeferredRefreshes, settings.interactionDeferDelay());
        }
    }

    public synchronized boolean isRefreshScheduled(String route) {
        return tasks.containsKey(route);
    }

    public synchronized boolean isRefreshExecuting(String route) {
        RefreshTask task = tasks.get(route);
        return task != null && task.executing;
    }

    public synchronized List<String> getDeferredRefreshes() {
        return List.copyOf(deferred);
    }

    /**
     * Failed attempts so far for the route's current task.
     */
    public synchronized int getRetryCount(String route) {
        RefreshTask task = tasks.get(route);
        return task == null ? 0 : task.retryCount;
    }

    public synchronized boolean isUserCurrentlyInteracting() {
        return userInteracting;
    }

    public synchronized RefreshStats getStats() {
        int executing = (int) tasks.values().stream().filter(t -> t.executing).count();
        return new RefreshStats(tasks.size(), executing, deferred.size(), userInteracting);
    }

    /**
     * Cancels every task and timer and resets interaction gating.
     */
    public synchronized void clear() {
        tasks.values().forEach(RefreshTask::cancel);
        tasks.clear();
        deferred.clear();
        if (interactionTimer != null) {
            interactionTimer.cancel(false);
            interactionTimer = null;
        }
        userInteracting = false;
    }

    /**
     * Clears all work and stops the timer thread if this manager created it.
     */
    public void shutdown() {
        clear();
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }

    private synchronized void executeDeferredRefreshes() {
        interactionTimer = null;
        List<String> routes = List.copyOf(deferred);
        deferred.clear();
        LOG.debugf("Releasing %d deferred refreshes", routes.size());
        for (String route : routes) {
            RefreshTask task = tasks.get(route);
            if (task != null) {
                submit(task, Duration.ZERO);
            }
        }
    }

    private void execute(RefreshTask task) {
        synchronized (this) {
            if (tasks.get(task.route) != task || task.executing) {
                return;
            }
            if (userInteracting) {
                deferred.add(task.route);
                LOG.debugf("Retry of %s deferred while user is interacting", task.route);
                return;
            }
            task.executing = true;
        }

        Uni<Object> fetch;
        try {
            fetch = task.callback.fetch(task.route);
        } catch (RuntimeException e) {
            fetch = Uni.createFrom().failure(e);
        }

        Cancellable inFlight = fetch.flatMap(data -> {
                    if (!isCurrent(task)) {
                        LOG.debugf("Dropping refresh result for cancelled route %s", task.route);
                        return Uni.createFrom().item(data);
                    }
                    return orchestrator
                            .set(RouteKeys.cacheKey(task.route), data, task.descriptor)
                            .replaceWith(data);
                })
                .subscribe()
                .with(data -> onSuccess(task, data), error -> onFailure(task, error));

        synchronized (this) {
            task.inFlight = inFlight;
        }
    }

    private synchronized boolean isCurrent(RefreshTask task) {
        return tasks.get(task.route) == task;
    }

    private void onSuccess(RefreshTask task, Object data) {
        synchronized (this) {
            if (tasks.get(task.route) != task) {
                return;
            }
            tasks.remove(task.route);
            task.executing = false;
        }

        LOG.debugf("Refreshed %s after %d failed attempts", task.route, task.retryCount);
        if (task.onUpdate != null) {
            try {
                task.onUpdate.accept(data);
            } catch (RuntimeException e) {
                LOG.errorf(e, "Update callback for %s failed", task.route);
            }
        }
        notifier.notifySubscribers(RouteKeys.cacheKey(task.route), data);
    }

    private synchronized void onFailure(RefreshTask task, Throwable error) {
        if (tasks.get(task.route) != task) {
            return;
        }
        task.executing = false;
        task.inFlight = null;
        task.retryCount++;

        if (task.retryCount >= settings.maxRetries()) {
            LOG.warnf(
                    "Background refresh of %s failed after %d attempts: %s",
                    task.route,
                    task.retryCount,
                    error.getMessage());
            tasks.remove(task.route);
            return;
        }

        Duration delay = settings.retryDelay(task.retryCount);
        LOG.warnf(
                "Background refresh of %s failed, retrying in %d ms (attempt %d/%d): %s",
                task.route,
                delay.toMillis(),
                task.retryCount,
                settings.maxRetries(),
                error.getMessage());
        submit(task, delay);
    }

    private void submit(RefreshTask task, Duration delay) {
        task.timer = schedule(() -> execute(task), delay);
    }

    private ScheduledFuture<?> schedule(Runnable action, Duration delay) {
        try {
            return executor.schedule(action, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOG.warnf("Refresh executor rejected work: %s", e.getMessage());
            return null;
        }
    }

    private static final class RefreshTask {
        private final String route;
        private final RefreshCallback callback;
        private final PageDescriptor descriptor;
        private final Consumer<Object> onUpdate;
        private int retryCount;
        private boolean executing;
        private ScheduledFuture<?> timer;
        private Cancellable inFlight;

        private RefreshTask(
                String route, RefreshCallback callback, PageDescriptor descriptor, Consumer<Object> onUpdate) {
            this.route = route;
            this.callback = callback;
            this.descriptor = descriptor;
            this.onUpdate = onUpdate;
        }

        private void cancel() {
            if (timer != null) {
                timer.cancel(false);
            }
            if (inFlight != null) {
                inFlight.cancel();
            }
        }
    }
}
