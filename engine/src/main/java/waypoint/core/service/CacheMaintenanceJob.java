package waypoint.core.service;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import waypoint.core.config.CacheSettings;
import waypoint.core.model.cache.CacheStats;

/**
 * Periodic cache housekeeping.
 *
 * <p>Each run flags stale entries, checks storage usage and cleans up both tiers,
 * switching to pressure cleanup when usage reaches the configured percentage.
 */
@ApplicationScoped
public class CacheMaintenanceJob {

    private static final Logger LOG = Logger.getLogger(CacheMaintenanceJob.class);

    private final CacheOrchestrator orchestrator;
    private final CacheSettings settings;

    @Inject
    public CacheMaintenanceJob(CacheOrchestrator orchestrator, CacheSettings settings) {
        this.orchestrator = orchestrator;
        this.settings = settings;
    }

    @Scheduled(
            every = "${waypoint.cache.maintenance-interval:60s}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> runMaintenance() {
        List<String> stale = orchestrator.markStaleEntries();
        LOG.debugf("Cache maintenance: %d stale entries", stale.size());

        CacheStats stats = orchestrator.getStats();
        if (stats.thrashingEvents() > settings.thrashingThreshold()) {
            LOG.warnf(
                    "Cache thrashing detected: %d re-admissions after eviction (threshold %d)",
                    stats.thrashingEvents(),
                    settings.thrashingThreshold());
        }

        return orchestrator
                .checkStorageQuota()
                .flatMap(quota -> {
                    boolean underPressure = quota.map(q -> q.percentage() >= settings.quotaPressurePercentage())
                            .orElse(false);
                    if (underPressure) {
                        LOG.warnf(
                                "Storage usage at %.1f%%, running pressure cleanup",
                                quota.get().percentage());
                    }
                    return orchestrator.cleanup(underPressure);
                })
                .onFailure()
                .invoke(e -> LOG.error("Cache maintenance failed", e));
    }
}
