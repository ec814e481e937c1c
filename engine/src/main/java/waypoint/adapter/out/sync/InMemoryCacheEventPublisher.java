package waypoint.adapter.out.sync;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.operators.multi.processors.BroadcastProcessor;
import org.jboss.logging.Logger;

import waypoint.core.model.cache.CacheEvent;
import waypoint.core.port.out.CacheEventPublisher;

/**
 * In-memory implementation of CacheEventPublisher.
 *
 * <p>Events are broadcast within the same JVM only, to subscribers present at
 * the time of publishing.
 */
public class InMemoryCacheEventPublisher implements CacheEventPublisher {

    private static final Logger LOG = Logger.getLogger(InMemoryCacheEventPublisher.class);

    private final BroadcastProcessor<CacheEvent> processor = BroadcastProcessor.create();

    @Override
    public Uni<Void> publish(CacheEvent event) {
        return Uni.createFrom().item(() -> {
            processor.onNext(event);
            LOG.debugf("Published cache event (in-memory): %s", event);
            return null;
        });
    }

    @Override
    public Multi<CacheEvent> subscribe() {
        return processor;
    }
}
