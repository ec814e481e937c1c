package waypoint.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import waypoint.core.service.PageCacheContext;

/**
 * Starts the page cache on application startup.
 */
@ApplicationScoped
public class PageCacheInitializer {

    private static final Logger LOG = Logger.getLogger(PageCacheInitializer.class);

    private final PageCacheContext context;

    @Inject
    public PageCacheInitializer(PageCacheContext context) {
        this.context = context;
    }

    void onStart(@Observes StartupEvent event) {
        LOG.info("Initializing page cache...");
        context.start()
                .subscribe()
                .with(
                        v -> LOG.info("Page cache initialized successfully"),
                        e -> LOG.errorf(e, "Failed to initialize page cache"));
    }
}
