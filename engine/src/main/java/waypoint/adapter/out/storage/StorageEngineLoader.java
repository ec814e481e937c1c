package waypoint.adapter.out.storage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import waypoint.core.port.out.PersistentStorageEngine;
import waypoint.core.port.out.StorageQuotaEstimator;
import waypoint.spi.StorageAdapterConfig;
import waypoint.spi.StorageEngineProvider;
import waypoint.spi.StorageProviderException;

/**
 * Discovers and loads durable tier storage engines via ServiceLoader.
 *
 * <p>Provider selection:
 * <ol>
 *   <li>If waypoint.storage.engine.provider is set, use that provider</li>
 *   <li>Otherwise, select the highest priority available provider</li>
 * </ol>
 */
@ApplicationScoped
public class StorageEngineLoader {

    private static final Logger LOG = Logger.getLogger(StorageEngineLoader.class);

    private final Optional<String> configuredProvider;
    private final StorageAdapterConfig config;
    private final ServiceLoader<StorageEngineProvider> serviceLoader;

    private StorageEngineProvider provider;

    @Inject
    public StorageEngineLoader(
            @ConfigProperty(name = "waypoint.storage.engine.provider") Optional<String> configuredProvider,
            StorageAdapterConfig config) {
        this(configuredProvider, config, ServiceLoader.load(StorageEngineProvider.class));
    }

    StorageEngineLoader(
            Optional<String> configuredProvider,
            StorageAdapterConfig config,
            ServiceLoader<StorageEngineProvider> serviceLoader) {
        this.configuredProvider = configuredProvider;
        this.config = config;
        this.serviceLoader = serviceLoader;
    }

    @Produces
    @ApplicationScoped
    public PersistentStorageEngine storageEngine() {
        StorageEngineProvider selected = getProvider();
        LOG.infof("Creating storage engine from provider: %s (%s)", selected.name(), selected.description());
        return selected.createEngine(config);
    }

    /**
     * Produces the quota estimator of the selected provider.
     *
     * @return estimator that reports nothing if the provider has none
     */
    @Produces
    @ApplicationScoped
    public StorageQuotaEstimator quotaEstimator() {
        return getProvider().createQuotaEstimator(config).orElseGet(() -> {
            LOG.debugf("Storage engine %s cannot report quota", getProvider().name());
            return StorageQuotaEstimator.unsupported();
        });
    }

    synchronized StorageEngineProvider getProvider() {
        if (provider != null) {
            return provider;
        }

        List<StorageEngineProvider> providers = new ArrayList<>();
        serviceLoader.forEach(providers::add);

        if (providers.isEmpty()) {
            throw new StorageProviderException(
                    "No storage engine providers found. Ensure a provider JAR is on the classpath.");
        }

        LOG.infof(
                "Found %d storage engine provider(s): %s",
                providers.size(),
                providers.stream().map(StorageEngineProvider::name).toList());

        provider = selectProvider(providers, configuredProvider.orElse(null));
        return provider;
    }

    static StorageEngineProvider selectProvider(List<StorageEngineProvider> providers, String configured) {
        // Explicit configuration takes precedence
        if (configured != null && !configured.isBlank()) {
            return providers.stream()
                    .filter(p -> p.name().equals(configured))
                    .findFirst()
                    .orElseThrow(() -> new StorageProviderException("Configured storage engine provider not found: "
                            + configured + ". Available: "
                            + providers.stream().map(StorageEngineProvider::name).toList()));
        }

        return providers.stream()
                .filter(StorageEngineProvider::isAvailable)
                .max(Comparator.comparingInt(StorageEngineProvider::priority))
                .orElseThrow(() -> new StorageProviderException("No available storage engine providers"));
    }
}
