package bastion.core.cache;

import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Stream;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import bastion.core.config.CacheConfig;
import bastion.spi.CacheBackend;
import bastion.spi.CacheBackendProvider;

/**
 * Selects the cache backend.
 *
 * <p>Selection order:
 * <ol>
 *   <li>Configured backend ({@code bastion.cache.backend})</li>
 *   <li>Highest priority available backend</li>
 * </ol>
 */
@ApplicationScoped
public class CacheBackendRegistry {

    private static final Logger LOG = Logger.getLogger(CacheBackendRegistry.class);

    private final Supplier<Stream<CacheBackendProvider>> providers;
    private final CacheConfig config;

    private CacheBackend backend;

    @Inject
    public CacheBackendRegistry(Instance<CacheBackendProvider> providers, CacheConfig config) {
        this.providers = providers::stream;
        this.config = config;
    }

    public CacheBackendRegistry(List<CacheBackendProvider> providers, CacheConfig config) {
        this.providers = providers::stream;
        this.config = config;
    }

    /**
     * Get the backend, creating it on first use.
     */
    public synchronized CacheBackend getBackend() {
        if (backend == null) {
            backend = selectProvider().createBackend(config);
        }
        return backend;
    }

    private CacheBackendProvider selectProvider() {
        final var configured = config.backend();
        final var available = providers.get()
                .filter(CacheBackendProvider::isAvailable)
                .sorted(Comparator.comparingInt(CacheBackendProvider::priority).reversed())
                .toList();

        LOG.debugf(
                "Available cache backends: %s",
                available.stream().map(CacheBackendProvider::name).toList());

        final var match = available.stream().filter(p -> p.name().equals(configured)).findFirst();
        if (match.isPresent()) {
            LOG.infof("Using configured cache backend: %s", configured);
            return match.get();
        }
        if (available.isEmpty()) {
            throw new IllegalStateException("No cache backends available");
        }
        final var fallback = available.get(0);
        LOG.warnf(
                "Configured cache backend '%s' is not available, using %s (priority: %d)",
                configured, fallback.name(), fallback.priority());
        return fallback;
    }
}
