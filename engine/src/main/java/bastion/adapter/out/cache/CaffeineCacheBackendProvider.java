package bastion.adapter.out.cache;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import bastion.core.config.CacheConfig;
import bastion.spi.CacheBackend;
import bastion.spi.CacheBackendProvider;

/**
 * In-process cache backend. Always available; entries are not shared across instances.
 */
@ApplicationScoped
public class CaffeineCacheBackendProvider implements CacheBackendProvider {

    private static final Logger LOG = Logger.getLogger(CaffeineCacheBackendProvider.class);

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public String description() {
        return "In-process Caffeine cache";
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public CacheBackend createBackend(CacheConfig config) {
        LOG.infof("Creating in-process cache backend (max entries: %d)", config.maxEntries());
        return new CaffeineCacheBackend(config.maxEntries());
    }
}
