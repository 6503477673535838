package bastion.spi;

import bastion.core.config.CacheConfig;

/**
 * Service provider interface for cache backends.
 *
 * <p>The backend named by {@code bastion.cache.backend} is used; when it is missing or
 * unavailable the highest priority available provider is used instead.
 */
public interface CacheBackendProvider {

    String name();

    default String description() {
        return name() + " cache backend";
    }

    default int priority() {
        return 0;
    }

    default boolean isAvailable() {
        return true;
    }

    CacheBackend createBackend(CacheConfig config);
}
