package bastion.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the authentication, authorization and session cache.
 *
 * <p>Configuration prefix: {@code bastion.cache}
 *
 * <h2>Configuration Properties</h2>
 * <ul>
 *   <li>{@code bastion.cache.enabled} - turn caching off entirely</li>
 *   <li>{@code bastion.cache.backend} - name of the cache backend provider</li>
 *   <li>{@code bastion.cache.ttl.credentials} - TTL for credential records</li>
 *   <li>{@code bastion.cache.ttl.authz-info} - TTL for roles and permissions</li>
 *   <li>{@code bastion.cache.ttl.session-absolute} - TTL for cached sessions</li>
 *   <li>{@code bastion.cache.ttl.absolute} - TTL for anything else</li>
 * </ul>
 */
@ConfigMapping(prefix = "bastion.cache")
public interface CacheConfig {

    /**
     * Enable caching. When disabled every lookup goes to the account store.
     *
     * @return true if enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Cache backend provider name.
     *
     * @return backend name (default: memory)
     */
    @WithDefault("memory")
    String backend();

    /**
     * Maximum number of entries held by the in-memory backend.
     *
     * @return maximum entries (default: 10000)
     */
    @WithDefault("10000")
    long maxEntries();

    /**
     * TTL per class of cached data.
     */
    TtlConfig ttl();

    /**
     * TTL settings.
     */
    interface TtlConfig {

        /**
         * Default TTL for entries without a more specific class.
         *
         * @return TTL (default: 1 hour)
         */
        @WithDefault("PT1H")
        Duration absolute();

        /**
         * TTL for cached credential records.
         *
         * @return TTL (default: 5 minutes)
         */
        @WithDefault("PT5M")
        Duration credentials();

        /**
         * TTL for cached roles and permissions.
         *
         * @return TTL (default: 30 minutes)
         */
        @WithDefault("PT30M")
        Duration authzInfo();

        /**
         * TTL for cached sessions. Never exceeds a session's remaining absolute lifetime.
         *
         * @return TTL (default: 30 minutes)
         */
        @WithDefault("PT30M")
        Duration sessionAbsolute();
    }
}
