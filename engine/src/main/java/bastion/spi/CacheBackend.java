package bastion.spi;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

/**
 * Key/value store with per-entry time-to-live.
 *
 * <p>Implementations report outages by failing with {@link CacheUnavailableException};
 * the engine then computes values directly.
 */
public interface CacheBackend {

    /**
     * Get a value.
     *
     * @param key  cache key
     * @param type expected value type
     * @return Uni with the value, or empty if absent, expired, or of another type
     */
    <V> Uni<Optional<V>> get(String key, Class<V> type);

    /**
     * Store a value.
     *
     * @param key   cache key
     * @param value value to store
     * @param ttl   time-to-live, must be positive
     * @return Uni completing when stored
     */
    Uni<Void> set(String key, Object value, Duration ttl);

    /**
     * Remove a value.
     *
     * @param key cache key
     * @return Uni completing when removed
     */
    Uni<Void> delete(String key);
}
