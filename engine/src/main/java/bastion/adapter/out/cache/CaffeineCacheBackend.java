package bastion.adapter.out.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import io.smallrye.mutiny.Uni;

import bastion.spi.CacheBackend;

/**
 * Caffeine-backed cache backend with per-entry TTL.
 *
 * <p>Each entry expires after the TTL it was stored with. To keep instances from
 * refreshing in lockstep the effective TTL is shortened by a random jitter; it is
 * never lengthened, so an entry never outlives the window its caller asked for.
 */
public class CaffeineCacheBackend implements CacheBackend {

    private static final double DEFAULT_JITTER_FACTOR = 0.1;

    private final Cache<String, Entry> cache;
    private final double jitterFactor;

    public CaffeineCacheBackend(long maxEntries) {
        this(maxEntries, DEFAULT_JITTER_FACTOR, Ticker.systemTicker());
    }

    /**
     * @param maxEntries   maximum number of entries
     * @param jitterFactor fraction by which a TTL may be shortened (0.0 to 0.5)
     * @param ticker       time source
     */
    public CaffeineCacheBackend(long maxEntries, double jitterFactor, Ticker ticker) {
        if (jitterFactor < 0.0 || jitterFactor > 0.5) {
            throw new IllegalArgumentException("Jitter factor must be between 0.0 and 0.5, got: " + jitterFactor);
        }
        this.jitterFactor = jitterFactor;
        this.cache = Caffeine.newBuilder()
                .expireAfter(new EntryExpiry())
                .maximumSize(maxEntries)
                .ticker(ticker)
                .build();
    }

    private class EntryExpiry implements Expiry<String, Entry> {
        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return applyJitter(entry.ttlNanos());
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return applyJitter(entry.ttlNanos());
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long applyJitter(long ttl) {
            if (jitterFactor == 0.0) {
                return ttl;
            }
            final var multiplier = 1.0 - ThreadLocalRandom.current().nextDouble() * jitterFactor;
            return (long) (ttl * multiplier);
        }
    }

    @Override
    public <V> Uni<Optional<V>> get(String key, Class<V> type) {
        return Uni.createFrom().item(() -> Optional.ofNullable(cache.getIfPresent(key))
                .map(Entry::value)
                .filter(type::isInstance)
                .map(type::cast));
    }

    @Override
    public Uni<Void> set(String key, Object value, Duration ttl) {
        if (ttl.isNegative() || ttl.isZero()) {
            return Uni.createFrom().failure(new IllegalArgumentException("TTL must be positive"));
        }
        return Uni.createFrom().item(() -> {
            cache.put(key, new Entry(value, ttl.toNanos()));
            return null;
        });
    }

    @Override
    public Uni<Void> delete(String key) {
        return Uni.createFrom().item(() -> {
            cache.invalidate(key);
            return null;
        });
    }

    /**
     * Approximate number of live entries (for testing).
     */
    public long estimatedSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private record Entry(Object value, long ttlNanos) {}
}
