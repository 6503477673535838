package bastion.core.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import bastion.core.config.CacheConfig;
import bastion.core.model.auth.ConfigurationException;
import bastion.core.model.cache.TtlClass;
import bastion.core.model.session.Session;
import bastion.spi.CacheBackend;
import bastion.spi.CacheUnavailableException;

/**
 * TTL-scoped cache in front of account and session data.
 *
 * <p>Concurrent misses on one key are collapsed into a single computation: the first
 * caller starts the backend lookup, compute and store as one memoized {@link Uni}, and
 * every other caller for the key subscribes to that same Uni until it terminates.
 *
 * <p>The backend is never allowed to fail a request. Errors on read are treated as
 * misses and errors on write are logged, so an outage degrades to direct computation.
 *
 * <p>Session copies are stored for at most the configured session TTL and never past
 * the session's own absolute expiry.
 */
@ApplicationScoped
public class CacheHandler {

    private static final Logger LOG = Logger.getLogger(CacheHandler.class);

    private final CacheBackend backend;
    private final CacheConfig config;
    private final Clock clock;
    private final Map<String, Flight> inFlight = new ConcurrentHashMap<>();

    @Inject
    public CacheHandler(CacheBackendRegistry registry, CacheConfig config, Clock clock) {
        this(config.enabled() ? registry.getBackend() : null, config, clock);
    }

    public CacheHandler(CacheBackend backend, CacheConfig config, Clock clock) {
        this.backend = backend;
        this.config = config;
        this.clock = clock;
        validateTtls(config.ttl());
        if (!config.enabled()) {
            LOG.info("Caching disabled, all lookups go to the backing stores");
        }
    }

    private static void validateTtls(CacheConfig.TtlConfig ttl) {
        for (var entry : Map.of(
                        "absolute", ttl.absolute(),
                        "credentials", ttl.credentials(),
                        "authz-info", ttl.authzInfo(),
                        "session-absolute", ttl.sessionAbsolute())
                .entrySet()) {
            if (entry.getValue().isNegative() || entry.getValue().isZero()) {
                throw new ConfigurationException("Cache TTL '" + entry.getKey() + "' must be positive");
            }
        }
    }

    public boolean isEnabled() {
        return config.enabled() && backend != null;
    }

    /**
     * Return the cached value for a key, computing and caching it on a miss.
     *
     * <p>A computed {@code null} is returned but not cached.
     *
     * @param key      cache key
     * @param ttlClass class whose TTL applies to the stored value
     * @param type     value type
     * @param compute  loads the authoritative value
     * @return Uni with the value
     */
    public <V> Uni<V> getOrCompute(String key, TtlClass ttlClass, Class<V> type, Supplier<Uni<V>> compute) {
        if (!isEnabled()) {
            return Uni.createFrom().deferred(compute::get);
        }
        return Uni.createFrom().deferred(() -> {
            final var flight = inFlight.computeIfAbsent(key, k -> createFlight(k, ttlClass, type, compute));
            return flight.uni().map(type::cast);
        });
    }

    private <V> Flight createFlight(String key, TtlClass ttlClass, Class<V> type, Supplier<Uni<V>> compute) {
        final var stale = new AtomicBoolean(false);
        final var self = new AtomicReference<Flight>();
        final Uni<Object> uni = read(key, type)
                .chain(cached -> {
                    if (cached.isPresent()) {
                        LOG.debugf("Cache hit: %s", key);
                        return Uni.createFrom().item((Object) cached.get());
                    }
                    LOG.debugf("Cache miss: %s", key);
                    return Uni.createFrom()
                            .deferred(compute::get)
                            .call(value -> value == null || stale.get()
                                    ? Uni.createFrom().voidItem()
                                    : write(key, ttlClass, value))
                            .map(value -> (Object) value);
                })
                .onTermination()
                .invoke(() -> inFlight.remove(key, self.get()))
                .memoize()
                .indefinitely();
        final var flight = new Flight(uni, stale);
        self.set(flight);
        return flight;
    }

    /**
     * Read a value without computing it.
     */
    public <V> Uni<Optional<V>> get(String key, Class<V> type) {
        if (!isEnabled()) {
            return Uni.createFrom().item(Optional.empty());
        }
        return read(key, type);
    }

    /**
     * Store a value directly.
     */
    public Uni<Void> put(String key, TtlClass ttlClass, Object value) {
        if (!isEnabled()) {
            return Uni.createFrom().voidItem();
        }
        return write(key, ttlClass, value);
    }

    /**
     * Remove a value. A computation already running for the key still answers its
     * waiters but does not store its result.
     */
    public Uni<Void> invalidate(String key) {
        final var flight = inFlight.remove(key);
        if (flight != null) {
            flight.stale().set(true);
        }
        if (!isEnabled()) {
            return Uni.createFrom().voidItem();
        }
        return Uni.createFrom()
                .deferred(() -> backend.delete(key))
                .onFailure()
                .recoverWithUni(e -> {
                    LOG.warnf("Cache delete failed for %s: %s", key, e.getMessage());
                    return Uni.createFrom().voidItem();
                })
                .invoke(() -> LOG.debugf("Cache invalidated: %s", key));
    }

    /**
     * Time-to-live for a value of the given class, or zero if it must not be cached.
     */
    Duration ttlFor(TtlClass ttlClass, Object value) {
        final var ttl = config.ttl();
        return switch (ttlClass) {
            case CREDENTIALS -> ttl.credentials();
            case AUTHZ_INFO -> ttl.authzInfo();
            case ABSOLUTE -> ttl.absolute();
            case SESSION -> {
                if (value instanceof Session session) {
                    final var remaining = session.remainingAbsolute(clock.instant());
                    yield remaining.compareTo(ttl.sessionAbsolute()) < 0 ? remaining : ttl.sessionAbsolute();
                }
                yield ttl.sessionAbsolute();
            }
        };
    }

    private <V> Uni<Optional<V>> read(String key, Class<V> type) {
        return Uni.createFrom()
                .deferred(() -> backend.get(key, type))
                .onFailure()
                .recoverWithItem(e -> {
                    logBackendFailure("read", key, e);
                    return Optional.empty();
                });
    }

    private Uni<Void> write(String key, TtlClass ttlClass, Object value) {
        final var ttl = ttlFor(ttlClass, value);
        if (ttl.isZero() || ttl.isNegative()) {
            return Uni.createFrom().voidItem();
        }
        return Uni.createFrom()
                .deferred(() -> backend.set(key, value, ttl))
                .onFailure()
                .recoverWithUni(e -> {
                    logBackendFailure("write", key, e);
                    return Uni.createFrom().voidItem();
                });
    }

    private void logBackendFailure(String operation, String key, Throwable e) {
        if (e instanceof CacheUnavailableException) {
            LOG.warnf("Cache unavailable on %s of %s, bypassing: %s", operation, key, e.getMessage());
        } else {
            LOG.warnf(e, "Cache %s failed for %s, bypassing", operation, key);
        }
    }

    /**
     * Number of computations currently running (for testing).
     */
    int inFlightCount() {
        return inFlight.size();
    }

    private record Flight(Uni<Object> uni, AtomicBoolean stale) {}
}
