package bastion.core.service.session;

import java.time.Clock;
import java.util.Optional;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import bastion.core.cache.CacheHandler;
import bastion.core.cache.CacheKeys;
import bastion.core.config.SessionConfig;
import bastion.core.model.auth.ConfigurationException;
import bastion.core.model.cache.TtlClass;
import bastion.core.model.session.Session;
import bastion.core.model.session.SessionCreationException;
import bastion.core.model.session.SessionExpiredException;
import bastion.core.port.in.SessionManagement;
import bastion.core.port.out.SecurityEventPublisher;
import bastion.core.port.out.SessionRepository;
import bastion.spi.SecurityEvent;

/**
 * Session lifecycle with absolute and idle expiry.
 *
 * <p>The repository is authoritative. Every write is compare-and-set against the
 * session value just read, so a touch and a concurrent sweep never undo each other:
 * a sweep cannot delete a session that was extended after it looked, and a touch
 * that loses the race re-reads and decides again. An expired session is deleted and
 * never written back.
 *
 * <p>Read-only lookups go to the cache first. A cached copy is never newer than the
 * stored session, so a cached copy that is still valid can be trusted; one that looks
 * expired is confirmed against the repository.
 */
@ApplicationScoped
public class SessionService implements SessionManagement {

    private static final Logger LOG = Logger.getLogger(SessionService.class);
    static final String ALL_SESSIONS = "*";

    private final SessionRepository repository;
    private final SessionIdGenerator idGenerator;
    private final SessionConfig config;
    private final CacheHandler cache;
    private final SecurityEventPublisher events;
    private final Clock clock;

    @Inject
    public SessionService(
            SessionRepository repository,
            SessionIdGenerator idGenerator,
            SessionConfig config,
            CacheHandler cache,
            SecurityEventPublisher events,
            Clock clock) {
        if (config.absoluteTimeout().isNegative() || config.absoluteTimeout().isZero()) {
            throw new ConfigurationException("Session absolute timeout must be positive");
        }
        if (config.idleTimeout().isNegative() || config.idleTimeout().isZero()) {
            throw new ConfigurationException("Session idle timeout must be positive");
        }
        if (config.idGeneration().maxRetries() < 1) {
            throw new ConfigurationException("Session id generation max retries must be at least 1");
        }
        this.repository = repository;
        this.idGenerator = idGenerator;
        this.config = config;
        this.cache = cache;
        this.events = events;
        this.clock = clock;
    }

    @Override
    public Uni<Session> create(String principal, String host) {
        return createWithRetry(principal, host, 0);
    }

    private Uni<Session> createWithRetry(String principal, String host, int attempt) {
        final int maxRetries = config.idGeneration().maxRetries();
        if (attempt >= maxRetries) {
            return Uni.createFrom()
                    .failure(new SessionCreationException(
                            "Failed to generate unique session ID after " + maxRetries + " attempts"));
        }

        final var session = Session.start(
                idGenerator.generate(),
                principal,
                host,
                clock.instant(),
                config.absoluteTimeout(),
                config.idleTimeout());

        return repository.saveIfAbsent(session).chain(saved -> {
            if (saved) {
                LOG.infof("Session created for %s", principal);
                events.publish(new SecurityEvent.SessionStarted(session.createdAt(), principal, session.id()));
                return cache.put(CacheKeys.session(session.id()), TtlClass.SESSION, session)
                        .replaceWith(session);
            }
            LOG.warnf("Session ID collision detected (attempt %d/%d), retrying", attempt + 1, maxRetries);
            return createWithRetry(principal, host, attempt + 1);
        });
    }

    @Override
    public Uni<Session> touch(String sessionId) {
        if (!SessionIdGenerator.isWellFormed(sessionId)) {
            LOG.debug("Rejected malformed session id");
            return Uni.createFrom().failure(new SessionExpiredException(sessionId));
        }
        return touchAttempt(sessionId);
    }

    /**
     * Read, check and conditionally replace. A lost replace means another writer stored a
     * newer copy, so the loop rereads until it wins or the session is no longer valid.
     */
    private Uni<Session> touchAttempt(String sessionId) {
        return repository.findById(sessionId).chain(found -> {
            if (found.isEmpty()) {
                return cache.invalidate(CacheKeys.session(sessionId))
                        .chain(() -> Uni.createFrom().<Session>failure(new SessionExpiredException(sessionId)));
            }
            final var session = found.get();
            final var now = clock.instant();
            if (!session.isValid(now)) {
                return expire(session)
                        .chain(() -> Uni.createFrom().<Session>failure(new SessionExpiredException(sessionId)));
            }
            final var touched = session.touchedAt(now, config.idleTimeout());
            return repository.replace(session, touched).chain(replaced -> {
                if (replaced) {
                    return cache.put(CacheKeys.session(sessionId), TtlClass.SESSION, touched)
                            .replaceWith(touched);
                }
                LOG.debug("Session touch lost a race, rereading");
                return touchAttempt(sessionId);
            });
        });
    }

    @Override
    public Uni<Optional<Session>> getSession(String sessionId) {
        if (!SessionIdGenerator.isWellFormed(sessionId)) {
            return Uni.createFrom().item(Optional.empty());
        }
        final var key = CacheKeys.session(sessionId);
        return cache.get(key, Session.class).chain(cached -> {
            if (cached.isPresent() && cached.get().isValid(clock.instant())) {
                return Uni.createFrom().item(cached);
            }
            return repository.findById(sessionId).chain(found -> {
                if (found.isEmpty()) {
                    return cache.invalidate(key).replaceWith(Optional.<Session>empty());
                }
                final var session = found.get();
                if (!session.isValid(clock.instant())) {
                    return expire(session).replaceWith(Optional.<Session>empty());
                }
                return cache.put(key, TtlClass.SESSION, session).replaceWith(found);
            });
        });
    }

    @Override
    public Uni<Optional<Session>> invalidate(String sessionId) {
        return repository.findById(sessionId).chain(found -> repository
                .delete(sessionId)
                .chain(() -> cache.invalidate(CacheKeys.session(sessionId)))
                .invoke(() -> found.ifPresent(session -> {
                    LOG.infof("Session of %s invalidated", session.principal());
                    events.publish(new SecurityEvent.SessionStopped(
                            clock.instant(), session.principal(), sessionId, "logout"));
                }))
                .replaceWith(found));
    }

    @Override
    public Uni<Integer> invalidateAll(String principal) {
        LOG.infof("Invalidating all sessions for %s", principal);
        return repository.deleteByPrincipal(principal).chain(ids -> {
            Uni<Void> evictions = Uni.createFrom().voidItem();
            for (var id : ids) {
                evictions = evictions.chain(() -> cache.invalidate(CacheKeys.session(id)));
            }
            return evictions.invoke(() -> events.publish(
                            new SecurityEvent.SessionStopped(clock.instant(), principal, ALL_SESSIONS, "revoked")))
                    .replaceWith(ids.size());
        });
    }

    @Override
    public Uni<Integer> validateAll() {
        final var now = clock.instant();
        return repository
                .streamAll()
                .select()
                .where(session -> !session.isValid(now))
                .onItem()
                .transformToUniAndConcatenate(this::expire)
                .select()
                .where(Boolean::booleanValue)
                .collect()
                .with(Collectors.counting())
                .map(Long::intValue)
                .invoke(count -> {
                    if (count > 0) {
                        LOG.infof("Session validation removed %d expired session(s)", count);
                    }
                });
    }

    /**
     * Delete an expired session if it is still the stored value.
     *
     * @return Uni with true if this call removed it
     */
    private Uni<Boolean> expire(Session session) {
        return repository.deleteIfMatches(session).call(deleted -> {
            if (!deleted) {
                return Uni.createFrom().voidItem();
            }
            LOG.debugf("Session of %s expired", session.principal());
            events.publish(new SecurityEvent.SessionExpired(clock.instant(), session.principal(), session.id()));
            return cache.invalidate(CacheKeys.session(session.id()));
        });
    }
}
