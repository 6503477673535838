package bastion.core.model.session;

import java.time.Duration;
import java.time.Instant;

/**
 * An authenticated session.
 *
 * <p>Two clocks govern validity: the absolute expiry is fixed at creation and never
 * moves, the idle expiry is pushed forward on every validated access. The session is
 * valid only while the current time is before both.
 *
 * @param id             session identifier
 * @param principal      authenticated account
 * @param host           client host the session was created from, may be null
 * @param createdAt      when the session was created
 * @param lastAccessedAt when the session was last validated
 * @param absoluteExpiry {@code createdAt + absoluteTimeout}
 * @param idleExpiry     {@code lastAccessedAt + idleTimeout}
 */
public record Session(
        String id,
        String principal,
        String host,
        Instant createdAt,
        Instant lastAccessedAt,
        Instant absoluteExpiry,
        Instant idleExpiry) {

    public Session {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Session ID cannot be null or blank");
        }
        if (principal == null || principal.isBlank()) {
            throw new IllegalArgumentException("Principal cannot be null or blank");
        }
        if (createdAt == null || lastAccessedAt == null || absoluteExpiry == null || idleExpiry == null) {
            throw new IllegalArgumentException("Session timestamps cannot be null");
        }
    }

    /**
     * Create a new session starting at {@code now}.
     */
    public static Session start(
            String id, String principal, String host, Instant now, Duration absoluteTimeout, Duration idleTimeout) {
        return new Session(id, principal, host, now, now, now.plus(absoluteTimeout), now.plus(idleTimeout));
    }

    /**
     * Check whether the session is valid at the given instant.
     *
     * <p>This is the only validity predicate; lazy checks on access and the periodic
     * sweep both call it.
     */
    public boolean isValid(Instant now) {
        return now.isBefore(absoluteExpiry) && now.isBefore(idleExpiry);
    }

    /**
     * Create a copy accessed at {@code now}, with the idle window reset.
     */
    public Session touchedAt(Instant now, Duration idleTimeout) {
        return new Session(id, principal, host, createdAt, now, absoluteExpiry, now.plus(idleTimeout));
    }

    /**
     * Time left before the absolute expiry, never negative.
     */
    public Duration remainingAbsolute(Instant now) {
        final var remaining = Duration.between(now, absoluteExpiry);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }
}
