package bastion.spi;

import java.time.Instant;

import bastion.core.model.auth.FailureReason;

/**
 * Security events raised by the engine.
 *
 * <p>Events are dispatched to {@link SecurityEventHandler} implementations for auditing.
 * Unlike the errors returned to callers, failure events carry the precise reason.
 */
public sealed interface SecurityEvent {

    Instant timestamp();

    String principal();

    Severity severity();

    enum Severity {
        INFO,
        WARNING,
        CRITICAL
    }

    /**
     * Credentials accepted.
     *
     * @param timestamp when
     * @param principal account
     * @param realm     realm that accepted the credentials
     */
    record AuthenticationSucceeded(Instant timestamp, String principal, String realm) implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.INFO;
        }
    }

    /**
     * Login rejected.
     *
     * @param timestamp    when
     * @param principal    account the attempt was for
     * @param reason       internal cause
     * @param failureCount consecutive failures so far, 0 if not counted
     */
    record AuthenticationFailed(Instant timestamp, String principal, FailureReason reason, long failureCount)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return failureCount >= 3 ? Severity.WARNING : Severity.INFO;
        }
    }

    /**
     * Account locked after repeated failures.
     *
     * @param timestamp      when
     * @param principal      account
     * @param failedAttempts failures that triggered the lock
     */
    record AccountLocked(Instant timestamp, String principal, long failedAttempts) implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.CRITICAL;
        }
    }

    /**
     * Lockout cleared, by a successful login or an administrator.
     */
    record AccountUnlocked(Instant timestamp, String principal) implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.INFO;
        }
    }

    /**
     * Stored credential re-hashed during login.
     *
     * @param timestamp     when
     * @param principal     account
     * @param fromAlgorithm previous algorithm id
     * @param toAlgorithm   new algorithm id
     */
    record CredentialUpgraded(Instant timestamp, String principal, String fromAlgorithm, String toAlgorithm)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.INFO;
        }
    }

    /**
     * One-time code dispatched.
     */
    record MfaChallengeIssued(Instant timestamp, String principal, String dispatcher) implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.INFO;
        }
    }

    /**
     * Session created.
     */
    record SessionStarted(Instant timestamp, String principal, String sessionId) implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.INFO;
        }
    }

    /**
     * Session ended by logout or revocation.
     *
     * @param timestamp when
     * @param principal account
     * @param sessionId session, or {@code *} when every session of the principal ended
     * @param cause     short cause, e.g. {@code logout}
     */
    record SessionStopped(Instant timestamp, String principal, String sessionId, String cause)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.INFO;
        }
    }

    /**
     * Session found past one of its expiry bounds.
     */
    record SessionExpired(Instant timestamp, String principal, String sessionId) implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.INFO;
        }
    }
}
