package bastion.core.service.auth;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import bastion.core.config.AuthcConfig;
import bastion.core.model.auth.AccountLockedException;
import bastion.core.model.auth.LockoutPolicy;
import bastion.core.port.out.SecurityEventPublisher;
import bastion.spi.FailedAttemptRepository;
import bastion.spi.FailedAttemptRepository.LockoutInfo;
import bastion.spi.SecurityEvent;

/**
 * Counts failed logins per principal and locks accounts at the configured threshold.
 *
 * <p>Every login first reserves an attempt with {@link #reserveAttempt}, which counts it
 * as a failure before any credential is checked. Once the threshold's worth of
 * attempts is reserved, further reservations are refused until one of them resolves,
 * so parallel logins never get more than the threshold's worth of password checks. A
 * reserved attempt is then resolved exactly once:
 * <ul>
 *   <li>{@link #recordFailure}: the attempt stays counted; the one that reaches the
 *       threshold records the lock, clears the counter and announces the lock</li>
 *   <li>{@link #recordSuccess}: the counter is cleared, unless the account was locked
 *       while the attempt was being checked</li>
 *   <li>{@link #release}: the attempt is given back because it was neither</li>
 * </ul>
 *
 * <p>With no threshold configured the tracker is disabled: it keeps no state and never
 * reports an account as locked.
 *
 * <p>Increments are delegated to {@link FailedAttemptRepository}, which applies them
 * atomically. State already written is not rolled back if the caller cancels.
 */
@ApplicationScoped
public class AccountLockoutTracker {

    private static final Logger LOG = Logger.getLogger(AccountLockoutTracker.class);
    private static final String KEY_PREFIX = "principal:";

    private final LockoutPolicy policy;
    private final FailedAttemptRepository repository;
    private final Optional<Duration> lockoutDuration;
    private final Optional<Duration> failedAttemptWindow;
    private final SecurityEventPublisher events;
    private final Clock clock;

    @Inject
    public AccountLockoutTracker(
            AuthcConfig config, FailedAttemptRepository repository, SecurityEventPublisher events, Clock clock) {
        this.policy = LockoutPolicy.fromThreshold(config.accountLockThreshold());
        this.repository = repository;
        this.lockoutDuration = config.lockoutDuration();
        this.failedAttemptWindow = config.failedAttemptWindow();
        this.events = events;
        this.clock = clock;

        if (policy instanceof LockoutPolicy.Enabled enabled) {
            LOG.infof(
                    "Account lockout enabled: threshold=%d, duration=%s",
                    enabled.threshold(), lockoutDuration.map(Duration::toString).orElse("until reset"));
        } else {
            LOG.info("Account lockout disabled");
        }
    }

    public LockoutPolicy policy() {
        return policy;
    }

    /**
     * Check whether a principal is locked.
     */
    public Uni<Boolean> isLocked(String principal) {
        if (!(policy instanceof LockoutPolicy.Enabled)) {
            return Uni.createFrom().item(false);
        }
        return repository.isLockedOut(key(principal));
    }

    /**
     * Reserve a login attempt before its credentials are checked.
     *
     * @return Uni with the reserved attempt, or failing with {@link AccountLockedException}
     *     when the account is locked or the threshold's worth of attempts is already taken
     */
    public Uni<Attempt> reserveAttempt(String principal) {
        if (!(policy instanceof LockoutPolicy.Enabled enabled)) {
            return Uni.createFrom().item(Attempt.untracked(principal));
        }
        final var key = key(principal);
        return repository.recordFailedAttempt(key, failedAttemptWindow).chain(count -> repository
                .isLockedOut(key)
                .chain(locked -> {
                    if (!locked && count <= enabled.threshold()) {
                        return Uni.createFrom().item(new Attempt(principal, count));
                    }
                    LOG.debugf("Refused attempt %s for %s, locked=%s", count, principal, locked);
                    return releaseQuietly(key)
                            .chain(() -> Uni.createFrom().<Attempt>failure(new AccountLockedException(principal)));
                }));
    }

    /**
     * Resolve a reserved attempt as a failed login.
     *
     * @return Uni with the tally; {@link FailureTally#locked()} is true when this failure
     *     reached the threshold
     */
    public Uni<FailureTally> recordFailure(Attempt attempt) {
        if (!attempt.tracked() || !(policy instanceof LockoutPolicy.Enabled enabled)) {
            return Uni.createFrom().item(FailureTally.NOT_TRACKED);
        }
        final var principal = attempt.principal();
        final long count = attempt.reservedCount();
        if (!enabled.reached(count)) {
            LOG.debugf("Failed login %s of %s for %s", count, enabled.threshold(), principal);
            return Uni.createFrom().item(new FailureTally(count, false));
        }
        LOG.warnf("Locking account %s after %s failed logins", principal, count);
        final var key = key(principal);
        return repository
                .recordLockout(key, lockoutDuration, count)
                .chain(() -> repository.clearFailedAttempts(key))
                .invoke(() -> events.publish(new SecurityEvent.AccountLocked(clock.instant(), principal, count)))
                .replaceWith(new FailureTally(count, true));
    }

    /**
     * Resolve a reserved attempt as a successful login and reset the principal's count.
     *
     * @return Uni failing with {@link AccountLockedException} when the account was locked
     *     while the attempt was being checked; the lock is left in place
     */
    public Uni<Void> recordSuccess(Attempt attempt) {
        if (!attempt.tracked()) {
            return Uni.createFrom().voidItem();
        }
        final var principal = attempt.principal();
        final var key = key(principal);
        return repository.isLockedOut(key).chain(locked -> {
            if (locked) {
                LOG.debugf("Correct credentials for %s arrived after the account was locked", principal);
                return Uni.createFrom().<Void>failure(new AccountLockedException(principal));
            }
            return repository.clearFailedAttempts(key);
        });
    }

    /**
     * Give back a reserved attempt that was neither a success nor a counted failure.
     */
    public Uni<Void> release(Attempt attempt) {
        if (!attempt.tracked()) {
            return Uni.createFrom().voidItem();
        }
        return releaseQuietly(key(attempt.principal()));
    }

    private Uni<Void> releaseQuietly(String key) {
        return repository.releaseFailedAttempt(key).onFailure().recoverWithUni(e -> {
            LOG.warnf("Could not release attempt for %s: %s", key, e.getMessage());
            return Uni.createFrom().voidItem();
        });
    }

    /**
     * Administrative unlock.
     */
    public Uni<Void> unlock(String principal) {
        if (!(policy instanceof LockoutPolicy.Enabled)) {
            return Uni.createFrom().voidItem();
        }
        final var key = key(principal);
        return repository.clearFailedAttempts(key).chain(() -> repository.clearLockout(key)).invoke(() -> {
            LOG.infof("Account %s unlocked", principal);
            events.publish(new SecurityEvent.AccountUnlocked(clock.instant(), principal));
        });
    }

    /**
     * Stream current lockouts.
     */
    public Multi<LockoutInfo> lockedAccounts() {
        if (!(policy instanceof LockoutPolicy.Enabled)) {
            return Multi.createFrom().empty();
        }
        return repository.streamAllLockouts();
    }

    private static String key(String principal) {
        return KEY_PREFIX + principal;
    }

    /**
     * An attempt reserved by {@link #reserveAttempt}.
     *
     * @param principal     the principal logging in
     * @param reservedCount the attempt's place in the failure count, 0 when lockout is disabled
     */
    public record Attempt(String principal, long reservedCount) {

        static Attempt untracked(String principal) {
            return new Attempt(principal, 0);
        }

        boolean tracked() {
            return reservedCount > 0;
        }
    }

    /**
     * Outcome of recording one failure.
     *
     * @param failedCount failures counted so far, 0 when lockout is disabled
     * @param locked      true if this failure locked the account
     */
    public record FailureTally(long failedCount, boolean locked) {

        static final FailureTally NOT_TRACKED = new FailureTally(0, false);
    }
}
