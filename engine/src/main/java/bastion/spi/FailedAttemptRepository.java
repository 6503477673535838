package bastion.spi;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

/**
 * SPI for tracking failed logins and lockouts per principal.
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>Increments MUST be atomic; a lost update lets an attacker exceed the threshold</li>
 *   <li>Counts never go negative; {@link #releaseFailedAttempt} stops at zero</li>
 *   <li>All operations MUST be non-blocking (return Uni/Multi)</li>
 * </ul>
 *
 * @see bastion.adapter.out.storage.memory.InMemoryFailedAttemptRepository
 * @see bastion.core.service.auth.AccountLockoutTracker
 */
public interface FailedAttemptRepository {

    /**
     * Record a failed attempt.
     *
     * @param key    principal key
     * @param window how long the count is kept after the latest failure, empty for no expiry
     * @return Uni with the count after incrementing
     */
    Uni<Long> recordFailedAttempt(String key, Optional<Duration> window);

    /**
     * Give back one attempt recorded by {@link #recordFailedAttempt}.
     *
     * <p>Used when an attempt was counted up front and then turned out not to be a
     * failure. A count already at zero stays there.
     *
     * @param key principal key
     * @return Uni completing when released
     */
    Uni<Void> releaseFailedAttempt(String key);

    /**
     * Get the current failed attempt count.
     *
     * @param key principal key
     * @return Uni with the count, 0 if none
     */
    Uni<Long> getFailedAttemptCount(String key);

    /**
     * Clear failed attempts for a key.
     *
     * @param key principal key
     * @return Uni completing when cleared
     */
    Uni<Void> clearFailedAttempts(String key);

    /**
     * Record a lockout.
     *
     * @param key            principal key
     * @param duration       how long the lockout lasts, empty until explicitly cleared
     * @param failedAttempts failures that triggered it
     * @return Uni completing when recorded
     */
    Uni<Void> recordLockout(String key, Optional<Duration> duration, long failedAttempts);

    /**
     * Check if a key is locked out.
     *
     * @param key principal key
     * @return Uni with true if locked out
     */
    Uni<Boolean> isLockedOut(String key);

    /**
     * Clear a lockout.
     *
     * @param key principal key
     * @return Uni completing when cleared
     */
    Uni<Void> clearLockout(String key);

    /**
     * Stream all current lockouts.
     *
     * @return Multi of lockout info
     */
    Multi<LockoutInfo> streamAllLockouts();

    /**
     * A current lockout.
     *
     * @param key            the locked key
     * @param lockedAt       when the lockout started
     * @param expiresAt      when it ends, empty if it lasts until cleared
     * @param failedAttempts failures that triggered it
     */
    record LockoutInfo(String key, Instant lockedAt, Optional<Instant> expiresAt, long failedAttempts) {}
}
