package bastion.core.config;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for credential verification.
 *
 * <p>Configuration prefix: {@code bastion.authc}
 *
 * <p>Covers the hash algorithms the engine accepts, the algorithm new and migrated
 * credentials are written with, account lockout, and the time-based one-time code
 * second factor.
 *
 * @see bastion.core.service.auth.HashAlgorithmRegistry
 * @see bastion.core.service.auth.AccountLockoutTracker
 * @see bastion.core.service.auth.MfaChallengeService
 */
@ConfigMapping(prefix = "bastion.authc")
public interface AuthcConfig {

    /**
     * Consecutive failed attempts after which an account is locked.
     *
     * <p>When absent, lockout is disabled: no failure state is kept and no account
     * is ever reported as locked.
     *
     * @return threshold, or empty when lockout is disabled
     */
    OptionalInt accountLockThreshold();

    /**
     * How long a lock lasts before it lifts on its own.
     *
     * <p>When absent, a lock holds until a successful reset or an administrative unlock.
     *
     * @return lock duration, or empty for no automatic expiry
     */
    Optional<Duration> lockoutDuration();

    /**
     * Window after which a run of failed attempts is forgotten.
     *
     * @return window, or empty to keep counting until a reset
     */
    Optional<Duration> failedAttemptWindow();

    /**
     * Algorithm used for new credentials and for migration on login.
     *
     * @return algorithm id (default: argon2)
     */
    @WithDefault("argon2")
    String preferredAlgorithm();

    /**
     * Algorithms accepted when verifying stored credentials.
     *
     * @return algorithm ids (default: argon2, bcrypt_sha256, pbkdf2_sha256)
     */
    @WithDefault("argon2,bcrypt_sha256,pbkdf2_sha256")
    Set<String> algorithms();

    /**
     * Per-algorithm parameters keyed by algorithm id.
     *
     * <p>Algorithms without an entry use their built-in defaults.
     */
    Map<String, HashAlgorithmConfig> hashAlgorithms();

    /**
     * Time-based one-time code configuration.
     */
    TotpConfig totp();

    /**
     * Parameters for a single hash algorithm. Every value is optional and falls back
     * to the algorithm's own default.
     */
    interface HashAlgorithmConfig {

        /**
         * Work factor used for new hashes (rounds, bcrypt cost or argon2 iterations).
         */
        OptionalInt defaultRounds();

        /**
         * Lowest acceptable work factor. Stored hashes below it are upgraded on login.
         */
        OptionalInt minRounds();

        /**
         * Highest acceptable work factor.
         */
        OptionalInt maxRounds();

        /**
         * Salt length in bytes.
         */
        OptionalInt saltSize();

        /**
         * Memory cost in KiB (memory-hard algorithms only).
         */
        OptionalInt memoryCost();

        /**
         * Degree of parallelism (memory-hard algorithms only).
         */
        OptionalInt parallelism();

        /**
         * Application-wide secret mixed into the hash, for algorithms that accept one.
         */
        Optional<String> pepper();
    }

    /**
     * Time-based one-time code configuration.
     */
    interface TotpConfig {

        /**
         * Name of the dispatcher that delivers challenges.
         *
         * <p>When absent, the second factor is disabled and login never asks for a code.
         *
         * @return dispatcher name, or empty when MFA is disabled
         */
        Optional<String> mfaDispatcher();

        /**
         * Tag of the application key that wraps newly enrolled secrets.
         *
         * <p>Defaults to the lexically greatest configured tag, so tags named after
         * a timestamp rotate naturally.
         */
        Optional<String> defaultTag();

        /**
         * Application keys keyed by tag. A tag stays usable for verification as long
         * as its key remains configured.
         */
        Map<String, String> secrets();

        /**
         * Log2 of the key-derivation rounds applied to application keys.
         *
         * @return cost (default: 12)
         */
        @WithDefault("12")
        int cost();

        /**
         * Length of one time step.
         *
         * @return time step (default: 30 seconds)
         */
        @WithDefault("PT30S")
        Duration timeStep();

        /**
         * Number of digits in a code.
         *
         * @return digits (default: 6)
         */
        @WithDefault("6")
        int digits();
    }
}
