package bastion.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for session management.
 *
 * <p>Configuration prefix: {@code bastion.session}
 *
 * <p>A session carries two independent clocks: the absolute timeout runs from
 * creation and is never extended, the idle timeout restarts on every access.
 */
@ConfigMapping(prefix = "bastion.session")
public interface SessionConfig {

    /**
     * Maximum lifetime of a session, measured from creation.
     *
     * @return absolute timeout (default: 30 minutes)
     */
    @WithDefault("PT30M")
    Duration absoluteTimeout();

    /**
     * Maximum inactivity between two accesses.
     *
     * @return idle timeout (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration idleTimeout();

    /**
     * Periodic validation sweep configuration.
     */
    ValidationConfig validation();

    /**
     * ID generation configuration.
     */
    IdGenerationConfig idGeneration();

    /**
     * Secret used to sign session cookies.
     *
     * @return signing secret, or empty when cookies are not signed by the engine
     */
    Optional<String> signedCookieSecret();

    /**
     * Validation sweep settings.
     */
    interface ValidationConfig {

        /**
         * Enable the background sweep that evicts expired sessions.
         *
         * @return true if enabled (default: false)
         */
        @WithDefault("false")
        boolean schedulerEnabled();

        /**
         * Time between two sweeps.
         *
         * @return interval (default: 1 hour)
         */
        @WithDefault("PT1H")
        Duration interval();
    }

    /**
     * Session ID generation settings.
     */
    interface IdGenerationConfig {

        /**
         * Attempts made to find an unused session ID before giving up.
         *
         * @return max retries (default: 3)
         */
        @WithDefault("3")
        int maxRetries();
    }
}
