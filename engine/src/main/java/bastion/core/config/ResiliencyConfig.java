package bastion.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for calls to external backends.
 *
 * <p>Configuration prefix: {@code bastion.resiliency}
 */
@ConfigMapping(prefix = "bastion.resiliency")
public interface ResiliencyConfig {

    /**
     * Account store retry configuration.
     */
    StoreConfig store();

    /**
     * Retry settings for account store calls that fail with a transient error.
     */
    interface StoreConfig {

        /**
         * Total attempts, the first call included.
         *
         * @return attempts (default: 3)
         */
        @WithDefault("3")
        int maxAttempts();

        /**
         * Delay before the first retry.
         *
         * @return initial backoff (default: 50 milliseconds)
         */
        @WithDefault("PT0.05S")
        Duration initialBackoff();

        /**
         * Upper bound for the delay between retries.
         *
         * @return max backoff (default: 1 second)
         */
        @WithDefault("PT1S")
        Duration maxBackoff();
    }
}
