package bastion.core.model.auth;

import java.util.OptionalInt;

/**
 * Whether failed logins lead to account lockout.
 *
 * <p>{@link Disabled} is a supported configuration, not a degraded mode: the tracker
 * keeps no state and never reports an account as locked.
 */
public sealed interface LockoutPolicy {

    /**
     * Build the policy from the configured threshold.
     *
     * @param threshold configured threshold, empty when lockout is turned off
     * @throws ConfigurationException if the threshold is lower than one
     */
    static LockoutPolicy fromThreshold(OptionalInt threshold) {
        if (threshold.isEmpty()) {
            return new Disabled();
        }
        return new Enabled(threshold.getAsInt());
    }

    /**
     * Lockout is off.
     */
    record Disabled() implements LockoutPolicy {}

    /**
     * Lockout is on.
     *
     * @param threshold failed attempts that lock the account
     */
    record Enabled(int threshold) implements LockoutPolicy {

        public Enabled {
            if (threshold < 1) {
                throw new ConfigurationException("Account lock threshold must be at least 1, got: " + threshold);
            }
        }

        /**
         * Check whether the given failure count locks the account.
         */
        public boolean reached(long failedCount) {
            return failedCount >= threshold;
        }
    }
}
