package bastion.core.model.cache;

/**
 * Category of cached data, each with its own configured time-to-live.
 */
public enum TtlClass {
    /** Stored credential records. */
    CREDENTIALS,
    /** Roles and permissions. */
    AUTHZ_INFO,
    /** Session copies; never cached beyond the session's own absolute expiry. */
    SESSION,
    /** Anything else. */
    ABSOLUTE
}
