package bastion.core.model.auth;

/**
 * Internal cause of a failed authentication.
 *
 * <p>Recorded for auditing only. Callers always see the same generic failure.
 */
public enum FailureReason {
    /** No realm knows the account. */
    UNKNOWN_ACCOUNT,
    /** The account exists but the credential did not match. */
    INVALID_CREDENTIALS,
    /** The stored credential uses an algorithm the engine cannot verify. */
    UNVERIFIABLE_CREDENTIAL,
    /** The account is locked. */
    ACCOUNT_LOCKED,
    /** A second factor is required and none was submitted. */
    MFA_REQUIRED,
    /** The submitted second factor was wrong or stale. */
    MFA_FAILED;

    /**
     * Rank used when several realms fail: the most specific reason wins.
     */
    public int specificity() {
        return switch (this) {
            case UNKNOWN_ACCOUNT -> 0;
            case UNVERIFIABLE_CREDENTIAL -> 1;
            case INVALID_CREDENTIALS -> 2;
            case MFA_REQUIRED, MFA_FAILED -> 3;
            case ACCOUNT_LOCKED -> 4;
        };
    }
}
