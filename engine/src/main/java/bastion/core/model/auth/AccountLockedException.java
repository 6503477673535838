package bastion.core.model.auth;

/**
 * Authentication failure caused by account lockout.
 *
 * <p>Carries the same generic message as any other authentication failure.
 */
public class AccountLockedException extends AuthenticationException {

    public AccountLockedException(String principal) {
        super(principal, FailureReason.ACCOUNT_LOCKED);
    }
}
