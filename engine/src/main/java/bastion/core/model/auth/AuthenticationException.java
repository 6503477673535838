package bastion.core.model.auth;

/**
 * Generic authentication failure.
 *
 * <p>The message is identical for every cause so callers cannot tell a wrong password
 * from an unknown or locked account. The precise {@link FailureReason} is available to
 * auditing code through {@link #reason()}.
 */
public class AuthenticationException extends RuntimeException {

    public static final String GENERIC_MESSAGE = "Authentication failed";

    private final transient String principal;
    private final FailureReason reason;

    public AuthenticationException(String principal, FailureReason reason) {
        this(principal, reason, null);
    }

    public AuthenticationException(String principal, FailureReason reason, Throwable cause) {
        super(GENERIC_MESSAGE, cause);
        this.principal = principal;
        this.reason = reason;
    }

    /**
     * Principal the attempt was made for. For auditing only.
     */
    public String principal() {
        return principal;
    }

    /**
     * Internal cause of the failure. For auditing only.
     */
    public FailureReason reason() {
        return reason;
    }
}
