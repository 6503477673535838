package bastion.core.model.auth;

/**
 * A stored credential could not be verified, for example because it names an
 * unknown algorithm or is not in the expected format.
 */
public class VerificationException extends RuntimeException {

    public VerificationException(String message) {
        super(message);
    }

    public VerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
