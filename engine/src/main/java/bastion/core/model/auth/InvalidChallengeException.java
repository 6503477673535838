package bastion.core.model.auth;

/**
 * A one-time code was malformed or could not be checked.
 */
public class InvalidChallengeException extends RuntimeException {

    public InvalidChallengeException(String message) {
        super(message);
    }

    public InvalidChallengeException(String message, Throwable cause) {
        super(message, cause);
    }
}
