package bastion.core.model.auth;

/**
 * A one-time code matched a time step outside the accepted window, or was already used.
 */
public class ExpiredChallengeException extends RuntimeException {

    public ExpiredChallengeException(String message) {
        super(message);
    }
}
