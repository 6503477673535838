package bastion.core.model.session;

/**
 * The session is unknown, invalidated, or past one of its expiry bounds.
 *
 * <p>Terminal for the session: the caller must authenticate again.
 */
public class SessionExpiredException extends RuntimeException {

    private final String sessionId;

    public SessionExpiredException(String sessionId) {
        super("Session expired or not found");
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }
}
