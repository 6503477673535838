package bastion.core.model.session;

/**
 * A session could not be created, for example because no unique id was found.
 */
public class SessionCreationException extends RuntimeException {

    public SessionCreationException(String message) {
        super(message);
    }
}
