package bastion.core.model.auth;

/**
 * The subject lacks a required permission or role.
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
