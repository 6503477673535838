package bastion.core.model.auth;

/**
 * Raised at startup when configuration is invalid or incomplete.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
