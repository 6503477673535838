package bastion.core.service.session;

import java.security.SecureRandom;
import java.util.Base64;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Issues session ids: 256 random bits as unpadded URL-safe Base64.
 *
 * <p>{@link #isWellFormed} lets lookups turn away values that could never have been
 * issued before they reach a store.
 */
@ApplicationScoped
public class SessionIdGenerator {

    /** Length of every issued id. */
    public static final int ID_LENGTH = 43;

    private static final int ID_BYTES = 32;
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final SecureRandom random;

    public SessionIdGenerator() {
        this(new SecureRandom());
    }

    SessionIdGenerator(SecureRandom random) {
        this.random = random;
    }

    public String generate() {
        final var bytes = new byte[ID_BYTES];
        random.nextBytes(bytes);
        return ENCODER.encodeToString(bytes);
    }

    /**
     * Check whether a value has the shape of an issued id.
     */
    public static boolean isWellFormed(String sessionId) {
        if (sessionId == null || sessionId.length() != ID_LENGTH) {
            return false;
        }
        for (int i = 0; i < ID_LENGTH; i++) {
            final char c = sessionId.charAt(i);
            final boolean urlSafe = (c >= 'A' && c <= 'Z')
                    || (c >= 'a' && c <= 'z')
                    || (c >= '0' && c <= '9')
                    || c == '-'
                    || c == '_';
            if (!urlSafe) {
                return false;
            }
        }
        return true;
    }
}
