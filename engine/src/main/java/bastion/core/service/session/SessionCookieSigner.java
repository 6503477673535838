package bastion.core.service.session;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.util.Arrays;
import org.jboss.logging.Logger;

import bastion.core.config.SessionConfig;
import bastion.core.model.auth.ConfigurationException;

/**
 * Signs session ids for transport in a cookie.
 *
 * <p>Cookie value: {@code <sessionId>.<base64url HMAC-SHA256(sessionId)>}, keyed with
 * {@code bastion.session.signed-cookie-secret}. Without a secret signing is disabled and
 * the raw session id is used.
 */
@ApplicationScoped
public class SessionCookieSigner {

    private static final Logger LOG = Logger.getLogger(SessionCookieSigner.class);
    private static final char SEPARATOR = '.';
    private static final int MIN_SECRET_BYTES = 32;
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final byte[] secret;

    @Inject
    public SessionCookieSigner(SessionConfig config) {
        this(config.signedCookieSecret());
    }

    public SessionCookieSigner(Optional<String> secret) {
        this.secret = secret.filter(s -> !s.isBlank())
                .map(s -> s.getBytes(StandardCharsets.UTF_8))
                .orElse(null);
        if (this.secret != null && this.secret.length < MIN_SECRET_BYTES) {
            throw new ConfigurationException(
                    "Signed cookie secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        if (this.secret == null) {
            LOG.warn("Session cookie signing is DISABLED. Set bastion.session.signed-cookie-secret to enable.");
        }
    }

    public boolean isEnabled() {
        return secret != null;
    }

    /**
     * Produce the cookie value for a session id.
     */
    public String sign(String sessionId) {
        if (!isEnabled()) {
            return sessionId;
        }
        return sessionId + SEPARATOR + ENCODER.encodeToString(mac(sessionId));
    }

    /**
     * Recover the session id from a cookie value.
     *
     * @return the session id, or empty if the value is malformed or the signature is wrong
     */
    public Optional<String> verify(String cookieValue) {
        if (cookieValue == null || cookieValue.isEmpty()) {
            return Optional.empty();
        }
        if (!isEnabled()) {
            return Optional.of(cookieValue);
        }
        final int separator = cookieValue.lastIndexOf(SEPARATOR);
        if (separator <= 0 || separator == cookieValue.length() - 1) {
            return Optional.empty();
        }
        final var sessionId = cookieValue.substring(0, separator);
        final byte[] presented;
        try {
            presented = Base64.getUrlDecoder().decode(cookieValue.substring(separator + 1));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        if (!Arrays.constantTimeAreEqual(mac(sessionId), presented)) {
            LOG.debug("Rejected session cookie with invalid signature");
            return Optional.empty();
        }
        return Optional.of(sessionId);
    }

    private byte[] mac(String value) {
        final var hmac = new HMac(new SHA256Digest());
        hmac.init(new KeyParameter(secret));
        final var input = value.getBytes(StandardCharsets.UTF_8);
        hmac.update(input, 0, input.length);
        final var out = new byte[hmac.getMacSize()];
        hmac.doFinal(out, 0);
        return out;
    }
}
