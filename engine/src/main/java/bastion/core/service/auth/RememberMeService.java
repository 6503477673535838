package bastion.core.service.auth;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;
import javax.crypto.spec.SecretKeySpec;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import bastion.core.config.RememberMeConfig;
import bastion.core.model.auth.ConfigurationException;
import bastion.core.model.auth.RememberMeToken;

/**
 * Issues and reads encrypted remember-me tokens.
 *
 * <p>The token is a JSON payload (principal, issue and expiry time) sealed with
 * AES-256-GCM under {@code bastion.remember-me.default-cipher-key}. A token that is
 * malformed, was sealed under another key, fails authentication or has expired reads
 * as absent; it never fails the request.
 *
 * <h2>Configuration</h2>
 * <pre>
 * bastion.remember-me.default-cipher-key=${REMEMBER_ME_KEY}  # Base64-encoded 256-bit key
 * bastion.remember-me.key-id=v1
 * </pre>
 */
@ApplicationScoped
public class RememberMeService {

    private static final Logger LOG = Logger.getLogger(RememberMeService.class);
    private static final byte[] CONTEXT = "bastion-remember-me".getBytes(StandardCharsets.UTF_8);

    private final Optional<AesGcmCipher> cipher;
    private final Duration ttl;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Inject
    public RememberMeService(RememberMeConfig config, ObjectMapper objectMapper, Clock clock) {
        this.ttl = config.ttl();
        this.objectMapper = objectMapper;
        this.clock = clock;
        if (ttl.isNegative() || ttl.isZero()) {
            throw new ConfigurationException("Remember-me TTL must be positive");
        }
        this.cipher = config.defaultCipherKey().filter(k -> !k.isBlank()).map(key -> {
            final byte[] keyBytes;
            try {
                keyBytes = Base64.getDecoder().decode(key);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Remember-me cipher key is not valid Base64", e);
            }
            if (keyBytes.length != 32) {
                throw new ConfigurationException(
                        "Remember-me cipher key must be 256 bits (32 bytes). Got: " + keyBytes.length + " bytes");
            }
            return new AesGcmCipher(new SecretKeySpec(keyBytes, "AES"), config.keyId());
        });
        if (cipher.isPresent()) {
            LOG.infof("Remember-me enabled with key ID: %s", config.keyId());
        } else {
            LOG.info("Remember-me disabled: no cipher key configured");
        }
    }

    public boolean isEnabled() {
        return cipher.isPresent();
    }

    /**
     * Issue a token for a principal.
     *
     * @return the token, or empty when remember-me is disabled
     */
    public Optional<RememberMeToken> issue(String principal) {
        return cipher.map(c -> {
            final var now = clock.instant();
            final var payload = new Payload(principal, now, now.plus(ttl));
            try {
                final var json = objectMapper.writeValueAsBytes(payload);
                return new RememberMeToken(principal, c.keyId(), c.encrypt(json, CONTEXT));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Failed to serialize remember-me payload", e);
            }
        });
    }

    /**
     * Resolve a token value to its principal.
     *
     * @return the principal, or empty if remember-me is disabled or the token is unusable
     */
    public Optional<String> resolve(String encryptedPayload) {
        if (cipher.isEmpty() || encryptedPayload == null || encryptedPayload.isBlank()) {
            return Optional.empty();
        }
        try {
            final var json = cipher.get().decrypt(encryptedPayload, CONTEXT);
            final var payload = objectMapper.readValue(json, Payload.class);
            if (payload.principal() == null || payload.expiresAt() == null) {
                LOG.debug("Remember-me token payload incomplete, ignoring");
                return Optional.empty();
            }
            if (!clock.instant().isBefore(payload.expiresAt())) {
                LOG.debugf("Remember-me token for %s expired at %s", payload.principal(), payload.expiresAt());
                return Optional.empty();
            }
            return Optional.of(payload.principal());
        } catch (GeneralSecurityException | IOException e) {
            LOG.debugf("Ignoring unreadable remember-me token: %s", e.getMessage());
            return Optional.empty();
        }
    }

    record Payload(String principal, Instant issuedAt, Instant expiresAt) {}
}
