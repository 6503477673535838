package bastion.core.service.auth;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import javax.crypto.spec.SecretKeySpec;

import org.bouncycastle.crypto.PBEParametersGenerator;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.params.KeyParameter;
import org.jboss.logging.Logger;

import bastion.core.config.AuthcConfig.TotpConfig;
import bastion.core.model.auth.ConfigurationException;
import bastion.core.model.auth.InvalidChallengeException;
import bastion.core.model.auth.TotpSecret;

/**
 * Application keys that wrap per-user one-time code secrets, one per tag.
 *
 * <p>Each configured tag secret is stretched with PBKDF2-HMAC-SHA256 over
 * {@code 2^cost} rounds into an AES-256 key. New secrets are wrapped under the default
 * tag; secrets wrapped under other configured tags stay readable, which lets a key be
 * rotated without forcing every user to re-enroll at once. Removing a tag from
 * configuration retires it.
 *
 * <p>The default tag is the configured one, or the lexically greatest tag.
 */
public class TotpKeyring {

    private static final Logger LOG = Logger.getLogger(TotpKeyring.class);
    private static final String SALT_PREFIX = "bastion-totp:";
    private static final int MIN_COST = 4;
    private static final int MAX_COST = 24;

    private final Map<String, AesGcmCipher> ciphers;
    private final Optional<String> defaultTag;
    private final int cost;

    public TotpKeyring(TotpConfig config) {
        this.cost = config.cost();
        if (cost < MIN_COST || cost > MAX_COST) {
            throw new ConfigurationException(
                    "TOTP key cost must be between " + MIN_COST + " and " + MAX_COST + ", got " + cost);
        }
        final var keys = new TreeMap<String, AesGcmCipher>();
        config.secrets().forEach((tag, secret) -> {
            if (secret == null || secret.isBlank()) {
                throw new ConfigurationException("TOTP secret for tag '" + tag + "' is blank");
            }
            keys.put(tag, new AesGcmCipher(deriveKey(tag, secret, cost), tag));
        });
        this.ciphers = Collections.unmodifiableMap(keys);
        this.defaultTag = config.defaultTag().or(() -> keys.isEmpty() ? Optional.empty() : Optional.of(keys.lastKey()));
        defaultTag.ifPresent(tag -> {
            if (!ciphers.containsKey(tag)) {
                throw new ConfigurationException("TOTP default tag '" + tag + "' has no configured secret");
            }
        });
        LOG.debugf("TOTP keyring loaded with tags %s, default %s", ciphers.keySet(), defaultTag.orElse("<none>"));
    }

    private static SecretKeySpec deriveKey(String tag, String secret, int cost) {
        final var generator = new PKCS5S2ParametersGenerator(new SHA256Digest());
        generator.init(
                PBEParametersGenerator.PKCS5PasswordToUTF8Bytes(secret.toCharArray()),
                (SALT_PREFIX + tag).getBytes(StandardCharsets.UTF_8),
                1 << cost);
        return new SecretKeySpec(((KeyParameter) generator.generateDerivedParameters(256)).getKey(), "AES");
    }

    public boolean isEmpty() {
        return ciphers.isEmpty();
    }

    public boolean hasTag(String tag) {
        return ciphers.containsKey(tag);
    }

    /**
     * Tag new secrets are wrapped under.
     *
     * @throws ConfigurationException if no tag secrets are configured
     */
    public String defaultTag() {
        return defaultTag.orElseThrow(() -> new ConfigurationException("No TOTP secrets configured"));
    }

    public int cost() {
        return cost;
    }

    /**
     * Wrap a user secret under the default tag.
     */
    public TotpSecret wrap(String principal, String base32Secret) {
        final var tag = defaultTag();
        final var encrypted = ciphers.get(tag).encrypt(
                base32Secret.getBytes(StandardCharsets.US_ASCII), principal.getBytes(StandardCharsets.UTF_8));
        return new TotpSecret(principal, tag, encrypted, cost);
    }

    /**
     * Unwrap a stored user secret.
     *
     * @throws InvalidChallengeException if the tag is retired or the secret fails to decrypt
     */
    public String unwrap(TotpSecret secret) {
        final var cipher = ciphers.get(secret.tag());
        if (cipher == null) {
            throw new InvalidChallengeException("TOTP tag is not configured: " + secret.tag());
        }
        try {
            final var plain = cipher.decrypt(
                    secret.encryptedSecret(), secret.principal().getBytes(StandardCharsets.UTF_8));
            return new String(plain, StandardCharsets.US_ASCII);
        } catch (GeneralSecurityException e) {
            throw new InvalidChallengeException("Stored TOTP secret could not be decrypted", e);
        }
    }
}
