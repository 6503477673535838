package bastion.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for remember-me tokens.
 *
 * <p>Configuration prefix: {@code bastion.remember-me}
 *
 * <pre>
 * bastion.remember-me.default-cipher-key=${REMEMBER_ME_KEY}  # Base64-encoded 256-bit key
 * bastion.remember-me.key-id=v1
 * </pre>
 */
@ConfigMapping(prefix = "bastion.remember-me")
public interface RememberMeConfig {

    /**
     * Base64-encoded AES-256 key. Remember-me is disabled when absent.
     */
    Optional<String> defaultCipherKey();

    /**
     * Identifier written into every token so keys can be rotated.
     *
     * @return key id (default: v1)
     */
    @WithDefault("v1")
    String keyId();

    /**
     * Lifetime of an issued token.
     *
     * @return TTL (default: 14 days)
     */
    @WithDefault("P14D")
    Duration ttl();
}
