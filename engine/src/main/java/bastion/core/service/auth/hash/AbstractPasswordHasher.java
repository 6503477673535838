package bastion.core.service.auth.hash;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Base64;

import org.bouncycastle.crypto.PBEParametersGenerator;

import bastion.core.model.auth.ConfigurationException;
import bastion.core.model.auth.HashAlgorithmSpec;

/**
 * Shared bounds checking, salt generation and encoding for password hashers.
 */
abstract class AbstractPasswordHasher implements PasswordHasher {

    static final Base64.Encoder B64 = Base64.getEncoder().withoutPadding();
    static final Base64.Decoder B64_DECODER = Base64.getDecoder();

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final int MIN_SALT_SIZE = 8;

    private final HashAlgorithmSpec spec;

    AbstractPasswordHasher(HashAlgorithmSpec spec, int lowestRounds, int highestRounds) {
        this.spec = spec;
        final int min = spec.minRounds();
        final int def = spec.defaultRounds();
        final int max = spec.maxRounds();
        if (!(min <= def && def <= max)) {
            throw new ConfigurationException(String.format(
                    "Hash algorithm %s requires min_rounds <= default_rounds <= max_rounds, got %d, %d, %d",
                    spec.id(), min, def, max));
        }
        if (min < lowestRounds || max > highestRounds) {
            throw new ConfigurationException(String.format(
                    "Hash algorithm %s supports rounds between %d and %d, got %d..%d",
                    spec.id(), lowestRounds, highestRounds, min, max));
        }
        if (spec.parameters().containsKey(HashAlgorithmSpec.SALT_SIZE)
                && spec.require(HashAlgorithmSpec.SALT_SIZE) < MIN_SALT_SIZE) {
            throw new ConfigurationException(
                    "Hash algorithm " + spec.id() + " requires a salt of at least " + MIN_SALT_SIZE + " bytes");
        }
    }

    @Override
    public HashAlgorithmSpec spec() {
        return spec;
    }

    @Override
    public String id() {
        return spec.id();
    }

    void checkRounds(int rounds) {
        if (rounds < spec.minRounds() || rounds > spec.maxRounds()) {
            throw new IllegalArgumentException(String.format(
                    "Rounds %d outside configured bounds %d..%d for %s",
                    rounds, spec.minRounds(), spec.maxRounds(), spec.id()));
        }
    }

    byte[] newSalt(int size) {
        final var salt = new byte[size];
        RANDOM.nextBytes(salt);
        return salt;
    }

    byte[] pepper() {
        return spec.pepper().map(p -> p.getBytes(StandardCharsets.UTF_8)).orElse(null);
    }

    static byte[] utf8(char[] password) {
        return PBEParametersGenerator.PKCS5PasswordToUTF8Bytes(password);
    }
}
