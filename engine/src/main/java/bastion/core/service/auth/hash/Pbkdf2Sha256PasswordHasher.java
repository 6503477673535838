package bastion.core.service.auth.hash;

import java.util.Arrays;
import java.util.Map;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.params.KeyParameter;

import bastion.core.model.auth.CredentialRecord;
import bastion.core.model.auth.HashAlgorithmSpec;
import bastion.core.model.auth.VerificationException;

/**
 * Salted PBKDF2-HMAC-SHA256 with configurable stretching.
 *
 * <p>Hashes are stored as {@code $pbkdf2-sha256$<rounds>$<salt>$<hash>}. A configured
 * pepper is appended to the password before derivation.
 */
public class Pbkdf2Sha256PasswordHasher extends AbstractPasswordHasher {

    public static final String ID = "pbkdf2_sha256";

    static final Map<String, Integer> DEFAULTS = Map.of(
            HashAlgorithmSpec.DEFAULT_ROUNDS, 110000,
            HashAlgorithmSpec.MIN_ROUNDS, 1000,
            HashAlgorithmSpec.MAX_ROUNDS, 1000000,
            HashAlgorithmSpec.SALT_SIZE, 16);

    private static final String PREFIX = "$pbkdf2-sha256$";
    private static final int KEY_BITS = 256;

    public Pbkdf2Sha256PasswordHasher(HashAlgorithmSpec spec) {
        super(spec, 1, Integer.MAX_VALUE);
    }

    @Override
    public CredentialRecord hash(String principal, char[] password, int rounds) {
        checkRounds(rounds);
        final var salt = newSalt(spec().require(HashAlgorithmSpec.SALT_SIZE));
        final var hash = derive(password, salt, rounds);
        final var encoded = PREFIX + rounds + "$" + B64.encodeToString(salt) + "$" + B64.encodeToString(hash);
        return new CredentialRecord(principal, ID, encoded, Map.of(HashAlgorithmSpec.DEFAULT_ROUNDS, rounds));
    }

    @Override
    public boolean verify(char[] password, CredentialRecord record) {
        final var parsed = parse(record);
        final var actual = derive(password, parsed.salt(), parsed.rounds());
        return org.bouncycastle.util.Arrays.constantTimeAreEqual(parsed.hash(), actual);
    }

    @Override
    public int rounds(CredentialRecord record) {
        return parse(record).rounds();
    }

    private byte[] derive(char[] password, byte[] salt, int rounds) {
        final var passwordBytes = utf8(password);
        final var pepper = pepper();
        final var input =
                pepper == null ? passwordBytes : org.bouncycastle.util.Arrays.concatenate(passwordBytes, pepper);
        try {
            final var generator = new PKCS5S2ParametersGenerator(new SHA256Digest());
            generator.init(input, salt, rounds);
            return ((KeyParameter) generator.generateDerivedParameters(KEY_BITS)).getKey();
        } finally {
            Arrays.fill(passwordBytes, (byte) 0);
            Arrays.fill(input, (byte) 0);
        }
    }

    private Parsed parse(CredentialRecord record) {
        final var hash = record.hash();
        if (!hash.startsWith(PREFIX)) {
            throw new VerificationException("Not a pbkdf2-sha256 hash");
        }
        final var parts = hash.substring(PREFIX.length()).split("\\$");
        if (parts.length != 3) {
            throw new VerificationException("Malformed pbkdf2-sha256 hash");
        }
        try {
            final int rounds = Integer.parseInt(parts[0]);
            if (rounds < 1) {
                throw new VerificationException("Invalid pbkdf2-sha256 rounds: " + rounds);
            }
            return new Parsed(rounds, B64_DECODER.decode(parts[1]), B64_DECODER.decode(parts[2]));
        } catch (IllegalArgumentException e) {
            throw new VerificationException("Malformed pbkdf2-sha256 hash", e);
        }
    }

    private record Parsed(int rounds, byte[] salt, byte[] hash) {}
}
