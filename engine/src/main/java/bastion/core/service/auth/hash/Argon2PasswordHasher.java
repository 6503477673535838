package bastion.core.service.auth.hash;

import java.util.Arrays;
import java.util.Map;

import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;

import bastion.core.model.auth.CredentialRecord;
import bastion.core.model.auth.HashAlgorithmSpec;
import bastion.core.model.auth.VerificationException;

/**
 * Argon2id, the memory-hard default.
 *
 * <p>Rounds are the Argon2 iteration count. Hashes use the PHC string format
 * {@code $argon2id$v=19$m=<KiB>,t=<iterations>,p=<lanes>$<salt>$<hash>}. A configured
 * pepper is passed as the Argon2 secret.
 */
public class Argon2PasswordHasher extends AbstractPasswordHasher {

    public static final String ID = "argon2";

    static final Map<String, Integer> DEFAULTS = Map.of(
            HashAlgorithmSpec.DEFAULT_ROUNDS, 3,
            HashAlgorithmSpec.MIN_ROUNDS, 1,
            HashAlgorithmSpec.MAX_ROUNDS, 10,
            HashAlgorithmSpec.SALT_SIZE, 16,
            HashAlgorithmSpec.MEMORY_COST, 65536,
            HashAlgorithmSpec.PARALLELISM, 1);

    private static final String PREFIX = "$argon2id$v=19$";
    private static final int HASH_LENGTH = 32;

    public Argon2PasswordHasher(HashAlgorithmSpec spec) {
        super(spec, 1, 100);
    }

    @Override
    public CredentialRecord hash(String principal, char[] password, int rounds) {
        checkRounds(rounds);
        final int memory = spec().require(HashAlgorithmSpec.MEMORY_COST);
        final int lanes = spec().require(HashAlgorithmSpec.PARALLELISM);
        final var salt = newSalt(spec().require(HashAlgorithmSpec.SALT_SIZE));
        final var hash = derive(password, salt, memory, rounds, lanes, HASH_LENGTH);

        final var encoded = PREFIX + "m=" + memory + ",t=" + rounds + ",p=" + lanes + "$" + B64.encodeToString(salt)
                + "$" + B64.encodeToString(hash);
        return new CredentialRecord(
                principal,
                ID,
                encoded,
                Map.of(
                        HashAlgorithmSpec.DEFAULT_ROUNDS, rounds,
                        HashAlgorithmSpec.MEMORY_COST, memory,
                        HashAlgorithmSpec.PARALLELISM, lanes));
    }

    @Override
    public boolean verify(char[] password, CredentialRecord record) {
        final var parsed = parse(record);
        final var actual = derive(
                password, parsed.salt(), parsed.memory(), parsed.iterations(), parsed.lanes(), parsed.hash().length);
        return org.bouncycastle.util.Arrays.constantTimeAreEqual(parsed.hash(), actual);
    }

    @Override
    public int rounds(CredentialRecord record) {
        return parse(record).iterations();
    }

    @Override
    public boolean isWeaker(CredentialRecord record) {
        final var parsed = parse(record);
        return parsed.iterations() < spec().minRounds()
                || parsed.memory() < spec().require(HashAlgorithmSpec.MEMORY_COST);
    }

    private byte[] derive(char[] password, byte[] salt, int memory, int iterations, int lanes, int length) {
        final var builder = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
                .withVersion(Argon2Parameters.ARGON2_VERSION_13)
                .withSalt(salt)
                .withMemoryAsKB(memory)
                .withIterations(iterations)
                .withParallelism(lanes);
        final var pepper = pepper();
        if (pepper != null) {
            builder.withSecret(pepper);
        }
        final var generator = new Argon2BytesGenerator();
        generator.init(builder.build());
        final var input = utf8(password);
        try {
            final var output = new byte[length];
            generator.generateBytes(input, output, 0, output.length);
            return output;
        } finally {
            Arrays.fill(input, (byte) 0);
        }
    }

    private Parsed parse(CredentialRecord record) {
        final var hash = record.hash();
        if (!hash.startsWith(PREFIX)) {
            throw new VerificationException("Not an argon2id hash");
        }
        final var parts = hash.substring(PREFIX.length()).split("\\$");
        if (parts.length != 3) {
            throw new VerificationException("Malformed argon2id hash");
        }
        try {
            int memory = -1;
            int iterations = -1;
            int lanes = -1;
            for (var param : parts[0].split(",")) {
                final var kv = param.split("=", 2);
                final int value = Integer.parseInt(kv[1]);
                switch (kv[0]) {
                    case "m" -> memory = value;
                    case "t" -> iterations = value;
                    case "p" -> lanes = value;
                    default -> throw new VerificationException("Unknown argon2 parameter: " + kv[0]);
                }
            }
            if (memory < 1 || iterations < 1 || lanes < 1) {
                throw new VerificationException("Incomplete argon2id parameters");
            }
            return new Parsed(memory, iterations, lanes, B64_DECODER.decode(parts[1]), B64_DECODER.decode(parts[2]));
        } catch (IllegalArgumentException | ArrayIndexOutOfBoundsException e) {
            throw new VerificationException("Malformed argon2id hash", e);
        }
    }

    private record Parsed(int memory, int iterations, int lanes, byte[] salt, byte[] hash) {}
}
