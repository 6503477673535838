package bastion.core.service.auth.hash;

import java.util.Arrays;
import java.util.Base64;
import java.util.Map;

import org.bouncycastle.crypto.Digest;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.OpenBSDBCrypt;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;

import bastion.core.model.auth.CredentialRecord;
import bastion.core.model.auth.HashAlgorithmSpec;
import bastion.core.model.auth.VerificationException;

/**
 * bcrypt over a SHA-256 pre-hash.
 *
 * <p>The password is first reduced to a Base64 SHA-256 digest (HMAC-SHA256 keyed with the
 * pepper when one is configured), which lifts bcrypt's 72 byte input limit. Rounds are
 * the bcrypt cost. Hashes are stored as {@code $bcrypt-sha256$} followed by the bcrypt
 * string.
 */
public class BcryptSha256PasswordHasher extends AbstractPasswordHasher {

    public static final String ID = "bcrypt_sha256";

    static final Map<String, Integer> DEFAULTS = Map.of(
            HashAlgorithmSpec.DEFAULT_ROUNDS, 12,
            HashAlgorithmSpec.MIN_ROUNDS, 10,
            HashAlgorithmSpec.MAX_ROUNDS, 16,
            HashAlgorithmSpec.SALT_SIZE, 16);

    private static final String PREFIX = "$bcrypt-sha256$";
    private static final String BCRYPT_VERSION = "2b";
    private static final int BCRYPT_SALT_SIZE = 16;

    public BcryptSha256PasswordHasher(HashAlgorithmSpec spec) {
        super(spec, 4, 31);
    }

    @Override
    public CredentialRecord hash(String principal, char[] password, int rounds) {
        checkRounds(rounds);
        final var prehashed = prehash(password);
        try {
            final var bcrypt = OpenBSDBCrypt.generate(BCRYPT_VERSION, prehashed, newSalt(BCRYPT_SALT_SIZE), rounds);
            return new CredentialRecord(
                    principal, ID, PREFIX + bcrypt, Map.of(HashAlgorithmSpec.DEFAULT_ROUNDS, rounds));
        } finally {
            Arrays.fill(prehashed, '\0');
        }
    }

    @Override
    public boolean verify(char[] password, CredentialRecord record) {
        final var bcrypt = bcryptPart(record);
        rounds(record);
        final var prehashed = prehash(password);
        try {
            return OpenBSDBCrypt.checkPassword(bcrypt, prehashed);
        } catch (IllegalArgumentException e) {
            throw new VerificationException("Malformed bcrypt hash", e);
        } finally {
            Arrays.fill(prehashed, '\0');
        }
    }

    @Override
    public int rounds(CredentialRecord record) {
        final var bcrypt = bcryptPart(record);
        // $2b$12$<53 chars>
        if (bcrypt.length() != 60 || bcrypt.charAt(0) != '$' || bcrypt.charAt(3) != '$' || bcrypt.charAt(6) != '$') {
            throw new VerificationException("Malformed bcrypt hash");
        }
        try {
            return Integer.parseInt(bcrypt.substring(4, 6));
        } catch (NumberFormatException e) {
            throw new VerificationException("Malformed bcrypt cost", e);
        }
    }

    private String bcryptPart(CredentialRecord record) {
        if (!record.hash().startsWith(PREFIX)) {
            throw new VerificationException("Not a bcrypt-sha256 hash");
        }
        return record.hash().substring(PREFIX.length());
    }

    private char[] prehash(char[] password) {
        final var input = utf8(password);
        try {
            final byte[] digest;
            final var pepper = pepper();
            if (pepper != null) {
                final var mac = new HMac(new SHA256Digest());
                mac.init(new KeyParameter(pepper));
                mac.update(input, 0, input.length);
                digest = new byte[mac.getMacSize()];
                mac.doFinal(digest, 0);
            } else {
                final Digest sha = new SHA256Digest();
                sha.update(input, 0, input.length);
                digest = new byte[sha.getDigestSize()];
                sha.doFinal(digest, 0);
            }
            final var encoded = Base64.getEncoder().encode(digest);
            final var chars = new char[encoded.length];
            for (int i = 0; i < encoded.length; i++) {
                chars[i] = (char) encoded[i];
            }
            return chars;
        } finally {
            Arrays.fill(input, (byte) 0);
        }
    }
}
