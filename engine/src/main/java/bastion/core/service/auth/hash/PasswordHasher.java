package bastion.core.service.auth.hash;

import bastion.core.model.auth.CredentialRecord;
import bastion.core.model.auth.HashAlgorithmSpec;

/**
 * One password hashing scheme.
 *
 * <p>Implementations are stateless apart from their immutable {@link HashAlgorithmSpec}
 * and safe to call from many threads. Every method is CPU bound; callers run them on a
 * worker pool.
 */
public interface PasswordHasher {

    String id();

    HashAlgorithmSpec spec();

    /**
     * Hash a password with the given work factor.
     *
     * @throws IllegalArgumentException if {@code rounds} is outside the configured bounds
     */
    CredentialRecord hash(String principal, char[] password, int rounds);

    /**
     * Hash a password with the configured default work factor.
     */
    default CredentialRecord hash(String principal, char[] password) {
        return hash(principal, password, spec().defaultRounds());
    }

    /**
     * Check a password against a stored record produced by this scheme.
     *
     * @throws bastion.core.model.auth.VerificationException if the stored hash is malformed
     */
    boolean verify(char[] password, CredentialRecord record);

    /**
     * Work factor the stored hash was produced with.
     *
     * @throws bastion.core.model.auth.VerificationException if the stored hash is malformed
     */
    int rounds(CredentialRecord record);

    /**
     * Check whether a stored hash is weaker than the configured minimum.
     */
    default boolean isWeaker(CredentialRecord record) {
        return rounds(record) < spec().minRounds();
    }
}
