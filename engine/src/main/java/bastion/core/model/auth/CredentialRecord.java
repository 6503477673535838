package bastion.core.model.auth;

import java.util.Map;

/**
 * A stored credential for one principal.
 *
 * <p>The account store owns the record; the engine replaces it only when a
 * successful login finds it written with an outdated algorithm or work factor.
 *
 * @param principal       account identifier
 * @param algorithmId     id of the hash algorithm that produced {@code hash}
 * @param hash            encoded hash, including salt and work factor
 * @param algorithmParams work-factor parameters the hash was produced with
 */
public record CredentialRecord(
        String principal, String algorithmId, String hash, Map<String, Integer> algorithmParams) {

    public CredentialRecord {
        if (principal == null || principal.isBlank()) {
            throw new IllegalArgumentException("Principal cannot be null or blank");
        }
        if (algorithmId == null || algorithmId.isBlank()) {
            throw new IllegalArgumentException("Algorithm ID cannot be null or blank");
        }
        if (hash == null) {
            throw new IllegalArgumentException("Hash cannot be null");
        }
        algorithmParams = algorithmParams == null ? Map.of() : Map.copyOf(algorithmParams);
    }

    /**
     * Return a stored parameter, or the given fallback when absent.
     */
    public int param(String name, int fallback) {
        return algorithmParams.getOrDefault(name, fallback);
    }
}
