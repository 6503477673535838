package bastion.core.model.auth;

/**
 * A principal's one-time code secret, wrapped with the application key of its tag.
 *
 * <p>A principal may hold several secrets; the one wrapped under the default tag is
 * current, others stay usable while their tag's key remains configured.
 *
 * @param principal       account identifier
 * @param tag             tag of the application key the secret is wrapped with
 * @param encryptedSecret wrapped secret, Base64-encoded
 * @param cost            log2 of the key-derivation rounds used for the wrapping key
 */
public record TotpSecret(String principal, String tag, String encryptedSecret, int cost) {

    public TotpSecret {
        if (principal == null || principal.isBlank()) {
            throw new IllegalArgumentException("Principal cannot be null or blank");
        }
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("Tag cannot be null or blank");
        }
        if (encryptedSecret == null || encryptedSecret.isBlank()) {
            throw new IllegalArgumentException("Encrypted secret cannot be null or blank");
        }
    }
}
