package bastion.core.model.auth;

/**
 * An encrypted remember-me token.
 *
 * @param principal        account the token re-establishes
 * @param cipherKeyId      id of the key the payload was encrypted with
 * @param encryptedPayload opaque token value handed to the client
 */
public record RememberMeToken(String principal, String cipherKeyId, String encryptedPayload) {

    @Override
    public String toString() {
        return "RememberMeToken[principal=" + principal + ", cipherKeyId=" + cipherKeyId + "]";
    }
}
