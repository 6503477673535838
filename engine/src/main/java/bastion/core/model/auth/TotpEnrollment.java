package bastion.core.model.auth;

/**
 * Result of enrolling a principal for one-time codes.
 *
 * @param secret        stored, wrapped secret
 * @param sharedSecret  base32 secret to hand to the user's authenticator, shown once
 */
public record TotpEnrollment(TotpSecret secret, String sharedSecret) {

    @Override
    public String toString() {
        return "TotpEnrollment[principal=" + secret.principal() + ", tag=" + secret.tag() + "]";
    }
}
