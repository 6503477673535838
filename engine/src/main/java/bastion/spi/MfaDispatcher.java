package bastion.spi;

import java.time.Instant;

import io.smallrye.mutiny.Uni;

/**
 * Delivers one-time codes to users, for example by SMS or email.
 *
 * <p>Dispatchers are CDI beans; the one named by {@code bastion.authc.totp.mfa-dispatcher}
 * is used. With no dispatcher configured the second factor is not required.
 */
public interface MfaDispatcher {

    String name();

    /**
     * Deliver a code.
     *
     * @param principal recipient account
     * @param code      the one-time code
     * @param expiresAt last instant the code is accepted
     * @return Uni completing when the code is handed off
     */
    Uni<Void> dispatch(String principal, String code, Instant expiresAt);
}
