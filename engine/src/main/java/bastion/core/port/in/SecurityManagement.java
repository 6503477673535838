package bastion.core.port.in;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import bastion.core.model.auth.LoginResult;
import bastion.core.model.auth.RememberMeToken;
import bastion.core.model.auth.TotpEnrollment;
import bastion.core.model.auth.UsernamePasswordToken;
import bastion.core.model.session.Session;

/**
 * Use cases of the security manager.
 *
 * <p>Authorization checks take a session id; each check counts as an access of the
 * session and fails with {@link bastion.core.model.session.SessionExpiredException}
 * when the session is no longer valid.
 */
public interface SecurityManagement {

    /**
     * Authenticate and start a session.
     *
     * <p>Every rejection fails with the same generic
     * {@link bastion.core.model.auth.AuthenticationException}. The token's password is
     * wiped once the login completes.
     */
    Uni<LoginResult> login(UsernamePasswordToken token);

    /**
     * End a session and drop the principal's cached account data.
     */
    Uni<Void> logout(String sessionId);

    Uni<Session> touch(String sessionId);

    Uni<Boolean> isPermitted(String sessionId, String permission);

    /**
     * Check several permissions at once.
     *
     * @return Uni with one result per distinct permission, in the order given
     */
    Uni<Map<String, Boolean>> isPermitted(String sessionId, Collection<String> permissions);

    Uni<Boolean> isPermittedAll(String sessionId, Collection<String> permissions);

    Uni<Boolean> hasRole(String sessionId, String role);

    /**
     * Check several roles at once.
     *
     * @return Uni with one result per distinct role, in the order given
     */
    Uni<Map<String, Boolean>> hasRole(String sessionId, Collection<String> roles);

    Uni<Boolean> hasAllRoles(String sessionId, Collection<String> roles);

    /**
     * Fail with {@link bastion.core.model.auth.UnauthorizedException} unless permitted.
     */
    Uni<Void> checkPermission(String sessionId, String permission);

    /**
     * Fail with {@link bastion.core.model.auth.UnauthorizedException} unless the role is held.
     */
    Uni<Void> checkRole(String sessionId, String role);

    /**
     * Fail with {@link bastion.core.model.auth.UnauthorizedException} naming every
     * permission that is not granted.
     */
    Uni<Void> checkPermission(String sessionId, Collection<String> permissions);

    /**
     * Fail with {@link bastion.core.model.auth.UnauthorizedException} naming every role
     * that is not held.
     */
    Uni<Void> checkRole(String sessionId, Collection<String> roles);

    /**
     * Issue a remember-me token for the session's principal.
     *
     * @return Uni with the token, empty when remember-me is disabled
     */
    Uni<Optional<RememberMeToken>> remember(String sessionId);

    /**
     * Start a session from a remember-me token.
     *
     * @return Uni with the session, empty if the token is unusable or the account is locked
     */
    Uni<Optional<Session>> loginViaRememberMeToken(String encryptedPayload);

    /**
     * Drop cached credential and authorization data after an external account change.
     */
    Uni<Void> accountChanged(String principal);

    /**
     * Administrative unlock.
     */
    Uni<Void> unlock(String principal);

    /**
     * End every session of a principal.
     */
    Uni<Integer> invalidateAll(String principal);

    /**
     * Enroll a principal for one-time codes.
     */
    Uni<TotpEnrollment> enrollTotp(String principal);
}
