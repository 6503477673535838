package bastion.core.service.auth;

import java.util.List;

import io.smallrye.mutiny.Uni;

import bastion.core.model.auth.AuthenticatedAccount;
import bastion.core.model.auth.AuthorizationInfo;
import bastion.core.model.auth.TotpSecret;
import bastion.core.model.auth.UsernamePasswordToken;

/**
 * One account store bound to its authentication and authorization verifiers.
 */
public interface Realm {

    String name();

    /**
     * Authenticate credentials.
     *
     * @return Uni with the account; fails with
     *     {@link bastion.core.model.auth.AuthenticationException} when the credentials are
     *     rejected, or {@link bastion.spi.StoreUnavailableException} when the store is down
     */
    Uni<AuthenticatedAccount> authenticate(UsernamePasswordToken token);

    /**
     * Roles and permissions of a principal; empty if the realm does not know it.
     */
    Uni<AuthorizationInfo> authorizationInfo(String principal);

    Uni<Boolean> isPermitted(String principal, String permission);

    Uni<Boolean> hasRole(String principal, String role);

    /**
     * Drop cached credential and authorization info of a principal.
     */
    Uni<Void> clearCachedInfo(String principal);

    /**
     * One-time code secrets of a principal; empty if the realm does not know it.
     */
    Uni<List<TotpSecret>> findTotpSecrets(String principal);

    /**
     * Store a secret; fails with {@link bastion.spi.AccountNotFoundException} if the realm
     * does not know the principal.
     */
    Uni<Void> saveTotpSecret(TotpSecret secret);
}
