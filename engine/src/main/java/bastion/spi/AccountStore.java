package bastion.spi;

import java.util.List;

import io.smallrye.mutiny.Uni;

import bastion.core.model.auth.AuthorizationInfo;
import bastion.core.model.auth.CredentialRecord;
import bastion.core.model.auth.TotpSecret;

/**
 * Port to the system of record for accounts.
 *
 * <p>The engine never owns account data. It reads credentials and authorization info,
 * writes back re-hashed credentials after a migration on login, and stores one-time
 * code secrets on enrollment.
 *
 * <h2>Failure contract</h2>
 * <ul>
 *   <li>{@link AccountNotFoundException} - the principal does not exist (terminal)</li>
 *   <li>{@link StoreUnavailableException} - the store cannot be reached (retryable)</li>
 * </ul>
 * Any other failure is treated as non-retryable.
 */
public interface AccountStore {

    /**
     * Find the stored credential of a principal.
     *
     * @param principal account identifier
     * @return Uni with the record, failing with {@link AccountNotFoundException} if absent
     */
    Uni<CredentialRecord> findCredential(String principal);

    /**
     * Find the roles and permissions of a principal.
     *
     * @param principal account identifier
     * @return Uni with the authorization info, failing with {@link AccountNotFoundException} if absent
     */
    Uni<AuthorizationInfo> findAuthorizationInfo(String principal);

    /**
     * Replace the stored credential of a principal.
     *
     * @param record the new credential
     * @return Uni completing when stored
     */
    Uni<Void> updateCredential(CredentialRecord record);

    /**
     * Find all one-time code secrets of a principal, across tags.
     *
     * @param principal account identifier
     * @return Uni with the secrets, empty if the principal has not enrolled
     */
    Uni<List<TotpSecret>> findTotpSecrets(String principal);

    /**
     * Store a one-time code secret, replacing any secret with the same tag.
     *
     * @param secret the secret to store
     * @return Uni completing when stored
     */
    Uni<Void> saveTotpSecret(TotpSecret secret);
}
