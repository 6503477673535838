package bastion.adapter.out.storage.memory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import bastion.core.model.auth.AuthorizationInfo;
import bastion.core.model.auth.CredentialRecord;
import bastion.core.model.auth.TotpSecret;
import bastion.spi.AccountNotFoundException;
import bastion.spi.AccountStore;

/**
 * In-memory account store.
 *
 * <p>Intended for development and testing only. Accounts are lost on restart and
 * not shared across instances.
 */
public class InMemoryAccountStore implements AccountStore {

    private static final Logger LOG = Logger.getLogger(InMemoryAccountStore.class);

    private final ConcurrentMap<String, Account> accounts = new ConcurrentHashMap<>();

    /**
     * Create or replace an account.
     */
    public void putAccount(CredentialRecord credential, Set<String> roles, Set<String> permissions) {
        accounts.put(
                credential.principal(),
                new Account(credential, new AuthorizationInfo(credential.principal(), roles, permissions), Map.of()));
        LOG.debugf("Stored account %s", credential.principal());
    }

    /**
     * Replace the roles and permissions of an existing account.
     *
     * @throws AccountNotFoundException if the account does not exist
     */
    public void putAuthorizationInfo(String principal, Set<String> roles, Set<String> permissions) {
        update(principal, a -> new Account(
                a.credential(), new AuthorizationInfo(principal, roles, permissions), a.totpSecrets()));
    }

    public void removeAccount(String principal) {
        accounts.remove(principal);
    }

    /**
     * Current stored credential, bypassing any cache (for testing).
     */
    public CredentialRecord credentialOf(String principal) {
        final var account = accounts.get(principal);
        if (account == null) {
            throw new AccountNotFoundException(principal);
        }
        return account.credential();
    }

    @Override
    public Uni<CredentialRecord> findCredential(String principal) {
        return Uni.createFrom().item(() -> credentialOf(principal));
    }

    @Override
    public Uni<AuthorizationInfo> findAuthorizationInfo(String principal) {
        return Uni.createFrom().item(() -> {
            final var account = accounts.get(principal);
            if (account == null) {
                throw new AccountNotFoundException(principal);
            }
            return account.authorizationInfo();
        });
    }

    @Override
    public Uni<Void> updateCredential(CredentialRecord record) {
        return Uni.createFrom().item(() -> {
            update(record.principal(), a -> new Account(record, a.authorizationInfo(), a.totpSecrets()));
            LOG.debugf("Updated credential of %s to %s", record.principal(), record.algorithmId());
            return null;
        });
    }

    @Override
    public Uni<List<TotpSecret>> findTotpSecrets(String principal) {
        return Uni.createFrom().item(() -> {
            final var account = accounts.get(principal);
            if (account == null) {
                throw new AccountNotFoundException(principal);
            }
            return List.copyOf(account.totpSecrets().values());
        });
    }

    @Override
    public Uni<Void> saveTotpSecret(TotpSecret secret) {
        return Uni.createFrom().item(() -> {
            update(secret.principal(), a -> {
                final var secrets = new HashMap<>(a.totpSecrets());
                secrets.put(secret.tag(), secret);
                return new Account(a.credential(), a.authorizationInfo(), secrets);
            });
            return null;
        });
    }

    private void update(String principal, UnaryOperator<Account> change) {
        final var updated = accounts.computeIfPresent(principal, (k, account) -> change.apply(account));
        if (updated == null) {
            throw new AccountNotFoundException(principal);
        }
    }

    /**
     * Remove all accounts (for testing).
     */
    public void clear() {
        accounts.clear();
    }

    private record Account(
            CredentialRecord credential, AuthorizationInfo authorizationInfo, Map<String, TotpSecret> totpSecrets) {

        Account {
            totpSecrets = Map.copyOf(totpSecrets);
        }
    }
}
