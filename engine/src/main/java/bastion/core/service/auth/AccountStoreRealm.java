package bastion.core.service.auth;

import java.time.Clock;
import java.util.List;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import bastion.core.cache.CacheHandler;
import bastion.core.cache.CacheKeys;
import bastion.core.config.ResiliencyConfig.StoreConfig;
import bastion.core.model.auth.AuthenticatedAccount;
import bastion.core.model.auth.AuthenticationException;
import bastion.core.model.auth.AuthorizationInfo;
import bastion.core.model.auth.ConfigurationException;
import bastion.core.model.auth.CredentialRecord;
import bastion.core.model.auth.FailureReason;
import bastion.core.model.auth.TotpSecret;
import bastion.core.model.auth.UsernamePasswordToken;
import bastion.core.model.auth.VerificationException;
import bastion.core.model.cache.TtlClass;
import bastion.core.port.out.SecurityEventPublisher;
import bastion.spi.AccountNotFoundException;
import bastion.spi.AccountStore;
import bastion.spi.SecurityEvent;
import bastion.spi.StoreUnavailableException;

/**
 * Realm backed by an {@link AccountStore}.
 *
 * <p>Credentials and authorization info are read through the {@link CacheHandler}.
 * Store calls that fail with {@link StoreUnavailableException} are retried with
 * exponential backoff; any other unexpected store failure is reported as unavailable
 * too so raw backend errors never reach callers.
 *
 * <p>An unknown principal is verified against a dummy hash before being rejected, and
 * a credential hashed with an outdated algorithm or work factor is re-hashed with the
 * plain password of the successful login and written back.
 */
public class AccountStoreRealm implements Realm {

    private static final Logger LOG = Logger.getLogger(AccountStoreRealm.class);

    private final String name;
    private final AccountStore store;
    private final PermissionVerifier permissionVerifier;
    private final RoleVerifier roleVerifier;
    private final HashAlgorithmRegistry hashAlgorithms;
    private final CacheHandler cache;
    private final StoreConfig retry;
    private final SecurityEventPublisher events;
    private final Clock clock;

    public AccountStoreRealm(
            String name,
            AccountStore store,
            PermissionVerifier permissionVerifier,
            RoleVerifier roleVerifier,
            HashAlgorithmRegistry hashAlgorithms,
            CacheHandler cache,
            StoreConfig retry,
            SecurityEventPublisher events,
            Clock clock) {
        if (retry.maxAttempts() < 1) {
            throw new ConfigurationException("Store max attempts must be at least 1");
        }
        this.name = name;
        this.store = store;
        this.permissionVerifier = permissionVerifier;
        this.roleVerifier = roleVerifier;
        this.hashAlgorithms = hashAlgorithms;
        this.cache = cache;
        this.retry = retry;
        this.events = events;
        this.clock = clock;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Uni<AuthenticatedAccount> authenticate(UsernamePasswordToken token) {
        final var principal = token.username();
        return credential(principal)
                .onFailure(AccountNotFoundException.class)
                .recoverWithNull()
                .chain(record -> {
                    if (record == null) {
                        LOG.debugf("Realm %s: unknown account %s", name, principal);
                        return hashAlgorithms
                                .verifyDummy(token.password())
                                .chain(() -> AccountStoreRealm.<AuthenticatedAccount>reject(
                                        principal, FailureReason.UNKNOWN_ACCOUNT));
                    }
                    return hashAlgorithms
                            .verify(token.password(), record)
                            .onFailure(VerificationException.class)
                            .transform(e -> {
                                LOG.warnf("Realm %s: stored credential of %s is unverifiable: %s",
                                        name, principal, e.getMessage());
                                return new AuthenticationException(principal, FailureReason.UNVERIFIABLE_CREDENTIAL, e);
                            })
                            .chain(matches -> matches
                                    ? upgradeIfNeeded(record, token.password())
                                    : AccountStoreRealm.<AuthenticatedAccount>reject(
                                            principal, FailureReason.INVALID_CREDENTIALS));
                });
    }

    private Uni<AuthenticatedAccount> upgradeIfNeeded(CredentialRecord record, char[] password) {
        final var principal = record.principal();
        final var account = new AuthenticatedAccount(principal, name, false);
        if (!hashAlgorithms.needsUpgrade(record)) {
            return Uni.createFrom().item(account);
        }
        final var target = hashAlgorithms.preferredAlgorithm();
        return hashAlgorithms
                .hashPreferred(principal, password)
                .chain(upgraded -> withRetry(() -> store.updateCredential(upgraded)))
                .chain(() -> cache.invalidate(CacheKeys.credential(name, principal)))
                .map(v -> {
                    LOG.infof("Upgraded credential of %s from %s to %s", principal, record.algorithmId(), target);
                    events.publish(new SecurityEvent.CredentialUpgraded(
                            clock.instant(), principal, record.algorithmId(), target));
                    return new AuthenticatedAccount(principal, name, true);
                })
                .onFailure()
                .recoverWithItem(e -> {
                    LOG.warnf("Credential upgrade for %s failed, keeping %s: %s",
                            principal, record.algorithmId(), e.getMessage());
                    return account;
                });
    }

    private static <T> Uni<T> reject(String principal, FailureReason reason) {
        return Uni.createFrom().failure(new AuthenticationException(principal, reason));
    }

    private Uni<CredentialRecord> credential(String principal) {
        return cache.getOrCompute(
                CacheKeys.credential(name, principal),
                TtlClass.CREDENTIALS,
                CredentialRecord.class,
                () -> withRetry(() -> store.findCredential(principal)));
    }

    @Override
    public Uni<AuthorizationInfo> authorizationInfo(String principal) {
        return cache.getOrCompute(
                CacheKeys.authorizationInfo(name, principal),
                TtlClass.AUTHZ_INFO,
                AuthorizationInfo.class,
                () -> withRetry(() -> store.findAuthorizationInfo(principal))
                        .onFailure(AccountNotFoundException.class)
                        .recoverWithItem(() -> AuthorizationInfo.empty(principal)));
    }

    @Override
    public Uni<Boolean> isPermitted(String principal, String permission) {
        return authorizationInfo(principal).map(info -> permissionVerifier.isPermitted(info, permission));
    }

    @Override
    public Uni<Boolean> hasRole(String principal, String role) {
        return authorizationInfo(principal).map(info -> roleVerifier.hasRole(info, role));
    }

    @Override
    public Uni<Void> clearCachedInfo(String principal) {
        return cache.invalidate(CacheKeys.credential(name, principal))
                .chain(() -> cache.invalidate(CacheKeys.authorizationInfo(name, principal)))
                .chain(() -> cache.invalidate(CacheKeys.totpSecrets(name, principal)));
    }

    @Override
    public Uni<List<TotpSecret>> findTotpSecrets(String principal) {
        return cache.getOrCompute(
                        CacheKeys.totpSecrets(name, principal),
                        TtlClass.ABSOLUTE,
                        EnrolledSecrets.class,
                        () -> withRetry(() -> store.findTotpSecrets(principal))
                                .onFailure(AccountNotFoundException.class)
                                .recoverWithItem(e -> List.of())
                                .map(EnrolledSecrets::new))
                .map(EnrolledSecrets::secrets);
    }

    @Override
    public Uni<Void> saveTotpSecret(TotpSecret secret) {
        return withRetry(() -> store.saveTotpSecret(secret))
                .call(() -> cache.invalidate(CacheKeys.totpSecrets(name, secret.principal())));
    }

    /** Cached form of a principal's one-time code secrets. */
    private record EnrolledSecrets(List<TotpSecret> secrets) {

        EnrolledSecrets {
            secrets = List.copyOf(secrets);
        }
    }

    private <T> Uni<T> withRetry(Supplier<Uni<T>> call) {
        var uni = Uni.createFrom().deferred(call::get);
        if (retry.maxAttempts() > 1) {
            uni = uni.onFailure(StoreUnavailableException.class)
                    .invoke(e -> LOG.debugf("Realm %s: store unavailable, retrying: %s", name, e.getMessage()))
                    .onFailure(StoreUnavailableException.class)
                    .retry()
                    .withBackOff(retry.initialBackoff(), retry.maxBackoff())
                    .atMost(retry.maxAttempts() - 1L);
        }
        return uni.onFailure(e -> !(e instanceof StoreUnavailableException) && !(e instanceof AccountNotFoundException))
                .transform(e -> new StoreUnavailableException("Account store failure in realm " + name, e));
    }
}
