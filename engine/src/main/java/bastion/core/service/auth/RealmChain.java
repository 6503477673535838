package bastion.core.service.auth;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import bastion.core.model.auth.AuthenticatedAccount;
import bastion.core.model.auth.AuthenticationException;
import bastion.core.model.auth.FailureReason;
import bastion.core.model.auth.TotpSecret;
import bastion.core.model.auth.UsernamePasswordToken;
import bastion.core.port.out.TotpSecretSource;
import bastion.spi.AccountNotFoundException;

/**
 * Runs authentication and authorization across the configured realms.
 *
 * <p>Authentication tries realms in order and stops at the first success. When every
 * realm rejects the credentials the failures collapse into one
 * {@link AuthenticationException} carrying the most specific reason and no realm name.
 * A store outage is not a rejection and propagates immediately.
 *
 * <p>A permission or role is granted when any realm grants it.
 */
@ApplicationScoped
public class RealmChain implements TotpSecretSource {

    private static final Logger LOG = Logger.getLogger(RealmChain.class);

    private final List<Realm> realms;

    @Inject
    public RealmChain(RealmRegistry registry) {
        this(registry.realms());
    }

    public RealmChain(List<Realm> realms) {
        if (realms.isEmpty()) {
            throw new IllegalArgumentException("At least one realm is required");
        }
        this.realms = List.copyOf(realms);
    }

    public List<Realm> realms() {
        return realms;
    }

    /**
     * Authenticate against each realm in turn.
     */
    public Uni<AuthenticatedAccount> authenticate(UsernamePasswordToken token) {
        return attempt(token, 0, null);
    }

    private Uni<AuthenticatedAccount> attempt(UsernamePasswordToken token, int index, FailureReason worst) {
        if (index >= realms.size()) {
            final var reason = worst != null ? worst : FailureReason.UNKNOWN_ACCOUNT;
            return Uni.createFrom().failure(new AuthenticationException(token.username(), reason));
        }
        final var realm = realms.get(index);
        return realm.authenticate(token)
                .onFailure(AuthenticationException.class)
                .recoverWithUni(e -> {
                    final var reason = ((AuthenticationException) e).reason();
                    LOG.debugf("Realm %s rejected %s: %s", realm.name(), token.username(), reason);
                    return attempt(token, index + 1, moreSpecific(worst, reason));
                });
    }

    private static FailureReason moreSpecific(FailureReason current, FailureReason candidate) {
        if (current == null || candidate.specificity() > current.specificity()) {
            return candidate;
        }
        return current;
    }

    public Uni<Boolean> isPermitted(String principal, String permission) {
        return anyRealm(realm -> realm.isPermitted(principal, permission));
    }

    public Uni<Boolean> isPermittedAll(String principal, Collection<String> permissions) {
        return all(permissions, permission -> isPermitted(principal, permission));
    }

    /**
     * Check each permission separately.
     */
    public Uni<Map<String, Boolean>> isPermitted(String principal, Collection<String> permissions) {
        return each(permissions, permission -> isPermitted(principal, permission));
    }

    public Uni<Boolean> hasRole(String principal, String role) {
        return anyRealm(realm -> realm.hasRole(principal, role));
    }

    public Uni<Boolean> hasAllRoles(String principal, Collection<String> roles) {
        return all(roles, role -> hasRole(principal, role));
    }

    /**
     * Check each role separately.
     */
    public Uni<Map<String, Boolean>> hasRole(String principal, Collection<String> roles) {
        return each(roles, role -> hasRole(principal, role));
    }

    /**
     * Load authorization info into the cache of every realm.
     */
    public Uni<Void> warmAuthorizationInfo(String principal) {
        return Multi.createFrom()
                .iterable(realms)
                .onItem()
                .transformToUniAndConcatenate(realm -> realm.authorizationInfo(principal))
                .collect()
                .last()
                .replaceWithVoid();
    }

    /**
     * Drop cached account data of a principal in every realm.
     */
    public Uni<Void> clearCachedInfo(String principal) {
        return Multi.createFrom()
                .iterable(realms)
                .onItem()
                .transformToUniAndConcatenate(realm -> realm.clearCachedInfo(principal).replaceWith(realm))
                .collect()
                .last()
                .replaceWithVoid();
    }

    @Override
    public Uni<List<TotpSecret>> findTotpSecrets(String principal) {
        return Multi.createFrom()
                .iterable(realms)
                .onItem()
                .transformToUniAndConcatenate(realm -> realm.findTotpSecrets(principal))
                .collect()
                .asList()
                .map(lists -> lists.stream().flatMap(List::stream).toList());
    }

    /**
     * Store the secret in the first realm that knows the principal.
     */
    @Override
    public Uni<Void> saveTotpSecret(TotpSecret secret) {
        return save(secret, 0);
    }

    private Uni<Void> save(TotpSecret secret, int index) {
        if (index >= realms.size()) {
            return Uni.createFrom().failure(new AccountNotFoundException(secret.principal()));
        }
        return realms.get(index)
                .saveTotpSecret(secret)
                .onFailure(AccountNotFoundException.class)
                .recoverWithUni(e -> save(secret, index + 1));
    }

    private Uni<Boolean> anyRealm(Function<Realm, Uni<Boolean>> check) {
        return Multi.createFrom()
                .iterable(realms)
                .onItem()
                .transformToUniAndConcatenate(check::apply)
                .select()
                .where(Boolean::booleanValue)
                .toUni()
                .map(granted -> granted != null && granted);
    }

    private static Uni<Boolean> all(Collection<String> values, Function<String, Uni<Boolean>> check) {
        return Multi.createFrom()
                .iterable(values)
                .onItem()
                .transformToUniAndConcatenate(check::apply)
                .select()
                .where(granted -> !granted)
                .toUni()
                .map(denied -> denied == null);
    }

    private static Uni<Map<String, Boolean>> each(Collection<String> values, Function<String, Uni<Boolean>> check) {
        return Multi.createFrom()
                .iterable(new LinkedHashSet<>(values))
                .onItem()
                .transformToUniAndConcatenate(value -> check.apply(value).map(granted -> Map.entry(value, granted)))
                .collect()
                .in(LinkedHashMap<String, Boolean>::new, (results, entry) -> results.put(
                        entry.getKey(), entry.getValue()))
                .map(results -> Collections.<String, Boolean>unmodifiableMap(results));
    }
}
