package bastion.core.service;

import java.time.Clock;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import bastion.core.model.auth.AccountLockedException;
import bastion.core.model.auth.AuthenticatedAccount;
import bastion.core.model.auth.AuthenticationException;
import bastion.core.model.auth.ExpiredChallengeException;
import bastion.core.model.auth.FailureReason;
import bastion.core.model.auth.InvalidChallengeException;
import bastion.core.model.auth.LoginResult;
import bastion.core.model.auth.RememberMeToken;
import bastion.core.model.auth.TotpEnrollment;
import bastion.core.model.auth.UnauthorizedException;
import bastion.core.model.auth.UsernamePasswordToken;
import bastion.core.model.session.Session;
import bastion.core.port.in.SecurityManagement;
import bastion.core.port.in.SessionManagement;
import bastion.core.port.out.SecurityEventPublisher;
import bastion.core.service.auth.AccountLockoutTracker;
import bastion.core.service.auth.MfaChallengeService;
import bastion.core.service.auth.RealmChain;
import bastion.core.service.auth.RememberMeService;
import bastion.spi.SecurityEvent;

/**
 * Security manager façade.
 *
 * <p>Login sequence: reserve an attempt with the lockout tracker (refused for locked
 * accounts), authenticate through the realm chain, require the second factor when the
 * principal is enrolled, clear the failure count, start the session, warm the
 * authorization cache and, on request, issue a remember-me token.
 *
 * <p>Rejected credentials and wrong one-time codes count toward lockout; the attempt
 * that reaches the threshold is itself rejected as locked. A login that only lacks its
 * one-time code dispatches a challenge and is not counted. Store outages propagate and
 * are not counted either. Whatever the cause, callers see the same generic failure;
 * the precise reason goes to the security event stream.
 */
@ApplicationScoped
public class SecurityManagerService implements SecurityManagement {

    private static final Logger LOG = Logger.getLogger(SecurityManagerService.class);

    private final RealmChain realms;
    private final AccountLockoutTracker lockout;
    private final MfaChallengeService mfa;
    private final SessionManagement sessions;
    private final RememberMeService rememberMe;
    private final SecurityEventPublisher events;
    private final Clock clock;

    @Inject
    public SecurityManagerService(
            RealmChain realms,
            AccountLockoutTracker lockout,
            MfaChallengeService mfa,
            SessionManagement sessions,
            RememberMeService rememberMe,
            SecurityEventPublisher events,
            Clock clock) {
        this.realms = realms;
        this.lockout = lockout;
        this.mfa = mfa;
        this.sessions = sessions;
        this.rememberMe = rememberMe;
        this.events = events;
        this.clock = clock;
    }

    @Override
    public Uni<LoginResult> login(UsernamePasswordToken token) {
        final var principal = token.username();
        return lockout.reserveAttempt(principal)
                .onFailure(AccountLockedException.class)
                .invoke(e -> {
                    LOG.debugf("Login rejected for locked account %s", principal);
                    publishLocked(principal);
                })
                .chain(attempt -> authenticate(attempt, token))
                .chain(account -> startSession(account, token))
                .onTermination()
                .invoke((result, failure, cancelled) -> {
                    // a cancelled login may still have a hash in flight on a worker
                    if (!cancelled) {
                        token.clear();
                    }
                });
    }

    private Uni<AuthenticatedAccount> authenticate(AccountLockoutTracker.Attempt attempt, UsernamePasswordToken token) {
        return realms.authenticate(token)
                .chain(account -> secondFactor(account, token))
                .onFailure(AuthenticationException.class)
                .recoverWithUni(e -> rejected(attempt, (AuthenticationException) e))
                .call(account -> lockout.recordSuccess(attempt)
                        .onFailure(AccountLockedException.class)
                        .invoke(e -> publishLocked(account.principal())))
                // store outages are not counted
                .onFailure(e -> !(e instanceof AuthenticationException))
                .call(e -> lockout.release(attempt))
                .onCancellation()
                .call(() -> lockout.release(attempt));
    }

    private void publishLocked(String principal) {
        events.publish(new SecurityEvent.AuthenticationFailed(
                clock.instant(), principal, FailureReason.ACCOUNT_LOCKED, 0));
    }

    private Uni<AuthenticatedAccount> secondFactor(AuthenticatedAccount account, UsernamePasswordToken token) {
        final var principal = account.principal();
        return mfa.isRequired(principal).chain(required -> {
            if (!required) {
                return Uni.createFrom().item(account);
            }
            if (token.totpCode().isEmpty()) {
                return mfa.issueChallenge(principal)
                        .chain(ref -> Uni.createFrom()
                                .<AuthenticatedAccount>failure(
                                        new AuthenticationException(principal, FailureReason.MFA_REQUIRED)));
            }
            return mfa.verifyCode(principal, token.totpCode().get())
                    .onFailure(e -> e instanceof ExpiredChallengeException || e instanceof InvalidChallengeException)
                    .recoverWithItem(e -> {
                        LOG.debugf("One-time code for %s rejected: %s", principal, e.getMessage());
                        return false;
                    })
                    .chain(valid -> valid
                            ? Uni.createFrom().item(account)
                            : Uni.createFrom()
                                    .<AuthenticatedAccount>failure(
                                            new AuthenticationException(principal, FailureReason.MFA_FAILED)));
        });
    }

    private Uni<AuthenticatedAccount> rejected(AccountLockoutTracker.Attempt attempt, AuthenticationException failure) {
        final var principal = failure.principal();
        if (failure.reason() == FailureReason.MFA_REQUIRED) {
            events.publish(new SecurityEvent.AuthenticationFailed(clock.instant(), principal, failure.reason(), 0));
            return lockout.release(attempt).chain(() -> Uni.createFrom().<AuthenticatedAccount>failure(failure));
        }
        return lockout.recordFailure(attempt).chain(tally -> {
            events.publish(new SecurityEvent.AuthenticationFailed(
                    clock.instant(), principal, failure.reason(), tally.failedCount()));
            if (tally.locked()) {
                return Uni.createFrom().<AuthenticatedAccount>failure(new AccountLockedException(principal));
            }
            return Uni.createFrom().<AuthenticatedAccount>failure(failure);
        });
    }

    private Uni<LoginResult> startSession(AuthenticatedAccount account, UsernamePasswordToken token) {
        final var principal = account.principal();
        return sessions.create(principal, token.host().orElse(null))
                .call(session -> warmAuthorizationInfo(principal))
                .map(session -> {
                    events.publish(
                            new SecurityEvent.AuthenticationSucceeded(clock.instant(), principal, account.realmName()));
                    final Optional<RememberMeToken> remembered =
                            token.rememberMe() ? rememberMe.issue(principal) : Optional.empty();
                    return new LoginResult(session, remembered);
                });
    }

    private Uni<Void> warmAuthorizationInfo(String principal) {
        return realms.warmAuthorizationInfo(principal).onFailure().recoverWithUni(e -> {
            LOG.warnf("Could not warm authorization info for %s: %s", principal, e.getMessage());
            return Uni.createFrom().voidItem();
        });
    }

    @Override
    public Uni<Void> logout(String sessionId) {
        return sessions.invalidate(sessionId).chain(removed -> removed
                .map(session -> realms.clearCachedInfo(session.principal()))
                .orElseGet(() -> Uni.createFrom().voidItem()));
    }

    @Override
    public Uni<Session> touch(String sessionId) {
        return sessions.touch(sessionId);
    }

    @Override
    public Uni<Boolean> isPermitted(String sessionId, String permission) {
        return principalOf(sessionId).chain(principal -> realms.isPermitted(principal, permission));
    }

    @Override
    public Uni<Map<String, Boolean>> isPermitted(String sessionId, Collection<String> permissions) {
        return principalOf(sessionId).chain(principal -> realms.isPermitted(principal, permissions));
    }

    @Override
    public Uni<Boolean> isPermittedAll(String sessionId, Collection<String> permissions) {
        return principalOf(sessionId).chain(principal -> realms.isPermittedAll(principal, permissions));
    }

    @Override
    public Uni<Boolean> hasRole(String sessionId, String role) {
        return principalOf(sessionId).chain(principal -> realms.hasRole(principal, role));
    }

    @Override
    public Uni<Map<String, Boolean>> hasRole(String sessionId, Collection<String> roles) {
        return principalOf(sessionId).chain(principal -> realms.hasRole(principal, roles));
    }

    @Override
    public Uni<Boolean> hasAllRoles(String sessionId, Collection<String> roles) {
        return principalOf(sessionId).chain(principal -> realms.hasAllRoles(principal, roles));
    }

    @Override
    public Uni<Void> checkPermission(String sessionId, String permission) {
        return isPermitted(sessionId, permission).chain(permitted -> permitted
                ? Uni.createFrom().voidItem()
                : Uni.createFrom().failure(new UnauthorizedException("Permission denied: " + permission)));
    }

    @Override
    public Uni<Void> checkRole(String sessionId, String role) {
        return hasRole(sessionId, role).chain(granted -> granted
                ? Uni.createFrom().voidItem()
                : Uni.createFrom().failure(new UnauthorizedException("Role required: " + role)));
    }

    @Override
    public Uni<Void> checkPermission(String sessionId, Collection<String> permissions) {
        return isPermitted(sessionId, permissions).chain(results -> requireAll(results, "Permission denied: "));
    }

    @Override
    public Uni<Void> checkRole(String sessionId, Collection<String> roles) {
        return hasRole(sessionId, roles).chain(results -> requireAll(results, "Role required: "));
    }

    private static Uni<Void> requireAll(Map<String, Boolean> results, String message) {
        final var missing = results.entrySet().stream()
                .filter(result -> !result.getValue())
                .map(Map.Entry::getKey)
                .toList();
        if (missing.isEmpty()) {
            return Uni.createFrom().voidItem();
        }
        return Uni.createFrom().failure(new UnauthorizedException(message + String.join(", ", missing)));
    }

    @Override
    public Uni<Optional<RememberMeToken>> remember(String sessionId) {
        return principalOf(sessionId).map(rememberMe::issue);
    }

    @Override
    public Uni<Optional<Session>> loginViaRememberMeToken(String encryptedPayload) {
        final var resolved = rememberMe.resolve(encryptedPayload);
        if (resolved.isEmpty()) {
            return Uni.createFrom().item(Optional.empty());
        }
        final var principal = resolved.get();
        return lockout.isLocked(principal).chain(locked -> {
            if (locked) {
                LOG.debugf("Remember-me login ignored for locked account %s", principal);
                return Uni.createFrom().item(Optional.<Session>empty());
            }
            return sessions.create(principal, null)
                    .call(session -> warmAuthorizationInfo(principal))
                    .invoke(session -> LOG.debugf("Session restored from remember-me token for %s", principal))
                    .map(Optional::of);
        });
    }

    @Override
    public Uni<Void> accountChanged(String principal) {
        LOG.debugf("Account %s changed, dropping cached account data", principal);
        return realms.clearCachedInfo(principal);
    }

    @Override
    public Uni<Void> unlock(String principal) {
        return lockout.unlock(principal);
    }

    @Override
    public Uni<Integer> invalidateAll(String principal) {
        return sessions.invalidateAll(principal).call(count -> realms.clearCachedInfo(principal));
    }

    @Override
    public Uni<TotpEnrollment> enrollTotp(String principal) {
        return mfa.enroll(principal);
    }

    private Uni<String> principalOf(String sessionId) {
        return sessions.touch(sessionId).map(Session::principal);
    }
}
