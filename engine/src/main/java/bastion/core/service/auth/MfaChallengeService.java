package bastion.core.service.auth;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.stream.Stream;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import dev.samstevens.totp.code.CodeGenerator;
import dev.samstevens.totp.code.DefaultCodeGenerator;
import dev.samstevens.totp.code.HashingAlgorithm;
import dev.samstevens.totp.exceptions.CodeGenerationException;
import dev.samstevens.totp.secret.DefaultSecretGenerator;
import dev.samstevens.totp.secret.SecretGenerator;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import bastion.core.config.AuthcConfig;
import bastion.core.config.AuthcConfig.TotpConfig;
import bastion.core.model.auth.ChallengeRef;
import bastion.core.model.auth.ConfigurationException;
import bastion.core.model.auth.ExpiredChallengeException;
import bastion.core.model.auth.InvalidChallengeException;
import bastion.core.model.auth.TotpEnrollment;
import bastion.core.model.auth.TotpSecret;
import bastion.core.port.out.SecurityEventPublisher;
import bastion.core.port.out.TotpSecretSource;
import bastion.spi.MfaDispatcher;
import bastion.spi.SecurityEvent;

/**
 * Time-based one-time code second factor.
 *
 * <p>Active only when {@code bastion.authc.totp.mfa-dispatcher} names a dispatcher;
 * otherwise every check passes through. A principal without an enrolled secret is not
 * asked for a second factor.
 *
 * <p>A submitted code is compared in constant time against the codes of the current
 * time step and its two neighbours. A code matching a step further out fails with
 * {@link ExpiredChallengeException}, as does a code whose step was already used.
 */
@ApplicationScoped
public class MfaChallengeService {

    private static final Logger LOG = Logger.getLogger(MfaChallengeService.class);

    /** Accepted steps on either side of the current one. */
    static final int ACCEPTED_SKEW = 1;

    /** Steps on either side inspected to tell a stale code from a wrong one. */
    static final int STALE_LOOKBACK = 10;

    private final TotpConfig config;
    private final TotpKeyring keyring;
    private final Optional<MfaDispatcher> dispatcher;
    private final Supplier<TotpSecretSource> secrets;
    private final SecurityEventPublisher events;
    private final Clock clock;
    private final CodeGenerator codeGenerator;
    private final SecretGenerator secretGenerator = new DefaultSecretGenerator();
    private final Cache<String, Long> usedSteps;
    private final long stepSeconds;

    @Inject
    public MfaChallengeService(
            AuthcConfig config,
            Instance<MfaDispatcher> dispatchers,
            Instance<TotpSecretSource> secrets,
            SecurityEventPublisher events,
            Clock clock) {
        this(config.totp(), selectDispatcher(config.totp(), dispatchers::stream), secrets::get, events, clock);
    }

    public MfaChallengeService(
            TotpConfig config,
            Optional<MfaDispatcher> dispatcher,
            Supplier<TotpSecretSource> secrets,
            SecurityEventPublisher events,
            Clock clock) {
        this.config = config;
        this.keyring = new TotpKeyring(config);
        this.dispatcher = dispatcher;
        this.secrets = secrets;
        this.events = events;
        this.clock = clock;
        this.stepSeconds = config.timeStep().toSeconds();
        if (stepSeconds < 1) {
            throw new ConfigurationException("TOTP time step must be at least one second");
        }
        if (config.digits() < 6 || config.digits() > 8) {
            throw new ConfigurationException("TOTP digits must be between 6 and 8, got " + config.digits());
        }
        if (dispatcher.isPresent() && keyring.isEmpty()) {
            throw new ConfigurationException("MFA dispatcher configured but no TOTP secrets are set");
        }
        this.codeGenerator = new DefaultCodeGenerator(HashingAlgorithm.SHA1, config.digits());
        this.usedSteps = Caffeine.newBuilder()
                .expireAfterWrite(config.timeStep().multipliedBy(2L * ACCEPTED_SKEW + 2))
                .build();

        dispatcher.ifPresentOrElse(
                d -> LOG.infof("MFA enabled via dispatcher %s, default tag %s", d.name(), keyring.defaultTag()),
                () -> LOG.info("MFA disabled: no dispatcher configured"));
    }

    private static Optional<MfaDispatcher> selectDispatcher(
            TotpConfig config, Supplier<Stream<MfaDispatcher>> dispatchers) {
        if (config.mfaDispatcher().isEmpty()) {
            return Optional.empty();
        }
        final var name = config.mfaDispatcher().get();
        return Optional.of(dispatchers
                .get()
                .filter(d -> d.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new ConfigurationException("Unknown MFA dispatcher: " + name)));
    }

    public boolean isEnabled() {
        return dispatcher.isPresent();
    }

    /**
     * Check whether a principal must present a second factor.
     */
    public Uni<Boolean> isRequired(String principal) {
        if (!isEnabled()) {
            return Uni.createFrom().item(false);
        }
        return secrets.get()
                .findTotpSecrets(principal)
                .map(list -> list.stream().anyMatch(s -> keyring.hasTag(s.tag())));
    }

    /**
     * Generate and dispatch a code for the principal's current secret.
     *
     * @return Uni with the challenge, or empty if MFA is disabled or the principal has
     *     not enrolled
     */
    public Uni<Optional<ChallengeRef>> issueChallenge(String principal) {
        if (!isEnabled()) {
            return Uni.createFrom().item(Optional.empty());
        }
        final var mfaDispatcher = dispatcher.get();
        return secrets.get().findTotpSecrets(principal).chain(list -> {
            final var current = currentSecret(list);
            if (current.isEmpty()) {
                return Uni.createFrom().item(Optional.<ChallengeRef>empty());
            }
            final var secret = current.get();
            final var now = clock.instant();
            final long step = stepAt(now);
            final var code = generate(keyring.unwrap(secret), step);
            final var expiresAt = Instant.ofEpochSecond((step + ACCEPTED_SKEW + 1) * stepSeconds);
            final var ref = new ChallengeRef(principal, secret.tag(), mfaDispatcher.name(), now, expiresAt);
            return mfaDispatcher.dispatch(principal, code, expiresAt).invoke(() -> {
                LOG.debugf("Dispatched one-time code to %s via %s", principal, mfaDispatcher.name());
                events.publish(new SecurityEvent.MfaChallengeIssued(now, principal, mfaDispatcher.name()));
            }).replaceWith(Optional.of(ref));
        });
    }

    /**
     * Verify a code against any of the principal's usable secrets.
     */
    public Uni<Boolean> verifyCode(String principal, String code) {
        return verifyCode(principal, code, Optional.empty());
    }

    /**
     * Verify a code.
     *
     * @param tag restrict the check to the secret of this tag
     * @return Uni with true if the code is valid; fails with {@link InvalidChallengeException}
     *     for a malformed code or {@link ExpiredChallengeException} for a stale or reused one
     */
    public Uni<Boolean> verifyCode(String principal, String code, Optional<String> tag) {
        if (!isEnabled()) {
            return Uni.createFrom().item(true);
        }
        if (code == null || code.length() != config.digits() || !code.chars().allMatch(Character::isDigit)) {
            return Uni.createFrom().failure(new InvalidChallengeException("Malformed one-time code"));
        }
        return secrets.get().findTotpSecrets(principal).map(list -> {
            final var candidates = list.stream()
                    .filter(s -> keyring.hasTag(s.tag()))
                    .filter(s -> tag.isEmpty() || tag.get().equals(s.tag()))
                    .toList();
            final long current = stepAt(clock.instant());
            final var matched = matchStep(candidates, code, current);
            if (matched.isEmpty()) {
                LOG.debugf("One-time code rejected for %s", principal);
                return false;
            }
            final long step = matched.get();
            if (Math.abs(step - current) > ACCEPTED_SKEW) {
                throw new ExpiredChallengeException("One-time code is outside the accepted time window");
            }
            markUsed(principal, step);
            return true;
        });
    }

    /**
     * Create and store a new secret for a principal under the default tag.
     */
    public Uni<TotpEnrollment> enroll(String principal) {
        final var shared = secretGenerator.generate();
        final var wrapped = keyring.wrap(principal, shared);
        return secrets.get()
                .saveTotpSecret(wrapped)
                .invoke(() -> LOG.infof("Enrolled %s for one-time codes under tag %s", principal, wrapped.tag()))
                .replaceWith(new TotpEnrollment(wrapped, shared));
    }

    /**
     * Code for a shared secret at an instant. Exposed for authenticator simulation in tests.
     */
    String codeAt(String base32Secret, Instant instant) {
        return generate(base32Secret, stepAt(instant));
    }

    private Optional<TotpSecret> currentSecret(List<TotpSecret> list) {
        final var defaultTag = keyring.defaultTag();
        return list.stream()
                .filter(s -> keyring.hasTag(s.tag()))
                .max(Comparator.comparing((TotpSecret s) -> s.tag().equals(defaultTag))
                        .thenComparing(TotpSecret::tag));
    }

    private Optional<Long> matchStep(List<TotpSecret> candidates, String code, long current) {
        final var submitted = code.getBytes(StandardCharsets.US_ASCII);
        final var offsets = new ArrayList<Long>();
        offsets.add(0L);
        for (long i = 1; i <= STALE_LOOKBACK; i++) {
            offsets.add(-i);
            offsets.add(i);
        }
        Optional<Long> found = Optional.empty();
        for (var secret : candidates) {
            final var shared = keyring.unwrap(secret);
            for (var offset : offsets) {
                final var expected = generate(shared, current + offset).getBytes(StandardCharsets.US_ASCII);
                final boolean equal = org.bouncycastle.util.Arrays.constantTimeAreEqual(expected, submitted);
                if (equal && (found.isEmpty() || Math.abs(offset) < Math.abs(found.get() - current))) {
                    found = Optional.of(current + offset);
                }
            }
        }
        return found;
    }

    private void markUsed(String principal, long step) {
        final var replayed = new AtomicBoolean(false);
        usedSteps.asMap().compute(principal, (k, last) -> {
            if (last != null && step <= last) {
                replayed.set(true);
                return last;
            }
            return step;
        });
        if (replayed.get()) {
            throw new ExpiredChallengeException("One-time code was already used");
        }
    }

    private long stepAt(Instant instant) {
        return Math.floorDiv(instant.getEpochSecond(), stepSeconds);
    }

    private String generate(String base32Secret, long step) {
        try {
            return codeGenerator.generate(base32Secret, step);
        } catch (CodeGenerationException e) {
            throw new InvalidChallengeException("Failed to generate one-time code", e);
        }
    }

    /**
     * Time step length.
     */
    public Duration timeStep() {
        return config.timeStep();
    }
}
