package bastion.core.service.auth;

import java.security.SecureRandom;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.function.Function;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import bastion.core.config.AuthcConfig;
import bastion.core.config.AuthcConfig.HashAlgorithmConfig;
import bastion.core.model.auth.ConfigurationException;
import bastion.core.model.auth.CredentialRecord;
import bastion.core.model.auth.HashAlgorithmSpec;
import bastion.core.model.auth.VerificationException;
import bastion.core.service.auth.hash.Argon2PasswordHasher;
import bastion.core.service.auth.hash.BcryptSha256PasswordHasher;
import bastion.core.service.auth.hash.PasswordHasher;
import bastion.core.service.auth.hash.PasswordHashers;
import bastion.core.service.auth.hash.Pbkdf2Sha256PasswordHasher;

/**
 * Holds the configured password hashing schemes.
 *
 * <p>Verification dispatches on the algorithm id stored with each credential, so
 * accounts hashed with any enabled scheme keep working while new hashes use the
 * preferred one. A credential is due for upgrade when it was hashed with another
 * scheme or with a work factor below the configured minimum.
 *
 * <p>Hashing is CPU and memory bound. Every operation that hashes returns a
 * {@link Uni} that runs on the worker executor, never on the calling thread.
 */
@ApplicationScoped
public class HashAlgorithmRegistry {

    private static final Logger LOG = Logger.getLogger(HashAlgorithmRegistry.class);

    private static final Map<String, Function<HashAlgorithmSpec, PasswordHasher>> FACTORIES = Map.of(
            Argon2PasswordHasher.ID, Argon2PasswordHasher::new,
            BcryptSha256PasswordHasher.ID, BcryptSha256PasswordHasher::new,
            Pbkdf2Sha256PasswordHasher.ID, Pbkdf2Sha256PasswordHasher::new);

    private static final String DUMMY_PRINCIPAL = "dummy";

    private final Map<String, PasswordHasher> hashers;
    private final PasswordHasher preferred;
    private final Executor executor;
    private final Uni<CredentialRecord> dummyRecord;

    @Inject
    public HashAlgorithmRegistry(AuthcConfig config) {
        this(config, Infrastructure.getDefaultWorkerPool());
    }

    public HashAlgorithmRegistry(AuthcConfig config, Executor executor) {
        this.executor = executor;
        this.hashers = Collections.unmodifiableMap(buildHashers(config.algorithms(), config.hashAlgorithms()));
        this.preferred = hashers.get(config.preferredAlgorithm());
        if (preferred == null) {
            throw new ConfigurationException("Preferred hash algorithm '" + config.preferredAlgorithm()
                    + "' is not among the enabled algorithms " + hashers.keySet());
        }
        this.dummyRecord = Uni.createFrom()
                .item(() -> preferred.hash(DUMMY_PRINCIPAL, randomPassword()))
                .runSubscriptionOn(executor)
                .memoize()
                .indefinitely();
        LOG.infof("Hash algorithms enabled: %s (preferred: %s)", hashers.keySet(), preferred.id());
    }

    private static Map<String, PasswordHasher> buildHashers(
            Set<String> enabled, Map<String, HashAlgorithmConfig> overrides) {
        for (var configured : overrides.keySet()) {
            if (!FACTORIES.containsKey(configured)) {
                throw new ConfigurationException("Unknown hash algorithm in configuration: " + configured);
            }
        }
        final var result = new LinkedHashMap<String, PasswordHasher>();
        for (var id : enabled) {
            final var factory = FACTORIES.get(id);
            if (factory == null) {
                throw new ConfigurationException(
                        "Unknown hash algorithm: " + id + ", supported: " + FACTORIES.keySet());
            }
            result.put(id, factory.apply(resolveSpec(id, Optional.ofNullable(overrides.get(id)))));
        }
        if (result.isEmpty()) {
            throw new ConfigurationException("At least one hash algorithm must be enabled");
        }
        return result;
    }

    static HashAlgorithmSpec resolveSpec(String id, Optional<HashAlgorithmConfig> override) {
        final var params = new HashMap<>(PasswordHashers.defaults(id));
        override.ifPresent(o -> {
            o.defaultRounds().ifPresent(v -> params.put(HashAlgorithmSpec.DEFAULT_ROUNDS, v));
            o.minRounds().ifPresent(v -> params.put(HashAlgorithmSpec.MIN_ROUNDS, v));
            o.maxRounds().ifPresent(v -> params.put(HashAlgorithmSpec.MAX_ROUNDS, v));
            o.saltSize().ifPresent(v -> params.put(HashAlgorithmSpec.SALT_SIZE, v));
            o.memoryCost().ifPresent(v -> params.put(HashAlgorithmSpec.MEMORY_COST, v));
            o.parallelism().ifPresent(v -> params.put(HashAlgorithmSpec.PARALLELISM, v));
        });
        return new HashAlgorithmSpec(id, params, override.flatMap(HashAlgorithmConfig::pepper));
    }

    /**
     * Verify a password against a stored credential.
     *
     * @return Uni with the result, failing with {@link VerificationException} when the
     *     record names an algorithm that is not enabled or its hash is malformed
     */
    public Uni<Boolean> verify(char[] password, CredentialRecord record) {
        final var hasher = hashers.get(record.algorithmId());
        if (hasher == null) {
            return Uni.createFrom()
                    .failure(new VerificationException("Unsupported hash algorithm: " + record.algorithmId()));
        }
        return Uni.createFrom().item(() -> hasher.verify(password, record)).runSubscriptionOn(executor);
    }

    /**
     * Spend the same work as a real verification against a throwaway hash.
     *
     * <p>Used when the account does not exist so response time does not reveal it.
     * Always yields false.
     */
    public Uni<Boolean> verifyDummy(char[] password) {
        return dummyRecord
                .chain(record -> Uni.createFrom()
                        .item(() -> preferred.verify(password, record))
                        .runSubscriptionOn(executor))
                .replaceWith(false);
    }

    /**
     * Hash a password with the given algorithm and its default work factor.
     *
     * @throws VerificationException if the algorithm is not enabled
     */
    public Uni<CredentialRecord> hash(String principal, char[] password, String algorithmId) {
        final var hasher = hashers.get(algorithmId);
        if (hasher == null) {
            return Uni.createFrom().failure(new VerificationException("Unsupported hash algorithm: " + algorithmId));
        }
        return Uni.createFrom().item(() -> hasher.hash(principal, password)).runSubscriptionOn(executor);
    }

    /**
     * Hash a password with the preferred algorithm.
     */
    public Uni<CredentialRecord> hashPreferred(String principal, char[] password) {
        return hash(principal, password, preferred.id());
    }

    /**
     * Check whether a credential should be re-hashed on the next successful login.
     */
    public boolean needsUpgrade(CredentialRecord record) {
        if (!preferred.id().equals(record.algorithmId())) {
            return true;
        }
        try {
            return preferred.isWeaker(record);
        } catch (VerificationException e) {
            LOG.debugf("Stored hash for %s could not be parsed, scheduling upgrade", record.principal());
            return true;
        }
    }

    public String preferredAlgorithm() {
        return preferred.id();
    }

    public Set<String> algorithms() {
        return hashers.keySet();
    }

    /**
     * Resolved parameters of an enabled algorithm.
     */
    public Optional<HashAlgorithmSpec> spec(String algorithmId) {
        return Optional.ofNullable(hashers.get(algorithmId)).map(PasswordHasher::spec);
    }

    private static char[] randomPassword() {
        final var random = new SecureRandom();
        final var chars = new char[24];
        for (int i = 0; i < chars.length; i++) {
            chars[i] = (char) ('a' + random.nextInt(26));
        }
        return chars;
    }
}
