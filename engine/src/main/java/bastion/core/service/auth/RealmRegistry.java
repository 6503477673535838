package bastion.core.service.auth;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Stream;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import bastion.core.cache.CacheHandler;
import bastion.core.config.ResiliencyConfig;
import bastion.core.config.SecurityManagerConfig;
import bastion.core.config.SecurityManagerConfig.RealmConfig;
import bastion.core.model.auth.ConfigurationException;
import bastion.core.port.out.SecurityEventPublisher;
import bastion.spi.AccountStoreProvider;

/**
 * Builds the ordered realm list from configuration.
 *
 * <p>Each configured realm names an {@link AccountStoreProvider} and its verifiers.
 * Providers are CDI beans; when several share a name the highest priority available
 * one is used. With no realms configured a single realm named {@code default} is built
 * on the highest priority available provider.
 */
@ApplicationScoped
public class RealmRegistry {

    private static final Logger LOG = Logger.getLogger(RealmRegistry.class);
    static final String DEFAULT_REALM = "default";

    private final List<Realm> realms;

    @Inject
    public RealmRegistry(
            SecurityManagerConfig config,
            Instance<AccountStoreProvider> providers,
            HashAlgorithmRegistry hashAlgorithms,
            CacheHandler cache,
            ResiliencyConfig resiliency,
            SecurityEventPublisher events,
            Clock clock) {
        this(config.realms(), providers::stream, hashAlgorithms, cache, resiliency, events, clock);
    }

    public RealmRegistry(
            List<? extends RealmConfig> realmConfigs,
            Supplier<Stream<AccountStoreProvider>> providers,
            HashAlgorithmRegistry hashAlgorithms,
            CacheHandler cache,
            ResiliencyConfig resiliency,
            SecurityEventPublisher events,
            Clock clock) {
        final var available = providers.get()
                .filter(AccountStoreProvider::isAvailable)
                .sorted(Comparator.comparingInt(AccountStoreProvider::priority).reversed())
                .toList();
        if (available.isEmpty()) {
            throw new ConfigurationException("No account store providers available");
        }

        final var built = new ArrayList<Realm>();
        if (realmConfigs.isEmpty()) {
            final var provider = available.get(0);
            LOG.infof("No realms configured, using realm '%s' on account store %s", DEFAULT_REALM, provider.name());
            built.add(new AccountStoreRealm(
                    DEFAULT_REALM,
                    provider.createStore(DEFAULT_REALM),
                    new IndexedPermissionVerifier(),
                    new SimpleRoleVerifier(),
                    hashAlgorithms,
                    cache,
                    resiliency.store(),
                    events,
                    clock));
        }

        final var names = new HashSet<String>();
        for (var realmConfig : realmConfigs) {
            if (!names.add(realmConfig.name())) {
                throw new ConfigurationException("Duplicate realm name: " + realmConfig.name());
            }
            final var provider = available.stream()
                    .filter(p -> p.name().equals(realmConfig.accountStore()))
                    .findFirst()
                    .orElseThrow(() -> new ConfigurationException("Realm '" + realmConfig.name()
                            + "' references unavailable account store: " + realmConfig.accountStore()));
            built.add(new AccountStoreRealm(
                    realmConfig.name(),
                    provider.createStore(realmConfig.name()),
                    Verifiers.permissionVerifier(realmConfig.permissionVerifier()),
                    Verifiers.roleVerifier(realmConfig.roleVerifier()),
                    hashAlgorithms,
                    cache,
                    resiliency.store(),
                    events,
                    clock));
            LOG.infof(
                    "Realm %s: account store %s, verifiers %s/%s",
                    realmConfig.name(),
                    provider.name(),
                    realmConfig.permissionVerifier(),
                    realmConfig.roleVerifier());
        }
        this.realms = List.copyOf(built);
    }

    /**
     * Realms in authentication order.
     */
    public List<Realm> realms() {
        return realms;
    }
}
