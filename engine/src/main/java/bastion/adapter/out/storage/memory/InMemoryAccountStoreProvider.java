package bastion.adapter.out.storage.memory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import bastion.spi.AccountStore;
import bastion.spi.AccountStoreProvider;

/**
 * Provides one {@link InMemoryAccountStore} per realm.
 */
@ApplicationScoped
public class InMemoryAccountStoreProvider implements AccountStoreProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryAccountStoreProvider.class);

    private final ConcurrentMap<String, InMemoryAccountStore> stores = new ConcurrentHashMap<>();

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public String description() {
        return "In-memory account store (development and testing)";
    }

    @Override
    public AccountStore createStore(String realmName) {
        return storeFor(realmName);
    }

    /**
     * The store of a realm, created on first use. Lets development setups seed accounts.
     */
    public InMemoryAccountStore storeFor(String realmName) {
        return stores.computeIfAbsent(realmName, name -> {
            LOG.warnf("Realm %s uses the in-memory account store; accounts are lost on restart", name);
            return new InMemoryAccountStore();
        });
    }
}
