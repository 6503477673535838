package bastion.spi;

/**
 * Service provider interface for account store backends.
 *
 * <p>Each realm names the provider it uses; providers are CDI beans looked up by
 * {@link #name()}.
 */
public interface AccountStoreProvider {

    /**
     * Unique identifier referenced from realm configuration.
     */
    String name();

    default String description() {
        return name() + " account store";
    }

    /**
     * Priority used when several providers share a name; higher wins.
     */
    default int priority() {
        return 0;
    }

    default boolean isAvailable() {
        return true;
    }

    /**
     * Create the store backing one realm.
     *
     * @param realmName name of the realm the store is created for
     * @return account store
     */
    AccountStore createStore(String realmName);
}
