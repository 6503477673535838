package bastion.core.config;

import java.util.List;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the realms composed by the security manager.
 *
 * <p>Configuration prefix: {@code bastion.security-manager}
 *
 * <p>Realms are tried in the order they are listed:
 * <pre>
 * bastion.security-manager.realms[0].name=primary
 * bastion.security-manager.realms[0].account-store=memory
 * bastion.security-manager.realms[0].permission-verifier=indexed
 * bastion.security-manager.realms[0].role-verifier=simple
 * </pre>
 */
@ConfigMapping(prefix = "bastion.security-manager")
public interface SecurityManagerConfig {

    /**
     * Realms in authentication order.
     */
    List<RealmConfig> realms();

    /**
     * Settings for one realm.
     */
    interface RealmConfig {

        /**
         * Realm name, unique within the security manager.
         */
        String name();

        /**
         * Name of the account store provider backing this realm.
         *
         * @return provider name (default: memory)
         */
        @WithDefault("memory")
        String accountStore();

        /**
         * Permission verifier implementation.
         *
         * @return verifier name (default: indexed)
         */
        @WithDefault("indexed")
        String permissionVerifier();

        /**
         * Role verifier implementation.
         *
         * @return verifier name (default: simple)
         */
        @WithDefault("simple")
        String roleVerifier();
    }
}
