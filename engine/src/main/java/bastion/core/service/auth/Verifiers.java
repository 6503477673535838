package bastion.core.service.auth;

import java.util.Map;
import java.util.function.Supplier;

import bastion.core.model.auth.ConfigurationException;

/**
 * Verifier implementations selectable by name from realm configuration.
 */
public final class Verifiers {

    private static final Map<String, Supplier<PermissionVerifier>> PERMISSION_VERIFIERS =
            Map.of("indexed", IndexedPermissionVerifier::new);

    private static final Map<String, Supplier<RoleVerifier>> ROLE_VERIFIERS = Map.of("simple", SimpleRoleVerifier::new);

    private Verifiers() {}

    public static PermissionVerifier permissionVerifier(String name) {
        final var factory = PERMISSION_VERIFIERS.get(name);
        if (factory == null) {
            throw new ConfigurationException(
                    "Unknown permission verifier: " + name + ", supported: " + PERMISSION_VERIFIERS.keySet());
        }
        return factory.get();
    }

    public static RoleVerifier roleVerifier(String name) {
        final var factory = ROLE_VERIFIERS.get(name);
        if (factory == null) {
            throw new ConfigurationException(
                    "Unknown role verifier: " + name + ", supported: " + ROLE_VERIFIERS.keySet());
        }
        return factory.get();
    }
}
