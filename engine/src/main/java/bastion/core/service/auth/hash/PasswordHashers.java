package bastion.core.service.auth.hash;

import java.util.Map;

/**
 * Built-in parameter defaults per algorithm id.
 */
public final class PasswordHashers {

    private PasswordHashers() {}

    /**
     * Defaults of a built-in algorithm, empty for unknown ids.
     */
    public static Map<String, Integer> defaults(String algorithmId) {
        return switch (algorithmId) {
            case Argon2PasswordHasher.ID -> Argon2PasswordHasher.DEFAULTS;
            case BcryptSha256PasswordHasher.ID -> BcryptSha256PasswordHasher.DEFAULTS;
            case Pbkdf2Sha256PasswordHasher.ID -> Pbkdf2Sha256PasswordHasher.DEFAULTS;
            default -> Map.of();
        };
    }
}
