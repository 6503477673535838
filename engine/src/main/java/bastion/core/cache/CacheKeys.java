package bastion.core.cache;

/**
 * Cache key layout.
 *
 * <p>Keys are namespaced by kind and, for account data, by realm, so two realms that
 * know the same principal never share entries.
 */
public final class CacheKeys {

    private CacheKeys() {}

    public static String credential(String realm, String principal) {
        return "authc:credential:" + realm + ":" + principal;
    }

    public static String authorizationInfo(String realm, String principal) {
        return "authz:info:" + realm + ":" + principal;
    }

    public static String totpSecrets(String realm, String principal) {
        return "mfa:totp:" + realm + ":" + principal;
    }

    public static String session(String sessionId) {
        return "session:" + sessionId;
    }
}
