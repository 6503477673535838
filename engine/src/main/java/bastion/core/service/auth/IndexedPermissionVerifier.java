package bastion.core.service.auth;

import java.util.List;
import java.util.Map;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.jboss.logging.Logger;

import bastion.core.model.auth.AuthorizationInfo;
import bastion.core.model.auth.WildcardPermission;

/**
 * Checks wildcard permissions against a per-domain index.
 *
 * <p>Only the granted permissions of the required domain and of the {@code *} domain
 * are consulted. The index is built once per {@link AuthorizationInfo} instance and
 * held weakly, so it lives exactly as long as the cached info it was built from.
 */
public class IndexedPermissionVerifier implements PermissionVerifier {

    private static final Logger LOG = Logger.getLogger(IndexedPermissionVerifier.class);

    private final Cache<AuthorizationInfo, Map<String, List<WildcardPermission>>> indexes =
            Caffeine.newBuilder().weakKeys().build();

    @Override
    public boolean isPermitted(AuthorizationInfo info, String permission) {
        final WildcardPermission required;
        try {
            required = WildcardPermission.parse(permission);
        } catch (IllegalArgumentException e) {
            LOG.debugf("Rejecting malformed permission check: %s", e.getMessage());
            return false;
        }
        final var index = indexes.get(info, AuthorizationInfo::indexByDomain);
        return implies(index.get(required.domain()), required)
                || (!WildcardPermission.WILDCARD.equals(required.domain())
                        && implies(index.get(WildcardPermission.WILDCARD), required));
    }

    private static boolean implies(List<WildcardPermission> granted, WildcardPermission required) {
        if (granted == null) {
            return false;
        }
        for (var permission : granted) {
            if (permission.implies(required)) {
                return true;
            }
        }
        return false;
    }
}
