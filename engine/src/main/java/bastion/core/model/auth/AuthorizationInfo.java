package bastion.core.model.auth;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Roles and permissions assigned to a principal.
 *
 * <p>Permissions are parsed once and indexed by domain, so a check only walks the
 * permissions of the requested domain plus the wildcard domain.
 *
 * @param principal   account identifier
 * @param roles       assigned role identifiers
 * @param permissions assigned permission strings
 * @throws IllegalArgumentException if a permission string is malformed
 */
public record AuthorizationInfo(String principal, Set<String> roles, Set<String> permissions) {

    public AuthorizationInfo {
        roles = roles == null ? Set.of() : Set.copyOf(roles);
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
        // malformed grants are rejected up front so checks never fail on them
        permissions.forEach(WildcardPermission::parse);
    }

    /**
     * Authorization info for a principal with nothing assigned.
     */
    public static AuthorizationInfo empty(String principal) {
        return new AuthorizationInfo(principal, Set.of(), Set.of());
    }

    /**
     * Group parsed permissions by domain.
     */
    public Map<String, List<WildcardPermission>> indexByDomain() {
        final var index = new HashMap<String, List<WildcardPermission>>();
        for (var permission : permissions) {
            final var parsed = WildcardPermission.parse(permission);
            index.computeIfAbsent(parsed.domain(), d -> new ArrayList<>()).add(parsed);
        }
        index.replaceAll((domain, list) -> Collections.unmodifiableList(list));
        return Collections.unmodifiableMap(index);
    }
}
