package bastion.core.service.auth;

import bastion.core.model.auth.AuthorizationInfo;

/**
 * Role check by exact membership.
 */
public class SimpleRoleVerifier implements RoleVerifier {

    @Override
    public boolean hasRole(AuthorizationInfo info, String role) {
        return role != null && info.roles().contains(role);
    }
}
