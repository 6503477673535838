package bastion.core.service.auth;

import bastion.core.model.auth.AuthorizationInfo;

/**
 * Decides whether a principal holds a role.
 */
public interface RoleVerifier {

    boolean hasRole(AuthorizationInfo info, String role);
}
