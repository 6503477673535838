package bastion.core.service.auth;

import bastion.core.model.auth.AuthorizationInfo;

/**
 * Decides whether assigned permissions imply a required one.
 */
public interface PermissionVerifier {

    boolean isPermitted(AuthorizationInfo info, String permission);
}
