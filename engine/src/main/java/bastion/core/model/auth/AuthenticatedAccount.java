package bastion.core.model.auth;

/**
 * Outcome of a successful first-factor authentication.
 *
 * @param principal  the authenticated account
 * @param realmName  realm that accepted the credentials
 * @param upgraded   true if the stored credential was re-hashed during this login
 */
public record AuthenticatedAccount(String principal, String realmName, boolean upgraded) {}
