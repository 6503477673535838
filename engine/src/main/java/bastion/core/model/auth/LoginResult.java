package bastion.core.model.auth;

import java.util.Optional;

import bastion.core.model.session.Session;

/**
 * Result of a successful login.
 *
 * @param session       the newly issued session
 * @param rememberMe    remember-me token, present when the login opted in
 */
public record LoginResult(Session session, Optional<RememberMeToken> rememberMe) {}
