package bastion.core.port.in;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import bastion.core.model.session.Session;

/**
 * Use cases for the session lifecycle.
 */
public interface SessionManagement {

    /**
     * Start a session for an authenticated principal.
     *
     * @param principal account identifier
     * @param host      client host, may be null
     */
    Uni<Session> create(String principal, String host);

    /**
     * Record an access, resetting the idle window.
     *
     * @return Uni with the updated session; fails with
     *     {@link bastion.core.model.session.SessionExpiredException} if the session is
     *     unknown or past either expiry bound
     */
    Uni<Session> touch(String sessionId);

    /**
     * Look up a valid session without recording an access.
     */
    Uni<Optional<Session>> getSession(String sessionId);

    /**
     * End a session.
     *
     * @return Uni with the removed session, empty if it did not exist
     */
    Uni<Optional<Session>> invalidate(String sessionId);

    /**
     * End every session of a principal.
     *
     * @return Uni with the number of sessions ended
     */
    Uni<Integer> invalidateAll(String principal);

    /**
     * Remove every expired session.
     *
     * @return Uni with the number of sessions removed
     */
    Uni<Integer> validateAll();
}
