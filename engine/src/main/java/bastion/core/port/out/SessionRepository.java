package bastion.core.port.out;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import bastion.core.model.session.Session;

/**
 * Port for session persistence.
 *
 * <p>Updates are compare-and-set so that a touch and a concurrent expiry sweep
 * cannot overwrite each other: whichever writes second sees that the stored value
 * has changed and re-reads.
 */
public interface SessionRepository {

    /**
     * Save a session only if no session with the same id exists.
     *
     * @return Uni with true if saved, false on id collision
     */
    Uni<Boolean> saveIfAbsent(Session session);

    Uni<Optional<Session>> findById(String sessionId);

    /**
     * Replace {@code expected} with {@code updated} if the stored session still equals {@code expected}.
     *
     * @return Uni with true if replaced
     */
    Uni<Boolean> replace(Session expected, Session updated);

    /**
     * Delete the session if the stored session still equals {@code expected}.
     *
     * @return Uni with true if deleted
     */
    Uni<Boolean> deleteIfMatches(Session expected);

    Uni<Void> delete(String sessionId);

    /**
     * Delete every session of a principal.
     *
     * @return Uni with the ids of the deleted sessions
     */
    Uni<List<String>> deleteByPrincipal(String principal);

    /**
     * Stream every stored session.
     */
    Multi<Session> streamAll();
}
