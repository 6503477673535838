package bastion.adapter.out.storage.memory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import bastion.core.model.session.Session;
import bastion.core.port.out.SessionRepository;

/**
 * In-memory implementation of SessionRepository.
 *
 * <p>This implementation is intended for development and testing only.
 * Sessions are lost on restart and not shared across instances. Expiry is left to
 * the session service; this class only stores.
 */
public class InMemorySessionRepository implements SessionRepository {

    private static final Logger LOG = Logger.getLogger(InMemorySessionRepository.class);

    private final ConcurrentMap<String, Session> sessions = new ConcurrentHashMap<>();

    @Override
    public Uni<Boolean> saveIfAbsent(Session session) {
        return Uni.createFrom().item(() -> {
            final var existing = sessions.putIfAbsent(session.id(), session);
            if (existing != null) {
                LOG.debug("Session ID collision detected");
                return false;
            }
            return true;
        });
    }

    @Override
    public Uni<Optional<Session>> findById(String sessionId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(sessions.get(sessionId)));
    }

    @Override
    public Uni<Boolean> replace(Session expected, Session updated) {
        return Uni.createFrom().item(() -> sessions.replace(expected.id(), expected, updated));
    }

    @Override
    public Uni<Boolean> deleteIfMatches(Session expected) {
        return Uni.createFrom().item(() -> sessions.remove(expected.id(), expected));
    }

    @Override
    public Uni<Void> delete(String sessionId) {
        return Uni.createFrom().item(() -> {
            sessions.remove(sessionId);
            return null;
        });
    }

    @Override
    public Uni<List<String>> deleteByPrincipal(String principal) {
        return Uni.createFrom().item(() -> {
            final var removed = new ArrayList<String>();
            for (var entry : sessions.entrySet()) {
                if (entry.getValue().principal().equals(principal)
                        && sessions.remove(entry.getKey(), entry.getValue())) {
                    removed.add(entry.getKey());
                }
            }
            LOG.debugf("Deleted %d session(s) of %s", removed.size(), principal);
            return removed;
        });
    }

    @Override
    public Multi<Session> streamAll() {
        return Multi.createFrom().items(() -> List.copyOf(sessions.values()).stream());
    }

    /**
     * Number of stored sessions (for testing).
     */
    public int size() {
        return sessions.size();
    }
}
