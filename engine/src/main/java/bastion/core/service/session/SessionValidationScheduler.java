package bastion.core.service.session;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import bastion.core.config.SessionConfig;
import bastion.core.model.auth.ConfigurationException;
import bastion.core.port.in.SessionManagement;

/**
 * Periodically removes expired sessions.
 *
 * <p>Runs only when {@code bastion.session.validation.scheduler-enabled} is set. Without
 * it sessions still expire lazily when accessed.
 */
@ApplicationScoped
public class SessionValidationScheduler {

    private static final Logger LOG = Logger.getLogger(SessionValidationScheduler.class);

    private final SessionManagement sessions;
    private final SessionConfig config;

    @Inject
    public SessionValidationScheduler(SessionManagement sessions, SessionConfig config) {
        this.sessions = sessions;
        this.config = config;
    }

    void onStart(@Observes StartupEvent event) {
        checkConfiguration();
    }

    void checkConfiguration() {
        if (!config.validation().schedulerEnabled()) {
            LOG.debug("Session validation sweep disabled");
            return;
        }
        final var interval = config.validation().interval();
        if (interval.isZero() || interval.isNegative()) {
            throw new ConfigurationException("Session validation interval must be positive");
        }
        LOG.infof("Session validation sweep runs every %s", interval);
    }

    /**
     * Remove every session past its idle or absolute deadline.
     */
    @Scheduled(
            every = "${bastion.session.validation.interval:1h}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> validateSessions() {
        if (!config.validation().schedulerEnabled()) {
            return Uni.createFrom().voidItem();
        }

        LOG.debug("Sweeping expired sessions...");

        return sessions.validateAll()
                .invoke(removed -> LOG.debugf("Session validation sweep removed %s sessions", removed))
                .replaceWithVoid()
                .onFailure()
                .invoke(e -> LOG.warn("Session validation sweep failed", e));
    }
}
