package bastion.adapter.out.telemetry;

import org.jboss.logging.Logger;

import bastion.spi.SecurityEvent;
import bastion.spi.SecurityEventHandler;

/**
 * Security event handler that logs events using JBoss Logging.
 *
 * <p>This is a built-in handler with priority 0 that always runs.
 * Log levels are based on event severity:
 * <ul>
 *   <li>INFO severity: DEBUG level</li>
 *   <li>WARNING severity: WARN level</li>
 *   <li>CRITICAL severity: ERROR level</li>
 * </ul>
 *
 * <p>Session ids are bearer secrets, so only a short prefix is logged.
 */
public class LoggingSecurityEventHandler implements SecurityEventHandler {

    private static final Logger LOG = Logger.getLogger("bastion.security");
    private static final int SESSION_ID_PREFIX = 8;

    @Override
    public String name() {
        return "logging";
    }

    @Override
    public String description() {
        return "Logs security events using JBoss Logging";
    }

    @Override
    public void handle(SecurityEvent event) {
        var message = format(event);
        switch (event.severity()) {
            case INFO -> LOG.debug(message);
            case WARNING -> LOG.warn(message);
            case CRITICAL -> LOG.error(message);
        }
    }

    static String format(SecurityEvent event) {
        if (event instanceof SecurityEvent.AuthenticationSucceeded e) {
            return String.format("AUTH_SUCCESS: principal=%s realm=%s", e.principal(), e.realm());
        }
        if (event instanceof SecurityEvent.AuthenticationFailed e) {
            return String.format(
                    "AUTH_FAILURE: principal=%s reason=%s failures=%d", e.principal(), e.reason(), e.failureCount());
        }
        if (event instanceof SecurityEvent.AccountLocked e) {
            return String.format("ACCOUNT_LOCKED: principal=%s failures=%d", e.principal(), e.failedAttempts());
        }
        if (event instanceof SecurityEvent.AccountUnlocked e) {
            return String.format("ACCOUNT_UNLOCKED: principal=%s", e.principal());
        }
        if (event instanceof SecurityEvent.CredentialUpgraded e) {
            return String.format(
                    "CREDENTIAL_UPGRADED: principal=%s from=%s to=%s",
                    e.principal(), e.fromAlgorithm(), e.toAlgorithm());
        }
        if (event instanceof SecurityEvent.MfaChallengeIssued e) {
            return String.format("MFA_CHALLENGE: principal=%s dispatcher=%s", e.principal(), e.dispatcher());
        }
        if (event instanceof SecurityEvent.SessionStarted e) {
            return String.format("SESSION_STARTED: principal=%s session=%s", e.principal(), abbreviate(e.sessionId()));
        }
        if (event instanceof SecurityEvent.SessionStopped e) {
            return String.format(
                    "SESSION_STOPPED: principal=%s session=%s cause=%s",
                    e.principal(), abbreviate(e.sessionId()), e.cause());
        }
        if (event instanceof SecurityEvent.SessionExpired e) {
            return String.format("SESSION_EXPIRED: principal=%s session=%s", e.principal(), abbreviate(e.sessionId()));
        }
        return event.getClass().getSimpleName() + ": principal=" + event.principal();
    }

    private static String abbreviate(String sessionId) {
        return sessionId.length() <= SESSION_ID_PREFIX ? sessionId : sessionId.substring(0, SESSION_ID_PREFIX) + "...";
    }
}
