package bastion.adapter.out.mfa;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import bastion.spi.MfaDispatcher;

/**
 * MFA dispatcher that keeps the last code sent to each principal instead of delivering it.
 *
 * <p>For development and testing. Select it with
 * {@code bastion.authc.totp.mfa-dispatcher=recording}.
 */
@ApplicationScoped
public class RecordingMfaDispatcher implements MfaDispatcher {

    private static final Logger LOG = Logger.getLogger(RecordingMfaDispatcher.class);

    private final ConcurrentMap<String, Delivery> deliveries = new ConcurrentHashMap<>();

    @Override
    public String name() {
        return "recording";
    }

    @Override
    public Uni<Void> dispatch(String principal, String code, Instant expiresAt) {
        return Uni.createFrom().item(() -> {
            deliveries.put(principal, new Delivery(code, expiresAt));
            LOG.debugf("Recorded one-time code for %s, valid until %s", principal, expiresAt);
            return null;
        });
    }

    /**
     * Last code dispatched to a principal.
     */
    public Optional<Delivery> lastDelivery(String principal) {
        return Optional.ofNullable(deliveries.get(principal));
    }

    public void clear() {
        deliveries.clear();
    }

    public record Delivery(String code, Instant expiresAt) {}
}
