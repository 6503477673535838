package bastion.adapter.out.telemetry;

import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import bastion.core.port.out.SecurityEventPublisher;
import bastion.spi.SecurityEvent;
import bastion.spi.SecurityEventHandler;

/**
 * Dispatches security events to registered handlers.
 *
 * <p>Handlers are discovered via {@link ServiceLoader} and invoked in priority order
 * (highest priority first). Events are dispatched on a single background thread so
 * handlers see them in publication order and never block a login.
 */
@ApplicationScoped
public class SecurityEventDispatcher implements SecurityEventPublisher {

    private static final Logger LOG = Logger.getLogger(SecurityEventDispatcher.class);

    private final List<SecurityEventHandler> handlers;
    private final ExecutorService executor;

    @Inject
    public SecurityEventDispatcher() {
        this(
                ServiceLoader.load(SecurityEventHandler.class).stream()
                        .map(ServiceLoader.Provider::get)
                        .toList(),
                Executors.newSingleThreadExecutor(r -> {
                    var thread = new Thread(r, "security-event-dispatcher");
                    thread.setDaemon(true);
                    return thread;
                }));
    }

    public SecurityEventDispatcher(List<SecurityEventHandler> candidates, ExecutorService executor) {
        this.handlers = candidates.stream()
                .filter(SecurityEventHandler::isAvailable)
                .sorted(Comparator.comparingInt(SecurityEventHandler::priority).reversed())
                .toList();
        this.executor = executor;

        if (handlers.isEmpty()) {
            LOG.warn("No security event handlers found - events will not be processed");
        } else {
            LOG.infof(
                    "Loaded %d security event handler(s): %s",
                    handlers.size(),
                    handlers.stream()
                            .map(h -> h.name() + "(priority=" + h.priority() + ")")
                            .toList());
        }
    }

    @PreDestroy
    void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        handlers.forEach(handler -> {
            try {
                handler.close();
            } catch (Exception e) {
                LOG.warnf("Error closing handler %s: %s", handler.name(), e.getMessage());
            }
        });
    }

    /**
     * Dispatch a security event to all registered handlers.
     *
     * @param event the event to dispatch
     */
    @Override
    public void publish(SecurityEvent event) {
        if (handlers.isEmpty()) {
            return;
        }
        try {
            executor.execute(() -> {
                for (var handler : handlers) {
                    try {
                        handler.handle(event);
                    } catch (Exception e) {
                        LOG.warnf("Handler %s failed to process event: %s", handler.name(), e.getMessage());
                    }
                }
            });
        } catch (RejectedExecutionException e) {
            LOG.debugf("Dropped %s after shutdown", event.getClass().getSimpleName());
        }
    }

    /**
     * Get the list of registered handlers.
     *
     * @return handlers in dispatch order
     */
    public List<SecurityEventHandler> getHandlers() {
        return handlers;
    }
}
