package bastion.spi;

/**
 * Service provider interface for consuming security events.
 *
 * <p>Handlers are discovered through {@link java.util.ServiceLoader} and invoked in
 * priority order, highest first. Register an implementation in
 * {@code META-INF/services/bastion.spi.SecurityEventHandler}.
 *
 * <p>Handlers run on a dispatcher thread. A handler that throws does not stop the
 * others from receiving the event.
 */
public interface SecurityEventHandler {

    /**
     * Unique handler name.
     */
    String name();

    default String description() {
        return name() + " security event handler";
    }

    /**
     * Higher values run first.
     */
    default int priority() {
        return 0;
    }

    /**
     * Unavailable handlers are skipped at load time.
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Handle one event.
     *
     * @param event the event
     */
    void handle(SecurityEvent event);

    /**
     * Release resources at shutdown.
     */
    default void close() {}
}
