package bastion.core.port.out;

import bastion.spi.SecurityEvent;

/**
 * Port for publishing security events.
 *
 * <p>Publishing never blocks and never fails the calling operation.
 */
public interface SecurityEventPublisher {

    void publish(SecurityEvent event);
}
