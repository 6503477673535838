package bastion.core.service.session;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import bastion.core.model.auth.ConfigurationException;
import bastion.core.port.in.SessionManagement;
import bastion.spi.StoreUnavailableException;
import bastion.support.TestConfigs;

@ExtendWith(MockitoExtension.class)
@DisplayName("SessionValidationScheduler")
class SessionValidationSchedulerTest {

    @Mock
    private SessionManagement sessions;

    private static TestConfigs.SessionSettings config(boolean enabled, Duration interval) {
        return new TestConfigs.SessionSettings(
                Duration.ofMinutes(30),
                Duration.ofMinutes(5),
                new TestConfigs.Validation(enabled, interval),
                () -> 3,
                Optional.empty());
    }

    @Nested
    @DisplayName("validateSessions()")
    class ValidateSessions {

        @Test
        @DisplayName("should do nothing when disabled")
        void shouldDoNothingWhenDisabled() {
            final var scheduler = new SessionValidationScheduler(sessions, config(false, Duration.ofMinutes(1)));

            scheduler.validateSessions().await().atMost(Duration.ofSeconds(1));

            verify(sessions, never()).validateAll();
        }

        @Test
        @DisplayName("should run a sweep through the session service")
        void shouldSweep() {
            when(sessions.validateAll()).thenReturn(Uni.createFrom().item(2));
            final var scheduler = new SessionValidationScheduler(sessions, config(true, Duration.ofSeconds(5)));

            scheduler.validateSessions().await().atMost(Duration.ofSeconds(1));

            verify(sessions).validateAll();
        }

        @Test
        @DisplayName("should report a failing sweep and run the next one")
        void shouldRunAfterFailingSweep() {
            when(sessions.validateAll())
                    .thenReturn(Uni.createFrom().failure(new StoreUnavailableException("down")))
                    .thenReturn(Uni.createFrom().item(0));
            final var scheduler = new SessionValidationScheduler(sessions, config(true, Duration.ofSeconds(5)));

            assertThrows(
                    StoreUnavailableException.class,
                    () -> scheduler.validateSessions().await().atMost(Duration.ofSeconds(1)));
            assertDoesNotThrow(() -> scheduler.validateSessions().await().atMost(Duration.ofSeconds(1)));

            verify(sessions, times(2)).validateAll();
        }
    }

    @Nested
    @DisplayName("checkConfiguration()")
    class CheckConfiguration {

        @Test
        @DisplayName("should accept a disabled sweep with any interval")
        void shouldAcceptDisabled() {
            final var scheduler = new SessionValidationScheduler(sessions, config(false, Duration.ZERO));

            assertDoesNotThrow(scheduler::checkConfiguration);
        }

        @Test
        @DisplayName("should refuse a non-positive interval")
        void shouldRefuseNonPositiveInterval() {
            final var scheduler = new SessionValidationScheduler(sessions, config(true, Duration.ZERO));

            assertThrows(ConfigurationException.class, scheduler::checkConfiguration);
        }
    }
}
