package bastion.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import bastion.core.model.auth.FailureReason;
import bastion.spi.SecurityEvent;
import bastion.spi.SecurityEventHandler;

@DisplayName("SecurityEventDispatcher")
class SecurityEventDispatcherTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private static final class TestHandler implements SecurityEventHandler {

        private final String name;
        private final int priority;
        private final boolean available;
        private final List<String> log;
        private boolean closed;

        TestHandler(String name, int priority, boolean available, List<String> log) {
            this.name = name;
            this.priority = priority;
            this.available = available;
            this.log = log;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public int priority() {
            return priority;
        }

        @Override
        public boolean isAvailable() {
            return available;
        }

        @Override
        public void handle(SecurityEvent event) {
            if (name.equals("broken")) {
                throw new IllegalStateException("handler failure");
            }
            log.add(name + ":" + event.principal());
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    @Nested
    @DisplayName("publish()")
    class PublishTests {

        @Test
        @DisplayName("should deliver events to available handlers in priority order")
        void shouldDeliverInPriorityOrder() {
            final var log = new CopyOnWriteArrayList<String>();
            final var low = new TestHandler("low", 0, true, log);
            final var high = new TestHandler("high", 10, true, log);
            final var off = new TestHandler("off", 100, false, log);
            final var dispatcher =
                    new SecurityEventDispatcher(List.of(low, high, off), Executors.newSingleThreadExecutor());

            dispatcher.publish(new SecurityEvent.AccountUnlocked(NOW, "alice"));
            dispatcher.publish(new SecurityEvent.AccountUnlocked(NOW, "bob"));
            dispatcher.shutdown();

            assertEquals(
                    List.of("high", "low"),
                    dispatcher.getHandlers().stream().map(SecurityEventHandler::name).toList());
            assertEquals(List.of("high:alice", "low:alice", "high:bob", "low:bob"), log);
            assertTrue(low.closed);
            assertTrue(high.closed);
        }

        @Test
        @DisplayName("should keep delivering when one handler fails")
        void shouldIsolateHandlerFailures() {
            final var log = new CopyOnWriteArrayList<String>();
            final var broken = new TestHandler("broken", 10, true, log);
            final var working = new TestHandler("working", 0, true, log);
            final var dispatcher =
                    new SecurityEventDispatcher(List.of(broken, working), Executors.newSingleThreadExecutor());

            dispatcher.publish(new SecurityEvent.AccountUnlocked(NOW, "alice"));
            dispatcher.shutdown();

            assertEquals(List.of("working:alice"), log);
        }

        @Test
        @DisplayName("should drop events published after shutdown")
        void shouldDropAfterShutdown() {
            final var log = new CopyOnWriteArrayList<String>();
            final var dispatcher = new SecurityEventDispatcher(
                    List.of(new TestHandler("only", 0, true, log)), Executors.newSingleThreadExecutor());
            dispatcher.shutdown();

            assertDoesNotThrow(() -> dispatcher.publish(new SecurityEvent.AccountUnlocked(NOW, "alice")));
            assertTrue(log.isEmpty());
        }

        @Test
        @DisplayName("should find the logging handler through the service loader")
        void shouldDiscoverLoggingHandler() {
            final var dispatcher = new SecurityEventDispatcher();

            assertTrue(dispatcher.getHandlers().stream().anyMatch(h -> h instanceof LoggingSecurityEventHandler));
            dispatcher.shutdown();
        }
    }

    @Nested
    @DisplayName("LoggingSecurityEventHandler")
    class FormatTests {

        @Test
        @DisplayName("should describe failures with reason and count")
        void shouldFormatFailure() {
            final var event =
                    new SecurityEvent.AuthenticationFailed(NOW, "alice", FailureReason.INVALID_CREDENTIALS, 2);

            assertEquals(
                    "AUTH_FAILURE: principal=alice reason=INVALID_CREDENTIALS failures=2",
                    LoggingSecurityEventHandler.format(event));
        }

        @Test
        @DisplayName("should abbreviate session ids")
        void shouldAbbreviateSessionIds() {
            final var event = new SecurityEvent.SessionStarted(NOW, "alice", "0123456789abcdef");

            assertEquals(
                    "SESSION_STARTED: principal=alice session=01234567...",
                    LoggingSecurityEventHandler.format(event));
        }

        @Test
        @DisplayName("should describe credential upgrades")
        void shouldFormatUpgrade() {
            final var event = new SecurityEvent.CredentialUpgraded(NOW, "alice", "pbkdf2_sha256", "argon2");

            assertEquals(
                    "CREDENTIAL_UPGRADED: principal=alice from=pbkdf2_sha256 to=argon2",
                    LoggingSecurityEventHandler.format(event));
        }
    }
}
