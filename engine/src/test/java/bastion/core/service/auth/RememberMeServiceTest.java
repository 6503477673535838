package bastion.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;
import java.util.Optional;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import bastion.core.model.auth.ConfigurationException;
import bastion.support.MutableClock;
import bastion.support.TestConfigs;

@DisplayName("RememberMeService")
class RememberMeServiceTest {

    private static final String KEY = Base64.getEncoder().encodeToString(new byte[32]);
    private static final String OTHER_KEY = Base64.getEncoder().encodeToString(filled(32, (byte) 7));

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private MutableClock clock;
    private RememberMeService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-01-01T00:00:00Z");
        service = new RememberMeService(TestConfigs.rememberMe(KEY), objectMapper, clock);
    }

    private static byte[] filled(int length, byte value) {
        final var bytes = new byte[length];
        Arrays.fill(bytes, value);
        return bytes;
    }

    @Nested
    @DisplayName("issue and resolve")
    class IssueAndResolve {

        @Test
        @DisplayName("should resolve an issued token to its principal")
        void shouldResolveIssuedToken() {
            final var token = service.issue("alice").orElseThrow();

            assertEquals("alice", token.principal());
            assertEquals("v1", token.cipherKeyId());
            assertFalse(token.encryptedPayload().contains("alice"));
            assertEquals(Optional.of("alice"), service.resolve(token.encryptedPayload()));
        }

        @Test
        @DisplayName("should honor a token until just before it expires")
        void shouldHonorUntilExpiry() {
            final var token = service.issue("alice").orElseThrow();

            clock.set(Instant.parse("2024-01-14T23:59:59Z"));
            assertEquals(Optional.of("alice"), service.resolve(token.encryptedPayload()));

            clock.set(Instant.parse("2024-01-15T00:00:00Z"));
            assertTrue(service.resolve(token.encryptedPayload()).isEmpty());
        }

        @Test
        @DisplayName("should ignore a token sealed under another key")
        void shouldIgnoreForeignKey() {
            final var other = new RememberMeService(TestConfigs.rememberMe(OTHER_KEY), objectMapper, clock);
            final var token = other.issue("alice").orElseThrow();

            assertTrue(service.resolve(token.encryptedPayload()).isEmpty());
        }

        @Test
        @DisplayName("should ignore a tampered token")
        void shouldIgnoreTamperedToken() {
            final var payload = service.issue("alice").orElseThrow().encryptedPayload();
            final var bytes = Base64.getUrlDecoder().decode(payload);
            bytes[bytes.length - 1] ^= 0x01;
            final var tampered = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);

            assertTrue(service.resolve(tampered).isEmpty());
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "not-a-token", "AAAA"})
        @DisplayName("should ignore garbage")
        void shouldIgnoreGarbage(String value) {
            assertTrue(service.resolve(value).isEmpty());
        }
    }

    @Nested
    @DisplayName("Disabled")
    class Disabled {

        @Test
        @DisplayName("should issue nothing and resolve nothing without a key")
        void shouldBeInertWithoutKey() {
            final var disabled = new RememberMeService(TestConfigs.rememberMe(null), objectMapper, clock);
            final var token = service.issue("alice").orElseThrow();

            assertFalse(disabled.isEnabled());
            assertTrue(disabled.issue("alice").isEmpty());
            assertTrue(disabled.resolve(token.encryptedPayload()).isEmpty());
        }
    }

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        @Test
        @DisplayName("should reject a key that is not 256 bits")
        void shouldRejectShortKey() {
            final var shortKey = Base64.getEncoder().encodeToString(new byte[16]);

            assertThrows(ConfigurationException.class,
                    () -> new RememberMeService(TestConfigs.rememberMe(shortKey), objectMapper, clock));
        }

        @Test
        @DisplayName("should reject a key that is not Base64")
        void shouldRejectNonBase64Key() {
            assertThrows(ConfigurationException.class,
                    () -> new RememberMeService(TestConfigs.rememberMe("%%%"), objectMapper, clock));
        }

        @Test
        @DisplayName("should reject a non-positive TTL")
        void shouldRejectNonPositiveTtl() {
            final var config = new TestConfigs.RememberMe(Optional.of(KEY), "v1", Duration.ZERO);

            assertThrows(ConfigurationException.class, () -> new RememberMeService(config, objectMapper, clock));
        }
    }
}
