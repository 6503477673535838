package bastion.adapter.out.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import bastion.core.cache.CacheBackendRegistry;
import bastion.core.config.CacheConfig;
import bastion.spi.CacheBackend;
import bastion.spi.CacheBackendProvider;
import bastion.support.TestConfigs;

@DisplayName("CaffeineCacheBackend")
class CaffeineCacheBackendTest {

    private AtomicLong nanos;
    private CaffeineCacheBackend backend;

    @BeforeEach
    void setUp() {
        nanos = new AtomicLong();
        final Ticker ticker = nanos::get;
        backend = new CaffeineCacheBackend(100, 0.0, ticker);
    }

    @Nested
    @DisplayName("expiry")
    class ExpiryTests {

        @Test
        @DisplayName("should expire an entry after its own TTL")
        void shouldExpireAfterTtl() {
            backend.set("short", "a", Duration.ofSeconds(10)).await().indefinitely();
            backend.set("long", "b", Duration.ofSeconds(60)).await().indefinitely();

            nanos.addAndGet(Duration.ofSeconds(11).toNanos());

            assertTrue(backend.get("short", String.class).await().indefinitely().isEmpty());
            assertEquals(Optional.of("b"), backend.get("long", String.class).await().indefinitely());
        }

        @Test
        @DisplayName("should never keep an entry past its TTL with jitter")
        void jitterOnlyShortens() {
            final Ticker ticker = nanos::get;
            final var jittered = new CaffeineCacheBackend(100, 0.5, ticker);
            for (int i = 0; i < 20; i++) {
                jittered.set("k" + i, i, Duration.ofSeconds(10)).await().indefinitely();
            }

            nanos.addAndGet(Duration.ofSeconds(10).toNanos());

            for (int i = 0; i < 20; i++) {
                assertTrue(jittered.get("k" + i, Integer.class).await().indefinitely().isEmpty());
            }
        }

        @Test
        @DisplayName("should reject a non-positive TTL")
        void shouldRejectNonPositiveTtl() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> backend.set("k", "v", Duration.ZERO).await().indefinitely());
        }
    }

    @Nested
    @DisplayName("get()")
    class GetTests {

        @Test
        @DisplayName("should treat a value of another type as absent")
        void shouldFilterByType() {
            backend.set("k", 42, Duration.ofMinutes(1)).await().indefinitely();

            assertTrue(backend.get("k", String.class).await().indefinitely().isEmpty());
            assertEquals(Optional.of(42), backend.get("k", Integer.class).await().indefinitely());
        }

        @Test
        @DisplayName("should forget deleted entries")
        void shouldDelete() {
            backend.set("k", "v", Duration.ofMinutes(1)).await().indefinitely();
            backend.delete("k").await().indefinitely();

            assertTrue(backend.get("k", String.class).await().indefinitely().isEmpty());
        }
    }

    @Nested
    @DisplayName("CacheBackendRegistry")
    class RegistryTests {

        @Test
        @DisplayName("should create the configured backend once")
        void shouldCreateConfiguredBackendOnce() {
            final var registry = new CacheBackendRegistry(
                    List.<CacheBackendProvider>of(new CaffeineCacheBackendProvider()), TestConfigs.cache());

            final var first = registry.getBackend();

            assertTrue(first instanceof CaffeineCacheBackend);
            assertEquals(first, registry.getBackend());
        }

        @Test
        @DisplayName("should fall back to the highest priority provider")
        void shouldFallBackToHighestPriority() {
            final var preferred = new FixedProvider("distributed", 10, new CaffeineCacheBackend(1));
            final var config = new TestConfigs.CacheSettings(true, "missing", 10, TestConfigs.cache().ttl());
            final var registry = new CacheBackendRegistry(
                    List.<CacheBackendProvider>of(new CaffeineCacheBackendProvider(), preferred), config);

            assertEquals(preferred.backend(), registry.getBackend());
        }
    }

    private record FixedProvider(String name, int priority, CacheBackend backend) implements CacheBackendProvider {

        @Override
        public String description() {
            return "fixed";
        }

        @Override
        public boolean isAvailable() {
            return true;
        }

        @Override
        public CacheBackend createBackend(CacheConfig config) {
            return backend;
        }
    }
}
