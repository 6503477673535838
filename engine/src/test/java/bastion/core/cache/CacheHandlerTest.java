package bastion.core.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import bastion.adapter.out.cache.CaffeineCacheBackend;
import bastion.core.model.auth.ConfigurationException;
import bastion.core.model.cache.TtlClass;
import bastion.core.model.session.Session;
import bastion.spi.CacheBackend;
import bastion.spi.CacheUnavailableException;
import bastion.support.MutableClock;
import bastion.support.TestConfigs;

@DisplayName("CacheHandler")
class CacheHandlerTest {

    private MutableClock clock;
    private CaffeineCacheBackend backend;
    private CacheHandler handler;
    private AtomicInteger computations;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-01-01T00:00:00Z");
        backend = new CaffeineCacheBackend(100);
        handler = new CacheHandler(backend, TestConfigs.cache(), clock);
        computations = new AtomicInteger();
    }

    private Uni<String> counted(String value) {
        return Uni.createFrom().item(() -> {
            computations.incrementAndGet();
            return value;
        });
    }

    @Nested
    @DisplayName("getOrCompute()")
    class GetOrComputeTests {

        @Test
        @DisplayName("should collapse concurrent misses into one computation")
        void shouldCollapseConcurrentMisses() throws Exception {
            final var pending = new CompletableFuture<String>();
            final var waiters = new ArrayList<CompletableFuture<String>>();

            for (int i = 0; i < 10; i++) {
                waiters.add(handler.getOrCompute("k", TtlClass.ABSOLUTE, String.class, () -> {
                            computations.incrementAndGet();
                            return Uni.createFrom().completionStage(pending);
                        })
                        .subscribeAsCompletionStage()
                        .toCompletableFuture());
            }

            assertEquals(1, computations.get());
            assertEquals(1, handler.inFlightCount());

            pending.complete("value");

            for (var waiter : waiters) {
                assertEquals("value", waiter.get(1, TimeUnit.SECONDS));
            }
            assertEquals(0, handler.inFlightCount());
            assertEquals(Optional.of("value"), backend.get("k", String.class).await().indefinitely());
        }

        @Test
        @DisplayName("should serve later calls from the cache")
        void shouldServeFromCache() {
            handler.getOrCompute("k", TtlClass.ABSOLUTE, String.class, () -> counted("v1")).await().indefinitely();
            final var second = handler.getOrCompute("k", TtlClass.ABSOLUTE, String.class, () -> counted("v2"))
                    .await()
                    .indefinitely();

            assertEquals("v1", second);
            assertEquals(1, computations.get());
        }

        @Test
        @DisplayName("should not cache a null result")
        void shouldNotCacheNull() {
            final var result = handler.getOrCompute("k", TtlClass.ABSOLUTE, String.class, () -> counted(null))
                    .await()
                    .indefinitely();
            handler.getOrCompute("k", TtlClass.ABSOLUTE, String.class, () -> counted(null)).await().indefinitely();

            assertNull(result);
            assertEquals(2, computations.get());
        }

        @Test
        @DisplayName("should fail every waiter and cache nothing when the computation fails")
        void shouldPropagateComputationFailure() {
            final var pending = new CompletableFuture<String>();
            final var first = handler.getOrCompute(
                            "k", TtlClass.ABSOLUTE, String.class, () -> Uni.createFrom().completionStage(pending))
                    .subscribeAsCompletionStage()
                    .toCompletableFuture();
            final var second = handler.getOrCompute("k", TtlClass.ABSOLUTE, String.class, () -> counted("unused"))
                    .subscribeAsCompletionStage()
                    .toCompletableFuture();

            pending.completeExceptionally(new IllegalStateException("store down"));

            assertThrows(CompletionException.class, first::join);
            assertThrows(CompletionException.class, second::join);
            assertEquals(0, computations.get());
            assertEquals(0, handler.inFlightCount());

            final var retried = handler.getOrCompute("k", TtlClass.ABSOLUTE, String.class, () -> counted("fresh"))
                    .await()
                    .indefinitely();
            assertEquals("fresh", retried);
        }

        @Test
        @DisplayName("should not store a result invalidated while computing")
        void shouldDropResultInvalidatedMidFlight() {
            final var pending = new CompletableFuture<String>();
            final var waiter = handler.getOrCompute(
                            "k", TtlClass.ABSOLUTE, String.class, () -> Uni.createFrom().completionStage(pending))
                    .subscribeAsCompletionStage()
                    .toCompletableFuture();

            handler.invalidate("k").await().indefinitely();
            pending.complete("old");

            assertEquals("old", waiter.join());
            assertTrue(backend.get("k", String.class).await().indefinitely().isEmpty());
        }
    }

    @Nested
    @DisplayName("backend failures")
    class BackendFailureTests {

        @Test
        @DisplayName("should compute when the backend cannot be read or written")
        void shouldBypassUnavailableBackend() {
            final var broken = mock(CacheBackend.class);
            when(broken.get(anyString(), eq(String.class)))
                    .thenReturn(Uni.createFrom().failure(new CacheUnavailableException("down")));
            when(broken.set(anyString(), any(), any(Duration.class)))
                    .thenReturn(Uni.createFrom().failure(new CacheUnavailableException("down")));
            when(broken.delete(anyString()))
                    .thenReturn(Uni.createFrom().failure(new CacheUnavailableException("down")));
            final var failOpen = new CacheHandler(broken, TestConfigs.cache(), clock);

            final var value = failOpen.getOrCompute("k", TtlClass.ABSOLUTE, String.class, () -> counted("v"))
                    .await()
                    .indefinitely();
            failOpen.invalidate("k").await().indefinitely();

            assertEquals("v", value);
            assertEquals(1, computations.get());
        }

        @Test
        @DisplayName("should always compute when caching is disabled")
        void shouldComputeWhenDisabled() {
            final var disabled = new CacheHandler((CacheBackend) null, TestConfigs.cacheDisabled(), clock);

            disabled.getOrCompute("k", TtlClass.ABSOLUTE, String.class, () -> counted("v")).await().indefinitely();
            disabled.getOrCompute("k", TtlClass.ABSOLUTE, String.class, () -> counted("v")).await().indefinitely();

            assertEquals(2, computations.get());
        }
    }

    @Nested
    @DisplayName("ttlFor()")
    class TtlTests {

        @Test
        @DisplayName("should cap a session copy at its remaining absolute lifetime")
        void shouldCapSessionTtl() {
            final var session = Session.start(
                    "s", "alice", null, clock.instant(), Duration.ofMinutes(10), Duration.ofMinutes(5));

            assertEquals(Duration.ofMinutes(10), handler.ttlFor(TtlClass.SESSION, session));

            final var longLived = Session.start(
                    "s", "alice", null, clock.instant(), Duration.ofHours(8), Duration.ofMinutes(5));

            assertEquals(Duration.ofMinutes(30), handler.ttlFor(TtlClass.SESSION, longLived));
        }

        @Test
        @DisplayName("should use the configured TTL per class")
        void shouldUseClassTtl() {
            assertEquals(Duration.ofMinutes(5), handler.ttlFor(TtlClass.CREDENTIALS, "x"));
            assertEquals(Duration.ofMinutes(30), handler.ttlFor(TtlClass.AUTHZ_INFO, "x"));
            assertEquals(Duration.ofHours(1), handler.ttlFor(TtlClass.ABSOLUTE, "x"));
        }

        @Test
        @DisplayName("should reject a non-positive TTL")
        void shouldRejectZeroTtl() {
            final var config = new TestConfigs.CacheSettings(
                    true,
                    "memory",
                    10,
                    new TestConfigs.Ttl(
                            Duration.ZERO, Duration.ofMinutes(5), Duration.ofMinutes(5), Duration.ofMinutes(5)));

            assertThrows(ConfigurationException.class, () -> new CacheHandler(backend, config, clock));
        }
    }
}
