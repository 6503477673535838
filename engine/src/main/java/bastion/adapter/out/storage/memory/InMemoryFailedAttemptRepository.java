package bastion.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import jakarta.annotation.PreDestroy;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import bastion.spi.FailedAttemptRepository;

/**
 * In-memory implementation of FailedAttemptRepository.
 *
 * <p>This implementation is intended for development and testing only.
 * Failure counts and lockouts are lost on restart and not shared across instances.
 *
 * <p><strong>Warning:</strong> Do not use in production with multiple instances.
 */
public class InMemoryFailedAttemptRepository implements FailedAttemptRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryFailedAttemptRepository.class);

    private final ConcurrentMap<String, Tally> tallies = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Lock> locks = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ScheduledExecutorService cleanupExecutor;

    public InMemoryFailedAttemptRepository(Clock clock) {
        this.clock = clock;
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "failed-attempt-cleanup");
            t.setDaemon(true);
            return t;
        });
        cleanupExecutor.scheduleAtFixedRate(this::cleanupExpired, 1, 1, TimeUnit.MINUTES);
        LOG.info("Initialized in-memory failed attempt repository");
    }

    @Override
    public Uni<Long> recordFailedAttempt(String key, Optional<Duration> window) {
        return Uni.createFrom().item(() -> {
            final var now = clock.instant();
            final var expiresAt = window.map(now::plus);

            final var tally = tallies.compute(key, (k, existing) -> {
                if (existing == null || existing.expiredAt(now)) {
                    return new Tally(1, expiresAt);
                }
                // every failure extends the window
                return new Tally(existing.count() + 1, expiresAt);
            });

            LOG.debugf("Recorded failed attempt for %s: count=%d", key, tally.count());
            return tally.count();
        });
    }

    @Override
    public Uni<Void> releaseFailedAttempt(String key) {
        return Uni.createFrom().item(() -> {
            tallies.computeIfPresent(key, (k, existing) -> existing.count() <= 1
                    ? null
                    : new Tally(existing.count() - 1, existing.expiresAt()));
            return null;
        });
    }

    @Override
    public Uni<Long> getFailedAttemptCount(String key) {
        return Uni.createFrom().item(() -> {
            final var now = clock.instant();
            final var tally = tallies.get(key);
            if (tally == null) {
                return 0L;
            }
            if (tally.expiredAt(now)) {
                tallies.remove(key, tally);
                return 0L;
            }
            return tally.count();
        });
    }

    @Override
    public Uni<Void> clearFailedAttempts(String key) {
        return Uni.createFrom().item(() -> {
            tallies.remove(key);
            LOG.debugf("Cleared failed attempts for %s", key);
            return null;
        });
    }

    @Override
    public Uni<Void> recordLockout(String key, Optional<Duration> duration, long failedAttempts) {
        return Uni.createFrom().item(() -> {
            final var now = clock.instant();
            final var lock = new Lock(now, duration.map(now::plus), failedAttempts);
            locks.put(key, lock);
            LOG.infof(
                    "Recorded lockout for %s: expires=%s",
                    key,
                    lock.expiresAt().map(Instant::toString).orElse("never"));
            return null;
        });
    }

    @Override
    public Uni<Boolean> isLockedOut(String key) {
        return Uni.createFrom().item(() -> {
            final var lock = locks.get(key);
            if (lock == null) {
                return false;
            }
            if (lock.expiredAt(clock.instant())) {
                locks.remove(key, lock);
                return false;
            }
            return true;
        });
    }

    @Override
    public Uni<Void> clearLockout(String key) {
        return Uni.createFrom().item(() -> {
            if (locks.remove(key) != null) {
                LOG.infof("Cleared lockout for %s", key);
            }
            return null;
        });
    }

    @Override
    public Multi<LockoutInfo> streamAllLockouts() {
        return Multi.createFrom().deferred(() -> {
            final var now = clock.instant();
            return Multi.createFrom()
                    .iterable(locks.entrySet())
                    .filter(entry -> !entry.getValue().expiredAt(now))
                    .map(entry -> new LockoutInfo(
                            entry.getKey(),
                            entry.getValue().lockedAt(),
                            entry.getValue().expiresAt(),
                            entry.getValue().failedAttempts()));
        });
    }

    private void cleanupExpired() {
        final var now = clock.instant();
        final var talliesBefore = tallies.size();
        final var locksBefore = locks.size();

        tallies.entrySet().removeIf(entry -> entry.getValue().expiredAt(now));
        locks.entrySet().removeIf(entry -> entry.getValue().expiredAt(now));

        final var talliesRemoved = talliesBefore - tallies.size();
        final var locksRemoved = locksBefore - locks.size();
        if (talliesRemoved > 0 || locksRemoved > 0) {
            LOG.debugf("Cleaned up %d expired failure tallies and %d lockouts", talliesRemoved, locksRemoved);
        }
    }

    /**
     * Shuts down the cleanup executor.
     */
    @PreDestroy
    public void shutdown() {
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Clear all entries (for testing).
     */
    public void clear() {
        tallies.clear();
        locks.clear();
    }

    private record Tally(long count, Optional<Instant> expiresAt) {

        boolean expiredAt(Instant now) {
            return expiresAt.map(e -> !now.isBefore(e)).orElse(false);
        }
    }

    private record Lock(Instant lockedAt, Optional<Instant> expiresAt, long failedAttempts) {

        boolean expiredAt(Instant now) {
            return expiresAt.map(e -> !now.isBefore(e)).orElse(false);
        }
    }
}
