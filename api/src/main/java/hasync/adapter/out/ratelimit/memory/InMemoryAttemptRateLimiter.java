package hasync.adapter.out.ratelimit.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import hasync.core.model.ratelimit.RateLimitDecision;
import hasync.core.port.out.AttemptRateLimiter;

/**
 * In-memory fixed-window rate limiter.
 *
 * <p>Counts are updated inside {@link ConcurrentMap#compute}, so concurrent attempts
 * for the same key are never lost. Expired windows are swept every minute.
 *
 * <p><strong>Warning:</strong> counts are per instance and lost on restart.
 */
public class InMemoryAttemptRateLimiter implements AttemptRateLimiter {

    private static final Logger LOG = Logger.getLogger(InMemoryAttemptRateLimiter.class);

    private final ConcurrentMap<String, Window> windows = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ScheduledExecutorService cleanupExecutor;

    public InMemoryAttemptRateLimiter(Clock clock) {
        this.clock = clock;
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "rate-limit-cleanup");
            t.setDaemon(true);
            return t;
        });
        cleanupExecutor.scheduleAtFixedRate(this::cleanupExpired, 1, 1, TimeUnit.MINUTES);
    }

    @Override
    public Uni<RateLimitDecision> tryAcquire(String key, int maxRequests, Duration window) {
        return Uni.createFrom().item(() -> {
            final var now = clock.instant();
            final var current = windows.compute(key, (k, existing) -> {
                if (existing == null || !now.isBefore(existing.resetAt())) {
                    return new Window(1, now.plus(window));
                }
                return new Window(existing.count() + 1, existing.resetAt());
            });

            if (current.count() <= maxRequests) {
                return RateLimitDecision.allow(maxRequests - current.count(), maxRequests, current.resetAt());
            }
            final var retryAfter = Math.max(1, Duration.between(now, current.resetAt()).toSeconds());
            LOG.debugf("Rate limit exceeded for %s: %d/%d", key, current.count(), maxRequests);
            return RateLimitDecision.rejected(maxRequests, current.resetAt(), retryAfter);
        });
    }

    @Override
    public Uni<Void> reset(String key) {
        return Uni.createFrom().item(() -> {
            windows.remove(key);
            return null;
        });
    }

    private void cleanupExpired() {
        final var now = clock.instant();
        final var before = windows.size();
        windows.entrySet().removeIf(entry -> !now.isBefore(entry.getValue().resetAt()));
        final var removed = before - windows.size();
        if (removed > 0) {
            LOG.debugf("Cleaned up %d expired rate limit windows", removed);
        }
    }

    /**
     * Shuts down the cleanup executor.
     */
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
     * Get the number of tracked keys (for testing).
     */
    public int getTrackedKeyCount() {
        return windows.size();
    }

    private record Window(int count, Instant resetAt) {}
}
