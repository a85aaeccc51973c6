package hasync.core.port.out;

import java.time.Duration;

import io.smallrye.mutiny.Uni;

import hasync.core.model.ratelimit.RateLimitDecision;

/**
 * Port for fixed-window attempt counting.
 */
public interface AttemptRateLimiter {

    /**
     * Count one attempt for {@code key} and decide whether it is within allowance.
     *
     * @param key         the rate limit key
     * @param maxRequests attempts allowed per window
     * @param window      window length
     * @return the decision for this attempt
     */
    Uni<RateLimitDecision> tryAcquire(String key, int maxRequests, Duration window);

    /**
     * Forget all attempts for {@code key}.
     */
    Uni<Void> reset(String key);
}
