package hasync.core.model.ratelimit;

import java.time.Instant;

/**
 * Result of a fixed-window rate limit check.
 *
 * @param allowed           whether the request is allowed
 * @param remaining         requests remaining in the current window
 * @param limit             the total limit for the window
 * @param resetAt           when the current window ends
 * @param retryAfterSeconds seconds until the client can retry (only meaningful when not allowed)
 */
public record RateLimitDecision(boolean allowed, long remaining, long limit, Instant resetAt, long retryAfterSeconds) {

    public static RateLimitDecision allow(long remaining, long limit, Instant resetAt) {
        return new RateLimitDecision(true, remaining, limit, resetAt, 0);
    }

    public static RateLimitDecision rejected(long limit, Instant resetAt, long retryAfterSeconds) {
        return new RateLimitDecision(false, 0, limit, resetAt, retryAfterSeconds);
    }
}
