package hasync.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for PIN pairing sessions.
 *
 * <p>Configuration prefix: {@code hasync.pairing}
 */
@ConfigMapping(prefix = "hasync.pairing")
public interface PairingConfig {

    /** Smallest accepted value of {@link #maxAttempts()}. */
    int MIN_ATTEMPTS = 3;

    /** Largest accepted value of {@link #maxAttempts()}. */
    int MAX_ATTEMPTS = 5;

    /**
     * How long a PIN is accepted after the session is created.
     *
     * @return PIN lifetime (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration pinTtl();

    /**
     * Wrong PIN attempts allowed before a session locks. Must be between 3 and 5.
     *
     * @return max attempts (default: 3)
     */
    @WithDefault("3")
    int maxAttempts();

    /**
     * Interval of the expired session sweep, in scheduler syntax.
     *
     * @return sweep interval (default: 60s)
     */
    @WithDefault("60s")
    String cleanupInterval();

    /**
     * How long terminal sessions are kept before the sweep deletes them.
     *
     * @return retention (default: 1 hour)
     */
    @WithDefault("PT1H")
    Duration retention();

    /**
     * Attempts to draw a PIN that does not collide with another open session.
     *
     * @return max draws (default: 5)
     */
    @WithDefault("5")
    int pinCollisionRetries();

    /**
     * Per-IP limit on the public verify endpoint.
     */
    RateLimit verifyRateLimit();

    /**
     * Fixed-window rate limit settings.
     */
    interface RateLimit {

        /** @return attempts per window (default: 5) */
        @WithDefault("5")
        int maxRequests();

        /** @return window length (default: 1 hour) */
        @WithDefault("PT1H")
        Duration window();
    }
}
