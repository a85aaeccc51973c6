package hasync.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import hasync.core.model.realtime.OverflowPolicy;

/**
 * Configuration mapping for the real-time WebSocket channel.
 *
 * <p>Configuration prefix: {@code hasync.realtime}
 *
 * <p>Limits are per instance.
 */
@ConfigMapping(prefix = "hasync.realtime")
public interface RealtimeConfig {

    /**
     * Maximum concurrent connections. Upgrades beyond it get 503.
     *
     * @return max connections (default: 1000)
     */
    @WithDefault("1000")
    int maxConnections();

    /**
     * Frames buffered per connection while the peer is slow.
     *
     * @return queue capacity (default: 256)
     */
    @WithDefault("256")
    int sendQueueCapacity();

    /** @return behaviour when the queue is full (default: DROP_OLDEST) */
    @WithDefault("DROP_OLDEST")
    OverflowPolicy overflowPolicy();

    /** @return WebSocket upgrade path (default: /ws) */
    @WithDefault("/ws")
    String path();

    /**
     * Longest wait for a final frame (such as the revocation notice) to flush before the
     * socket is closed anyway.
     *
     * @return close grace period (default: 500ms)
     */
    @WithDefault("PT0.5S")
    Duration closeGrace();

    /** Heartbeat that detects peers gone without a close. */
    Heartbeat heartbeat();

    interface Heartbeat {

        /** @return whether sockets are pinged (default: true) */
        @WithDefault("true")
        boolean enabled();

        /** @return time between pings (default: 30s) */
        @WithDefault("PT30S")
        Duration interval();

        /**
         * A socket that has not answered a ping with a pong within this time is closed
         * and unregistered.
         *
         * @return pong timeout (default: 10s)
         */
        @WithDefault("PT10S")
        Duration timeout();
    }
}
