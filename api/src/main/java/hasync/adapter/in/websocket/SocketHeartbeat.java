package hasync.adapter.in.websocket;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.ServerWebSocket;

/**
 * Pings one socket on a fixed interval and reports a peer that stops answering.
 *
 * <p>A pong clears the pending timeout. If no pong arrives within {@code timeout} of a
 * ping, the heartbeat stops and {@code onTimeout} runs once. Timer callbacks run on the
 * event loop.
 */
final class SocketHeartbeat {

    private final Vertx vertx;
    private final ServerWebSocket socket;
    private final Duration interval;
    private final Duration timeout;
    private final Runnable onTimeout;
    private final AtomicBoolean stopped = new AtomicBoolean();

    private volatile long pingTimerId = -1;
    private volatile long pongTimeoutTimerId = -1;

    SocketHeartbeat(Vertx vertx, ServerWebSocket socket, Duration interval, Duration timeout, Runnable onTimeout) {
        this.vertx = vertx;
        this.socket = socket;
        this.interval = interval;
        this.timeout = timeout;
        this.onTimeout = onTimeout;
    }

    void start() {
        socket.pongHandler(buffer -> cancelPongTimeout());
        pingTimerId = vertx.setPeriodic(interval.toMillis(), id -> {
            if (stopped.get()) {
                return;
            }
            if (pongTimeoutTimerId == -1) {
                pongTimeoutTimerId = vertx.setTimer(timeout.toMillis(), timer -> {
                    if (stop()) {
                        onTimeout.run();
                    }
                });
            }
            socket.writePing(Buffer.buffer("ping"));
        });
    }

    /**
     * Cancel all timers.
     *
     * @return false if already stopped
     */
    boolean stop() {
        if (!stopped.compareAndSet(false, true)) {
            return false;
        }
        if (pingTimerId != -1) {
            vertx.cancelTimer(pingTimerId);
        }
        cancelPongTimeout();
        return true;
    }

    private void cancelPongTimeout() {
        final var timerId = pongTimeoutTimerId;
        if (timerId != -1) {
            vertx.cancelTimer(timerId);
            pongTimeoutTimerId = -1;
        }
    }
}
