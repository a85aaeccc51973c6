package hasync.adapter.in.websocket;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

import io.vertx.core.Vertx;
import io.vertx.core.http.ServerWebSocket;
import org.jboss.logging.Logger;

import hasync.core.model.realtime.OutboundMessage;
import hasync.core.port.out.RealtimeChannel;

/**
 * {@link RealtimeChannel} over a Vert.x server WebSocket.
 *
 * <p>A final frame gets {@code closeGrace} to flush. A peer that stops reading cannot
 * hold the socket open past it.
 */
public class VertxRealtimeChannel implements RealtimeChannel {

    private static final Logger LOG = Logger.getLogger(VertxRealtimeChannel.class);

    private final String id;
    private final ServerWebSocket socket;
    private final RealtimeMessageCodec codec;
    private final Vertx vertx;
    private final Duration closeGrace;

    public VertxRealtimeChannel(
            String id, ServerWebSocket socket, RealtimeMessageCodec codec, Vertx vertx, Duration closeGrace) {
        this.id = id;
        this.socket = socket;
        this.codec = codec;
        this.vertx = vertx;
        this.closeGrace = closeGrace;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean writeQueueFull() {
        return socket.writeQueueFull();
    }

    @Override
    public void write(OutboundMessage message) {
        socket.writeTextMessage(codec.encode(message))
                .onFailure(e -> LOG.debugv(
                        "Write of {0} frame to socket {1} failed: {2}", message.type(), id, e.getMessage()));
    }

    @Override
    public void drainHandler(Runnable handler) {
        socket.drainHandler(v -> handler.run());
    }

    @Override
    public void close(int code, String reason) {
        if (!socket.isClosed()) {
            socket.close((short) code, reason);
        }
    }

    @Override
    public void writeAndClose(OutboundMessage message, int code, String reason) {
        if (socket.isClosed()) {
            return;
        }
        final var closed = new AtomicBoolean();
        final Runnable closeOnce = () -> {
            if (closed.compareAndSet(false, true)) {
                close(code, reason);
            }
        };
        final long timerId = vertx.setTimer(closeGrace.toMillis(), timer -> {
            if (!closed.get()) {
                LOG.debugv(
                        "Final {0} frame to socket {1} not flushed within {2}, closing",
                        message.type(),
                        id,
                        closeGrace);
            }
            closeOnce.run();
        });
        socket.writeTextMessage(codec.encode(message)).onComplete(ignored -> {
            vertx.cancelTimer(timerId);
            closeOnce.run();
        });
    }

    @Override
    public boolean isClosed() {
        return socket.isClosed();
    }
}
