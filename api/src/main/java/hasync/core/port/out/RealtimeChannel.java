package hasync.core.port.out;

import hasync.core.model.realtime.OutboundMessage;

/**
 * Transport side of a live connection.
 *
 * <p>Implementations must not block: {@link #write(OutboundMessage)} hands the frame to
 * the transport's own write queue and returns.
 */
public interface RealtimeChannel {

    /** Unique id of the underlying socket. */
    String id();

    /** Whether the transport's write queue is above its high-water mark. */
    boolean writeQueueFull();

    void write(OutboundMessage message);

    /** Register a callback invoked when the transport write queue drains. */
    void drainHandler(Runnable handler);

    void close(int code, String reason);

    /** Write a final frame, then close once it is flushed. */
    void writeAndClose(OutboundMessage message, int code, String reason);

    boolean isClosed();
}
