package hasync.core.service.realtime;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicLong;

import hasync.core.model.realtime.OutboundMessage;
import hasync.core.model.realtime.OverflowPolicy;

/**
 * Bounded per-connection queue of frames waiting for the transport.
 */
public final class OutboundQueue {

    /** Outcome of {@link #offer(OutboundMessage)}. */
    public enum OfferResult {
        QUEUED,
        DROPPED_OLDEST,
        OVERFLOW
    }

    private final int capacity;
    private final OverflowPolicy policy;
    private final Deque<OutboundMessage> frames = new ArrayDeque<>();
    private final AtomicLong dropped = new AtomicLong();

    public OutboundQueue(int capacity, OverflowPolicy policy) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Queue capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.policy = policy;
    }

    public synchronized OfferResult offer(OutboundMessage message) {
        if (frames.size() < capacity) {
            frames.addLast(message);
            return OfferResult.QUEUED;
        }
        return switch (policy) {
            case DROP_OLDEST -> {
                frames.pollFirst();
                frames.addLast(message);
                dropped.incrementAndGet();
                yield OfferResult.DROPPED_OLDEST;
            }
            case DISCONNECT -> OfferResult.OVERFLOW;
        };
    }

    public synchronized OutboundMessage poll() {
        return frames.pollFirst();
    }

    public synchronized boolean isEmpty() {
        return frames.isEmpty();
    }

    public synchronized int size() {
        return frames.size();
    }

    public synchronized void clear() {
        frames.clear();
    }

    /** Frames discarded by {@link OverflowPolicy#DROP_OLDEST} since creation. */
    public long droppedCount() {
        return dropped.get();
    }
}
