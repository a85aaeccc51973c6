package hasync.core.service.realtime;

import java.time.Instant;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.jboss.logging.Logger;

import hasync.core.model.auth.Credential;
import hasync.core.model.auth.Role;
import hasync.core.model.realtime.OutboundMessage;
import hasync.core.model.realtime.OverflowPolicy;
import hasync.core.port.out.RealtimeChannel;

/**
 * A live, authenticated real-time connection.
 *
 * <p>Holds a snapshot of the scopes the credential authorized at connect time,
 * replaced atomically when the scopes change, and the client's optional
 * subscription. Frames go through a bounded {@link OutboundQueue}; the queue is
 * drained by one thread at a time and only while the transport accepts writes,
 * so a slow peer never blocks the sender.
 */
public final class Connection {

    private static final Logger LOG = Logger.getLogger(Connection.class);

    /** Close code sent after a {@code revoked} notice. */
    public static final int CLOSE_REVOKED = 4401;

    /** Close code for queue overflow under {@link OverflowPolicy#DISCONNECT}. */
    public static final int CLOSE_POLICY_VIOLATION = 1008;

    public static final int CLOSE_NORMAL = 1000;

    private final String socketId;
    private final String subjectId;
    private final Role role;
    private final String tokenHash;
    private final Instant connectedAt;
    private final RealtimeChannel channel;
    private final OutboundQueue queue;
    private final AtomicReference<Set<String>> authorizedScopes;
    private final AtomicReference<Optional<Set<String>>> subscribedScopes = new AtomicReference<>(Optional.empty());
    private final AtomicBoolean draining = new AtomicBoolean();
    private final AtomicBoolean closing = new AtomicBoolean();

    public Connection(RealtimeChannel channel, Credential credential, OutboundQueue queue, Instant connectedAt) {
        this.socketId = channel.id();
        this.subjectId = credential.subjectId();
        this.role = credential.role();
        this.tokenHash = credential.tokenHash();
        this.authorizedScopes = new AtomicReference<>(credential.assignedScopes());
        this.channel = channel;
        this.queue = queue;
        this.connectedAt = connectedAt;
    }

    public String socketId() {
        return socketId;
    }

    public String subjectId() {
        return subjectId;
    }

    public Role role() {
        return role;
    }

    public String tokenHash() {
        return tokenHash;
    }

    public Instant connectedAt() {
        return connectedAt;
    }

    public Set<String> authorizedScopes() {
        return authorizedScopes.get();
    }

    /**
     * Scopes the connection currently receives. Until the client subscribes this is
     * the authorized set.
     */
    public Set<String> subscribedScopes() {
        return subscribedScopes.get().orElseGet(authorizedScopes::get);
    }

    public boolean isClosing() {
        return closing.get() || channel.isClosed();
    }

    /**
     * Whether an event for {@code scope} may be delivered here.
     */
    public boolean canReceive(String scope) {
        if (isClosing()) {
            return false;
        }
        final var subscribed = subscribedScopes.get().map(s -> s.contains(scope)).orElse(true);
        return authorizedScopes.get().contains(scope) && subscribed;
    }

    /**
     * Record the subscription. Only authorized scopes are granted, for every role;
     * the rest are reported back as ignored.
     */
    public OutboundMessage.Subscribed subscribe(Set<String> requested) {
        final var granted = intersect(requested, authorizedScopes.get());
        final var ignored = new HashSet<>(requested);
        ignored.removeAll(granted);
        subscribedScopes.set(Optional.of(granted));
        return new OutboundMessage.Subscribed(granted, Set.copyOf(ignored));
    }

    /**
     * Swap the authorized scope snapshot. An existing subscription is narrowed to
     * the new set; newly added scopes need a fresh subscribe.
     */
    public void replaceScopes(Set<String> scopes) {
        final var snapshot = Set.copyOf(scopes);
        authorizedScopes.set(snapshot);
        subscribedScopes.updateAndGet(current -> current.map(s -> intersect(s, snapshot)));
    }

    /**
     * Queue a frame for delivery.
     *
     * @return false if the connection is closing or the frame overflowed the queue
     */
    public boolean send(OutboundMessage message) {
        if (isClosing()) {
            return false;
        }
        final var result = queue.offer(message);
        switch (result) {
            case OVERFLOW -> {
                LOG.warnf("Outbound queue overflow on socket %s (subject %s), disconnecting", socketId, subjectId);
                close(CLOSE_POLICY_VIOLATION, "send queue overflow");
                return false;
            }
            case DROPPED_OLDEST -> LOG.debugf("Dropped oldest frame on socket %s", socketId);
            case QUEUED -> {
                // delivered by drain
            }
        }
        drain();
        return true;
    }

    /**
     * Send {@code finalMessage} as the last frame and close. Pending frames are discarded.
     *
     * @return false if the connection was already closing
     */
    public boolean terminate(OutboundMessage finalMessage, int code, String reason) {
        if (!closing.compareAndSet(false, true)) {
            return false;
        }
        queue.clear();
        channel.writeAndClose(finalMessage, code, reason);
        return true;
    }

    public void close(int code, String reason) {
        if (closing.compareAndSet(false, true)) {
            queue.clear();
            channel.close(code, reason);
        }
    }

    /** Frames waiting in the outbound queue. */
    public int pendingFrames() {
        return queue.size();
    }

    public long droppedFrames() {
        return queue.droppedCount();
    }

    /**
     * Flush queued frames. Run when the transport signals it accepts writes again.
     */
    void drain() {
        do {
            if (!draining.compareAndSet(false, true)) {
                return;
            }
            try {
                while (!isClosing() && !channel.writeQueueFull()) {
                    final var next = queue.poll();
                    if (next == null) {
                        break;
                    }
                    channel.write(next);
                }
            } finally {
                draining.set(false);
            }
            // a frame offered while we were releasing the flag must not be stranded
        } while (!queue.isEmpty() && !isClosing() && !channel.writeQueueFull());
    }

    private static Set<String> intersect(Set<String> a, Set<String> b) {
        final var result = new HashSet<>(a);
        result.retainAll(b);
        return Set.copyOf(result);
    }
}
