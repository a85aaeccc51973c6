package hasync.core.model.realtime;

/**
 * What to do when a connection's outbound queue is full.
 */
public enum OverflowPolicy {
    /** Discard the oldest queued frame to make room. */
    DROP_OLDEST,
    /** Close the connection with a policy violation. */
    DISCONNECT
}
