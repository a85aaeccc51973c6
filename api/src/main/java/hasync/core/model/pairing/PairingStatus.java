package hasync.core.model.pairing;

/**
 * Lifecycle state of a pairing session.
 *
 * <pre>
 * PENDING --verify--&gt; VERIFIED --complete--&gt; COMPLETED
 * PENDING|VERIFIED --timeout or cancel--&gt; EXPIRED
 * </pre>
 */
public enum PairingStatus {
    PENDING,
    VERIFIED,
    COMPLETED,
    EXPIRED;

    /** Whether the session can still move forward in the state machine. */
    public boolean isOpen() {
        return this == PENDING || this == VERIFIED;
    }

    public boolean isTerminal() {
        return !isOpen();
    }
}
