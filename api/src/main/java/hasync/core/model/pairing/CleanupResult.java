package hasync.core.model.pairing;

/**
 * Outcome of one pairing session sweep.
 *
 * @param expired open sessions moved to EXPIRED because their PIN timed out
 * @param deleted terminal sessions removed after the retention period
 */
public record CleanupResult(int expired, int deleted) {

    public static CleanupResult empty() {
        return new CleanupResult(0, 0);
    }

    public boolean isEmpty() {
        return expired == 0 && deleted == 0;
    }
}
