package hasync.core.model.common;

/**
 * Raised by repository implementations when the backing store fails
 * (connection loss, timeout, conflict). Never raised for absent rows.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
