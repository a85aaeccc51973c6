package hasync.core.model.common;

import java.util.Optional;

/**
 * Base for failures that map to a user-safe {@link ErrorCode}.
 *
 * <p>The message is for logs only. Adapters render the code and the optional
 * correlation id, never the message.
 */
public class ServiceException extends RuntimeException {

    private final ErrorCode code;
    private final String correlationId;

    public ServiceException(ErrorCode code, String message) {
        this(code, message, null, null);
    }

    public ServiceException(ErrorCode code, String message, String correlationId, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.correlationId = correlationId;
    }

    public ErrorCode code() {
        return code;
    }

    public Optional<String> correlationId() {
        return Optional.ofNullable(correlationId);
    }
}
