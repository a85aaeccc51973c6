package hasync.core.model.common;

/**
 * User-safe error codes surfaced to API callers.
 *
 * <p>Each code carries the HTTP status it renders with. The message shown to
 * callers is chosen by the adapter, never taken from exception text.
 */
public enum ErrorCode {
    INVALID_PIN(400, "Invalid PIN"),
    SESSION_EXPIRED(410, "Pairing session expired"),
    SESSION_ALREADY_USED(409, "Pairing session already used"),
    MAX_ATTEMPTS_EXCEEDED(429, "Maximum attempts exceeded"),
    SESSION_NOT_VERIFIED(409, "Pairing session not verified"),
    SESSION_NOT_FOUND(404, "Pairing session not found"),
    SUBJECT_NOT_FOUND(404, "Client not found"),
    TOKEN_INVALID(401, "Invalid token"),
    TOKEN_EXPIRED(401, "Token expired"),
    TOKEN_REVOKED(401, "Token revoked"),
    UNAUTHORIZED(401, "Unauthorized"),
    FORBIDDEN(403, "Forbidden"),
    SCOPE_NOT_FOUND(400, "Unknown scope"),
    RATE_LIMITED(429, "Too many requests"),
    TRANSIENT_FAILURE(503, "Temporarily unavailable");

    private final int httpStatus;
    private final String title;

    ErrorCode(int httpStatus, String title) {
        this.httpStatus = httpStatus;
        this.title = title;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public String title() {
        return title;
    }
}
