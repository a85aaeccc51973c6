package hasync.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

import hasync.core.model.common.ErrorCode;

/**
 * RFC 7807 Problem Details factory for API errors.
 *
 * <p>Every problem carries the machine-readable {@code code} extension. Details are
 * fixed strings chosen here, never exception messages.
 */
public final class ApiProblem {

    static final String CODE = "code";
    public static final String ATTEMPTS_REMAINING = "attemptsRemaining";
    static final String CORRELATION_ID = "correlationId";
    static final String RETRY_AFTER = "retryAfter";

    /** Shown for every PIN failure on the public verify endpoint. */
    public static final String INVALID_OR_EXPIRED_PIN = "Invalid or expired PIN";

    private ApiProblem() {}

    /**
     * Start a problem for {@code code} with its title and status.
     */
    public static HttpProblem.Builder of(ErrorCode code) {
        return HttpProblem.builder()
                .withTitle(code.title())
                .withStatus(Status.fromStatusCode(code.httpStatus()))
                .with(CODE, code.name());
    }

    public static HttpProblem of(ErrorCode code, String detail) {
        return of(code).withDetail(detail).build();
    }

    public static HttpProblem validationError(String detail) {
        return HttpProblem.builder()
                .withTitle("Validation Error")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem tooManyRequests(long retryAfterSeconds, long limit, long resetAtEpochSeconds) {
        return of(ErrorCode.RATE_LIMITED)
                .withDetail("Too many attempts, retry later")
                .with(RETRY_AFTER, retryAfterSeconds)
                .with("limit", limit)
                .with("resetAt", resetAtEpochSeconds)
                .build();
    }

    public static HttpProblem internalError(String correlationId) {
        return HttpProblem.builder()
                .withTitle("Internal Server Error")
                .withStatus(Status.INTERNAL_SERVER_ERROR)
                .withDetail("Unexpected error")
                .with(CORRELATION_ID, correlationId)
                .build();
    }

    /**
     * Caller-facing detail for each code.
     */
    static String detail(ErrorCode code) {
        return switch (code) {
            case INVALID_PIN -> "The PIN did not match";
            case SESSION_EXPIRED -> "The pairing session has expired";
            case SESSION_ALREADY_USED -> "The pairing session was already used";
            case MAX_ATTEMPTS_EXCEEDED -> "Too many wrong PIN attempts";
            case SESSION_NOT_VERIFIED -> "The pairing session has not been verified yet";
            case SESSION_NOT_FOUND -> "No such pairing session";
            case SUBJECT_NOT_FOUND -> "No such client";
            case TOKEN_INVALID, TOKEN_EXPIRED, TOKEN_REVOKED, UNAUTHORIZED -> "Authentication required";
            case FORBIDDEN -> "Not allowed";
            case SCOPE_NOT_FOUND -> "One or more scopes are not registered";
            case RATE_LIMITED -> "Too many attempts, retry later";
            case TRANSIENT_FAILURE -> "Temporarily unavailable, retry later";
        };
    }
}
