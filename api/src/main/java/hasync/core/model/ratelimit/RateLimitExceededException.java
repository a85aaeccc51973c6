package hasync.core.model.ratelimit;

import hasync.core.model.common.ErrorCode;
import hasync.core.model.common.ServiceException;

/**
 * Raised when a caller exceeded the attempt limit for an endpoint.
 */
public class RateLimitExceededException extends ServiceException {

    private final RateLimitDecision decision;

    public RateLimitExceededException(String operation, RateLimitDecision decision) {
        super(ErrorCode.RATE_LIMITED, "Rate limit exceeded for " + operation);
        this.decision = decision;
    }

    public RateLimitDecision decision() {
        return decision;
    }
}
