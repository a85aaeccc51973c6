package hasync.adapter.in.problem;

import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import hasync.core.model.auth.TokenException;
import hasync.core.model.common.ServiceException;
import hasync.core.model.pairing.PairingException;
import hasync.core.model.ratelimit.RateLimitExceededException;

/**
 * Global exception mappers for converting exceptions to RFC 7807 Problem Details.
 *
 * <p>Exception messages are logged, never rendered.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";
    static final String INVALID_REQUEST_DETAIL = "The request is invalid";

    @ServerExceptionMapper
    public Response mapRateLimitExceeded(RateLimitExceededException e) {
        final var decision = e.decision();
        return Response.fromResponse(toResponse(ApiProblem.tooManyRequests(
                        decision.retryAfterSeconds(),
                        decision.limit(),
                        decision.resetAt().getEpochSecond())))
                .header(HttpHeaders.RETRY_AFTER, decision.retryAfterSeconds())
                .build();
    }

    @ServerExceptionMapper
    public Response mapPairingException(PairingException e) {
        LOG.debugf("Pairing failure %s: %s", e.code(), e.getMessage());
        final var builder = ApiProblem.of(e.code()).withDetail(ApiProblem.detail(e.code()));
        e.attemptsRemaining().ifPresent(remaining -> builder.with(ApiProblem.ATTEMPTS_REMAINING, remaining));
        return toResponse(builder.build());
    }

    @ServerExceptionMapper
    public Response mapTokenException(TokenException e) {
        LOG.debugf("Token rejected %s: %s", e.code(), e.getMessage());
        return Response.fromResponse(toResponse(ApiProblem.of(e.code(), ApiProblem.detail(e.code()))))
                .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer realm=\"hasync\"")
                .build();
    }

    @ServerExceptionMapper
    public Response mapServiceException(ServiceException e) {
        final var builder = ApiProblem.of(e.code()).withDetail(ApiProblem.detail(e.code()));
        e.correlationId().ifPresent(id -> builder.with(ApiProblem.CORRELATION_ID, id));
        if (e.code().httpStatus() >= 500) {
            LOG.warnf("Service failure %s [%s]: %s", e.code(), e.correlationId().orElse("-"), e.getMessage());
        } else {
            LOG.debugf("Service failure %s: %s", e.code(), e.getMessage());
        }
        return toResponse(builder.build());
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(ApiProblem.validationError(INVALID_REQUEST_DETAIL));
    }

    @ServerExceptionMapper
    public Response mapIllegalStateException(IllegalStateException e) {
        final var correlationId = UUID.randomUUID().toString().substring(0, 8);
        LOG.errorf(e, "Unexpected state [%s]", correlationId);
        return toResponse(ApiProblem.internalError(correlationId));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
