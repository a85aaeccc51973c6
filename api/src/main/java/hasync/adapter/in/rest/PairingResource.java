package hasync.adapter.in.rest;

import java.time.Clock;
import java.util.Optional;
import java.util.Set;

import jakarta.annotation.security.RolesAllowed;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import io.quarkus.security.identity.SecurityIdentity;
import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;

import hasync.adapter.in.auth.Roles;
import hasync.adapter.in.dto.CompletePairingRequest;
import hasync.adapter.in.dto.PairingSessionCreatedResponse;
import hasync.adapter.in.dto.PairingSessionDto;
import hasync.adapter.in.dto.TokenResponse;
import hasync.adapter.in.dto.VerifyPinRequest;
import hasync.adapter.in.dto.VerifyPinResponse;
import hasync.adapter.in.http.ClientIpResolver;
import hasync.adapter.in.problem.ApiProblem;
import hasync.core.model.common.ErrorCode;
import hasync.core.model.pairing.DeviceType;
import hasync.core.model.pairing.PairingException;
import hasync.core.port.in.PairingManagement;
import hasync.core.service.ratelimit.PairingRateLimitService;

/**
 * REST resource for PIN pairing.
 *
 * <p>Session administration requires the {@code admin} role. {@code POST /verify} is
 * public and rate limited per client address; its PIN failures are deliberately
 * indistinguishable from one another.
 */
@Path("/api/pairing")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class PairingResource {

    private final PairingManagement pairing;
    private final PairingRateLimitService rateLimits;
    private final ClientIpResolver clientIpResolver;
    private final SecurityIdentity identity;
    private final Clock clock;

    public PairingResource(
            PairingManagement pairing,
            PairingRateLimitService rateLimits,
            ClientIpResolver clientIpResolver,
            SecurityIdentity identity,
            Clock clock) {
        this.pairing = pairing;
        this.rateLimits = rateLimits;
        this.clientIpResolver = clientIpResolver;
        this.identity = identity;
        this.clock = clock;
    }

    /**
     * Create a pairing session. The PIN is only returned in this response.
     */
    @POST
    @Path("/sessions")
    @RolesAllowed(Roles.ADMIN)
    public Uni<Response> createSession() {
        return pairing.createSession(identity.getPrincipal().getName())
                .map(created -> Response.status(Response.Status.CREATED)
                        .entity(PairingSessionCreatedResponse.from(created, clock.instant()))
                        .build());
    }

    @GET
    @Path("/sessions/{sessionId}")
    @RolesAllowed(Roles.ADMIN)
    public Uni<PairingSessionDto> getSession(@PathParam("sessionId") String sessionId) {
        return pairing.getSession(sessionId).map(PairingSessionDto::from);
    }

    @DELETE
    @Path("/sessions/{sessionId}")
    @RolesAllowed(Roles.ADMIN)
    public Uni<Response> cancelSession(@PathParam("sessionId") String sessionId) {
        return pairing.cancelSession(sessionId, identity.getPrincipal().getName())
                .map(ignored -> Response.noContent().build());
    }

    /**
     * Verify a PIN entered on the device being paired.
     */
    @POST
    @Path("/verify")
    public Uni<VerifyPinResponse> verify(
            @Valid @NotNull VerifyPinRequest request, @Context HttpServerRequest httpRequest) {
        return rateLimits
                .checkVerify(clientIpResolver.resolve(httpRequest))
                .flatMap(decision -> pairing.verifySession(
                        request.pin().trim(),
                        request.deviceName(),
                        DeviceType.fromValue(request.deviceType()),
                        Optional.ofNullable(request.sessionId()).filter(id -> !id.isBlank())))
                .map(VerifyPinResponse::new)
                .onFailure(PairingException.class)
                .transform(e -> maskPinFailure((PairingException) e));
    }

    /**
     * Complete a verified session and return the client's credential.
     */
    @POST
    @Path("/sessions/{sessionId}/complete")
    @RolesAllowed(Roles.ADMIN)
    public Uni<Response> completeSession(
            @PathParam("sessionId") String sessionId, @Valid CompletePairingRequest request) {
        final var clientName = request != null ? request.clientName() : null;
        final Set<String> scopes = request != null && request.assignedScopes() != null
                ? request.assignedScopes()
                : Set.of();
        return pairing.completeSession(sessionId, clientName, scopes, identity.getPrincipal().getName())
                .map(completion -> Response.status(Response.Status.CREATED)
                        .entity(TokenResponse.from(completion.issuedToken()))
                        .build());
    }

    /**
     * Wrong, expired and used PINs all look the same to an unauthenticated caller.
     */
    static Throwable maskPinFailure(PairingException e) {
        return switch (e.code()) {
            case INVALID_PIN, SESSION_EXPIRED, SESSION_ALREADY_USED -> {
                final var builder = ApiProblem.of(ErrorCode.INVALID_PIN).withDetail(ApiProblem.INVALID_OR_EXPIRED_PIN);
                e.attemptsRemaining().ifPresent(remaining -> builder.with(ApiProblem.ATTEMPTS_REMAINING, remaining));
                final HttpProblem problem = builder.build();
                yield problem;
            }
            default -> e;
        };
    }
}
