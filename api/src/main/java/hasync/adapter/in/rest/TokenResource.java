package hasync.adapter.in.rest;

import jakarta.annotation.security.RolesAllowed;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;

import hasync.adapter.in.auth.Roles;
import hasync.adapter.in.dto.RevokeRequest;
import hasync.adapter.in.dto.RevokeResponse;
import hasync.core.port.in.TokenManagement;

/**
 * REST resource for credential revocation.
 */
@Path("/api/tokens")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class TokenResource {

    static final String DEFAULT_REASON = "revoked_by_admin";

    private final TokenManagement tokens;

    public TokenResource(TokenManagement tokens) {
        this.tokens = tokens;
    }

    /**
     * Revoke every credential of a subject. Its live connections are closed before
     * this returns.
     */
    @POST
    @Path("/revoke")
    @RolesAllowed(Roles.ADMIN)
    public Uni<RevokeResponse> revoke(@Valid @NotNull RevokeRequest request) {
        final var reason = request.reason() == null || request.reason().isBlank() ? DEFAULT_REASON : request.reason();
        return tokens.revoke(request.subjectId(), reason).map(RevokeResponse::new);
    }
}
