package hasync.adapter.in.rest;

import jakarta.annotation.security.RolesAllowed;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.quarkus.security.identity.SecurityIdentity;
import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;

import hasync.adapter.in.auth.CredentialIdentityProvider;
import hasync.adapter.in.auth.Roles;
import hasync.adapter.in.dto.LoginRequest;
import hasync.adapter.in.dto.TokenResponse;
import hasync.adapter.in.http.ClientIpResolver;
import hasync.adapter.in.problem.ApiProblem;
import hasync.core.service.auth.AdminAuthService;

/**
 * REST resource for administrator login and credential logout.
 */
@Path("/api/auth")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AuthResource {

    private final AdminAuthService adminAuth;
    private final ClientIpResolver clientIpResolver;
    private final SecurityIdentity identity;

    public AuthResource(AdminAuthService adminAuth, ClientIpResolver clientIpResolver, SecurityIdentity identity) {
        this.adminAuth = adminAuth;
        this.clientIpResolver = clientIpResolver;
        this.identity = identity;
    }

    /**
     * Exchange the administrator username and password for an admin credential.
     */
    @POST
    @Path("/login")
    public Uni<TokenResponse> login(LoginRequest request, @Context HttpServerRequest httpRequest) {
        if (request == null || request.username() == null || request.password() == null) {
            throw ApiProblem.validationError("username and password are required");
        }
        return adminAuth
                .login(request.username(), request.password(), clientIpResolver.resolve(httpRequest))
                .map(TokenResponse::from);
    }

    /**
     * Revoke the credential this request was authenticated with.
     */
    @POST
    @Path("/logout")
    @RolesAllowed({Roles.ADMIN, Roles.CLIENT})
    public Uni<Response> logout() {
        final String rawToken = identity.getAttribute(CredentialIdentityProvider.RAW_TOKEN_ATTRIBUTE);
        return adminAuth.logout(rawToken).map(revoked -> Response.noContent().build());
    }
}
