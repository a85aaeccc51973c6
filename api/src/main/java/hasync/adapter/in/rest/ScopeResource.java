package hasync.adapter.in.rest;

import java.util.List;

import jakarta.annotation.security.RolesAllowed;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import hasync.adapter.in.auth.Roles;
import hasync.adapter.in.dto.RegisterScopeRequest;
import hasync.core.port.out.ScopeRegistry;

/**
 * REST resource for the scope (area) registry.
 */
@Path("/api/scopes")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@RolesAllowed(Roles.ADMIN)
public class ScopeResource {

    private final ScopeRegistry scopes;

    public ScopeResource(ScopeRegistry scopes) {
        this.scopes = scopes;
    }

    @GET
    public Uni<List<String>> listScopes() {
        return scopes.knownScopes().map(known -> known.stream().sorted().toList());
    }

    /**
     * Register a scope. Answers 201 when added and 200 when it already existed.
     */
    @POST
    public Uni<Response> registerScope(@Valid @NotNull RegisterScopeRequest request) {
        return scopes.register(request.scopeId())
                .map(added -> Response.status(added ? Response.Status.CREATED : Response.Status.OK)
                        .entity(request)
                        .build());
    }
}
