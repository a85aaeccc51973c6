package hasync.adapter.in.rest;

import java.util.List;

import jakarta.annotation.security.RolesAllowed;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import hasync.adapter.in.auth.Roles;
import hasync.adapter.in.dto.ClientDto;
import hasync.adapter.in.dto.CredentialDto;
import hasync.adapter.in.dto.TokenResponse;
import hasync.adapter.in.dto.UpdateScopesRequest;
import hasync.core.port.in.ClientManagement;
import hasync.core.port.in.TokenManagement;

/**
 * REST resource for paired client administration.
 *
 * <p>All endpoints require the {@code admin} role.
 */
@Path("/api/clients")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@RolesAllowed(Roles.ADMIN)
public class ClientResource {

    private final ClientManagement clients;
    private final TokenManagement tokens;

    public ClientResource(ClientManagement clients, TokenManagement tokens) {
        this.clients = clients;
        this.tokens = tokens;
    }

    @GET
    public Uni<List<ClientDto>> listClients() {
        return clients.listClients()
                .map(views -> views.stream().map(ClientDto::from).toList());
    }

    @GET
    @Path("/{subjectId}")
    public Uni<ClientDto> getClient(@PathParam("subjectId") String subjectId) {
        return clients.getClient(subjectId).map(ClientDto::from);
    }

    /**
     * Revoke the client's credentials, close its connections and remove it.
     */
    @DELETE
    @Path("/{subjectId}")
    public Uni<Response> deleteClient(@PathParam("subjectId") String subjectId) {
        return clients.deleteClient(subjectId).map(v -> Response.noContent().build());
    }

    /**
     * Credential history of a client, newest first.
     */
    @GET
    @Path("/{subjectId}/credentials")
    public Uni<List<CredentialDto>> listCredentials(@PathParam("subjectId") String subjectId) {
        return clients.getClient(subjectId)
                .flatMap(view -> tokens.listCredentials(subjectId))
                .map(credentials -> credentials.stream().map(CredentialDto::from).toList());
    }

    /**
     * Replace the client's scopes. A new credential is issued and returned; the
     * previous one is revoked while live connections stay open with the new scopes.
     */
    @PUT
    @Path("/{subjectId}/scopes")
    public Uni<TokenResponse> updateScopes(
            @PathParam("subjectId") String subjectId, @Valid @NotNull UpdateScopesRequest request) {
        return clients.updateScopes(subjectId, request.assignedScopes()).map(TokenResponse::from);
    }
}
