package hasync.core.port.in;

import java.util.List;
import java.util.Set;

import io.smallrye.mutiny.Uni;

import hasync.core.model.auth.IssuedToken;
import hasync.core.model.pairing.ClientView;

/**
 * Port for administering paired clients.
 */
public interface ClientManagement {

    Uni<List<ClientView>> listClients();

    Uni<ClientView> getClient(String subjectId);

    /**
     * Validate the scopes and re-issue the client's credential with them.
     */
    Uni<IssuedToken> updateScopes(String subjectId, Set<String> assignedScopes);

    /**
     * Revoke every credential of the client, closing its connections, and forget it.
     */
    Uni<Void> deleteClient(String subjectId);
}
