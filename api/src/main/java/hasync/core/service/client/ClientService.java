package hasync.core.service.client;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import hasync.core.model.auth.Credential;
import hasync.core.model.auth.IssuedToken;
import hasync.core.model.auth.Role;
import hasync.core.model.common.ErrorCode;
import hasync.core.model.common.ServiceException;
import hasync.core.model.pairing.ClientView;
import hasync.core.model.pairing.PairedClient;
import hasync.core.port.in.ClientManagement;
import hasync.core.port.in.TokenManagement;
import hasync.core.port.out.PairedClientRepository;
import hasync.core.port.out.ScopeRegistry;
import hasync.core.service.common.StorageCalls;

/**
 * Read, scope administration and removal of paired clients.
 */
@ApplicationScoped
public class ClientService implements ClientManagement {

    private static final Logger LOG = Logger.getLogger(ClientService.class);

    private final PairedClientRepository clients;
    private final ScopeRegistry scopeRegistry;
    private final TokenManagement tokens;
    private final Clock clock;

    public ClientService(
            PairedClientRepository clients, ScopeRegistry scopeRegistry, TokenManagement tokens, Clock clock) {
        this.clients = clients;
        this.scopeRegistry = scopeRegistry;
        this.tokens = tokens;
        this.clock = clock;
    }

    @Override
    public Uni<List<ClientView>> listClients() {
        return StorageCalls.read("client scan", clients::findAll)
                .flatMap(all -> Multi.createFrom()
                        .iterable(all)
                        .onItem()
                        .transformToUniAndConcatenate(this::view)
                        .collect()
                        .asList());
    }

    @Override
    public Uni<ClientView> getClient(String subjectId) {
        return requireClient(subjectId).flatMap(this::view);
    }

    @Override
    public Uni<IssuedToken> updateScopes(String subjectId, Set<String> assignedScopes) {
        final var scopes = assignedScopes == null ? Set.<String>of() : Set.copyOf(assignedScopes);
        return requireClient(subjectId)
                .call(client -> scopeRegistry.unknown(scopes).invoke(unknown -> {
                    if (!unknown.isEmpty()) {
                        throw new ServiceException(ErrorCode.SCOPE_NOT_FOUND, "Unknown scopes: " + unknown);
                    }
                }))
                .flatMap(client -> tokens.reissueWithScopes(subjectId, scopes))
                .invoke(issued -> LOG.infof("Client %s now holds scopes %s", subjectId, scopes));
    }

    @Override
    public Uni<Void> deleteClient(String subjectId) {
        return requireClient(subjectId)
                .flatMap(client -> tokens.revoke(subjectId, "client_deleted"))
                .flatMap(revoked -> StorageCalls.write("client delete", () -> clients.delete(subjectId)))
                .invoke(removed -> LOG.infof("Client %s deleted", subjectId))
                .replaceWithVoid();
    }

    private Uni<PairedClient> requireClient(String subjectId) {
        return StorageCalls.read("client lookup", () -> clients.findBySubject(subjectId))
                .map(found -> found.orElseThrow(
                        () -> new ServiceException(ErrorCode.SUBJECT_NOT_FOUND, "Unknown client " + subjectId)));
    }

    private Uni<ClientView> view(PairedClient client) {
        return tokens.listCredentials(client.subjectId()).map(credentials -> toView(client, credentials));
    }

    private ClientView toView(PairedClient client, List<Credential> credentials) {
        final var now = clock.instant();
        final var current = credentials.stream()
                .filter(c -> c.role() == Role.CLIENT && c.isActiveAt(now))
                .max(Comparator.comparing(Credential::issuedAt));
        final Instant lastSeen = credentials.stream()
                .map(Credential::lastUsedAt)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);
        return new ClientView(
                client, current.map(Credential::assignedScopes).orElse(Set.of()), current.isPresent(), lastSeen);
    }
}
