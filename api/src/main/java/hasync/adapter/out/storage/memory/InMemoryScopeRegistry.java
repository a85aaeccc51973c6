package hasync.adapter.out.storage.memory;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import hasync.core.port.out.ScopeRegistry;

/**
 * In-memory scope registry, seeded from configuration and extendable at runtime.
 */
public class InMemoryScopeRegistry implements ScopeRegistry {

    private static final Logger LOG = Logger.getLogger(InMemoryScopeRegistry.class);

    private final Set<String> scopes = ConcurrentHashMap.newKeySet();

    public InMemoryScopeRegistry(Collection<String> initialScopes) {
        initialScopes.stream().map(String::trim).filter(s -> !s.isEmpty()).forEach(scopes::add);
        LOG.infof("Initialized scope registry with %d scope(s)", scopes.size());
    }

    @Override
    public Uni<Set<String>> knownScopes() {
        return Uni.createFrom().item(() -> Set.copyOf(scopes));
    }

    @Override
    public Uni<Set<String>> unknown(Collection<String> requested) {
        return Uni.createFrom().item(() -> {
            final var missing = new HashSet<String>();
            for (String scope : requested) {
                if (!scopes.contains(scope)) {
                    missing.add(scope);
                }
            }
            return Set.copyOf(missing);
        });
    }

    @Override
    public Uni<Boolean> register(String scopeId) {
        if (scopeId == null || scopeId.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("Scope ID cannot be blank"));
        }
        return Uni.createFrom().item(() -> scopes.add(scopeId.trim()));
    }
}
