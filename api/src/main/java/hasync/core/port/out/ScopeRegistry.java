package hasync.core.port.out;

import java.util.Collection;
import java.util.Set;

import io.smallrye.mutiny.Uni;

/**
 * Port for the set of known scope ids.
 */
public interface ScopeRegistry {

    Uni<Set<String>> knownScopes();

    /**
     * Return the subset of {@code scopes} that is not registered.
     */
    Uni<Set<String>> unknown(Collection<String> scopes);

    /**
     * Register a scope id.
     *
     * @return true if newly added, false if it already existed
     */
    Uni<Boolean> register(String scopeId);
}
