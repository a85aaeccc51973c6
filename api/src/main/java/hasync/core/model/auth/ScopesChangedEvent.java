package hasync.core.model.auth;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * Fired when a client's credential is re-issued with a different scope set.
 */
public record ScopesChangedEvent(
        String subjectId, Set<String> previousScopes, Set<String> newScopes, Instant changedAt) {

    public ScopesChangedEvent {
        previousScopes = Set.copyOf(previousScopes);
        newScopes = Set.copyOf(newScopes);
    }

    public Set<String> added() {
        final var added = new HashSet<>(newScopes);
        added.removeAll(previousScopes);
        return Set.copyOf(added);
    }

    public Set<String> removed() {
        final var removed = new HashSet<>(previousScopes);
        removed.removeAll(newScopes);
        return Set.copyOf(removed);
    }
}
