package hasync.adapter.out.storage.memory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;

import hasync.core.model.auth.Credential;
import hasync.core.port.out.CredentialRepository;

/**
 * In-memory implementation of CredentialRepository, keyed by token hash.
 *
 * <p><strong>Warning:</strong> credentials are lost on restart, which revokes every
 * paired client. Do not use in production.
 */
public class InMemoryCredentialRepository implements CredentialRepository {

    private final ConcurrentMap<String, Credential> credentials = new ConcurrentHashMap<>();

    @Override
    public Uni<Void> save(Credential credential) {
        return Uni.createFrom().item(() -> {
            if (credentials.putIfAbsent(credential.tokenHash(), credential) != null) {
                throw new IllegalStateException("Duplicate token hash");
            }
            return null;
        });
    }

    @Override
    public Uni<Optional<Credential>> findByHash(String tokenHash) {
        return Uni.createFrom().item(() -> Optional.ofNullable(credentials.get(tokenHash)));
    }

    @Override
    public Uni<List<Credential>> findBySubject(String subjectId) {
        return Uni.createFrom().item(() -> credentials.values().stream()
                .filter(c -> c.subjectId().equals(subjectId))
                .toList());
    }

    @Override
    public Uni<Boolean> compareAndSet(Credential expected, Credential updated) {
        return Uni.createFrom().item(() -> credentials.replace(expected.tokenHash(), expected, updated));
    }

    @Override
    public Uni<Void> touch(String tokenHash, Instant lastUsedAt) {
        return Uni.createFrom().item(() -> {
            credentials.computeIfPresent(tokenHash, (hash, current) -> current.touch(lastUsedAt));
            return null;
        });
    }

    @Override
    public Uni<Integer> deleteInactiveBefore(Instant cutoff) {
        return Uni.createFrom().item(() -> {
            final var before = credentials.size();
            credentials
                    .values()
                    .removeIf(c -> c.expiresAt().isBefore(cutoff)
                            || (c.revokedAt() != null && c.revokedAt().isBefore(cutoff)));
            return before - credentials.size();
        });
    }
}
