package hasync.core.port.out;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import hasync.core.model.auth.Credential;

/**
 * Port for credential persistence, keyed by token hash.
 */
public interface CredentialRepository {

    Uni<Void> save(Credential credential);

    Uni<Optional<Credential>> findByHash(String tokenHash);

    Uni<List<Credential>> findBySubject(String subjectId);

    /**
     * Replace {@code expected} with {@code updated} if the stored row still equals {@code expected}.
     */
    Uni<Boolean> compareAndSet(Credential expected, Credential updated);

    /**
     * Set {@code lastUsedAt} without touching any other field.
     */
    Uni<Void> touch(String tokenHash, Instant lastUsedAt);

    /**
     * Delete credentials that expired or were revoked before {@code cutoff}.
     *
     * @return number of rows deleted
     */
    Uni<Integer> deleteInactiveBefore(Instant cutoff);
}
