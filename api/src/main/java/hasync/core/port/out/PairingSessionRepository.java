package hasync.core.port.out;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import hasync.core.model.pairing.PairingSession;

/**
 * Port for pairing session persistence.
 *
 * <p>Writes after creation are compare-and-set on {@link PairingSession#version()},
 * equivalent to {@code UPDATE ... WHERE id = ? AND version = ?}.
 */
public interface PairingSessionRepository {

    /**
     * Store a new session unless the id is taken.
     *
     * @return true if stored, false on id collision
     */
    Uni<Boolean> saveIfAbsent(PairingSession session);

    Uni<Optional<PairingSession>> findById(String id);

    /** All stored sessions, in no particular order. */
    Uni<List<PairingSession>> findAll();

    /**
     * Replace the stored session if its version still equals {@code expectedVersion}.
     *
     * @return true if applied, false if the row changed or no longer exists
     */
    Uni<Boolean> compareAndSet(long expectedVersion, PairingSession updated);

    /**
     * Delete the session if its version still equals {@code expectedVersion}.
     */
    Uni<Boolean> deleteIfVersion(String id, long expectedVersion);
}
