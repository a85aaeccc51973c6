package hasync.adapter.out.storage.memory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

import io.smallrye.mutiny.Uni;

import hasync.core.model.pairing.PairingSession;
import hasync.core.port.out.PairingSessionRepository;

/**
 * In-memory implementation of PairingSessionRepository.
 *
 * <p>Compare-and-set is applied inside {@link ConcurrentMap#computeIfPresent}, so a
 * version check and the replacement are atomic per session.
 *
 * <p><strong>Warning:</strong> sessions are lost on restart and not shared across instances.
 */
public class InMemoryPairingSessionRepository implements PairingSessionRepository {

    private final ConcurrentMap<String, PairingSession> sessions = new ConcurrentHashMap<>();

    @Override
    public Uni<Boolean> saveIfAbsent(PairingSession session) {
        return Uni.createFrom().item(() -> sessions.putIfAbsent(session.id(), session) == null);
    }

    @Override
    public Uni<Optional<PairingSession>> findById(String id) {
        return Uni.createFrom().item(() -> Optional.ofNullable(sessions.get(id)));
    }

    @Override
    public Uni<List<PairingSession>> findAll() {
        return Uni.createFrom().item(() -> List.copyOf(sessions.values()));
    }

    @Override
    public Uni<Boolean> compareAndSet(long expectedVersion, PairingSession updated) {
        return Uni.createFrom().item(() -> {
            final var applied = new AtomicBoolean();
            sessions.computeIfPresent(updated.id(), (id, current) -> {
                if (current.version() != expectedVersion) {
                    return current;
                }
                applied.set(true);
                return updated;
            });
            return applied.get();
        });
    }

    @Override
    public Uni<Boolean> deleteIfVersion(String id, long expectedVersion) {
        return Uni.createFrom().item(() -> {
            final var deleted = new AtomicBoolean();
            sessions.computeIfPresent(id, (key, current) -> {
                if (current.version() != expectedVersion) {
                    return current;
                }
                deleted.set(true);
                return null;
            });
            return deleted.get();
        });
    }

    /**
     * Get the number of stored sessions (for testing).
     */
    public int size() {
        return sessions.size();
    }
}
