package hasync.adapter.out.storage.memory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;

import hasync.core.model.pairing.PairedClient;
import hasync.core.port.out.PairedClientRepository;

/**
 * In-memory implementation of PairedClientRepository.
 */
public class InMemoryPairedClientRepository implements PairedClientRepository {

    private final ConcurrentMap<String, PairedClient> clients = new ConcurrentHashMap<>();

    @Override
    public Uni<Void> save(PairedClient client) {
        return Uni.createFrom().item(() -> {
            clients.put(client.subjectId(), client);
            return null;
        });
    }

    @Override
    public Uni<Optional<PairedClient>> findBySubject(String subjectId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(clients.get(subjectId)));
    }

    @Override
    public Uni<List<PairedClient>> findAll() {
        return Uni.createFrom().item(() -> clients.values().stream()
                .sorted(Comparator.comparing(PairedClient::pairedAt))
                .toList());
    }

    @Override
    public Uni<Boolean> delete(String subjectId) {
        return Uni.createFrom().item(() -> clients.remove(subjectId) != null);
    }
}
