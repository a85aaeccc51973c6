package hasync.core.port.out;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import hasync.core.model.pairing.PairedClient;

/**
 * Port for paired client records.
 */
public interface PairedClientRepository {

    Uni<Void> save(PairedClient client);

    Uni<Optional<PairedClient>> findBySubject(String subjectId);

    Uni<List<PairedClient>> findAll();

    /**
     * @return true if a record was removed
     */
    Uni<Boolean> delete(String subjectId);
}
