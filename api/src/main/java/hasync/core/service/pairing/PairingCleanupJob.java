package hasync.core.service.pairing;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import hasync.core.port.in.PairingManagement;

/**
 * Periodic sweep that expires stale pairing sessions and deletes old terminal ones.
 */
@ApplicationScoped
public class PairingCleanupJob {

    private static final Logger LOG = Logger.getLogger(PairingCleanupJob.class);

    private final PairingManagement pairing;
    private final Clock clock;

    public PairingCleanupJob(PairingManagement pairing, Clock clock) {
        this.pairing = pairing;
        this.clock = clock;
    }

    @Scheduled(
            every = "${hasync.pairing.cleanup-interval:60s}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> sweep() {
        LOG.debug("Sweeping pairing sessions...");

        return pairing.cleanupExpired(clock.instant())
                .invoke(result -> {
                    if (!result.isEmpty()) {
                        LOG.infof(
                                "Pairing sweep: %d session(s) expired, %d deleted", result.expired(), result.deleted());
                    }
                })
                .replaceWithVoid()
                .onFailure()
                .invoke(e -> LOG.error("Pairing session sweep failed", e));
    }
}
