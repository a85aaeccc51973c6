package hasync.core.service.auth;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import hasync.core.port.in.TokenManagement;

/**
 * Deletes credentials that expired or were revoked longer ago than the retention period.
 */
@ApplicationScoped
public class CredentialRetentionJob {

    private static final Logger LOG = Logger.getLogger(CredentialRetentionJob.class);

    private final TokenManagement tokens;
    private final Clock clock;

    public CredentialRetentionJob(TokenManagement tokens, Clock clock) {
        this.tokens = tokens;
        this.clock = clock;
    }

    @Scheduled(
            every = "${hasync.auth.token.purge-interval:1h}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> purge() {
        return tokens.purgeExpired(clock.instant())
                .replaceWithVoid()
                .onFailure()
                .invoke(e -> LOG.error("Credential purge failed", e));
    }
}
