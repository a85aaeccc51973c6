package hasync.adapter.out.storage.memory;

import java.time.Clock;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import hasync.adapter.out.ratelimit.memory.InMemoryAttemptRateLimiter;
import hasync.core.config.ScopeConfig;
import hasync.core.port.out.CredentialRepository;
import hasync.core.port.out.PairedClientRepository;
import hasync.core.port.out.PairingSessionRepository;
import hasync.core.port.out.ScopeRegistry;

/**
 * CDI producer for the in-memory persistence adapters.
 *
 * <p>Each port is produced once per application. Replacing a store means replacing
 * the corresponding producer method.
 */
@ApplicationScoped
public class StorageProducer {

    @Produces
    @ApplicationScoped
    public PairingSessionRepository pairingSessionRepository() {
        return new InMemoryPairingSessionRepository();
    }

    @Produces
    @ApplicationScoped
    public CredentialRepository credentialRepository() {
        return new InMemoryCredentialRepository();
    }

    @Produces
    @ApplicationScoped
    public PairedClientRepository pairedClientRepository() {
        return new InMemoryPairedClientRepository();
    }

    @Produces
    @ApplicationScoped
    public ScopeRegistry scopeRegistry(ScopeConfig config) {
        return new InMemoryScopeRegistry(config.known().orElse(Set.of()));
    }

    @Produces
    @Singleton
    public InMemoryAttemptRateLimiter attemptRateLimiter(Clock clock) {
        return new InMemoryAttemptRateLimiter(clock);
    }

    void disposeRateLimiter(@Disposes InMemoryAttemptRateLimiter rateLimiter) {
        rateLimiter.shutdown();
    }
}
