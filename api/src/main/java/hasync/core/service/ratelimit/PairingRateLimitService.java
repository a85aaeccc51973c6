package hasync.core.service.ratelimit;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import hasync.core.config.AdminAuthConfig;
import hasync.core.config.PairingConfig;
import hasync.core.model.ratelimit.RateLimitDecision;
import hasync.core.model.ratelimit.RateLimitExceededException;
import hasync.core.port.out.AttemptRateLimiter;
import hasync.core.util.SecureHash;

/**
 * Per-client-address allowances for the unauthenticated endpoints.
 *
 * <p>Addresses are hashed before they become limiter keys.
 */
@ApplicationScoped
public class PairingRateLimitService {

    private static final Logger LOG = Logger.getLogger(PairingRateLimitService.class);

    static final String VERIFY_PREFIX = "pairing-verify:";
    static final String LOGIN_PREFIX = "admin-login:";
    private static final int KEY_HASH_CHARS = 16;

    private final AttemptRateLimiter limiter;
    private final PairingConfig pairingConfig;
    private final AdminAuthConfig adminConfig;

    public PairingRateLimitService(
            AttemptRateLimiter limiter, PairingConfig pairingConfig, AdminAuthConfig adminConfig) {
        this.limiter = limiter;
        this.pairingConfig = pairingConfig;
        this.adminConfig = adminConfig;
    }

    /**
     * Count a PIN verification from {@code clientAddress}.
     */
    public Uni<RateLimitDecision> checkVerify(String clientAddress) {
        final var limit = pairingConfig.verifyRateLimit();
        return check("pairing verify", VERIFY_PREFIX, clientAddress, limit.maxRequests(), limit.window());
    }

    /**
     * Count an administrator login from {@code clientAddress}.
     */
    public Uni<RateLimitDecision> checkLogin(String clientAddress) {
        final var limit = adminConfig.loginRateLimit();
        return check("admin login", LOGIN_PREFIX, clientAddress, limit.maxRequests(), limit.window());
    }

    private Uni<RateLimitDecision> check(
            String operation, String prefix, String clientAddress, int maxRequests, Duration window) {
        final var address = clientAddress == null ? "unknown" : clientAddress;
        final var key = prefix + SecureHash.truncatedSha256(address, KEY_HASH_CHARS);
        return limiter.tryAcquire(key, maxRequests, window).map(decision -> {
            if (!decision.allowed()) {
                LOG.warnf(
                        "Rate limit hit for %s, key=%s, retryAfter=%ds",
                        operation,
                        key,
                        decision.retryAfterSeconds());
                throw new RateLimitExceededException(operation, decision);
            }
            return decision;
        });
    }
}
