package hasync.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for credential issuance.
 *
 * <p>Configuration prefix: {@code hasync.auth.token}
 *
 * <p>The signing secret also keys the PIN hash. The service refuses to start
 * without one of at least {@link #MIN_SECRET_LENGTH} characters.
 */
@ConfigMapping(prefix = "hasync.auth.token")
public interface TokenConfig {

    int MIN_SECRET_LENGTH = 32;

    /**
     * HMAC secret for token signatures and PIN hashes.
     *
     * @return the secret, empty if not configured
     */
    Optional<String> signingSecret();

    /** @return the {@code iss} claim (default: hasync-backend) */
    @WithDefault("hasync-backend")
    String issuer();

    /** @return the {@code aud} claim (default: hasync-client) */
    @WithDefault("hasync-client")
    String audience();

    /**
     * Lifetime of client credentials issued at pairing.
     *
     * @return client TTL (default: 3650 days)
     */
    @WithDefault("P3650D")
    Duration clientTtl();

    /**
     * Lifetime of administrator login credentials.
     *
     * @return admin TTL (default: 8 hours)
     */
    @WithDefault("PT8H")
    Duration adminTtl();

    /**
     * How long expired or revoked credentials are kept before purge.
     *
     * @return retention (default: 30 days)
     */
    @WithDefault("P30D")
    Duration retention();

    /**
     * Interval of the credential purge job, in scheduler syntax.
     *
     * @return purge interval (default: 1h)
     */
    @WithDefault("1h")
    String purgeInterval();
}
