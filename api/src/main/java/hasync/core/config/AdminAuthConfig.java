package hasync.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for administrator login.
 *
 * <p>Configuration prefix: {@code hasync.auth.admin}
 */
@ConfigMapping(prefix = "hasync.auth.admin")
public interface AdminAuthConfig {

    /** @return admin username (default: admin) */
    @WithDefault("admin")
    String username();

    /**
     * Admin password. Login is disabled when absent.
     *
     * @return the password, if configured
     */
    Optional<String> password();

    /**
     * Per-IP limit on the login endpoint.
     */
    LoginRateLimit loginRateLimit();

    interface LoginRateLimit {

        /** @return attempts per window (default: 10) */
        @WithDefault("10")
        int maxRequests();

        /** @return window length (default: 15 minutes) */
        @WithDefault("PT15M")
        Duration window();
    }
}
