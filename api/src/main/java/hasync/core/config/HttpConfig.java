package hasync.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for HTTP edge behaviour.
 *
 * <p>Configuration prefix: {@code hasync.http}
 */
@ConfigMapping(prefix = "hasync.http")
public interface HttpConfig {

    /**
     * Take the client address for rate limiting from {@code X-Forwarded-For}.
     * Enable only behind a proxy that overwrites the header.
     *
     * @return true to trust the header (default: false)
     */
    @WithDefault("false")
    boolean trustForwardedFor();
}
