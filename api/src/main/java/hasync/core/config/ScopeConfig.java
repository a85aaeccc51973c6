package hasync.core.config;

import java.util.Optional;
import java.util.Set;

import io.smallrye.config.ConfigMapping;

/**
 * Configuration mapping for the scope (area) registry.
 *
 * <p>Configuration prefix: {@code hasync.scopes}
 */
@ConfigMapping(prefix = "hasync.scopes")
public interface ScopeConfig {

    /**
     * Scope ids known at startup, e.g. {@code kitchen,living_room}.
     */
    Optional<Set<String>> known();
}
