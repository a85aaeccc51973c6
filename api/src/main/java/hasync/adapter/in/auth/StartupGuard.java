package hasync.adapter.in.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import hasync.core.config.AdminAuthConfig;
import hasync.core.config.PairingConfig;
import hasync.core.config.TokenConfig;

/**
 * Startup guard that refuses to run with unsafe security settings.
 *
 * <p>Fails fast when the signing secret is missing or shorter than
 * {@link TokenConfig#MIN_SECRET_LENGTH}, or when the pairing attempt limit is outside
 * {@link PairingConfig#MIN_ATTEMPTS}..{@link PairingConfig#MAX_ATTEMPTS}.
 */
@ApplicationScoped
public class StartupGuard {

    private static final Logger LOG = Logger.getLogger(StartupGuard.class);

    private final TokenConfig tokenConfig;
    private final PairingConfig pairingConfig;
    private final AdminAuthConfig adminConfig;

    public StartupGuard(TokenConfig tokenConfig, PairingConfig pairingConfig, AdminAuthConfig adminConfig) {
        this.tokenConfig = tokenConfig;
        this.pairingConfig = pairingConfig;
        this.adminConfig = adminConfig;
    }

    /**
     * @throws IllegalStateException if a setting is unsafe
     */
    void onStart(@Observes StartupEvent event) {
        validate();
    }

    void validate() {
        final var secret = tokenConfig.signingSecret().orElse("");
        if (secret.length() < TokenConfig.MIN_SECRET_LENGTH) {
            LOG.error("hasync.auth.token.signing-secret is missing or too short");
            throw new IllegalStateException("hasync.auth.token.signing-secret must be set to at least "
                    + TokenConfig.MIN_SECRET_LENGTH + " characters. "
                    + "It signs every credential and keys the PIN hashes.");
        }

        final var maxAttempts = pairingConfig.maxAttempts();
        if (maxAttempts < PairingConfig.MIN_ATTEMPTS || maxAttempts > PairingConfig.MAX_ATTEMPTS) {
            LOG.errorf("hasync.pairing.max-attempts=%d is out of range", maxAttempts);
            throw new IllegalStateException("hasync.pairing.max-attempts must be between "
                    + PairingConfig.MIN_ATTEMPTS + " and " + PairingConfig.MAX_ATTEMPTS + ", got " + maxAttempts);
        }

        if (adminConfig.password().filter(p -> !p.isEmpty()).isEmpty()) {
            LOG.warn("hasync.auth.admin.password is not set, administrator login is disabled");
        }
    }
}
