package hasync.core.service.pairing;

import jakarta.enterprise.context.ApplicationScoped;

import hasync.core.config.TokenConfig;
import hasync.core.util.SecureHash;

/**
 * Keyed hashing of PINs. A plain digest of six digits could be reversed by
 * enumerating all 900000 values, so the server secret is mixed in.
 */
@ApplicationScoped
public class PinHasher {

    private final TokenConfig config;

    public PinHasher(TokenConfig config) {
        this.config = config;
    }

    public String hash(String pin) {
        final var secret = config.signingSecret()
                .orElseThrow(() -> new IllegalStateException("hasync.auth.token.signing-secret is not configured"));
        return SecureHash.hmacSha256Hex(secret, pin);
    }
}
