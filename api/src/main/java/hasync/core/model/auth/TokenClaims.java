package hasync.core.model.auth;

import java.time.Instant;
import java.util.Set;

/**
 * Claims carried inside a signed token.
 *
 * @param subjectId the {@code sub} claim
 * @param tokenId   the {@code jti} claim
 * @param role      the {@code role} claim
 * @param scopes    the {@code scopes} claim
 * @param issuedAt  the {@code iat} claim
 * @param expiresAt the {@code exp} claim
 * @param nonce     random value making each token unique even with equal claims
 */
public record TokenClaims(
        String subjectId,
        String tokenId,
        Role role,
        Set<String> scopes,
        Instant issuedAt,
        Instant expiresAt,
        String nonce) {

    public TokenClaims {
        scopes = scopes == null ? Set.of() : Set.copyOf(scopes);
    }
}
