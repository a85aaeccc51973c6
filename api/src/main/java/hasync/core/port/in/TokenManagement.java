package hasync.core.port.in;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import io.smallrye.mutiny.Uni;

import hasync.core.model.auth.Credential;
import hasync.core.model.auth.IssuedToken;
import hasync.core.model.auth.Role;
import hasync.core.model.auth.TokenException;

/**
 * Port for credential lifecycle operations.
 *
 * <p>Verification failures fail the returned {@link Uni} with a {@link TokenException}.
 */
public interface TokenManagement {

    /**
     * Issue a credential with the role's default lifetime.
     */
    Uni<IssuedToken> issue(String subjectId, Role role, Set<String> scopes);

    /**
     * Issue a credential. Only the token hash is persisted; the raw token is in the result.
     */
    Uni<IssuedToken> issue(String subjectId, Role role, Set<String> scopes, Duration ttl);

    /**
     * Verify a presented token and return its stored credential.
     */
    Uni<Credential> verify(String rawToken);

    /**
     * Whether the credential with this hash exists and is active now.
     */
    Uni<Boolean> isActive(String tokenHash);

    /**
     * Revoke every active credential of a subject and disconnect its live connections.
     *
     * @return number of credentials revoked by this call
     */
    Uni<Integer> revoke(String subjectId, String reason);

    /**
     * Revoke the single credential behind {@code rawToken}.
     *
     * @return true if it was active and is now revoked
     */
    Uni<Boolean> revokeToken(String rawToken, String reason);

    /**
     * Replace a client's credential with one carrying {@code newScopes}. Live connections
     * stay open and have their scopes updated in place.
     */
    Uni<IssuedToken> reissueWithScopes(String subjectId, Set<String> newScopes);

    Uni<List<Credential>> listCredentials(String subjectId);

    /**
     * Delete credentials that have been inactive for longer than the retention period.
     *
     * @return number of credentials deleted
     */
    Uni<Integer> purgeExpired(Instant now);
}
