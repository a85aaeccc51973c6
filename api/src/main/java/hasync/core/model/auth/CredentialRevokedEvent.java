package hasync.core.model.auth;

import java.time.Instant;
import java.util.Optional;

/**
 * Fired when credentials are revoked so live connections can be closed.
 *
 * @param subjectId whose credentials were revoked
 * @param tokenHash when present, only connections opened with this credential are affected
 * @param reason    reason sent to the disconnected clients
 * @param revokedAt revocation time
 */
public record CredentialRevokedEvent(String subjectId, Optional<String> tokenHash, String reason, Instant revokedAt) {

    public static CredentialRevokedEvent forSubject(String subjectId, String reason, Instant revokedAt) {
        return new CredentialRevokedEvent(subjectId, Optional.empty(), reason, revokedAt);
    }

    public static CredentialRevokedEvent forToken(
            String subjectId, String tokenHash, String reason, Instant revokedAt) {
        return new CredentialRevokedEvent(subjectId, Optional.of(tokenHash), reason, revokedAt);
    }
}
