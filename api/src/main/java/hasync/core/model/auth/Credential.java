package hasync.core.model.auth;

import java.time.Instant;
import java.util.Set;

/**
 * Stored form of an issued credential. The raw token is never part of it.
 *
 * @param tokenHash      SHA-256 hex of the raw token, unique lookup key
 * @param tokenId        the token's {@code jti}
 * @param subjectId      who the credential belongs to
 * @param role           credential role
 * @param assignedScopes scopes the holder may receive events for
 * @param issuedAt       issuance time
 * @param expiresAt      expiry time
 * @param revokedAt      revocation time, null while not revoked
 * @param revokeReason   reason given at revocation
 * @param lastUsedAt     last successful verification
 */
public record Credential(
        String tokenHash,
        String tokenId,
        String subjectId,
        Role role,
        Set<String> assignedScopes,
        Instant issuedAt,
        Instant expiresAt,
        Instant revokedAt,
        String revokeReason,
        Instant lastUsedAt) {

    public Credential {
        if (tokenHash == null || tokenHash.isBlank()) {
            throw new IllegalArgumentException("Token hash cannot be null or blank");
        }
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("Subject ID cannot be null or blank");
        }
        if (role == null) {
            throw new IllegalArgumentException("Role cannot be null");
        }
        if (issuedAt == null || expiresAt == null) {
            throw new IllegalArgumentException("Issue and expiry times are required");
        }
        assignedScopes = assignedScopes == null ? Set.of() : Set.copyOf(assignedScopes);
    }

    public boolean isRevoked() {
        return revokedAt != null;
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /** Active iff not revoked and {@code now < expiresAt}. */
    public boolean isActiveAt(Instant now) {
        return !isRevoked() && !isExpiredAt(now);
    }

    public Credential revoke(Instant now, String reason) {
        return new Credential(
                tokenHash, tokenId, subjectId, role, assignedScopes, issuedAt, expiresAt, now, reason, lastUsedAt);
    }

    public Credential touch(Instant now) {
        return new Credential(
                tokenHash, tokenId, subjectId, role, assignedScopes, issuedAt, expiresAt, revokedAt, revokeReason, now);
    }
}
