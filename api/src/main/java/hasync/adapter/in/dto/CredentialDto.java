package hasync.adapter.in.dto;

import java.time.Instant;
import java.util.Set;

import hasync.core.model.auth.Credential;

/**
 * DTO for credential metadata. Neither the token nor its hash is exposed.
 */
public record CredentialDto(
        String tokenId,
        String role,
        Set<String> assignedScopes,
        Instant issuedAt,
        Instant expiresAt,
        Instant revokedAt,
        String revokeReason,
        Instant lastUsedAt) {

    public static CredentialDto from(Credential credential) {
        return new CredentialDto(
                credential.tokenId(),
                credential.role().value(),
                credential.assignedScopes(),
                credential.issuedAt(),
                credential.expiresAt(),
                credential.revokedAt(),
                credential.revokeReason(),
                credential.lastUsedAt());
    }
}
