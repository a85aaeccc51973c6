package hasync.adapter.in.dto;

import java.time.Instant;
import java.util.Set;

import hasync.core.model.auth.IssuedToken;

/**
 * DTO returned whenever a credential is issued. This is the only place a raw token
 * leaves the service.
 *
 * @param subjectId      credential subject
 * @param token          the raw bearer token
 * @param expiresAt      credential expiry
 * @param assignedScopes scopes carried by the credential
 */
public record TokenResponse(String subjectId, String token, Instant expiresAt, Set<String> assignedScopes) {

    public static TokenResponse from(IssuedToken issued) {
        final var credential = issued.credential();
        return new TokenResponse(
                credential.subjectId(), issued.rawToken(), credential.expiresAt(), credential.assignedScopes());
    }
}
