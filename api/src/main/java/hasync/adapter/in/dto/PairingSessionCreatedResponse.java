package hasync.adapter.in.dto;

import java.time.Duration;
import java.time.Instant;

import hasync.core.model.pairing.PairingSessionCreated;

/**
 * DTO for a newly created pairing session, including the PIN to display.
 *
 * @param expiresIn seconds until the PIN expires
 */
public record PairingSessionCreatedResponse(String id, String pin, Instant expiresAt, long expiresIn) {

    public static PairingSessionCreatedResponse from(PairingSessionCreated created, Instant now) {
        return new PairingSessionCreatedResponse(
                created.id(),
                created.pin(),
                created.expiresAt(),
                Math.max(0, Duration.between(now, created.expiresAt()).toSeconds()));
    }
}
