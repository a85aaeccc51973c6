package hasync.adapter.in.dto;

import java.time.Instant;

import hasync.core.model.pairing.PairingSession;

/**
 * DTO for a pairing session's status. The PIN hash is never included.
 */
public record PairingSessionDto(
        String id,
        String status,
        boolean cancelled,
        String deviceName,
        String deviceType,
        String createdBy,
        Instant createdAt,
        Instant expiresAt,
        Instant verifiedAt,
        Instant completedAt,
        int attemptsRemaining) {

    public static PairingSessionDto from(PairingSession session) {
        return new PairingSessionDto(
                session.id(),
                session.status().name(),
                session.cancelled(),
                session.deviceName(),
                session.deviceType() != null ? session.deviceType().value() : null,
                session.createdBy(),
                session.createdAt(),
                session.expiresAt(),
                session.verifiedAt(),
                session.completedAt(),
                session.attemptsRemaining());
    }
}
