package hasync.adapter.in.dto;

import java.time.Instant;
import java.util.Set;

import hasync.core.model.pairing.ClientView;

/**
 * DTO for a paired client with its current scopes.
 */
public record ClientDto(
        String subjectId,
        String clientName,
        String deviceName,
        String deviceType,
        String pairedBy,
        Instant pairedAt,
        Set<String> assignedScopes,
        boolean active,
        Instant lastSeenAt) {

    public static ClientDto from(ClientView view) {
        final var client = view.client();
        return new ClientDto(
                client.subjectId(),
                client.clientName(),
                client.deviceName(),
                client.deviceType().value(),
                client.pairedBy(),
                client.pairedAt(),
                view.assignedScopes(),
                view.active(),
                view.lastSeenAt());
    }
}
