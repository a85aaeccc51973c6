package hasync.adapter.in.dto;

import java.util.Set;

import jakarta.validation.constraints.Size;

/**
 * DTO for completing a verified pairing session.
 *
 * @param clientName     display name, defaults to the device name
 * @param assignedScopes scopes to grant (may be empty)
 */
public record CompletePairingRequest(@Size(max = 128) String clientName, Set<String> assignedScopes) {}
