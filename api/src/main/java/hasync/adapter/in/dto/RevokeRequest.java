package hasync.adapter.in.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * DTO for revoking every credential of a subject.
 */
public record RevokeRequest(@NotBlank String subjectId, String reason) {}
