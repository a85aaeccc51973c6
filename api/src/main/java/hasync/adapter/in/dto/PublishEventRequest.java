package hasync.adapter.in.dto;

import java.util.Map;

import jakarta.validation.constraints.NotBlank;

/**
 * DTO for publishing a real-time event. Exactly one of {@code scope} and
 * {@code subjectId} must be set.
 *
 * @param type      application event type
 * @param scope     scope the event belongs to
 * @param subjectId subject the event is addressed to
 * @param payload   JSON body delivered to clients
 */
public record PublishEventRequest(@NotBlank String type, String scope, String subjectId, Map<String, Object> payload) {}
