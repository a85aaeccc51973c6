package hasync.core.model.realtime;

import java.time.Instant;
import java.util.Map;

/**
 * An application event to fan out to live connections.
 *
 * @param eventType application-defined type, e.g. {@code state_changed}
 * @param target    who may receive it
 * @param payload   JSON-compatible body
 * @param timestamp when the event happened
 */
public record RealtimeEvent(String eventType, EventTarget target, Map<String, Object> payload, Instant timestamp) {

    public RealtimeEvent {
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("Event type cannot be null or blank");
        }
        if (target == null) {
            throw new IllegalArgumentException("Event target cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("Timestamp cannot be null");
        }
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }
}
