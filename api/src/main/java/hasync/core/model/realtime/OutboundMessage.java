package hasync.core.model.realtime;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Frames the server sends on a real-time connection. {@link #type()} is the
 * discriminator written to the wire.
 */
public sealed interface OutboundMessage {

    String type();

    record Connected(String socketId, String subjectId, String role, Set<String> scopes, Instant timestamp)
            implements OutboundMessage {
        @Override
        public String type() {
            return "connected";
        }
    }

    record EventMessage(String eventType, String scope, Map<String, Object> payload, Instant timestamp)
            implements OutboundMessage {
        @Override
        public String type() {
            return "event";
        }
    }

    record Subscribed(Set<String> scopes, Set<String> ignored) implements OutboundMessage {
        @Override
        public String type() {
            return "subscribed";
        }
    }

    record ScopeChanged(Set<String> scopes, Set<String> added, Set<String> removed) implements OutboundMessage {
        @Override
        public String type() {
            return "scope_changed";
        }
    }

    record Revoked(String reason) implements OutboundMessage {
        @Override
        public String type() {
            return "revoked";
        }
    }

    record Pong(Instant timestamp) implements OutboundMessage {
        @Override
        public String type() {
            return "pong";
        }
    }

    record ErrorNotice(String code, String message) implements OutboundMessage {
        @Override
        public String type() {
            return "error";
        }
    }
}
