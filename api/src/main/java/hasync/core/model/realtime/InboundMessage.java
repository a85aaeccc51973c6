package hasync.core.model.realtime;

import java.util.Set;

/**
 * Frames a client may send on a real-time connection.
 */
public sealed interface InboundMessage {

    /** Narrow delivery to the given scopes. */
    record Subscribe(Set<String> scopes) implements InboundMessage {
        public Subscribe {
            scopes = scopes == null ? Set.of() : Set.copyOf(scopes);
        }
    }

    record Ping() implements InboundMessage {}

    /** Anything unparseable or of an unknown type. */
    record Unsupported(String type) implements InboundMessage {}
}
