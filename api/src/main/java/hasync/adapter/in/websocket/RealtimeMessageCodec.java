package hasync.adapter.in.websocket;

import java.util.LinkedHashSet;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jboss.logging.Logger;

import hasync.core.model.realtime.InboundMessage;
import hasync.core.model.realtime.OutboundMessage;

/**
 * JSON text frame codec for the real-time channel.
 *
 * <p>Every frame is an object whose {@code type} field comes first. Inbound frames that
 * are not valid JSON, or have an unknown type, decode to {@link InboundMessage.Unsupported}.
 */
@ApplicationScoped
public class RealtimeMessageCodec {

    private static final Logger LOG = Logger.getLogger(RealtimeMessageCodec.class);

    static final String TYPE = "type";
    static final String INVALID_JSON = "invalid_json";

    private final ObjectMapper objectMapper;

    public RealtimeMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(OutboundMessage message) {
        final ObjectNode frame = objectMapper.createObjectNode();
        frame.put(TYPE, message.type());
        frame.setAll((ObjectNode) objectMapper.valueToTree(message));
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + message.type() + " frame", e);
        }
    }

    public InboundMessage decode(String text) {
        final JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            LOG.debugv("Unparseable frame: {0}", e.getOriginalMessage());
            return new InboundMessage.Unsupported(INVALID_JSON);
        }
        if (root == null || !root.isObject() || !root.path(TYPE).isTextual()) {
            return new InboundMessage.Unsupported(INVALID_JSON);
        }

        final var type = root.get(TYPE).asText();
        return switch (type) {
            case "subscribe" -> decodeSubscribe(root);
            case "ping" -> new InboundMessage.Ping();
            default -> new InboundMessage.Unsupported(type);
        };
    }

    private InboundMessage decodeSubscribe(JsonNode root) {
        final var scopes = root.path("scopes");
        if (!scopes.isArray()) {
            return new InboundMessage.Unsupported("subscribe");
        }
        final Set<String> requested = new LinkedHashSet<>();
        for (JsonNode scope : scopes) {
            if (scope.isTextual() && !scope.asText().isBlank()) {
                requested.add(scope.asText());
            }
        }
        return new InboundMessage.Subscribe(requested);
    }
}
