package in.assignhub.transport.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.assignhub.domain.event.AssignmentEvent;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON wire format of the WebSocket protocol.
 *
 * Client to server:
 * <pre>
 * {"type": "subscribe", "filters": {"direction": "IB"}}   // filters optional
 * {"type": "unsubscribe"}
 * {"type": "ping"}
 * </pre>
 *
 * Server to client: {@code connection_ack}, {@code pong}, {@code error} and the
 * assignment events ({@code assignment_created}, {@code assignment_updated},
 * {@code assignment_deleted}, {@code conflict_detected}).
 */
public final class WireCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String TYPE_CONNECTION_ACK = "connection_ack";
    public static final String TYPE_PONG = "pong";
    public static final String TYPE_ERROR = "error";

    public String connectionAck() {
        return write(typed(TYPE_CONNECTION_ACK));
    }

    public String pong() {
        return write(typed(TYPE_PONG));
    }

    public String error(String message) {
        ObjectNode node = typed(TYPE_ERROR);
        node.put("message", message);
        return write(node);
    }

    public String event(AssignmentEvent e) {
        ObjectNode node = typed(e.kind().wireType());
        node.put("timestamp", e.timestamp().toString());
        node.put("assignment_id", e.assignmentId());
        node.put("action", e.action().name());
        if (e.actorUserId() != null) {
            node.put("user_id", e.actorUserId());
        } else {
            node.putNull("user_id");
        }
        node.put("user_email", e.actorEmail());
        node.set("data", e.payload() == null ? MAPPER.createObjectNode() : e.payload());
        return write(node);
    }

    /**
     * Parse one client text frame.
     *
     * @throws ProtocolException if the frame is not a known, well-formed command
     */
    public ClientMessage parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ProtocolException(ProtocolException.Kind.MALFORMED, "Empty message");
        }

        JsonNode root;
        try {
            root = MAPPER.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new ProtocolException(ProtocolException.Kind.MALFORMED, "Invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ProtocolException(ProtocolException.Kind.MALFORMED, "Message must be a JSON object");
        }

        JsonNode typeNode = root.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            throw new ProtocolException(ProtocolException.Kind.MALFORMED, "Missing 'type'");
        }

        ClientMessage.Type type = ClientMessage.Type.fromWire(typeNode.asText());
        if (type == null) {
            throw new ProtocolException(ProtocolException.Kind.UNKNOWN_TYPE, "Unknown message type: " + typeNode.asText());
        }

        if (type != ClientMessage.Type.SUBSCRIBE) {
            return new ClientMessage(type, Map.of());
        }
        return new ClientMessage(type, parseFilters(root.get("filters")));
    }

    private Map<String, String> parseFilters(JsonNode filters) {
        if (filters == null || filters.isNull()) {
            return Map.of();
        }
        if (!filters.isObject()) {
            throw new ProtocolException(ProtocolException.Kind.INVALID_FILTER, "'filters' must be an object");
        }
        Map<String, String> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = filters.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> f = fields.next();
            JsonNode v = f.getValue();
            if (!v.isValueNode() || v.isNull()) {
                throw new ProtocolException(ProtocolException.Kind.INVALID_FILTER,
                    "Filter value for '" + f.getKey() + "' must be a string");
            }
            out.put(f.getKey(), v.asText());
        }
        return out;
    }

    private static ObjectNode typed(String type) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", type);
        return node;
    }

    private static String write(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize WS message", e);
        }
    }
}
