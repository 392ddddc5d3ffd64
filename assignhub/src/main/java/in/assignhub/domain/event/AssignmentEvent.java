package in.assignhub.domain.event;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable change notification for one assignment.
 *
 * <p>{@code attributes} is the flat view used for subscription matching;
 * {@code payload} is the full snapshot delivered to clients.
 * {@code actorUserId} and {@code actorEmail} are null for system actions.
 */
public record AssignmentEvent(
    EventKind kind,
    Instant timestamp,
    long assignmentId,
    AssignmentAction action,
    Long actorUserId,
    String actorEmail,
    Map<String, String> attributes,
    JsonNode payload
) {
    public AssignmentEvent {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(action, "action");
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        // JsonNode is mutable; keep our own copy
        payload = payload == null ? null : payload.deepCopy();
    }
}
