package in.assignhub.domain.event;

/**
 * Kinds of assignment change pushed to WebSocket clients.
 * Each kind maps to the {@code type} field of the server message.
 */
public enum EventKind {
    CREATED("assignment_created"),
    UPDATED("assignment_updated"),
    DELETED("assignment_deleted"),
    CONFLICT("conflict_detected");

    private final String wireType;

    EventKind(String wireType) {
        this.wireType = wireType;
    }

    public String wireType() {
        return wireType;
    }
}
