package in.assignhub.domain.ws;

/**
 * Why a connection left the registry, and how its transport is closed.
 *
 * <p>{@code closesTransport} is false when the peer already started the close handshake.
 */
public enum CloseReason {
    CLIENT_CLOSED(1000, "Normal closure", false),
    POLICY_VIOLATION(1008, "Authentication required", true),
    BACKLOG_EXCEEDED(1008, "Outbound backlog exceeded", true),
    DELIVERY_FAILED(1011, "Delivery failed", true),
    INTERNAL_ERROR(1011, "Internal error", true),
    SHUTDOWN(1001, "Server shutting down", true);

    private final int code;
    private final String message;
    private final boolean closesTransport;

    CloseReason(int code, String message, boolean closesTransport) {
        this.code = code;
        this.message = message;
        this.closesTransport = closesTransport;
    }

    public int code() {
        return code;
    }

    public String message() {
        return message;
    }

    public boolean closesTransport() {
        return closesTransport;
    }
}
