package in.assignhub.domain.ws;

/**
 * Connection lifecycle. CLOSED is terminal.
 */
public enum ConnectionState {
    CONNECTING,
    ACTIVE,
    CLOSED
}
