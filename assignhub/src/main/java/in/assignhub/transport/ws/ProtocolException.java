package in.assignhub.transport.ws;

/**
 * Client message that cannot be acted on. Reported back as an {@code error} message;
 * the connection stays open.
 */
public class ProtocolException extends RuntimeException {

    public enum Kind {
        MALFORMED,
        UNKNOWN_TYPE,
        INVALID_FILTER
    }

    private final Kind kind;

    public ProtocolException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ProtocolException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
