package in.assignhub.auth;

/**
 * Token could not be trusted: malformed, bad signature, expired or missing claims.
 */
public class InvalidTokenException extends Exception {

    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
