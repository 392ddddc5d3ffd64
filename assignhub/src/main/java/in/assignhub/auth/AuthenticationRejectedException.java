package in.assignhub.auth;

/**
 * Connection attempt without a usable token. The channel must be closed with a
 * policy-violation status and no further protocol activity.
 */
public class AuthenticationRejectedException extends Exception {

    private final String remoteAddress;

    public AuthenticationRejectedException(String remoteAddress, String message) {
        super(message);
        this.remoteAddress = remoteAddress;
    }

    public AuthenticationRejectedException(String remoteAddress, String message, Throwable cause) {
        super(message, cause);
        this.remoteAddress = remoteAddress;
    }

    public String getRemoteAddress() {
        return remoteAddress;
    }
}
