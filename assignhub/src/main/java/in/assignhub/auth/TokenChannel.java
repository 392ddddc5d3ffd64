package in.assignhub.auth;

/**
 * Where a token was found on the upgrade request.
 */
public enum TokenChannel {
    SUBPROTOCOL_BEARER,
    SUBPROTOCOL_BARE,
    QUERY_PARAMETER
}
