package in.assignhub.auth;

/**
 * Verifies an access token and returns its claims.
 */
@FunctionalInterface
public interface TokenDecoder {

    /**
     * @throws InvalidTokenException if the token is not fully valid
     */
    TokenClaims decode(String token) throws InvalidTokenException;
}
