package in.assignhub.auth;

import in.assignhub.infrastructure.metrics.GatewayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Authenticates WebSocket upgrade requests.
 *
 * Token lookup, first hit wins:
 * 1. {@code Sec-WebSocket-Protocol} header ({@code Bearer.<token>}, or a bare token, see {@link SubprotocolTokens})
 * 2. {@code ?token=} query parameter - deprecated, tokens in URLs end up in access logs and browser history
 *
 * The token is then verified by the {@link TokenDecoder}. Any decoder failure rejects the attempt.
 */
public final class AuthenticationGate {
    private static final Logger log = LoggerFactory.getLogger(AuthenticationGate.class);

    public static final String TOKEN_QUERY_PARAMETER = "token";

    private final TokenDecoder decoder;
    private final boolean acceptBareToken;
    private final GatewayMetrics metrics;

    public AuthenticationGate(TokenDecoder decoder, boolean acceptBareToken, GatewayMetrics metrics) {
        this.decoder = decoder;
        this.acceptBareToken = acceptBareToken;
        this.metrics = metrics;
    }

    public AuthenticatedHandshake authenticate(HandshakeRequest request) throws AuthenticationRejectedException {
        String remote = request.remoteAddress();

        String token = null;
        TokenChannel channel = null;

        Optional<SubprotocolTokens.Match> match = SubprotocolTokens.find(request.subprotocolHeader(), acceptBareToken);
        if (match.isPresent()) {
            token = match.get().token();
            channel = match.get().channel();
        }

        if (token == null) {
            Optional<String> queryToken = request.queryParameter(TOKEN_QUERY_PARAMETER).filter(t -> !t.isBlank());
            if (queryToken.isPresent()) {
                token = queryToken.get();
                channel = TokenChannel.QUERY_PARAMETER;
                log.warn("WS token supplied as query parameter by {} - deprecated, "
                    + "use the Sec-WebSocket-Protocol header (Bearer.<token>) instead", remote);
            }
        }

        if (token == null) {
            metrics.authRejected("none");
            throw new AuthenticationRejectedException(remote, "No token supplied");
        }

        try {
            TokenClaims claims = decoder.decode(token);
            return new AuthenticatedHandshake(claims.toIdentity(), channel);
        } catch (InvalidTokenException e) {
            metrics.authRejected(channel.name().toLowerCase());
            throw new AuthenticationRejectedException(remote, "Invalid token: " + e.getMessage(), e);
        }
    }

    public boolean acceptsBareToken() {
        return acceptBareToken;
    }
}
