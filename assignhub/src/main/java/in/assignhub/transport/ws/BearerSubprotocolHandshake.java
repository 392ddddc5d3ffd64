package in.assignhub.transport.ws;

import in.assignhub.auth.SubprotocolTokens;
import io.undertow.websockets.core.protocol.version13.Hybi13Handshake;

/**
 * RFC 6455 handshake that echoes the token-bearing subprotocol element.
 *
 * Browsers fail the upgrade when they offer a subprotocol and the server selects none,
 * so the element the token was taken from is selected. Authentication itself happens
 * after the upgrade.
 */
final class BearerSubprotocolHandshake extends Hybi13Handshake {

    private final boolean acceptBareToken;

    BearerSubprotocolHandshake(boolean acceptBareToken) {
        this.acceptBareToken = acceptBareToken;
    }

    @Override
    protected String supportedSubprotols(String[] requestedSubprotocolArray) {
        return SubprotocolTokens.find(requestedSubprotocolArray, acceptBareToken)
            .map(SubprotocolTokens.Match::element)
            .orElse(null);
    }
}
