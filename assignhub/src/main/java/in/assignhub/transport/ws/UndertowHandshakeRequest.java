package in.assignhub.transport.ws;

import in.assignhub.auth.HandshakeRequest;
import io.undertow.util.Headers;
import io.undertow.websockets.spi.WebSocketHttpExchange;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link HandshakeRequest} view of an Undertow upgrade exchange.
 */
final class UndertowHandshakeRequest implements HandshakeRequest {

    private final WebSocketHttpExchange exchange;
    private final String remoteAddress;

    UndertowHandshakeRequest(WebSocketHttpExchange exchange, String remoteAddress) {
        this.exchange = exchange;
        this.remoteAddress = remoteAddress;
    }

    @Override
    public String subprotocolHeader() {
        return exchange.getRequestHeader(Headers.SEC_WEB_SOCKET_PROTOCOL_STRING);
    }

    @Override
    public Optional<String> queryParameter(String name) {
        Map<String, List<String>> params = exchange.getRequestParameters();
        if (params == null) {
            return Optional.empty();
        }
        List<String> values = params.get(name);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.get(0));
    }

    @Override
    public String remoteAddress() {
        return remoteAddress;
    }
}
