package in.assignhub.transport.ws;

import in.assignhub.auth.AuthenticationGate;
import in.assignhub.infrastructure.metrics.GatewayMetrics;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.CloseMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.protocol.Handshake;
import io.undertow.websockets.spi.WebSocketHttpExchange;

import java.util.List;

/**
 * Undertow WebSocket endpoint.
 *
 * Authentication (recommended - subprotocol header):
 * <pre>
 * new WebSocket("wss://host/api/ws", ["Bearer." + jwt])
 * </pre>
 *
 * Authentication (deprecated - query parameter):
 * <pre>
 * wss://host/api/ws?token=JWT
 * </pre>
 *
 * Each accepted socket gets its own {@link ClientProtocolHandler}; Undertow delivers that
 * socket's frames sequentially, which is the per-connection receive loop.
 */
public final class GatewayEndpoint implements WebSocketConnectionCallback {

    private final ConnectionRegistry registry;
    private final AuthenticationGate gate;
    private final WireCodec codec;
    private final FilterAttributes filterAttributes;
    private final GatewayMetrics metrics;

    public GatewayEndpoint(ConnectionRegistry registry, AuthenticationGate gate, WireCodec codec,
                           FilterAttributes filterAttributes, GatewayMetrics metrics) {
        this.registry = registry;
        this.gate = gate;
        this.codec = codec;
        this.filterAttributes = filterAttributes;
        this.metrics = metrics;
    }

    public WebSocketProtocolHandshakeHandler handshakeHandler() {
        return new WebSocketProtocolHandshakeHandler(
            List.<Handshake>of(new BearerSubprotocolHandshake(gate.acceptsBareToken())), this);
    }

    @Override
    public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
        UndertowMessageSink sink = new UndertowMessageSink(channel);
        ClientProtocolHandler handler = new ClientProtocolHandler(registry, gate, codec, filterAttributes, metrics);

        if (!handler.open(new UndertowHandshakeRequest(exchange, sink.remoteAddress()), sink)) {
            // keep reading so the close handshake can complete
            channel.getReceiveSetter().set(new AbstractReceiveListener() {});
            channel.resumeReceives();
            return;
        }

        channel.getReceiveSetter().set(new AbstractReceiveListener() {
            @Override
            protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                handler.onText(message.getData());
            }

            @Override
            protected void onCloseMessage(CloseMessage cm, WebSocketChannel ch) {
                handler.onClosed();
                super.onCloseMessage(cm, ch);
            }

            @Override
            protected void onError(WebSocketChannel ch, Throwable error) {
                handler.onTransportError(error);
                super.onError(ch, error);
            }
        });
        // abrupt disconnect without a close frame
        channel.getCloseSetter().set(ch -> handler.onClosed());
        channel.resumeReceives();
    }
}
