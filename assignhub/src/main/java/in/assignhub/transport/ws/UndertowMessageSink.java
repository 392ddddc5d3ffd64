package in.assignhub.transport.ws;

import in.assignhub.domain.ws.MessageSink;
import io.undertow.websockets.core.WebSocketCallback;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;

import java.net.InetSocketAddress;

/**
 * {@link MessageSink} over an Undertow {@link WebSocketChannel}.
 */
final class UndertowMessageSink implements MessageSink {

    private final WebSocketChannel channel;

    UndertowMessageSink(WebSocketChannel channel) {
        this.channel = channel;
    }

    @Override
    public void send(String text, SendCallback callback) {
        WebSockets.sendText(text, channel, new WebSocketCallback<Void>() {
            @Override
            public void complete(WebSocketChannel ch, Void context) {
                callback.onComplete();
            }

            @Override
            public void onError(WebSocketChannel ch, Void context, Throwable throwable) {
                callback.onFailure(throwable);
            }
        });
    }

    @Override
    public void close(int code, String reason) {
        if (!channel.isOpen() || channel.isCloseFrameSent()) {
            return;
        }
        WebSockets.sendClose(code, reason, channel, null);
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen() && !channel.isCloseFrameSent();
    }

    @Override
    public String remoteAddress() {
        InetSocketAddress address = channel.getSourceAddress();
        return address == null ? "unknown" : address.getHostString() + ":" + address.getPort();
    }
}
