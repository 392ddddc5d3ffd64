package in.assignhub.transport.ws;

import in.assignhub.auth.AuthenticatedHandshake;
import in.assignhub.auth.AuthenticationGate;
import in.assignhub.auth.AuthenticationRejectedException;
import in.assignhub.auth.HandshakeRequest;
import in.assignhub.domain.ws.CloseReason;
import in.assignhub.domain.ws.Connection;
import in.assignhub.domain.ws.MessageSink;
import in.assignhub.infrastructure.metrics.GatewayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-connection protocol driver. One instance per socket.
 *
 * <pre>
 * HANDSHAKE --open(): authenticated + registered--> ACTIVE --close/error--> CLOSED
 *     \--open(): rejected--------------------------------------------------^
 * </pre>
 *
 * The transport delivers inbound frames to {@link #onText} one at a time. Bad input is
 * answered with an {@code error} message and never closes the connection. Graceful close
 * and transport failures both end in exactly one {@link ConnectionRegistry#disconnect}.
 */
public final class ClientProtocolHandler {
    private static final Logger log = LoggerFactory.getLogger(ClientProtocolHandler.class);

    public enum Phase {
        HANDSHAKE,
        ACTIVE,
        CLOSED
    }

    private final ConnectionRegistry registry;
    private final AuthenticationGate gate;
    private final WireCodec codec;
    private final FilterAttributes filterAttributes;
    private final GatewayMetrics metrics;

    private final AtomicReference<Phase> phase = new AtomicReference<>(Phase.HANDSHAKE);
    private volatile String connectionId;

    public ClientProtocolHandler(ConnectionRegistry registry, AuthenticationGate gate, WireCodec codec,
                                 FilterAttributes filterAttributes, GatewayMetrics metrics) {
        this.registry = registry;
        this.gate = gate;
        this.codec = codec;
        this.filterAttributes = filterAttributes;
        this.metrics = metrics;
    }

    /**
     * Authenticate and register. On rejection the transport is closed with 1008 and
     * nothing else is sent.
     *
     * @return true if the connection is now ACTIVE
     */
    public boolean open(HandshakeRequest request, MessageSink sink) {
        if (phase.get() != Phase.HANDSHAKE) {
            throw new IllegalStateException("open() called in phase " + phase.get());
        }

        AuthenticatedHandshake auth;
        try {
            auth = gate.authenticate(request);
        } catch (AuthenticationRejectedException e) {
            log.warn("WS connection rejected from {}: {}", e.getRemoteAddress(), e.getMessage());
            phase.set(Phase.CLOSED);
            sink.close(CloseReason.POLICY_VIOLATION.code(), CloseReason.POLICY_VIOLATION.message());
            return false;
        }

        try {
            connectionId = registry.connect(auth.identity(), sink);
        } catch (IllegalStateException e) {
            log.warn("WS connection from {} refused: {}", request.remoteAddress(), e.getMessage());
            phase.set(Phase.CLOSED);
            sink.close(CloseReason.SHUTDOWN.code(), CloseReason.SHUTDOWN.message());
            return false;
        }

        phase.set(Phase.ACTIVE);
        log.debug("WS {} authenticated via {}", connectionId, auth.channel());
        return true;
    }

    /**
     * Handle one inbound text frame.
     */
    public void onText(String raw) {
        if (phase.get() != Phase.ACTIVE) {
            log.debug("WS message ignored in phase {}", phase.get());
            return;
        }
        try {
            handle(raw);
        } catch (RuntimeException e) {
            log.error("WS error for client {}: {}", connectionId, e.getMessage(), e);
            close(CloseReason.INTERNAL_ERROR);
        }
    }

    /**
     * Peer closed the socket.
     */
    public void onClosed() {
        close(CloseReason.CLIENT_CLOSED);
    }

    /**
     * Transport-level receive/send failure.
     */
    public void onTransportError(Throwable error) {
        if (phase.get() == Phase.ACTIVE) {
            log.error("WS transport error for client {}: {}", connectionId, error.toString(), error);
        }
        close(CloseReason.INTERNAL_ERROR);
    }

    public Phase phase() {
        return phase.get();
    }

    public String connectionId() {
        return connectionId;
    }

    private void handle(String raw) {
        Optional<Connection> connection = registry.lookup(connectionId);
        if (connection.isEmpty()) {
            // dropped by the registry (delivery failure, backlog, shutdown)
            phase.set(Phase.CLOSED);
            return;
        }
        connection.get().touch();

        ClientMessage message;
        try {
            message = codec.parse(raw);
        } catch (ProtocolException e) {
            metrics.clientMessage(e.getKind() == ProtocolException.Kind.UNKNOWN_TYPE ? "unknown" : "invalid");
            log.debug("WS {} sent bad message ({}): {}", connectionId, e.getKind(), e.getMessage());
            reply(codec.error(e.getMessage()));
            return;
        }

        metrics.clientMessage(message.type().wireName());
        switch (message.type()) {
            case SUBSCRIBE -> subscribe(message.filters());
            case UNSUBSCRIBE -> registry.clearSubscription(connectionId);
            case PING -> reply(codec.pong());
        }
    }

    private void subscribe(Map<String, String> filters) {
        Set<String> unknown = filterAttributes.unknownKeys(filters);
        if (!unknown.isEmpty()) {
            reply(codec.error("Unknown filter attribute(s): " + String.join(", ", unknown)
                + " (allowed: " + String.join(", ", new TreeSet<>(filterAttributes.names())) + ")"));
            return;
        }
        registry.setSubscription(connectionId, filters);
    }

    private void reply(String frame) {
        registry.send(connectionId, frame);
    }

    private void close(CloseReason reason) {
        if (phase.getAndSet(Phase.CLOSED) != Phase.ACTIVE) {
            return;
        }
        registry.disconnect(connectionId, reason);
    }
}
