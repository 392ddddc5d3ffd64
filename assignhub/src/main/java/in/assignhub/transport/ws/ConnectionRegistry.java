package in.assignhub.transport.ws;

import in.assignhub.domain.user.Identity;
import in.assignhub.domain.ws.CloseReason;
import in.assignhub.domain.ws.Connection;
import in.assignhub.domain.ws.ConnectionSummary;
import in.assignhub.domain.ws.MessageSink;
import in.assignhub.infrastructure.metrics.GatewayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Live WebSocket connections.
 *
 * <p>Every structural change is a single {@link ConcurrentMap} operation, so connects,
 * disconnects and subscription updates never wait on each other or on a broadcast.
 * {@link #snapshot()} copies the current entries; broadcasting iterates the copy.
 *
 * <p>Lifecycle: {@link #start()} opens an empty registry, {@link #shutdown()} refuses new
 * connections and force-disconnects the remaining ones.
 */
public final class ConnectionRegistry {
    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private static final Comparator<Connection> CONNECT_ORDER = Comparator.comparingLong(Connection::sequence);

    private final ConcurrentMap<String, Connection> connections = new ConcurrentHashMap<>();
    private final AtomicLong connectSeq = new AtomicLong(0);
    private final WireCodec codec;
    private final GatewayMetrics metrics;
    private final int outboundQueueLimit;

    private volatile boolean open;

    public ConnectionRegistry(WireCodec codec, GatewayMetrics metrics, int outboundQueueLimit) {
        if (outboundQueueLimit < 1) {
            throw new IllegalArgumentException("outboundQueueLimit must be positive");
        }
        this.codec = codec;
        this.metrics = metrics;
        this.outboundQueueLimit = outboundQueueLimit;
    }

    public void start() {
        open = true;
        log.info("Connection registry started (outbound queue limit {})", outboundQueueLimit);
    }

    public boolean isOpen() {
        return open;
    }

    /**
     * Register an authenticated client and queue its {@code connection_ack}.
     *
     * <p>The connection is stored CONNECTING and becomes ACTIVE only after the ack is queued.
     * Broadcasts skip connections that are not ACTIVE, so the ack is always the first frame.
     *
     * @return the new connection id
     * @throws IllegalStateException if the registry is not started or already shut down
     */
    public String connect(Identity identity, MessageSink sink) {
        if (!open) {
            throw new IllegalStateException("Connection registry is not accepting connections");
        }

        Connection connection;
        do {
            connection = new Connection(
                UUID.randomUUID().toString(),
                connectSeq.incrementAndGet(),
                identity,
                sink,
                outboundQueueLimit,
                this::onDeliveryFailure);
        } while (connections.putIfAbsent(connection.id(), connection) != null);

        metrics.connectionOpened();

        // lost a race with shutdown(): undo
        if (!open) {
            disconnect(connection.id(), CloseReason.SHUTDOWN);
            throw new IllegalStateException("Connection registry is shutting down");
        }

        log.info("WS connected: {} (user={}, remote={}, total={})",
            connection.id(), identity.userId(), sink.remoteAddress(), connections.size());

        connection.offer(codec.connectionAck());
        connection.activate();
        return connection.id();
    }

    /**
     * Remove a client that closed its side.
     */
    public boolean disconnect(String connectionId) {
        return disconnect(connectionId, CloseReason.CLIENT_CLOSED);
    }

    /**
     * Remove a connection and release its transport. Idempotent: unknown or already removed
     * ids are a no-op.
     *
     * @return true if this call removed the connection
     */
    public boolean disconnect(String connectionId, CloseReason reason) {
        if (connectionId == null) {
            return false;
        }
        Connection connection = connections.remove(connectionId);
        if (connection == null) {
            return false;
        }

        connection.markClosed();
        if (reason.closesTransport()) {
            try {
                connection.closeTransport(reason.code(), reason.message());
            } catch (RuntimeException e) {
                log.warn("WS close failed for {}: {}", connectionId, e.toString());
            }
        }
        metrics.connectionClosed(reason);

        log.info("WS disconnected: {} (user={}, reason={}, total={})",
            connectionId, connection.identity().userId(), reason, connections.size());
        return true;
    }

    public Optional<Connection> lookup(String connectionId) {
        return connectionId == null ? Optional.empty() : Optional.ofNullable(connections.get(connectionId));
    }

    /**
     * Replace the connection's filters. Empty filters mean receive everything.
     *
     * @return false if the connection is no longer registered
     */
    public boolean setSubscription(String connectionId, Map<String, String> filters) {
        Connection connection = connections.get(connectionId);
        if (connection == null) {
            return false;
        }
        connection.replaceSubscription(filters);
        log.debug("WS {} subscribed with filters {}", connectionId, connection.subscription());
        return true;
    }

    public boolean clearSubscription(String connectionId) {
        Connection connection = connections.get(connectionId);
        if (connection == null) {
            return false;
        }
        connection.clearSubscription();
        log.debug("WS {} cleared its filters", connectionId);
        return true;
    }

    /**
     * Queue a frame for one connection. A connection whose backlog is full is dropped.
     */
    public Connection.OfferResult send(String connectionId, String frame) {
        Connection connection = connections.get(connectionId);
        if (connection == null) {
            return Connection.OfferResult.CLOSED;
        }
        Connection.OfferResult result = connection.offer(frame);
        if (result == Connection.OfferResult.OVERFLOW) {
            log.warn("WS {} outbound backlog exceeded ({} frames), disconnecting", connectionId, outboundQueueLimit);
            disconnect(connectionId, CloseReason.BACKLOG_EXCEEDED);
        }
        return result;
    }

    /**
     * Copy of the registered connections in connect order.
     */
    public List<Connection> snapshot() {
        List<Connection> copy = new ArrayList<>(connections.values());
        copy.sort(CONNECT_ORDER);
        return copy;
    }

    public int count() {
        return connections.size();
    }

    public List<ConnectionSummary> summaries() {
        List<ConnectionSummary> out = new ArrayList<>();
        for (Connection c : snapshot()) {
            out.add(ConnectionSummary.of(c));
        }
        return out;
    }

    /**
     * Refuse new connections and disconnect every live one. Safe to call more than once.
     */
    public void shutdown() {
        open = false;
        List<Connection> remaining = snapshot();
        for (Connection c : remaining) {
            disconnect(c.id(), CloseReason.SHUTDOWN);
        }
        log.info("Connection registry shut down ({} connections closed)", remaining.size());
    }

    private void onDeliveryFailure(Connection connection, Throwable error) {
        log.warn("WS delivery to {} failed: {}", connection.id(), error.toString());
        metrics.delivery("failed", 1);
        disconnect(connection.id(), CloseReason.DELIVERY_FAILED);
    }
}
