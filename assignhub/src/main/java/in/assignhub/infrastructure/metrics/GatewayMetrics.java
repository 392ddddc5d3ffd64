package in.assignhub.infrastructure.metrics;

import in.assignhub.domain.event.EventKind;
import in.assignhub.domain.ws.CloseReason;

/**
 * Gateway metrics for monitoring and alerting.
 *
 * Key metrics:
 * - Live connection count
 * - Authentication rejections by token channel
 * - Disconnects by reason
 * - Client messages by type
 * - Events dispatched and per-connection delivery outcomes
 */
public interface GatewayMetrics {

    void connectionOpened();

    void connectionClosed(CloseReason reason);

    /**
     * @param channel token channel that failed, or {@code none} when no token was found
     */
    void authRejected(String channel);

    /**
     * @param type client message type, {@code invalid} for unparseable input
     */
    void clientMessage(String type);

    void eventDispatched(EventKind kind);

    /**
     * @param outcome {@code queued}, {@code overflow} or {@code failed}
     */
    void delivery(String outcome, int count);

    /**
     * Metrics sink that records nothing.
     */
    static GatewayMetrics noop() {
        return NoopGatewayMetrics.INSTANCE;
    }

    final class NoopGatewayMetrics implements GatewayMetrics {
        private static final NoopGatewayMetrics INSTANCE = new NoopGatewayMetrics();

        private NoopGatewayMetrics() {}

        @Override public void connectionOpened() {}
        @Override public void connectionClosed(CloseReason reason) {}
        @Override public void authRejected(String channel) {}
        @Override public void clientMessage(String type) {}
        @Override public void eventDispatched(EventKind kind) {}
        @Override public void delivery(String outcome, int count) {}
    }
}
