package in.assignhub.infrastructure.metrics;

import in.assignhub.domain.event.EventKind;
import in.assignhub.domain.ws.CloseReason;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;

/**
 * Prometheus implementation of GatewayMetrics.
 *
 * Key Metrics:
 * - ws_active_connections - Connections currently in the registry
 * - ws_connections_total - Connections accepted since start
 * - ws_auth_rejections_total{channel} - Rejected upgrade attempts
 * - ws_disconnects_total{reason} - Disconnects by close reason
 * - ws_client_messages_total{type} - Inbound client messages
 * - ws_events_dispatched_total{kind} - Domain events fanned out
 * - ws_deliveries_total{outcome} - Per-connection delivery attempts
 *
 * Usage:
 * <pre>
 * PrometheusGatewayMetrics metrics = new PrometheusGatewayMetrics(new CollectorRegistry());
 * paths.addExactPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));
 * </pre>
 */
public class PrometheusGatewayMetrics implements GatewayMetrics {

    private final CollectorRegistry registry;

    private final Gauge activeConnections;
    private final Counter connectionsTotal;
    private final Counter authRejections;
    private final Counter disconnects;
    private final Counter clientMessages;
    private final Counter eventsDispatched;
    private final Counter deliveries;

    public PrometheusGatewayMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusGatewayMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.activeConnections = Gauge.build()
            .name("ws_active_connections")
            .help("WebSocket connections currently registered")
            .register(registry);

        this.connectionsTotal = Counter.build()
            .name("ws_connections_total")
            .help("Total number of accepted WebSocket connections")
            .register(registry);

        this.authRejections = Counter.build()
            .name("ws_auth_rejections_total")
            .help("Total number of rejected WebSocket upgrade attempts")
            .labelNames("channel")
            .register(registry);

        this.disconnects = Counter.build()
            .name("ws_disconnects_total")
            .help("Total number of disconnects by reason")
            .labelNames("reason")
            .register(registry);

        this.clientMessages = Counter.build()
            .name("ws_client_messages_total")
            .help("Total number of messages received from clients")
            .labelNames("type")
            .register(registry);

        this.eventsDispatched = Counter.build()
            .name("ws_events_dispatched_total")
            .help("Total number of domain events dispatched")
            .labelNames("kind")
            .register(registry);

        this.deliveries = Counter.build()
            .name("ws_deliveries_total")
            .help("Total number of per-connection delivery attempts")
            .labelNames("outcome")
            .register(registry);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    @Override
    public void connectionOpened() {
        connectionsTotal.inc();
        activeConnections.inc();
    }

    @Override
    public void connectionClosed(CloseReason reason) {
        activeConnections.dec();
        disconnects.labels(reason.name().toLowerCase()).inc();
    }

    @Override
    public void authRejected(String channel) {
        authRejections.labels(channel).inc();
    }

    @Override
    public void clientMessage(String type) {
        clientMessages.labels(type).inc();
    }

    @Override
    public void eventDispatched(EventKind kind) {
        eventsDispatched.labels(kind.wireType()).inc();
    }

    @Override
    public void delivery(String outcome, int count) {
        if (count > 0) {
            deliveries.labels(outcome).inc(count);
        }
    }
}
