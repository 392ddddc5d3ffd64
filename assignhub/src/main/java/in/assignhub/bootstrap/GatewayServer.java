package in.assignhub.bootstrap;

import in.assignhub.auth.AuthenticationGate;
import in.assignhub.auth.TokenDecoder;
import in.assignhub.config.GatewayConfig;
import in.assignhub.infrastructure.metrics.PrometheusGatewayMetrics;
import in.assignhub.infrastructure.metrics.PrometheusMetricsHandler;
import in.assignhub.service.core.AssignmentEventPublisher;
import in.assignhub.transport.http.GatewayStatsHandler;
import in.assignhub.transport.ws.BroadcastDispatcher;
import in.assignhub.transport.ws.ConnectionRegistry;
import in.assignhub.transport.ws.FilterAttributes;
import in.assignhub.transport.ws.GatewayEndpoint;
import in.assignhub.transport.ws.WireCodec;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.handlers.PathHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the gateway components and hosts them on Undertow.
 *
 * Routes:
 * - {wsPath}        WebSocket endpoint
 * - {wsPath}/stats  connection introspection
 * - /metrics        Prometheus scrape
 * - /health         liveness
 */
public final class GatewayServer {
    private static final Logger log = LoggerFactory.getLogger(GatewayServer.class);

    private final GatewayConfig config;
    private final ConnectionRegistry registry;
    private final BroadcastDispatcher dispatcher;
    private final AssignmentEventPublisher publisher;
    private final PathHandler paths;

    private Undertow server;

    public GatewayServer(GatewayConfig config, TokenDecoder tokenDecoder, PrometheusGatewayMetrics metrics) {
        this.config = config;

        WireCodec codec = new WireCodec();
        FilterAttributes filterAttributes = new FilterAttributes(config.filterAttributes());

        this.registry = new ConnectionRegistry(codec, metrics, config.outboundQueueLimit());
        this.dispatcher = new BroadcastDispatcher(registry, codec, metrics);
        this.publisher = new AssignmentEventPublisher(dispatcher, filterAttributes);

        AuthenticationGate gate = new AuthenticationGate(tokenDecoder, config.acceptBareToken(), metrics);
        GatewayEndpoint endpoint = new GatewayEndpoint(registry, gate, codec, filterAttributes, metrics);
        GatewayStatsHandler stats = new GatewayStatsHandler(registry);

        this.paths = Handlers.path()
            .addExactPath(config.wsPath(), endpoint.handshakeHandler())
            .addExactPath(config.statsPath(), stats::getStats)
            .addExactPath("/health", stats::getHealth)
            .addExactPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));
    }

    public synchronized void start() {
        if (server != null) {
            throw new IllegalStateException("Gateway already started");
        }
        registry.start();
        server = Undertow.builder()
            .addHttpListener(config.port(), config.bindHost())
            .setHandler(paths)
            .build();
        server.start();
        log.info("Gateway listening on {}:{} (ws={}, stats={}, filters={})",
            config.bindHost(), config.port(), config.wsPath(), config.statsPath(), config.filterAttributes());
    }

    /**
     * Disconnect every client, then stop the listener.
     */
    public synchronized void stop() {
        registry.shutdown();
        if (server != null) {
            server.stop();
            server = null;
            log.info("Gateway stopped");
        }
    }

    public ConnectionRegistry registry() {
        return registry;
    }

    public BroadcastDispatcher dispatcher() {
        return dispatcher;
    }

    public AssignmentEventPublisher publisher() {
        return publisher;
    }
}
