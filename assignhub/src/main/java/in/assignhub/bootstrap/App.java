package in.assignhub.bootstrap;

import in.assignhub.auth.HmacJwtDecoder;
import in.assignhub.config.GatewayConfig;
import in.assignhub.infrastructure.metrics.PrometheusGatewayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gateway entry point (NO Spring).
 *
 * Environment: PORT, BIND_HOST, WS_PATH, JWT_SECRET, WS_OUTBOUND_QUEUE_LIMIT,
 * WS_FILTER_ATTRIBUTES, WS_ACCEPT_BARE_TOKEN. See {@link GatewayConfig}.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("=== AssignHub gateway starting ===");

        GatewayConfig config;
        try {
            config = GatewayConfig.fromEnv();
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }

        PrometheusGatewayMetrics metrics = new PrometheusGatewayMetrics();
        GatewayServer server = new GatewayServer(config, new HmacJwtDecoder(config.jwtSecret()), metrics);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            server.stop();
        }, "gateway-shutdown"));

        server.start();
        log.info("=== AssignHub gateway ready ===");
    }

    private App() {}
}
