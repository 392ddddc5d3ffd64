package in.assignhub.config;

import in.assignhub.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Runtime configuration for the WebSocket gateway.
 *
 * Loaded from environment variables (or system properties with the same name).
 */
public record GatewayConfig(
    String bindHost,
    int port,
    String wsPath,
    String jwtSecret,
    int outboundQueueLimit,         // frames buffered per connection before it is dropped
    Set<String> filterAttributes,   // attribute names a subscription may filter on
    boolean acceptBareToken         // accept an unmarked subprotocol element as a token
) {
    private static final Logger log = LoggerFactory.getLogger(GatewayConfig.class);

    public static final String DEV_JWT_SECRET = "assignhub-dev-secret-change-in-production";
    public static final String DEFAULT_FILTER_ATTRIBUTES = "direction,ramp_id,status_id";

    public GatewayConfig {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (outboundQueueLimit < 1) {
            throw new IllegalArgumentException("outboundQueueLimit must be positive: " + outboundQueueLimit);
        }
        if (jwtSecret == null || jwtSecret.isEmpty()) {
            throw new IllegalArgumentException("jwtSecret is required");
        }
        if (wsPath == null || !wsPath.startsWith("/")) {
            throw new IllegalArgumentException("wsPath must start with '/': " + wsPath);
        }
        filterAttributes = Set.copyOf(filterAttributes);
    }

    public static GatewayConfig fromEnv() {
        String secret = Env.get("JWT_SECRET", null);
        if (secret == null) {
            log.warn("JWT_SECRET not set - using development secret. Do NOT run like this in production.");
            secret = DEV_JWT_SECRET;
        }
        return new GatewayConfig(
            Env.get("BIND_HOST", "0.0.0.0"),
            Env.getInt("PORT", 8000),
            Env.get("WS_PATH", "/api/ws"),
            secret,
            Env.getInt("WS_OUTBOUND_QUEUE_LIMIT", 256),
            Env.getSet("WS_FILTER_ATTRIBUTES", DEFAULT_FILTER_ATTRIBUTES),
            Env.getBool("WS_ACCEPT_BARE_TOKEN", true)
        );
    }

    /**
     * Path of the introspection endpoint, next to the socket path.
     */
    public String statsPath() {
        return wsPath + "/stats";
    }
}
