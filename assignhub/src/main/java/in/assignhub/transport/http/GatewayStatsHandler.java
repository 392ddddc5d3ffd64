package in.assignhub.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.assignhub.transport.ws.ConnectionRegistry;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.Methods;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP handlers for gateway introspection.
 *
 * - GET /api/ws/stats - connection count and per-client summary
 * - GET /health       - liveness
 */
public final class GatewayStatsHandler {
    private static final Logger log = LoggerFactory.getLogger(GatewayStatsHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ConnectionRegistry registry;

    public GatewayStatsHandler(ConnectionRegistry registry) {
        this.registry = registry;
    }

    /**
     * GET /api/ws/stats
     *
     * Returns {@code {"active_connections": n, "clients": [...]}}.
     */
    public void getStats(HttpServerExchange exchange) {
        if (!Methods.GET.equals(exchange.getRequestMethod())) {
            sendError(exchange, StatusCodes.METHOD_NOT_ALLOWED, "Method not allowed");
            return;
        }
        try {
            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("active_connections", registry.count());
            stats.put("clients", registry.summaries());
            sendJson(exchange, stats);
        } catch (Exception e) {
            log.error("Failed to get WS stats: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to get WS stats");
        }
    }

    /**
     * GET /health
     */
    public void getHealth(HttpServerExchange exchange) {
        try {
            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", registry.isOpen() ? "UP" : "DOWN");
            health.put("active_connections", registry.count());
            if (!registry.isOpen()) {
                exchange.setStatusCode(StatusCodes.SERVICE_UNAVAILABLE);
            }
            sendJson(exchange, health);
        } catch (Exception e) {
            log.error("Failed to get health: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to get health");
        }
    }

    private void sendJson(HttpServerExchange exchange, Object data) throws Exception {
        String json = MAPPER.writeValueAsString(data);
        // status stays at the default 200 unless the caller set one
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }

    private void sendError(HttpServerExchange exchange, int statusCode, String message) {
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
        exchange.getResponseSender().send(message, StandardCharsets.UTF_8);
    }
}
