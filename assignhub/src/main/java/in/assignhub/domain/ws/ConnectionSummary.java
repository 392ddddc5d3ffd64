package in.assignhub.domain.ws;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Point-in-time description of one connection, as served by the stats endpoint.
 */
public record ConnectionSummary(
    @JsonProperty("client_id") String clientId,
    @JsonProperty("user_id") long userId,
    @JsonProperty("email") String email,
    @JsonProperty("role") String role,
    @JsonProperty("filters") Map<String, String> filters,
    @JsonProperty("state") ConnectionState state,
    @JsonProperty("connected_at") String connectedAt,
    @JsonProperty("last_activity") String lastActivity,
    @JsonProperty("outbound_backlog") int outboundBacklog
) {
    public static ConnectionSummary of(Connection c) {
        return new ConnectionSummary(
            c.id(),
            c.identity().userId(),
            c.identity().email(),
            c.identity().role(),
            c.subscription(),
            c.state(),
            c.connectedAt().toString(),
            c.lastActivity().toString(),
            c.backlog()
        );
    }
}
