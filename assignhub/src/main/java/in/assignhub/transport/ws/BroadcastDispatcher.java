package in.assignhub.transport.ws;

import in.assignhub.domain.event.AssignmentEvent;
import in.assignhub.domain.ws.CloseReason;
import in.assignhub.domain.ws.Connection;
import in.assignhub.domain.ws.ConnectionState;
import in.assignhub.infrastructure.metrics.GatewayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Fans assignment events out to matching connections.
 *
 * <p>The event is serialized once; each matching connection gets the same frame through its
 * own bounded queue, so a slow consumer never holds up the others. Failures are handled per
 * connection: the connection is disconnected and the fan-out continues.
 */
public final class BroadcastDispatcher {
    private static final Logger log = LoggerFactory.getLogger(BroadcastDispatcher.class);

    private final ConnectionRegistry registry;
    private final WireCodec codec;
    private final GatewayMetrics metrics;

    public BroadcastDispatcher(ConnectionRegistry registry, WireCodec codec, GatewayMetrics metrics) {
        this.registry = registry;
        this.codec = codec;
        this.metrics = metrics;
    }

    public DispatchReport dispatch(AssignmentEvent event) {
        String frame = codec.event(event);
        List<Connection> snapshot = registry.snapshot();

        int matched = 0;
        int queued = 0;
        int overflow = 0;
        int closed = 0;
        int writeFailed = 0;

        for (Connection connection : snapshot) {
            // still waiting for its connection_ack
            if (connection.state() != ConnectionState.ACTIVE) {
                continue;
            }
            if (!SubscriptionFilterMatcher.matches(connection.subscription(), event.attributes())) {
                continue;
            }
            matched++;
            try {
                switch (connection.offer(frame)) {
                    case ACCEPTED -> queued++;
                    case OVERFLOW -> {
                        overflow++;
                        log.warn("WS {} outbound backlog full, disconnecting", connection.id());
                        registry.disconnect(connection.id(), CloseReason.BACKLOG_EXCEEDED);
                    }
                    case CLOSED -> {
                        closed++;
                        // closed between snapshot and offer; make sure the entry is gone
                        registry.disconnect(connection.id(), CloseReason.DELIVERY_FAILED);
                    }
                    // the registry already dropped it and counted the failure
                    case FAILED -> writeFailed++;
                }
            } catch (RuntimeException e) {
                closed++;
                log.warn("WS delivery to {} failed: {}", connection.id(), e.toString());
                registry.disconnect(connection.id(), CloseReason.DELIVERY_FAILED);
            }
        }

        metrics.eventDispatched(event.kind());
        metrics.delivery("queued", queued);
        metrics.delivery("overflow", overflow);
        metrics.delivery("failed", closed);

        DispatchReport report = new DispatchReport(snapshot.size(), matched, queued, overflow + closed + writeFailed);
        log.debug("Dispatched {} for assignment {}: {}", event.kind().wireType(), event.assignmentId(), report);
        return report;
    }
}
