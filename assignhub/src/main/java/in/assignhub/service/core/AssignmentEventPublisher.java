package in.assignhub.service.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.assignhub.domain.event.AssignmentAction;
import in.assignhub.domain.event.AssignmentEvent;
import in.assignhub.domain.event.EventKind;
import in.assignhub.transport.ws.BroadcastDispatcher;
import in.assignhub.transport.ws.DispatchReport;
import in.assignhub.transport.ws.FilterAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Entry point for the assignment CRUD layer: call after a change is committed.
 *
 * Builds the {@link AssignmentEvent} (snapshot as payload, recognized filter attributes
 * pulled from the snapshot) and hands it to the {@link BroadcastDispatcher}.
 * Delivery is best effort; a disconnected client does not get the event later.
 */
public final class AssignmentEventPublisher {
    private static final Logger log = LoggerFactory.getLogger(AssignmentEventPublisher.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final BroadcastDispatcher dispatcher;
    private final FilterAttributes filterAttributes;
    private final Clock clock;

    public AssignmentEventPublisher(BroadcastDispatcher dispatcher, FilterAttributes filterAttributes) {
        this(dispatcher, filterAttributes, Clock.systemUTC());
    }

    public AssignmentEventPublisher(BroadcastDispatcher dispatcher, FilterAttributes filterAttributes, Clock clock) {
        this.dispatcher = dispatcher;
        this.filterAttributes = filterAttributes;
        this.clock = clock;
    }

    public DispatchReport assignmentCreated(long assignmentId, Long actorUserId, String actorEmail,
                                            Map<String, ?> snapshot) {
        return publish(EventKind.CREATED, AssignmentAction.CREATE, assignmentId, actorUserId, actorEmail, snapshot);
    }

    public DispatchReport assignmentUpdated(long assignmentId, Long actorUserId, String actorEmail,
                                            Map<String, ?> snapshot) {
        return publish(EventKind.UPDATED, AssignmentAction.UPDATE, assignmentId, actorUserId, actorEmail, snapshot);
    }

    /**
     * @param snapshot last known state of the deleted assignment
     */
    public DispatchReport assignmentDeleted(long assignmentId, Long actorUserId, String actorEmail,
                                            Map<String, ?> snapshot) {
        return publish(EventKind.DELETED, AssignmentAction.DELETE, assignmentId, actorUserId, actorEmail, snapshot);
    }

    /**
     * An update lost an optimistic-locking race. {@code snapshot} is the current stored state.
     */
    public DispatchReport conflictDetected(long assignmentId, Long actorUserId, String actorEmail,
                                           Map<String, ?> snapshot) {
        return publish(EventKind.CONFLICT, AssignmentAction.UPDATE, assignmentId, actorUserId, actorEmail, snapshot);
    }

    private DispatchReport publish(EventKind kind, AssignmentAction action, long assignmentId,
                                   Long actorUserId, String actorEmail, Map<String, ?> snapshot) {
        Map<String, ?> data = snapshot == null ? Map.of() : snapshot;
        JsonNode payload = MAPPER.valueToTree(data);

        AssignmentEvent event = new AssignmentEvent(
            kind,
            clock.instant(),
            assignmentId,
            action,
            actorUserId,
            actorEmail,
            attributesOf(data),
            payload
        );

        DispatchReport report = dispatcher.dispatch(event);
        log.debug("Event emitted: type={}, assignmentId={}, actor={}, {}",
            kind.wireType(), assignmentId, actorUserId, report);
        return report;
    }

    /**
     * Recognized filter attributes of the snapshot, stringified. Null values are left out so
     * that a filter on that attribute does not match.
     */
    Map<String, String> attributesOf(Map<String, ?> snapshot) {
        Map<String, String> attributes = new HashMap<>();
        for (Map.Entry<String, ?> e : snapshot.entrySet()) {
            if (e.getValue() != null && filterAttributes.isRecognized(e.getKey())) {
                attributes.put(e.getKey(), String.valueOf(e.getValue()));
            }
        }
        return attributes;
    }
}
