package in.assignhub.domain.ws;

import in.assignhub.domain.user.Identity;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One authenticated WebSocket client.
 *
 * <p>Outbound frames go through a bounded queue with at most one frame in flight, so
 * concurrent writers (ack, replies, broadcasts) never interleave and frames for this
 * connection leave in the order they were offered.
 */
public final class Connection {

    public enum OfferResult {
        ACCEPTED,
        OVERFLOW,
        CLOSED,
        /** The write was attempted during this offer and failed; the connection is now closed. */
        FAILED
    }

    /**
     * Notified when an in-flight write fails. The connection is already CLOSED by then.
     */
    @FunctionalInterface
    public interface DeliveryFailureListener {
        void onDeliveryFailure(Connection connection, Throwable error);
    }

    private final String id;
    private final long sequence;
    private final Identity identity;
    private final MessageSink sink;
    private final int outboundLimit;
    private final DeliveryFailureListener failureListener;
    private final Instant connectedAt;

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);
    private volatile Map<String, String> subscription = Map.of();
    private volatile Instant lastActivity;

    private final Queue<String> outbound = new ConcurrentLinkedQueue<>();
    private final AtomicInteger backlog = new AtomicInteger();   // queued + in flight
    private final AtomicBoolean writing = new AtomicBoolean();

    public Connection(String id, long sequence, Identity identity, MessageSink sink,
                      int outboundLimit, DeliveryFailureListener failureListener) {
        this.id = Objects.requireNonNull(id, "id");
        this.sequence = sequence;
        this.identity = Objects.requireNonNull(identity, "identity");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.outboundLimit = outboundLimit;
        this.failureListener = Objects.requireNonNull(failureListener, "failureListener");
        this.connectedAt = Instant.now();
        this.lastActivity = connectedAt;
    }

    public String id() {
        return id;
    }

    /**
     * Registry-assigned connect order.
     */
    public long sequence() {
        return sequence;
    }

    public Identity identity() {
        return identity;
    }

    public ConnectionState state() {
        return state.get();
    }

    public Map<String, String> subscription() {
        return subscription;
    }

    public Instant connectedAt() {
        return connectedAt;
    }

    public Instant lastActivity() {
        return lastActivity;
    }

    public int backlog() {
        return backlog.get();
    }

    public String remoteAddress() {
        return sink.remoteAddress();
    }

    public void touch() {
        this.lastActivity = Instant.now();
    }

    /**
     * CONNECTING -> ACTIVE. Returns false if the connection is no longer CONNECTING.
     */
    public boolean activate() {
        return state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.ACTIVE);
    }

    /**
     * Replace the whole filter mapping. Empty means receive everything.
     */
    public void replaceSubscription(Map<String, String> filters) {
        this.subscription = filters == null ? Map.of() : Map.copyOf(filters);
        touch();
    }

    public void clearSubscription() {
        this.subscription = Map.of();
        touch();
    }

    /**
     * Move to CLOSED and drop anything still queued.
     *
     * @return true for the call that performed the transition
     */
    public boolean markClosed() {
        if (state.getAndSet(ConnectionState.CLOSED) == ConnectionState.CLOSED) {
            return false;
        }
        int dropped = 0;
        while (outbound.poll() != null) {
            dropped++;
        }
        backlog.addAndGet(-dropped);
        return true;
    }

    /**
     * Close the underlying transport. Only the registry calls this, after {@link #markClosed()}.
     */
    public void closeTransport(int code, String reason) {
        if (sink.isOpen()) {
            sink.close(code, reason);
        }
    }

    /**
     * Queue a text frame for delivery.
     */
    public OfferResult offer(String frame) {
        Objects.requireNonNull(frame, "frame");
        if (state.get() == ConnectionState.CLOSED) {
            return OfferResult.CLOSED;
        }
        if (backlog.incrementAndGet() > outboundLimit) {
            backlog.decrementAndGet();
            return OfferResult.OVERFLOW;
        }
        outbound.add(frame);
        drain();
        return state.get() == ConnectionState.CLOSED ? OfferResult.FAILED : OfferResult.ACCEPTED;
    }

    private void drain() {
        if (!writing.compareAndSet(false, true)) {
            return;
        }
        while (true) {
            String next = outbound.poll();
            if (next == null) {
                writing.set(false);
                // a producer may have queued between poll() and set(false)
                if (outbound.isEmpty() || !writing.compareAndSet(false, true)) {
                    return;
                }
                continue;
            }
            if (!write(next)) {
                return;
            }
        }
    }

    /**
     * Hand one frame to the sink.
     *
     * @return true if the write completed before the sink returned and the caller still
     *         owns the writer; false if completion is pending or the write failed
     */
    private boolean write(String frame) {
        if (state.get() == ConnectionState.CLOSED) {
            backlog.decrementAndGet();
            return true;
        }
        Write write = new Write();
        try {
            sink.send(frame, write);
        } catch (RuntimeException e) {
            backlog.decrementAndGet();
            writing.set(false);
            fail(e);
            return false;
        }
        return write.afterSend();
    }

    private void fail(Throwable error) {
        markClosed();
        failureListener.onDeliveryFailure(this, error);
    }

    /**
     * Completion of one frame. Inline completion returns control to the drain loop
     * instead of recursing, so a sink that completes synchronously does not grow the stack.
     */
    private final class Write implements MessageSink.SendCallback {
        private static final int IN_SEND = 0;
        private static final int PENDING = 1;
        private static final int DONE_INLINE = 2;
        private static final int FAILED_INLINE = 3;

        private final AtomicInteger phase = new AtomicInteger(IN_SEND);

        @Override
        public void onComplete() {
            backlog.decrementAndGet();
            if (phase.compareAndSet(IN_SEND, DONE_INLINE)) {
                return;
            }
            writing.set(false);
            drain();
        }

        @Override
        public void onFailure(Throwable error) {
            backlog.decrementAndGet();
            if (!phase.compareAndSet(IN_SEND, FAILED_INLINE)) {
                writing.set(false);
            }
            fail(error);
        }

        boolean afterSend() {
            if (phase.compareAndSet(IN_SEND, PENDING)) {
                return false;
            }
            if (phase.get() == DONE_INLINE) {
                return true;
            }
            writing.set(false);
            return false;
        }
    }

    @Override
    public String toString() {
        return "Connection{id=" + id + ", user=" + identity.userId() + ", state=" + state.get() + "}";
    }
}
