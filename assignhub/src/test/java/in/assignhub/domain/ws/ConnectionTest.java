package in.assignhub.domain.ws;

import in.assignhub.domain.user.Identity;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionTest {

    private static final Identity USER = new Identity(1, "u1@example.com", "operator");

    private final AtomicReference<Throwable> failure = new AtomicReference<>();

    private Connection connection(RecordingSink sink, int limit) {
        Connection c = new Connection("c-1", 1, USER, sink, limit, (conn, error) -> failure.set(error));
        c.activate();
        return c;
    }

    @Test
    void startsConnectingAndActivatesOnce() {
        Connection c = new Connection("c-1", 1, USER, new RecordingSink(), 4, (conn, e) -> {});

        assertEquals(ConnectionState.CONNECTING, c.state());
        assertTrue(c.activate());
        assertFalse(c.activate());
        assertEquals(ConnectionState.ACTIVE, c.state());
        assertTrue(c.subscription().isEmpty());
    }

    @Test
    void framesLeaveInOfferOrder() {
        RecordingSink sink = new RecordingSink();
        Connection c = connection(sink, 16);

        for (int i = 0; i < 10; i++) {
            assertEquals(Connection.OfferResult.ACCEPTED, c.offer("m" + i));
        }

        List<String> expected = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            expected.add("m" + i);
        }
        assertEquals(expected, sink.sent());
        assertEquals(0, c.backlog());
    }

    @Test
    void onlyOneWriteInFlight() {
        RecordingSink sink = new RecordingSink().holdWrites(true);
        Connection c = connection(sink, 16);

        c.offer("a");
        c.offer("b");
        c.offer("c");

        assertEquals(1, sink.heldCount(), "second frame must wait for the first to complete");
        assertEquals(3, c.backlog());

        sink.releaseOne();
        assertEquals(List.of("a"), sink.sent());
        assertEquals(1, sink.heldCount());

        sink.releaseAll();
        assertEquals(List.of("a", "b", "c"), sink.sent());
        assertEquals(0, c.backlog());
    }

    @Test
    void overflowWhenBacklogFull() {
        RecordingSink sink = new RecordingSink().holdWrites(true);
        Connection c = connection(sink, 2);

        assertEquals(Connection.OfferResult.ACCEPTED, c.offer("a"));
        assertEquals(Connection.OfferResult.ACCEPTED, c.offer("b"));
        assertEquals(Connection.OfferResult.OVERFLOW, c.offer("c"));
        assertEquals(2, c.backlog());

        sink.releaseAll();
        assertEquals(Connection.OfferResult.ACCEPTED, c.offer("d"));
        assertEquals(List.of("a", "b", "d"), sink.sent());
    }

    @Test
    void closedConnectionRefusesAndDropsQueue() {
        RecordingSink sink = new RecordingSink().holdWrites(true);
        Connection c = connection(sink, 8);
        c.offer("a");
        c.offer("b");

        assertTrue(c.markClosed());
        assertFalse(c.markClosed());
        assertEquals(ConnectionState.CLOSED, c.state());
        assertEquals(Connection.OfferResult.CLOSED, c.offer("c"));

        sink.releaseAll();
        assertEquals(List.of("a"), sink.sent(), "queued frames are dropped on close");
        assertEquals(0, c.backlog());
    }

    @Test
    void asyncSendFailureIsReported() {
        IllegalStateException boom = new IllegalStateException("broken pipe");
        RecordingSink sink = new RecordingSink().failOnSend(boom);
        Connection c = connection(sink, 8);

        assertEquals(Connection.OfferResult.FAILED, c.offer("a"));

        assertSame(boom, failure.get());
        assertEquals(0, c.backlog());
        assertEquals(ConnectionState.CLOSED, c.state());
    }

    @Test
    void synchronousSendExceptionIsReported() {
        RecordingSink sink = new RecordingSink().throwOnSend(new IllegalStateException("channel closed"));
        Connection c = connection(sink, 8);

        assertEquals(Connection.OfferResult.FAILED, c.offer("a"));
        assertEquals("channel closed", failure.get().getMessage());
        assertEquals(ConnectionState.CLOSED, c.state());
        assertEquals(Connection.OfferResult.CLOSED, c.offer("b"));
    }

    @Test
    void failedFollowUpWriteClosesConnection() {
        RecordingSink sink = new RecordingSink().holdWrites(true);
        Connection c = connection(sink, 8);
        assertEquals(Connection.OfferResult.ACCEPTED, c.offer("a"));
        c.offer("b");

        sink.failOnSend(new IllegalStateException("reset"));
        sink.releaseOne();

        assertEquals(List.of("a"), sink.sent());
        assertEquals("reset", failure.get().getMessage());
        assertEquals(ConnectionState.CLOSED, c.state());
        assertEquals(0, c.backlog());
    }

    @Test
    void subscriptionReplacedWholesale() {
        Connection c = connection(new RecordingSink(), 8);

        c.replaceSubscription(Map.of("direction", "IB", "ramp_id", "4"));
        c.replaceSubscription(Map.of("direction", "OB"));
        assertEquals(Map.of("direction", "OB"), c.subscription());

        c.clearSubscription();
        assertTrue(c.subscription().isEmpty());
    }

    @Test
    void concurrentWritersNeverOverlap() throws Exception {
        RecordingSink sink = new RecordingSink();
        Connection c = connection(sink, 100_000);
        int threads = 8;
        int perThread = 500;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        for (int t = 0; t < threads; t++) {
            int id = t;
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    c.offer(id + ":" + i);
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(threads * perThread, sink.sent().size());
        assertEquals(1, sink.maxConcurrentWrites());
        assertEquals(0, c.backlog());

        // each producer's frames keep their relative order
        int[] last = new int[threads];
        java.util.Arrays.fill(last, -1);
        for (String frame : sink.sent()) {
            String[] parts = frame.split(":");
            int producer = Integer.parseInt(parts[0]);
            int seq = Integer.parseInt(parts[1]);
            assertTrue(seq > last[producer], "out of order for producer " + producer);
            last[producer] = seq;
        }
    }
}
