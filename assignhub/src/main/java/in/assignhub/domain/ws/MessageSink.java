package in.assignhub.domain.ws;

/**
 * Send side of one client transport.
 *
 * <p>Implementations are not required to be thread-safe for {@link #send}; the owning
 * {@link Connection} guarantees a single frame in flight at a time.
 */
public interface MessageSink {

    /**
     * Write one text frame. Completion or failure is reported through the callback,
     * possibly on another thread and possibly before this method returns.
     */
    void send(String text, SendCallback callback);

    /**
     * Start the close handshake with the given status code. No-op if already closing.
     */
    void close(int code, String reason);

    boolean isOpen();

    String remoteAddress();

    interface SendCallback {
        void onComplete();

        void onFailure(Throwable error);
    }
}
