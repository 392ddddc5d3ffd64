package in.assignhub.auth;

import java.util.Optional;

/**
 * The parts of a WebSocket upgrade request that authentication looks at.
 */
public interface HandshakeRequest {

    /**
     * Raw {@code Sec-WebSocket-Protocol} header value, or null.
     */
    String subprotocolHeader();

    Optional<String> queryParameter(String name);

    String remoteAddress();
}
