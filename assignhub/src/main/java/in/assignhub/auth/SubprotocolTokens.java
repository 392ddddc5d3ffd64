package in.assignhub.auth;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Token lookup in the {@code Sec-WebSocket-Protocol} header.
 *
 * <p>Browsers cannot set an Authorization header on a WebSocket, so clients offer the
 * token as a subprotocol element: {@code Bearer.<jwt>}. The marker is matched
 * case-insensitively and an element carrying it always wins.
 *
 * <p>Bare-token heuristic: when no element carries the marker, the first element longer
 * than {@value #BARE_TOKEN_MIN_LENGTH_EXCLUSIVE} characters that contains a
 * {@value #BARE_TOKEN_SEPARATOR} is taken as the token itself. This can mistake an
 * ordinary protocol name for a token; it is kept for existing clients and can be turned
 * off with {@code WS_ACCEPT_BARE_TOKEN=false}.
 */
public final class SubprotocolTokens {

    public static final String BEARER_MARKER = "bearer.";
    public static final int BARE_TOKEN_MIN_LENGTH_EXCLUSIVE = 20;
    public static final char BARE_TOKEN_SEPARATOR = '.';

    /**
     * A token found in the header, with the element it came from (echoed back on the handshake).
     */
    public record Match(String element, String token, TokenChannel channel) {
    }

    public static Optional<Match> find(String header, boolean acceptBare) {
        if (header == null || header.isBlank()) {
            return Optional.empty();
        }
        return find(header.split(","), acceptBare);
    }

    public static Optional<Match> find(String[] elements, boolean acceptBare) {
        if (elements == null || elements.length == 0) {
            return Optional.empty();
        }
        String[] parts = Arrays.stream(elements)
            .map(String::trim)
            .filter(p -> !p.isEmpty())
            .toArray(String[]::new);

        for (String part : parts) {
            if (part.toLowerCase(Locale.ROOT).startsWith(BEARER_MARKER)) {
                String token = part.substring(BEARER_MARKER.length());
                if (token.isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(new Match(part, token, TokenChannel.SUBPROTOCOL_BEARER));
            }
        }

        if (acceptBare) {
            for (String part : parts) {
                if (looksLikeBareToken(part)) {
                    return Optional.of(new Match(part, part, TokenChannel.SUBPROTOCOL_BARE));
                }
            }
        }
        return Optional.empty();
    }

    static boolean looksLikeBareToken(String element) {
        return element.length() > BARE_TOKEN_MIN_LENGTH_EXCLUSIVE
            && element.indexOf(BARE_TOKEN_SEPARATOR) >= 0;
    }

    private SubprotocolTokens() {}
}
