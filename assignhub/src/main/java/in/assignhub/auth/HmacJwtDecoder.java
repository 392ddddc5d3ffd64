package in.assignhub.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;

/**
 * HS256 JWT verification.
 *
 * Tokens are issued by the login flow with claims {@code user_id}, {@code email},
 * {@code role} and {@code exp} (epoch seconds). {@code sub} is accepted when
 * {@code user_id} is absent.
 */
public final class HmacJwtDecoder implements TokenDecoder {
    private static final Logger log = LoggerFactory.getLogger(HmacJwtDecoder.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String HMAC_SHA256 = "HmacSHA256";

    private final SecretKeySpec key;
    private final Clock clock;

    public HmacJwtDecoder(String secret) {
        this(secret, Clock.systemUTC());
    }

    public HmacJwtDecoder(String secret, Clock clock) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("JWT secret must not be empty");
        }
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_SHA256);
        this.clock = clock;
    }

    @Override
    public TokenClaims decode(String token) throws InvalidTokenException {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Empty token");
        }

        String[] parts = token.split("\\.", -1);
        if (parts.length != 3) {
            throw new InvalidTokenException("Malformed token: expected 3 segments, got " + parts.length);
        }

        JsonNode header = readSegment(parts[0], "header");
        if (!"HS256".equals(header.path("alg").asText())) {
            throw new InvalidTokenException("Unsupported algorithm: " + header.path("alg").asText("<none>"));
        }

        byte[] expected = sign(parts[0] + "." + parts[1]);
        byte[] actual;
        try {
            actual = Base64.getUrlDecoder().decode(parts[2]);
        } catch (IllegalArgumentException e) {
            throw new InvalidTokenException("Malformed signature encoding", e);
        }
        if (!MessageDigest.isEqual(expected, actual)) {
            throw new InvalidTokenException("Invalid signature");
        }

        JsonNode payload = readSegment(parts[1], "payload");

        JsonNode exp = payload.get("exp");
        if (exp == null || !exp.canConvertToLong()) {
            throw new InvalidTokenException("Missing or non-numeric 'exp' claim");
        }
        Instant expiresAt = Instant.ofEpochSecond(exp.asLong());

        JsonNode userIdNode = payload.has("user_id") ? payload.get("user_id") : payload.get("sub");
        long userId;
        if (userIdNode != null && userIdNode.canConvertToLong()) {
            userId = userIdNode.asLong();
        } else if (userIdNode != null && userIdNode.isTextual()) {
            try {
                userId = Long.parseLong(userIdNode.asText());
            } catch (NumberFormatException e) {
                throw new InvalidTokenException("Non-numeric user id claim", e);
            }
        } else {
            throw new InvalidTokenException("Missing 'user_id' claim");
        }

        TokenClaims claims = new TokenClaims(
            userId,
            payload.path("email").asText(""),
            payload.path("role").asText(""),
            expiresAt
        );

        if (claims.isExpiredAt(clock.instant())) {
            throw new InvalidTokenException("Token expired at " + expiresAt);
        }

        log.debug("Token verified for user {}", userId);
        return claims;
    }

    private JsonNode readSegment(String segment, String name) throws InvalidTokenException {
        try {
            byte[] json = Base64.getUrlDecoder().decode(segment);
            JsonNode node = MAPPER.readTree(json);
            if (node == null || !node.isObject()) {
                throw new InvalidTokenException("Token " + name + " is not a JSON object");
            }
            return node;
        } catch (IllegalArgumentException | IOException e) {
            throw new InvalidTokenException("Malformed token " + name, e);
        }
    }

    private byte[] sign(String data) {
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(key);
            return mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }
}
