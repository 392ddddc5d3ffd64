package in.assignhub.auth;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;

/**
 * Mints HS256 tokens shaped like the ones the login flow issues.
 */
public final class TestTokens {

    public static final String SECRET = "test-secret-for-gateway";
    public static final String HS256_HEADER = "{\"alg\":\"HS256\",\"typ\":\"JWT\"}";

    public static String valid(long userId) {
        return token(userId, "user" + userId + "@example.com", "operator", Instant.now().plusSeconds(3600));
    }

    public static String token(long userId, String email, String role, Instant expiresAt) {
        String payload = String.format(
            "{\"user_id\":%d,\"email\":\"%s\",\"role\":\"%s\",\"exp\":%d}",
            userId, email, role, expiresAt.getEpochSecond());
        return sign(SECRET, HS256_HEADER, payload);
    }

    public static String sign(String secret, String headerJson, String payloadJson) {
        String header = encode(headerJson);
        String payload = encode(payloadJson);
        return header + "." + payload + "." + signature(secret, header + "." + payload);
    }

    private static String signature(String secret, String data) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return Base64.getUrlEncoder().withoutPadding()
                .encodeToString(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private static String encode(String json) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(json.getBytes(StandardCharsets.UTF_8));
    }

    private TestTokens() {}
}
