package in.assignhub.auth;

import in.assignhub.domain.user.Identity;
import in.assignhub.infrastructure.metrics.GatewayMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuthenticationGateTest {

    private static final String JWT = "header.payload.signature-long-enough";

    @Mock
    private TokenDecoder decoder;
    @Mock
    private GatewayMetrics metrics;

    private AuthenticationGate gate;

    @BeforeEach
    void setUp() {
        gate = new AuthenticationGate(decoder, true, metrics);
    }

    @Test
    void subprotocolBearerTokenYieldsIdentity() throws Exception {
        when(decoder.decode(JWT)).thenReturn(claims(5));

        AuthenticatedHandshake result = gate.authenticate(request("Bearer." + JWT, Map.of()));

        assertEquals(new Identity(5, "u5@example.com", "operator"), result.identity());
        assertEquals(TokenChannel.SUBPROTOCOL_BEARER, result.channel());
        verifyNoInteractions(metrics);
    }

    @Test
    void subprotocolIsPreferredOverQueryParameter() throws Exception {
        when(decoder.decode(JWT)).thenReturn(claims(5));

        gate.authenticate(request("Bearer." + JWT, Map.of("token", "query-token")));

        verify(decoder).decode(JWT);
        verify(decoder, never()).decode("query-token");
    }

    @Test
    void queryParameterIsFallback() throws Exception {
        when(decoder.decode("query-token")).thenReturn(claims(9));

        AuthenticatedHandshake result = gate.authenticate(request(null, Map.of("token", "query-token")));

        assertEquals(9, result.identity().userId());
        assertEquals(TokenChannel.QUERY_PARAMETER, result.channel());
    }

    @Test
    void noTokenIsRejectedWithoutCallingDecoder() throws Exception {
        AuthenticationRejectedException e = assertThrows(AuthenticationRejectedException.class,
            () -> gate.authenticate(request(null, Map.of())));

        assertEquals("10.0.0.1:4000", e.getRemoteAddress());
        verify(decoder, never()).decode(anyString());
        verify(metrics).authRejected("none");
    }

    @Test
    void blankQueryTokenCountsAsMissing() throws Exception {
        assertThrows(AuthenticationRejectedException.class,
            () -> gate.authenticate(request("", Map.of("token", " "))));
        verify(decoder, never()).decode(anyString());
    }

    @Test
    void decoderFailureIsRejection() throws Exception {
        when(decoder.decode(JWT)).thenThrow(new InvalidTokenException("Token expired"));

        AuthenticationRejectedException e = assertThrows(AuthenticationRejectedException.class,
            () -> gate.authenticate(request("Bearer." + JWT, Map.of())));

        assertTrue(e.getMessage().contains("Token expired"));
        assertInstanceOf(InvalidTokenException.class, e.getCause());
        verify(metrics).authRejected("subprotocol_bearer");
    }

    @Test
    void bareTokenOnlyWhenEnabled() throws Exception {
        when(decoder.decode(JWT)).thenReturn(claims(3));
        assertEquals(TokenChannel.SUBPROTOCOL_BARE, gate.authenticate(request(JWT, Map.of())).channel());

        AuthenticationGate strict = new AuthenticationGate(decoder, false, metrics);
        assertThrows(AuthenticationRejectedException.class, () -> strict.authenticate(request(JWT, Map.of())));
    }

    private static TokenClaims claims(long userId) {
        return new TokenClaims(userId, "u" + userId + "@example.com", "operator", Instant.now().plusSeconds(60));
    }

    private static HandshakeRequest request(String subprotocols, Map<String, String> query) {
        return new HandshakeRequest() {
            @Override
            public String subprotocolHeader() {
                return subprotocols;
            }

            @Override
            public Optional<String> queryParameter(String name) {
                return Optional.ofNullable(query.get(name));
            }

            @Override
            public String remoteAddress() {
                return "10.0.0.1:4000";
            }
        };
    }
}
