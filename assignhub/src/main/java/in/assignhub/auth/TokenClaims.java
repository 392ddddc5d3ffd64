package in.assignhub.auth;

import in.assignhub.domain.user.Identity;

import java.time.Instant;

/**
 * Decoded access-token claims.
 */
public record TokenClaims(
    long userId,
    String email,
    String role,
    Instant expiresAt
) {
    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public Identity toIdentity() {
        return new Identity(userId, email, role);
    }
}
