package in.assignhub.domain.user;

import java.util.Objects;

/**
 * Authenticated user behind a connection. Fixed at connect time.
 */
public record Identity(long userId, String email, String role) {
    public Identity {
        Objects.requireNonNull(email, "email");
        Objects.requireNonNull(role, "role");
    }
}
