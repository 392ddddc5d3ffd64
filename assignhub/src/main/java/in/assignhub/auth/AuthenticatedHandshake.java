package in.assignhub.auth;

import in.assignhub.domain.user.Identity;

/**
 * Successful authentication: who connected and through which channel.
 */
public record AuthenticatedHandshake(Identity identity, TokenChannel channel) {
}
