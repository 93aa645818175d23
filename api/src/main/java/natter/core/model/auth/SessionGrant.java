package natter.core.model.auth;

import java.time.Instant;

/**
 * Session token handed to a client after a successful login.
 *
 * @param token     opaque session token
 * @param userId    user the token resolves to
 * @param expiresAt when the session store will forget the token
 */
public record SessionGrant(String token, String userId, Instant expiresAt) {}
