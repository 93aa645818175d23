package natter.core.model.chat;

/**
 * Result of resolving a connection's session token.
 */
public sealed interface IdentityResolution {

    /**
     * Token is valid; the connection may be admitted with this identity.
     */
    record Resolved(ChatIdentity identity) implements IdentityResolution {}

    /**
     * Token missing, expired or unknown. Never retried.
     */
    record Unauthenticated(String reason) implements IdentityResolution {}

    /**
     * The session store could not be reached, so the token could not be checked.
     */
    record Unavailable(String reason) implements IdentityResolution {}
}
