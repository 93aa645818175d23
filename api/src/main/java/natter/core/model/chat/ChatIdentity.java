package natter.core.model.chat;

import java.util.Optional;

/**
 * Identity a chat connection was admitted with.
 *
 * @param userId      stable user identifier from the session store
 * @param displayName name rendered in front of every message the user sends
 */
public record ChatIdentity(String userId, String displayName) {

    /**
     * Identity used when a broadcast's sender is no longer registered.
     */
    public static final ChatIdentity UNKNOWN = new ChatIdentity("unknown", "unknown");

    public ChatIdentity {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId cannot be null or blank");
        }
        if (displayName == null || displayName.isBlank()) {
            displayName = userId;
        }
    }

    /**
     * Create an identity whose display name falls back to the user ID.
     *
     * @param userId      user identifier
     * @param displayName resolved display name, if any
     * @return the identity
     */
    public static ChatIdentity of(String userId, Optional<String> displayName) {
        return new ChatIdentity(userId, displayName.orElse(userId));
    }
}
