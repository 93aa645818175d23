package natter.core.port.out;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

/**
 * Outbound port for the session token store.
 *
 * <p>Maps opaque session tokens to user IDs with a time-to-live, and user IDs to
 * display names. Failures to reach the backing store surface as
 * {@link natter.core.model.common.UpstreamUnavailableException}.
 */
public interface SessionStore {

    /**
     * Store a token only if it is not already present.
     *
     * @param token  session token
     * @param userId user the token resolves to
     * @param ttl    time-to-live
     * @return true if stored, false if the token already exists
     */
    Uni<Boolean> saveIfAbsent(String token, String userId, Duration ttl);

    /**
     * Resolve a token to its user ID.
     *
     * @param token session token
     * @return the user ID, or empty if the token is unknown or expired
     */
    Uni<Optional<String>> findUserId(String token);

    /**
     * Forget a token. Deleting an unknown token is a no-op.
     *
     * @param token session token
     * @return Uni completing when deleted
     */
    Uni<Void> delete(String token);

    /**
     * Store the display name for a user.
     *
     * @param userId      user identifier
     * @param displayName display name
     * @return Uni completing when stored
     */
    Uni<Void> saveDisplayName(String userId, String displayName);

    /**
     * Look up the display name for a user.
     *
     * @param userId user identifier
     * @return the display name, or empty if none is stored
     */
    Uni<Optional<String>> findDisplayName(String userId);
}
