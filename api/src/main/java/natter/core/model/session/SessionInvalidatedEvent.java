package natter.core.model.session;

/**
 * Event fired when a session token is invalidated (logout).
 *
 * <p>Chat connections admitted with the token observe this event and close.
 *
 * @param sessionToken the invalidated token
 */
public record SessionInvalidatedEvent(String sessionToken) {

    /**
     * Check whether a connection admitted with {@code token} is affected.
     *
     * @param token token the connection authenticated with
     * @return true if the connection must close
     */
    public boolean appliesTo(String token) {
        return sessionToken != null && sessionToken.equals(token);
    }
}
