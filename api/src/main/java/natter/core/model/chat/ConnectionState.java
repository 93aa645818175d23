package natter.core.model.chat;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a single chat connection.
 *
 * <pre>
 * CONNECTING -> AUTHENTICATING -> OPEN -> CLOSING -> CLOSED
 *                     \______________________/^
 * </pre>
 *
 * <p>Any non-terminal state may move to {@link #CLOSING}; only {@link #AUTHENTICATING}
 * may move to {@link #OPEN}.
 */
public enum ConnectionState {
    CONNECTING,
    AUTHENTICATING,
    OPEN,
    CLOSING,
    CLOSED;

    /**
     * Check whether moving from this state to {@code next} is a legal transition.
     *
     * @param next the target state
     * @return true if the transition is allowed
     */
    public boolean canTransitionTo(ConnectionState next) {
        return successors().contains(next);
    }

    /**
     * Whether the connection is on its way out or gone.
     */
    public boolean isTerminating() {
        return this == CLOSING || this == CLOSED;
    }

    private Set<ConnectionState> successors() {
        return switch (this) {
            case CONNECTING -> EnumSet.of(AUTHENTICATING, CLOSING);
            case AUTHENTICATING -> EnumSet.of(OPEN, CLOSING);
            case OPEN -> EnumSet.of(CLOSING);
            case CLOSING -> EnumSet.of(CLOSED);
            case CLOSED -> EnumSet.noneOf(ConnectionState.class);
        };
    }
}
