package natter.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for chat WebSocket connections.
 *
 * <p>Configuration prefix: {@code natter.websocket}
 *
 * <p>All limits are per process; connections are never shared across instances.
 */
@ConfigMapping(prefix = "natter.websocket")
public interface WebSocketConfig {

    /**
     * Path the chat WebSocket is served on.
     *
     * @return endpoint path (default: /api/v1/ws/chat)
     */
    @WithDefault("/api/v1/ws/chat")
    String path();

    /**
     * Maximum concurrent chat connections on this instance.
     *
     * <p>A soft cap: the count is checked before the upgrade and the session is
     * registered once the handshake completes, so the limit can be briefly exceeded
     * by the number of upgrades in flight.
     *
     * @return max connections (default: 10000)
     */
    @WithDefault("10000")
    int maxConnections();

    /**
     * Deadline for writing one envelope to one recipient.
     *
     * <p>A recipient that does not accept the frame in time misses that message;
     * other recipients are unaffected.
     *
     * @return send timeout (default: 5 seconds)
     */
    @WithDefault("PT5S")
    Duration sendTimeout();

    /**
     * Close the connection if the client sends nothing for this long.
     *
     * @return idle duration (default: 30 minutes)
     */
    @WithDefault("PT30M")
    Duration idleTimeout();

    /**
     * Maximum connection lifetime regardless of activity.
     *
     * @return max lifetime (default: 24 hours)
     */
    @WithDefault("PT24H")
    Duration maxLifetime();

    /**
     * Ping/pong heartbeat configuration.
     */
    PingConfig ping();

    interface PingConfig {

        /**
         * Send pings to detect dead peers.
         *
         * @return true if pings are enabled (default: true)
         */
        @WithDefault("true")
        boolean enabled();

        @WithDefault("PT30S")
        Duration interval();

        /**
         * Close the connection if no pong arrives within this time.
         *
         * @return pong timeout (default: 10 seconds)
         */
        @WithDefault("PT10S")
        Duration timeout();
    }
}
