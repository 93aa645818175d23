package natter.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for session tokens and their storage.
 *
 * <p>Configuration prefix: {@code natter.session}
 */
@ConfigMapping(prefix = "natter.session")
public interface SessionConfig {

    /**
     * Session token time-to-live.
     *
     * @return TTL (default: 24 hours)
     */
    @WithDefault("PT24H")
    Duration ttl();

    /**
     * Query parameter carrying the token on the WebSocket upgrade request.
     *
     * @return parameter name (default: token)
     */
    @WithDefault("token")
    String tokenQueryParameter();

    /**
     * Header carrying the token when no query parameter is present.
     *
     * @return header name (default: X-Session-Token)
     */
    @WithDefault("X-Session-Token")
    String tokenHeader();

    IdGenerationConfig idGeneration();

    StorageConfig storage();

    interface IdGenerationConfig {

        /**
         * Maximum attempts to store a freshly generated token before giving up.
         *
         * @return max retries (default: 3)
         */
        @WithDefault("3")
        int maxRetries();
    }

    interface StorageConfig {

        /**
         * Storage provider name.
         *
         * <p>Built-in providers: redis, memory.
         *
         * @return provider name (default: redis)
         */
        @WithDefault("redis")
        String provider();

        RedisConfig redis();

        interface RedisConfig {

            /**
             * Key prefix for session tokens.
             *
             * @return key prefix (default: session:)
             */
            @WithDefault("session:")
            String keyPrefix();

            /**
             * Key prefix for display names, keyed by user ID.
             *
             * @return key prefix (default: username:)
             */
            @WithDefault("username:")
            String displayNamePrefix();

            /**
             * Key prefix for accounts, keyed by lower-cased email.
             *
             * @return key prefix (default: account:)
             */
            @WithDefault("account:")
            String accountPrefix();

            /**
             * Upper bound for a single Redis operation.
             *
             * @return timeout (default: 2 seconds)
             */
            @WithDefault("PT2S")
            Duration timeout();
        }
    }
}
