package natter.adapter.out.storage.redis;

import java.time.Duration;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import natter.core.config.SessionConfig;
import natter.core.port.out.SessionStore;
import natter.core.service.auth.SessionTokenGenerator;

/**
 * Redis implementation of SessionStore.
 *
 * <p>A session is a plain string key {@code <key-prefix><token>} holding the user ID,
 * expired by Redis TTL. Display names live under {@code <display-name-prefix><userId>}
 * without expiry.
 */
public class RedisSessionStore implements SessionStore {

    private static final Logger LOG = Logger.getLogger(RedisSessionStore.class);

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final String keyPrefix;
    private final String displayNamePrefix;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisSessionStore(
            ReactiveRedisDataSource redisDataSource, SessionConfig config, RedisTimeoutHelper timeoutHelper) {
        this.redisDataSource = redisDataSource;
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.keyPrefix = config.storage().redis().keyPrefix();
        this.displayNamePrefix = config.storage().redis().displayNamePrefix();
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public Uni<Boolean> saveIfAbsent(String token, String userId, Duration ttl) {
        // SET NX EX: a null reply means the token already exists
        var operation = redisDataSource.execute(
                "SET", keyPrefix + token, userId, "NX", "EX", String.valueOf(Math.max(1, ttl.toSeconds())));

        return timeoutHelper.withTimeout(operation, "saveIfAbsent").map(reply -> {
            if (reply != null) {
                LOG.debugf("Session stored in Redis: %s", SessionTokenGenerator.abbreviate(token));
                return true;
            }
            LOG.debugf("Session token collision in Redis: %s", SessionTokenGenerator.abbreviate(token));
            return false;
        });
    }

    @Override
    public Uni<Optional<String>> findUserId(String token) {
        return timeoutHelper.withTimeout(valueCommands.get(keyPrefix + token), "findUserId").map(Optional::ofNullable);
    }

    @Override
    public Uni<Void> delete(String token) {
        return timeoutHelper.withTimeout(keyCommands.del(keyPrefix + token), "delete").replaceWithVoid();
    }

    @Override
    public Uni<Void> saveDisplayName(String userId, String displayName) {
        return timeoutHelper.withTimeout(valueCommands.set(displayNamePrefix + userId, displayName), "saveDisplayName");
    }

    @Override
    public Uni<Optional<String>> findDisplayName(String userId) {
        return timeoutHelper
                .withTimeoutGraceful(valueCommands.get(displayNamePrefix + userId), "findDisplayName")
                .map(name -> name.filter(n -> !n.isBlank()));
    }
}
