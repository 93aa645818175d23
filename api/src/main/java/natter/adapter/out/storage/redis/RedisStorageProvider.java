package natter.adapter.out.storage.redis;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import natter.core.config.SessionConfig;
import natter.core.port.out.IdentityProvider;
import natter.core.port.out.Metrics;
import natter.core.port.out.SessionStore;
import natter.spi.ChatStorageProvider;

/**
 * Redis-based chat storage provider.
 *
 * <p>This is the recommended provider for production deployments.
 * Sessions are persisted in Redis with automatic TTL expiration.
 */
@ApplicationScoped
public class RedisStorageProvider implements ChatStorageProvider {

    private static final Logger LOG = Logger.getLogger(RedisStorageProvider.class);
    private static final int PRIORITY = 100;

    private final ReactiveRedisDataSource redisDataSource;
    private final SessionConfig sessionConfig;
    private final Metrics metrics;

    private RedisSessionStore sessionStore;
    private RedisIdentityProvider identityProvider;
    private final AtomicBoolean available = new AtomicBoolean(false);
    private final CountDownLatch checkLatch = new CountDownLatch(1);

    @Inject
    public RedisStorageProvider(ReactiveRedisDataSource redisDataSource, SessionConfig sessionConfig, Metrics metrics) {
        this.redisDataSource = redisDataSource;
        this.sessionConfig = sessionConfig;
        this.metrics = metrics;
    }

    @PostConstruct
    void checkAvailability() {
        redisDataSource
                .key(String.class)
                .exists("natter:test-connection")
                .ifNoItem()
                .after(Duration.ofSeconds(5))
                .fail()
                .subscribe()
                .with(
                        result -> {
                            available.set(true);
                            checkLatch.countDown();
                            LOG.info("Redis chat storage is available");
                        },
                        error -> {
                            available.set(false);
                            checkLatch.countDown();
                            LOG.warnf("Redis chat storage is not available: %s", error.getMessage());
                        });
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        try {
            if (!checkLatch.await(6, TimeUnit.SECONDS)) {
                LOG.warn("Redis availability check timed out");
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        return available.get();
    }

    @Override
    public synchronized SessionStore createSessionStore() {
        if (sessionStore == null) {
            sessionStore = new RedisSessionStore(redisDataSource, sessionConfig, timeoutHelper("sessions"));
            LOG.info("Created Redis session store with prefix: "
                    + sessionConfig.storage().redis().keyPrefix());
        }
        return sessionStore;
    }

    @Override
    public synchronized IdentityProvider createIdentityProvider() {
        if (identityProvider == null) {
            identityProvider = new RedisIdentityProvider(redisDataSource, sessionConfig, timeoutHelper("accounts"));
        }
        return identityProvider;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        // Cached state; health checks must not block
        if (available.get()) {
            return Optional.of(HealthCheckResponse.named("chat-storage-redis")
                    .up()
                    .withData("type", "redis")
                    .withData("keyPrefix", sessionConfig.storage().redis().keyPrefix())
                    .build());
        }
        return Optional.of(HealthCheckResponse.named("chat-storage-redis")
                .down()
                .withData("type", "redis")
                .withData("error", "Redis not available or check not completed")
                .build());
    }

    private RedisTimeoutHelper timeoutHelper(String repositoryName) {
        return new RedisTimeoutHelper(sessionConfig.storage().redis().timeout(), metrics, repositoryName);
    }
}
