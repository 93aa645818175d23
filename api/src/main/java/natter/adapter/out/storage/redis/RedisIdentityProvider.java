package natter.adapter.out.storage.redis;

import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import natter.core.config.SessionConfig;
import natter.core.model.auth.UserAccount;
import natter.core.port.in.AccountManagement.AccountExistsException;
import natter.core.port.out.IdentityProvider;
import natter.core.util.PasswordHasher;

/**
 * Redis implementation of IdentityProvider.
 *
 * <p>Accounts are stored as JSON under {@code <account-prefix><lower-cased email>}.
 * Creation uses SET NX so two registrations for the same email cannot both succeed.
 */
public class RedisIdentityProvider implements IdentityProvider {

    private static final Logger LOG = Logger.getLogger(RedisIdentityProvider.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveValueCommands<String, String> valueCommands;
    private final String accountPrefix;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisIdentityProvider(
            ReactiveRedisDataSource redisDataSource, SessionConfig config, RedisTimeoutHelper timeoutHelper) {
        this.redisDataSource = redisDataSource;
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.accountPrefix = config.storage().redis().accountPrefix();
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public Uni<UserAccount> createAccount(String email, String password) {
        final var normalized = normalize(email);
        return Uni.createFrom()
                .item(() -> new UserAccount(
                        UUID.randomUUID().toString(), normalized, PasswordHasher.hash(password), Instant.now()))
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool())
                .flatMap(account -> timeoutHelper
                        .withTimeout(
                                redisDataSource.execute("SET", accountPrefix + normalized, serialize(account), "NX"),
                                "createAccount")
                        .flatMap(reply -> {
                            if (reply == null) {
                                LOG.debugf("Account already exists in Redis: %s", normalized);
                                return Uni.createFrom().<UserAccount>failure(new AccountExistsException(normalized));
                            }
                            return Uni.createFrom().item(account);
                        }));
    }

    @Override
    public Uni<Optional<UserAccount>> lookupByEmail(String email) {
        return timeoutHelper
                .withTimeout(valueCommands.get(accountPrefix + normalize(email)), "lookupByEmail")
                .map(value -> Optional.ofNullable(value).map(RedisIdentityProvider::deserialize));
    }

    private static String normalize(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }

    static String serialize(UserAccount account) {
        try {
            return OBJECT_MAPPER.writeValueAsString(account);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize account", e);
        }
    }

    static UserAccount deserialize(String json) {
        try {
            return OBJECT_MAPPER.readValue(json, UserAccount.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize account", e);
        }
    }
}
