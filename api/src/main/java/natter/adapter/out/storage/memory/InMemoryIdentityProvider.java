package natter.adapter.out.storage.memory;

import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;

import natter.core.model.auth.UserAccount;
import natter.core.port.in.AccountManagement.AccountExistsException;
import natter.core.port.out.IdentityProvider;
import natter.core.util.PasswordHasher;

/**
 * In-memory implementation of IdentityProvider, keyed by lower-cased email.
 *
 * <p>For development and testing only; accounts are lost on restart.
 */
public class InMemoryIdentityProvider implements IdentityProvider {

    private final ConcurrentMap<String, UserAccount> accounts = new ConcurrentHashMap<>();

    @Override
    public Uni<UserAccount> createAccount(String email, String password) {
        final var normalized = normalize(email);
        return Uni.createFrom()
                .item(() -> {
                    final var account = new UserAccount(
                            UUID.randomUUID().toString(), normalized, PasswordHasher.hash(password), Instant.now());
                    if (accounts.putIfAbsent(normalized, account) != null) {
                        throw new AccountExistsException(normalized);
                    }
                    return account;
                })
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }

    @Override
    public Uni<Optional<UserAccount>> lookupByEmail(String email) {
        return Uni.createFrom().item(() -> Optional.ofNullable(accounts.get(normalize(email))));
    }

    public int getAccountCount() {
        return accounts.size();
    }

    private static String normalize(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
