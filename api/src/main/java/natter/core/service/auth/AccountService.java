package natter.core.service.auth;

import java.time.Instant;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import natter.core.config.SessionConfig;
import natter.core.model.auth.SessionGrant;
import natter.core.model.auth.UserAccount;
import natter.core.model.session.SessionInvalidatedEvent;
import natter.core.port.in.AccountManagement;
import natter.core.port.out.IdentityProvider;
import natter.core.port.out.SessionStore;
import natter.core.util.PasswordHasher;

/**
 * Implementation of account registration, login and logout.
 *
 * <p>Login issues a random session token and stores it with collision retry.
 * Logout deletes the token and notifies open chat connections admitted with it.
 */
@ApplicationScoped
public class AccountService implements AccountManagement {

    private static final Logger LOG = Logger.getLogger(AccountService.class);

    private final IdentityProvider identityProvider;
    private final SessionStore sessionStore;
    private final SessionTokenGenerator tokenGenerator;
    private final SessionConfig config;
    private final Event<SessionInvalidatedEvent> sessionInvalidatedEvent;

    public AccountService(
            IdentityProvider identityProvider,
            SessionStore sessionStore,
            SessionTokenGenerator tokenGenerator,
            SessionConfig config,
            Event<SessionInvalidatedEvent> sessionInvalidatedEvent) {
        this.identityProvider = identityProvider;
        this.sessionStore = sessionStore;
        this.tokenGenerator = tokenGenerator;
        this.config = config;
        this.sessionInvalidatedEvent = sessionInvalidatedEvent;
    }

    @Override
    public Uni<UserAccount> register(String email, String password, Optional<String> displayName) {
        requireText(email, "email");
        requireText(password, "password");

        return identityProvider.createAccount(email.trim(), password).flatMap(account -> {
            LOG.infof("Account created: %s", account.uid());
            final var name = displayName.map(String::trim).filter(n -> !n.isEmpty());
            if (name.isEmpty()) {
                return Uni.createFrom().item(account);
            }
            return sessionStore.saveDisplayName(account.uid(), name.get()).replaceWith(account);
        });
    }

    @Override
    public Uni<SessionGrant> login(String email, String password) {
        requireText(email, "email");
        requireText(password, "password");

        return identityProvider
                .lookupByEmail(email.trim())
                .emitOn(Infrastructure.getDefaultWorkerPool())
                .map(account -> account.filter(a -> PasswordHasher.matches(password, a.passwordHash())))
                .flatMap(account -> {
                    if (account.isEmpty()) {
                        LOG.debugf("Login rejected for %s", email);
                        return Uni.createFrom().failure(new InvalidCredentialsException());
                    }
                    final var expiresAt = Instant.now().plus(config.ttl());
                    return createSessionWithRetry(account.get().uid(), expiresAt, 0);
                });
    }

    private Uni<SessionGrant> createSessionWithRetry(String userId, Instant expiresAt, int attempt) {
        final var maxRetries = config.idGeneration().maxRetries();

        if (attempt >= maxRetries) {
            return Uni.createFrom()
                    .failure(new SessionCreationException(
                            "Failed to generate unique session token after " + maxRetries + " attempts"));
        }

        final var token = tokenGenerator.generate();
        return sessionStore.saveIfAbsent(token, userId, config.ttl()).flatMap(saved -> {
            if (saved) {
                LOG.infof("Session created: %s for user %s", SessionTokenGenerator.abbreviate(token), userId);
                return Uni.createFrom().item(new SessionGrant(token, userId, expiresAt));
            }

            LOG.warnf("Session token collision detected (attempt %d/%d), retrying", attempt + 1, maxRetries);
            return createSessionWithRetry(userId, expiresAt, attempt + 1);
        });
    }

    @Override
    public Uni<Void> logout(String token) {
        requireText(token, "session_token");

        LOG.infof("Invalidating session: %s", SessionTokenGenerator.abbreviate(token));
        return sessionStore.delete(token).invoke(() -> sessionInvalidatedEvent.fireAsync(new SessionInvalidatedEvent(token)));
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }
}
