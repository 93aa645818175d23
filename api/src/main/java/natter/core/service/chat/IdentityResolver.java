package natter.core.service.chat;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import natter.core.model.chat.ChatIdentity;
import natter.core.model.chat.IdentityResolution;
import natter.core.port.out.SessionStore;
import natter.core.service.auth.SessionTokenGenerator;

/**
 * Resolves the session token presented on a chat upgrade into a chat identity.
 *
 * <p>A missing or unknown token is {@link IdentityResolution.Unauthenticated}; a
 * session store failure is {@link IdentityResolution.Unavailable}. The display
 * name falls back to the user ID when none is stored.
 */
@ApplicationScoped
public class IdentityResolver {

    private static final Logger LOG = Logger.getLogger(IdentityResolver.class);

    private final SessionStore sessionStore;

    @Inject
    public IdentityResolver(SessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    public Uni<IdentityResolution> resolve(Optional<String> token) {
        if (token.isEmpty() || token.get().isBlank()) {
            return Uni.createFrom().item(new IdentityResolution.Unauthenticated("Missing session token"));
        }
        final var sessionToken = token.get();
        return sessionStore
                .findUserId(sessionToken)
                .flatMap(userId -> {
                    if (userId.isEmpty()) {
                        LOG.debugv("Session {0} not found", SessionTokenGenerator.abbreviate(sessionToken));
                        return Uni.createFrom()
                                .item((IdentityResolution)
                                        new IdentityResolution.Unauthenticated("Invalid or expired session"));
                    }
                    return sessionStore
                            .findDisplayName(userId.get())
                            .map(name -> (IdentityResolution)
                                    new IdentityResolution.Resolved(ChatIdentity.of(userId.get(), name)));
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(error, "Session store unavailable while resolving session");
                    return new IdentityResolution.Unavailable("Session store unavailable");
                });
    }
}
