package natter.adapter.out.storage.memory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import natter.core.port.out.IdentityProvider;
import natter.core.port.out.SessionStore;
import natter.spi.ChatStorageProvider;

/**
 * In-memory chat storage provider.
 *
 * <p>This provider is always available and serves as a fallback when
 * Redis is unavailable.
 *
 * <p><strong>Warning:</strong> sessions and accounts are per instance. Not
 * recommended for production.
 */
@ApplicationScoped
public class InMemoryStorageProvider implements ChatStorageProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryStorageProvider.class);
    private static final int PRIORITY = 0;

    private final AtomicBoolean warningLogged = new AtomicBoolean(false);
    private InMemorySessionStore sessionStore;
    private InMemoryIdentityProvider identityProvider;

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public synchronized SessionStore createSessionStore() {
        warnOnce();
        if (sessionStore == null) {
            sessionStore = new InMemorySessionStore();
        }
        return sessionStore;
    }

    @Override
    public synchronized IdentityProvider createIdentityProvider() {
        warnOnce();
        if (identityProvider == null) {
            identityProvider = new InMemoryIdentityProvider();
        }
        return identityProvider;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        return Optional.of(HealthCheckResponse.named("chat-storage-memory")
                .up()
                .withData("type", "in-memory")
                .withData("sessions", sessionStore != null ? sessionStore.getSessionCount() : 0)
                .withData("accounts", identityProvider != null ? identityProvider.getAccountCount() : 0)
                .build());
    }

    @PreDestroy
    synchronized void shutdown() {
        if (sessionStore != null) {
            sessionStore.shutdown();
        }
    }

    private void warnOnce() {
        if (warningLogged.compareAndSet(false, true)) {
            LOG.warn("========================================================================");
            LOG.warn("  WARNING: Chat storage is in-memory only!");
            LOG.warn("  Sessions and accounts are not shared between natter instances.");
            LOG.warn("  Configure Redis (natter.session.storage.provider=redis) for production.");
            LOG.warn("========================================================================");
        }
    }
}
