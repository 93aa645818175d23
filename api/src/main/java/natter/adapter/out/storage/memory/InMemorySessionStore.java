package natter.adapter.out.storage.memory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import natter.core.port.out.SessionStore;
import natter.core.service.auth.SessionTokenGenerator;

/**
 * In-memory implementation of SessionStore.
 *
 * <p>This implementation is intended for development and testing only.
 * Sessions are lost on restart and not shared across instances.
 */
public class InMemorySessionStore implements SessionStore {

    private static final Logger LOG = Logger.getLogger(InMemorySessionStore.class);

    private final ConcurrentMap<String, StoredSession> sessions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> displayNames = new ConcurrentHashMap<>();
    private final ScheduledExecutorService cleanupExecutor;

    public InMemorySessionStore() {
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "session-cleanup");
            t.setDaemon(true);
            return t;
        });

        cleanupExecutor.scheduleAtFixedRate(this::cleanupExpiredSessions, 1, 1, TimeUnit.MINUTES);
    }

    @Override
    public Uni<Boolean> saveIfAbsent(String token, String userId, Duration ttl) {
        return Uni.createFrom().item(() -> {
            final var candidate = new StoredSession(userId, Instant.now().plus(ttl));
            final var stored = sessions.compute(
                    token, (key, existing) -> existing == null || existing.isExpired() ? candidate : existing);
            if (stored == candidate) {
                LOG.debugf("Session stored: %s for user %s", SessionTokenGenerator.abbreviate(token), userId);
                return true;
            }
            LOG.debugf("Session token collision detected: %s", SessionTokenGenerator.abbreviate(token));
            return false;
        });
    }

    @Override
    public Uni<Optional<String>> findUserId(String token) {
        return Uni.createFrom().item(() -> {
            final var session = sessions.get(token);
            if (session == null) {
                return Optional.empty();
            }
            if (session.isExpired()) {
                sessions.remove(token, session);
                return Optional.empty();
            }
            return Optional.of(session.userId());
        });
    }

    @Override
    public Uni<Void> delete(String token) {
        return Uni.createFrom().item(() -> {
            if (sessions.remove(token) != null) {
                LOG.debugf("Session deleted: %s", SessionTokenGenerator.abbreviate(token));
            }
            return null;
        });
    }

    @Override
    public Uni<Void> saveDisplayName(String userId, String displayName) {
        return Uni.createFrom().item(() -> {
            displayNames.put(userId, displayName);
            return null;
        });
    }

    @Override
    public Uni<Optional<String>> findDisplayName(String userId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(displayNames.get(userId)));
    }

    private void cleanupExpiredSessions() {
        int removed = 0;

        for (var entry : sessions.entrySet()) {
            if (entry.getValue().isExpired() && sessions.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }

        if (removed > 0) {
            LOG.debugf("Cleaned up %d expired sessions", removed);
        }
    }

    /**
     * Shuts down the cleanup executor.
     */
    public void shutdown() {
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Return the current session count, expired entries not yet cleaned up included.
     */
    public int getSessionCount() {
        return sessions.size();
    }

    private record StoredSession(String userId, Instant expiresAt) {

        boolean isExpired() {
            return !Instant.now().isBefore(expiresAt);
        }
    }
}
