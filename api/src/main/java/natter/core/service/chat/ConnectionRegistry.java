package natter.core.service.chat;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import natter.core.model.chat.ChatIdentity;
import natter.core.model.chat.ConnectionEntry;
import natter.core.model.chat.PresentationColor;
import natter.core.port.out.ChatConnection;

/**
 * Process-wide set of admitted chat connections.
 *
 * <p>Writers (admit, remove) take the write lock; readers take the read lock and
 * receive immutable copies, so a broadcast never observes a half-applied change.
 * Entries keep admission order.
 */
@ApplicationScoped
public class ConnectionRegistry {

    private static final Logger LOG = Logger.getLogger(ConnectionRegistry.class);

    private final Map<String, ConnectionEntry> entries = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Supplier<PresentationColor> colorSource;

    @Inject
    public ConnectionRegistry() {
        this(PresentationColor::random);
    }

    public ConnectionRegistry(Supplier<PresentationColor> colorSource) {
        this.colorSource = colorSource;
    }

    /**
     * Admit a connection with its resolved identity and a freshly assigned color.
     *
     * @param connection   the connection to admit
     * @param identity     identity resolved from the session token
     * @param sessionToken token the connection authenticated with
     * @return the new entry
     * @throws DuplicateAdmissionException if the connection ID is already registered
     */
    public ConnectionEntry admit(ChatConnection connection, ChatIdentity identity, String sessionToken) {
        final var connectionId = connection.id();
        final var entry = new ConnectionEntry(
                connectionId, connection, identity, colorSource.get(), sessionToken, Instant.now());
        lock.writeLock().lock();
        try {
            if (entries.containsKey(connectionId)) {
                LOG.errorv("Connection {0} admitted twice", connectionId);
                throw new DuplicateAdmissionException(connectionId);
            }
            entries.put(connectionId, entry);
        } finally {
            lock.writeLock().unlock();
        }
        LOG.debugv(
                "Admitted connection {0} for user {1} with color {2}",
                connectionId, identity.userId(), entry.color().hex());
        return entry;
    }

    /**
     * Remove a connection. Removing an absent connection is a no-op.
     *
     * @param connectionId connection to remove
     * @return the removed entry, or empty if it was not registered
     */
    public Optional<ConnectionEntry> remove(String connectionId) {
        lock.writeLock().lock();
        try {
            return Optional.ofNullable(entries.remove(connectionId));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<ConnectionEntry> find(String connectionId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entries.get(connectionId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String connectionId) {
        lock.readLock().lock();
        try {
            return entries.containsKey(connectionId);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Point-in-time copy of all entries in admission order.
     *
     * <p>Later admissions and removals do not affect the returned list.
     */
    public List<ConnectionEntry> snapshot() {
        lock.readLock().lock();
        try {
            return List.copyOf(entries.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * A connection ID was admitted while already registered.
     */
    public static class DuplicateAdmissionException extends IllegalStateException {

        public DuplicateAdmissionException(String connectionId) {
            super("Connection already registered: " + connectionId);
        }
    }
}
