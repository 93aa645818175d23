package natter.adapter.in.websocket;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.ServerWebSocket;
import org.jboss.logging.Logger;

import natter.core.config.WebSocketConfig;
import natter.core.model.chat.ChatIdentity;
import natter.core.model.chat.ConnectionState;
import natter.core.model.chat.IdentityResolution;
import natter.core.model.session.SessionInvalidatedEvent;
import natter.core.port.in.ChatBroadcasting;
import natter.core.port.out.Metrics;
import natter.core.service.chat.ConnectionRegistry;
import natter.core.service.auth.SessionTokenGenerator;
import natter.core.service.chat.ConnectionRegistry.DuplicateAdmissionException;
import natter.core.service.chat.IdentityResolver;

/**
 * Lifecycle of one chat WebSocket, from authentication to teardown.
 *
 * <p>The socket is paused while the session token is resolved, so no frame is read
 * before admission. Once open, the socket is paused again for each inbound frame
 * until its broadcast completes; a client cannot have more than one message in
 * flight and TCP back-pressure applies beyond that.
 *
 * <p>Teardown removes the connection from the registry before the socket is closed,
 * and runs at most once however many close paths fire.
 */
public class ChatSocketSession {

    private static final Logger LOG = Logger.getLogger(ChatSocketSession.class);

    static final short NORMAL_CLOSURE = 1000;
    static final short PROTOCOL_ERROR = 1002;
    static final short POLICY_VIOLATION = 1008;
    static final short INTERNAL_ERROR = 1011;
    static final short TRY_AGAIN_LATER = 1013;

    private final VertxChatConnection connection;
    private final ServerWebSocket socket;
    private final Vertx vertx;
    private final WebSocketConfig config;
    private final IdentityResolver identityResolver;
    private final ConnectionRegistry registry;
    private final ChatBroadcasting broadcasting;
    private final Metrics metrics;
    private final Runnable onTerminated;

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);
    private volatile String sessionToken;
    // Written on the event loop, cancelled from whichever thread closes the session
    private volatile long idleTimerId = -1;
    private volatile long maxLifetimeTimerId = -1;
    private volatile long pingTimerId = -1;
    private volatile long pongTimeoutTimerId = -1;

    public ChatSocketSession(
            VertxChatConnection connection,
            ServerWebSocket socket,
            Vertx vertx,
            WebSocketConfig config,
            IdentityResolver identityResolver,
            ConnectionRegistry registry,
            ChatBroadcasting broadcasting,
            Metrics metrics,
            Runnable onTerminated) {
        this.connection = connection;
        this.socket = socket;
        this.vertx = vertx;
        this.config = config;
        this.identityResolver = identityResolver;
        this.registry = registry;
        this.broadcasting = broadcasting;
        this.metrics = metrics;
        this.onTerminated = onTerminated;
    }

    /**
     * Start authenticating the connection with the token from the upgrade request.
     *
     * @param token session token, if the client presented one
     */
    public void start(Optional<String> token) {
        if (!transition(ConnectionState.CONNECTING, ConnectionState.AUTHENTICATING)) {
            return;
        }
        sessionToken = token.orElse(null);

        socket.pause();
        socket.closeHandler(v -> closeWithReason(NORMAL_CLOSURE, "Client disconnected"));
        socket.exceptionHandler(t -> closeWithReason(INTERNAL_ERROR, "Client error: " + t.getMessage()));

        identityResolver
                .resolve(token)
                .subscribe()
                .with(this::onResolved, error -> {
                    LOG.errorv(error, "Identity resolution failed for connection {0}", connection.id());
                    closeWithReason(INTERNAL_ERROR, "Internal error");
                });
    }

    private void onResolved(IdentityResolution resolution) {
        if (resolution instanceof IdentityResolution.Resolved resolved) {
            admit(resolved.identity());
        } else if (resolution instanceof IdentityResolution.Unauthenticated unauthenticated) {
            metrics.recordConnectionRefused("unauthenticated");
            LOG.warnv(
                    "Connection {0} refused (token {1}): {2}",
                    connection.id(), SessionTokenGenerator.abbreviate(sessionToken), unauthenticated.reason());
            closeWithReason(POLICY_VIOLATION, unauthenticated.reason());
        } else if (resolution instanceof IdentityResolution.Unavailable unavailable) {
            metrics.recordConnectionRefused("unavailable");
            LOG.warnv("Connection {0} refused: {1}", connection.id(), unavailable.reason());
            closeWithReason(TRY_AGAIN_LATER, unavailable.reason());
        }
    }

    private void admit(ChatIdentity identity) {
        if (state.get() != ConnectionState.AUTHENTICATING) {
            // Client went away while the token was being resolved
            return;
        }

        try {
            registry.admit(connection, identity, sessionToken);
        } catch (DuplicateAdmissionException e) {
            closeWithReason(INTERNAL_ERROR, "Internal error");
            return;
        }
        metrics.incrementActiveConnections();

        if (!transition(ConnectionState.AUTHENTICATING, ConnectionState.OPEN)) {
            // Closed between admission and opening; teardown may have run before the entry existed
            registry.remove(connection.id()).ifPresent(entry -> metrics.decrementActiveConnections());
            return;
        }

        socket.textMessageHandler(this::onText);
        socket.pongHandler(buffer -> {
            cancelPongTimeout();
            resetIdleTimer();
        });

        startIdleTimer();
        startMaxLifetimeTimer();
        if (config.ping().enabled()) {
            startPingTimer();
        }
        if (state.get() != ConnectionState.OPEN) {
            // Closed from another thread while the timers were starting
            cancelTimers();
            return;
        }

        socket.resume();
        LOG.infov("Chat connection {0} admitted for user {1}", connection.id(), identity.userId());
    }

    private void onText(String text) {
        if (state.get() != ConnectionState.OPEN) {
            return;
        }
        LOG.debugv("Frame received on connection {0} ({1} chars)", connection.id(), text.length());
        resetIdleTimer();

        socket.pause();
        broadcasting
                .broadcast(text, connection.id())
                .subscribe()
                .with(report -> resumeIfOpen(), error -> {
                    LOG.errorv(error, "Broadcast from connection {0} failed", connection.id());
                    resumeIfOpen();
                });
    }

    private void resumeIfOpen() {
        if (state.get() == ConnectionState.OPEN) {
            socket.resume();
        }
    }

    private void startIdleTimer() {
        var timeoutMs = config.idleTimeout().toMillis();
        idleTimerId = vertx.setTimer(timeoutMs, id -> closeWithReason(NORMAL_CLOSURE, "Idle timeout exceeded"));
    }

    private void resetIdleTimer() {
        if (idleTimerId != -1) {
            vertx.cancelTimer(idleTimerId);
        }
        startIdleTimer();
    }

    private void startMaxLifetimeTimer() {
        var lifetimeMs = config.maxLifetime().toMillis();
        maxLifetimeTimerId = vertx.setTimer(
                lifetimeMs, id -> closeWithReason(NORMAL_CLOSURE, "Maximum connection lifetime exceeded"));
    }

    private void startPingTimer() {
        var intervalMs = config.ping().interval().toMillis();
        pingTimerId = vertx.setPeriodic(intervalMs, id -> {
            if (state.get() == ConnectionState.OPEN) {
                socket.writePing(Buffer.buffer("ping"));
                startPongTimeout();
            }
        });
    }

    private void startPongTimeout() {
        if (pongTimeoutTimerId != -1) {
            return;
        }
        var timeoutMs = config.ping().timeout().toMillis();
        pongTimeoutTimerId =
                vertx.setTimer(timeoutMs, id -> closeWithReason(PROTOCOL_ERROR, "Ping timeout - no pong received"));
    }

    private void cancelPongTimeout() {
        if (pongTimeoutTimerId != -1) {
            vertx.cancelTimer(pongTimeoutTimerId);
            pongTimeoutTimerId = -1;
        }
    }

    /**
     * Tear the connection down: deregister it, then close the socket with a reason.
     *
     * <p>Idempotent; only the first call has any effect.
     *
     * @param code   WebSocket close code
     * @param reason Close reason message
     */
    public void closeWithReason(short code, String reason) {
        ConnectionState current;
        do {
            current = state.get();
            if (current.isTerminating()) {
                return;
            }
        } while (!transition(current, ConnectionState.CLOSING));

        cancelTimers();

        var removed = registry.remove(connection.id());
        removed.ifPresent(entry -> metrics.decrementActiveConnections());
        connection.close(code, reason);
        transition(ConnectionState.CLOSING, ConnectionState.CLOSED);
        onTerminated.run();

        if (removed.isPresent()) {
            var duration = Duration.between(removed.get().admittedAt(), Instant.now()).toSeconds();
            LOG.infov(
                    "Chat connection {0} closed: {1} (code: {2}, duration: {3}s)",
                    connection.id(), reason, code, duration);
        } else {
            LOG.debugv("Chat connection {0} closed before admission: {1} (code: {2})", connection.id(), reason, code);
        }
    }

    private void cancelTimers() {
        idleTimerId = cancel(idleTimerId);
        maxLifetimeTimerId = cancel(maxLifetimeTimerId);
        pingTimerId = cancel(pingTimerId);
        pongTimeoutTimerId = cancel(pongTimeoutTimerId);
    }

    private long cancel(long timerId) {
        if (timerId != -1) {
            vertx.cancelTimer(timerId);
        }
        return -1;
    }

    private boolean transition(ConnectionState from, ConnectionState to) {
        return from.canTransitionTo(to) && state.compareAndSet(from, to);
    }

    /**
     * Check if this connection must close because its session was invalidated.
     *
     * @param event the session invalidation event
     * @return true if this connection authenticated with the invalidated token
     */
    public boolean shouldCloseFor(SessionInvalidatedEvent event) {
        return event.appliesTo(sessionToken);
    }

    public String connectionId() {
        return connection.id();
    }

    public ConnectionState state() {
        return state.get();
    }
}
