package natter.adapter.in.websocket;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.ObservesAsync;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.ext.web.RoutingContext;
import org.jboss.logging.Logger;

import natter.core.config.SessionConfig;
import natter.core.config.WebSocketConfig;
import natter.core.model.session.SessionInvalidatedEvent;
import natter.core.port.in.ChatBroadcasting;
import natter.core.port.out.Metrics;
import natter.core.service.chat.ConnectionRegistry;
import natter.core.service.chat.IdentityResolver;

/**
 * Accepts chat WebSocket upgrades and owns the per-instance set of live sockets.
 *
 * <p>Every upgrade is accepted before authentication; a connection that fails
 * authentication is closed with a WebSocket close code rather than an HTTP status.
 * Only the connection limit is enforced at the HTTP level.
 */
@ApplicationScoped
public class ChatGateway {

    private static final Logger LOG = Logger.getLogger(ChatGateway.class);

    // Live sockets, authenticating ones included (per-instance)
    private final Map<String, ChatSocketSession> activeSessions = new ConcurrentHashMap<>();

    private final WebSocketConfig config;
    private final SessionConfig sessionConfig;
    private final Vertx vertx;
    private final ObjectMapper objectMapper;
    private final IdentityResolver identityResolver;
    private final ConnectionRegistry registry;
    private final ChatBroadcasting broadcasting;
    private final Metrics metrics;

    @Inject
    public ChatGateway(
            WebSocketConfig config,
            SessionConfig sessionConfig,
            Vertx vertx,
            ObjectMapper objectMapper,
            IdentityResolver identityResolver,
            ConnectionRegistry registry,
            ChatBroadcasting broadcasting,
            Metrics metrics) {
        this.config = config;
        this.sessionConfig = sessionConfig;
        this.vertx = vertx;
        this.objectMapper = objectMapper;
        this.identityResolver = identityResolver;
        this.registry = registry;
        this.broadcasting = broadcasting;
        this.metrics = metrics;
    }

    /**
     * Upgrade the request to a chat WebSocket and start authenticating it.
     *
     * <p>The connection limit is a soft cap; see {@link WebSocketConfig#maxConnections()}.
     */
    public void handleUpgrade(RoutingContext ctx) {
        if (activeSessions.size() >= config.maxConnections()) {
            LOG.warnv("Chat connection limit reached ({0})", config.maxConnections());
            metrics.recordConnectionRefused("capacity");
            ctx.response().setStatusCode(503).end("Service temporarily unavailable: connection limit reached");
            return;
        }

        final var token = extractToken(ctx.request());

        ctx.request()
                .toWebSocket()
                .onSuccess(socket -> {
                    final var connectionId = UUID.randomUUID().toString();
                    final var connection = new VertxChatConnection(connectionId, socket, objectMapper);
                    final var session = new ChatSocketSession(
                            connection,
                            socket,
                            vertx,
                            config,
                            identityResolver,
                            registry,
                            broadcasting,
                            metrics,
                            () -> activeSessions.remove(connectionId));

                    activeSessions.put(connectionId, session);
                    session.start(token);
                    LOG.debugv("Chat WebSocket {0} upgraded, authenticating", connectionId);
                })
                .onFailure(err -> {
                    LOG.warnv(err, "Chat WebSocket upgrade failed");
                    if (!ctx.response().ended()) {
                        ctx.response().setStatusCode(500).end("WebSocket upgrade failed");
                    }
                });
    }

    private Optional<String> extractToken(HttpServerRequest request) {
        var token = request.getParam(sessionConfig.tokenQueryParameter());
        if (token == null || token.isBlank()) {
            token = request.getHeader(sessionConfig.tokenHeader());
        }
        return Optional.ofNullable(token).map(String::trim).filter(t -> !t.isEmpty());
    }

    /**
     * Handle session invalidation events (logout).
     *
     * <p>Every connection admitted with the invalidated token is closed.
     *
     * @param event the session invalidation event
     */
    void onSessionInvalidated(@ObservesAsync SessionInvalidatedEvent event) {
        var sessionsToClose = activeSessions.values().stream()
                .filter(session -> session.shouldCloseFor(event))
                .toList();

        if (!sessionsToClose.isEmpty()) {
            LOG.infov("Closing {0} chat connection(s) due to logout", sessionsToClose.size());
            sessionsToClose.forEach(
                    session -> session.closeWithReason(ChatSocketSession.NORMAL_CLOSURE, "Session logged out"));
        }
    }

    /**
     * Get the number of admitted chat connections (per-instance).
     *
     * @return admitted connection count
     */
    public int getActiveConnectionCount() {
        return registry.size();
    }

    /**
     * Get the number of open sockets, including those still authenticating.
     *
     * @return open socket count
     */
    public int getOpenSocketCount() {
        return activeSessions.size();
    }
}
