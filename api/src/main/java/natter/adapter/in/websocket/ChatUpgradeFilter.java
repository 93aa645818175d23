package natter.adapter.in.websocket;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.vertx.web.RouteFilter;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.ext.web.RoutingContext;
import org.jboss.logging.Logger;

import natter.core.config.WebSocketConfig;

/**
 * Vert.x route filter that intercepts chat WebSocket upgrade requests before JAX-RS.
 *
 * <p>Priority 50 ensures this runs after CORS (100) but before most other processing.
 */
@ApplicationScoped
public class ChatUpgradeFilter {

    private static final Logger LOG = Logger.getLogger(ChatUpgradeFilter.class);

    private final ChatGateway chatGateway;
    private final WebSocketConfig config;

    @Inject
    public ChatUpgradeFilter(ChatGateway chatGateway, WebSocketConfig config) {
        this.chatGateway = chatGateway;
        this.config = config;
    }

    @RouteFilter(50)
    void interceptWebSocketUpgrade(RoutingContext ctx) {
        if (!isWebSocketUpgrade(ctx.request())) {
            ctx.next();
            return;
        }

        var path = ctx.request().path();
        if (isChatPath(path)) {
            LOG.debugv("Chat WebSocket upgrade request detected: {0}", path);
            chatGateway.handleUpgrade(ctx);
        } else {
            LOG.debugv("WebSocket upgrade to unknown path: {0}", path);
            ctx.next();
        }
    }

    static boolean isWebSocketUpgrade(HttpServerRequest request) {
        var upgrade = request.getHeader("Upgrade");
        var connection = request.getHeader("Connection");

        return "websocket".equalsIgnoreCase(upgrade)
                && connection != null
                && connection.toLowerCase().contains("upgrade");
    }

    private boolean isChatPath(String path) {
        var normalized = path.endsWith("/") && path.length() > 1 ? path.substring(0, path.length() - 1) : path;
        return normalized.equals(config.path());
    }
}
