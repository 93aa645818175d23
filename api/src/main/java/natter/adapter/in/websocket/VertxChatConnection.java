package natter.adapter.in.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import io.vertx.core.http.ServerWebSocket;

import natter.core.model.chat.ChatEnvelope;
import natter.core.port.out.ChatConnection;

/**
 * {@link ChatConnection} backed by a Vert.x server WebSocket.
 *
 * <p>Envelopes are written as a single JSON text frame. A send fails immediately
 * when the socket is closed or its write queue is full, so a slow client cannot
 * accumulate unbounded pending frames.
 */
public class VertxChatConnection implements ChatConnection {

    private final String id;
    private final ServerWebSocket socket;
    private final ObjectMapper objectMapper;

    public VertxChatConnection(String id, ServerWebSocket socket, ObjectMapper objectMapper) {
        this.id = id;
        this.socket = socket;
        this.objectMapper = objectMapper;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Uni<Void> send(ChatEnvelope envelope) {
        if (socket.isClosed()) {
            return Uni.createFrom().failure(new IllegalStateException("Connection closed"));
        }
        if (socket.writeQueueFull()) {
            return Uni.createFrom().failure(new IllegalStateException("Write queue full"));
        }

        final String json;
        try {
            json = objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            return Uni.createFrom().failure(e);
        }
        return Uni.createFrom().completionStage(() -> socket.writeTextMessage(json).toCompletionStage());
    }

    @Override
    public void close(short code, String reason) {
        if (!socket.isClosed()) {
            socket.close(code, reason);
        }
    }

    @Override
    public boolean isOpen() {
        return !socket.isClosed();
    }
}
