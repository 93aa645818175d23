package natter.adapter.in.websocket;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyShort;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.vertx.core.Future;
import io.vertx.core.http.ServerWebSocket;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import natter.core.model.chat.ChatEnvelope;

@DisplayName("VertxChatConnection")
class VertxChatConnectionTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ServerWebSocket socket;
    private VertxChatConnection connection;

    @BeforeEach
    void setUp() {
        socket = mock(ServerWebSocket.class);
        connection = new VertxChatConnection("conn-1", socket, objectMapper);
    }

    @Test
    @DisplayName("Should write the envelope as one JSON text frame")
    void shouldWriteEnvelopeAsJson() throws Exception {
        when(socket.writeTextMessage(anyString())).thenReturn(Future.succeededFuture());

        connection.send(new ChatEnvelope("alice: hi", "#a11ce0")).await().indefinitely();

        var frame = ArgumentCaptor.forClass(String.class);
        verify(socket).writeTextMessage(frame.capture());
        var json = objectMapper.readTree(frame.getValue());
        assertEquals("alice: hi", json.get("message").asText());
        assertEquals("#a11ce0", json.get("color").asText());
        assertEquals(2, json.size());
    }

    @Test
    @DisplayName("Should fail when the write fails")
    void shouldFailWhenWriteFails() {
        when(socket.writeTextMessage(anyString())).thenReturn(Future.failedFuture(new IllegalStateException("reset")));

        var send = connection.send(new ChatEnvelope("m", "#000000"));

        assertThrows(IllegalStateException.class, () -> send.await().indefinitely());
    }

    @Test
    @DisplayName("Should fail without writing when the socket is closed")
    void shouldFailWhenClosed() {
        when(socket.isClosed()).thenReturn(true);

        var send = connection.send(new ChatEnvelope("m", "#000000"));

        var error = assertThrows(IllegalStateException.class, () -> send.await().indefinitely());
        assertEquals("Connection closed", error.getMessage());
        verify(socket, never()).writeTextMessage(anyString());
    }

    @Test
    @DisplayName("Should fail without writing when the write queue is full")
    void shouldFailWhenWriteQueueFull() {
        when(socket.writeQueueFull()).thenReturn(true);

        var send = connection.send(new ChatEnvelope("m", "#000000"));

        var error = assertThrows(IllegalStateException.class, () -> send.await().indefinitely());
        assertEquals("Write queue full", error.getMessage());
        verify(socket, never()).writeTextMessage(anyString());
    }

    @Test
    @DisplayName("Should close an open socket with the code and reason")
    void shouldCloseOpenSocket() {
        connection.close((short) 1008, "Invalid or expired session");

        verify(socket).close((short) 1008, "Invalid or expired session");
    }

    @Test
    @DisplayName("Should not close an already closed socket")
    void shouldNotCloseClosedSocket() {
        when(socket.isClosed()).thenReturn(true);

        connection.close((short) 1000, "bye");

        verify(socket, never()).close(anyShort(), anyString());
        assertFalse(connection.isOpen());
    }

    @Test
    @DisplayName("Should report open while the socket is open")
    void shouldReportOpen() {
        assertTrue(connection.isOpen());
        assertEquals("conn-1", connection.id());
    }
}
