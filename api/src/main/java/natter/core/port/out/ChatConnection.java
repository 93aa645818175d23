package natter.core.port.out;

import io.smallrye.mutiny.Uni;

import natter.core.model.chat.ChatEnvelope;

/**
 * Outbound port for one live duplex chat connection.
 *
 * <p>Implementations wrap the transport socket. Sends must not block the caller;
 * a send that cannot be written fails the returned {@link Uni}.
 */
public interface ChatConnection {

    /**
     * Stable identifier for this connection.
     */
    String id();

    /**
     * Write an envelope to the peer.
     *
     * @param envelope the envelope
     * @return Uni completing when the frame is written, failing if it could not be
     */
    Uni<Void> send(ChatEnvelope envelope);

    /**
     * Close the connection from the server side.
     *
     * @param code   WebSocket close code
     * @param reason close reason
     */
    void close(short code, String reason);

    /**
     * Whether the underlying transport is still open.
     */
    boolean isOpen();
}
