package natter.core.port.in;

import io.smallrye.mutiny.Uni;

import natter.core.model.chat.BroadcastReport;

/**
 * Inbound port for fanning a chat message out to every live connection.
 */
public interface ChatBroadcasting {

    /**
     * Deliver a message to every registered connection, the sender included.
     *
     * <p>The returned Uni never fails because of a recipient; per-recipient
     * failures are reported in the {@link BroadcastReport}.
     *
     * @param text     raw chat text
     * @param senderId connection ID of the sender
     * @return the per-recipient outcomes
     */
    Uni<BroadcastReport> broadcast(String text, String senderId);
}
