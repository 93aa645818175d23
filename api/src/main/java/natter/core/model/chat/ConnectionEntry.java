package natter.core.model.chat;

import java.time.Instant;

import natter.core.port.out.ChatConnection;

/**
 * Registry entry for one admitted connection.
 *
 * <p>Entries are immutable; the only change an entry ever sees is removal from
 * the registry. The registry holds the connection for lookup and delivery only;
 * closing it is the job of the handler that owns it.
 *
 * @param connectionId stable identifier the entry is keyed by
 * @param connection   transport handle used for delivery
 * @param identity     identity resolved at admission
 * @param color        color assigned at admission
 * @param sessionToken session token the connection authenticated with
 * @param admittedAt   admission timestamp
 */
public record ConnectionEntry(
        String connectionId,
        ChatConnection connection,
        ChatIdentity identity,
        PresentationColor color,
        String sessionToken,
        Instant admittedAt) {}
