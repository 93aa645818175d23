package natter.core.model.chat;

/**
 * Outcome of delivering one envelope to one recipient.
 */
public sealed interface DeliveryResult {

    String connectionId();

    /**
     * The envelope was written to the recipient.
     */
    record Delivered(String connectionId) implements DeliveryResult {}

    /**
     * Writing to the recipient failed or timed out; the recipient misses this message.
     */
    record Failed(String connectionId, String reason) implements DeliveryResult {}

    /**
     * The recipient was deregistered between the snapshot and the delivery attempt.
     */
    record Skipped(String connectionId) implements DeliveryResult {}
}
