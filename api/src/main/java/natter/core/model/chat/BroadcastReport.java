package natter.core.model.chat;

import java.util.List;

/**
 * Per-recipient outcomes of a single broadcast call.
 *
 * @param senderId connection that sent the message
 * @param results  one result per entry in the snapshot the broadcast iterated
 */
public record BroadcastReport(String senderId, List<DeliveryResult> results) {

    public BroadcastReport {
        results = List.copyOf(results);
    }

    public static BroadcastReport empty(String senderId) {
        return new BroadcastReport(senderId, List.of());
    }

    public long deliveredCount() {
        return count(DeliveryResult.Delivered.class);
    }

    public long failedCount() {
        return count(DeliveryResult.Failed.class);
    }

    public long skippedCount() {
        return count(DeliveryResult.Skipped.class);
    }

    private long count(Class<? extends DeliveryResult> type) {
        return results.stream().filter(type::isInstance).count();
    }
}
