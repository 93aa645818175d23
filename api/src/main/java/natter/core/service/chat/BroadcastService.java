package natter.core.service.chat;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import natter.core.config.WebSocketConfig;
import natter.core.model.chat.BroadcastReport;
import natter.core.model.chat.ChatEnvelope;
import natter.core.model.chat.ChatIdentity;
import natter.core.model.chat.ConnectionEntry;
import natter.core.model.chat.DeliveryResult;
import natter.core.model.chat.PresentationColor;
import natter.core.port.in.ChatBroadcasting;
import natter.core.port.out.Metrics;

/**
 * Fans a sender's message out to every admitted connection, the sender included.
 *
 * <p>Recipients are taken from a registry snapshot. Deliveries run concurrently and
 * each is bounded by the configured send timeout; one slow or failed recipient
 * never prevents delivery to the others. The returned Uni completes once every
 * recipient has an outcome.
 */
@ApplicationScoped
public class BroadcastService implements ChatBroadcasting {

    private static final Logger LOG = Logger.getLogger(BroadcastService.class);

    private final ConnectionRegistry registry;
    private final WebSocketConfig config;
    private final Metrics metrics;

    @Inject
    public BroadcastService(ConnectionRegistry registry, WebSocketConfig config, Metrics metrics) {
        this.registry = registry;
        this.config = config;
        this.metrics = metrics;
    }

    @Override
    public Uni<BroadcastReport> broadcast(String text, String senderId) {
        final var sender = registry.find(senderId);
        final var identity = sender.map(ConnectionEntry::identity).orElse(ChatIdentity.UNKNOWN);
        final var color = sender.map(ConnectionEntry::color).orElse(PresentationColor.BLACK);
        if (sender.isEmpty()) {
            LOG.debugv("Broadcast from unregistered connection {0}, rendering as unknown", senderId);
        }

        final var envelope = ChatEnvelope.render(identity, color, text);
        final var recipients = registry.snapshot();
        if (recipients.isEmpty()) {
            final var report = BroadcastReport.empty(senderId);
            metrics.recordBroadcast(report);
            return Uni.createFrom().item(report);
        }

        final List<Uni<DeliveryResult>> deliveries = new ArrayList<>(recipients.size());
        for (var recipient : recipients) {
            deliveries.add(deliver(recipient, envelope));
        }

        return Uni.join().all(deliveries).andFailFast().map(results -> {
            final var report = new BroadcastReport(senderId, results);
            metrics.recordBroadcast(report);
            if (report.failedCount() > 0) {
                LOG.debugv(
                        "Broadcast from {0}: {1} delivered, {2} failed, {3} skipped",
                        senderId, report.deliveredCount(), report.failedCount(), report.skippedCount());
            }
            return report;
        });
    }

    private Uni<DeliveryResult> deliver(ConnectionEntry recipient, ChatEnvelope envelope) {
        final var connectionId = recipient.connectionId();
        final var timeout = config.sendTimeout();
        return Uni.createFrom()
                .<DeliveryResult>deferred(() -> {
                    // Deregistered or already closing since the snapshot
                    if (!registry.contains(connectionId) || !recipient.connection().isOpen()) {
                        return Uni.createFrom().item((DeliveryResult) new DeliveryResult.Skipped(connectionId));
                    }
                    return recipient
                            .connection()
                            .send(envelope)
                            .ifNoItem()
                            .after(timeout)
                            .failWith(() -> new TimeoutException("Send timed out after " + timeout.toMillis() + "ms"))
                            .map(ignored -> (DeliveryResult) new DeliveryResult.Delivered(connectionId));
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Delivery to {0} failed: {1}", connectionId, error.getMessage());
                    return new DeliveryResult.Failed(connectionId, String.valueOf(error.getMessage()));
                });
    }
}
