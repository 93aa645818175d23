package natter.adapter.out.telemetry;

import java.util.concurrent.atomic.AtomicLong;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import natter.core.config.TelemetryConfig;
import natter.core.model.chat.BroadcastReport;
import natter.core.port.out.Metrics;

/**
 * Records chat metrics using Micrometer.
 *
 * <p>All methods are no-ops when metrics are disabled, so callers never need to
 * check configuration.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code natter.connections.active} - Admitted chat connections gauge</li>
 *   <li>{@code natter.connections.refused.total} - Connections refused before admission, by reason</li>
 *   <li>{@code natter.broadcasts.total} - Broadcast calls</li>
 *   <li>{@code natter.deliveries.total} - Per-recipient deliveries, by outcome</li>
 *   <li>{@code natter.redis.timeouts.total} - Redis operation timeouts</li>
 *   <li>{@code natter.redis.failures.total} - Redis operation failures other than timeouts</li>
 * </ul>
 */
@ApplicationScoped
public class ChatMetrics implements Metrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    private final AtomicLong activeConnections = new AtomicLong(0);

    @Inject
    public ChatMetrics(MeterRegistry registry, TelemetryConfig config) {
        this.registry = registry;
        this.enabled = config != null && config.metrics().enabled();
    }

    @PostConstruct
    void init() {
        if (!enabled) {
            return;
        }

        Gauge.builder("natter.connections.active", activeConnections, AtomicLong::get)
                .description("Number of admitted chat connections")
                .register(registry);
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    // -------------------------------------------------------------------------
    // Connection Metrics
    // -------------------------------------------------------------------------

    @Override
    public void incrementActiveConnections() {
        if (enabled) {
            activeConnections.incrementAndGet();
        }
    }

    @Override
    public void decrementActiveConnections() {
        if (enabled) {
            activeConnections.decrementAndGet();
        }
    }

    @Override
    public void recordConnectionRefused(String reason) {
        if (!enabled) {
            return;
        }

        Counter.builder("natter.connections.refused.total")
                .description("Chat connections refused before admission")
                .tag("reason", nullSafe(reason))
                .register(registry)
                .increment();
    }

    // -------------------------------------------------------------------------
    // Broadcast Metrics
    // -------------------------------------------------------------------------

    /**
     * Record a broadcast and the outcome of each delivery.
     *
     * @param report the broadcast report
     */
    @Override
    public void recordBroadcast(BroadcastReport report) {
        if (!enabled) {
            return;
        }

        Counter.builder("natter.broadcasts.total")
                .description("Total number of broadcasts")
                .register(registry)
                .increment();

        recordDeliveries("delivered", report.deliveredCount());
        recordDeliveries("failed", report.failedCount());
        recordDeliveries("skipped", report.skippedCount());
    }

    private void recordDeliveries(String outcome, long count) {
        if (count == 0) {
            return;
        }
        Counter.builder("natter.deliveries.total")
                .description("Per-recipient broadcast deliveries")
                .tag("outcome", outcome)
                .register(registry)
                .increment(count);
    }

    // -------------------------------------------------------------------------
    // Storage Metrics
    // -------------------------------------------------------------------------

    @Override
    public void recordRedisTimeout(String repository, String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("natter.redis.timeouts.total")
                .description("Redis operations that exceeded the configured timeout")
                .tag("repository", nullSafe(repository))
                .tag("operation", nullSafe(operation))
                .register(registry)
                .increment();
    }

    @Override
    public void recordRedisFailure(String repository, String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("natter.redis.failures.total")
                .description("Redis operations that failed for reasons other than timeout")
                .tag("repository", nullSafe(repository))
                .tag("operation", nullSafe(operation))
                .register(registry)
                .increment();
    }

    /** Current number of admitted connections as tracked by the gauge. */
    long activeConnections() {
        return activeConnections.get();
    }

    private static String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
