package natter.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import natter.core.config.TelemetryConfig;
import natter.core.model.chat.BroadcastReport;
import natter.core.model.chat.DeliveryResult;

@DisplayName("ChatMetrics")
class ChatMetricsTest {

    private MeterRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
    }

    private ChatMetrics metrics(boolean enabled) {
        var config = mock(TelemetryConfig.class);
        var metricsConfig = mock(TelemetryConfig.MetricsConfig.class);
        when(config.metrics()).thenReturn(metricsConfig);
        when(metricsConfig.enabled()).thenReturn(enabled);
        var chatMetrics = new ChatMetrics(registry, config);
        chatMetrics.init();
        return chatMetrics;
    }

    @Nested
    @DisplayName("When enabled")
    class EnabledTests {

        @Test
        @DisplayName("Should track admitted connections in a gauge")
        void shouldTrackActiveConnections() {
            var metrics = metrics(true);

            metrics.incrementActiveConnections();
            metrics.incrementActiveConnections();
            metrics.decrementActiveConnections();

            assertEquals(1, metrics.activeConnections());
            assertEquals(1.0, registry.get("natter.connections.active").gauge().value());
        }

        @Test
        @DisplayName("Should count refusals by reason")
        void shouldCountRefusals() {
            var metrics = metrics(true);

            metrics.recordConnectionRefused("unauthenticated");
            metrics.recordConnectionRefused("unauthenticated");
            metrics.recordConnectionRefused("capacity");

            assertEquals(
                    2.0,
                    registry.get("natter.connections.refused.total")
                            .tag("reason", "unauthenticated")
                            .counter()
                            .count());
            assertEquals(
                    1.0,
                    registry.get("natter.connections.refused.total")
                            .tag("reason", "capacity")
                            .counter()
                            .count());
        }

        @Test
        @DisplayName("Should count broadcasts and deliveries by outcome")
        void shouldCountBroadcastOutcomes() {
            var metrics = metrics(true);
            var report = new BroadcastReport(
                    "a",
                    List.of(
                            new DeliveryResult.Delivered("a"),
                            new DeliveryResult.Delivered("b"),
                            new DeliveryResult.Failed("c", "Write queue full")));

            metrics.recordBroadcast(report);

            assertEquals(1.0, registry.get("natter.broadcasts.total").counter().count());
            assertEquals(
                    2.0,
                    registry.get("natter.deliveries.total")
                            .tag("outcome", "delivered")
                            .counter()
                            .count());
            assertEquals(
                    1.0,
                    registry.get("natter.deliveries.total")
                            .tag("outcome", "failed")
                            .counter()
                            .count());
            assertNull(registry.find("natter.deliveries.total")
                    .tag("outcome", "skipped")
                    .counter());
        }

        @Test
        @DisplayName("Should count Redis timeouts and failures by repository and operation")
        void shouldCountRedisProblems() {
            var metrics = metrics(true);

            metrics.recordRedisTimeout("sessions", "findUserId");
            metrics.recordRedisFailure("accounts", null);

            assertEquals(
                    1.0,
                    registry.get("natter.redis.timeouts.total")
                            .tags("repository", "sessions", "operation", "findUserId")
                            .counter()
                            .count());
            assertEquals(
                    1.0,
                    registry.get("natter.redis.failures.total")
                            .tags("repository", "accounts", "operation", "unknown")
                            .counter()
                            .count());
        }
    }

    @Nested
    @DisplayName("When disabled")
    class DisabledTests {

        @Test
        @DisplayName("Should register nothing")
        void shouldRegisterNothing() {
            var metrics = metrics(false);

            metrics.incrementActiveConnections();
            metrics.recordConnectionRefused("capacity");
            metrics.recordBroadcast(BroadcastReport.empty("a"));

            assertFalse(metrics.isEnabled());
            assertEquals(0, metrics.activeConnections());
            assertTrue(registry.getMeters().isEmpty());
        }
    }
}
