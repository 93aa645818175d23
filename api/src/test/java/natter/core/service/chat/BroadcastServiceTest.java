package natter.core.service.chat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import natter.core.config.WebSocketConfig;
import natter.core.model.chat.BroadcastReport;
import natter.core.model.chat.ChatEnvelope;
import natter.core.model.chat.ChatIdentity;
import natter.core.model.chat.DeliveryResult;
import natter.core.model.chat.PresentationColor;
import natter.core.port.out.Metrics;

@DisplayName("BroadcastService")
class BroadcastServiceTest {

    private static final PresentationColor ALICE_COLOR = new PresentationColor(0xA11CE0);
    private static final PresentationColor BOB_COLOR = new PresentationColor(0x0000B0);

    private ConnectionRegistry registry;
    private WebSocketConfig config;
    private Metrics metrics;
    private BroadcastService service;

    @BeforeEach
    void setUp() {
        var colors = new ArrayDeque<>(List.of(ALICE_COLOR, BOB_COLOR, new PresentationColor(0xCCCCCC)));
        registry = new ConnectionRegistry(colors::poll);
        config = mock(WebSocketConfig.class);
        metrics = mock(Metrics.class);
        when(config.sendTimeout()).thenReturn(Duration.ofMillis(200));
        service = new BroadcastService(registry, config, metrics);
    }

    private RecordingConnection admit(RecordingConnection connection, String userId, String displayName) {
        registry.admit(connection, new ChatIdentity(userId, displayName), "token-" + userId);
        return connection;
    }

    private static Map<String, DeliveryResult> byConnection(BroadcastReport report) {
        return report.results().stream()
                .collect(Collectors.toMap(DeliveryResult::connectionId, Function.identity()));
    }

    @Nested
    @DisplayName("Envelope rendering")
    class RenderingTests {

        @Test
        @DisplayName("Should echo the message back to a lone sender")
        void shouldEchoToLoneSender() {
            var alice = admit(RecordingConnection.healthy("a"), "u1", "alice");

            service.broadcast("hi", "a").await().indefinitely();

            assertEquals(List.of(new ChatEnvelope("alice: hi", "#a11ce0")), alice.received());
        }

        @Test
        @DisplayName("Should render every recipient's envelope with the sender's name and color")
        void shouldRenderWithSenderMetadata() {
            var alice = admit(RecordingConnection.healthy("a"), "u1", "alice");
            var bob = admit(RecordingConnection.healthy("b"), "u2", "bob");

            service.broadcast("hello", "a").await().indefinitely();

            var expected = new ChatEnvelope("alice: hello", ALICE_COLOR.hex());
            assertEquals(List.of(expected), alice.received());
            assertEquals(List.of(expected), bob.received());
        }

        @Test
        @DisplayName("Should fall back to the user ID when no display name was resolved")
        void shouldFallBackToUserId() {
            var conn = RecordingConnection.healthy("a");
            registry.admit(conn, ChatIdentity.of("u1", Optional.empty()), "t");

            service.broadcast("yo", "a").await().indefinitely();

            assertEquals("u1: yo", conn.received().get(0).message());
        }

        @Test
        @DisplayName("Should render an unregistered sender as unknown in black")
        void shouldRenderUnregisteredSenderAsUnknown() {
            var bob = admit(RecordingConnection.healthy("b"), "u2", "bob");

            var report = service.broadcast("ghost", "gone").await().indefinitely();

            assertEquals(List.of(new ChatEnvelope("unknown: ghost", "#000000")), bob.received());
            assertEquals(1, report.deliveredCount());
        }

        @Test
        @DisplayName("Should pass the text through without interpreting it")
        void shouldPassTextThrough() {
            var alice = admit(RecordingConnection.healthy("a"), "u1", "alice");

            service.broadcast("{\"not\": \"parsed\"}", "a").await().indefinitely();

            assertEquals("alice: {\"not\": \"parsed\"}", alice.received().get(0).message());
        }
    }

    @Nested
    @DisplayName("Recipients")
    class RecipientTests {

        @Test
        @DisplayName("Should deliver exactly once to every registered connection, sender included")
        void shouldDeliverExactlyOnceToEveryConnection() {
            var alice = admit(RecordingConnection.healthy("a"), "u1", "alice");
            var bob = admit(RecordingConnection.healthy("b"), "u2", "bob");
            var carol = admit(RecordingConnection.healthy("c"), "u3", "carol");

            var report = service.broadcast("hey", "b").await().indefinitely();

            assertEquals(1, alice.received().size());
            assertEquals(1, bob.received().size());
            assertEquals(1, carol.received().size());
            assertEquals(3, report.deliveredCount());
            assertInstanceOf(DeliveryResult.Delivered.class, byConnection(report).get("b"));
        }

        @Test
        @DisplayName("Should not deliver to a connection that disconnected before the broadcast")
        void shouldNotDeliverToDisconnectedConnection() {
            var alice = admit(RecordingConnection.healthy("a"), "u1", "alice");
            var bob = admit(RecordingConnection.healthy("b"), "u2", "bob");

            registry.remove("a");
            assertEquals(1, registry.size());
            var report = service.broadcast("anyone?", "b").await().indefinitely();

            assertTrue(alice.received().isEmpty());
            assertEquals(1, bob.received().size());
            assertEquals(1, report.results().size());
        }

        @Test
        @DisplayName("Should skip a recipient removed after the snapshot but before delivery")
        void shouldSkipRecipientRemovedAfterSnapshot() {
            admit(RecordingConnection.onSend("a", () -> registry.remove("b")), "u1", "alice");
            var bob = admit(RecordingConnection.healthy("b"), "u2", "bob");

            var report = service.broadcast("race", "a").await().indefinitely();

            assertTrue(bob.received().isEmpty());
            assertInstanceOf(DeliveryResult.Skipped.class, byConnection(report).get("b"));
            assertEquals(1, report.skippedCount());
        }

        @Test
        @DisplayName("Should skip a registered recipient whose connection is already closed")
        void shouldSkipClosedRecipient() {
            admit(RecordingConnection.healthy("a"), "u1", "alice");
            var bob = admit(RecordingConnection.healthy("b"), "u2", "bob");
            bob.close((short) 1000, "Client disconnected");

            var report = service.broadcast("late", "a").await().indefinitely();

            assertTrue(bob.received().isEmpty());
            assertInstanceOf(DeliveryResult.Skipped.class, byConnection(report).get("b"));
            assertInstanceOf(DeliveryResult.Delivered.class, byConnection(report).get("a"));
        }

        @Test
        @DisplayName("Should return an empty report when nobody is connected")
        void shouldReturnEmptyReportWhenNobodyConnected() {
            var report = service.broadcast("echo", "a").await().indefinitely();

            assertTrue(report.results().isEmpty());
            verify(metrics).recordBroadcast(report);
        }
    }

    @Nested
    @DisplayName("Failure isolation")
    class FailureIsolationTests {

        @Test
        @DisplayName("Should keep delivering to others when one recipient fails")
        void shouldKeepDeliveringWhenOneRecipientFails() {
            var alice = admit(RecordingConnection.healthy("a"), "u1", "alice");
            admit(RecordingConnection.failing("b", new IllegalStateException("Connection closed")), "u2", "bob");
            var carol = admit(RecordingConnection.healthy("c"), "u3", "carol");

            var report = service.broadcast("still here", "a").await().indefinitely();

            assertEquals(1, alice.received().size());
            assertEquals(1, carol.received().size());
            var failed = assertInstanceOf(DeliveryResult.Failed.class, byConnection(report).get("b"));
            assertEquals("Connection closed", failed.reason());
            assertEquals(2, report.deliveredCount());
            assertEquals(1, report.failedCount());
        }

        @Test
        @DisplayName("Should time out a stalled recipient without holding up the others")
        void shouldTimeOutStalledRecipient() {
            var alice = admit(RecordingConnection.healthy("a"), "u1", "alice");
            admit(RecordingConnection.stalled("b"), "u2", "bob");

            var report = service.broadcast("tick", "a").await().atMost(Duration.ofSeconds(5));

            assertEquals(1, alice.received().size());
            assertInstanceOf(DeliveryResult.Failed.class, byConnection(report).get("b"));
        }

        @Test
        @DisplayName("Should not fail when the sender itself cannot be written to")
        void shouldNotFailWhenSenderWriteFails() {
            admit(RecordingConnection.failing("a", new IllegalStateException("Write queue full")), "u1", "alice");
            var bob = admit(RecordingConnection.healthy("b"), "u2", "bob");

            var report = service.broadcast("hi", "a").await().indefinitely();

            assertEquals(1, bob.received().size());
            assertEquals(1, report.failedCount());
        }

        @Test
        @DisplayName("Should record metrics for every broadcast")
        void shouldRecordEveryBroadcast() {
            admit(RecordingConnection.healthy("a"), "u1", "alice");

            service.broadcast("one", "a").await().indefinitely();
            service.broadcast("two", "a").await().indefinitely();

            verify(metrics, times(2)).recordBroadcast(any());
        }
    }

    @Nested
    @DisplayName("Ordering")
    class OrderingTests {

        @Test
        @DisplayName("Should preserve a sender's message order at every recipient")
        void shouldPreserveSenderOrder() {
            var alice = admit(RecordingConnection.healthy("a"), "u1", "alice");
            var bob = admit(RecordingConnection.healthy("b"), "u2", "bob");

            for (int i = 0; i < 20; i++) {
                service.broadcast("m" + i, "a").await().indefinitely();
            }

            var expected = IntStream.range(0, 20)
                    .mapToObj(i -> "alice: m" + i)
                    .toList();
            assertEquals(expected, alice.received().stream().map(ChatEnvelope::message).toList());
            assertEquals(expected, bob.received().stream().map(ChatEnvelope::message).toList());
        }
    }
}
