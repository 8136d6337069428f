package io.livedoc.transport.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.livedoc.domain.session.CloseReason;
import io.livedoc.domain.session.SessionState;
import io.livedoc.infrastructure.common.RetryPolicy;
import io.livedoc.infrastructure.metrics.LiveDocMetrics;
import io.livedoc.infrastructure.store.StoreGateway;
import io.livedoc.repository.InMemoryDocumentStore;
import io.livedoc.service.notify.ChangeNotifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link SocketHub} handshake and inbound frame routing.
 *
 * Tests:
 * - token check on handshake
 * - subscribe, unsubscribe, heartbeat and ping routing
 * - protocol violations close the session
 * - shutdown closes sessions and refuses new ones
 */
@ExtendWith(MockitoExtension.class)
class SocketHubTest {
    private static final LiveSession.Settings SETTINGS = new LiveSession.Settings(16, Duration.ofMillis(100));

    @Mock
    private LiveDocMetrics metrics;

    private ChangeNotifier notifier;
    private StoreGateway gateway;

    @BeforeEach
    void setUp() {
        InMemoryDocumentStore store = new InMemoryDocumentStore(Clock.systemUTC());
        gateway = new StoreGateway(store, RetryPolicy.forStore(), d -> { }, LiveDocMetrics.NOOP);
        notifier = new ChangeNotifier(8, LiveDocMetrics.NOOP);
        gateway.addPublisher(notifier);
    }

    private SocketHub hub(String token) {
        return new SocketHub(notifier, gateway, Runnable::run, SETTINGS, token, metrics, Clock.systemUTC());
    }

    @Test
    void testHandshakeWithoutTokenRejected() {
        SocketHub hub = hub("s3cret");
        FakeFrameSink sink = new FakeFrameSink(FakeFrameSink.Mode.AUTO);

        assertNull(hub.connect(sink, null));

        assertEquals(List.of("error"), sink.types());
        assertEquals(1008, sink.closeCode());
        assertEquals(0, hub.getConnectionCount());
        verify(metrics).recordSessionOpened();
        verify(metrics).recordSessionClosed(CloseReason.HANDSHAKE_FAILURE);
    }

    @Test
    void testHandshakeWithWrongTokenRejected() {
        SocketHub hub = hub("s3cret");
        FakeFrameSink sink = new FakeFrameSink(FakeFrameSink.Mode.AUTO);

        assertNull(hub.connect(sink, "token=guess"));
        assertEquals(1008, sink.closeCode());
    }

    @Test
    void testHandshakeWithValidToken() {
        SocketHub hub = hub("s3 cret");
        FakeFrameSink sink = new FakeFrameSink(FakeFrameSink.Mode.AUTO);

        LiveSession session = hub.connect(sink, "client=web&token=s3%20cret");

        assertNotNull(session);
        assertEquals(SessionState.ACTIVE, session.getState());
        assertSame(session, hub.getSession(session.getSessionId()));
        assertEquals(1, hub.getConnectionCount());
        assertTrue(sink.frames().isEmpty());
    }

    @Test
    void testNoTokenConfiguredAcceptsAnyClient() {
        SocketHub hub = hub("");
        assertNotNull(hub.connect(new FakeFrameSink(FakeFrameSink.Mode.AUTO), null));
        assertNotNull(hub.connect(new FakeFrameSink(FakeFrameSink.Mode.AUTO), "token=whatever"));
        assertEquals(2, hub.getConnectionCount());
    }

    @Test
    void testSubscribeAndUnsubscribeRouting() {
        SocketHub hub = hub("");
        FakeFrameSink sink = new FakeFrameSink(FakeFrameSink.Mode.AUTO);
        LiveSession session = hub.connect(sink, null);

        hub.handleClientMessage(session, "{\"action\":\"subscribe\",\"resource\":\"cart-42\",\"extra\":1}");
        assertEquals(Set.of("cart-42"), session.getSubscribedResources());
        assertEquals(1, notifier.subscriberCount("cart-42"));

        hub.handleClientMessage(session, "{\"action\":\"unsubscribe\",\"resource\":\"cart-42\"}");
        assertTrue(session.getSubscribedResources().isEmpty());
        assertEquals(List.of("ack", "ack"), sink.types());
        assertTrue(session.isActive());
    }

    @Test
    void testSubscribeWithSnapshot() {
        gateway.write("cart-42", new ObjectMapper().createObjectNode().put("n", 1));
        SocketHub hub = hub("");
        FakeFrameSink sink = new FakeFrameSink(FakeFrameSink.Mode.AUTO);
        LiveSession session = hub.connect(sink, null);

        hub.handleClientMessage(session, "{\"action\":\"subscribe\",\"resource\":\"cart-42\",\"snapshot\":true}");

        assertEquals(List.of("ack", "event"), sink.types());
        assertEquals(List.of(1L), sink.eventRevisions("cart-42"));
    }

    @Test
    void testHeartbeatAndPingReply() {
        SocketHub hub = hub("");
        FakeFrameSink sink = new FakeFrameSink(FakeFrameSink.Mode.AUTO);
        LiveSession session = hub.connect(sink, null);

        hub.handleClientMessage(session, "{\"action\":\"heartbeat\"}");
        hub.handleClientMessage(session, "{\"action\":\"ping\"}");

        assertEquals(List.of("heartbeat", "heartbeat"), sink.types());
    }

    @Test
    void testMalformedJsonClosesWithProtocolViolation() {
        assertProtocolViolation("{not json", "Invalid JSON");
    }

    @Test
    void testUnknownActionClosesWithProtocolViolation() {
        assertProtocolViolation("{\"action\":\"dance\"}", "Unknown action: dance");
    }

    @Test
    void testMissingActionClosesWithProtocolViolation() {
        assertProtocolViolation("{\"resource\":\"cart-42\"}", "Missing 'action'");
    }

    @Test
    void testMissingResourceClosesWithProtocolViolation() {
        assertProtocolViolation("{\"action\":\"subscribe\"}", "Missing 'resource' for subscribe");
    }

    @Test
    void testInvalidResourceIdClosesWithProtocolViolation() {
        assertProtocolViolation("{\"action\":\"subscribe\",\"resource\":\"../etc\"}", "Invalid resource id");
    }

    private void assertProtocolViolation(String frame, String expectedError) {
        SocketHub hub = hub("");
        FakeFrameSink sink = new FakeFrameSink(FakeFrameSink.Mode.AUTO);
        LiveSession session = hub.connect(sink, null);

        hub.handleClientMessage(session, frame);

        assertEquals(SessionState.CLOSED, session.getState());
        assertEquals(CloseReason.PROTOCOL_VIOLATION, session.getCloseReason());
        assertEquals(List.of("error", "closing"), sink.types());
        assertTrue(sink.framesOfType("error").get(0).path("error").asText().startsWith(expectedError),
            "Error frame names the problem: " + sink.frames());
        assertFalse(sink.framesOfType("error").get(0).path("error").asText().contains(session.getSessionId()));
        assertEquals(1002, sink.closeCode());
        assertEquals(0, hub.getConnectionCount(), "Closed session leaves the hub");
    }

    @Test
    void testFramesIgnoredAfterClose() {
        SocketHub hub = hub("");
        FakeFrameSink sink = new FakeFrameSink(FakeFrameSink.Mode.AUTO);
        LiveSession session = hub.connect(sink, null);
        session.close(CloseReason.TRANSPORT_FAILURE);

        hub.handleClientMessage(session, "{\"action\":\"subscribe\",\"resource\":\"cart-42\"}");

        assertTrue(sink.frames().isEmpty());
        assertEquals(0, notifier.subscriberCount("cart-42"));
    }

    @Test
    void testShutdownClosesSessionsAndRefusesNewOnes() {
        SocketHub hub = hub("");
        FakeFrameSink first = new FakeFrameSink(FakeFrameSink.Mode.AUTO);
        FakeFrameSink second = new FakeFrameSink(FakeFrameSink.Mode.AUTO);
        hub.connect(first, null);
        hub.connect(second, null);

        hub.shutdown();

        assertEquals(1001, first.closeCode());
        assertEquals(1001, second.closeCode());
        assertEquals("ServerShutdown", first.framesOfType("closing").get(0).path("reason").asText());
        assertEquals(0, hub.getConnectionCount());

        FakeFrameSink late = new FakeFrameSink(FakeFrameSink.Mode.AUTO);
        assertNull(hub.connect(late, null));
        assertEquals(1008, late.closeCode());
    }

    @Test
    void testExtractToken() {
        assertEquals("abc", SocketHub.extractToken("token=abc"));
        assertEquals("a b", SocketHub.extractToken("x=1&token=a+b"));
        assertNull(SocketHub.extractToken("x=1"));
        assertNull(SocketHub.extractToken(null));
    }
}
