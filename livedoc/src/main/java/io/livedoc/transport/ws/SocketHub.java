package io.livedoc.transport.ws;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.livedoc.domain.common.MessageType;
import io.livedoc.domain.model.ChangeEvent;
import io.livedoc.domain.session.CloseReason;
import io.livedoc.domain.session.SessionState;
import io.livedoc.infrastructure.metrics.LiveDocMetrics;
import io.livedoc.infrastructure.store.StoreGateway;
import io.livedoc.security.InputValidator;
import io.livedoc.service.notify.ChangeNotifier;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.CloseMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;

/**
 * Undertow-native WebSocket hub with:
 * - Optional token handshake (?token=xxx, required when a token is configured)
 * - Per-resource subscriptions backed by the change notifier
 * - JSON frames in both directions
 * - Protocol violations answered with an error frame and a close
 */
public final class SocketHub {
    private static final Logger log = LoggerFactory.getLogger(SocketHub.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final long SHUTDOWN_GRACE_NANOS = 100_000_000L;

    private final ConcurrentMap<String, LiveSession> sessions = new ConcurrentHashMap<>();

    private final ChangeNotifier notifier;
    private final StoreGateway gateway;
    private final Executor dispatch;
    private final LiveSession.Settings settings;
    private final String token;
    private final LiveDocMetrics metrics;
    private final Clock clock;
    private final InputValidator validator = new InputValidator();

    private volatile boolean shuttingDown = false;

    public SocketHub(ChangeNotifier notifier, StoreGateway gateway, Executor dispatch,
                     LiveSession.Settings settings, String token, LiveDocMetrics metrics, Clock clock) {
        this.notifier = notifier;
        this.gateway = gateway;
        this.dispatch = dispatch;
        this.settings = settings;
        this.token = token == null ? "" : token;
        this.metrics = metrics;
        this.clock = clock;
    }

    public WebSocketProtocolHandshakeHandler websocketHandler() {
        return new WebSocketProtocolHandshakeHandler(new WebSocketConnectionCallback() {
            @Override
            public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
                LiveSession session = connect(new UndertowFrameSink(channel), exchange.getQueryString());
                if (session == null) {
                    return;
                }

                channel.getReceiveSetter().set(new AbstractReceiveListener() {
                    @Override
                    protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                        handleClientMessage(session, message.getData());
                    }

                    @Override
                    protected void onCloseMessage(CloseMessage cm, WebSocketChannel ch) {
                        session.closeAsync(CloseReason.CLIENT_CLOSED);
                        super.onCloseMessage(cm, ch);
                    }

                    @Override
                    protected void onError(WebSocketChannel ch, Throwable error) {
                        log.warn("[SOCKET] Transport error on session {}: {}", session.getSessionId(), error.toString());
                        session.closeAsync(CloseReason.TRANSPORT_FAILURE);
                        super.onError(ch, error);
                    }
                });
                channel.addCloseTask(ch -> session.closeAsync(CloseReason.TRANSPORT_FAILURE));
                channel.resumeReceives();
            }
        });
    }

    /**
     * Create a session for a new connection and run the handshake.
     *
     * @return the active session, or null if the handshake was refused
     */
    LiveSession connect(FrameSink sink, String query) {
        String sessionId = UUID.randomUUID().toString();
        LiveSession session = new LiveSession(sessionId, sink, notifier, gateway, dispatch, settings,
            metrics, clock, closed -> sessions.remove(closed.getSessionId()));
        metrics.recordSessionOpened();

        if (shuttingDown) {
            session.rejectHandshake("Server shutting down");
            return null;
        }
        if (!token.isEmpty() && !tokenMatches(extractToken(query))) {
            log.warn("[SOCKET] Handshake rejected: invalid token from {}", sink.remoteAddress());
            session.rejectHandshake("Invalid or missing token");
            return null;
        }

        sessions.put(sessionId, session);
        session.activate();
        log.info("[SOCKET] Connected: {} (session={})", sink.remoteAddress(), sessionId);
        return session;
    }

    /**
     * Route one inbound text frame. Any violation closes the session with PROTOCOL_VIOLATION.
     */
    void handleClientMessage(LiveSession session, String raw) {
        if (!session.isActive()) {
            return;
        }
        session.touch();
        try {
            ClientMessage msg = parse(session, raw);
            switch (msg.action) {
                case "subscribe" -> session.subscribe(requireResource(session, msg), Boolean.TRUE.equals(msg.snapshot));
                case "unsubscribe" -> session.unsubscribe(requireResource(session, msg));
                case "heartbeat", "ping" -> session.heartbeat();
                default -> throw new ProtocolViolationException(session.getSessionId(), "Unknown action: " + msg.action);
            }
        } catch (ProtocolViolationException e) {
            log.warn("[SOCKET] Protocol violation: {}", e.getMessage());
            session.sendError(e.clientMessage());
            session.closeAsync(CloseReason.PROTOCOL_VIOLATION);
        }
    }

    private ClientMessage parse(LiveSession session, String raw) {
        ClientMessage msg;
        try {
            msg = MAPPER.readValue(raw, ClientMessage.class);
        } catch (JsonProcessingException e) {
            throw new ProtocolViolationException(session.getSessionId(), "Invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (msg == null || msg.action == null || msg.action.isBlank()) {
            throw new ProtocolViolationException(session.getSessionId(), "Missing 'action'");
        }
        return msg;
    }

    private String requireResource(LiveSession session, ClientMessage msg) {
        if (msg.resource == null || msg.resource.isBlank()) {
            throw new ProtocolViolationException(session.getSessionId(), "Missing 'resource' for " + msg.action);
        }
        if (!validator.isValidResourceId(msg.resource)) {
            throw new ProtocolViolationException(session.getSessionId(), "Invalid resource id: " + msg.resource);
        }
        return msg.resource;
    }

    private boolean tokenMatches(String presented) {
        if (presented == null) {
            return false;
        }
        return MessageDigest.isEqual(presented.getBytes(StandardCharsets.UTF_8), token.getBytes(StandardCharsets.UTF_8));
    }

    static String extractToken(String query) {
        if (query == null)
            return null;
        for (String param : query.split("&")) {
            if (param.startsWith("token=")) {
                return URLDecoder.decode(param.substring(6), StandardCharsets.UTF_8);
            }
        }
        return null;
    }

    /**
     * Close every session with SERVER_SHUTDOWN and refuse new ones.
     *
     * Sessions flush concurrently; this waits at most one flush timeout for all of them together.
     */
    public void shutdown() {
        shuttingDown = true;
        List<LiveSession> open = new ArrayList<>(sessions.values());
        for (LiveSession session : open) {
            session.close(CloseReason.SERVER_SHUTDOWN);
        }
        long deadline = System.nanoTime() + settings.flushTimeout().toNanos() + SHUTDOWN_GRACE_NANOS;
        while (!allClosed(open) && System.nanoTime() < deadline) {
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        long pending = open.stream().filter(s -> s.getState() != SessionState.CLOSED).count();
        if (pending > 0) {
            log.warn("[SOCKET] Shutdown: {} of {} sessions still closing", pending, open.size());
        } else {
            log.info("[SOCKET] Closed {} sessions for shutdown", open.size());
        }
    }

    private static boolean allClosed(List<LiveSession> open) {
        for (LiveSession session : open) {
            if (session.getState() != SessionState.CLOSED) {
                return false;
            }
        }
        return true;
    }

    public Collection<LiveSession> sessions() {
        return List.copyOf(sessions.values());
    }

    public LiveSession getSession(String sessionId) {
        return sessions.get(sessionId);
    }

    public int getConnectionCount() {
        return sessions.size();
    }

    static String encode(ServerMessage msg) {
        try {
            return MAPPER.writeValueAsString(msg);
        } catch (JsonProcessingException e) {
            log.warn("[SOCKET] Failed to serialize socket message: {}", e.toString());
            return null;
        }
    }

    // Message models
    public static final class ClientMessage {
        public String action;
        public String resource;
        public Boolean snapshot;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class ServerMessage {
        public String type;
        public String action;
        public String resource;
        public Long revision;
        public JsonNode payload;
        public String sessionId;
        public String error;
        public String reason;
        public String ts;

        public ServerMessage() {
        }

        private ServerMessage(MessageType type, String ts) {
            this.type = type.wireName();
            this.ts = ts;
        }

        static ServerMessage ack(String action, String resource, String sessionId) {
            ServerMessage m = new ServerMessage(MessageType.ACK, Instant.now().toString());
            m.action = action;
            m.resource = resource;
            m.sessionId = sessionId;
            return m;
        }

        static ServerMessage event(ChangeEvent event) {
            ServerMessage m = new ServerMessage(MessageType.EVENT, event.committedAt().toString());
            m.resource = event.resourceId();
            m.revision = event.revision();
            m.payload = event.payload();
            return m;
        }

        static ServerMessage heartbeat() {
            return new ServerMessage(MessageType.HEARTBEAT, Instant.now().toString());
        }

        static ServerMessage error(String error) {
            ServerMessage m = new ServerMessage(MessageType.ERROR, Instant.now().toString());
            m.error = error;
            return m;
        }

        static ServerMessage closing(CloseReason reason) {
            ServerMessage m = new ServerMessage(MessageType.CLOSING, Instant.now().toString());
            m.reason = reason.wireName();
            return m;
        }
    }
}
