package io.livedoc.transport.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.livedoc.infrastructure.store.StoreGateway;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * Socket service listener: {@code /socket} for clients, plus {@code /health} and {@code /metrics}.
 */
public final class SocketServer {
    private static final Logger log = LoggerFactory.getLogger(SocketServer.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SocketHub hub;
    private final StoreGateway gateway;
    private final HttpHandler metricsHandler;
    private final boolean tokenRequired;
    private Undertow server;

    public SocketServer(SocketHub hub, StoreGateway gateway, HttpHandler metricsHandler, boolean tokenRequired) {
        this.hub = hub;
        this.gateway = gateway;
        this.metricsHandler = metricsHandler;
        this.tokenRequired = tokenRequired;
    }

    public synchronized void start(String host, int port) {
        if (server != null) {
            throw new IllegalStateException("Socket server already started");
        }
        if (tokenRequired) {
            log.info("[SOCKET] Token authentication ENABLED");
        } else {
            log.warn("[SOCKET] Token authentication DISABLED - set SOCKET_TOKEN env var for production");
        }

        PathHandler paths = new PathHandler()
            .addExactPath("/socket", hub.websocketHandler())
            .addExactPath("/health", new BlockingHandler(this::health))
            .addExactPath("/metrics", metricsHandler);

        server = Undertow.builder()
            .addHttpListener(port, host)
            .setHandler(paths)
            .build();
        server.start();
        log.info("[SOCKET] Listening on ws://{}:{}/socket", host, port);
    }

    /**
     * Close every session with SERVER_SHUTDOWN, then stop the listener.
     */
    public synchronized void stop() {
        if (server != null) {
            hub.shutdown();
            server.stop();
            server = null;
            log.info("[SOCKET] Stopped");
        }
    }

    private void health(HttpServerExchange exchange) {
        boolean reachable = gateway.isStoreReachable();
        ObjectNode health = MAPPER.createObjectNode();
        // The socket service keeps serving with stale delivery while the store is down
        health.put("status", reachable ? "ok" : "degraded");
        health.put("store", reachable ? "up" : "down");
        health.put("sessions", hub.getConnectionCount());
        health.put("ts", Instant.now().toString());

        exchange.setStatusCode(200);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(health.toString(), StandardCharsets.UTF_8);
    }
}
