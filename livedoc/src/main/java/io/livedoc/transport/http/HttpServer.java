package io.livedoc.transport.http;

import io.livedoc.infrastructure.store.StoreGateway;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.BlockingHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Stateless HTTP service: resource API, form messages, static pages and metrics on one Undertow listener.
 */
public final class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final StoreGateway gateway;
    private final HttpHandler metricsHandler;
    private final Clock clock;
    private Undertow server;

    public HttpServer(StoreGateway gateway, HttpHandler metricsHandler, Clock clock) {
        this.gateway = gateway;
        this.metricsHandler = metricsHandler;
        this.clock = clock;
    }

    public synchronized void start(String host, int port) {
        if (server != null) {
            throw new IllegalStateException("HTTP server already started");
        }
        server = Undertow.builder()
            .addHttpListener(port, host)
            .setHandler(routes())
            .build();
        server.start();
        log.info("[HTTP] Listening on http://{}:{}/", host, port);
    }

    public synchronized void stop() {
        if (server != null) {
            server.stop();
            server = null;
            log.info("[HTTP] Stopped");
        }
    }

    RoutingHandler routes() {
        ResourceHandlers api = new ResourceHandlers(gateway);
        MessageFormHandler forms = new MessageFormHandler(gateway, api, clock);

        // Store calls block; BlockingHandler dispatches them off the IO thread
        return Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/api/health", new BlockingHandler(api::health))
            .put("/api/resources/{resourceId}", new BlockingHandler(api::putResource))
            .get("/api/resources/{resourceId}", new BlockingHandler(api::getResource))
            .post("/message", new BlockingHandler(forms::postMessage))
            .setFallbackHandler(StaticPages.handler());
    }
}
