package io.livedoc.bootstrap;

import io.livedoc.config.LiveDocConfig;
import io.livedoc.infrastructure.common.RetryPolicy;
import io.livedoc.infrastructure.metrics.PrometheusLiveDocMetrics;
import io.livedoc.infrastructure.metrics.PrometheusMetricsHandler;
import io.livedoc.infrastructure.store.ChangeLogPublisher;
import io.livedoc.infrastructure.store.StoreGateway;
import io.livedoc.repository.DocumentStore;
import io.livedoc.repository.InMemoryDocumentStore;
import io.livedoc.repository.MongoDocumentStore;
import io.livedoc.service.notify.ChangeFeed;
import io.livedoc.service.notify.ChangeLogTailer;
import io.livedoc.service.notify.ChangeNotifier;
import io.livedoc.service.notify.MongoChangeStreamFeed;
import io.livedoc.transport.http.HttpServer;
import io.livedoc.transport.ws.LiveSession;
import io.livedoc.transport.ws.SessionReaper;
import io.livedoc.transport.ws.SocketHub;
import io.livedoc.transport.ws.SocketServer;
import io.livedoc.util.Env;
import io.prometheus.client.CollectorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point.
 *
 * Runs the HTTP service, the socket service, or both. The two never call each other:
 * - HTTP writes go through the store gateway, which appends each commit to the store's change log
 * - the socket service tails that log (or a MongoDB change stream) into the change notifier
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== livedoc Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        RunMode mode;
        LiveDocConfig config;
        try {
            mode = RunMode.resolve(args, Env.get("RUN_MODE", "ALL"));
            config = LiveDocConfig.fromEnv();
            StartupConfigValidator.validate(config, mode);
        } catch (IllegalStateException e) {
            log.error("❌ STARTUP VALIDATION FAILED", e);
            System.err.println("\n" + e.getMessage() + "\n");
            System.exit(1);
            return;
        }

        Running running = start(config, mode, CollectorRegistry.defaultRegistry, Clock.systemUTC());
        Runtime.getRuntime().addShutdownHook(new Thread(running::stop, "livedoc-shutdown"));

        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== livedoc started ({}) ===", mode);
        log.info("═══════════════════════════════════════════════════════════════");
    }

    /**
     * Build and start the services for a run mode.
     *
     * @return handle that stops everything in reverse start order
     */
    public static Running start(LiveDocConfig config, RunMode mode, CollectorRegistry registry, Clock clock) {
        Running running = new Running();
        try {
            startServices(config, mode, registry, clock, running);
        } catch (RuntimeException e) {
            running.stop();
            throw e;
        }
        return running;
    }

    private static void startServices(LiveDocConfig config, RunMode mode, CollectorRegistry registry,
                                      Clock clock, Running running) {
        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusLiveDocMetrics metrics = new PrometheusLiveDocMetrics(registry);
        PrometheusMetricsHandler metricsHandler = new PrometheusMetricsHandler(metrics.getRegistry());
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Store
        // ═══════════════════════════════════════════════════════════════
        DocumentStore store = createStore(config, clock);
        running.onStop("document store", store::close);

        RetryPolicy retry = RetryPolicy.builder()
            .initialDelay(config.storeRetryInitialDelay())
            .maxDelay(config.storeRetryMaxDelay())
            .maxAttempts(config.storeRetryAttempts())
            .build();
        StoreGateway gateway = new StoreGateway(store, retry, metrics);
        log.info("✓ Store gateway ready (retry: {} attempts, {}ms initial, {}ms max)",
            config.storeRetryAttempts(), config.storeRetryInitialDelay().toMillis(),
            config.storeRetryMaxDelay().toMillis());

        if (Env.getBool("STORE_STARTUP_CHECK", true)) {
            if (gateway.isStoreReachable()) {
                log.info("✓ Store reachable");
            } else {
                log.warn("⚠️ Store not reachable at startup; requests will fail or retry until it is");
            }
        }

        // ═══════════════════════════════════════════════════════════════
        // HTTP service
        // ═══════════════════════════════════════════════════════════════
        if (mode.runsHttp()) {
            // Publish step: every committed write lands in the store-side change log
            if (config.changeFeed() == LiveDocConfig.ChangeFeedType.POLL) {
                ChangeLogPublisher changeLog = new ChangeLogPublisher(gateway, retry, metrics);
                gateway.addPublisher(changeLog);
                running.onStop("change log publisher", changeLog::close);
                log.info("✓ Change log publisher registered");
            }
            HttpServer http = new HttpServer(gateway, metricsHandler, clock);
            http.start(config.httpHost(), config.httpPort());
            running.onStop("HTTP server", http::stop);
            log.info("✓ HTTP service started on port {}", config.httpPort());
        } else {
            log.info("⏭️ Skipping HTTP service (mode {})", mode);
        }

        // ═══════════════════════════════════════════════════════════════
        // Socket service
        // ═══════════════════════════════════════════════════════════════
        if (mode.runsSocket()) {
            ChangeNotifier notifier = new ChangeNotifier(config.subscriberBufferSize(), metrics);

            ExecutorService dispatch = dispatchPool(config.dispatchThreads());
            running.onStop("dispatch pool", () -> shutdownPool(dispatch));

            ChangeFeed feed = createFeed(config, store, notifier, retry, metrics, clock);

            SocketHub hub = new SocketHub(notifier, gateway, dispatch,
                new LiveSession.Settings(config.maxInFlightSends(), config.flushTimeout()),
                config.socketToken(), metrics, clock);
            SocketServer socketServer = new SocketServer(hub, gateway, metricsHandler, !config.socketToken().isEmpty());
            socketServer.start(config.socketHost(), config.socketPort());
            running.onStop("socket server", socketServer::stop);

            SessionReaper reaper = new SessionReaper(hub, config.reaperInterval(), config.heartbeatTimeout(), clock);
            reaper.start();
            running.onStop("session reaper", reaper::stop);

            feed.start();
            running.onStop("change feed", feed::stop);
            log.info("✓ Socket service started on port {} (feed={}, dispatch threads={})",
                config.socketPort(), config.changeFeed(), config.dispatchThreads());
        } else {
            log.info("⏭️ Skipping socket service (mode {})", mode);
        }
    }

    private static DocumentStore createStore(LiveDocConfig config, Clock clock) {
        return switch (config.store()) {
            case MONGO -> new MongoDocumentStore(config);
            case MEMORY -> new InMemoryDocumentStore(clock);
        };
    }

    private static ChangeFeed createFeed(LiveDocConfig config, DocumentStore store, ChangeNotifier notifier,
                                         RetryPolicy retry, PrometheusLiveDocMetrics metrics, Clock clock) {
        if (config.changeFeed() == LiveDocConfig.ChangeFeedType.CHANGESTREAM) {
            return new MongoChangeStreamFeed((MongoDocumentStore) store, notifier, retry);
        }
        return new ChangeLogTailer(store, notifier, config.tailPollInterval(), config.tailBatchSize(),
            config.tailGapTimeout(), retry, metrics, clock);
    }

    private static ExecutorService dispatchPool(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "livedoc-dispatch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private static void shutdownPool(ExecutorService pool) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Started components, stopped in reverse order.
     */
    public static final class Running {
        private final Deque<Step> steps = new ArrayDeque<>();
        private boolean stopped = false;

        private record Step(String name, Runnable action) {
        }

        synchronized void onStop(String name, Runnable action) {
            steps.push(new Step(name, action));
        }

        public synchronized void stop() {
            if (stopped) {
                return;
            }
            stopped = true;
            log.info("Shutting down...");
            while (!steps.isEmpty()) {
                Step step = steps.pop();
                try {
                    step.action().run();
                } catch (RuntimeException e) {
                    log.warn("Failed to stop {}: {}", step.name(), e.toString());
                }
            }
            log.info("✓ Shutdown complete");
        }
    }
}
