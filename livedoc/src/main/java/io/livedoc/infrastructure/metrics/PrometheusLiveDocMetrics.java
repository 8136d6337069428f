package io.livedoc.infrastructure.metrics;

import io.livedoc.domain.session.CloseReason;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Prometheus implementation of LiveDocMetrics.
 *
 * Key Metrics:
 * - livedoc_store_operations_total{operation, outcome}
 * - livedoc_store_latency_seconds{operation}
 * - livedoc_store_retries_total{operation}
 * - livedoc_changelog_append_failures_total
 * - livedoc_events_published_total{result}
 * - livedoc_events_delivered_total
 * - livedoc_subscribers_dropped_total
 * - livedoc_sessions_active
 * - livedoc_sessions_closed_total{reason}
 * - livedoc_tail_lag_seconds
 */
public class PrometheusLiveDocMetrics implements LiveDocMetrics {

    private final CollectorRegistry registry;

    private final Counter storeOperations;
    private final Histogram storeLatency;
    private final Counter storeRetries;
    private final Counter changeLogAppendFailures;
    private final Counter eventsPublished;
    private final Counter eventsDelivered;
    private final Counter subscribersDropped;
    private final Gauge sessionsActive;
    private final Counter sessionsClosed;
    private final Histogram tailLag;

    public PrometheusLiveDocMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusLiveDocMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.storeOperations = Counter.build()
            .name("livedoc_store_operations_total")
            .help("Store operations by outcome")
            .labelNames("operation", "outcome")
            .register(registry);

        this.storeLatency = Histogram.build()
            .name("livedoc_store_latency_seconds")
            .help("Store operation latency in seconds")
            .labelNames("operation")
            .buckets(0.001, 0.005, 0.01, 0.05, 0.1, 0.5, 1.0, 2.0)
            .register(registry);

        this.storeRetries = Counter.build()
            .name("livedoc_store_retries_total")
            .help("Store operation retries after transient failures")
            .labelNames("operation")
            .register(registry);

        this.changeLogAppendFailures = Counter.build()
            .name("livedoc_changelog_append_failures_total")
            .help("Committed writes whose change log append failed")
            .register(registry);

        this.eventsPublished = Counter.build()
            .name("livedoc_events_published_total")
            .help("Change events offered to the notifier")
            .labelNames("result")
            .register(registry);

        this.eventsDelivered = Counter.build()
            .name("livedoc_events_delivered_total")
            .help("Change events pushed to socket clients")
            .register(registry);

        this.subscribersDropped = Counter.build()
            .name("livedoc_subscribers_dropped_total")
            .help("Subscribers dropped after buffer overflow")
            .register(registry);

        this.sessionsActive = Gauge.build()
            .name("livedoc_sessions_active")
            .help("Open socket sessions")
            .register(registry);

        this.sessionsClosed = Counter.build()
            .name("livedoc_sessions_closed_total")
            .help("Closed socket sessions by reason")
            .labelNames("reason")
            .register(registry);

        this.tailLag = Histogram.build()
            .name("livedoc_tail_lag_seconds")
            .help("Delay between commit and change log observation")
            .buckets(0.05, 0.1, 0.25, 0.5, 1.0, 2.5, 5.0, 10.0)
            .register(registry);
    }

    @Override
    public void recordStoreOperation(String operation, String outcome, Duration latency) {
        storeOperations.labels(operation, outcome).inc();
        storeLatency.labels(operation).observe(latency.toNanos() / 1_000_000_000.0);
    }

    @Override
    public void recordStoreRetry(String operation) {
        storeRetries.labels(operation).inc();
    }

    @Override
    public void recordChangeLogAppendFailure() {
        changeLogAppendFailures.inc();
    }

    @Override
    public void recordEventPublished(boolean accepted) {
        eventsPublished.labels(accepted ? "accepted" : "stale").inc();
    }

    @Override
    public void recordEventDelivered() {
        eventsDelivered.inc();
    }

    @Override
    public void recordSubscriberDropped() {
        subscribersDropped.inc();
    }

    @Override
    public void recordSessionOpened() {
        sessionsActive.inc();
    }

    @Override
    public void recordSessionClosed(CloseReason reason) {
        sessionsActive.dec();
        sessionsClosed.labels(reason.name()).inc();
    }

    @Override
    public void recordTailLag(Duration lag) {
        tailLag.observe(Math.max(0, lag.toMillis()) / 1000.0);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
