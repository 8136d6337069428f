package io.livedoc.infrastructure.metrics;

import io.livedoc.domain.session.CloseReason;

import java.time.Duration;

/**
 * Metrics for the store write path and the change propagation path.
 *
 * Implementations can publish to Prometheus or be a no-op in tests.
 */
public interface LiveDocMetrics {

    /**
     * Record a store operation outcome.
     *
     * @param operation read, write, appendChange
     * @param outcome   ok, conflict, unavailable
     */
    void recordStoreOperation(String operation, String outcome, Duration latency);

    void recordStoreRetry(String operation);

    void recordChangeLogAppendFailure();

    void recordEventPublished(boolean accepted);

    void recordEventDelivered();

    void recordSubscriberDropped();

    void recordSessionOpened();

    void recordSessionClosed(CloseReason reason);

    /**
     * Seconds between commit and the tailer observing the change.
     */
    void recordTailLag(Duration lag);

    LiveDocMetrics NOOP = new LiveDocMetrics() {
        @Override public void recordStoreOperation(String operation, String outcome, Duration latency) {}
        @Override public void recordStoreRetry(String operation) {}
        @Override public void recordChangeLogAppendFailure() {}
        @Override public void recordEventPublished(boolean accepted) {}
        @Override public void recordEventDelivered() {}
        @Override public void recordSubscriberDropped() {}
        @Override public void recordSessionOpened() {}
        @Override public void recordSessionClosed(CloseReason reason) {}
        @Override public void recordTailLag(Duration lag) {}
    };
}
