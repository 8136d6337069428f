package io.livedoc.infrastructure.store;

import com.fasterxml.jackson.databind.JsonNode;
import io.livedoc.domain.model.ChangeEvent;
import io.livedoc.domain.model.StoreDocument;
import io.livedoc.infrastructure.common.RetryPolicy;
import io.livedoc.infrastructure.metrics.LiveDocMetrics;
import io.livedoc.repository.DocumentNotFoundException;
import io.livedoc.repository.DocumentStore;
import io.livedoc.repository.RevisionConflictException;
import io.livedoc.repository.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Single choke point for store access.
 *
 * Reliability rule: commit the write first, then hand the change to the publishers.
 * - {@link StoreUnavailableException} is retried with backoff, rethrown once attempts run out
 * - {@link RevisionConflictException} and {@link DocumentNotFoundException} go straight to the caller
 * - a failing publisher never fails the write; the document is already durable
 */
public final class StoreGateway {
    private static final Logger log = LoggerFactory.getLogger(StoreGateway.class);

    private final DocumentStore store;
    private final RetryPolicy retryTemplate;
    private final RetryPolicy.Sleeper sleeper;
    private final LiveDocMetrics metrics;
    private final List<ChangePublisher> publishers = new CopyOnWriteArrayList<>();

    public StoreGateway(DocumentStore store, RetryPolicy retryTemplate, LiveDocMetrics metrics) {
        this(store, retryTemplate, RetryPolicy.Sleeper.THREAD, metrics);
    }

    public StoreGateway(DocumentStore store, RetryPolicy retryTemplate, RetryPolicy.Sleeper sleeper,
                        LiveDocMetrics metrics) {
        this.store = store;
        this.retryTemplate = retryTemplate;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    public void addPublisher(ChangePublisher publisher) {
        publishers.add(publisher);
    }

    /**
     * Unconditional write (last write wins).
     *
     * @return committed revision
     */
    public long write(String resourceId, JsonNode document) {
        return write(resourceId, document, null);
    }

    /**
     * Write, optionally guarded by the revision the caller last saw.
     *
     * @param expectedRevision null for unconditional, 0 for create-only
     * @return committed revision
     */
    public long write(String resourceId, JsonNode document, Long expectedRevision) {
        StoreDocument committed = withRetry("write", () -> store.write(resourceId, document, expectedRevision));
        log.debug("[STORE] Write committed: resource={}, revision={}", resourceId, committed.revision());

        ChangeEvent event = committed.toChangeEvent();
        for (ChangePublisher publisher : publishers) {
            try {
                publisher.publish(event);
            } catch (RuntimeException e) {
                metrics.recordChangeLogAppendFailure();
                log.error("[STORE] Change publish failed: resource={}, revision={}, publisher={}",
                    resourceId, committed.revision(), publisher.getClass().getSimpleName(), e);
            }
        }
        return committed.revision();
    }

    /**
     * @throws DocumentNotFoundException if the resource was never written
     */
    public StoreDocument read(String resourceId) {
        return withRetry("read", () -> store.read(resourceId))
            .orElseThrow(() -> new DocumentNotFoundException(resourceId));
    }

    /**
     * Append to the store-side change log with the same retry policy as writes.
     */
    public long appendChange(ChangeEvent event) {
        return withRetry("appendChange", () -> store.appendChange(event));
    }

    public boolean isStoreReachable() {
        try {
            return store.ping();
        } catch (RuntimeException e) {
            log.debug("[STORE] ping failed: {}", e.toString());
            return false;
        }
    }

    private <T> T withRetry(String operation, Supplier<T> action) {
        RetryPolicy policy = retryTemplate.fresh();
        while (true) {
            long start = System.nanoTime();
            try {
                T result = action.get();
                metrics.recordStoreOperation(operation, "ok", Duration.ofNanos(System.nanoTime() - start));
                return result;
            } catch (RevisionConflictException e) {
                metrics.recordStoreOperation(operation, "conflict", Duration.ofNanos(System.nanoTime() - start));
                throw e;
            } catch (StoreUnavailableException e) {
                metrics.recordStoreOperation(operation, "unavailable", Duration.ofNanos(System.nanoTime() - start));
                policy.recordFailure();
                if (!policy.shouldRetry()) {
                    log.warn("[STORE] {} failed after {} attempts: {}", operation, policy.getAttemptCount(), e.getMessage());
                    throw e;
                }
                Duration delay = policy.getNextDelay();
                log.debug("[STORE] {} unavailable (attempt {}/{}), retrying in {}ms",
                    operation, policy.getAttemptCount(), policy.getMaxAttempts(), delay.toMillis());
                metrics.recordStoreRetry(operation);
                pause(operation, delay, e);
            }
        }
    }

    private void pause(String operation, Duration delay, StoreUnavailableException cause) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException(operation, "interrupted while backing off", cause);
        }
    }
}
