package io.livedoc.infrastructure.store;

import io.livedoc.domain.model.ChangeEvent;
import io.livedoc.infrastructure.common.RetryPolicy;
import io.livedoc.infrastructure.metrics.LiveDocMetrics;
import io.livedoc.repository.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Publishes committed writes into the store's change log, where the socket process tails them.
 * The store is the only channel between the two processes.
 *
 * Appends that still fail after the gateway's retries go to an in-process backlog. A background
 * thread keeps appending the backlog, oldest first, until the store answers again. While the
 * backlog is not empty new changes queue behind it, so the log keeps commit order.
 */
public final class ChangeLogPublisher implements ChangePublisher {
    private static final Logger log = LoggerFactory.getLogger(ChangeLogPublisher.class);

    private final StoreGateway gateway;
    private final RetryPolicy backoff;
    private final LiveDocMetrics metrics;

    private final ScheduledExecutorService retrier = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "livedoc-changelog-retry");
        t.setDaemon(true);
        return t;
    });

    // Guarded by this
    private final Deque<ChangeEvent> backlog = new ArrayDeque<>();
    private boolean retryScheduled = false;
    private boolean closed = false;

    public ChangeLogPublisher(StoreGateway gateway, RetryPolicy backoff, LiveDocMetrics metrics) {
        this.gateway = gateway;
        this.backoff = backoff.fresh();
        this.metrics = metrics;
    }

    @Override
    public synchronized void publish(ChangeEvent event) {
        if (!backlog.isEmpty()) {
            backlog.addLast(event);
            log.debug("[CHANGELOG] Queued behind backlog: resource={}, revision={}, backlog={}",
                event.resourceId(), event.revision(), backlog.size());
            return;
        }
        try {
            append(event);
        } catch (StoreUnavailableException e) {
            metrics.recordChangeLogAppendFailure();
            backlog.addLast(event);
            log.warn("[CHANGELOG] Append failed, retrying in background: resource={}, revision={}: {}",
                event.resourceId(), event.revision(), e.getMessage());
            scheduleRetry(backoff.getNextDelay());
        }
    }

    public synchronized int backlogSize() {
        return backlog.size();
    }

    /**
     * Stop retrying. Whatever is still in the backlog is logged and dropped.
     */
    public void close() {
        synchronized (this) {
            closed = true;
            if (!backlog.isEmpty()) {
                log.error("[CHANGELOG] Closing with {} unlogged changes, oldest: resource={}, revision={}",
                    backlog.size(), backlog.peekFirst().resourceId(), backlog.peekFirst().revision());
            }
        }
        retrier.shutdown();
        try {
            if (!retrier.awaitTermination(5, TimeUnit.SECONDS)) {
                retrier.shutdownNow();
            }
        } catch (InterruptedException e) {
            retrier.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void append(ChangeEvent event) {
        long seq = gateway.appendChange(event);
        log.debug("[CHANGELOG] Logged seq={}, resource={}, revision={}", seq, event.resourceId(), event.revision());
    }

    // Caller holds the monitor
    private void scheduleRetry(Duration delay) {
        if (retryScheduled || closed) {
            return;
        }
        retryScheduled = true;
        retrier.schedule(this::drainBacklog, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private synchronized void drainBacklog() {
        retryScheduled = false;
        while (!backlog.isEmpty() && !closed) {
            ChangeEvent head = backlog.peekFirst();
            try {
                append(head);
            } catch (StoreUnavailableException e) {
                backoff.recordFailure();
                Duration delay = backoff.isExhausted() ? backoff.getMaxDelay() : backoff.getNextDelay();
                log.debug("[CHANGELOG] Store still unavailable, {} changes waiting, next attempt in {}ms",
                    backlog.size(), delay.toMillis());
                scheduleRetry(delay);
                return;
            } catch (RuntimeException e) {
                backlog.pollFirst();
                log.error("[CHANGELOG] Dropping change that cannot be logged: resource={}, revision={}",
                    head.resourceId(), head.revision(), e);
                continue;
            }
            backlog.pollFirst();
        }
        if (backlog.isEmpty() && backoff.getAttemptCount() > 0) {
            log.info("[CHANGELOG] Backlog drained after {} failed attempts", backoff.getAttemptCount());
            backoff.recordSuccess();
        }
    }
}
