package io.livedoc.service.notify;

import io.livedoc.domain.model.ChangeEvent;
import io.livedoc.domain.model.ChangeRecord;
import io.livedoc.infrastructure.common.RetryPolicy;
import io.livedoc.infrastructure.metrics.LiveDocMetrics;
import io.livedoc.infrastructure.store.ChangePublisher;
import io.livedoc.repository.DocumentStore;
import io.livedoc.repository.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Polls the store's change log and republishes every entry in sequence order.
 *
 * Cursor rules:
 * - starts at the newest sequence number present when the tailer first reaches the store (no replay)
 * - advances only over contiguous sequence numbers
 * - a hole (sequence allocated by a writer that has not committed yet) holds the cursor
 *   for at most {@code gapTimeout}, then is skipped with a warning
 *
 * Store outages back off with {@link RetryPolicy}; once attempts are exhausted polling
 * continues at the maximum delay until the store answers again.
 */
public final class ChangeLogTailer implements ChangeFeed {
    private static final Logger log = LoggerFactory.getLogger(ChangeLogTailer.class);

    private final DocumentStore store;
    private final ChangePublisher sink;
    private final Duration pollInterval;
    private final int batchSize;
    private final Duration gapTimeout;
    private final RetryPolicy backoff;
    private final LiveDocMetrics metrics;
    private final Clock clock;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "livedoc-change-tailer");
        t.setDaemon(true);
        return t;
    });

    // Written only by the tailer thread
    private volatile long cursor = -1;
    private Instant gapSince;

    private volatile boolean running = false;

    public ChangeLogTailer(DocumentStore store, ChangePublisher sink, Duration pollInterval, int batchSize,
                           Duration gapTimeout, RetryPolicy backoff, LiveDocMetrics metrics, Clock clock) {
        this.store = store;
        this.sink = sink;
        this.pollInterval = pollInterval;
        this.batchSize = batchSize;
        this.gapTimeout = gapTimeout;
        this.backoff = backoff.fresh();
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public synchronized void start() {
        if (running) {
            log.warn("[TAILER] Already running");
            return;
        }
        running = true;
        scheduler.schedule(this::tick, 0, TimeUnit.MILLISECONDS);
        log.info("[TAILER] Started (poll={}ms, batch={}, gapTimeout={}ms)",
            pollInterval.toMillis(), batchSize, gapTimeout.toMillis());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[TAILER] Stopped at seq={}", cursor);
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void tick() {
        Duration delay = pollInterval;
        try {
            delay = pollOnce();
        } catch (RuntimeException e) {
            log.error("[TAILER] Unexpected error while tailing", e);
        }
        if (running) {
            scheduler.schedule(this::tick, delay.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    /**
     * One polling round.
     *
     * @return delay before the next round
     */
    Duration pollOnce() {
        try {
            if (cursor < 0) {
                cursor = store.latestChangeSeq();
                log.info("[TAILER] Tailing change log from seq={}", cursor);
            }
            List<ChangeRecord> batch = store.changesAfter(cursor, batchSize);
            if (backoff.getAttemptCount() > 0) {
                log.info("[TAILER] Store reachable again after {} failed polls", backoff.getAttemptCount());
                backoff.recordSuccess();
            }
            consume(batch);
            return pollInterval;
        } catch (StoreUnavailableException e) {
            backoff.recordFailure();
            Duration delay = backoff.isExhausted() ? backoff.getMaxDelay() : backoff.getNextDelay();
            if (backoff.getAttemptCount() == 1) {
                log.warn("[TAILER] Store unavailable, delivery is stale until it recovers: {}", e.getMessage());
            } else {
                log.debug("[TAILER] Store still unavailable (attempt {}), next poll in {}ms",
                    backoff.getAttemptCount(), delay.toMillis());
            }
            return delay;
        }
    }

    private void consume(List<ChangeRecord> batch) {
        for (ChangeRecord record : batch) {
            long seq = record.seq();
            if (seq <= cursor) {
                continue;
            }
            if (seq > cursor + 1) {
                Instant now = clock.instant();
                if (gapSince == null) {
                    gapSince = now;
                    log.debug("[TAILER] Waiting for seq {}..{}", cursor + 1, seq - 1);
                    return;
                }
                if (Duration.between(gapSince, now).compareTo(gapTimeout) < 0) {
                    return;
                }
                log.warn("[TAILER] Skipping missing seq {}..{} after {}ms", cursor + 1, seq - 1, gapTimeout.toMillis());
            }
            deliver(record.event());
            cursor = seq;
            gapSince = null;
        }
    }

    private void deliver(ChangeEvent event) {
        metrics.recordTailLag(Duration.between(event.committedAt(), clock.instant()));
        sink.publish(event);
    }

    long cursor() {
        return cursor;
    }
}
