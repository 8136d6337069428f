package io.livedoc.service.notify;

import com.mongodb.MongoException;
import com.mongodb.client.ChangeStreamIterable;
import com.mongodb.client.MongoChangeStreamCursor;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.changestream.ChangeStreamDocument;
import com.mongodb.client.model.changestream.FullDocument;
import io.livedoc.infrastructure.common.RetryPolicy;
import io.livedoc.infrastructure.store.ChangePublisher;
import io.livedoc.repository.MongoDocumentStore;
import org.bson.BsonDocument;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Native change feed: a MongoDB change stream on the documents collection (replica set required).
 * Reopens after errors from the last resume token, so nothing committed in between is lost
 * while the token is still inside the oplog window.
 */
public final class MongoChangeStreamFeed implements ChangeFeed {
    private static final Logger log = LoggerFactory.getLogger(MongoChangeStreamFeed.class);

    private final MongoCollection<Document> documents;
    private final ChangePublisher sink;
    private final RetryPolicy backoff;
    private final Duration maxAwait;

    private final ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "livedoc-change-stream");
        t.setDaemon(true);
        return t;
    });

    private volatile boolean running = false;
    private volatile BsonDocument resumeToken;
    private volatile MongoChangeStreamCursor<ChangeStreamDocument<Document>> cursor;

    public MongoChangeStreamFeed(MongoDocumentStore store, ChangePublisher sink, RetryPolicy backoff) {
        this(store.documentsCollection(), sink, backoff, Duration.ofMillis(500));
    }

    MongoChangeStreamFeed(MongoCollection<Document> documents, ChangePublisher sink, RetryPolicy backoff,
                          Duration maxAwait) {
        this.documents = documents;
        this.sink = sink;
        this.backoff = backoff.fresh();
        this.maxAwait = maxAwait;
    }

    @Override
    public synchronized void start() {
        if (running) {
            log.warn("[CHANGESTREAM] Already running");
            return;
        }
        running = true;
        worker.submit(this::run);
        log.info("[CHANGESTREAM] Started on collection {}", documents.getNamespace());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        MongoChangeStreamCursor<ChangeStreamDocument<Document>> current = cursor;
        if (current != null) {
            try {
                current.close();
            } catch (MongoException e) {
                log.debug("[CHANGESTREAM] Cursor close failed: {}", e.toString());
            }
        }
        worker.shutdown();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[CHANGESTREAM] Stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void run() {
        while (running) {
            try (MongoChangeStreamCursor<ChangeStreamDocument<Document>> opened = open()) {
                cursor = opened;
                if (backoff.getAttemptCount() > 0) {
                    log.info("[CHANGESTREAM] Reopened after {} failures", backoff.getAttemptCount());
                    backoff.recordSuccess();
                }
                while (running) {
                    ChangeStreamDocument<Document> change = opened.tryNext();
                    if (change == null) {
                        continue;
                    }
                    resumeToken = change.getResumeToken();
                    Document full = change.getFullDocument();
                    if (full != null) {
                        sink.publish(MongoDocumentStore.toStoreDocument(full).toChangeEvent());
                    }
                }
            } catch (MongoException e) {
                if (!running) {
                    return;
                }
                backoff.recordFailure();
                Duration delay = backoff.isExhausted() ? backoff.getMaxDelay() : backoff.getNextDelay();
                log.warn("[CHANGESTREAM] Stream failed (attempt {}), reopening in {}ms: {}",
                    backoff.getAttemptCount(), delay.toMillis(), e.getMessage());
                if (!pause(delay)) {
                    return;
                }
            } catch (RuntimeException e) {
                log.error("[CHANGESTREAM] Unexpected error, reopening", e);
                if (!pause(backoff.getMaxDelay())) {
                    return;
                }
            }
        }
    }

    private MongoChangeStreamCursor<ChangeStreamDocument<Document>> open() {
        ChangeStreamIterable<Document> stream = documents.watch()
            .fullDocument(FullDocument.UPDATE_LOOKUP)
            .maxAwaitTime(maxAwait.toMillis(), TimeUnit.MILLISECONDS);
        BsonDocument token = resumeToken;
        if (token != null) {
            stream = stream.resumeAfter(token);
        }
        return stream.cursor();
    }

    private boolean pause(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
