package io.livedoc.repository;

import com.fasterxml.jackson.databind.JsonNode;
import io.livedoc.domain.model.ChangeEvent;
import io.livedoc.domain.model.ChangeRecord;
import io.livedoc.domain.model.StoreDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process document store for tests and single-JVM runs ({@code STORE=memory}).
 *
 * Per-resource writes are atomic through {@link ConcurrentMap#compute}. Can be flipped into an
 * unavailable mode to simulate store outages.
 */
public final class InMemoryDocumentStore implements DocumentStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentStore.class);

    private final ConcurrentMap<String, StoreDocument> documents = new ConcurrentHashMap<>();
    private final ConcurrentNavigableMap<Long, ChangeRecord> changes = new ConcurrentSkipListMap<>();
    private final AtomicLong changeSeq = new AtomicLong(0);
    private final Clock clock;

    private volatile boolean available = true;

    public InMemoryDocumentStore() {
        this(Clock.systemUTC());
    }

    public InMemoryDocumentStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public StoreDocument write(String resourceId, JsonNode body, Long expectedRevision) {
        checkAvailable("write");
        JsonNode copy = body.deepCopy();
        return documents.compute(resourceId, (id, current) -> {
            long currentRevision = current == null ? 0 : current.revision();
            if (expectedRevision != null && expectedRevision != currentRevision) {
                throw new RevisionConflictException(id, expectedRevision, currentRevision);
            }
            return new StoreDocument(id, currentRevision + 1, copy, Instant.now(clock));
        });
    }

    @Override
    public Optional<StoreDocument> read(String resourceId) {
        checkAvailable("read");
        return Optional.ofNullable(documents.get(resourceId));
    }

    @Override
    public long appendChange(ChangeEvent event) {
        checkAvailable("appendChange");
        long seq = changeSeq.incrementAndGet();
        changes.put(seq, new ChangeRecord(seq, event));
        return seq;
    }

    @Override
    public List<ChangeRecord> changesAfter(long afterSeq, int limit) {
        checkAvailable("changesAfter");
        List<ChangeRecord> result = new ArrayList<>(Math.min(limit, 64));
        for (Map.Entry<Long, ChangeRecord> e : changes.tailMap(afterSeq, false).entrySet()) {
            if (result.size() >= limit) {
                break;
            }
            result.add(e.getValue());
        }
        return result;
    }

    @Override
    public long latestChangeSeq() {
        checkAvailable("latestChangeSeq");
        return changeSeq.get();
    }

    @Override
    public boolean ping() {
        return available;
    }

    /**
     * Simulate an outage (false) or recovery (true).
     */
    public void setAvailable(boolean available) {
        if (this.available != available) {
            log.info("[MEMSTORE] availability -> {}", available);
        }
        this.available = available;
    }

    public int documentCount() {
        return documents.size();
    }

    @Override
    public void close() {
        documents.clear();
        changes.clear();
    }

    private void checkAvailable(String operation) {
        if (!available) {
            throw new StoreUnavailableException(operation, "in-memory store marked unavailable");
        }
    }
}
