package io.livedoc.repository;

import com.fasterxml.jackson.databind.JsonNode;
import io.livedoc.domain.model.ChangeEvent;
import io.livedoc.domain.model.ChangeRecord;
import io.livedoc.domain.model.StoreDocument;

import java.util.List;
import java.util.Optional;

/**
 * Shared document store reachable by both service processes.
 *
 * Implementations throw {@link StoreUnavailableException} for transient failures and
 * {@link RevisionConflictException} for compare-and-set mismatches. They never cache documents.
 */
public interface DocumentStore extends AutoCloseable {

    /**
     * Write a document and return the committed document.
     *
     * @param expectedRevision null for an unconditional write (last write wins),
     *                         0 for "must not exist", otherwise the revision the caller last saw
     */
    StoreDocument write(String resourceId, JsonNode body, Long expectedRevision);

    Optional<StoreDocument> read(String resourceId);

    /**
     * Append a committed change to the change log and return its sequence number.
     */
    long appendChange(ChangeEvent event);

    /**
     * Change log entries with seq greater than {@code afterSeq}, ascending, at most {@code limit}.
     */
    List<ChangeRecord> changesAfter(long afterSeq, int limit);

    /**
     * Highest sequence number allocated so far (0 if the log is empty).
     */
    long latestChangeSeq();

    /**
     * Cheap liveness check.
     */
    boolean ping();

    @Override
    void close();
}
