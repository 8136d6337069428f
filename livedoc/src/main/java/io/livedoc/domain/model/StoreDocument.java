package io.livedoc.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;

/**
 * Durable document as held by the shared store.
 * Read through the store gateway for the lifetime of one request only.
 */
public record StoreDocument(
    String resourceId,
    long revision,          // 1 for the first write, +1 per committed write
    JsonNode body,
    Instant updatedAt
) {
    public StoreDocument {
        Objects.requireNonNull(resourceId, "resourceId");
        Objects.requireNonNull(body, "body");
        if (revision < 1) {
            throw new IllegalArgumentException("revision must be >= 1: " + revision);
        }
    }

    /**
     * Change event describing the commit that produced this document.
     */
    public ChangeEvent toChangeEvent() {
        return new ChangeEvent(resourceId, revision, body, updatedAt);
    }
}
