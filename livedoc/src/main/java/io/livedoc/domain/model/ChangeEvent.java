package io.livedoc.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;

/**
 * One committed mutation of a resource. Immutable once created.
 */
public record ChangeEvent(
    String resourceId,
    long revision,
    JsonNode payload,
    Instant committedAt
) {
    public ChangeEvent {
        Objects.requireNonNull(resourceId, "resourceId");
        Objects.requireNonNull(committedAt, "committedAt");
        if (revision < 1) {
            throw new IllegalArgumentException("revision must be >= 1: " + revision);
        }
        if (payload != null) {
            // JsonNode is mutable; take a private copy
            payload = payload.deepCopy();
        }
    }

    public boolean isNewerThan(long otherRevision) {
        return revision > otherRevision;
    }
}
