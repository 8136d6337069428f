package io.livedoc.domain.model;

/**
 * Change log entry: a change event plus its store-wide sequence number.
 * The sequence number is only a tailing cursor; ordering per resource comes from the revision.
 */
public record ChangeRecord(long seq, ChangeEvent event) {
    public ChangeRecord {
        if (seq < 1) {
            throw new IllegalArgumentException("seq must be >= 1: " + seq);
        }
    }
}
