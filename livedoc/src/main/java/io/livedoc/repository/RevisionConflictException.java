package io.livedoc.repository;

/**
 * Compare-and-set write rejected because the stored revision moved on.
 * Never retried automatically: the caller decides between overwrite and merge.
 */
public class RevisionConflictException extends RuntimeException {

    private final String resourceId;
    private final long expectedRevision;
    private final long actualRevision;

    public RevisionConflictException(String resourceId, long expectedRevision, long actualRevision) {
        super(String.format("[%s] revision conflict: expected=%d actual=%d",
            resourceId, expectedRevision, actualRevision));
        this.resourceId = resourceId;
        this.expectedRevision = expectedRevision;
        this.actualRevision = actualRevision;
    }

    public String getResourceId() {
        return resourceId;
    }

    public long getExpectedRevision() {
        return expectedRevision;
    }

    public long getActualRevision() {
        return actualRevision;
    }
}
