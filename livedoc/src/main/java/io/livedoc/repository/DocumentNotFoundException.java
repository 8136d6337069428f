package io.livedoc.repository;

/**
 * Read of a resource that has never been written.
 */
public class DocumentNotFoundException extends RuntimeException {

    private final String resourceId;

    public DocumentNotFoundException(String resourceId) {
        super(String.format("[%s] document not found", resourceId));
        this.resourceId = resourceId;
    }

    public String getResourceId() {
        return resourceId;
    }
}
