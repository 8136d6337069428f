package io.livedoc.repository;

/**
 * Transient store failure (timeout, connection refused, primary stepped down).
 * Safe to retry; the store gateway does so with backoff.
 */
public class StoreUnavailableException extends RuntimeException {

    private final String operation;

    public StoreUnavailableException(String operation, String message) {
        super(String.format("[%s] %s", operation, message));
        this.operation = operation;
    }

    public StoreUnavailableException(String operation, String message, Throwable cause) {
        super(String.format("[%s] %s", operation, message), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
