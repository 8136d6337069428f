package io.livedoc.service.notify;

/**
 * A subscriber fell behind and its buffer overflowed; it was dropped instead of blocking the publisher.
 * The client is expected to reconnect and resubscribe.
 */
public class SubscriberDisconnectedException extends RuntimeException {

    private final String resourceId;
    private final int capacity;

    public SubscriberDisconnectedException(String resourceId, int capacity) {
        super(String.format("[%s] subscriber buffer overflow (capacity=%d)", resourceId, capacity));
        this.resourceId = resourceId;
        this.capacity = capacity;
    }

    public String getResourceId() {
        return resourceId;
    }

    public int getCapacity() {
        return capacity;
    }
}
