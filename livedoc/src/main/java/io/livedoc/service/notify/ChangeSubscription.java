package io.livedoc.service.notify;

import io.livedoc.domain.model.ChangeEvent;
import io.livedoc.domain.session.CloseReason;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Interest of one consumer in one resource: a bounded buffer of pending events fed by {@link ChangeNotifier}.
 *
 * Not seekable. To start over, close and subscribe again.
 */
public final class ChangeSubscription implements AutoCloseable {

    private final ChangeNotifier notifier;
    private final String resourceId;
    private final int capacity;
    private final ChangeListener listener;
    private final BlockingQueue<ChangeEvent> buffer;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile SubscriberDisconnectedException disconnectCause;

    ChangeSubscription(ChangeNotifier notifier, String resourceId, int capacity, ChangeListener listener) {
        this.notifier = notifier;
        this.resourceId = resourceId;
        this.capacity = capacity;
        this.listener = listener;
        this.buffer = new ArrayBlockingQueue<>(capacity);
    }

    public String resourceId() {
        return resourceId;
    }

    /**
     * Next buffered event, or null if none is pending.
     */
    public ChangeEvent poll() {
        return buffer.poll();
    }

    /**
     * Wait up to {@code timeout} for the next event.
     *
     * @return the event, or null on timeout or after {@link #close()}
     * @throws SubscriberDisconnectedException once the buffer is drained after an overflow drop
     */
    public ChangeEvent next(Duration timeout) throws InterruptedException {
        ChangeEvent event = buffer.poll();
        if (event != null) {
            return event;
        }
        if (disconnectCause != null) {
            throw disconnectCause;
        }
        if (closed.get()) {
            return null;
        }
        event = buffer.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (event == null && disconnectCause != null) {
            throw disconnectCause;
        }
        return event;
    }

    public int pendingCount() {
        return buffer.size();
    }

    /**
     * Unsubscribe. Idempotent; discards anything still buffered.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            notifier.unsubscribe(this);
            if (disconnectCause == null) {
                buffer.clear();
            }
        }
    }

    public boolean isActive() {
        return !closed.get();
    }

    /**
     * Set once the subscription has ended: CLIENT_CLOSED after {@link #close()},
     * SUBSCRIBER_DISCONNECTED after an overflow drop.
     */
    public Optional<CloseReason> closeReason() {
        if (disconnectCause != null) {
            return Optional.of(CloseReason.SUBSCRIBER_DISCONNECTED);
        }
        if (closed.get()) {
            return Optional.of(CloseReason.CLIENT_CLOSED);
        }
        return Optional.empty();
    }

    public Optional<SubscriberDisconnectedException> disconnectCause() {
        return Optional.ofNullable(disconnectCause);
    }

    ChangeListener listener() {
        return listener;
    }

    // Called with the channel lock held
    boolean offer(ChangeEvent event) {
        return !closed.get() && buffer.offer(event);
    }

    // Called with the channel lock held
    SubscriberDisconnectedException markDisconnected() {
        SubscriberDisconnectedException cause = new SubscriberDisconnectedException(resourceId, capacity);
        disconnectCause = cause;
        closed.set(true);
        return cause;
    }
}
