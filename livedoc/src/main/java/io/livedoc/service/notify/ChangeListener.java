package io.livedoc.service.notify;

/**
 * Push-side hooks of a {@link ChangeSubscription}.
 * Invoked on the publishing thread after the resource lock is released; implementations must not block.
 */
public interface ChangeListener {

    ChangeListener NONE = new ChangeListener() {
    };

    /**
     * At least one event is buffered and ready to be polled.
     */
    default void onAvailable(ChangeSubscription subscription) {
    }

    /**
     * The subscription was dropped after a buffer overflow.
     */
    default void onDisconnected(ChangeSubscription subscription, SubscriberDisconnectedException cause) {
    }
}
