package io.livedoc.service.notify;

import io.livedoc.domain.model.ChangeEvent;
import io.livedoc.infrastructure.metrics.LiveDocMetrics;
import io.livedoc.infrastructure.store.ChangePublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-process fan-out of committed changes, keyed by resource id.
 *
 * Each resource has its own channel and lock, so publishes for different resources never contend.
 * Within a channel:
 * - events are accepted only if their revision is newer than the last one published
 * - every subscriber gets the event in its own bounded buffer
 * - a subscriber with a full buffer is dropped, the publisher never waits
 */
public final class ChangeNotifier implements ChangePublisher {
    private static final Logger log = LoggerFactory.getLogger(ChangeNotifier.class);

    private final ConcurrentMap<String, Channel> channels = new ConcurrentHashMap<>();
    private final int bufferSize;
    private final LiveDocMetrics metrics;

    public ChangeNotifier(int bufferSize, LiveDocMetrics metrics) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be positive: " + bufferSize);
        }
        this.bufferSize = bufferSize;
        this.metrics = metrics;
    }

    public ChangeSubscription subscribe(String resourceId) {
        return subscribe(resourceId, ChangeListener.NONE);
    }

    public ChangeSubscription subscribe(String resourceId, ChangeListener listener) {
        ChangeSubscription subscription = new ChangeSubscription(this, resourceId, bufferSize, listener);
        while (true) {
            Channel channel = channels.computeIfAbsent(resourceId, Channel::new);
            synchronized (channel) {
                // Lost a race with the removal of an empty channel; take the fresh one
                if (channel.removed) {
                    continue;
                }
                channel.subscribers.add(subscription);
            }
            log.debug("[NOTIFY] Subscribed: resource={}, subscribers={}", resourceId, subscriberCount(resourceId));
            return subscription;
        }
    }

    @Override
    public void publish(ChangeEvent event) {
        offer(event);
    }

    /**
     * Publish a committed change to every current subscriber of its resource.
     *
     * @return false if the event was rejected as stale (revision not newer than the last published one)
     */
    public boolean offer(ChangeEvent event) {
        Channel channel = channels.get(event.resourceId());
        if (channel == null) {
            metrics.recordEventPublished(true);
            return true;
        }

        List<ChangeSubscription> ready = new ArrayList<>();
        List<ChangeSubscription> dropped = new ArrayList<>();
        List<SubscriberDisconnectedException> causes = new ArrayList<>();

        synchronized (channel) {
            if (channel.removed) {
                metrics.recordEventPublished(true);
                return true;
            }
            if (!event.isNewerThan(channel.lastRevision)) {
                metrics.recordEventPublished(false);
                log.debug("[NOTIFY] Stale event ignored: resource={}, revision={}, last={}",
                    event.resourceId(), event.revision(), channel.lastRevision);
                return false;
            }
            channel.lastRevision = event.revision();

            for (ChangeSubscription subscription : channel.subscribers) {
                if (subscription.offer(event)) {
                    ready.add(subscription);
                } else if (subscription.isActive()) {
                    dropped.add(subscription);
                    causes.add(subscription.markDisconnected());
                }
            }
            if (!dropped.isEmpty()) {
                channel.subscribers.removeAll(dropped);
                removeIfEmpty(channel);
            }
        }
        metrics.recordEventPublished(true);

        for (int i = 0; i < dropped.size(); i++) {
            ChangeSubscription subscription = dropped.get(i);
            SubscriberDisconnectedException cause = causes.get(i);
            metrics.recordSubscriberDropped();
            log.warn("[NOTIFY] Subscriber dropped: {}", cause.getMessage());
            notifyListener(() -> subscription.listener().onDisconnected(subscription, cause));
        }
        for (ChangeSubscription subscription : ready) {
            notifyListener(() -> subscription.listener().onAvailable(subscription));
        }
        return true;
    }

    /**
     * Remove a subscription. Idempotent.
     */
    public void unsubscribe(ChangeSubscription subscription) {
        Channel channel = channels.get(subscription.resourceId());
        if (channel == null) {
            return;
        }
        synchronized (channel) {
            if (channel.subscribers.remove(subscription)) {
                removeIfEmpty(channel);
            }
        }
        if (subscription.isActive()) {
            subscription.close();
        }
    }

    public int subscriberCount(String resourceId) {
        Channel channel = channels.get(resourceId);
        if (channel == null) {
            return 0;
        }
        synchronized (channel) {
            return channel.subscribers.size();
        }
    }

    /**
     * Last revision published for a resource that currently has subscribers, 0 otherwise.
     */
    public long lastRevision(String resourceId) {
        Channel channel = channels.get(resourceId);
        if (channel == null) {
            return 0;
        }
        synchronized (channel) {
            return channel.lastRevision;
        }
    }

    public int channelCount() {
        return channels.size();
    }

    // Caller holds the channel lock
    private void removeIfEmpty(Channel channel) {
        if (channel.subscribers.isEmpty()) {
            channel.removed = true;
            channels.remove(channel.resourceId, channel);
        }
    }

    private void notifyListener(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.error("[NOTIFY] Listener callback failed", e);
        }
    }

    private static final class Channel {
        private final String resourceId;
        private final List<ChangeSubscription> subscribers = new ArrayList<>();
        private long lastRevision;
        private boolean removed;

        Channel(String resourceId) {
            this.resourceId = resourceId;
        }
    }
}
