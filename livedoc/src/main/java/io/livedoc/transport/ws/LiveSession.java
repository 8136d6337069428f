package io.livedoc.transport.ws;

import io.livedoc.domain.model.ChangeEvent;
import io.livedoc.domain.model.StoreDocument;
import io.livedoc.domain.session.CloseReason;
import io.livedoc.domain.session.SessionState;
import io.livedoc.infrastructure.metrics.LiveDocMetrics;
import io.livedoc.infrastructure.store.StoreGateway;
import io.livedoc.repository.DocumentNotFoundException;
import io.livedoc.repository.StoreUnavailableException;
import io.livedoc.service.notify.ChangeListener;
import io.livedoc.service.notify.ChangeNotifier;
import io.livedoc.service.notify.ChangeSubscription;
import io.livedoc.service.notify.SubscriberDisconnectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * One live client connection and its subscriptions.
 *
 * Threading:
 * - inbound frames arrive on transport threads and call {@link #subscribe}, {@link #unsubscribe}, {@link #touch}
 * - buffered events are drained on the shared dispatch executor, at most one drain per session at a time
 * - delivery, subscribe and unsubscribe all hold {@code lock}, so nothing is sent for a resource
 *   once its unsubscribe has returned
 *
 * Lock order: session lock, then notifier channel lock. The notifier calls back without holding its lock.
 *
 * Closing never waits on a thread. A flushing close that still has sends in flight is finished by
 * the last send callback, or by a timer once the flush timeout passes.
 */
public final class LiveSession {
    private static final Logger log = LoggerFactory.getLogger(LiveSession.class);

    private final String sessionId;
    private final FrameSink sink;
    private final ChangeNotifier notifier;
    private final StoreGateway gateway;
    private final Executor dispatch;
    private final Settings settings;
    private final LiveDocMetrics metrics;
    private final Clock clock;
    private final Consumer<LiveSession> onClosed;
    private final Instant connectedAt;

    private final ReentrantLock lock = new ReentrantLock();
    // Guarded by lock
    private final Map<String, ChangeSubscription> subscriptions = new LinkedHashMap<>();
    private final Map<String, Long> watermarks = new HashMap<>();
    private final Map<String, Instant> subscribedAt = new HashMap<>();

    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.CONNECTING);
    private final AtomicBoolean drainScheduled = new AtomicBoolean(false);
    private final AtomicInteger inFlight = new AtomicInteger(0);
    private final AtomicBoolean closeFinished = new AtomicBoolean(false);
    private final ChangeListener listener = new SessionListener();

    private volatile Instant lastActivity;
    private volatile CloseReason closeReason;
    private volatile boolean flushPending = false;

    /**
     * Per-session limits taken from configuration.
     */
    public record Settings(int maxInFlightSends, Duration flushTimeout) {
        public Settings {
            if (maxInFlightSends <= 0) {
                throw new IllegalArgumentException("maxInFlightSends must be positive");
            }
        }
    }

    public LiveSession(String sessionId, FrameSink sink, ChangeNotifier notifier, StoreGateway gateway,
                       Executor dispatch, Settings settings, LiveDocMetrics metrics, Clock clock,
                       Consumer<LiveSession> onClosed) {
        this.sessionId = sessionId;
        this.sink = sink;
        this.notifier = notifier;
        this.gateway = gateway;
        this.dispatch = dispatch;
        this.settings = settings;
        this.metrics = metrics;
        this.clock = clock;
        this.onClosed = onClosed;
        this.connectedAt = clock.instant();
        this.lastActivity = connectedAt;
    }

    public String getSessionId() {
        return sessionId;
    }

    public SessionState getState() {
        return state.get();
    }

    public CloseReason getCloseReason() {
        return closeReason;
    }

    public String remoteAddress() {
        return sink.remoteAddress();
    }

    public void touch() {
        lastActivity = clock.instant();
    }

    public Duration idleFor(Instant now) {
        return Duration.between(lastActivity, now);
    }

    public boolean isActive() {
        return state.get() == SessionState.ACTIVE;
    }

    public Set<String> getSubscribedResources() {
        lock.lock();
        try {
            return Set.copyOf(subscriptions.keySet());
        } finally {
            lock.unlock();
        }
    }

    public long watermark(String resourceId) {
        lock.lock();
        try {
            return watermarks.getOrDefault(resourceId, 0L);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Handshake accepted: CONNECTING -> ACTIVE.
     */
    public void activate() {
        if (!state.compareAndSet(SessionState.CONNECTING, SessionState.ACTIVE)) {
            throw new IllegalStateException("Session " + sessionId + " cannot activate from " + state.get());
        }
        touch();
        log.debug("[SOCKET] Session active: {}", sessionId);
    }

    /**
     * Handshake refused: CONNECTING -> CLOSED with an error frame and a policy-violation close.
     */
    public void rejectHandshake(String error) {
        if (!state.compareAndSet(SessionState.CONNECTING, SessionState.CLOSED)) {
            return;
        }
        closeReason = CloseReason.HANDSHAKE_FAILURE;
        sendFrame(SocketHub.ServerMessage.error(error), false);
        sink.close(CloseReason.HANDSHAKE_FAILURE.closeCode(), CloseReason.HANDSHAKE_FAILURE.wireName());
        metrics.recordSessionClosed(CloseReason.HANDSHAKE_FAILURE);
        onClosed.accept(this);
    }

    /**
     * Start receiving events for a resource and acknowledge. Subscribing twice keeps the existing subscription.
     *
     * @param snapshot also send the current document (read through the store gateway) as an event
     */
    public void subscribe(String resourceId, boolean snapshot) {
        lock.lock();
        try {
            if (!isActive()) {
                return;
            }
            if (!subscriptions.containsKey(resourceId)) {
                // Millisecond precision, as stores persist commit times
                subscribedAt.put(resourceId, clock.instant().truncatedTo(ChronoUnit.MILLIS));
                subscriptions.put(resourceId, notifier.subscribe(resourceId, listener));
            }
            sendFrame(SocketHub.ServerMessage.ack("subscribe", resourceId, sessionId), false);
        } finally {
            lock.unlock();
        }
        touch();
        if (snapshot) {
            execute(() -> sendSnapshot(resourceId));
        }
    }

    /**
     * Stop receiving events for a resource and acknowledge. Events already buffered for it are discarded.
     * Unsubscribing a resource that is not subscribed only acknowledges.
     */
    public void unsubscribe(String resourceId) {
        lock.lock();
        try {
            if (!isActive()) {
                return;
            }
            ChangeSubscription subscription = subscriptions.remove(resourceId);
            watermarks.remove(resourceId);
            subscribedAt.remove(resourceId);
            if (subscription != null) {
                subscription.close();
            }
            sendFrame(SocketHub.ServerMessage.ack("unsubscribe", resourceId, sessionId), false);
        } finally {
            lock.unlock();
        }
        touch();
    }

    public void heartbeat() {
        touch();
        if (isActive()) {
            sendFrame(SocketHub.ServerMessage.heartbeat(), false);
        }
    }

    public void sendError(String error) {
        if (state.get() == SessionState.ACTIVE || state.get() == SessionState.CLOSING) {
            sendFrame(SocketHub.ServerMessage.error(error), false);
        }
    }

    /**
     * Close on the dispatch executor. Safe to call from transport threads and notifier callbacks.
     */
    public void closeAsync(CloseReason reason) {
        if (state.get() == SessionState.CLOSING || state.get() == SessionState.CLOSED) {
            return;
        }
        execute(() -> close(reason));
    }

    /**
     * ACTIVE -> CLOSING -> CLOSED. Only the first call has an effect.
     *
     * With a flushing reason, buffered events for subscribed resources are sent first and in-flight
     * sends get up to the flush timeout to complete before the closing frame goes out. Every
     * subscription is closed at once either way. Returns without waiting for the flush; the session
     * may still be CLOSING when this returns.
     */
    public void close(CloseReason reason) {
        if (!state.compareAndSet(SessionState.ACTIVE, SessionState.CLOSING)) {
            if (state.compareAndSet(SessionState.CONNECTING, SessionState.CLOSED)) {
                closeReason = reason;
                sink.close(reason.closeCode(), reason.wireName());
                metrics.recordSessionClosed(reason);
                onClosed.accept(this);
            }
            return;
        }
        closeReason = reason;
        log.info("[SOCKET] Closing session {} ({}) after {}s: {}", sessionId, sink.remoteAddress(),
            Duration.between(connectedAt, clock.instant()).getSeconds(), reason);

        lock.lock();
        try {
            if (reason.flushBeforeClose() && sink.isOpen()) {
                flushLocked();
            }
            for (ChangeSubscription subscription : subscriptions.values()) {
                subscription.close();
            }
            subscriptions.clear();
            watermarks.clear();
            subscribedAt.clear();
        } finally {
            lock.unlock();
        }

        if (!reason.flushBeforeClose() || !sink.isOpen()) {
            finishClose(false);
            return;
        }
        flushPending = true;
        if (inFlight.get() == 0) {
            finishClose(false);
            return;
        }
        CompletableFuture.delayedExecutor(settings.flushTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .execute(() -> finishClose(true));
    }

    /**
     * Completes a close: closing frame (flushing reasons only), transport close, CLOSED. Runs once.
     */
    private void finishClose(boolean timedOut) {
        if (!closeFinished.compareAndSet(false, true)) {
            return;
        }
        CloseReason reason = closeReason;
        if (timedOut) {
            log.warn("[SOCKET] Session {} flush timed out with {} sends in flight", sessionId, inFlight.get());
        }
        if (reason.flushBeforeClose() && sink.isOpen()) {
            sendFrame(SocketHub.ServerMessage.closing(reason), false);
        }
        sink.close(reason.closeCode(), reason.wireName());

        state.set(SessionState.CLOSED);
        metrics.recordSessionClosed(reason);
        onClosed.accept(this);
    }

    private void onSendSettled() {
        if (flushPending && inFlight.get() == 0) {
            finishClose(false);
        }
    }

    private void sendSnapshot(String resourceId) {
        StoreDocument document;
        try {
            document = gateway.read(resourceId);
        } catch (DocumentNotFoundException e) {
            return;
        } catch (StoreUnavailableException e) {
            log.warn("[SOCKET] Snapshot for {} skipped, store unavailable: {}", resourceId, e.getMessage());
            sendError("store unavailable, snapshot skipped for " + resourceId);
            return;
        }
        lock.lock();
        try {
            if (isActive() && subscriptions.containsKey(resourceId)) {
                deliverLocked(document.toChangeEvent(), true);
            }
        } finally {
            lock.unlock();
        }
    }

    private void scheduleDrain() {
        if (!isActive()) {
            return;
        }
        if (drainScheduled.compareAndSet(false, true)) {
            execute(this::drain);
        }
    }

    private void drain() {
        drainScheduled.set(false);
        lock.lock();
        try {
            if (isActive()) {
                drainLocked(true);
            }
        } finally {
            lock.unlock();
        }
    }

    // Round-robin over subscriptions, one event each per pass
    private void drainLocked(boolean respectInFlightLimit) {
        boolean progressed = true;
        while (progressed) {
            progressed = false;
            for (ChangeSubscription subscription : subscriptions.values()) {
                if (respectInFlightLimit && inFlight.get() >= settings.maxInFlightSends()) {
                    return;
                }
                ChangeEvent event = subscription.poll();
                if (event != null) {
                    deliverLocked(event, false);
                    progressed = true;
                }
            }
        }
    }

    private void flushLocked() {
        drainLocked(false);
    }

    /**
     * @param snapshot the current document read on subscribe; it predates the subscription by nature
     */
    private void deliverLocked(ChangeEvent event, boolean snapshot) {
        Instant since = subscribedAt.get(event.resourceId());
        if (!snapshot && since != null && event.committedAt().isBefore(since)) {
            log.debug("[SOCKET] Session {} skipped {} revision {} committed before its subscription",
                sessionId, event.resourceId(), event.revision());
            return;
        }
        long last = watermarks.getOrDefault(event.resourceId(), 0L);
        if (!event.isNewerThan(last)) {
            log.debug("[SOCKET] Session {} skipped {} revision {} (watermark {})",
                sessionId, event.resourceId(), event.revision(), last);
            return;
        }
        watermarks.put(event.resourceId(), event.revision());
        sendFrame(SocketHub.ServerMessage.event(event), true);
    }

    private void sendFrame(SocketHub.ServerMessage message, boolean isEvent) {
        String json = SocketHub.encode(message);
        if (json == null) {
            return;
        }
        inFlight.incrementAndGet();
        sink.send(json, new FrameSink.SendCallback() {
            @Override
            public void onComplete() {
                if (isEvent) {
                    metrics.recordEventDelivered();
                }
                boolean wasSaturated = inFlight.getAndDecrement() >= settings.maxInFlightSends();
                onSendSettled();
                if (wasSaturated) {
                    scheduleDrain();
                }
            }

            @Override
            public void onError(Throwable error) {
                inFlight.decrementAndGet();
                onSendSettled();
                if (isActive()) {
                    log.warn("[SOCKET] Send to session {} failed: {}", sessionId, error.toString());
                    closeAsync(CloseReason.SEND_FAILURE);
                }
            }
        });
    }

    private void execute(Runnable task) {
        try {
            dispatch.execute(task);
        } catch (RejectedExecutionException e) {
            log.debug("[SOCKET] Dispatch rejected for session {}, running inline", sessionId);
            task.run();
        }
    }

    private final class SessionListener implements ChangeListener {
        @Override
        public void onAvailable(ChangeSubscription subscription) {
            scheduleDrain();
        }

        @Override
        public void onDisconnected(ChangeSubscription subscription, SubscriberDisconnectedException cause) {
            log.warn("[SOCKET] Session {} fell behind on {}, disconnecting", sessionId, subscription.resourceId());
            closeAsync(CloseReason.SUBSCRIBER_DISCONNECTED);
        }
    }

    @Override
    public String toString() {
        return "LiveSession{" + sessionId + ", " + state.get() + "}";
    }
}
