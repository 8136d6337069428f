package io.livedoc.transport.ws;

import io.livedoc.domain.session.CloseReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Idle detection for socket sessions.
 *
 * One scheduled scan over all sessions replaces a timer per connection. A session that has not sent
 * any frame (heartbeat included) for longer than the timeout is closed with IDLE_TIMEOUT.
 *
 * Usage:
 * <pre>
 * SessionReaper reaper = new SessionReaper(hub, Duration.ofSeconds(5), Duration.ofSeconds(60), Clock.systemUTC());
 * reaper.start();
 * ...
 * reaper.stop();
 * </pre>
 */
public class SessionReaper {

    private static final Logger log = LoggerFactory.getLogger(SessionReaper.class);

    private final SocketHub hub;
    private final Duration interval;
    private final Duration timeout;
    private final Clock clock;

    private final ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> scanTask;
    private volatile boolean running = false;

    public SessionReaper(SocketHub hub, Duration interval, Duration timeout, Clock clock) {
        this.hub = hub;
        this.interval = interval;
        this.timeout = timeout;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "livedoc-session-reaper");
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (running) {
            log.warn("[REAPER] Already running");
            return;
        }

        log.info("[REAPER] Starting (interval: {}ms, idle timeout: {}ms)", interval.toMillis(), timeout.toMillis());
        running = true;
        scanTask = scheduler.scheduleAtFixedRate(() -> {
            try {
                reapIdle();
            } catch (Exception e) {
                log.error("[REAPER] Scan failed", e);
            }
        }, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }

        log.info("[REAPER] Stopping");
        running = false;

        if (scanTask != null) {
            scanTask.cancel(false);
            scanTask = null;
        }

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Close every active session idle for longer than the timeout.
     *
     * @return number of sessions closed
     */
    public int reapIdle() {
        Instant now = clock.instant();
        int reaped = 0;
        for (LiveSession session : hub.sessions()) {
            if (!session.isActive()) {
                continue;
            }
            Duration idle = session.idleFor(now);
            if (idle.compareTo(timeout) > 0) {
                log.info("[REAPER] Session {} idle for {}s, closing", session.getSessionId(), idle.getSeconds());
                session.closeAsync(CloseReason.IDLE_TIMEOUT);
                reaped++;
            }
        }
        return reaped;
    }

    public boolean isRunning() {
        return running;
    }
}
