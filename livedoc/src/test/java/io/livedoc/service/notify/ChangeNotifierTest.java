package io.livedoc.service.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.livedoc.domain.model.ChangeEvent;
import io.livedoc.domain.session.CloseReason;
import io.livedoc.infrastructure.metrics.LiveDocMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ChangeNotifier fan-out.
 *
 * Tests:
 * - Per-resource ordering and isolation
 * - Stale and duplicate revisions
 * - Overflow drop without blocking the publisher
 * - Idempotent unsubscribe and channel cleanup
 */
@DisplayName("Change Notifier Tests")
class ChangeNotifierTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ChangeNotifier notifier;

    @BeforeEach
    void setUp() {
        notifier = new ChangeNotifier(4, LiveDocMetrics.NOOP);
    }

    private static ChangeEvent event(String resource, long revision) {
        return new ChangeEvent(resource, revision, MAPPER.createObjectNode().put("rev", revision), Instant.now());
    }

    @Test
    @DisplayName("Events arrive in revision order")
    void testOrderedDelivery() throws Exception {
        ChangeSubscription sub = notifier.subscribe("cart-42");

        notifier.publish(event("cart-42", 1));
        notifier.publish(event("cart-42", 2));

        assertEquals(1, sub.next(Duration.ofSeconds(1)).revision());
        assertEquals(2, sub.next(Duration.ofSeconds(1)).revision());
        assertNull(sub.poll(), "Nothing else pending");
    }

    @Test
    @DisplayName("Only subscribers of the resource receive its events")
    void testResourceIsolation() {
        ChangeSubscription a = notifier.subscribe("a");
        ChangeSubscription b = notifier.subscribe("b");

        notifier.publish(event("a", 1));

        assertNotNull(a.poll());
        assertNull(b.poll(), "Other resource gets nothing");
    }

    @Test
    @DisplayName("Stale and duplicate revisions are rejected")
    void testStaleRejected() {
        ChangeSubscription sub = notifier.subscribe("r");

        assertTrue(notifier.offer(event("r", 2)));
        assertFalse(notifier.offer(event("r", 2)), "Duplicate");
        assertFalse(notifier.offer(event("r", 1)), "Older");
        assertTrue(notifier.offer(event("r", 3)));

        assertEquals(2, sub.poll().revision());
        assertEquals(3, sub.poll().revision());
        assertNull(sub.poll());
        assertEquals(3, notifier.lastRevision("r"));
    }

    @Test
    @DisplayName("Publishing without subscribers is accepted and cheap")
    void testPublishWithoutSubscribers() {
        assertTrue(notifier.offer(event("nobody", 1)));
        assertEquals(0, notifier.channelCount(), "No channel created by publish");
    }

    @Test
    @DisplayName("Overflowing subscriber is dropped, others keep receiving")
    void testOverflowDropsSubscriber() throws Exception {
        List<SubscriberDisconnectedException> causes = new ArrayList<>();
        ChangeSubscription slow = notifier.subscribe("r", new ChangeListener() {
            @Override
            public void onDisconnected(ChangeSubscription subscription, SubscriberDisconnectedException cause) {
                causes.add(cause);
            }
        });
        ChangeSubscription fast = notifier.subscribe("r");

        for (int rev = 1; rev <= 5; rev++) {
            notifier.publish(event("r", rev));
            assertEquals(rev, fast.poll().revision());
        }

        assertEquals(1, causes.size(), "Disconnect reported once");
        assertEquals("r", causes.get(0).getResourceId());
        assertEquals(4, causes.get(0).getCapacity());
        assertEquals(4, slow.pendingCount(), "Buffer kept for draining");
        assertFalse(slow.isActive());
        assertEquals(CloseReason.SUBSCRIBER_DISCONNECTED, slow.closeReason().orElseThrow());
        assertEquals(1, notifier.subscriberCount("r"), "Only the fast subscriber remains");

        // Buffered events are still drained before the disconnect surfaces
        for (int rev = 1; rev <= 4; rev++) {
            assertEquals(rev, slow.next(Duration.ofMillis(10)).revision());
        }
        assertThrows(SubscriberDisconnectedException.class, () -> slow.next(Duration.ofMillis(10)));
    }

    @Test
    @DisplayName("Unsubscribe is idempotent and removes empty channels")
    void testIdempotentUnsubscribe() {
        ChangeSubscription sub = notifier.subscribe("r");
        assertEquals(1, notifier.channelCount());

        sub.close();
        sub.close();
        notifier.unsubscribe(sub);

        assertFalse(sub.isActive());
        assertEquals(CloseReason.CLIENT_CLOSED, sub.closeReason().orElseThrow());
        assertEquals(0, notifier.subscriberCount("r"));
        assertEquals(0, notifier.channelCount(), "Empty channel removed");

        notifier.publish(event("r", 1));
        assertNull(sub.poll(), "Nothing delivered after unsubscribe");
    }

    @Test
    @DisplayName("Closing a subscription discards what it buffered")
    void testCloseDiscardsBuffered() throws Exception {
        ChangeSubscription sub = notifier.subscribe("r");
        notifier.publish(event("r", 1));

        sub.close();

        assertNull(sub.poll());
        assertNull(sub.next(Duration.ofMillis(10)), "Closed subscription returns null instead of waiting");
    }

    @Test
    @DisplayName("Listener is told when events are available")
    void testOnAvailable() {
        AtomicInteger signals = new AtomicInteger();
        notifier.subscribe("r", new ChangeListener() {
            @Override
            public void onAvailable(ChangeSubscription subscription) {
                signals.incrementAndGet();
            }
        });

        notifier.publish(event("r", 1));
        notifier.publish(event("r", 2));

        assertEquals(2, signals.get());
    }

    @Test
    @DisplayName("Failing listener does not break publishing")
    void testFailingListener() {
        notifier.subscribe("r", new ChangeListener() {
            @Override
            public void onAvailable(ChangeSubscription subscription) {
                throw new IllegalStateException("boom");
            }
        });
        ChangeSubscription healthy = notifier.subscribe("r");

        assertTrue(notifier.offer(event("r", 1)));
        assertNotNull(healthy.poll());
    }

    @Test
    @DisplayName("1000 subscribers all receive a single publish")
    void testWideFanOut() {
        List<ChangeSubscription> subs = new ArrayList<>();
        for (int i = 0; i < 1000; i++) {
            subs.add(notifier.subscribe("hot"));
        }

        notifier.publish(event("hot", 1));

        for (ChangeSubscription sub : subs) {
            ChangeEvent received = sub.poll();
            assertNotNull(received);
            assertEquals(1, received.revision());
        }
    }

    @Test
    @DisplayName("Concurrent subscribe and unsubscribe leave no stale channel")
    void testConcurrentChurn() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        for (int t = 0; t < 8; t++) {
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < 500; i++) {
                    ChangeSubscription sub = notifier.subscribe("churn");
                    sub.close();
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(0, notifier.subscriberCount("churn"));
        assertEquals(0, notifier.channelCount());
    }
}
