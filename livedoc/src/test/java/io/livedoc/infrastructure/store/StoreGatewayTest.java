package io.livedoc.infrastructure.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.livedoc.domain.model.ChangeEvent;
import io.livedoc.domain.model.StoreDocument;
import io.livedoc.infrastructure.common.RetryPolicy;
import io.livedoc.infrastructure.metrics.LiveDocMetrics;
import io.livedoc.repository.DocumentNotFoundException;
import io.livedoc.repository.DocumentStore;
import io.livedoc.repository.InMemoryDocumentStore;
import io.livedoc.repository.RevisionConflictException;
import io.livedoc.repository.StoreUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StoreGatewayTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock
    private DocumentStore store;
    @Mock
    private LiveDocMetrics metrics;

    private final List<Duration> sleeps = new ArrayList<>();
    private StoreGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new StoreGateway(store, RetryPolicy.forStore(), sleeps::add, metrics);
    }

    private static StoreDocument doc(String id, long revision) {
        return new StoreDocument(id, revision, MAPPER.createObjectNode().put("rev", revision), Instant.now());
    }

    @Test
    void testWriteReturnsCommittedRevision() {
        JsonNode body = MAPPER.createObjectNode();
        when(store.write(eq("cart-42"), any(), isNull())).thenReturn(doc("cart-42", 1));

        assertEquals(1, gateway.write("cart-42", body));
        verify(metrics).recordStoreOperation(eq("write"), eq("ok"), any());
        assertTrue(sleeps.isEmpty(), "No backoff on success");
    }

    @Test
    void testWriteRetriesTransientFailureWithBackoff() {
        when(store.write(eq("cart-42"), any(), isNull()))
            .thenThrow(new StoreUnavailableException("write", "timeout"))
            .thenThrow(new StoreUnavailableException("write", "timeout"))
            .thenReturn(doc("cart-42", 3));

        assertEquals(3, gateway.write("cart-42", MAPPER.createObjectNode()));

        verify(store, times(3)).write(eq("cart-42"), any(), isNull());
        assertEquals(List.of(Duration.ofMillis(50), Duration.ofMillis(100)), sleeps);
        verify(metrics, times(2)).recordStoreRetry("write");
    }

    @Test
    void testWriteGivesUpAfterThreeAttempts() {
        when(store.write(eq("cart-42"), any(), isNull()))
            .thenThrow(new StoreUnavailableException("write", "connection refused"));

        assertThrows(StoreUnavailableException.class, () -> gateway.write("cart-42", MAPPER.createObjectNode()));

        verify(store, times(3)).write(eq("cart-42"), any(), isNull());
        assertEquals(2, sleeps.size(), "Backoff only between attempts");
    }

    @Test
    void testWriteNeverRetriesConflict() {
        when(store.write(eq("cart-42"), any(), eq(1L)))
            .thenThrow(new RevisionConflictException("cart-42", 1, 2));

        RevisionConflictException e = assertThrows(RevisionConflictException.class,
            () -> gateway.write("cart-42", MAPPER.createObjectNode(), 1L));

        assertEquals(2, e.getActualRevision());
        verify(store, times(1)).write(eq("cart-42"), any(), eq(1L));
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void testWritePublishesCommittedChangeToEveryPublisher() {
        when(store.write(eq("cart-42"), any(), isNull())).thenReturn(doc("cart-42", 7));
        List<ChangeEvent> first = new ArrayList<>();
        List<ChangeEvent> second = new ArrayList<>();
        gateway.addPublisher(first::add);
        gateway.addPublisher(second::add);

        gateway.write("cart-42", MAPPER.createObjectNode());

        assertEquals(1, first.size());
        assertEquals(7, first.get(0).revision());
        assertEquals("cart-42", second.get(0).resourceId());
    }

    @Test
    void testWritePublisherFailureDoesNotFailWrite() {
        when(store.write(eq("cart-42"), any(), isNull())).thenReturn(doc("cart-42", 1));
        List<ChangeEvent> later = new ArrayList<>();
        gateway.addPublisher(event -> {
            throw new StoreUnavailableException("appendChange", "down");
        });
        gateway.addPublisher(later::add);

        assertEquals(1, gateway.write("cart-42", MAPPER.createObjectNode()));

        assertEquals(1, later.size(), "Publishers after a failing one still run");
        verify(metrics).recordChangeLogAppendFailure();
    }

    @Test
    void testWriteFailedWriteIsNotPublished() {
        when(store.write(eq("cart-42"), any(), isNull()))
            .thenThrow(new StoreUnavailableException("write", "down"));
        List<ChangeEvent> published = new ArrayList<>();
        gateway.addPublisher(published::add);

        assertThrows(StoreUnavailableException.class, () -> gateway.write("cart-42", MAPPER.createObjectNode()));

        assertTrue(published.isEmpty());
    }

    @Test
    void testReadMissingDocumentIsNotFound() {
        when(store.read("nope")).thenReturn(Optional.empty());

        DocumentNotFoundException e = assertThrows(DocumentNotFoundException.class, () -> gateway.read("nope"));
        assertTrue(e.getMessage().contains("nope"));
    }

    @Test
    void testReadRetriesTransientFailure() {
        when(store.read("cart-42"))
            .thenThrow(new StoreUnavailableException("read", "timeout"))
            .thenReturn(Optional.of(doc("cart-42", 2)));

        assertEquals(2, gateway.read("cart-42").revision());
        assertEquals(1, sleeps.size());
    }

    @Test
    void testIsStoreReachableSwallowsPingFailure() {
        when(store.ping()).thenThrow(new StoreUnavailableException("ping", "down"));

        assertFalse(gateway.isStoreReachable());
    }

    @Test
    void testChangeLogPublisherAppendsEveryWrite() {
        InMemoryDocumentStore memory = new InMemoryDocumentStore();
        StoreGateway real = new StoreGateway(memory, RetryPolicy.forStore(), sleeps::add, LiveDocMetrics.NOOP);
        real.addPublisher(new ChangeLogPublisher(real, RetryPolicy.forStore(), LiveDocMetrics.NOOP));

        real.write("a", MAPPER.createObjectNode());
        real.write("b", MAPPER.createObjectNode());
        real.write("a", MAPPER.createObjectNode());

        assertEquals(3, memory.latestChangeSeq());
        assertEquals(2, memory.changesAfter(2, 10).get(0).event().revision());
        assertEquals("a", memory.changesAfter(2, 10).get(0).event().resourceId());
    }

    @Test
    void testRoundTripWriteThenReadSeesRevision() {
        InMemoryDocumentStore memory = new InMemoryDocumentStore();
        StoreGateway real = new StoreGateway(memory, RetryPolicy.forStore(), sleeps::add, LiveDocMetrics.NOOP);

        long revision = real.write("cart-42", MAPPER.createObjectNode().put("n", 1));

        assertTrue(real.read("cart-42").revision() >= revision);
    }
}
