package io.livedoc.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.livedoc.domain.model.ChangeRecord;
import io.livedoc.domain.model.StoreDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryDocumentStoreTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private InMemoryDocumentStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
    }

    private static JsonNode json(String raw) throws Exception {
        return MAPPER.readTree(raw);
    }

    @Test
    void testFirstWriteIsRevisionOne() throws Exception {
        StoreDocument doc = store.write("cart-42", json("{\"items\":[\"x\"]}"), null);

        assertEquals(1, doc.revision());
        assertEquals("x", doc.body().get("items").get(0).asText());
    }

    @Test
    void testReadReturnsWhatWasWritten() throws Exception {
        store.write("cart-42", json("{\"items\":[\"x\"]}"), null);
        StoreDocument second = store.write("cart-42", json("{\"items\":[\"x\",\"y\"]}"), null);

        StoreDocument read = store.read("cart-42").orElseThrow();

        assertEquals(second.revision(), read.revision());
        assertEquals(2, read.body().get("items").size());
    }

    @Test
    void testReadMissingIsEmpty() {
        assertTrue(store.read("nope").isEmpty());
    }

    @Test
    void testCompareAndSet() throws Exception {
        store.write("doc", json("{\"v\":1}"), 0L);

        StoreDocument second = store.write("doc", json("{\"v\":2}"), 1L);
        assertEquals(2, second.revision());

        RevisionConflictException conflict = assertThrows(RevisionConflictException.class,
            () -> store.write("doc", json("{\"v\":3}"), 1L));
        assertEquals(1, conflict.getExpectedRevision());
        assertEquals(2, conflict.getActualRevision());
        assertEquals(2, store.read("doc").orElseThrow().revision(), "Rejected write leaves the document alone");
    }

    @Test
    void testCreateOnlyRejectsExistingDocument() throws Exception {
        store.write("doc", json("{}"), null);

        assertThrows(RevisionConflictException.class, () -> store.write("doc", json("{}"), 0L));
    }

    @Test
    void testStoredBodyIsIsolatedFromCaller() throws Exception {
        JsonNode body = json("{\"v\":1}");
        store.write("doc", body, null);

        ((com.fasterxml.jackson.databind.node.ObjectNode) body).put("v", 99);

        assertEquals(1, store.read("doc").orElseThrow().body().get("v").asInt());
    }

    @Test
    void testConcurrentWritersGetDistinctRevisions() throws Exception {
        int writers = 8;
        int writesEach = 100;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        for (int i = 0; i < writers; i++) {
            pool.submit(() -> {
                start.await();
                for (int j = 0; j < writesEach; j++) {
                    store.write("hot", MAPPER.createObjectNode(), null);
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(writers * writesEach, store.read("hot").orElseThrow().revision());
    }

    @Test
    void testChangeLogIsOrderedAndPaged() throws Exception {
        for (int i = 1; i <= 5; i++) {
            StoreDocument doc = store.write("r", json("{\"i\":" + i + "}"), null);
            store.appendChange(doc.toChangeEvent());
        }

        assertEquals(5, store.latestChangeSeq());
        List<ChangeRecord> page = store.changesAfter(1, 2);
        assertEquals(2, page.size());
        assertEquals(2, page.get(0).seq());
        assertEquals(3, page.get(1).seq());
        assertEquals(3, page.get(1).event().revision());
        assertTrue(store.changesAfter(5, 10).isEmpty());
    }

    @Test
    void testUnavailableModeFailsOperations() throws Exception {
        store.setAvailable(false);

        assertFalse(store.ping());
        StoreUnavailableException e = assertThrows(StoreUnavailableException.class,
            () -> store.write("r", json("{}"), null));
        assertEquals("write", e.getOperation());
        assertThrows(StoreUnavailableException.class, () -> store.read("r"));
        assertThrows(StoreUnavailableException.class, () -> store.changesAfter(0, 10));

        store.setAvailable(true);
        assertTrue(store.ping());
        assertEquals(1, store.write("r", json("{}"), null).revision());
    }
}
