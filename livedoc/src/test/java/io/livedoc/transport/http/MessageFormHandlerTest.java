package io.livedoc.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import io.livedoc.infrastructure.common.RetryPolicy;
import io.livedoc.infrastructure.metrics.LiveDocMetrics;
import io.livedoc.infrastructure.store.StoreGateway;
import io.livedoc.repository.InMemoryDocumentStore;
import io.undertow.Undertow;
import io.undertow.server.handlers.BlockingHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MessageFormHandler.
 *
 * Tests:
 * - form parsing and rejection of malformed input
 * - every post is stored as its own resource, so earlier messages survive
 */
class MessageFormHandlerTest {
    private static final int TEST_PORT = 19093;

    private final MessageFormHandler handler = new MessageFormHandler(null, null, Clock.systemUTC());
    private Undertow server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private HttpResponse<String> post(String form) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + "/message"))
            .header("Content-Type", "application/x-www-form-urlencoded")
            .POST(HttpRequest.BodyPublishers.ofString(form))
            .build();
        return HttpClient.newHttpClient().send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void testEachPostIsKeptAsItsOwnMessage() throws Exception {
        InMemoryDocumentStore store = new InMemoryDocumentStore();
        StoreGateway gateway = new StoreGateway(store, RetryPolicy.forStore(), d -> { }, LiveDocMetrics.NOOP);
        AtomicInteger ids = new AtomicInteger();
        MessageFormHandler forms = new MessageFormHandler(gateway, new ResourceHandlers(gateway), Clock.systemUTC(),
            () -> "m" + ids.incrementAndGet());
        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(new BlockingHandler(forms::postMessage))
            .build();
        server.start();

        HttpResponse<String> first = post("message=first");
        HttpResponse<String> second = post("message=second");
        HttpResponse<String> elsewhere = post("resource=room-1&message=third");

        assertEquals(302, first.statusCode());
        assertEquals("/api/resources/messages:m1", first.headers().firstValue("Content-Location").orElse(""));
        assertEquals("/api/resources/messages:m2", second.headers().firstValue("Content-Location").orElse(""));
        assertEquals("/api/resources/room-1:m3", elsewhere.headers().firstValue("Content-Location").orElse(""));

        JsonNode one = store.read("messages:m1").orElseThrow().body();
        JsonNode two = store.read("messages:m2").orElseThrow().body();
        assertEquals("first", one.path("message").asText(), "First message survives the second post");
        assertEquals("m1", one.path("messageId").asText());
        assertEquals("second", two.path("message").asText());
        assertEquals(1, store.read("messages:m1").orElseThrow().revision(), "One write per post");
        assertEquals("third", store.read("room-1:m3").orElseThrow().body().path("message").asText());
        assertTrue(store.read("messages").isEmpty());
        assertEquals(3, store.documentCount());
    }

    @Test
    void testInvalidChannelIsRejectedWithoutWriting() throws Exception {
        InMemoryDocumentStore store = new InMemoryDocumentStore();
        StoreGateway gateway = new StoreGateway(store, RetryPolicy.forStore(), d -> { }, LiveDocMetrics.NOOP);
        MessageFormHandler forms = new MessageFormHandler(gateway, new ResourceHandlers(gateway), Clock.systemUTC(),
            () -> "m1");
        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(new BlockingHandler(forms::postMessage))
            .build();
        server.start();

        assertEquals(400, post("resource=../etc&message=x").statusCode());
        assertEquals(400, post("resource=&message=x").statusCode());
        assertEquals(0, store.documentCount());
    }

    @Test
    void testMessageResourceId() {
        assertEquals("messages:abc", MessageFormHandler.messageResourceId("messages", "abc"));
    }

    @Test
    void testParseFormDecodesFields() {
        Map<String, String> fields = handler.parseForm("name=ana&text=a%26b+c&empty=");

        assertEquals("ana", fields.get("name"));
        assertEquals("a&b c", fields.get("text"));
        assertEquals("", fields.get("empty"));
    }

    @Test
    void testParseFormLaterDuplicateWins() {
        assertEquals("2", handler.parseForm("n=1&n=2").get("n"));
    }

    @Test
    void testParseFormEmptyBody() {
        assertTrue(handler.parseForm("").isEmpty());
        assertTrue(handler.parseForm(null).isEmpty());
    }

    @Test
    void testParseFormStripsControlCharacters() {
        assertEquals("ab", handler.parseForm("text=a%00b").get("text"));
    }

    @Test
    void testParseFormRejectsMalformedInput() {
        assertThrows(IllegalArgumentException.class, () -> handler.parseForm("novalue"));
        assertThrows(IllegalArgumentException.class, () -> handler.parseForm("9lives=x"));
        assertThrows(IllegalArgumentException.class, () -> handler.parseForm("bad%zz=x"));
    }
}
