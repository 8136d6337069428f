package io.livedoc.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.livedoc.domain.model.StoreDocument;
import io.livedoc.infrastructure.store.StoreGateway;
import io.livedoc.repository.DocumentNotFoundException;
import io.livedoc.repository.RevisionConflictException;
import io.livedoc.repository.StoreUnavailableException;
import io.livedoc.security.InputValidator;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import io.undertow.util.PathTemplateMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * HTTP API over the store gateway. Every mutating request is exactly one gateway write;
 * the write's outcome is the response. Nothing here knows about sockets.
 *
 * Handlers are mounted behind a blocking dispatch, so store calls never run on the IO thread.
 */
public final class ResourceHandlers {
    private static final Logger log = LoggerFactory.getLogger(ResourceHandlers.class);
    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final String JSON_CONTENT_TYPE = "application/json; charset=utf-8";
    private static final HttpString IF_MATCH = HttpString.tryFromString("If-Match");

    private final StoreGateway gateway;
    private final InputValidator validator = new InputValidator();

    public ResourceHandlers(StoreGateway gateway) {
        this.gateway = gateway;
    }

    /**
     * PUT /api/resources/{resourceId} - Write a JSON document. If-Match: &lt;revision&gt; makes it a compare-and-set.
     */
    public void putResource(HttpServerExchange exchange) {
        String resourceId = pathParam(exchange, "resourceId");
        try {
            validator.validateResourceId(resourceId);
        } catch (IllegalArgumentException e) {
            badRequest(exchange, e.getMessage());
            return;
        }

        JsonNode body;
        Long expectedRevision;
        try {
            body = MAPPER.readTree(readBody(exchange));
            if (body == null || body.isMissingNode()) {
                badRequest(exchange, "Request body must be a JSON document");
                return;
            }
            expectedRevision = parseIfMatch(exchange.getRequestHeaders().getFirst(IF_MATCH));
        } catch (JsonProcessingException e) {
            badRequest(exchange, "Malformed JSON: " + e.getOriginalMessage());
            return;
        } catch (IllegalArgumentException e) {
            badRequest(exchange, e.getMessage());
            return;
        } catch (IOException e) {
            log.warn("[HTTP] Failed to read request body for {}: {}", resourceId, e.toString());
            badRequest(exchange, "Unreadable request body");
            return;
        }

        try {
            long revision = gateway.write(resourceId, body, expectedRevision);
            ObjectNode response = MAPPER.createObjectNode();
            response.put("resourceId", resourceId);
            response.put("revision", revision);
            exchange.getResponseHeaders().put(Headers.ETAG, etag(revision));
            sendJson(exchange, 200, response);
        } catch (RuntimeException e) {
            handleFailure(exchange, resourceId, e);
        }
    }

    /**
     * GET /api/resources/{resourceId} - Current document with its revision as ETag.
     */
    public void getResource(HttpServerExchange exchange) {
        String resourceId = pathParam(exchange, "resourceId");
        try {
            validator.validateResourceId(resourceId);
        } catch (IllegalArgumentException e) {
            badRequest(exchange, e.getMessage());
            return;
        }

        try {
            StoreDocument document = gateway.read(resourceId);
            ObjectNode response = MAPPER.createObjectNode();
            response.put("resourceId", document.resourceId());
            response.put("revision", document.revision());
            response.set("body", document.body());
            response.put("updatedAt", document.updatedAt().toString());
            exchange.getResponseHeaders().put(Headers.ETAG, etag(document.revision()));
            sendJson(exchange, 200, response);
        } catch (RuntimeException e) {
            handleFailure(exchange, resourceId, e);
        }
    }

    /**
     * GET /api/health - Store reachability.
     */
    public void health(HttpServerExchange exchange) {
        boolean reachable = gateway.isStoreReachable();
        ObjectNode health = MAPPER.createObjectNode();
        health.put("status", reachable ? "ok" : "degraded");
        health.put("store", reachable ? "up" : "down");
        health.put("ts", Instant.now().toString());
        sendJson(exchange, reachable ? 200 : 503, health);
    }

    /**
     * Map gateway failures to status codes. Anything unexpected is a 500, never a crash.
     */
    void handleFailure(HttpServerExchange exchange, String resourceId, RuntimeException e) {
        if (e instanceof DocumentNotFoundException) {
            error(exchange, 404, "Resource not found: " + resourceId);
        } else if (e instanceof RevisionConflictException) {
            RevisionConflictException conflict = (RevisionConflictException) e;
            ObjectNode body = errorBody("Revision conflict");
            body.put("expectedRevision", conflict.getExpectedRevision());
            body.put("actualRevision", conflict.getActualRevision());
            sendJson(exchange, 409, body);
        } else if (e instanceof StoreUnavailableException) {
            log.warn("[HTTP] Store unavailable for {}: {}", resourceId, e.getMessage());
            ObjectNode body = errorBody("Store unavailable");
            body.put("retryable", true);
            exchange.getResponseHeaders().put(Headers.RETRY_AFTER, "1");
            sendJson(exchange, 503, body);
        } else {
            log.error("[HTTP] Unexpected error for {}", resourceId, e);
            error(exchange, 500, "Internal error");
        }
    }

    /**
     * @return null when the header is absent
     * @throws IllegalArgumentException if the header is not a revision number
     */
    static Long parseIfMatch(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        String value = header.trim();
        if (value.startsWith("W/")) {
            value = value.substring(2);
        }
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            value = value.substring(1, value.length() - 1);
        }
        try {
            long revision = Long.parseLong(value);
            if (revision < 0) {
                throw new IllegalArgumentException("If-Match revision must not be negative");
            }
            return revision;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("If-Match must be a revision number");
        }
    }

    static String readBody(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        return new String(exchange.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
    }

    static String pathParam(HttpServerExchange exchange, String name) {
        PathTemplateMatch match = exchange.getAttachment(PathTemplateMatch.ATTACHMENT_KEY);
        return match == null ? null : match.getParameters().get(name);
    }

    private static String etag(long revision) {
        return "\"" + revision + "\"";
    }

    private static ObjectNode errorBody(String message) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("error", message);
        return body;
    }

    static void badRequest(HttpServerExchange exchange, String message) {
        error(exchange, 400, message);
    }

    static void error(HttpServerExchange exchange, int status, String message) {
        sendJson(exchange, status, errorBody(message));
    }

    static void sendJson(HttpServerExchange exchange, int status, JsonNode body) {
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, JSON_CONTENT_TYPE);
        exchange.getResponseSender().send(body.toString(), StandardCharsets.UTF_8);
    }
}
