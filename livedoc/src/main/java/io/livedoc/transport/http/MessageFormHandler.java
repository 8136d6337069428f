package io.livedoc.transport.http;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.livedoc.infrastructure.store.StoreGateway;
import io.livedoc.security.InputValidator;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * POST /message - Store an url-encoded form as a JSON document stamped with the current date,
 * then redirect back to the index page.
 *
 * Every post becomes its own resource {@code <channel>:<messageId>}, where the channel is the
 * {@code resource} form field or {@value #DEFAULT_RESOURCE}. The new resource is returned in
 * {@code Content-Location}.
 */
public final class MessageFormHandler {
    private static final Logger log = LoggerFactory.getLogger(MessageFormHandler.class);

    static final String DEFAULT_RESOURCE = "messages";
    static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS");

    private final StoreGateway gateway;
    private final ResourceHandlers resources;
    private final Clock clock;
    private final Supplier<String> messageIds;
    private final InputValidator validator = new InputValidator();

    public MessageFormHandler(StoreGateway gateway, ResourceHandlers resources, Clock clock) {
        this(gateway, resources, clock, () -> UUID.randomUUID().toString());
    }

    MessageFormHandler(StoreGateway gateway, ResourceHandlers resources, Clock clock, Supplier<String> messageIds) {
        this.gateway = gateway;
        this.resources = resources;
        this.clock = clock;
        this.messageIds = messageIds;
    }

    public void postMessage(HttpServerExchange exchange) {
        Map<String, String> fields;
        try {
            fields = parseForm(ResourceHandlers.readBody(exchange));
        } catch (IllegalArgumentException e) {
            ResourceHandlers.badRequest(exchange, e.getMessage());
            return;
        } catch (IOException e) {
            log.warn("[HTTP] Failed to read form body: {}", e.toString());
            ResourceHandlers.badRequest(exchange, "Unreadable request body");
            return;
        }

        String messageId = messageIds.get();
        String resourceId = messageResourceId(fields.getOrDefault("resource", DEFAULT_RESOURCE), messageId);
        if (!validator.isValidResourceId(resourceId)) {
            ResourceHandlers.badRequest(exchange, "Invalid resource id");
            return;
        }

        ObjectNode document = ResourceHandlers.MAPPER.createObjectNode();
        fields.forEach((name, value) -> {
            if (!"resource".equals(name)) {
                document.put(name, value);
            }
        });
        document.put("messageId", messageId);
        document.put("date", LocalDateTime.now(clock).format(DATE_FORMAT));

        try {
            long revision = gateway.write(resourceId, document);
            log.debug("[HTTP] Form message stored: resource={}, revision={}", resourceId, revision);
            exchange.setStatusCode(StatusCodes.FOUND);
            exchange.getResponseHeaders().put(Headers.LOCATION, "/");
            exchange.getResponseHeaders().put(Headers.CONTENT_LOCATION, "/api/resources/" + resourceId);
            exchange.endExchange();
        } catch (RuntimeException e) {
            resources.handleFailure(exchange, resourceId, e);
        }
    }

    static String messageResourceId(String channel, String messageId) {
        return channel + ":" + messageId;
    }

    /**
     * Parse {@code application/x-www-form-urlencoded} content. Later duplicates win.
     *
     * @throws IllegalArgumentException for a pair without '=' or an invalid field name
     */
    Map<String, String> parseForm(String body) {
        Map<String, String> fields = new LinkedHashMap<>();
        if (body == null || body.isBlank()) {
            return fields;
        }
        for (String pair : body.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            if (eq < 0) {
                throw new IllegalArgumentException("Malformed form data: " + pair);
            }
            String name = URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8);
            String value = URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            if (!validator.isValidFieldName(name)) {
                throw new IllegalArgumentException("Invalid field name: " + name);
            }
            fields.put(name, validator.sanitize(value));
        }
        return fields;
    }
}
