package io.livedoc.transport.http;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.resource.ClassPathResourceManager;
import io.undertow.server.handlers.resource.ResourceHandler;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Static pages from the classpath {@code static/} folder: {@code /} serves {@code index.html},
 * unknown paths get {@code error.html} with 404.
 */
public final class StaticPages {

    static final String ROOT = "static";

    private StaticPages() {
    }

    public static HttpHandler handler() {
        ClassLoader loader = StaticPages.class.getClassLoader();
        String errorPage = load(loader, ROOT + "/error.html");
        HttpHandler notFound = exchange -> sendNotFound(exchange, errorPage);
        return new ResourceHandler(new ClassPathResourceManager(loader, ROOT), notFound)
            .setWelcomeFiles("index.html")
            .setDirectoryListingEnabled(false);
    }

    private static void sendNotFound(HttpServerExchange exchange, String errorPage) {
        exchange.setStatusCode(StatusCodes.NOT_FOUND);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/html; charset=utf-8");
        exchange.getResponseSender().send(errorPage, StandardCharsets.UTF_8);
    }

    private static String load(ClassLoader loader, String path) {
        try (InputStream in = loader.getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }
}
