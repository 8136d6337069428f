package io.livedoc.infrastructure.metrics;

import io.prometheus.client.Collector;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.Methods;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Deque;
import java.util.Enumeration;
import java.util.HashSet;
import java.util.Set;

/**
 * Serves {@code GET /metrics} in the Prometheus text format on both listeners.
 *
 * Supports the scraper's {@code name[]} query parameter to limit output to named families.
 * HEAD returns headers only.
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        boolean head = Methods.HEAD.equals(exchange.getRequestMethod());
        if (!head && !Methods.GET.equals(exchange.getRequestMethod())) {
            exchange.setStatusCode(StatusCodes.METHOD_NOT_ALLOWED);
            exchange.getResponseHeaders().put(Headers.ALLOW, "GET, HEAD");
            exchange.endExchange();
            return;
        }

        Set<String> names = requestedNames(exchange);
        Enumeration<Collector.MetricFamilySamples> samples = names.isEmpty()
            ? registry.metricFamilySamples()
            : registry.filteredMetricFamilySamples(names);

        StringWriter body = new StringWriter();
        try {
            TextFormat.write004(body, samples);
        } catch (IOException e) {
            log.error("[Metrics] Export failed: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseSender().send("metrics export failed");
            return;
        }

        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004);
        if (head) {
            exchange.endExchange();
            return;
        }
        String text = body.toString();
        exchange.getResponseSender().send(text);
        log.debug("[Metrics] Scraped {} bytes, filter={}", text.length(), names);
    }

    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Set<String> names = new HashSet<>();
        Deque<String> values = exchange.getQueryParameters().get("name[]");
        if (values != null) {
            for (String v : values) {
                if (!v.isBlank()) names.add(v.trim());
            }
        }
        return names;
    }
}
