package com.firstcrack.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * GET /metrics
 *
 * Text format 0.0.4 by default, OpenMetrics when the scraper asks for it.
 * {@code ?name[]=x} (or {@code ?name=x}) limits the output to the named series.
 *
 * <pre>
 * # HELP firstcrack_stage_sends_total Stage notifications by outcome
 * # TYPE firstcrack_stage_sends_total counter
 * firstcrack_stage_sends_total{stage="brewing",status="success",} 12.0
 * firstcrack_stage_sends_total{stage="brewing",status="failure",} 1.0
 * </pre>
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String contentType = TextFormat.chooseContentType(exchange.getRequestHeaders().getFirst(Headers.ACCEPT));
        Set<String> names = requestedNames(exchange);

        StringWriter writer = new StringWriter();
        try {
            TextFormat.writeFormat(contentType, writer,
                names.isEmpty() ? registry.metricFamilySamples() : registry.filteredMetricFamilySamples(names));
        } catch (IOException e) {
            log.error("[METRICS] Failed to export metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage());
            return;
        }

        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, contentType);
        exchange.getResponseSender().send(writer.toString());
        log.debug("[METRICS] Served {} chars ({})", writer.getBuffer().length(), contentType);
    }

    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Set<String> names = new HashSet<>();
        for (String key : new String[] {"name[]", "name"}) {
            Deque<String> values = exchange.getQueryParameters().get(key);
            if (values != null) {
                values.stream().filter(v -> !v.isBlank()).forEach(names::add);
            }
        }
        return names;
    }
}
