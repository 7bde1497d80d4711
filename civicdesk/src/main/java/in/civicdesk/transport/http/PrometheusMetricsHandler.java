package in.civicdesk.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * GET /metrics in Prometheus text format.
 *
 * Supports the exporter convention {@code ?name[]=a&name[]=b} to return only
 * the named metric families. Export failures answer 500 with the same JSON
 * error body as the rest of the API.
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String NAME_PARAM = "name[]";

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        StringWriter writer = new StringWriter();
        try {
            TextFormat.write004(writer, registry.filteredMetricFamilySamples(requestedNames(exchange)));
        } catch (IOException e) {
            log.error("Failed to export metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
            exchange.getResponseSender().send(
                MAPPER.createObjectNode().put("error", "Internal error").toString(), StandardCharsets.UTF_8);
            return;
        }

        exchange.setStatusCode(200);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004);
        exchange.getResponseSender().send(writer.toString(), StandardCharsets.UTF_8);
    }

    // empty set = every family
    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Deque<String> names = exchange.getQueryParameters().get(NAME_PARAM);
        return names == null ? new HashSet<>() : new HashSet<>(names);
    }
}
