package com.mimecast.mailroom.metrics;

import com.google.gson.Gson;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Monitoring endpoint.
 *
 * <p>Embedded HTTP server exposing Prometheus metrics and a health document listing runner states.
 */
public class MetricsEndpoint {
    private static final Logger log = LogManager.getLogger(MetricsEndpoint.class);

    private HttpServer server;
    private final long startTime = System.currentTimeMillis();
    private final Supplier<Map<String, String>> runnerStates;

    /**
     * Constructs a new MetricsEndpoint.
     *
     * @param runnerStates Supplier of runner name to state.
     */
    public MetricsEndpoint(Supplier<Map<String, String>> runnerStates) {
        this.runnerStates = runnerStates;
    }

    /**
     * Registers the Prometheus registry, binds JVM metrics and starts the HTTP server.
     *
     * @param port Port to listen on.
     * @throws IOException Unable to bind.
     */
    public void start(int port) throws IOException {
        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        MetricsRegistry.register(registry);
        QueueMetrics.resetCounters();
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        server = HttpServer.create(new InetSocketAddress(port), 10);
        server.createContext("/prometheus", this::handlePrometheus);
        server.createContext("/health", this::handleHealth);
        server.start();

        log.info("Prometheus data available at http://localhost:{}/prometheus", port);
        log.info("Health available at http://localhost:{}/health", port);
    }

    /**
     * Stops the HTTP server.
     */
    public void stop() {
        if (server != null) {
            server.stop(0);
        }
    }

    private void handlePrometheus(HttpExchange exchange) throws IOException {
        log.debug("Handling /prometheus: method={}, remote={}", exchange.getRequestMethod(), exchange.getRemoteAddress());
        PrometheusMeterRegistry registry = MetricsRegistry.getPrometheusRegistry();
        sendResponse(exchange, 200, "text/plain; charset=utf-8", registry != null ? registry.scrape() : "");
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        log.debug("Handling /health: method={}, remote={}", exchange.getRequestMethod(), exchange.getRemoteAddress());
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "UP");
        health.put("uptimeMillis", System.currentTimeMillis() - startTime);
        health.put("runners", runnerStates.get());
        sendResponse(exchange, 200, "application/json; charset=utf-8", new Gson().toJson(health));
    }

    private void sendResponse(HttpExchange exchange, int code, String contentType, String response) throws IOException {
        byte[] bytes = response.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(code, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
