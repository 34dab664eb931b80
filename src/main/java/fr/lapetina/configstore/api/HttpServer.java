package fr.lapetina.configstore.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.configstore.api.dto.ConfigResponse;
import fr.lapetina.configstore.api.dto.ItemResponse;
import fr.lapetina.configstore.domain.model.Item;
import fr.lapetina.configstore.domain.model.ProviderError;
import fr.lapetina.configstore.domain.model.ResolvedConfig;
import fr.lapetina.configstore.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.configstore.store.Store;
import fr.lapetina.configstore.store.Watcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - GET /config - Full resolution (items and provider errors)
 * - GET /config/{key} - A single resolved item
 * - GET /providers - Registered provider names, in registration order
 * - GET /health - UP, or DEGRADED when some provider fails
 * - GET /watch?timeoutMs=N - Long-poll until the next change notification
 * - GET /metrics - Prometheus metrics endpoint
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private static final long MAX_WATCH_TIMEOUT_MS = 300_000;
    private static final long DEFAULT_WATCH_TIMEOUT_MS = 30_000;

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final Store store;
    private final MetricsRegistry metricsRegistry;

    public HttpServer(
            String host,
            int port,
            int backlog,
            Store store,
            MetricsRegistry metricsRegistry
    ) throws IOException {
        this.store = store;
        this.metricsRegistry = metricsRegistry;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(host, port), backlog
        );

        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "http-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        // Register handlers
        server.createContext("/config", new ConfigHandler());
        server.createContext("/providers", new ProvidersHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/watch", new WatchHandler());
        server.createContext("/metrics", new MetricsHandler());

        log.info("HTTP server configured on {}:{}", host, getPort());
    }

    public void start() {
        server.start();
        log.info("HTTP server started");
    }

    /**
     * Returns the bound port, useful when created with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
        log.info("HTTP server stopped");
    }

    // ==================== CONFIG HANDLER ====================

    private class ConfigHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            MDC.put("requestId", UUID.randomUUID().toString());
            try {
                if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                    sendError(exchange, 405, "Method Not Allowed");
                    return;
                }

                String path = exchange.getRequestURI().getRawPath();
                ResolvedConfig resolved = store.resolve();

                if (path.equals("/config") || path.equals("/config/")) {
                    sendJson(exchange, 200, ConfigResponse.fromResolvedConfig(resolved));
                    return;
                }

                // The context also matches siblings such as /configuration
                if (!path.startsWith("/config/")) {
                    sendError(exchange, 404, "Not found: " + path);
                    return;
                }

                String key = URLDecoder.decode(path.substring("/config/".length()), StandardCharsets.UTF_8);
                Optional<Item> item = resolved.get(key);
                if (item.isEmpty()) {
                    sendError(exchange, 404, "Key not found: " + key);
                    return;
                }
                sendJson(exchange, 200, ItemResponse.fromItem(item.get(), true));
            } catch (Exception e) {
                log.error("Error handling config request", e);
                sendError(exchange, 500, "Internal server error: " + e.getMessage());
            } finally {
                MDC.clear();
            }
        }
    }

    // ==================== PROVIDERS HANDLER ====================

    private class ProvidersHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            sendJson(exchange, 200, store.getProviderNames());
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            ResolvedConfig resolved = store.resolve();

            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", resolved.hasErrors() ? "DEGRADED" : "UP");
            health.put("timestamp", System.currentTimeMillis());
            health.put("providers", store.getProviderCount());
            health.put("items", resolved.size());
            health.put("failedProviders", resolved.errors().stream()
                    .map(ProviderError::providerName)
                    .distinct()
                    .toList());

            // Partial configuration is still served
            sendJson(exchange, 200, health);
        }
    }

    // ==================== WATCH HANDLER ====================

    private class WatchHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            long timeoutMs;
            try {
                timeoutMs = parseTimeout(exchange.getRequestURI().getRawQuery());
            } catch (NumberFormatException e) {
                sendError(exchange, 400, "Invalid timeoutMs");
                return;
            }

            try (Watcher watcher = store.registerWatcher()) {
                boolean changed = watcher.await(Duration.ofMillis(timeoutMs));
                sendJson(exchange, 200, Map.of("changed", changed));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                sendError(exchange, 503, "Interrupted");
            }
        }

        private long parseTimeout(String query) {
            if (query != null) {
                for (String param : query.split("&")) {
                    if (param.startsWith("timeoutMs=")) {
                        long value = Long.parseLong(param.substring("timeoutMs=".length()));
                        if (value < 0) {
                            throw new NumberFormatException("negative timeout");
                        }
                        return Math.min(value, MAX_WATCH_TIMEOUT_MS);
                    }
                }
            }
            return DEFAULT_WATCH_TIMEOUT_MS;
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length == 0 ? -1 : bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== HELPER METHODS ====================

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> error = Map.of("error", message);
        sendJson(exchange, statusCode, error);
    }
}
