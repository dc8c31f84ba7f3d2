package com.pulsewatch.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.pulsewatch.core.AnalyticsCore;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lightweight HTTP server for liveness and readiness checks, status and metric scrapes.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health} returns {@code 200 OK} with {@code {"status":"UP"}}</li>
 * <li>{@code GET /readiness} same; readiness check target</li>
 * <li>{@code GET /status} the core health snapshot as JSON</li>
 * <li>{@code GET /metrics} Prometheus text exposition</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);
    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);

    private final AnalyticsCore core;
    private final PrometheusMeterRegistry registry;
    private final ObjectMapper mapper;

    private HttpServer server;
    private ExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public HealthServer(AnalyticsCore core, PrometheusMeterRegistry registry) {
        this.core = Objects.requireNonNull(core, "core must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.mapper = new ObjectMapper();
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    /**
     * Start the server on the given port; {@code 0} binds an ephemeral port.
     *
     * @throws IllegalArgumentException if port is out of range
     * @throws IllegalStateException    if the port cannot be bound
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to start health server on port " + port, e);
        }
        server.createContext("/health", HealthServer::handleHealthCheck);
        server.createContext("/readiness", HealthServer::handleHealthCheck);
        server.createContext("/status", this::handleStatus);
        server.createContext("/metrics", this::handleMetrics);

        executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "health-server");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);
        server.start();
        running.set(true);
        LOG.info("Health server started on port {}", getPort());
    }

    /**
     * Stop the health server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdown();
            LOG.info("Health server stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port, or {@code -1} before {@link #start(int)}
     */
    public int getPort() {
        return server == null ? -1 : server.getAddress().getPort();
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private static void handleHealthCheck(HttpExchange exchange) throws IOException {
        respond(exchange, "application/json", HEALTH_RESPONSE);
    }

    private void handleStatus(HttpExchange exchange) throws IOException {
        respond(exchange, "application/json", mapper.writeValueAsBytes(core.health()));
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        respond(exchange, "text/plain; version=0.0.4; charset=utf-8",
                registry.scrape().getBytes(StandardCharsets.UTF_8));
    }

    private static void respond(HttpExchange exchange, String contentType, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(200, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
