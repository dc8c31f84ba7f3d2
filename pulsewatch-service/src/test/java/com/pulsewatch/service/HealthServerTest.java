package com.pulsewatch.service;

import com.pulsewatch.core.AnalyticsCore;
import com.pulsewatch.core.config.EngineSettings;
import com.pulsewatch.core.storage.InMemoryTimeSeriesStore;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link HealthServer} over a real loopback socket.
 */
class HealthServerTest {

    private AnalyticsCore core;
    private PrometheusMeterRegistry registry;
    private HealthServer server;
    private final HttpClient client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();

    @BeforeEach
    void setUp() {
        core = new AnalyticsCore(new EngineSettings(), new InMemoryTimeSeriesStore(), Clock.systemUTC());
        registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        ServiceMetrics metrics = new ServiceMetrics(registry);
        metrics.bindTo(core);
        metrics.messageRejected();
        server = new HealthServer(core, registry);
        server.start(0);
    }

    @AfterEach
    void tearDown() {
        server.stop();
        core.close();
        registry.close();
    }

    @Test
    @DisplayName("Should answer liveness and readiness checks")
    void shouldAnswerHealthChecks() throws Exception {
        assertThat(get("/health").body()).isEqualTo("{\"status\":\"UP\"}");
        assertThat(get("/readiness").statusCode()).isEqualTo(200);
    }

    @Test
    @DisplayName("Should report the core health snapshot as snake_case JSON")
    void shouldReportStatus() throws Exception {
        core.ingest("cpu_usage", 50.0, "org-a", null, null);

        HttpResponse<String> response = get("/status");

        assertThat(response.headers().firstValue("Content-Type")).hasValue("application/json");
        assertThat(response.body())
                .contains("\"tracked_metrics\":1")
                .contains("\"ingested_total\":1")
                .contains("\"durability_degraded\":false");
    }

    @Test
    @DisplayName("Should expose Prometheus metrics")
    void shouldExposeMetrics() throws Exception {
        String body = get("/metrics").body();

        assertThat(body)
                .contains("pulsewatch_messages_rejected_total 1.0")
                .contains("pulsewatch_core_tracked_metrics");
    }

    @Test
    @DisplayName("Should report the bound port and stop cleanly")
    void shouldReportPort() {
        assertThat(server.isRunning()).isTrue();
        assertThat(server.getPort()).isPositive();

        server.stop();

        assertThat(server.isRunning()).isFalse();
        assertThatThrownBy(() -> new HealthServer(core, registry).start(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + server.getPort() + path))
                .timeout(Duration.ofSeconds(5))
                .GET()
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
