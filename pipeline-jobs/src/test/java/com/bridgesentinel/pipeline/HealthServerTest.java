package com.bridgesentinel.pipeline;

import com.bridgesentinel.pipeline.scoring.LoopState;
import com.bridgesentinel.pipeline.scoring.LoopStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link HealthServer} against a real socket on an ephemeral port.
 */
class HealthServerTest {

    private final AtomicReference<LoopStatus> status = new AtomicReference<>(
            new LoopStatus(LoopState.CONNECTED, 3, 120, 7, 0, Instant.parse("2025-06-01T08:30:00Z")));
    private final PipelineMetrics metrics = new PipelineMetrics();
    private final HttpClient client = HttpClient.newHttpClient();
    private HealthServer server;

    @BeforeEach
    void setUp() {
        metrics.recordBatch(120, 7, Duration.ofMillis(40));
        metrics.incrementReconnectAttempts();
        server = new HealthServer(status::get, metrics);
        server.start(0);
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private HttpResponse<String> get(String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + server.getPort() + path))
                .GET()
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    @DisplayName("/health should always report UP")
    void health() throws Exception {
        HttpResponse<String> response = get("/health");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("{\"status\":\"UP\"}");
    }

    @Test
    @DisplayName("/readiness should follow the loop state")
    void readiness() throws Exception {
        assertThat(get("/readiness").statusCode()).isEqualTo(200);

        status.set(new LoopStatus(LoopState.RECONNECTING, 4, 120, 7, 1, null));

        HttpResponse<String> response = get("/readiness");
        assertThat(response.statusCode()).isEqualTo(503);
        assertThat(response.body()).isEqualTo("{\"status\":\"NOT_READY\",\"state\":\"RECONNECTING\"}");
    }

    @Test
    @DisplayName("/status should render the latest snapshot as JSON")
    void statusJson() throws Exception {
        HttpResponse<String> response = get("/status");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body())
                .contains("\"totalScored\":120")
                .contains("\"totalAnomalies\":7")
                .contains("\"lastBatchAt\":\"2025-06-01T08:30:00Z\"");
    }

    @Test
    @DisplayName("/metrics should render the pipeline meters")
    void metricsJson() throws Exception {
        HttpResponse<String> response = get("/metrics");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body())
                .contains("\"sentinel_records_scored_total\":{\"count\":120.0}")
                .contains("\"sentinel_anomalies_flagged_total\":{\"count\":7.0}")
                .contains("\"sentinel_reconnect_attempts_total\":{\"count\":1.0}")
                .contains("\"sentinel_cycle_duration\":{\"count\":1.0");
    }

    @Test
    @DisplayName("Should report running state and reject invalid ports")
    void lifecycle() {
        assertThat(server.isRunning()).isTrue();
        assertThat(server.getPort()).isPositive();

        server.stop();
        assertThat(server.isRunning()).isFalse();
        assertThat(server.getPort()).isEqualTo(-1);

        HealthServer other = new HealthServer(status::get, metrics);
        assertThatThrownBy(() -> other.start(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
