package com.bridgesentinel.pipeline;

import com.bridgesentinel.pipeline.scoring.LoopState;
import com.bridgesentinel.pipeline.scoring.LoopStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Lightweight HTTP server exposing the scoring loop's health.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health}: {@code 200 OK} with {@code {"status":"UP"}} while
 * the process lives</li>
 * <li>{@code GET /readiness}: {@code 200} while the loop is
 * {@link LoopState#CONNECTED}, {@code 503} otherwise</li>
 * <li>{@code GET /status}: the latest {@link LoopStatus} as JSON</li>
 * <li>{@code GET /metrics}: every {@link PipelineMetrics} meter as JSON</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer} on a single daemon thread.
 * Handlers only read the immutable snapshot from the supplier.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);
    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);

    private final Supplier<LoopStatus> statusSupplier;
    private final PipelineMetrics metrics;
    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private HttpServer server;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public HealthServer(Supplier<LoopStatus> statusSupplier, PipelineMetrics metrics) {
        this.statusSupplier = Objects.requireNonNull(statusSupplier, "statusSupplier must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * Start the health server on the given port.
     *
     * @param port TCP port to bind to; 0 binds an ephemeral port
     * @throws IllegalArgumentException if port is out of range
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", HealthServer::handleHealth);
            server.createContext("/readiness", this::handleReadiness);
            server.createContext("/status", this::handleStatus);
            server.createContext("/metrics", this::handleMetrics);

            server.setExecutor(Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "health-server");
                t.setDaemon(true);
                return t;
            }));

            server.start();
            running.set(true);
            LOG.info("Health server started on port {}", getPort());
        } catch (IOException e) {
            LOG.error("Failed to start health server on port {}: {}", port, e.getMessage(), e);
        }
    }

    /**
     * Stop the health server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            LOG.info("Health server stopped");
        }
    }

    /**
     * @return {@code true} if the server is currently running
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port, or -1 when not running
     */
    public int getPort() {
        return server != null && running.get() ? server.getAddress().getPort() : -1;
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private static void handleHealth(HttpExchange exchange) throws IOException {
        respond(exchange, 200, HEALTH_RESPONSE);
    }

    private void handleReadiness(HttpExchange exchange) throws IOException {
        LoopState state = statusSupplier.get().getState();
        boolean ready = state == LoopState.CONNECTED;
        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", ready ? "READY" : "NOT_READY");
        body.put("state", state.name());
        respondJson(exchange, ready ? 200 : 503, body);
    }

    private void handleStatus(HttpExchange exchange) throws IOException {
        respondJson(exchange, 200, statusSupplier.get());
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        respondJson(exchange, 200, metrics.snapshot());
    }

    private void respondJson(HttpExchange exchange, int code, Object value) throws IOException {
        byte[] body;
        try {
            body = mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to render {}: {}", exchange.getRequestURI().getPath(), e.getMessage(), e);
            respond(exchange, 500, "{\"error\":\"unavailable\"}".getBytes(StandardCharsets.UTF_8));
            return;
        }
        respond(exchange, code, body);
    }

    private static void respond(HttpExchange exchange, int code, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(code, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
