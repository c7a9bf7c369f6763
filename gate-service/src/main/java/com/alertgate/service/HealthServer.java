package com.alertgate.service;

import com.alertgate.core.pipeline.AdmissionPipeline;
import com.alertgate.core.storm.StormStatus;
import com.alertgate.core.throttle.ThrottleManager;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Lightweight HTTP server that exposes health and gate status endpoints.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health}: returns {@code 200 OK} with body
 * {@code {"status":"UP"}}</li>
 * <li>{@code GET /readiness}: same; Kubernetes readiness probe target</li>
 * <li>{@code GET /status}: storm status, throttle summaries and queue depths
 * as JSON</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer}.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);
    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);

    private final AdmissionPipeline pipeline;
    private final Supplier<Map<String, Integer>> channelQueueCounts;

    private HttpServer server;
    private ExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * @param pipeline           source of storm and throttle state
     * @param channelQueueCounts queued notifications per channel
     */
    public HealthServer(AdmissionPipeline pipeline, Supplier<Map<String, Integer>> channelQueueCounts) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.channelQueueCounts = Objects.requireNonNull(channelQueueCounts, "channelQueueCounts must not be null");
    }

    /**
     * Start the server on the given port; {@code 0} binds an ephemeral port.
     *
     * @param port TCP port to bind to; must be in range [0, 65535]
     * @throws IllegalArgumentException if port is out of range
     * @throws IOException              if the port cannot be bound
     */
    public void start(int port) throws IOException {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [0, 65535], got: " + port);
        }
        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/health", HealthServer::handleHealthCheck);
        server.createContext("/readiness", HealthServer::handleHealthCheck);
        server.createContext("/status", this::handleStatus);

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
            executor.shutdownNow();
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
     * @return the bound port, or {@code -1} before {@link #start(int)}
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : -1;
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private static void handleHealthCheck(HttpExchange exchange) throws IOException {
        respond(exchange, 200, HEALTH_RESPONSE);
    }

    private void handleStatus(HttpExchange exchange) throws IOException {
        byte[] body;
        try {
            body = EventJson.encodeBytes(status());
        } catch (IllegalArgumentException e) {
            LOG.error("Failed to render gate status: {}", e.getMessage(), e);
            respond(exchange, 500, "{\"status\":\"ERROR\"}".getBytes(StandardCharsets.UTF_8));
            return;
        }
        respond(exchange, 200, body);
    }

    Map<String, Object> status() {
        StormStatus storm = pipeline.getStormDetector().getStatus();
        Map<String, Object> stormView = new LinkedHashMap<>();
        stormView.put("in_storm", storm.isInStorm());
        stormView.put("storm_start_time", storm.getStormStartTime());
        stormView.put("suppressed_count", storm.getSuppressedCount());
        stormView.put("current_rate", storm.getCurrentRate());
        stormView.put("threshold_rate", storm.getThresholdRate());
        stormView.put("cooldown_remaining_seconds", storm.getCooldownRemaining().toSeconds());

        ThrottleManager throttle = pipeline.getThrottleManager();
        List<Map<String, Object>> throttles = new ArrayList<>();
        for (String ruleId : new TreeSet<>(throttle.ruleIds())) {
            throttle.getSummary(ruleId)
                    .map(ThrottleSummaryReporter::toPayload)
                    .ifPresent(throttles::add);
        }

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", "UP");
        status.put("storm", stormView);
        status.put("throttles", throttles);
        status.put("queued_digest_alerts", pipeline.getAlertQueue().count());
        status.put("queued_notifications", channelQueueCounts.get());
        return status;
    }

    private static void respond(HttpExchange exchange, int code, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(code, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
