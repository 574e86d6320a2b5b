package com.alertwarden.service;

import com.alertwarden.core.engine.AlertingEngine;
import com.alertwarden.core.evaluation.RuleHealth;
import com.alertwarden.core.model.AlertInstance;
import com.alertwarden.core.model.NotificationAttempt;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lightweight HTTP server that exposes health, readiness and alert
 * diagnostics.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health} - {@code 200 {"status":"UP"}} while the process runs</li>
 * <li>{@code GET /readiness} - {@code 200} once a configuration is active and
 * the engine is running, {@code 503} before</li>
 * <li>{@code GET /alerts/firing} - JSON array of Firing alert instances</li>
 * <li>{@code GET /diagnostics} - config version, degraded rules, given-up
 * notifications and meter values</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer} so no external dependencies
 * (Jetty, Netty, etc.) are required.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);

    private final AlertingEngine engine;
    private final PayloadSerializer serializer;

    private HttpServer server;
    private ExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public HealthServer(AlertingEngine engine, PayloadSerializer serializer) {
        this.engine = Objects.requireNonNull(engine, "AlertingEngine must not be null");
        this.serializer = Objects.requireNonNull(serializer, "PayloadSerializer must not be null");
    }

    /**
     * Start the health server on the given port.
     *
     * @param port TCP port to bind to; {@code 0} picks a free port
     * @throws IllegalArgumentException if port is out of range
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", this::handleHealth);
            server.createContext("/readiness", this::handleReadiness);
            server.createContext("/alerts/firing", this::handleFiring);
            server.createContext("/diagnostics", this::handleDiagnostics);

            executor = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                    .setNameFormat("health-server-%d")
                    .setDaemon(true)
                    .build());
            server.setExecutor(executor);

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
            executor.shutdown();
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
     * @return the bound port
     * @throws IllegalStateException if the server is not running
     */
    public int getPort() {
        if (server == null) {
            throw new IllegalStateException("Health server not started");
        }
        return server.getAddress().getPort();
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private void handleHealth(HttpExchange exchange) throws IOException {
        respond(exchange, 200, Map.of("status", "UP"));
    }

    private void handleReadiness(HttpExchange exchange) throws IOException {
        long version = engine.configVersion();
        if (version > 0 && engine.isRunning()) {
            respond(exchange, 200, Map.of("status", "READY", "configVersion", version));
        } else {
            respond(exchange, 503, Map.of("status", "NOT_READY", "configVersion", version));
        }
    }

    private void handleFiring(HttpExchange exchange) throws IOException {
        List<Map<String, Object>> firing = engine.listFiring().stream()
                .map(HealthServer::instanceView)
                .toList();
        respond(exchange, 200, firing);
    }

    private void handleDiagnostics(HttpExchange exchange) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("configVersion", engine.configVersion());
        body.put("rules", engine.activeConfig().getRules().size());
        body.put("running", engine.isRunning());
        body.put("degraded", engine.listDegraded().stream().map(HealthServer::healthView).toList());
        body.put("givenUp", engine.givenUpNotifications().stream().map(HealthServer::attemptView).toList());
        body.put("meters", engine.getMetrics().getRegistry().getMeters().stream()
                .map(HealthServer::meterView)
                .toList());
        respond(exchange, 200, body);
    }

    private void respond(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] json = serializer.toJson(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, json.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(json);
        }
    }

    // ---------------------------------------------------------------
    // Views
    // ---------------------------------------------------------------

    private static Map<String, Object> instanceView(AlertInstance instance) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("ruleId", instance.getRuleId());
        view.put("episode", instance.getEpisode());
        view.put("state", instance.getState());
        view.put("correlationId", instance.getCorrelationId());
        view.put("consecutiveBreaches", instance.getConsecutiveBreaches());
        view.put("consecutiveClears", instance.getConsecutiveClears());
        view.put("firstBreachAt", instance.getFirstBreachAt());
        view.put("firedAt", instance.getFiredAt());
        view.put("lastEvaluatedAt", instance.getLastEvaluatedAt());
        view.put("lastValue", instance.getLastValue());
        return view;
    }

    private static Map<String, Object> healthView(RuleHealth health) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("ruleId", health.getRuleId());
        view.put("consecutiveErrors", health.getConsecutiveErrors());
        view.put("totalErrors", health.getTotalErrors());
        view.put("lastError", health.getLastError());
        view.put("degradedSince", health.getDegradedSince());
        return view;
    }

    private static Map<String, Object> attemptView(NotificationAttempt attempt) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("correlationId", attempt.getAlertInstanceCorrelationId());
        view.put("receiver", attempt.getReceiver().key());
        view.put("eventType", attempt.getPayload().getEventType());
        view.put("attempts", attempt.getAttemptNumber());
        view.put("lastError", attempt.getLastError());
        view.put("updatedAt", attempt.getUpdatedAt());
        return view;
    }

    private static Map<String, Object> meterView(Meter meter) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("name", meter.getId().getName());
        Map<String, String> tags = new LinkedHashMap<>();
        for (Tag tag : meter.getId().getTags()) {
            tags.put(tag.getKey(), tag.getValue());
        }
        view.put("tags", tags);
        Map<String, Double> values = new LinkedHashMap<>();
        for (Measurement measurement : meter.measure()) {
            values.put(measurement.getStatistic().name().toLowerCase(Locale.ROOT), measurement.getValue());
        }
        view.put("values", values);
        return view;
    }
}
