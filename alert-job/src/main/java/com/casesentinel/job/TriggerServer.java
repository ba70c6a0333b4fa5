package com.casesentinel.job;

import com.casesentinel.core.model.PredictedRisk;
import com.casesentinel.core.model.TimeWindow;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Lightweight HTTP server for health checks, metrics and on-demand work.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health}: {@code 200 OK} with body
 * {@code {"status":"UP"}}</li>
 * <li>{@code GET /readiness}: same; readiness check target</li>
 * <li>{@code GET /metrics}: every job meter with its tags and current
 * measurements</li>
 * <li>{@code GET /predictions?window=weekly&limit=10&threshold=100}:
 * predicted risks for the window. Each parameter is optional.</li>
 * <li>{@code POST /recompute?window=daily}: runs the detectors for the
 * window (default: the job's window) and returns the {@link RunReport}.
 * {@code 200} when every detector succeeded, {@code 500} otherwise. Intended
 * as the post-ingestion hook.</li>
 * </ul>
 * <p>
 * Bad parameters get {@code 400}, a wrong method {@code 405}.
 * </p>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer} with a single worker thread.
 * </p>
 *
 * @since 1.0.0
 */
public class TriggerServer {

    private static final Logger LOG = LoggerFactory.getLogger(TriggerServer.class);
    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);

    static final int DEFAULT_PREDICTION_LIMIT = 10;

    /**
     * Computes predicted risks on request.
     */
    @FunctionalInterface
    public interface PredictionSource {
        List<PredictedRisk> predict(TimeWindow window, int limit, int threshold);
    }

    private final Function<TimeWindow, RunReport> recompute;
    private final PredictionSource predictions;
    private final JobMetrics metrics;
    private final TimeWindow defaultWindow;
    private final int defaultThreshold;

    private HttpServer server;
    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * @param defaultThreshold alert threshold for prediction requests that
     *                         name none
     */
    public TriggerServer(Function<TimeWindow, RunReport> recompute,
            PredictionSource predictions,
            JobMetrics metrics,
            TimeWindow defaultWindow,
            int defaultThreshold) {
        this.recompute = Objects.requireNonNull(recompute, "recompute must not be null");
        this.predictions = Objects.requireNonNull(predictions, "predictions must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.defaultWindow = Objects.requireNonNull(defaultWindow, "defaultWindow must not be null");
        this.defaultThreshold = defaultThreshold;
    }

    /**
     * Start the server on the given port.
     *
     * @param port TCP port to bind to; 0 picks a free port
     * @throws IllegalArgumentException if port is out of range
     * @throws UncheckedIOException     if the port cannot be bound
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Trigger port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to bind trigger server on port " + port, e);
        }
        server.createContext("/health", TriggerServer::handleHealthCheck);
        server.createContext("/readiness", TriggerServer::handleHealthCheck);
        server.createContext("/metrics", this::handleMetrics);
        server.createContext("/predictions", this::handlePredictions);
        server.createContext("/recompute", this::handleRecompute);

        server.setExecutor(Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "trigger-server");
            t.setDaemon(true);
            return t;
        }));

        server.start();
        running.set(true);
        LOG.info("Trigger server started on port {}", getPort());
    }

    /**
     * Stop the server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            LOG.info("Trigger server stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port
     * @throws IllegalStateException if the server was never started
     */
    public int getPort() {
        if (server == null) {
            throw new IllegalStateException("Trigger server not started");
        }
        return server.getAddress().getPort();
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private static void handleHealthCheck(HttpExchange exchange) throws IOException {
        respond(exchange, 200, HEALTH_RESPONSE);
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        if (!allow(exchange, "GET")) {
            return;
        }
        respondJson(exchange, 200, metrics.snapshot());
    }

    private void handlePredictions(HttpExchange exchange) throws IOException {
        if (!allow(exchange, "GET")) {
            return;
        }

        TimeWindow window;
        int limit;
        int threshold;
        try {
            Map<String, String> params = queryParams(exchange.getRequestURI());
            window = params.containsKey("window") ? TimeWindow.fromWireName(params.get("window")) : defaultWindow;
            limit = positiveInt(params, "limit", DEFAULT_PREDICTION_LIMIT);
            threshold = positiveInt(params, "threshold", defaultThreshold);
        } catch (IllegalArgumentException e) {
            LOG.warn("Rejected predictions request: {}", e.getMessage());
            respondJson(exchange, 400, Map.of("error", e.getMessage()));
            return;
        }

        try {
            List<PredictedRisk> risks = predictions.predict(window, limit, threshold);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("predictions", risks);
            body.put("window", window);
            body.put("threshold", threshold);
            respondJson(exchange, 200, body);
        } catch (RuntimeException e) {
            LOG.error("Predictions for window {} failed: {}", window.wireName(), e.getMessage(), e);
            respondJson(exchange, 500, Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    private void handleRecompute(HttpExchange exchange) throws IOException {
        if (!allow(exchange, "POST")) {
            return;
        }

        TimeWindow window;
        try {
            String value = queryParams(exchange.getRequestURI()).get("window");
            window = value == null ? defaultWindow : TimeWindow.fromWireName(value);
        } catch (IllegalArgumentException e) {
            LOG.warn("Rejected recompute request: {}", e.getMessage());
            respondJson(exchange, 400, Map.of("error", e.getMessage()));
            return;
        }

        LOG.info("Recompute requested for window {}", window.wireName());
        try {
            RunReport report = recompute.apply(window);
            respondJson(exchange, report.hasFailures() ? 500 : 200, report);
        } catch (RuntimeException e) {
            LOG.error("Recompute for window {} failed: {}", window.wireName(), e.getMessage(), e);
            respondJson(exchange, 500, Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static boolean allow(HttpExchange exchange, String method) throws IOException {
        if (method.equalsIgnoreCase(exchange.getRequestMethod())) {
            return true;
        }
        exchange.getResponseHeaders().set("Allow", method);
        respondJson(exchange, 405, Map.of("error", "Method not allowed"));
        return false;
    }

    /**
     * @return decoded query parameters; the first value wins for repeated
     *         names
     */
    static Map<String, String> queryParams(URI uri) {
        Map<String, String> params = new HashMap<>();
        String query = uri.getRawQuery();
        if (query == null || query.isBlank()) {
            return params;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            if (eq > 0) {
                params.putIfAbsent(
                        URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8),
                        URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
            }
        }
        return params;
    }

    private static int positiveInt(Map<String, String> params, String name, int fallback) {
        String raw = params.get(name);
        if (raw == null) {
            return fallback;
        }
        int value;
        try {
            value = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got: '" + raw + "'", e);
        }
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be >= 1, got: " + value);
        }
        return value;
    }

    private static void respondJson(HttpExchange exchange, int status, Object body) throws IOException {
        respond(exchange, status, JsonSupport.mapper().writeValueAsBytes(body));
    }

    private static void respond(HttpExchange exchange, int status, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
