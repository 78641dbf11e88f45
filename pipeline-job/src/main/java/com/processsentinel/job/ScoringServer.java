package com.processsentinel.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.processsentinel.core.error.DataIntegrityException;
import com.processsentinel.core.model.ScoringResult;
import com.processsentinel.core.scoring.ScoringService;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lightweight HTTP server exposing the scoring service as JSON endpoints.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health} - liveness, with {@code model_loaded}</li>
 * <li>{@code GET /readiness} - same; readiness check target</li>
 * <li>{@code GET /model_info} - description of the loaded model</li>
 * <li>{@code POST /predict} - one row object, or an array of rows forming
 * one sequence</li>
 * <li>{@code POST /batch_predict} - {@code {"batch_data": [rows...]}}</li>
 * </ul>
 *
 * <p>
 * Bad input answers {@code 400}, anything else that fails answers
 * {@code 500}; both with {@code {"error": "..."}}. Uses the JDK built-in
 * {@link HttpServer}.
 * </p>
 *
 * @since 1.0.0
 */
public class ScoringServer {

    private static final Logger LOG = LoggerFactory.getLogger(ScoringServer.class);
    private static final TypeReference<Map<String, Object>> ROW_TYPE = new TypeReference<>() {
    };
    private static final int WORKER_THREADS = 4;

    private final ScoringService service;
    private final ObjectMapper mapper;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private HttpServer server;
    private ExecutorService executor;

    public ScoringServer(ScoringService service) {
        this.service = Objects.requireNonNull(service, "Scoring service must not be null");
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    /**
     * Start the server on the given port.
     *
     * @param port TCP port to bind to; 0 picks a free port
     * @throws IllegalArgumentException if port is out of range
     * @throws IllegalStateException    if the port cannot be bound
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Server port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to start scoring server on port " + port, e);
        }
        server.createContext("/health", get(this::handleHealth));
        server.createContext("/readiness", get(this::handleHealth));
        server.createContext("/model_info", get(exchange -> service.modelInfo()));
        server.createContext("/predict", post(this::handlePredict));
        server.createContext("/batch_predict", post(this::handleBatchPredict));

        AtomicInteger threadCount = new AtomicInteger();
        executor = Executors.newFixedThreadPool(WORKER_THREADS, r -> {
            Thread t = new Thread(r, "scoring-server-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);
        server.start();
        running.set(true);
        LOG.info("Scoring server started on port {}", getPort());
    }

    /**
     * Stop the server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdown();
            LOG.info("Scoring server stopped");
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
     * @throws IllegalStateException if the server was never started
     */
    public int getPort() {
        if (server == null) {
            throw new IllegalStateException("Scoring server not started");
        }
        return server.getAddress().getPort();
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private Object handleHealth(HttpExchange exchange) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("model_loaded", true);
        body.put("timestamp", Instant.now());
        return body;
    }

    private Object handlePredict(JsonNode body) {
        List<Map<String, Object>> rows;
        if (body.isArray()) {
            rows = toRows(body);
        } else if (body.isObject()) {
            rows = List.of(mapper.convertValue(body, ROW_TYPE));
        } else {
            throw new BadRequestException("Request body must be a JSON object or array");
        }
        if (rows.isEmpty()) {
            throw new BadRequestException("No input data provided");
        }
        List<ScoringResult> results = service.score(rows);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("predictions", results);
        response.put("status", "success");
        return response;
    }

    private Object handleBatchPredict(JsonNode body) {
        JsonNode batch = body.get("batch_data");
        if (batch == null || !batch.isArray() || batch.isEmpty()) {
            throw new BadRequestException("No batch data provided");
        }
        List<ScoringResult> results = service.score(toRows(batch));

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("batch_predictions", results);
        response.put("total_processed", results.size());
        response.put("status", "success");
        return response;
    }

    private List<Map<String, Object>> toRows(JsonNode array) {
        for (JsonNode element : array) {
            if (!element.isObject()) {
                throw new BadRequestException("Every row must be a JSON object");
            }
        }
        return mapper.convertValue(array, new TypeReference<List<Map<String, Object>>>() {
        });
    }

    // ---------------------------------------------------------------
    // Plumbing
    // ---------------------------------------------------------------

    @FunctionalInterface
    private interface GetHandler {
        Object handle(HttpExchange exchange);
    }

    @FunctionalInterface
    private interface PostHandler {
        Object handle(JsonNode body);
    }

    private HttpHandler get(GetHandler handler) {
        return exchange -> dispatch(exchange, "GET", () -> handler.handle(exchange));
    }

    private HttpHandler post(PostHandler handler) {
        return exchange -> dispatch(exchange, "POST", () -> {
            JsonNode body;
            try (InputStream in = exchange.getRequestBody()) {
                body = mapper.readTree(in);
            }
            if (body == null || body.isMissingNode() || body.isNull()) {
                throw new BadRequestException("No input data provided");
            }
            return handler.handle(body);
        });
    }

    @FunctionalInterface
    private interface Action {
        Object run() throws IOException;
    }

    private void dispatch(HttpExchange exchange, String method, Action action) throws IOException {
        try {
            if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
                send(exchange, 405, error("Method not allowed: " + exchange.getRequestMethod()));
                return;
            }
            send(exchange, 200, action.run());
        } catch (BadRequestException | DataIntegrityException | IllegalArgumentException
                | JsonProcessingException e) {
            LOG.warn("Rejected {} {}: {}", exchange.getRequestMethod(), exchange.getRequestURI(), e.getMessage());
            send(exchange, 400, error(e.getMessage()));
        } catch (RuntimeException e) {
            LOG.error("Failed to handle {} {}", exchange.getRequestMethod(), exchange.getRequestURI(), e);
            send(exchange, 500, error(e.getMessage()));
        } finally {
            exchange.close();
        }
    }

    private static Map<String, Object> error(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message != null ? message : "Internal error");
        return body;
    }

    private void send(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] bytes = mapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    /**
     * Client error raised by request validation.
     */
    static final class BadRequestException extends RuntimeException {
        private static final long serialVersionUID = 1L;

        BadRequestException(String message) {
            super(message);
        }
    }
}
