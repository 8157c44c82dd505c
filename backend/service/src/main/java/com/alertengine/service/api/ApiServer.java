package com.alertengine.service.api;

import com.alertengine.core.error.AlertEngineException;
import com.alertengine.core.error.InvalidCategoryException;
import com.alertengine.core.error.InvalidPriorityFilterException;
import com.alertengine.core.error.InvalidTransitionException;
import com.alertengine.core.error.NotFoundException;
import com.alertengine.core.error.StorageFailureException;
import com.alertengine.core.events.Event;
import com.alertengine.core.model.Alert;
import com.alertengine.core.model.AlertCategory;
import com.alertengine.core.model.AlertPriority;
import com.alertengine.core.model.AlertRule;
import com.alertengine.core.model.UserAlertPreferences;
import com.alertengine.core.util.JsonUtils;
import com.alertengine.engine.AlertEngine;
import com.alertengine.engine.BulkRequest;
import com.alertengine.engine.BulkResult;
import com.alertengine.engine.CreateAlertCommand;
import com.alertengine.engine.lifecycle.LifecycleResult;
import com.alertengine.engine.query.ActiveAlertQuery;
import com.alertengine.service.store.EventStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thin JSON adapter over {@link AlertEngine}. Every error leaves as {@code {"error": "..."}}.
 */
public class ApiServer {
    private static final Logger LOGGER = Logger.getLogger(ApiServer.class.getName());
    private static final int DEFAULT_EVENT_LIMIT = 200;

    private final int port;
    private final AlertEngine engine;
    private final EventStore eventStore;
    private final DiagnosticsTracker diagnosticsTracker;

    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(int port, AlertEngine engine, EventStore eventStore, DiagnosticsTracker diagnosticsTracker) {
        this.port = port;
        this.engine = engine;
        this.eventStore = eventStore;
        this.diagnosticsTracker = diagnosticsTracker;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            executor = Executors.newFixedThreadPool(8);
            server.setExecutor(executor);
            server.createContext("/api/health", exchange -> guarded(exchange, this::handleHealth));
            server.createContext("/api/metrics", exchange -> guarded(exchange, this::handleMetrics));
            server.createContext("/api/events", exchange -> guarded(exchange, this::handleEvents));
            server.createContext("/api/alerts", exchange -> guarded(exchange, this::handleAlerts));
            server.createContext("/api/preferences", exchange -> guarded(exchange, this::handlePreferences));
            server.createContext("/api/rules", exchange -> guarded(exchange, this::handleRules));
            server.createContext("/api/patterns", exchange -> guarded(exchange, this::handlePatterns));
            server.createContext("/api/insights", exchange -> guarded(exchange, this::handleInsights));
            server.start();
            LOGGER.info("API listening on port " + actualPort());
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting API server", e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdown();
        }
    }

    public int actualPort() {
        if (server == null) {
            return port;
        }
        return server.getAddress().getPort();
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (requireMethod(exchange, "GET")) {
            writeJson(exchange, 200, engine.health());
        }
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        if (requireMethod(exchange, "GET")) {
            Map<String, Object> metrics = new HashMap<>(diagnosticsTracker.metricsSnapshot());
            metrics.put("engine", engine.health().counters());
            writeJson(exchange, 200, metrics);
        }
    }

    private void handleEvents(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        Map<String, String> query = queryParams(exchange.getRequestURI());
        Instant since = query.containsKey("since") ? Instant.parse(query.get("since")) : Instant.EPOCH;
        Optional<String> type = Optional.ofNullable(query.get("type")).filter(value -> !value.isBlank());
        int limit = intParam(query, "limit", DEFAULT_EVENT_LIMIT);
        List<Event> events = eventStore.query(since, type, Math.max(1, limit));
        writeJson(exchange, 200, events);
    }

    private void handleAlerts(HttpExchange exchange) throws IOException {
        String[] segments = pathSegments(exchange, "/api/alerts");
        String method = exchange.getRequestMethod().toUpperCase(Locale.ROOT);
        if (segments.length == 0 && "POST".equals(method)) {
            createAlert(exchange);
        } else if (segments.length == 1 && "active".equals(segments[0]) && "GET".equals(method)) {
            listActive(exchange);
        } else if (segments.length == 1 && "history".equals(segments[0]) && "GET".equals(method)) {
            history(exchange);
        } else if (segments.length == 2 && "bulk".equals(segments[0]) && "POST".equals(method)) {
            bulk(exchange, segments[1]);
        } else if (segments.length == 1 && "GET".equals(method)) {
            writeJson(exchange, 200, engine.getAlert(segments[0]));
        } else if (segments.length == 2 && "POST".equals(method)) {
            alertAction(exchange, segments[0], segments[1]);
        } else {
            writeJson(exchange, 404, Map.of("error", "No route for " + method + " " + exchange.getRequestURI().getPath()));
        }
    }

    private void createAlert(HttpExchange exchange) throws IOException {
        CreateAlertRequest body = readBody(exchange, CreateAlertRequest.class);
        if (body.category() == null || body.category().isBlank()) {
            throw new IllegalArgumentException("category is required");
        }
        Alert alert = engine.createAlert(new CreateAlertCommand(
                body.tenantId(),
                body.title(),
                body.message(),
                AlertCategory.fromValue(body.category()),
                body.sourceData(),
                body.metadata()
        ));
        writeJson(exchange, 201, alert);
    }

    private void listActive(HttpExchange exchange) throws IOException {
        Map<String, String> query = queryParams(exchange.getRequestURI());
        AlertPriority priority = blankToNull(query.get("priority")) == null
                ? null : AlertPriority.fromValue(query.get("priority"));
        AlertCategory category = blankToNull(query.get("category")) == null
                ? null : AlertCategory.fromValue(query.get("category"));
        List<Alert> alerts = engine.listActiveAlerts(new ActiveAlertQuery(
                query.get("tenantId"),
                blankToNull(query.get("userId")),
                priority,
                category,
                intParam(query, "limit", 0)
        ));
        writeJson(exchange, 200, alerts);
    }

    private void history(HttpExchange exchange) throws IOException {
        Map<String, String> query = queryParams(exchange.getRequestURI());
        writeJson(exchange, 200, engine.history(
                query.get("tenantId"),
                blankToNull(query.get("userId")),
                intParam(query, "days", 7),
                intParam(query, "limit", 0)
        ));
    }

    private void bulk(HttpExchange exchange, String action) throws IOException {
        BulkRequest request = readBody(exchange, BulkRequest.class);
        BulkResult result;
        if ("acknowledge".equals(action)) {
            result = engine.bulkAcknowledge(request);
        } else if ("dismiss".equals(action)) {
            result = engine.bulkDismiss(request);
        } else {
            writeJson(exchange, 404, Map.of("error", "Unknown bulk action: " + action));
            return;
        }
        writeJson(exchange, 200, result);
    }

    private void alertAction(HttpExchange exchange, String alertId, String action) throws IOException {
        AlertActionRequest body = readBody(exchange, AlertActionRequest.class);
        LifecycleResult result;
        switch (action) {
            case "acknowledge":
                result = engine.acknowledge(alertId, body.userId(), body.notes());
                break;
            case "dismiss":
                result = engine.dismiss(alertId, body.userId(), body.feedback(), body.reason());
                break;
            case "resolve":
                result = engine.resolve(alertId, body.userId(), body.notes());
                break;
            case "snooze":
                if (body.until() == null) {
                    throw new IllegalArgumentException("until is required");
                }
                result = engine.snooze(alertId, body.userId(), body.until(), body.reason());
                break;
            case "rate":
                if (body.rating() == null) {
                    throw new IllegalArgumentException("rating is required");
                }
                result = engine.rate(alertId, body.userId(), body.rating(), body.comment());
                break;
            case "view":
                result = engine.markViewed(alertId, body.userId());
                break;
            default:
                writeJson(exchange, 404, Map.of("error", "Unknown alert action: " + action));
                return;
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("changed", result.changed());
        response.put("status", result.alert().status().value());
        response.put("alert", result.alert());
        writeJson(exchange, 200, response);
    }

    private void handlePreferences(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod().toUpperCase(Locale.ROOT);
        if ("GET".equals(method)) {
            Map<String, String> query = queryParams(exchange.getRequestURI());
            writeJson(exchange, 200, engine.getPreferences(query.get("userId"), query.get("tenantId")));
        } else if ("PUT".equals(method)) {
            writeJson(exchange, 200, engine.updatePreferences(readBody(exchange, UserAlertPreferences.class)));
        } else {
            methodNotAllowed(exchange);
        }
    }

    private void handleRules(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod().toUpperCase(Locale.ROOT);
        if ("GET".equals(method)) {
            writeJson(exchange, 200, engine.listRules(queryParams(exchange.getRequestURI()).get("tenantId")));
        } else if ("PUT".equals(method)) {
            writeJson(exchange, 200, engine.saveRule(readBody(exchange, AlertRule.class)));
        } else {
            methodNotAllowed(exchange);
        }
    }

    private void handlePatterns(HttpExchange exchange) throws IOException {
        if (requireMethod(exchange, "GET")) {
            writeJson(exchange, 200, engine.patterns(queryParams(exchange.getRequestURI()).get("tenantId")));
        }
    }

    private void handleInsights(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        String tenantId = queryParams(exchange.getRequestURI()).get("tenantId");
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId is required");
        }
        writeJson(exchange, 200, engine.latestInsight(tenantId)
                .orElseThrow(() -> new NotFoundException("Insight", tenantId)));
    }

    private void guarded(HttpExchange exchange, ExchangeHandler handler) throws IOException {
        try {
            handler.handle(exchange);
        } catch (NotFoundException e) {
            writeJson(exchange, 404, error(e));
        } catch (InvalidTransitionException e) {
            writeJson(exchange, 409, error(e));
        } catch (StorageFailureException e) {
            LOGGER.log(Level.WARNING, "Storage failure on " + exchange.getRequestURI(), e);
            writeJson(exchange, 503, error(e));
        } catch (InvalidCategoryException | InvalidPriorityFilterException | IllegalArgumentException
                 | DateTimeException e) {
            writeJson(exchange, 400, error(e));
        } catch (JsonProcessingException e) {
            writeJson(exchange, 400, Map.of("error", "Invalid request body: " + rootMessage(e)));
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Unhandled error on " + exchange.getRequestURI(), e);
            writeJson(exchange, 500, Map.of("error", "internal_error"));
        }
    }

    private boolean requireMethod(HttpExchange exchange, String method) throws IOException {
        if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
            methodNotAllowed(exchange);
            return false;
        }
        return true;
    }

    private void methodNotAllowed(HttpExchange exchange) throws IOException {
        writeJson(exchange, 405, Map.of("error", "Method not allowed: " + exchange.getRequestMethod()));
    }

    private <T> T readBody(HttpExchange exchange, Class<T> type) throws IOException {
        try (InputStream in = exchange.getRequestBody()) {
            byte[] raw = in.readAllBytes();
            if (raw.length == 0) {
                throw new IllegalArgumentException("Request body is required");
            }
            return JsonUtils.objectMapper().readValue(raw, type);
        }
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = JsonUtils.objectMapper().writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    private static String[] pathSegments(HttpExchange exchange, String prefix) {
        String rest = exchange.getRequestURI().getPath().substring(prefix.length());
        String trimmed = rest.replaceAll("^/+|/+$", "");
        return trimmed.isEmpty() ? new String[0] : trimmed.split("/");
    }

    private static Map<String, String> queryParams(URI uri) {
        Map<String, String> query = new HashMap<>();
        String raw = uri.getRawQuery();
        if (raw == null || raw.isBlank()) {
            return query;
        }
        for (String entry : raw.split("&")) {
            String[] pair = entry.split("=", 2);
            String key = URLDecoder.decode(pair[0], StandardCharsets.UTF_8);
            String value = pair.length > 1 ? URLDecoder.decode(pair[1], StandardCharsets.UTF_8) : "";
            query.put(key, value);
        }
        return query;
    }

    private static int intParam(Map<String, String> query, String name, int fallback) {
        String raw = blankToNull(query.get(name));
        if (raw == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer", e);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static Map<String, String> error(RuntimeException e) {
        return Map.of("error", String.valueOf(e.getMessage()));
    }

    private static String rootMessage(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
            if (current instanceof AlertEngineException) {
                return current.getMessage();
            }
        }
        return error instanceof JsonProcessingException
                ? ((JsonProcessingException) error).getOriginalMessage()
                : error.getMessage();
    }

    @FunctionalInterface
    private interface ExchangeHandler {
        void handle(HttpExchange exchange) throws IOException;
    }

    record CreateAlertRequest(
            String tenantId,
            String title,
            String message,
            String category,
            Map<String, Object> sourceData,
            Map<String, Object> metadata
    ) {
    }

    record AlertActionRequest(
            String userId,
            String notes,
            String feedback,
            String reason,
            Instant until,
            Integer rating,
            String comment
    ) {
    }
}
