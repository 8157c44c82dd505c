package com.alertengine.service.api;

import com.alertengine.core.bus.EventBus;
import com.alertengine.core.util.JsonUtils;
import com.alertengine.engine.AlertEngine;
import com.alertengine.engine.EngineContext;
import com.alertengine.engine.config.EngineSettings;
import com.alertengine.engine.store.InMemoryAlertStore;
import com.alertengine.service.notify.LoggingNotificationGateway;
import com.alertengine.service.store.JsonlEventStore;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.time.Clock;
import java.time.ZoneOffset;

import static com.alertengine.service.support.ServiceFixtures.T0;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ApiServerIntegrationTest {
    private static final String REVENUE_ALERT = """
            {"tenantId":"shop-1","title":"Revenue drop detected","message":"Revenue is 40% below forecast",
             "category":"revenue-anomaly",
             "sourceData":{"revenueImpact":1000,"customerCount":25,"trendDirection":"decreasing",
                           "thresholdDeviation":0.8,"systemCritical":true}}
            """;

    private final HttpClient client = HttpClient.newHttpClient();
    private ApiServer apiServer;

    @BeforeEach
    void setUp() throws Exception {
        Clock clock = Clock.fixed(T0, ZoneOffset.UTC);
        EventBus eventBus = new EventBus();
        JsonlEventStore eventStore = new JsonlEventStore(
                Files.createTempDirectory("api-events-").resolve("alert-events.jsonl"));
        eventBus.subscribeAll(eventStore::append);
        DiagnosticsTracker diagnostics = new DiagnosticsTracker(eventBus, clock);
        AlertEngine engine = new AlertEngine(new EngineContext(new InMemoryAlertStore(),
                new LoggingNotificationGateway(clock), eventBus, clock, EngineSettings.defaults(), null));
        apiServer = new ApiServer(0, engine, eventStore, diagnostics);
        apiServer.start();
    }

    @AfterEach
    void tearDown() {
        if (apiServer != null) {
            apiServer.stop();
        }
    }

    @Test
    void createListAndAcknowledgeAlert() throws Exception {
        HttpResponse<String> created = post("/api/alerts", REVENUE_ALERT);
        assertEquals(201, created.statusCode());
        JsonNode alert = JsonUtils.objectMapper().readTree(created.body());
        String alertId = alert.path("alertId").asText();
        assertEquals("revenue_anomaly", alert.path("category").asText());
        assertTrue(alert.path("recommendedActions").size() >= 3);

        HttpResponse<String> active = get("/api/alerts/active?tenantId=shop-1&userId=barber-1");
        assertEquals(200, active.statusCode());
        assertEquals(1, JsonUtils.objectMapper().readTree(active.body()).size());

        HttpResponse<String> acked = post("/api/alerts/" + alertId + "/acknowledge", "{\"userId\":\"barber-1\"}");
        assertEquals(200, acked.statusCode());
        JsonNode ackBody = JsonUtils.objectMapper().readTree(acked.body());
        assertTrue(ackBody.path("changed").asBoolean());
        assertEquals("acknowledged", ackBody.path("status").asText());

        HttpResponse<String> again = post("/api/alerts/" + alertId + "/acknowledge", "{\"userId\":\"barber-1\"}");
        assertFalse(JsonUtils.objectMapper().readTree(again.body()).path("changed").asBoolean());
    }

    @Test
    void duplicateCreateReturnsSameAlert() throws Exception {
        String first = JsonUtils.objectMapper().readTree(post("/api/alerts", REVENUE_ALERT).body())
                .path("alertId").asText();
        JsonNode second = JsonUtils.objectMapper().readTree(post("/api/alerts", REVENUE_ALERT).body());

        assertEquals(first, second.path("alertId").asText());
        assertEquals(1, second.path("similarAlertCount").asInt());
    }

    @Test
    void errorsMapToStatusCodesWithJsonBody() throws Exception {
        HttpResponse<String> badCategory = post("/api/alerts",
                "{\"tenantId\":\"shop-1\",\"title\":\"x\",\"category\":\"weather\"}");
        assertEquals(400, badCategory.statusCode());
        assertTrue(badCategory.body().contains("Invalid category 'weather'"));

        HttpResponse<String> badPriority = get("/api/alerts/active?tenantId=shop-1&priority=urgent");
        assertEquals(400, badPriority.statusCode());
        assertTrue(badPriority.body().contains("Invalid priority 'urgent'"));

        HttpResponse<String> missing = post("/api/alerts/nope/dismiss", "{\"userId\":\"barber-1\"}");
        assertEquals(404, missing.statusCode());
        assertTrue(missing.body().contains("\"error\""));

        String alertId = JsonUtils.objectMapper().readTree(post("/api/alerts", REVENUE_ALERT).body())
                .path("alertId").asText();
        post("/api/alerts/" + alertId + "/acknowledge", "{\"userId\":\"barber-1\"}");
        HttpResponse<String> snooze = post("/api/alerts/" + alertId + "/snooze",
                "{\"userId\":\"barber-1\",\"until\":\"2026-03-11T09:00:00Z\"}");
        assertEquals(409, snooze.statusCode());
    }

    @Test
    void preferencesDefaultThenUpdate() throws Exception {
        HttpResponse<String> defaults = get("/api/preferences?userId=barber-1&tenantId=shop-1");
        assertEquals(200, defaults.statusCode());
        JsonNode prefs = JsonUtils.objectMapper().readTree(defaults.body());
        assertEquals("medium", prefs.path("priorityThreshold").asText());

        String updated = defaults.body().replace("\"priorityThreshold\":\"medium\"", "\"priorityThreshold\":\"high\"");
        HttpResponse<String> saved = send(HttpRequest.newBuilder(uri("/api/preferences"))
                .PUT(HttpRequest.BodyPublishers.ofString(updated)).build());
        assertEquals(200, saved.statusCode());

        JsonNode reread = JsonUtils.objectMapper().readTree(get("/api/preferences?userId=barber-1&tenantId=shop-1").body());
        assertEquals("high", reread.path("priorityThreshold").asText());
    }

    @Test
    void healthMetricsAndEventsAreServed() throws Exception {
        post("/api/alerts", REVENUE_ALERT);

        JsonNode health = JsonUtils.objectMapper().readTree(get("/api/health").body());
        assertEquals("ok", health.path("status").asText());
        assertFalse(health.path("learnedModelLoaded").asBoolean());
        assertEquals(1, health.path("counters").path("alertsCreated").asInt());

        JsonNode metrics = JsonUtils.objectMapper().readTree(get("/api/metrics").body());
        assertTrue(metrics.path("eventsEmittedTotal").asInt() >= 2);

        JsonNode events = JsonUtils.objectMapper().readTree(get("/api/events?type=AlertCreated").body());
        assertEquals(1, events.size());
        assertEquals("shop-1", events.get(0).path("tenantId").asText());
    }

    @Test
    void unknownMethodIsRejected() throws Exception {
        HttpResponse<String> response = send(HttpRequest.newBuilder(uri("/api/health"))
                .DELETE().build());
        assertEquals(405, response.statusCode());
    }

    private HttpResponse<String> get(String path) throws Exception {
        return send(HttpRequest.newBuilder(uri(path)).GET().build());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        return send(HttpRequest.newBuilder(uri(path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build());
    }

    private HttpResponse<String> send(HttpRequest request) throws Exception {
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://localhost:" + apiServer.actualPort() + path);
    }
}
