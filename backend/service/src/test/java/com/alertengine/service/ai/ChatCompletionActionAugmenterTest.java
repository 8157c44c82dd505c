package com.alertengine.service.ai;

import com.alertengine.core.model.AlertCategory;
import com.alertengine.engine.scoring.ScoreVector;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChatCompletionActionAugmenterTest {
    private HttpServer stub;

    @AfterEach
    void tearDown() {
        if (stub != null) {
            stub.stop(0);
        }
    }

    @Test
    void keepsOnlyRecommendationLinesOfReasonableLength() {
        String reply = String.join("\n",
                "Here is what I think:",
                "- We recommend calling the top 10 regulars this week",
                "Consider",
                "- You should review weekday pricing against nearby shops",
                "- Consider a loyalty double-points weekend to lift bookings",
                "- Suggest " + "x".repeat(160),
                "- You should also audit no-show fees");

        List<String> actions = ChatCompletionActionAugmenter.extractActions(reply);

        assertEquals(List.of(
                "- We recommend calling the top 10 regulars this week",
                "- You should review weekday pricing against nearby shops",
                "- Consider a loyalty double-points weekend to lift bookings"), actions);
    }

    @Test
    void callsChatCompletionEndpointWithBearerToken() throws Exception {
        AtomicReference<String> authorization = new AtomicReference<>();
        AtomicReference<String> requestBody = new AtomicReference<>();
        startStub(200, """
                {"choices":[{"message":{"role":"assistant","content":"1. You should text lapsed clients a rebooking offer"}}]}
                """, authorization, requestBody);

        List<String> actions = augmenter().suggestActions(AlertCategory.REVENUE_ANOMALY,
                Map.of("revenueImpact", 1000), new ScoreVector(0.8, 0.9, 0.7, 0.6));

        assertEquals(List.of("1. You should text lapsed clients a rebooking offer"), actions);
        assertEquals("Bearer test-key", authorization.get());
        assertTrue(requestBody.get().contains("\"model\":\"test-model\""));
        assertTrue(requestBody.get().contains("revenue_anomaly"));
    }

    @Test
    void errorStatusIsThrown() throws Exception {
        startStub(503, "{\"error\":\"overloaded\"}", new AtomicReference<>(), new AtomicReference<>());

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> augmenter().suggestActions(
                AlertCategory.SECURITY, Map.of(), ScoreVector.NEUTRAL));
        assertTrue(ex.getMessage().contains("503"));
    }

    private ChatCompletionActionAugmenter augmenter() {
        String baseUrl = "http://localhost:" + stub.getAddress().getPort() + "/v1/";
        return new ChatCompletionActionAugmenter(HttpClient.newHttpClient(), baseUrl, "test-key", "test-model",
                Duration.ofSeconds(5));
    }

    private void startStub(int status, String body, AtomicReference<String> authorization,
                           AtomicReference<String> requestBody) throws IOException {
        stub = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        stub.createContext("/v1/chat/completions", exchange -> {
            authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            requestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] payload = body.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, payload.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(payload);
            }
        });
        stub.start();
    }
}
