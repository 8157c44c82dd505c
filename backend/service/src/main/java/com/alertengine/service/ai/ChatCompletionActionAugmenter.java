package com.alertengine.service.ai;

import com.alertengine.core.model.AlertCategory;
import com.alertengine.core.util.JsonUtils;
import com.alertengine.engine.api.ActionAugmenter;
import com.alertengine.engine.scoring.ScoreVector;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Asks an OpenAI-compatible {@code /chat/completions} endpoint for extra actions and keeps the
 * reply lines that read like recommendations. Failures are thrown; the recommender falls back to
 * its templates.
 */
public class ChatCompletionActionAugmenter implements ActionAugmenter {
    static final int MAX_ACTIONS = 3;
    static final int MIN_LINE_LENGTH = 10;
    static final int MAX_LINE_LENGTH = 150;
    private static final List<String> ACTION_WORDS = List.of("recommend", "suggest", "should", "consider");
    private static final String SYSTEM_PROMPT =
            "You advise barbershop owners. Reply with short, concrete next steps, one per line.";

    private final HttpClient httpClient;
    private final URI endpoint;
    private final String apiKey;
    private final String model;
    private final Duration timeout;

    public ChatCompletionActionAugmenter(HttpClient httpClient, String baseUrl, String apiKey, String model,
                                         Duration timeout) {
        this.httpClient = httpClient;
        this.endpoint = URI.create(stripTrailingSlash(baseUrl) + "/chat/completions");
        this.apiKey = apiKey;
        this.model = model;
        this.timeout = timeout;
    }

    @Override
    public List<String> suggestActions(AlertCategory category, Map<String, Object> sourceData, ScoreVector scores) {
        try {
            HttpRequest request = HttpRequest.newBuilder(endpoint)
                    .timeout(timeout)
                    .header("Authorization", "Bearer " + apiKey)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody(category, sourceData, scores),
                            StandardCharsets.UTF_8))
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                throw new IllegalStateException("Chat completion failed with status " + response.statusCode());
            }
            return extractActions(replyText(response.body()));
        } catch (IOException e) {
            throw new IllegalStateException("Chat completion request failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Chat completion request interrupted", e);
        }
    }

    static List<String> extractActions(String reply) {
        List<String> actions = new ArrayList<>();
        if (reply == null) {
            return actions;
        }
        for (String rawLine : reply.split("\n")) {
            String line = rawLine.strip();
            if (line.length() <= MIN_LINE_LENGTH || line.length() >= MAX_LINE_LENGTH) {
                continue;
            }
            String lower = line.toLowerCase(Locale.ROOT);
            if (ACTION_WORDS.stream().anyMatch(lower::contains)) {
                actions.add(line);
                if (actions.size() == MAX_ACTIONS) {
                    break;
                }
            }
        }
        return actions;
    }

    private String requestBody(AlertCategory category, Map<String, Object> sourceData, ScoreVector scores)
            throws IOException {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("category", category.value());
        context.put("sourceData", sourceData);
        context.put("scores", Map.of(
                "confidence", scores.confidence(),
                "severity", scores.severity(),
                "urgency", scores.urgency(),
                "businessImpact", scores.businessImpact()
        ));
        String prompt = "Generate 2-3 specific actionable recommendations for this " + category.value()
                + " alert. Context: " + JsonUtils.objectMapper().writeValueAsString(context);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("temperature", 0.3);
        body.put("max_tokens", 300);
        body.put("messages", List.of(
                Map.of("role", "system", "content", SYSTEM_PROMPT),
                Map.of("role", "user", "content", prompt)
        ));
        return JsonUtils.objectMapper().writeValueAsString(body);
    }

    private static String replyText(String responseBody) throws IOException {
        JsonNode choices = JsonUtils.objectMapper().readTree(responseBody).path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            return "";
        }
        return choices.get(0).path("message").path("content").asText("");
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
