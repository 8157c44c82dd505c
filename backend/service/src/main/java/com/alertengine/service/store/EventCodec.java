package com.alertengine.service.store;

import com.alertengine.core.events.AlertCreated;
import com.alertengine.core.events.AlertDeduplicated;
import com.alertengine.core.events.AlertNotified;
import com.alertengine.core.events.AlertStatusChanged;
import com.alertengine.core.events.AlertSuppressed;
import com.alertengine.core.events.Event;
import com.alertengine.core.events.InsightGenerated;
import com.alertengine.core.events.PatternDetected;
import com.alertengine.core.events.ProcessorTickCompleted;
import com.alertengine.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * One JSON object per event: {@code {"type": ..., "timestamp": ..., "event": {...}}}.
 */
public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Map<String, Class<? extends Event>> TYPES = Map.of(
            "AlertCreated", AlertCreated.class,
            "AlertDeduplicated", AlertDeduplicated.class,
            "AlertSuppressed", AlertSuppressed.class,
            "AlertStatusChanged", AlertStatusChanged.class,
            "AlertNotified", AlertNotified.class,
            "PatternDetected", PatternDetected.class,
            "InsightGenerated", InsightGenerated.class,
            "ProcessorTickCompleted", ProcessorTickCompleted.class
    );

    private EventCodec() {
    }

    public static Set<String> knownTypes() {
        return TYPES.keySet();
    }

    public static String toJsonLine(Event event) {
        try {
            return MAPPER.writeValueAsString(new StoredEvent(event.type(), event.timestamp(), event));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize event " + event.type(), e);
        }
    }

    public static Event fromJsonLine(String line) {
        try {
            JsonNode node = MAPPER.readTree(line);
            String type = node.path("type").asText();
            Class<? extends Event> eventClass = TYPES.get(type);
            if (eventClass == null) {
                throw new IllegalArgumentException("Unsupported event type: " + type);
            }
            return MAPPER.treeToValue(node.path("event"), eventClass);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to deserialize event", e);
        }
    }

    private record StoredEvent(String type, Instant timestamp, Event event) {
    }
}
