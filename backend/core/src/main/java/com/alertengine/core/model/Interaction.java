package com.alertengine.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Map;

public record Interaction(
        String interactionId,
        String alertId,
        String tenantId,
        AlertCategory category,
        String userId,
        InteractionType type,
        Map<String, Object> payload,
        Instant timestamp,
        double responseTimeSeconds
) {
    public static final String SYSTEM_USER = "system";

    public Interaction {
        payload = payload == null ? Map.of() : payload;
    }

    @JsonIgnore
    public boolean isSystem() {
        return SYSTEM_USER.equals(userId);
    }
}
