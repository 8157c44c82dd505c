package com.alertengine.engine;

import com.alertengine.core.model.AlertCategory;

import java.util.Map;

public record CreateAlertCommand(
        String tenantId,
        String title,
        String message,
        AlertCategory category,
        Map<String, Object> sourceData,
        Map<String, Object> metadata
) {
    public CreateAlertCommand {
        sourceData = sourceData == null ? Map.of() : sourceData;
        metadata = metadata == null ? Map.of() : metadata;
    }

    public void validate() {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId is required");
        }
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title is required");
        }
        if (category == null) {
            throw new IllegalArgumentException("category is required");
        }
    }
}
