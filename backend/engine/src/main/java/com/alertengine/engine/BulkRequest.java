package com.alertengine.engine;

import com.alertengine.core.model.AlertCategory;
import com.alertengine.core.model.AlertPriority;

import java.util.List;

/**
 * Targets either an explicit list of alert ids or, when {@code alertIds} is empty, every active
 * alert of the tenant matching the optional category and priority.
 */
public record BulkRequest(
        String tenantId,
        String userId,
        List<String> alertIds,
        AlertCategory category,
        AlertPriority priority,
        String note
) {
    public BulkRequest {
        alertIds = alertIds == null ? List.of() : List.copyOf(alertIds);
    }
}
