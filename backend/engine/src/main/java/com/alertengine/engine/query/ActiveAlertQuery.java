package com.alertengine.engine.query;

import com.alertengine.core.model.AlertCategory;
import com.alertengine.core.model.AlertPriority;

/**
 * Filters are optional; a non-positive {@code limit} selects the configured default.
 */
public record ActiveAlertQuery(
        String tenantId,
        String userId,
        AlertPriority priorityFilter,
        AlertCategory categoryFilter,
        int limit
) {
    public static ActiveAlertQuery forUser(String tenantId, String userId) {
        return new ActiveAlertQuery(tenantId, userId, null, null, 0);
    }
}
