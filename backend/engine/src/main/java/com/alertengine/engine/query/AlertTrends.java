package com.alertengine.engine.query;

import com.alertengine.core.model.AlertCategory;
import com.alertengine.core.model.AlertPriority;

import java.time.LocalDate;
import java.util.Map;

/**
 * {@code direction} compares the newer half of the window with the older half: increasing,
 * decreasing or stable.
 */
public record AlertTrends(
        Map<LocalDate, Integer> dailyCounts,
        Map<AlertCategory, Integer> byCategory,
        Map<AlertPriority, Integer> byPriority,
        String direction
) {
}
