package com.alertengine.service.support;

import com.alertengine.core.model.Alert;
import com.alertengine.core.model.AlertCategory;
import com.alertengine.core.model.AlertPriority;
import com.alertengine.core.model.AlertStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public final class ServiceFixtures {
    public static final Instant T0 = Instant.parse("2026-03-10T20:00:00Z");
    public static final String TENANT = "shop-1";

    private ServiceFixtures() {
    }

    public static Alert alert(String id, AlertPriority priority) {
        return new Alert(id, "fp-" + id, TENANT, "rule_shop-1_revenue_anomaly", "Revenue drop " + id,
                "Daily revenue is below forecast", AlertCategory.REVENUE_ANOMALY, priority, 0.8, 0.9, 0.7, 0.6,
                AlertStatus.ACTIVE, null, T0, T0, T0.plus(Duration.ofHours(24)), null, Map.of("source", "pos"),
                Map.of("revenueImpact", 1000, "trendDirection", "decreasing"),
                List.of("Review pricing", "Check marketing spend"), 0,
                Map.of("categoryUrgency", 0.8, "revenueImpact", 1.0));
    }
}
