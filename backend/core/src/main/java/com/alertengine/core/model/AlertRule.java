package com.alertengine.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * Tenant-scoped alert configuration. {@code feedbackScore} is the running mean of every feedback
 * score folded into it; {@code feedbackCount} is the number of folded scores.
 */
public record AlertRule(
        String ruleId,
        String tenantId,
        String name,
        AlertCategory category,
        Map<String, Object> conditions,
        Map<String, Object> thresholds,
        boolean enabled,
        double priorityWeight,
        Integer dailyCap,
        double feedbackScore,
        int feedbackCount,
        long triggerCount,
        Instant lastTriggeredAt,
        Instant createdAt,
        Instant updatedAt
) {
    public static final double INITIAL_FEEDBACK_SCORE = 0.5;

    public AlertRule {
        conditions = conditions == null ? Map.of() : conditions;
        thresholds = thresholds == null ? Map.of() : thresholds;
    }

    public static String defaultRuleId(String tenantId, AlertCategory category) {
        return "rule_" + tenantId + "_" + category.value();
    }

    public static AlertRule defaultFor(String tenantId, AlertCategory category, Instant now) {
        return new AlertRule(
                defaultRuleId(tenantId, category),
                tenantId,
                "Default " + category.value() + " rule",
                category,
                Map.of(),
                Map.of(),
                true,
                1.0,
                null,
                INITIAL_FEEDBACK_SCORE,
                0,
                0,
                null,
                now,
                now
        );
    }

    public AlertRule withTrigger(Instant at) {
        return new AlertRule(ruleId, tenantId, name, category, conditions, thresholds, enabled, priorityWeight,
                dailyCap, feedbackScore, feedbackCount, triggerCount + 1, at, createdAt, at);
    }

    public AlertRule withFeedback(double score, Instant at) {
        // the initial score counts as one observation so a single rating cannot swing it fully
        int observations = feedbackCount + 1;
        double updated = (feedbackScore * observations + score) / (observations + 1);
        return new AlertRule(ruleId, tenantId, name, category, conditions, thresholds, enabled, priorityWeight,
                dailyCap, updated, feedbackCount + 1, triggerCount, lastTriggeredAt, createdAt, at);
    }
}
