package com.alertengine.engine.actions;

import com.alertengine.core.model.AlertCategory;
import com.alertengine.engine.api.ActionAugmenter;
import com.alertengine.engine.scoring.ScoreVector;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds the recommended action list: category templates, adjusted by urgency and impact, then
 * optionally extended by an {@link ActionAugmenter}. Augmentation failures never fail the alert.
 */
public final class ActionRecommender {
    private static final Logger LOGGER = Logger.getLogger(ActionRecommender.class.getName());

    public static final int MAX_TEMPLATE_ACTIONS = 5;
    public static final int MAX_AUGMENTED_ACTIONS = 3;
    public static final double URGENT_THRESHOLD = 0.7;
    public static final double HIGH_IMPACT_THRESHOLD = 0.6;
    public static final String IMMEDIATE_ACTION = "Take immediate action - high urgency detected";
    public static final String FINANCIAL_TRACKING_ACTION = "Calculate and track financial impact of resolution";
    public static final String FALLBACK_ACTION = "Review alert details and take appropriate action";

    private static final Map<AlertCategory, List<String>> TEMPLATES = new EnumMap<>(AlertCategory.class);

    static {
        TEMPLATES.put(AlertCategory.REVENUE_ANOMALY, List.of(
                "Review recent pricing changes and competitor analysis",
                "Analyze customer booking patterns for unusual behavior",
                "Check marketing campaign performance and ROI"));
        TEMPLATES.put(AlertCategory.SYSTEM_HEALTH, List.of(
                "Check system logs for error patterns",
                "Verify backup systems and failover procedures",
                "Monitor resource utilization trends"));
        TEMPLATES.put(AlertCategory.CUSTOMER_BEHAVIOR, List.of(
                "Review customer satisfaction surveys",
                "Analyze service quality metrics",
                "Check for seasonal behavior patterns"));
        TEMPLATES.put(AlertCategory.OPPORTUNITY, List.of(
                "Evaluate potential for service expansion",
                "Consider targeted marketing campaigns",
                "Analyze optimal pricing strategies"));
        TEMPLATES.put(AlertCategory.BUSINESS_METRIC, List.of(
                "Compare the metric against the same period last week",
                "Check the metric inputs for missing or late data",
                "Share the change with the shop manager"));
        TEMPLATES.put(AlertCategory.OPERATIONAL_ISSUE, List.of(
                "Review staff schedules and chair capacity",
                "Check equipment and supply levels",
                "Audit recent changes to the booking workflow"));
        TEMPLATES.put(AlertCategory.COMPLIANCE, List.of(
                "Review the affected licensing or health regulation requirements",
                "Document the corrective measures taken",
                "Schedule a compliance check with the responsible staff member"));
        TEMPLATES.put(AlertCategory.SECURITY, List.of(
                "Review recent login and access activity",
                "Rotate credentials for affected accounts",
                "Verify that no customer data was exposed"));
    }

    private final ActionAugmenter augmenter;

    public ActionRecommender(ActionAugmenter augmenter) {
        this.augmenter = augmenter;
    }

    public List<String> recommend(AlertCategory category, Map<String, Object> sourceData, ScoreVector scores) {
        return withAugmentation(category, sourceData, scores, templateActions(category, scores));
    }

    /**
     * Category templates adjusted by urgency and impact. Pure and cheap; never calls the augmenter.
     */
    public List<String> templateActions(AlertCategory category, ScoreVector scores) {
        List<String> actions = new ArrayList<>(TEMPLATES.getOrDefault(category, List.of()));
        if (scores.urgency() > URGENT_THRESHOLD) {
            actions.add(0, IMMEDIATE_ACTION);
        }
        if (scores.businessImpact() > HIGH_IMPACT_THRESHOLD) {
            actions.add(FINANCIAL_TRACKING_ACTION);
        }
        if (actions.isEmpty()) {
            actions.add(FALLBACK_ACTION);
        }
        return List.copyOf(new LinkedHashSet<>(actions.subList(0, Math.min(actions.size(), MAX_TEMPLATE_ACTIONS))));
    }

    /**
     * Appends up to {@link #MAX_AUGMENTED_ACTIONS} suggestions from the augmenter to {@code base}.
     * May block on the augmenter, so callers should not hold locks.
     */
    public List<String> withAugmentation(AlertCategory category, Map<String, Object> sourceData, ScoreVector scores,
                                         List<String> base) {
        Set<String> result = new LinkedHashSet<>(base);
        result.addAll(augment(category, sourceData, scores));
        return List.copyOf(result);
    }

    public boolean canAugment() {
        return augmenter != null;
    }

    private List<String> augment(AlertCategory category, Map<String, Object> sourceData, ScoreVector scores) {
        if (augmenter == null) {
            return List.of();
        }
        try {
            List<String> suggested = augmenter.suggestActions(category, sourceData, scores);
            if (suggested == null) {
                return List.of();
            }
            return suggested.stream()
                    .filter(action -> action != null && !action.isBlank())
                    .map(String::trim)
                    .limit(MAX_AUGMENTED_ACTIONS)
                    .toList();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Action augmentation failed for " + category.value()
                    + "; using template actions", e);
            return List.of();
        }
    }
}
