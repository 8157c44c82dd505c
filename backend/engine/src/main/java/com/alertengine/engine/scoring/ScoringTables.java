package com.alertengine.engine.scoring;

import com.alertengine.core.model.AlertCategory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Every fixed number the scoring contract depends on. Nothing else in the engine carries scoring
 * literals.
 */
public final class ScoringTables {
    public static final double REVENUE_NORMALIZER = 1000.0;
    public static final double CUSTOMER_NORMALIZER = 100.0;
    public static final double FREQUENCY_NORMALIZER = 10.0;
    public static final double SIMILAR_ALERTS_NORMALIZER = 10.0;
    public static final double CATEGORY_VOLUME_NORMALIZER = 20.0;

    public static final int BUSINESS_HOURS_START = 9;
    public static final int BUSINESS_HOURS_END = 17;
    public static final double BUSINESS_HOURS_URGENCY_BOOST = 1.2;
    public static final double WEEKDAY_URGENCY_BOOST = 1.1;

    public static final double REVENUE_IMPACT_WEIGHT = 0.4;
    public static final double CUSTOMER_IMPACT_WEIGHT = 0.3;
    public static final double DEVIATION_IMPACT_WEIGHT = 0.3;
    public static final double IMPACT_SEVERITY_WEIGHT = 0.2;

    public static final double BASE_CONFIDENCE = 0.7;
    public static final double RICH_PAYLOAD_CONFIDENCE_BONUS = 0.2;
    public static final int RICH_PAYLOAD_FIELD_COUNT = 5;
    public static final double NOVEL_ALERT_CONFIDENCE_BONUS = 0.1;

    private static final ScoreVector RULE_WEIGHTS = new ScoreVector(0.7, 0.6, 0.6, 0.5);

    public static final double FEEDBACK_SWING = 0.3;

    public static final double NEUTRAL_SCORE = 0.5;
    public static final double NEUTRAL_FLAG = 0.0;

    private static final Map<AlertCategory, Double> CATEGORY_URGENCY = new EnumMap<>(AlertCategory.class);
    private static final Map<AlertCategory, CategoryBase> CATEGORY_BASE = new EnumMap<>(AlertCategory.class);

    static {
        CATEGORY_URGENCY.put(AlertCategory.SECURITY, 0.95);
        CATEGORY_URGENCY.put(AlertCategory.SYSTEM_HEALTH, 0.9);
        CATEGORY_URGENCY.put(AlertCategory.REVENUE_ANOMALY, 0.8);
        CATEGORY_URGENCY.put(AlertCategory.OPERATIONAL_ISSUE, 0.7);
        CATEGORY_URGENCY.put(AlertCategory.CUSTOMER_BEHAVIOR, 0.6);
        CATEGORY_URGENCY.put(AlertCategory.BUSINESS_METRIC, 0.5);
        CATEGORY_URGENCY.put(AlertCategory.COMPLIANCE, 0.4);
        CATEGORY_URGENCY.put(AlertCategory.OPPORTUNITY, 0.3);

        CATEGORY_BASE.put(AlertCategory.SECURITY, new CategoryBase(0.9, 0.9));
        CATEGORY_BASE.put(AlertCategory.SYSTEM_HEALTH, new CategoryBase(0.7, 0.8));
        CATEGORY_BASE.put(AlertCategory.REVENUE_ANOMALY, new CategoryBase(0.8, 0.7));
        CATEGORY_BASE.put(AlertCategory.OPERATIONAL_ISSUE, new CategoryBase(0.6, 0.6));
        CATEGORY_BASE.put(AlertCategory.CUSTOMER_BEHAVIOR, new CategoryBase(0.6, 0.5));
        CATEGORY_BASE.put(AlertCategory.BUSINESS_METRIC, new CategoryBase(0.5, 0.4));
        CATEGORY_BASE.put(AlertCategory.COMPLIANCE, new CategoryBase(0.6, 0.4));
        CATEGORY_BASE.put(AlertCategory.OPPORTUNITY, new CategoryBase(0.4, 0.3));
    }

    private ScoringTables() {
    }

    public static double categoryUrgency(AlertCategory category) {
        return CATEGORY_URGENCY.get(category);
    }

    public static CategoryBase categoryBase(AlertCategory category) {
        return CATEGORY_BASE.get(category);
    }

    /**
     * Blend weight of the rule-based score per dimension; the learned score gets the remainder.
     */
    public static ScoreVector ruleWeights() {
        return RULE_WEIGHTS;
    }

    public record CategoryBase(double severity, double urgency) {
    }
}
