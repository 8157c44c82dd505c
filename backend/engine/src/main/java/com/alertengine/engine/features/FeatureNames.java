package com.alertengine.engine.features;

/**
 * Keys of the feature map stored on every alert as {@code mlFeatures}.
 */
public final class FeatureNames {
    public static final String HOUR_OF_DAY = "hourOfDay";
    public static final String DAY_OF_WEEK = "dayOfWeek";
    public static final String IS_WEEKEND = "isWeekend";
    public static final String IS_BUSINESS_HOURS = "isBusinessHours";
    public static final String CATEGORY_URGENCY = "categoryUrgency";
    public static final String REVENUE_IMPACT = "revenueImpact";
    public static final String CUSTOMER_IMPACT = "customerImpact";
    public static final String EVENT_FREQUENCY = "eventFrequency";
    public static final String TREND_DIRECTION = "trendDirection";
    public static final String THRESHOLD_DEVIATION = "thresholdDeviation";
    public static final String SIMILAR_ALERTS_24H = "similarAlerts24h";
    public static final String ALERT_FREQUENCY_SCORE = "alertFrequencyScore";
    public static final String SYSTEM_CRITICAL = "systemCritical";
    public static final String SERVICE_UPTIME = "serviceUptime";

    private FeatureNames() {
    }
}
