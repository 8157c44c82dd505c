package com.alertengine.engine.features;

import com.alertengine.core.model.AlertCategory;
import com.alertengine.engine.scoring.ScoreVector;
import com.alertengine.engine.scoring.ScoringTables;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.DoubleSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns an event payload into the normalized feature map used for scoring, clustering and
 * training. Every value lies in [0, 1]. Extraction never throws: a feature that cannot be computed
 * falls back to a neutral value.
 */
public final class FeatureExtractor {
    private static final Logger LOGGER = Logger.getLogger(FeatureExtractor.class.getName());

    private final Clock clock;

    public FeatureExtractor(Clock clock) {
        this.clock = clock;
    }

    public Map<String, Double> extract(Map<String, Object> sourceData, AlertCategory category, RecentActivity activity) {
        Map<String, Double> features = new LinkedHashMap<>();
        ZonedDateTime now = ZonedDateTime.now(clock);
        SourceSignals signals = SourceSignals.from(sourceData);
        RecentActivity recent = activity == null ? RecentActivity.NONE : activity;

        put(features, FeatureNames.HOUR_OF_DAY, ScoringTables.NEUTRAL_SCORE, () -> now.getHour() / 24.0);
        put(features, FeatureNames.DAY_OF_WEEK, ScoringTables.NEUTRAL_SCORE,
                () -> (now.getDayOfWeek().getValue() - 1) / 6.0);
        put(features, FeatureNames.IS_WEEKEND, ScoringTables.NEUTRAL_FLAG, () -> flag(isWeekend(now.getDayOfWeek())));
        put(features, FeatureNames.IS_BUSINESS_HOURS, ScoringTables.NEUTRAL_FLAG, () -> flag(isBusinessHours(now)));
        put(features, FeatureNames.CATEGORY_URGENCY, ScoringTables.NEUTRAL_SCORE,
                () -> ScoringTables.categoryUrgency(category));

        magnitude(features, signals, "revenueImpact", FeatureNames.REVENUE_IMPACT,
                signals.revenueImpact().orElse(null), ScoringTables.REVENUE_NORMALIZER);
        magnitude(features, signals, "customerCount", FeatureNames.CUSTOMER_IMPACT,
                signals.customerCount().orElse(null), ScoringTables.CUSTOMER_NORMALIZER);
        magnitude(features, signals, "frequency", FeatureNames.EVENT_FREQUENCY,
                signals.eventFrequency().orElse(null), ScoringTables.FREQUENCY_NORMALIZER);
        magnitude(features, signals, "thresholdDeviation", FeatureNames.THRESHOLD_DEVIATION,
                signals.thresholdDeviation().orElse(null), 1.0);

        if (signals.isInvalid("trendDirection")) {
            features.put(FeatureNames.TREND_DIRECTION, ScoringTables.NEUTRAL_SCORE);
        } else {
            signals.trend().ifPresent(trend -> features.put(FeatureNames.TREND_DIRECTION, trend.featureValue()));
        }

        put(features, FeatureNames.SIMILAR_ALERTS_24H, ScoringTables.NEUTRAL_SCORE,
                () -> recent.similarAlerts() / ScoringTables.SIMILAR_ALERTS_NORMALIZER);
        put(features, FeatureNames.ALERT_FREQUENCY_SCORE, ScoringTables.NEUTRAL_SCORE,
                () -> recent.categoryAlerts() / ScoringTables.CATEGORY_VOLUME_NORMALIZER);

        if (category == AlertCategory.SYSTEM_HEALTH) {
            if (signals.isInvalid("systemCritical")) {
                features.put(FeatureNames.SYSTEM_CRITICAL, ScoringTables.NEUTRAL_FLAG);
            } else {
                signals.systemCritical().ifPresent(critical -> features.put(FeatureNames.SYSTEM_CRITICAL, flag(critical)));
            }
            magnitude(features, signals, "uptimePercentage", FeatureNames.SERVICE_UPTIME,
                    signals.uptimePercentage().orElse(null), 100.0);
        }

        if (!signals.invalidFields().isEmpty()) {
            LOGGER.fine("Unreadable source fields " + signals.invalidFields() + " replaced by neutral features");
        }
        return features;
    }

    public static boolean isBusinessHours(ZonedDateTime time) {
        int hour = time.getHour();
        return hour >= ScoringTables.BUSINESS_HOURS_START && hour <= ScoringTables.BUSINESS_HOURS_END;
    }

    private static boolean isWeekend(DayOfWeek day) {
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    private static double flag(boolean value) {
        return value ? 1.0 : 0.0;
    }

    private static void magnitude(
            Map<String, Double> features,
            SourceSignals signals,
            String sourceField,
            String feature,
            Double raw,
            double normalizer
    ) {
        if (signals.isInvalid(sourceField)) {
            features.put(feature, ScoringTables.NEUTRAL_SCORE);
        } else if (raw != null) {
            features.put(feature, ScoreVector.clamp(Math.abs(raw) / normalizer));
        }
    }

    private static void put(Map<String, Double> features, String name, double fallback, DoubleSupplier supplier) {
        double value;
        try {
            value = supplier.getAsDouble();
        } catch (RuntimeException e) {
            LOGGER.log(Level.FINE, "Feature " + name + " fell back to " + fallback, e);
            value = fallback;
        }
        features.put(name, ScoreVector.clamp(value));
    }
}
