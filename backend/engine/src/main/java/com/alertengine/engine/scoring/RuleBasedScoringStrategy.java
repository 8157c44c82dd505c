package com.alertengine.engine.scoring;

import com.alertengine.engine.features.FeatureNames;

import java.util.Optional;

import static com.alertengine.engine.scoring.ScoringTables.BASE_CONFIDENCE;
import static com.alertengine.engine.scoring.ScoringTables.BUSINESS_HOURS_URGENCY_BOOST;
import static com.alertengine.engine.scoring.ScoringTables.CUSTOMER_IMPACT_WEIGHT;
import static com.alertengine.engine.scoring.ScoringTables.DEVIATION_IMPACT_WEIGHT;
import static com.alertengine.engine.scoring.ScoringTables.IMPACT_SEVERITY_WEIGHT;
import static com.alertengine.engine.scoring.ScoringTables.NOVEL_ALERT_CONFIDENCE_BONUS;
import static com.alertengine.engine.scoring.ScoringTables.REVENUE_IMPACT_WEIGHT;
import static com.alertengine.engine.scoring.ScoringTables.RICH_PAYLOAD_CONFIDENCE_BONUS;
import static com.alertengine.engine.scoring.ScoringTables.RICH_PAYLOAD_FIELD_COUNT;
import static com.alertengine.engine.scoring.ScoringTables.WEEKDAY_URGENCY_BOOST;

/**
 * Deterministic scoring from the category table and the extracted features. Always produces a
 * result.
 */
public final class RuleBasedScoringStrategy implements ScoringStrategy {
    @Override
    public Optional<ScoreVector> score(ScoringContext context) {
        ScoringTables.CategoryBase base = ScoringTables.categoryBase(context.category());

        double businessImpact = context.feature(FeatureNames.REVENUE_IMPACT, 0.0) * REVENUE_IMPACT_WEIGHT
                + context.feature(FeatureNames.CUSTOMER_IMPACT, 0.0) * CUSTOMER_IMPACT_WEIGHT
                + context.feature(FeatureNames.THRESHOLD_DEVIATION, 0.0) * DEVIATION_IMPACT_WEIGHT;

        double severity = base.severity() + businessImpact * IMPACT_SEVERITY_WEIGHT;

        double urgency = base.urgency() * urgencyModifier(context);

        double confidence = BASE_CONFIDENCE;
        if (context.sourceFieldCount() > RICH_PAYLOAD_FIELD_COUNT) {
            confidence += RICH_PAYLOAD_CONFIDENCE_BONUS;
        }
        if (context.feature(FeatureNames.SIMILAR_ALERTS_24H, 0.0) == 0.0) {
            confidence += NOVEL_ALERT_CONFIDENCE_BONUS;
        }

        return Optional.of(new ScoreVector(confidence, severity, urgency, businessImpact).clamped());
    }

    /**
     * The business-hours and weekday boosts do not compound; the larger applicable one is used.
     */
    static double urgencyModifier(ScoringContext context) {
        double modifier = 1.0;
        if (context.feature(FeatureNames.IS_BUSINESS_HOURS, 0.0) > 0.5) {
            modifier = Math.max(modifier, BUSINESS_HOURS_URGENCY_BOOST);
        }
        if (context.feature(FeatureNames.IS_WEEKEND, 0.0) < 0.5) {
            modifier = Math.max(modifier, WEEKDAY_URGENCY_BOOST);
        }
        return modifier;
    }
}
