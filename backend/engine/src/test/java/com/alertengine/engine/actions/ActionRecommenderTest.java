package com.alertengine.engine.actions;

import com.alertengine.core.model.AlertCategory;
import com.alertengine.engine.scoring.ScoreVector;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ActionRecommenderTest {
    @Test
    void urgentHighImpactAlertGetsImmediateAndFinancialActions() {
        List<String> actions = new ActionRecommender(null).recommend(AlertCategory.REVENUE_ANOMALY, Map.of(),
                new ScoreVector(0.8, 0.9, 0.77, 0.715));

        assertEquals(5, actions.size());
        assertEquals(ActionRecommender.IMMEDIATE_ACTION, actions.get(0));
        assertEquals(ActionRecommender.FINANCIAL_TRACKING_ACTION, actions.get(4));
    }

    @Test
    void everyCategoryHasTemplates() {
        ActionRecommender recommender = new ActionRecommender(null);
        for (AlertCategory category : AlertCategory.values()) {
            List<String> actions = recommender.recommend(category, Map.of(), new ScoreVector(0.5, 0.5, 0.5, 0.1));
            assertEquals(3, actions.size(), category.value());
        }
    }

    @Test
    void augmentationAppendsAtMostThreeDistinctActions() {
        ActionRecommender recommender = new ActionRecommender((category, source, scores) -> List.of(
                "Consider a loyalty discount for lapsed clients",
                "Check system logs for error patterns",
                "Suggest a weekday promotion",
                "Recommend a follow-up call",
                "Should never appear"));

        List<String> actions = recommender.recommend(AlertCategory.SYSTEM_HEALTH, Map.of(),
                new ScoreVector(0.5, 0.5, 0.5, 0.1));

        assertEquals(5, actions.size());
        assertTrue(actions.contains("Suggest a weekday promotion"));
        assertFalse(actions.contains("Recommend a follow-up call"));
    }

    @Test
    void failingAugmenterLeavesTemplateActions() {
        ActionRecommender recommender = new ActionRecommender((category, source, scores) -> {
            throw new IllegalStateException("model offline");
        });

        List<String> actions = recommender.recommend(AlertCategory.OPPORTUNITY, Map.of(),
                new ScoreVector(0.5, 0.4, 0.3, 0.0));

        assertEquals(List.of("Evaluate potential for service expansion", "Consider targeted marketing campaigns",
                "Analyze optimal pricing strategies"), actions);
    }
}
