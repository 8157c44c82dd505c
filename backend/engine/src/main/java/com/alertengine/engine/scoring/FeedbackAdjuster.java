package com.alertengine.engine.scoring;

import com.alertengine.core.model.AlertCategory;
import com.alertengine.core.model.Interaction;
import com.alertengine.engine.api.AlertStore;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per tenant and category multiplier derived from how users reacted to past alerts. Categories that
 * users mostly acknowledge score higher, categories they mostly dismiss score lower. Factors are
 * cached and recomputed by {@link #refresh(String)}; a missing entry is computed on first use.
 */
public final class FeedbackAdjuster {
    public static final String RATING_KEY = "rating";

    private final AlertStore store;
    private final Clock clock;
    private final Duration lookback;
    private final int minInteractions;
    private final Map<String, Double> factors = new ConcurrentHashMap<>();

    public FeedbackAdjuster(AlertStore store, Clock clock, Duration lookback, int minInteractions) {
        this.store = store;
        this.clock = clock;
        this.lookback = lookback;
        this.minInteractions = minInteractions;
    }

    public double factorFor(String tenantId, AlertCategory category) {
        return factors.computeIfAbsent(key(tenantId, category),
                ignored -> compute(tenantId).get(category));
    }

    public Map<AlertCategory, Double> refresh(String tenantId) {
        Map<AlertCategory, Double> computed = compute(tenantId);
        computed.forEach((category, factor) -> factors.put(key(tenantId, category), factor));
        return computed;
    }

    private Map<AlertCategory, Double> compute(String tenantId) {
        List<Interaction> interactions = store.interactionsSince(tenantId, clock.instant().minus(lookback));
        Map<AlertCategory, int[]> tallies = new EnumMap<>(AlertCategory.class);
        for (Interaction interaction : interactions) {
            if (interaction.isSystem() || interaction.category() == null) {
                continue;
            }
            int[] tally = tallies.computeIfAbsent(interaction.category(), ignored -> new int[2]);
            switch (interaction.type()) {
                case ACKNOWLEDGED:
                case RESOLVED:
                    tally[0]++;
                    break;
                case DISMISSED:
                    tally[1]++;
                    break;
                case RATED:
                    int rating = rating(interaction);
                    if (rating >= 4) {
                        tally[0]++;
                    } else if (rating > 0 && rating <= 2) {
                        tally[1]++;
                    }
                    break;
                default:
                    break;
            }
        }
        Map<AlertCategory, Double> result = new EnumMap<>(AlertCategory.class);
        for (AlertCategory category : AlertCategory.values()) {
            int[] tally = tallies.getOrDefault(category, new int[2]);
            int total = tally[0] + tally[1];
            if (total < minInteractions) {
                result.put(category, 1.0);
            } else {
                double positiveRate = tally[0] / (double) total;
                result.put(category, 1.0 + ScoringTables.FEEDBACK_SWING * (positiveRate - 0.5));
            }
        }
        return result;
    }

    private static int rating(Interaction interaction) {
        Object raw = interaction.payload().get(RATING_KEY);
        return raw instanceof Number ? ((Number) raw).intValue() : 0;
    }

    private static String key(String tenantId, AlertCategory category) {
        return tenantId + "|" + category.value();
    }
}
