package com.alertengine.engine.background;

import com.alertengine.core.bus.EventBus;
import com.alertengine.core.events.InsightGenerated;
import com.alertengine.core.model.Alert;
import com.alertengine.core.model.AlertCategory;
import com.alertengine.core.model.AlertInsight;
import com.alertengine.core.model.AlertPriority;
import com.alertengine.core.model.AlertStatus;
import com.alertengine.core.model.Interaction;
import com.alertengine.core.model.InteractionType;
import com.alertengine.engine.api.AlertStore;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds a per-tenant rollup of the last day and publishes it as {@link InsightGenerated}.
 */
public final class InsightReporter implements ProcessorStep {
    private static final Duration WINDOW = Duration.ofHours(24);

    private final AlertStore store;
    private final EventBus eventBus;
    private final Map<String, AlertInsight> latest = new ConcurrentHashMap<>();

    public InsightReporter(AlertStore store, EventBus eventBus) {
        this.store = store;
        this.eventBus = eventBus;
    }

    @Override
    public String name() {
        return "insights";
    }

    @Override
    public StepResult run(Instant now) {
        int reported = 0;
        for (String tenantId : store.tenantIds()) {
            AlertInsight insight = build(tenantId, now);
            latest.put(tenantId, insight);
            eventBus.publish(new InsightGenerated(now, insight));
            reported++;
        }
        return StepResult.success(name(), "reported " + reported + " tenants", Map.of("tenants", reported));
    }

    public Optional<AlertInsight> latest(String tenantId) {
        return Optional.ofNullable(latest.get(tenantId));
    }

    AlertInsight build(String tenantId, Instant now) {
        Instant since = now.minus(WINDOW);
        List<Alert> active = store.alertsForTenant(tenantId, AlertStatus.ACTIVE);
        List<Alert> recent = store.alertsCreatedSince(tenantId, since);
        List<Interaction> interactions = store.interactionsSince(tenantId, since);

        Map<AlertPriority, Integer> byPriority = new EnumMap<>(AlertPriority.class);
        Map<AlertCategory, Integer> byCategory = new EnumMap<>(AlertCategory.class);
        for (Alert alert : active) {
            byPriority.merge(alert.priority(), 1, Integer::sum);
            byCategory.merge(alert.category(), 1, Integer::sum);
        }
        int suppressed = (int) interactions.stream()
                .filter(Interaction::isSystem)
                .filter(interaction -> interaction.type() == InteractionType.DISMISSED)
                .count();
        List<Interaction> responses = interactions.stream()
                .filter(interaction -> !interaction.isSystem())
                .filter(interaction -> interaction.type() == InteractionType.ACKNOWLEDGED
                        || interaction.type() == InteractionType.DISMISSED
                        || interaction.type() == InteractionType.RESOLVED)
                .toList();
        long acknowledged = responses.stream()
                .filter(interaction -> interaction.type() != InteractionType.DISMISSED)
                .count();
        double ackRate = responses.isEmpty() ? 0.0 : acknowledged / (double) responses.size();
        double averageResponse = responses.stream()
                .mapToDouble(Interaction::responseTimeSeconds)
                .average()
                .orElse(0.0);
        return new AlertInsight(tenantId, now, active.size(), recent.size(), suppressed, byPriority, byCategory,
                ackRate, averageResponse);
    }
}
