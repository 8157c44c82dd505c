package com.alertengine.engine.query;

import com.alertengine.core.model.Alert;
import com.alertengine.core.model.AlertCategory;
import com.alertengine.core.model.AlertPriority;
import com.alertengine.core.model.AlertStatus;
import com.alertengine.core.model.Interaction;
import com.alertengine.core.model.InteractionType;
import com.alertengine.core.model.UserAlertPreferences;
import com.alertengine.engine.api.AlertStore;
import com.alertengine.engine.config.EngineSettings;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Read side of the engine: ranked active alerts and historical analytics.
 */
public final class AlertQueryService {
    /**
     * Priority rank, then urgency, then recency, all descending.
     */
    public static final Comparator<Alert> RANKING = Comparator
            .comparingInt((Alert alert) -> alert.priority().rank()).reversed()
            .thenComparing(Comparator.comparingDouble(Alert::urgency).reversed())
            .thenComparing(Comparator.comparing(Alert::createdAt).reversed());

    private static final double TREND_TOLERANCE = 0.2;

    private final AlertStore store;
    private final Clock clock;
    private final EngineSettings settings;

    public AlertQueryService(AlertStore store, Clock clock, EngineSettings settings) {
        this.store = store;
        this.clock = clock;
        this.settings = settings;
    }

    /**
     * Active alerts for the tenant. For a known user, alerts below their priority threshold are
     * left out, using the default threshold when nothing is stored; anonymous queries are not
     * filtered by threshold.
     */
    public List<Alert> activeAlerts(ActiveAlertQuery query) {
        Optional<AlertPriority> threshold = thresholdFor(query.userId(), query.tenantId());
        int limit = clampLimit(query.limit());
        return store.alertsForTenant(query.tenantId(), AlertStatus.ACTIVE).stream()
                .filter(alert -> query.priorityFilter() == null || alert.priority() == query.priorityFilter())
                .filter(alert -> query.categoryFilter() == null || alert.category() == query.categoryFilter())
                .filter(alert -> threshold.map(alert.priority()::isAtLeast).orElse(true))
                .sorted(RANKING)
                .limit(limit)
                .toList();
    }

    public AlertHistory history(String tenantId, String userId, int days, int limit) {
        int window = Math.max(1, Math.min(days, settings.maxHistoryDays()));
        Instant now = clock.instant();
        Instant since = now.minus(Duration.ofDays(window));

        List<Alert> alerts = store.alertsCreatedSince(tenantId, since).stream()
                .sorted(Comparator.comparing(Alert::createdAt).reversed())
                .toList();
        List<Interaction> interactions = store.interactionsSince(tenantId, since);

        return new AlertHistory(
                tenantId,
                window,
                alerts.size(),
                alerts.stream().limit(clampLimit(limit)).toList(),
                interactionStats(interactions, userId),
                trends(alerts, since, now),
                fatigue(alerts, interactions, window)
        );
    }

    private Optional<AlertPriority> thresholdFor(String userId, String tenantId) {
        if (userId == null) {
            return Optional.empty();
        }
        UserAlertPreferences preferences = store.findPreferences(userId, tenantId)
                .orElseGet(() -> UserAlertPreferences.defaults(userId, tenantId, clock.instant()));
        return Optional.of(preferences.priorityThreshold());
    }

    private int clampLimit(int requested) {
        int limit = requested <= 0 ? settings.defaultListLimit() : requested;
        return Math.min(limit, settings.maxListLimit());
    }

    private static InteractionStats interactionStats(List<Interaction> interactions, String userId) {
        Map<InteractionType, Integer> counts = new EnumMap<>(InteractionType.class);
        Map<InteractionType, Double> averages = new EnumMap<>(InteractionType.class);
        Map<InteractionType, List<Interaction>> byType = interactions.stream()
                .filter(interaction -> !interaction.isSystem())
                .collect(Collectors.groupingBy(Interaction::type, () -> new EnumMap<>(InteractionType.class),
                        Collectors.toList()));
        byType.forEach((type, items) -> {
            counts.put(type, items.size());
            averages.put(type, items.stream().mapToDouble(Interaction::responseTimeSeconds).average().orElse(0.0));
        });
        int userCount = userId == null ? 0
                : (int) interactions.stream().filter(interaction -> userId.equals(interaction.userId())).count();
        int total = counts.values().stream().mapToInt(Integer::intValue).sum();
        return new InteractionStats(total, userCount, counts, averages);
    }

    private AlertTrends trends(List<Alert> alerts, Instant since, Instant now) {
        ZoneId zone = clock.getZone();
        Map<LocalDate, Integer> daily = new TreeMap<>();
        Map<AlertCategory, Integer> byCategory = new EnumMap<>(AlertCategory.class);
        Map<AlertPriority, Integer> byPriority = new EnumMap<>(AlertPriority.class);
        Instant midpoint = since.plus(Duration.between(since, now).dividedBy(2));
        int older = 0;
        int newer = 0;
        for (Alert alert : alerts) {
            daily.merge(LocalDate.ofInstant(alert.createdAt(), zone), 1, Integer::sum);
            byCategory.merge(alert.category(), 1, Integer::sum);
            byPriority.merge(alert.priority(), 1, Integer::sum);
            if (alert.createdAt().isBefore(midpoint)) {
                older++;
            } else {
                newer++;
            }
        }
        String direction = "stable";
        if (newer > older * (1 + TREND_TOLERANCE)) {
            direction = "increasing";
        } else if (newer < older * (1 - TREND_TOLERANCE)) {
            direction = "decreasing";
        }
        return new AlertTrends(daily, byCategory, byPriority, direction);
    }

    private static FatigueIndicators fatigue(List<Alert> alerts, List<Interaction> interactions, int days) {
        double perDay = alerts.size() / (double) days;
        int suppressed = (int) interactions.stream()
                .filter(Interaction::isSystem)
                .filter(interaction -> interaction.type() == InteractionType.DISMISSED)
                .count();
        long userDismissals = interactions.stream()
                .filter(interaction -> !interaction.isSystem())
                .filter(interaction -> interaction.type() == InteractionType.DISMISSED)
                .count();
        double dismissalRate = alerts.isEmpty() ? 0.0 : userDismissals / (double) alerts.size();
        double averageRepeats = alerts.stream().mapToInt(Alert::similarAlertCount).average().orElse(0.0);
        String risk = "low";
        if (perDay > 20 || dismissalRate > 0.6) {
            risk = "high";
        } else if (perDay > 10 || dismissalRate > 0.3) {
            risk = "medium";
        }
        return new FatigueIndicators(perDay, suppressed, dismissalRate, averageRepeats, risk);
    }
}
