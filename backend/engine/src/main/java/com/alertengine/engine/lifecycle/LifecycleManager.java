package com.alertengine.engine.lifecycle;

import com.alertengine.core.bus.EventBus;
import com.alertengine.core.error.InvalidTransitionException;
import com.alertengine.core.error.NotFoundException;
import com.alertengine.core.events.AlertStatusChanged;
import com.alertengine.core.model.Alert;
import com.alertengine.core.model.AlertStatus;
import com.alertengine.core.model.Interaction;
import com.alertengine.core.model.InteractionType;
import com.alertengine.core.model.TrainingSample;
import com.alertengine.core.util.HashingUtils;
import com.alertengine.engine.api.AlertStore;
import com.alertengine.engine.scoring.FeedbackAdjuster;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

/**
 * Applies user and system actions to alerts. Transitions follow {@link AlertStatus#canTransitionTo};
 * an action on a terminal alert, or one that repeats the current status, is a no-op.
 */
public final class LifecycleManager {
    private static final Logger LOGGER = Logger.getLogger(LifecycleManager.class.getName());

    public static final String EXPIRED_REASON = "expired";
    public static final String SNOOZE_ELAPSED_REASON = "snooze elapsed";

    private final AlertStore store;
    private final EventBus eventBus;
    private final Clock clock;

    public LifecycleManager(AlertStore store, EventBus eventBus, Clock clock) {
        this.store = store;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public LifecycleResult acknowledge(String alertId, String userId, String notes) {
        return apply(new Action(alertId, userId, AlertStatus.ACKNOWLEDGED, InteractionType.ACKNOWLEDGED,
                "acknowledged", payload("notes", notes), FeedbackScores.ACKNOWLEDGED, null));
    }

    public LifecycleResult dismiss(String alertId, String userId, String feedback, String reason) {
        Map<String, Object> payload = payload("feedback", feedback);
        if (reason != null) {
            payload.put("reason", reason);
        }
        String statusReason = reason == null || reason.isBlank() ? "dismissed" : reason;
        return apply(new Action(alertId, userId, AlertStatus.DISMISSED, InteractionType.DISMISSED,
                statusReason, payload, FeedbackScores.forDismissal(feedback), null));
    }

    public LifecycleResult resolve(String alertId, String userId, String notes) {
        return apply(new Action(alertId, userId, AlertStatus.RESOLVED, InteractionType.RESOLVED,
                "resolved", payload("notes", notes), FeedbackScores.RESOLVED, null));
    }

    public LifecycleResult snooze(String alertId, String userId, Instant until, String reason) {
        if (until == null || !until.isAfter(clock.instant())) {
            throw new IllegalArgumentException("snooze time must be in the future");
        }
        Map<String, Object> payload = payload("reason", reason);
        payload.put("snoozedUntil", until.toString());
        return apply(new Action(alertId, userId, AlertStatus.SNOOZED, InteractionType.SNOOZED,
                reason == null || reason.isBlank() ? "snoozed" : reason, payload, null, until));
    }

    /**
     * Records a 1..5 usefulness rating without changing status. Ratings on terminal alerts are
     * accepted since they are typically given after resolution.
     */
    public LifecycleResult rate(String alertId, String userId, int rating, String comment) {
        double score = FeedbackScores.forRating(rating);
        Alert alert = require(alertId);
        Map<String, Object> payload = payload("comment", comment);
        payload.put(FeedbackAdjuster.RATING_KEY, rating);
        Interaction interaction = recordFeedback(alert, userId, InteractionType.RATED, payload, score);
        return LifecycleResult.changed(alert, interaction);
    }

    public LifecycleResult markViewed(String alertId, String userId) {
        Alert alert = require(alertId);
        Interaction interaction = interaction(alert, userId, InteractionType.VIEWED, Map.of(), clock.instant());
        store.appendInteraction(interaction);
        return LifecycleResult.changed(alert, interaction);
    }

    /**
     * Records the system interaction for an alert that was persisted already dismissed by the
     * fatigue guard. No training sample is produced.
     */
    public Interaction recordSuppression(Alert suppressed) {
        Interaction interaction = interaction(suppressed, Interaction.SYSTEM_USER, InteractionType.DISMISSED,
                payload("reason", suppressed.statusReason()), suppressed.createdAt());
        store.appendInteraction(interaction);
        return interaction;
    }

    public Optional<Alert> expire(Alert alert) {
        return systemTransition(alert.alertId(), AlertStatus.RESOLVED, EXPIRED_REASON);
    }

    public Optional<Alert> reactivate(Alert alert) {
        return systemTransition(alert.alertId(), AlertStatus.ACTIVE, SNOOZE_ELAPSED_REASON);
    }

    private Optional<Alert> systemTransition(String alertId, AlertStatus target, String reason) {
        Instant now = clock.instant();
        AtomicReference<AlertStatus> previous = new AtomicReference<>();
        Optional<Alert> updated = store.updateAlert(alertId, alert -> {
            if (!alert.status().canTransitionTo(target)) {
                return alert;
            }
            previous.set(alert.status());
            return alert.withStatus(target, reason, now);
        });
        if (previous.get() == null) {
            return Optional.empty();
        }
        Alert alert = updated.orElseThrow();
        eventBus.publish(new AlertStatusChanged(now, alert.tenantId(), alertId, previous.get(), target,
                Interaction.SYSTEM_USER, reason));
        return updated;
    }

    private LifecycleResult apply(Action action) {
        Alert current = require(action.alertId());
        if (current.status().isTerminal() || current.status() == action.target()) {
            return LifecycleResult.unchanged(current);
        }
        if (!current.status().canTransitionTo(action.target())) {
            throw new InvalidTransitionException(action.alertId(), current.status(), action.target());
        }

        Instant now = clock.instant();
        AtomicReference<AlertStatus> previous = new AtomicReference<>();
        Alert updated = store.updateAlert(action.alertId(), alert -> {
            if (alert.status().isTerminal() || alert.status() == action.target()) {
                return alert;
            }
            if (!alert.status().canTransitionTo(action.target())) {
                throw new InvalidTransitionException(alert.alertId(), alert.status(), action.target());
            }
            previous.set(alert.status());
            return action.target() == AlertStatus.SNOOZED
                    ? alert.withSnooze(action.snoozeUntil(), action.reason(), now)
                    : alert.withStatus(action.target(), action.reason(), now);
        }).orElseThrow(() -> new NotFoundException("Alert", action.alertId()));

        if (previous.get() == null) {
            return LifecycleResult.unchanged(updated);
        }

        Interaction interaction;
        if (action.feedbackScore() == null) {
            interaction = interaction(updated, action.userId(), action.type(), action.payload(), now);
            store.appendInteraction(interaction);
        } else {
            interaction = recordFeedback(updated, action.userId(), action.type(), action.payload(),
                    action.feedbackScore());
        }
        eventBus.publish(new AlertStatusChanged(now, updated.tenantId(), updated.alertId(), previous.get(),
                action.target(), action.userId(), action.reason()));
        LOGGER.info("Alert " + updated.alertId() + " " + previous.get().value() + " -> "
                + action.target().value() + " by " + action.userId());
        return LifecycleResult.changed(updated, interaction);
    }

    private Interaction recordFeedback(
            Alert alert,
            String userId,
            InteractionType type,
            Map<String, Object> payload,
            double feedbackScore
    ) {
        Instant now = clock.instant();
        Interaction interaction = interaction(alert, userId, type, payload, now);
        store.appendInteraction(interaction);
        store.appendTrainingSample(new TrainingSample(
                "sample_" + HashingUtils.shortHash(interaction.interactionId(), 16),
                alert.tenantId(),
                alert.alertId(),
                alert.category(),
                alert.mlFeatures(),
                type.value(),
                feedbackScore,
                now
        ));
        if (alert.ruleId() != null) {
            store.updateRule(alert.ruleId(), rule -> rule.withFeedback(feedbackScore, now));
        }
        return interaction;
    }

    private Interaction interaction(
            Alert alert,
            String userId,
            InteractionType type,
            Map<String, Object> payload,
            Instant at
    ) {
        double responseSeconds = Math.max(0.0, Duration.between(alert.createdAt(), at).toMillis() / 1000.0);
        String id = "interaction_" + HashingUtils.shortHash(
                alert.alertId() + "|" + userId + "|" + type.value() + "|" + at + "|" + System.nanoTime(), 16);
        return new Interaction(id, alert.alertId(), alert.tenantId(), alert.category(), userId, type, payload,
                at, responseSeconds);
    }

    private Alert require(String alertId) {
        return store.findAlert(alertId).orElseThrow(() -> new NotFoundException("Alert", alertId));
    }

    private static Map<String, Object> payload(String key, Object value) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (value != null) {
            payload.put(key, value);
        }
        return payload;
    }

    private record Action(
            String alertId,
            String userId,
            AlertStatus target,
            InteractionType type,
            String reason,
            Map<String, Object> payload,
            Double feedbackScore,
            Instant snoozeUntil
    ) {
    }
}
