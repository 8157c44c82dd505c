package com.alertengine.engine.lifecycle;

import com.alertengine.core.bus.EventBus;
import com.alertengine.core.error.InvalidTransitionException;
import com.alertengine.core.error.NotFoundException;
import com.alertengine.core.events.AlertStatusChanged;
import com.alertengine.core.model.Alert;
import com.alertengine.core.model.AlertCategory;
import com.alertengine.core.model.AlertPriority;
import com.alertengine.core.model.AlertRule;
import com.alertengine.core.model.AlertStatus;
import com.alertengine.core.model.Interaction;
import com.alertengine.core.model.InteractionType;
import com.alertengine.core.model.TrainingSample;
import com.alertengine.engine.store.InMemoryAlertStore;
import com.alertengine.engine.support.EngineFixtures;
import com.alertengine.engine.support.EventCapture;
import com.alertengine.engine.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LifecycleManagerTest {
    private static final String RULE_ID = AlertRule.defaultRuleId("shop-1", AlertCategory.REVENUE_ANOMALY);

    private final InMemoryAlertStore store = new InMemoryAlertStore();
    private final MutableClock clock = new MutableClock(EngineFixtures.T0, ZoneOffset.UTC);
    private final EventBus bus = new EventBus();
    private final EventCapture events = new EventCapture(bus);
    private final LifecycleManager lifecycle = new LifecycleManager(store, bus, clock);

    @BeforeEach
    void seed() {
        store.saveRule(AlertRule.defaultFor("shop-1", AlertCategory.REVENUE_ANOMALY, EngineFixtures.T0));
        store.saveAlert(alert("alert_1"));
        clock.advance(Duration.ofMinutes(5));
    }

    @Test
    void acknowledgeRecordsInteractionSampleAndEvent() {
        LifecycleResult result = lifecycle.acknowledge("alert_1", "barber-1", "on it");

        assertTrue(result.changed());
        assertEquals(AlertStatus.ACKNOWLEDGED, result.alert().status());
        Interaction interaction = result.interaction().orElseThrow();
        assertEquals(InteractionType.ACKNOWLEDGED, interaction.type());
        assertEquals(300.0, interaction.responseTimeSeconds(), 1e-9);
        assertEquals("on it", interaction.payload().get("notes"));

        List<TrainingSample> samples = store.trainingSamplesSince(Instant.EPOCH);
        assertEquals(1, samples.size());
        assertEquals(0.7, samples.get(0).feedbackScore());
        assertEquals(Map.of("revenueImpact", 1.0), samples.get(0).features());

        AlertStatusChanged changed = events.byType(AlertStatusChanged.class).get(0);
        assertEquals(AlertStatus.ACTIVE, changed.previousStatus());
        assertEquals("barber-1", changed.userId());
    }

    @Test
    void repeatedAcknowledgeIsNoOp() {
        lifecycle.acknowledge("alert_1", "barber-1", null);
        LifecycleResult again = lifecycle.acknowledge("alert_1", "barber-1", null);

        assertFalse(again.changed());
        assertTrue(again.interaction().isEmpty());
        assertEquals(1, store.interactionsForAlert("alert_1").size());
    }

    @Test
    void dismissWithSpamFeedbackLowersRuleScore() {
        LifecycleResult result = lifecycle.dismiss("alert_1", "barber-1", "This is spam", "noise");

        assertEquals(AlertStatus.DISMISSED, result.alert().status());
        assertEquals("noise", result.alert().statusReason());
        assertEquals(0.1, store.trainingSamplesSince(Instant.EPOCH).get(0).feedbackScore());
        AlertRule rule = store.findRule(RULE_ID).orElseThrow();
        assertTrue(rule.feedbackScore() < AlertRule.INITIAL_FEEDBACK_SCORE);
        assertEquals(1, rule.feedbackCount());
    }

    @Test
    void actionsOnTerminalAlertsAreNoOps() {
        lifecycle.resolve("alert_1", "barber-1", "fixed pricing");

        LifecycleResult dismiss = lifecycle.dismiss("alert_1", "barber-2", "useful", null);
        LifecycleResult acknowledge = lifecycle.acknowledge("alert_1", "barber-2", null);

        assertFalse(dismiss.changed());
        assertFalse(acknowledge.changed());
        assertEquals(AlertStatus.RESOLVED, store.findAlert("alert_1").orElseThrow().status());
        assertEquals(1, store.interactionsForAlert("alert_1").size());
        assertEquals(0.9, store.trainingSamplesSince(Instant.EPOCH).get(0).feedbackScore());
    }

    @Test
    void acknowledgedAlertCannotBeDismissed() {
        lifecycle.acknowledge("alert_1", "barber-1", null);

        assertThrows(InvalidTransitionException.class, () -> lifecycle.dismiss("alert_1", "barber-1", null, null));
        assertEquals(AlertStatus.RESOLVED, lifecycle.resolve("alert_1", "barber-1", null).alert().status());
    }

    @Test
    void unknownAlertIsNotFound() {
        NotFoundException error = assertThrows(NotFoundException.class,
                () -> lifecycle.acknowledge("missing", "barber-1", null));
        assertEquals("Alert not found: missing", error.getMessage());
    }

    @Test
    void snoozeAndReactivate() {
        Instant until = clock.instant().plus(Duration.ofHours(2));
        Alert snoozed = lifecycle.snooze("alert_1", "barber-1", until, "busy with a client").alert();
        assertEquals(AlertStatus.SNOOZED, snoozed.status());
        assertEquals(until, snoozed.snoozedUntil());

        Alert woken = lifecycle.reactivate(snoozed).orElseThrow();
        assertEquals(AlertStatus.ACTIVE, woken.status());
        assertNull(woken.snoozedUntil());
        assertEquals("system", events.byType(AlertStatusChanged.class).get(1).userId());

        assertThrows(IllegalArgumentException.class,
                () -> lifecycle.snooze("alert_1", "barber-1", clock.instant().minusSeconds(1), null));
    }

    @Test
    void expireResolvesAndIgnoresTerminalAlerts() {
        Alert expired = lifecycle.expire(store.findAlert("alert_1").orElseThrow()).orElseThrow();

        assertEquals(AlertStatus.RESOLVED, expired.status());
        assertEquals(LifecycleManager.EXPIRED_REASON, expired.statusReason());
        assertTrue(lifecycle.expire(expired).isEmpty());
    }

    @Test
    void ratingFeedsTrainingWithoutChangingStatus() {
        LifecycleResult rated = lifecycle.rate("alert_1", "barber-1", 4, "helpful heads-up");

        assertEquals(AlertStatus.ACTIVE, rated.alert().status());
        assertEquals(4, rated.interaction().orElseThrow().payload().get("rating"));
        assertEquals(0.8, store.trainingSamplesSince(Instant.EPOCH).get(0).feedbackScore(), 1e-9);
        assertThrows(IllegalArgumentException.class, () -> lifecycle.rate("alert_1", "barber-1", 6, null));
    }

    @Test
    void dismissalFeedbackTextMapsToScores() {
        assertEquals(0.6, FeedbackScores.forDismissal("Useful but already handled"));
        assertEquals(0.1, FeedbackScores.forDismissal("not useful"));
        assertEquals(0.1, FeedbackScores.forDismissal("irrelevant for our shop"));
        assertEquals(0.2, FeedbackScores.forDismissal(null));
        assertEquals(0.2, FeedbackScores.forDismissal("later"));
    }

    private static Alert alert(String id) {
        return new Alert(id, id, "shop-1", RULE_ID, "Revenue drop", "msg", AlertCategory.REVENUE_ANOMALY,
                AlertPriority.HIGH, 0.8, 0.8, 0.6, 0.5, AlertStatus.ACTIVE, null, EngineFixtures.T0,
                EngineFixtures.T0, EngineFixtures.T0.plus(Duration.ofHours(24)), null, Map.of(),
                Map.of("revenueImpact", 1000), List.of(), 0, Map.of("revenueImpact", 1.0));
    }
}
