package com.alertengine.core.model;

import com.alertengine.core.error.InvalidCategoryException;
import com.alertengine.core.error.InvalidPriorityFilterException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AlertModelTest {
    private static final Instant T0 = Instant.parse("2026-03-10T20:00:00Z");

    @Test
    void priorityBandsFollowCompositeThresholds() {
        assertEquals(AlertPriority.CRITICAL, AlertPriority.fromComposite(0.8));
        assertEquals(AlertPriority.HIGH, AlertPriority.fromComposite(0.79));
        assertEquals(AlertPriority.HIGH, AlertPriority.fromComposite(0.65));
        assertEquals(AlertPriority.MEDIUM, AlertPriority.fromComposite(0.4));
        assertEquals(AlertPriority.LOW, AlertPriority.fromComposite(0.2));
        assertEquals(AlertPriority.INFO, AlertPriority.fromComposite(0.19));
        assertEquals(AlertPriority.INFO, AlertPriority.fromComposite(0.0));
        assertTrue(AlertPriority.HIGH.isAtLeast(AlertPriority.MEDIUM));
        assertFalse(AlertPriority.LOW.isAtLeast(AlertPriority.MEDIUM));
    }

    @Test
    void categoryParsingAcceptsHyphensAndRejectsUnknownValues() {
        assertEquals(AlertCategory.REVENUE_ANOMALY, AlertCategory.fromValue("revenue-anomaly"));
        assertEquals(AlertCategory.SYSTEM_HEALTH, AlertCategory.fromValue(" System_Health "));

        InvalidCategoryException error = assertThrows(InvalidCategoryException.class,
                () -> AlertCategory.fromValue("weather"));
        assertTrue(error.getMessage().contains("weather"));
        assertTrue(error.getMessage().contains("revenue_anomaly"));
        assertThrows(InvalidPriorityFilterException.class, () -> AlertPriority.fromValue("urgent"));
    }

    @Test
    void statusTransitionsOnlyMoveForward() {
        assertTrue(AlertStatus.ACTIVE.canTransitionTo(AlertStatus.ACKNOWLEDGED));
        assertTrue(AlertStatus.ACTIVE.canTransitionTo(AlertStatus.SNOOZED));
        assertTrue(AlertStatus.ACKNOWLEDGED.canTransitionTo(AlertStatus.RESOLVED));
        assertTrue(AlertStatus.SNOOZED.canTransitionTo(AlertStatus.ACTIVE));
        assertFalse(AlertStatus.ACKNOWLEDGED.canTransitionTo(AlertStatus.DISMISSED));
        assertFalse(AlertStatus.ACKNOWLEDGED.canTransitionTo(AlertStatus.ACTIVE));
        for (AlertStatus next : AlertStatus.values()) {
            assertFalse(AlertStatus.RESOLVED.canTransitionTo(next));
            assertFalse(AlertStatus.DISMISSED.canTransitionTo(next));
        }
    }

    @Test
    void alertTransitionsKeepScoresAndRefuseTerminalAlerts() {
        Alert alert = alert(AlertStatus.ACTIVE);

        Alert snoozed = alert.withSnooze(T0.plusSeconds(3600), "lunch", T0.plusSeconds(60));
        assertEquals(AlertStatus.SNOOZED, snoozed.status());
        assertEquals(T0.plusSeconds(3600), snoozed.snoozedUntil());

        Alert woken = snoozed.withStatus(AlertStatus.ACTIVE, "snooze elapsed", T0.plusSeconds(3600));
        assertNull(woken.snoozedUntil());
        assertEquals(alert.compositeScore(), woken.compositeScore());

        Alert resolved = woken.withStatus(AlertStatus.RESOLVED, "fixed", T0.plusSeconds(4000));
        assertThrows(IllegalStateException.class,
                () -> resolved.withStatus(AlertStatus.ACTIVE, "again", T0.plusSeconds(5000)));
        assertEquals(1, resolved.withSimilarAlertRecorded(T0.plusSeconds(5000)).similarAlertCount());
    }

    @Test
    void ruleFeedbackIsRunningMeanSeededByInitialScore() {
        AlertRule rule = AlertRule.defaultFor("shop-1", AlertCategory.REVENUE_ANOMALY, T0);
        assertEquals("rule_shop-1_revenue_anomaly", rule.ruleId());
        assertEquals(0.5, rule.feedbackScore());

        AlertRule once = rule.withFeedback(0.1, T0);
        assertEquals(0.3, once.feedbackScore(), 1e-9);
        assertEquals(1, once.feedbackCount());

        AlertRule twice = once.withFeedback(0.9, T0);
        assertEquals(0.5, twice.feedbackScore(), 1e-9);
        assertEquals(1, rule.withTrigger(T0).triggerCount());
    }

    @Test
    void defaultPreferencesAndQuietHoursWrapMidnight() {
        UserAlertPreferences prefs = UserAlertPreferences.defaults("barber-1", "shop-1", T0);

        assertTrue(prefs.emailEnabled());
        assertFalse(prefs.smsEnabled());
        assertEquals(AlertPriority.MEDIUM, prefs.priorityThreshold());
        assertFalse(prefs.isCategoryEnabled(AlertCategory.OPPORTUNITY));
        assertTrue(prefs.isCategoryEnabled(AlertCategory.SECURITY));
        assertEquals(3, prefs.frequencyLimits().get(AlertCategory.REVENUE_ANOMALY));
        assertTrue(prefs.isQuietAt(LocalTime.of(23, 30)));
        assertTrue(prefs.isQuietAt(LocalTime.of(7, 59)));
        assertFalse(prefs.isQuietAt(LocalTime.of(8, 0)));
        assertFalse(prefs.isQuietAt(LocalTime.of(12, 0)));
    }

    private static Alert alert(AlertStatus status) {
        return new Alert("alert_1", "alert_1", "shop-1", "rule_shop-1_revenue_anomaly", "Revenue drop", "msg",
                AlertCategory.REVENUE_ANOMALY, AlertPriority.HIGH, 0.8, 0.7, 0.6, 0.5, status, null, T0, T0,
                T0.plusSeconds(86_400), null, Map.of(), Map.of("revenueImpact", 100), List.of("Check"), 0, Map.of());
    }
}
