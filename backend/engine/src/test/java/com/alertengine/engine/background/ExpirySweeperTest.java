package com.alertengine.engine.background;

import com.alertengine.core.bus.EventBus;
import com.alertengine.core.model.Alert;
import com.alertengine.core.model.AlertCategory;
import com.alertengine.core.model.AlertPriority;
import com.alertengine.core.model.AlertStatus;
import com.alertengine.engine.dedup.Deduplicator;
import com.alertengine.engine.lifecycle.LifecycleManager;
import com.alertengine.engine.store.InMemoryAlertStore;
import com.alertengine.engine.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static com.alertengine.engine.support.EngineFixtures.T0;
import static com.alertengine.engine.support.EngineFixtures.storedAlert;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExpirySweeperTest {
    private final MutableClock clock = new MutableClock(T0, ZoneOffset.UTC);
    private final InMemoryAlertStore store = new InMemoryAlertStore();
    private final LifecycleManager lifecycle = new LifecycleManager(store, new EventBus(), clock);
    private final Deduplicator deduplicator = new Deduplicator(store, clock, Duration.ofHours(24));
    private final ExpirySweeper sweeper = new ExpirySweeper(store, lifecycle, deduplicator, Duration.ofDays(30));

    @Test
    void expiresAlertsPastTheirDeadline() {
        store.saveAlert(storedAlert("old", AlertCategory.SECURITY, AlertPriority.HIGH, 0.8, AlertStatus.ACTIVE,
                T0.minus(Duration.ofHours(30))));
        store.saveAlert(storedAlert("fresh", AlertCategory.SECURITY, AlertPriority.HIGH, 0.8, AlertStatus.ACTIVE,
                T0.minus(Duration.ofHours(2))));

        StepResult result = sweeper.run(clock.instant());

        assertTrue(result.success());
        assertEquals(1, result.stats().get("expired"));
        Alert old = store.findAlert("old").orElseThrow();
        assertEquals(AlertStatus.RESOLVED, old.status());
        assertEquals("expired", old.statusReason());
        assertEquals(AlertStatus.ACTIVE, store.findAlert("fresh").orElseThrow().status());
    }

    @Test
    void reactivatesSnoozedAlertsWhenDue() {
        Alert base = storedAlert("nap", AlertCategory.OPERATIONAL_ISSUE, AlertPriority.MEDIUM, 0.5,
                AlertStatus.ACTIVE, T0.minus(Duration.ofHours(1)));
        store.saveAlert(base.withSnooze(T0.plus(Duration.ofMinutes(30)), "after lunch", T0));

        assertEquals(0, sweeper.run(clock.instant()).stats().get("reactivated"));
        clock.advance(Duration.ofMinutes(31));
        StepResult result = sweeper.run(clock.instant());

        assertEquals(1, result.stats().get("reactivated"));
        Alert woken = store.findAlert("nap").orElseThrow();
        assertEquals(AlertStatus.ACTIVE, woken.status());
        assertEquals("snooze elapsed", woken.statusReason());
    }

    @Test
    void purgesTerminalAlertsPastRetention() {
        Instant longAgo = T0.minus(Duration.ofDays(31));
        store.saveAlert(storedAlert("ancient", AlertCategory.COMPLIANCE, AlertPriority.LOW, 0.2,
                AlertStatus.DISMISSED, longAgo));
        store.saveAlert(storedAlert("recent", AlertCategory.COMPLIANCE, AlertPriority.LOW, 0.2,
                AlertStatus.RESOLVED, T0.minus(Duration.ofDays(3))));

        StepResult result = sweeper.run(clock.instant());

        assertEquals(1, result.stats().get("purged"));
        assertTrue(store.findAlert("ancient").isEmpty());
        assertTrue(store.findAlert("recent").isPresent());
    }
}
