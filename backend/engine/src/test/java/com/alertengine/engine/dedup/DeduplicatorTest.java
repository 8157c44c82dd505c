package com.alertengine.engine.dedup;

import com.alertengine.core.model.Alert;
import com.alertengine.core.model.AlertCategory;
import com.alertengine.core.model.AlertPriority;
import com.alertengine.core.model.AlertStatus;
import com.alertengine.engine.store.InMemoryAlertStore;
import com.alertengine.engine.support.EngineFixtures;
import com.alertengine.engine.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeduplicatorTest {
    private final InMemoryAlertStore store = new InMemoryAlertStore();
    private final MutableClock clock = new MutableClock(EngineFixtures.T0, ZoneOffset.UTC);
    private final Deduplicator deduplicator = new Deduplicator(store, clock, Duration.ofHours(24));

    @Test
    void fingerprintIgnoresSourceKeyOrderButNotValues() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("revenueImpact", 1000);
        first.put("customerCount", 25);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("customerCount", 25);
        second.put("revenueImpact", 1000);

        String fingerprint = Deduplicator.fingerprint("shop-1", "Revenue drop", first);

        assertEquals(fingerprint, Deduplicator.fingerprint("shop-1", "Revenue drop", second));
        assertTrue(fingerprint.matches("alert_[0-9a-f]{16}"));
        assertNotEquals(fingerprint, Deduplicator.fingerprint("shop-2", "Revenue drop", first));
        assertNotEquals(fingerprint, Deduplicator.fingerprint("shop-1", "Revenue drop", Map.of("revenueImpact", 999)));
    }

    @Test
    void findsActiveOrRecentAlertFromStoreOnColdStart() {
        Alert stored = EngineFixtures.storedAlert("alert_abc", AlertCategory.BUSINESS_METRIC, AlertPriority.LOW, 0.3,
                AlertStatus.DISMISSED, EngineFixtures.T0.minus(Duration.ofHours(2)));
        store.saveAlert(stored);

        assertEquals("alert_abc", deduplicator.findDuplicate("shop-1", "alert_abc").orElseThrow().alertId());
        assertTrue(deduplicator.findDuplicate("shop-2", "alert_abc").isEmpty());

        clock.advance(Duration.ofHours(23));
        assertTrue(deduplicator.findDuplicate("shop-1", "alert_abc").isEmpty());
    }

    @Test
    void activeAlertKeepsDeduplicatingPastTheWindow() {
        store.saveAlert(EngineFixtures.storedAlert("alert_old", AlertCategory.BUSINESS_METRIC, AlertPriority.LOW, 0.3,
                AlertStatus.ACTIVE, EngineFixtures.T0.minus(Duration.ofHours(30))));

        Alert repeated = deduplicator.recordRepeat(deduplicator.findDuplicate("shop-1", "alert_old").orElseThrow());

        assertEquals(1, repeated.similarAlertCount());
        assertEquals(1, store.findAlert("alert_old").orElseThrow().similarAlertCount());
    }

    @Test
    void recurrenceAfterWindowGetsQualifiedId() {
        String fingerprint = "alert_0123456789abcdef";
        assertEquals(fingerprint, deduplicator.allocateAlertId(fingerprint));

        store.saveAlert(EngineFixtures.storedAlert(fingerprint, AlertCategory.BUSINESS_METRIC, AlertPriority.LOW, 0.3,
                AlertStatus.RESOLVED, EngineFixtures.T0.minus(Duration.ofDays(2))));

        assertEquals(fingerprint + "_" + EngineFixtures.T0.getEpochSecond(), deduplicator.allocateAlertId(fingerprint));
    }

    @Test
    void evictsIndexEntriesOlderThanWindow() {
        Alert alert = EngineFixtures.storedAlert("alert_x", AlertCategory.SECURITY, AlertPriority.HIGH, 0.9,
                AlertStatus.ACTIVE, EngineFixtures.T0);
        deduplicator.remember(alert);
        assertEquals(1, deduplicator.indexedFingerprints());

        clock.advance(Duration.ofHours(25));

        assertEquals(1, deduplicator.evictExpired());
        assertEquals(0, deduplicator.indexedFingerprints());
    }
}
