package com.alertengine.engine.background;

import com.alertengine.core.model.Alert;
import com.alertengine.core.model.AlertStatus;
import com.alertengine.engine.api.AlertStore;
import com.alertengine.engine.dedup.Deduplicator;
import com.alertengine.engine.lifecycle.LifecycleManager;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves alerts past {@code expiresAt}, wakes snoozed alerts whose time has come and deletes
 * terminal alerts older than the retention period.
 */
public final class ExpirySweeper implements ProcessorStep {
    private final AlertStore store;
    private final LifecycleManager lifecycle;
    private final Deduplicator deduplicator;
    private final Duration retention;

    public ExpirySweeper(AlertStore store, LifecycleManager lifecycle, Deduplicator deduplicator, Duration retention) {
        this.store = store;
        this.lifecycle = lifecycle;
        this.deduplicator = deduplicator;
        this.retention = retention;
    }

    @Override
    public String name() {
        return "expiry";
    }

    @Override
    public StepResult run(Instant now) {
        int expired = 0;
        for (AlertStatus status : List.of(AlertStatus.ACTIVE, AlertStatus.ACKNOWLEDGED)) {
            for (Alert alert : store.alertsWithStatus(status)) {
                if (alert.expiresAt() != null && !alert.expiresAt().isAfter(now) && lifecycle.expire(alert).isPresent()) {
                    expired++;
                }
            }
        }

        int reactivated = 0;
        for (Alert alert : store.alertsWithStatus(AlertStatus.SNOOZED)) {
            if (alert.snoozedUntil() != null && !alert.snoozedUntil().isAfter(now)
                    && lifecycle.reactivate(alert).isPresent()) {
                reactivated++;
            }
        }

        Instant purgeBefore = now.minus(retention);
        List<String> stale = new ArrayList<>();
        for (AlertStatus status : List.of(AlertStatus.RESOLVED, AlertStatus.DISMISSED)) {
            for (Alert alert : store.alertsWithStatus(status)) {
                Instant lastTouched = alert.updatedAt() == null ? alert.createdAt() : alert.updatedAt();
                if (lastTouched.isBefore(purgeBefore)) {
                    stale.add(alert.alertId());
                }
            }
        }
        int purged = stale.isEmpty() ? 0 : store.deleteAlerts(stale);
        int evicted = deduplicator.evictExpired();

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("expired", expired);
        stats.put("reactivated", reactivated);
        stats.put("purged", purged);
        stats.put("fingerprintsEvicted", evicted);
        return StepResult.success(name(), "expired " + expired + ", reactivated " + reactivated, stats);
    }
}
