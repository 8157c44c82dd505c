package com.alertengine.engine.dedup;

import com.alertengine.core.model.Alert;
import com.alertengine.core.model.AlertStatus;
import com.alertengine.core.util.HashingUtils;
import com.alertengine.core.util.JsonUtils;
import com.alertengine.engine.api.AlertStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Fingerprint based duplicate suppression. Callers run the whole check-then-create sequence inside
 * {@link #withFingerprintLock}, so two concurrent creations of the same event yield one alert.
 * The in-memory index only speeds up lookups; the store stays authoritative.
 */
public final class Deduplicator {
    private static final int LOCK_STRIPES = 64;
    private static final int FINGERPRINT_LENGTH = 16;

    private final AlertStore store;
    private final Clock clock;
    private final Duration window;
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];
    private final Map<String, Seen> recent = new ConcurrentHashMap<>();

    public Deduplicator(AlertStore store, Clock clock, Duration window) {
        this.store = store;
        this.clock = clock;
        this.window = window;
        for (int i = 0; i < locks.length; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    public static String fingerprint(String tenantId, String title, Map<String, Object> sourceData) {
        String canonical = tenantId + "|" + title + "|"
                + JsonUtils.canonicalJson(sourceData == null ? Map.of() : sourceData);
        return "alert_" + HashingUtils.shortHash(canonical, FINGERPRINT_LENGTH);
    }

    public <T> T withFingerprintLock(String fingerprint, Supplier<T> action) {
        ReentrantLock lock = locks[Math.floorMod(fingerprint.hashCode(), locks.length)];
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * An alert counts as a duplicate target while it is still active or was created inside the
     * window, whatever its status.
     */
    public Optional<Alert> findDuplicate(String tenantId, String fingerprint) {
        Instant cutoff = clock.instant().minus(window);
        Seen seen = recent.get(fingerprint);
        Optional<Alert> candidate = Optional.empty();
        if (seen != null) {
            candidate = store.findAlert(seen.alertId());
        }
        if (candidate.isEmpty()) {
            candidate = store.latestByFingerprint(tenantId, fingerprint);
        }
        return candidate.filter(alert -> tenantId.equals(alert.tenantId()))
                .filter(alert -> alert.status() == AlertStatus.ACTIVE || !alert.createdAt().isBefore(cutoff));
    }

    public Alert recordRepeat(Alert existing) {
        Instant now = clock.instant();
        return store.updateAlert(existing.alertId(), alert -> alert.withSimilarAlertRecorded(now))
                .orElse(existing);
    }

    /**
     * The first alert of a fingerprint takes the fingerprint as its id. A later recurrence, once
     * the earlier alert no longer deduplicates, gets a time-qualified id.
     */
    public String allocateAlertId(String fingerprint) {
        if (store.findAlert(fingerprint).isEmpty()) {
            return fingerprint;
        }
        String base = fingerprint + "_" + clock.instant().getEpochSecond();
        String candidate = base;
        for (int suffix = 1; store.findAlert(candidate).isPresent(); suffix++) {
            candidate = base + "_" + suffix;
        }
        return candidate;
    }

    public void remember(Alert alert) {
        recent.put(alert.fingerprint(), new Seen(alert.alertId(), alert.createdAt()));
    }

    public int evictExpired() {
        Instant cutoff = clock.instant().minus(window);
        int before = recent.size();
        recent.values().removeIf(seen -> seen.createdAt().isBefore(cutoff));
        return before - recent.size();
    }

    public int indexedFingerprints() {
        return recent.size();
    }

    private record Seen(String alertId, Instant createdAt) {
    }
}
