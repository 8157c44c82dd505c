package com.alertengine.engine.fatigue;

import com.alertengine.core.model.Alert;
import com.alertengine.core.model.AlertCategory;
import com.alertengine.core.model.AlertRule;
import com.alertengine.core.model.UserAlertPreferences;
import com.alertengine.engine.api.AlertStore;
import com.alertengine.engine.config.EngineSettings;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Caps how many alerts of one category a tenant receives per rolling window. Counts are kept in
 * memory and rebuilt from the store on first use, so a restart does not reset them.
 */
public final class FatigueGuard {
    private static final Logger LOGGER = Logger.getLogger(FatigueGuard.class.getName());

    private final AlertStore store;
    private final Clock clock;
    private final EngineSettings settings;
    private final Map<String, Deque<Instant>> windows = new ConcurrentHashMap<>();

    public FatigueGuard(AlertStore store, Clock clock, EngineSettings settings) {
        this.store = store;
        this.clock = clock;
        this.settings = settings;
    }

    /**
     * Counts the new alert and decides whether it must be suppressed. Every admitted or suppressed
     * alert is counted; use {@link #release} if the alert is never persisted.
     */
    public FatigueDecision admit(String tenantId, AlertCategory category, AlertRule rule, Instant createdAt) {
        int cap = dailyCap(tenantId, category, rule);
        Deque<Instant> window = windowFor(tenantId, category);
        synchronized (window) {
            evict(window);
            int prior = window.size();
            window.addLast(createdAt);
            FatigueDecision decision = new FatigueDecision(prior >= cap, prior, cap);
            if (decision.suppressed()) {
                LOGGER.info("Fatigue cap reached tenant=" + tenantId + " category=" + category.value()
                        + " count=" + prior + " cap=" + cap);
            }
            return decision;
        }
    }

    public void release(String tenantId, AlertCategory category, Instant createdAt) {
        Deque<Instant> window = windows.get(key(tenantId, category));
        if (window != null) {
            synchronized (window) {
                window.removeLastOccurrence(createdAt);
            }
        }
    }

    public int countInWindow(String tenantId, AlertCategory category) {
        Deque<Instant> window = windowFor(tenantId, category);
        synchronized (window) {
            evict(window);
            return window.size();
        }
    }

    /**
     * Rule cap first, then the strictest per-user limit, then the configured default.
     */
    public int dailyCap(String tenantId, AlertCategory category, AlertRule rule) {
        if (rule != null && rule.dailyCap() != null && rule.dailyCap() > 0) {
            return rule.dailyCap();
        }
        OptionalInt userLimit = store.preferencesForTenant(tenantId).stream()
                .map(UserAlertPreferences::frequencyLimits)
                .map(limits -> limits.get(category))
                .filter(limit -> limit != null && limit > 0)
                .mapToInt(Integer::intValue)
                .min();
        return userLimit.orElse(settings.defaultDailyCap(category));
    }

    private Deque<Instant> windowFor(String tenantId, AlertCategory category) {
        return windows.computeIfAbsent(key(tenantId, category), ignored -> load(tenantId, category));
    }

    private Deque<Instant> load(String tenantId, AlertCategory category) {
        Instant since = clock.instant().minus(settings.fatigueWindow());
        Deque<Instant> window = new ArrayDeque<>();
        store.alertsCreatedSince(tenantId, since).stream()
                .filter(alert -> alert.category() == category)
                .map(Alert::createdAt)
                .sorted()
                .forEach(window::addLast);
        return window;
    }

    private void evict(Deque<Instant> window) {
        Duration span = settings.fatigueWindow();
        Instant cutoff = clock.instant().minus(span);
        while (!window.isEmpty() && !window.peekFirst().isAfter(cutoff)) {
            window.pollFirst();
        }
    }

    private static String key(String tenantId, AlertCategory category) {
        return tenantId + "|" + category.value();
    }
}
