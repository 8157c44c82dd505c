package com.alertengine.engine.store;

import com.alertengine.core.model.Alert;
import com.alertengine.core.model.AlertPattern;
import com.alertengine.core.model.AlertRule;
import com.alertengine.core.model.AlertStatus;
import com.alertengine.core.model.Interaction;
import com.alertengine.core.model.TrainingSample;
import com.alertengine.core.model.UserAlertPreferences;
import com.alertengine.engine.api.AlertStore;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;

/**
 * Map-backed store. Updates of one alert or rule are atomic through {@link ConcurrentHashMap#compute}.
 */
public class InMemoryAlertStore implements AlertStore {
    private final Map<String, Alert> alerts = new ConcurrentHashMap<>();
    private final Map<String, AlertRule> rules = new ConcurrentHashMap<>();
    private final Map<String, UserAlertPreferences> preferences = new ConcurrentHashMap<>();
    private final List<Interaction> interactions = new CopyOnWriteArrayList<>();
    private final List<TrainingSample> samples = new CopyOnWriteArrayList<>();
    private final Map<String, AlertPattern> patterns = new ConcurrentHashMap<>();

    @Override
    public void saveAlert(Alert alert) {
        alerts.put(alert.alertId(), alert);
    }

    @Override
    public Optional<Alert> findAlert(String alertId) {
        return Optional.ofNullable(alerts.get(alertId));
    }

    @Override
    public Optional<Alert> updateAlert(String alertId, UnaryOperator<Alert> update) {
        return Optional.ofNullable(alerts.computeIfPresent(alertId, (id, current) -> update.apply(current)));
    }

    @Override
    public Optional<Alert> latestByFingerprint(String tenantId, String fingerprint) {
        return alerts.values().stream()
                .filter(alert -> tenantId.equals(alert.tenantId()))
                .filter(alert -> fingerprint.equals(alert.fingerprint()))
                .max(Comparator.comparing(Alert::createdAt));
    }

    @Override
    public List<Alert> alertsCreatedSince(String tenantId, Instant since) {
        return alerts.values().stream()
                .filter(alert -> tenantId.equals(alert.tenantId()))
                .filter(alert -> alert.createdAt().isAfter(since))
                .toList();
    }

    @Override
    public List<Alert> alertsForTenant(String tenantId, AlertStatus status) {
        return alerts.values().stream()
                .filter(alert -> tenantId.equals(alert.tenantId()))
                .filter(alert -> alert.status() == status)
                .toList();
    }

    @Override
    public List<Alert> alertsWithStatus(AlertStatus status) {
        return alerts.values().stream().filter(alert -> alert.status() == status).toList();
    }

    @Override
    public int deleteAlerts(Collection<String> alertIds) {
        int removed = 0;
        for (String alertId : alertIds) {
            if (alerts.remove(alertId) != null) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public Set<String> tenantIds() {
        Set<String> tenants = new TreeSet<>();
        alerts.values().forEach(alert -> tenants.add(alert.tenantId()));
        rules.values().forEach(rule -> tenants.add(rule.tenantId()));
        preferences.values().forEach(prefs -> tenants.add(prefs.tenantId()));
        return tenants;
    }

    @Override
    public Optional<AlertRule> findRule(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId));
    }

    @Override
    public List<AlertRule> rulesForTenant(String tenantId) {
        return rules.values().stream()
                .filter(rule -> tenantId.equals(rule.tenantId()))
                .sorted(Comparator.comparing(AlertRule::ruleId))
                .toList();
    }

    @Override
    public void saveRule(AlertRule rule) {
        rules.put(rule.ruleId(), rule);
    }

    @Override
    public Optional<AlertRule> updateRule(String ruleId, UnaryOperator<AlertRule> update) {
        return Optional.ofNullable(rules.computeIfPresent(ruleId, (id, current) -> update.apply(current)));
    }

    @Override
    public Optional<UserAlertPreferences> findPreferences(String userId, String tenantId) {
        return Optional.ofNullable(preferences.get(preferenceKey(userId, tenantId)));
    }

    @Override
    public List<UserAlertPreferences> preferencesForTenant(String tenantId) {
        return preferences.values().stream()
                .filter(prefs -> tenantId.equals(prefs.tenantId()))
                .sorted(Comparator.comparing(UserAlertPreferences::userId))
                .toList();
    }

    @Override
    public void savePreferences(UserAlertPreferences prefs) {
        preferences.put(preferenceKey(prefs.userId(), prefs.tenantId()), prefs);
    }

    @Override
    public void appendInteraction(Interaction interaction) {
        interactions.add(interaction);
    }

    @Override
    public List<Interaction> interactionsForAlert(String alertId) {
        return interactions.stream().filter(interaction -> alertId.equals(interaction.alertId())).toList();
    }

    @Override
    public List<Interaction> interactionsSince(String tenantId, Instant since) {
        return interactions.stream()
                .filter(interaction -> tenantId.equals(interaction.tenantId()))
                .filter(interaction -> interaction.timestamp().isAfter(since))
                .toList();
    }

    @Override
    public void appendTrainingSample(TrainingSample sample) {
        samples.add(sample);
    }

    @Override
    public List<TrainingSample> trainingSamplesSince(Instant since) {
        return samples.stream()
                .filter(sample -> sample.createdAt().isAfter(since))
                .sorted(Comparator.comparing(TrainingSample::createdAt).thenComparing(TrainingSample::sampleId))
                .toList();
    }

    @Override
    public int pruneTrainingSamples(Instant before) {
        int size = samples.size();
        samples.removeIf(sample -> sample.createdAt().isBefore(before));
        return size - samples.size();
    }

    @Override
    public void savePattern(AlertPattern pattern) {
        patterns.put(pattern.patternId(), pattern);
    }

    @Override
    public List<AlertPattern> patternsForTenant(String tenantId) {
        return patterns.values().stream()
                .filter(pattern -> tenantId.equals(pattern.tenantId()))
                .sorted(Comparator.comparing(AlertPattern::identifiedAt).reversed())
                .toList();
    }

    public StoreSnapshot snapshot() {
        return new StoreSnapshot(
                List.copyOf(alerts.values()),
                List.copyOf(rules.values()),
                List.copyOf(preferences.values()),
                List.copyOf(interactions),
                List.copyOf(samples),
                List.copyOf(patterns.values())
        );
    }

    /**
     * Replaces every table with the snapshot's rows.
     */
    public void restore(StoreSnapshot snapshot) {
        alerts.clear();
        rules.clear();
        preferences.clear();
        interactions.clear();
        samples.clear();
        patterns.clear();
        snapshot.alerts().forEach(this::saveAlert);
        snapshot.rules().forEach(this::saveRule);
        snapshot.preferences().forEach(this::savePreferences);
        interactions.addAll(snapshot.interactions());
        samples.addAll(snapshot.trainingSamples());
        snapshot.patterns().forEach(this::savePattern);
    }

    private static String preferenceKey(String userId, String tenantId) {
        return tenantId + "|" + userId;
    }
}
