package com.alertengine.service.store;

import com.alertengine.core.error.StorageFailureException;
import com.alertengine.core.model.Alert;
import com.alertengine.core.model.AlertPattern;
import com.alertengine.core.model.AlertRule;
import com.alertengine.core.model.AlertStatus;
import com.alertengine.core.model.Interaction;
import com.alertengine.core.model.TrainingSample;
import com.alertengine.core.model.UserAlertPreferences;
import com.alertengine.core.util.JsonUtils;
import com.alertengine.engine.api.AlertStore;
import com.alertengine.engine.store.InMemoryAlertStore;
import com.alertengine.engine.store.StoreSnapshot;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Keeps every table in memory and rewrites one JSON file after each write. A write that cannot be
 * persisted is rolled back in memory before {@link StorageFailureException} reaches the caller.
 */
public class JsonFileAlertStore implements AlertStore {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();
    private final InMemoryAlertStore tables = new InMemoryAlertStore();

    public JsonFileAlertStore(Path file) {
        this.file = file;
        loadIfPresent();
    }

    @Override
    public void saveAlert(Alert alert) {
        write(() -> {
            tables.saveAlert(alert);
            return null;
        });
    }

    @Override
    public Optional<Alert> findAlert(String alertId) {
        return tables.findAlert(alertId);
    }

    @Override
    public Optional<Alert> updateAlert(String alertId, UnaryOperator<Alert> update) {
        return write(() -> tables.updateAlert(alertId, update));
    }

    @Override
    public Optional<Alert> latestByFingerprint(String tenantId, String fingerprint) {
        return tables.latestByFingerprint(tenantId, fingerprint);
    }

    @Override
    public List<Alert> alertsCreatedSince(String tenantId, Instant since) {
        return tables.alertsCreatedSince(tenantId, since);
    }

    @Override
    public List<Alert> alertsForTenant(String tenantId, AlertStatus status) {
        return tables.alertsForTenant(tenantId, status);
    }

    @Override
    public List<Alert> alertsWithStatus(AlertStatus status) {
        return tables.alertsWithStatus(status);
    }

    @Override
    public int deleteAlerts(Collection<String> alertIds) {
        return write(() -> tables.deleteAlerts(alertIds));
    }

    @Override
    public Set<String> tenantIds() {
        return tables.tenantIds();
    }

    @Override
    public Optional<AlertRule> findRule(String ruleId) {
        return tables.findRule(ruleId);
    }

    @Override
    public List<AlertRule> rulesForTenant(String tenantId) {
        return tables.rulesForTenant(tenantId);
    }

    @Override
    public void saveRule(AlertRule rule) {
        write(() -> {
            tables.saveRule(rule);
            return null;
        });
    }

    @Override
    public Optional<AlertRule> updateRule(String ruleId, UnaryOperator<AlertRule> update) {
        return write(() -> tables.updateRule(ruleId, update));
    }

    @Override
    public Optional<UserAlertPreferences> findPreferences(String userId, String tenantId) {
        return tables.findPreferences(userId, tenantId);
    }

    @Override
    public List<UserAlertPreferences> preferencesForTenant(String tenantId) {
        return tables.preferencesForTenant(tenantId);
    }

    @Override
    public void savePreferences(UserAlertPreferences preferences) {
        write(() -> {
            tables.savePreferences(preferences);
            return null;
        });
    }

    @Override
    public void appendInteraction(Interaction interaction) {
        write(() -> {
            tables.appendInteraction(interaction);
            return null;
        });
    }

    @Override
    public List<Interaction> interactionsForAlert(String alertId) {
        return tables.interactionsForAlert(alertId);
    }

    @Override
    public List<Interaction> interactionsSince(String tenantId, Instant since) {
        return tables.interactionsSince(tenantId, since);
    }

    @Override
    public void appendTrainingSample(TrainingSample sample) {
        write(() -> {
            tables.appendTrainingSample(sample);
            return null;
        });
    }

    @Override
    public List<TrainingSample> trainingSamplesSince(Instant since) {
        return tables.trainingSamplesSince(since);
    }

    @Override
    public int pruneTrainingSamples(Instant before) {
        return write(() -> tables.pruneTrainingSamples(before));
    }

    @Override
    public void savePattern(AlertPattern pattern) {
        write(() -> {
            tables.savePattern(pattern);
            return null;
        });
    }

    @Override
    public List<AlertPattern> patternsForTenant(String tenantId) {
        return tables.patternsForTenant(tenantId);
    }

    private <T> T write(Supplier<T> mutation) {
        lock.lock();
        StoreSnapshot before = null;
        try {
            before = tables.snapshot();
            T result = mutation.get();
            persist();
            return result;
        } catch (IOException e) {
            tables.restore(before);
            throw new StorageFailureException("Failed writing alert store to " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private void loadIfPresent() {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return;
            }
            try (InputStream in = Files.newInputStream(file)) {
                tables.restore(MAPPER.readValue(in, StoreSnapshot.class));
            }
        } catch (IOException e) {
            throw new StorageFailureException("Failed loading alert store from " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private void persist() throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path staging = parent.resolve(file.getFileName() + ".tmp");
        try (OutputStream out = Files.newOutputStream(staging)) {
            MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, tables.snapshot());
        }
        Files.move(staging, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
