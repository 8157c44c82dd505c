package com.alertengine.engine.background;

import com.alertengine.core.bus.EventBus;
import com.alertengine.core.events.PatternDetected;
import com.alertengine.core.model.Alert;
import com.alertengine.core.model.AlertPattern;
import com.alertengine.core.model.AlertStatus;
import com.alertengine.core.util.HashingUtils;
import com.alertengine.engine.api.AlertStore;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Groups each tenant's active alerts by feature similarity (density-based clustering) and stores
 * every group as an {@link AlertPattern}. Alerts themselves are left untouched.
 */
public final class AlertClusterer implements ProcessorStep {
    private static final int NOISE = -1;
    private static final int UNVISITED = 0;

    private final AlertStore store;
    private final EventBus eventBus;
    private final double radius;
    private final int minClusterSize;

    public AlertClusterer(AlertStore store, EventBus eventBus, double radius, int minClusterSize) {
        this.store = store;
        this.eventBus = eventBus;
        this.radius = radius;
        this.minClusterSize = minClusterSize;
    }

    @Override
    public String name() {
        return "cluster";
    }

    @Override
    public StepResult run(Instant now) {
        int tenants = 0;
        int patterns = 0;
        for (String tenantId : store.tenantIds()) {
            List<Alert> candidates = store.alertsForTenant(tenantId, AlertStatus.ACTIVE).stream()
                    .filter(alert -> !alert.mlFeatures().isEmpty())
                    .toList();
            if (candidates.size() < minClusterSize) {
                continue;
            }
            tenants++;
            for (List<Alert> cluster : cluster(candidates)) {
                AlertPattern pattern = toPattern(tenantId, cluster, candidates.size(), now);
                store.savePattern(pattern);
                eventBus.publish(new PatternDetected(now, tenantId, pattern.patternId(), cluster.size(),
                        pattern.significanceScore()));
                patterns++;
            }
        }
        return StepResult.success(name(), "clustered " + tenants + " tenants",
                Map.of("tenants", tenants, "patterns", patterns));
    }

    List<List<Alert>> cluster(List<Alert> alerts) {
        int[] labels = new int[alerts.size()];
        Arrays.fill(labels, UNVISITED);
        int clusterId = 0;
        for (int i = 0; i < alerts.size(); i++) {
            if (labels[i] != UNVISITED) {
                continue;
            }
            List<Integer> neighbours = neighbours(alerts, i);
            if (neighbours.size() < minClusterSize) {
                labels[i] = NOISE;
                continue;
            }
            clusterId++;
            labels[i] = clusterId;
            Deque<Integer> frontier = new ArrayDeque<>(neighbours);
            while (!frontier.isEmpty()) {
                int j = frontier.poll();
                if (labels[j] == NOISE) {
                    labels[j] = clusterId;
                }
                if (labels[j] != UNVISITED) {
                    continue;
                }
                labels[j] = clusterId;
                List<Integer> expansion = neighbours(alerts, j);
                if (expansion.size() >= minClusterSize) {
                    frontier.addAll(expansion);
                }
            }
        }
        Map<Integer, List<Alert>> grouped = new TreeMap<>();
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] > 0) {
                grouped.computeIfAbsent(labels[i], ignored -> new ArrayList<>()).add(alerts.get(i));
            }
        }
        return new ArrayList<>(grouped.values());
    }

    /**
     * Root-mean-square difference over the union of feature names, so the radius does not depend
     * on how many features an alert carries. Missing features count as zero.
     */
    static double distance(Map<String, Double> left, Map<String, Double> right) {
        TreeSet<String> names = new TreeSet<>(left.keySet());
        names.addAll(right.keySet());
        if (names.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (String name : names) {
            double delta = left.getOrDefault(name, 0.0) - right.getOrDefault(name, 0.0);
            sum += delta * delta;
        }
        return Math.sqrt(sum / names.size());
    }

    private List<Integer> neighbours(List<Alert> alerts, int index) {
        List<Integer> result = new ArrayList<>();
        Map<String, Double> origin = alerts.get(index).mlFeatures();
        for (int i = 0; i < alerts.size(); i++) {
            if (distance(origin, alerts.get(i).mlFeatures()) <= radius) {
                result.add(i);
            }
        }
        return result;
    }

    private static AlertPattern toPattern(String tenantId, List<Alert> cluster, int population, Instant now) {
        Map<String, Double> centroid = new HashMap<>();
        for (Alert alert : cluster) {
            alert.mlFeatures().forEach((name, value) -> centroid.merge(name, value, Double::sum));
        }
        centroid.replaceAll((name, sum) -> sum / cluster.size());
        List<String> alertIds = cluster.stream().map(Alert::alertId).sorted().toList();
        double meanSeverity = cluster.stream().mapToDouble(Alert::severity).average().orElse(0.0);
        double significance = 0.5 * cluster.size() / population + 0.5 * meanSeverity;
        String patternId = "pattern_" + HashingUtils.shortHash(tenantId + "|" + String.join(",", alertIds), 16);
        return new AlertPattern(patternId, tenantId, AlertPattern.CLUSTER, centroid, alertIds, significance, now);
    }
}
