package com.alertengine.engine.features;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Typed view over the free-form {@code sourceData} map. Every documented field is read under its
 * camelCase or snake_case key. Fields that are present but unreadable are reported through
 * {@link #invalidFields()} instead of failing.
 */
public final class SourceSignals {
    private final Double revenueImpact;
    private final Double customerCount;
    private final Double eventFrequency;
    private final Trend trend;
    private final Double thresholdDeviation;
    private final Boolean systemCritical;
    private final Double uptimePercentage;
    private final int fieldCount;
    private final Set<String> invalidFields;

    private SourceSignals(Map<String, Object> data) {
        Set<String> invalid = new TreeSet<>();
        this.revenueImpact = number(data, invalid, "revenueImpact", "revenue_impact");
        this.customerCount = number(data, invalid, "customerCount", "customer_count");
        this.eventFrequency = number(data, invalid, "frequency", "eventFrequency", "event_frequency");
        this.trend = trend(data, invalid);
        this.thresholdDeviation = number(data, invalid, "thresholdDeviation", "threshold_deviation");
        this.systemCritical = flag(data, invalid, "systemCritical", "system_critical");
        this.uptimePercentage = number(data, invalid, "uptimePercentage", "uptime_percentage");
        this.fieldCount = data.size();
        this.invalidFields = Collections.unmodifiableSet(invalid);
    }

    public static SourceSignals from(Map<String, Object> sourceData) {
        return new SourceSignals(sourceData == null ? Map.of() : sourceData);
    }

    public Optional<Double> revenueImpact() {
        return Optional.ofNullable(revenueImpact);
    }

    public Optional<Double> customerCount() {
        return Optional.ofNullable(customerCount);
    }

    public Optional<Double> eventFrequency() {
        return Optional.ofNullable(eventFrequency);
    }

    public Optional<Trend> trend() {
        return Optional.ofNullable(trend);
    }

    public Optional<Double> thresholdDeviation() {
        return Optional.ofNullable(thresholdDeviation);
    }

    public Optional<Boolean> systemCritical() {
        return Optional.ofNullable(systemCritical);
    }

    public Optional<Double> uptimePercentage() {
        return Optional.ofNullable(uptimePercentage);
    }

    public int fieldCount() {
        return fieldCount;
    }

    public Set<String> invalidFields() {
        return invalidFields;
    }

    public boolean isInvalid(String field) {
        return invalidFields.contains(field);
    }

    private static Double number(Map<String, Object> data, Set<String> invalid, String name, String... aliases) {
        Object raw = lookup(data, name, aliases);
        if (raw == null) {
            return null;
        }
        Double parsed = null;
        if (raw instanceof Number) {
            parsed = ((Number) raw).doubleValue();
        } else if (raw instanceof String) {
            try {
                parsed = Double.parseDouble(((String) raw).trim());
            } catch (NumberFormatException ignored) {
                parsed = null;
            }
        }
        if (parsed == null || parsed.isNaN() || parsed.isInfinite()) {
            invalid.add(name);
            return null;
        }
        return parsed;
    }

    private static Boolean flag(Map<String, Object> data, Set<String> invalid, String name, String... aliases) {
        Object raw = lookup(data, name, aliases);
        if (raw == null) {
            return null;
        }
        if (raw instanceof Boolean) {
            return (Boolean) raw;
        }
        if (raw instanceof String) {
            String text = ((String) raw).trim().toLowerCase(Locale.ROOT);
            if ("true".equals(text) || "false".equals(text)) {
                return Boolean.valueOf(text);
            }
        }
        invalid.add(name);
        return null;
    }

    private static Trend trend(Map<String, Object> data, Set<String> invalid) {
        Object raw = lookup(data, "trendDirection", "trend_direction", "trend");
        if (raw == null) {
            return null;
        }
        Optional<Trend> parsed = Trend.parse(raw.toString());
        if (parsed.isEmpty()) {
            invalid.add("trendDirection");
            return null;
        }
        return parsed.get();
    }

    private static Object lookup(Map<String, Object> data, String name, String... aliases) {
        Object value = data.get(name);
        for (int i = 0; value == null && i < aliases.length; i++) {
            value = data.get(aliases[i]);
        }
        return value;
    }
}
