package com.alertengine.core.model;

import com.alertengine.core.error.InvalidCategoryException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

public enum AlertCategory {
    @JsonProperty("business_metric")
    BUSINESS_METRIC("business_metric"),
    @JsonProperty("system_health")
    SYSTEM_HEALTH("system_health"),
    @JsonProperty("customer_behavior")
    CUSTOMER_BEHAVIOR("customer_behavior"),
    @JsonProperty("revenue_anomaly")
    REVENUE_ANOMALY("revenue_anomaly"),
    @JsonProperty("operational_issue")
    OPERATIONAL_ISSUE("operational_issue"),
    @JsonProperty("opportunity")
    OPPORTUNITY("opportunity"),
    @JsonProperty("compliance")
    COMPLIANCE("compliance"),
    @JsonProperty("security")
    SECURITY("security");

    private final String value;

    AlertCategory(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Parses a wire value. Accepts {@code revenue_anomaly}, {@code revenue-anomaly} and any case.
     */
    @JsonCreator
    public static AlertCategory fromValue(String raw) {
        if (raw != null) {
            String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
            for (AlertCategory category : values()) {
                if (category.value.equals(normalized)) {
                    return category;
                }
            }
        }
        throw new InvalidCategoryException(String.valueOf(raw), allowedValues());
    }

    public static String allowedValues() {
        return Arrays.stream(values()).map(AlertCategory::value).collect(Collectors.joining(", "));
    }
}
