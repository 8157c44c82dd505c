package com.alertengine.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.EnumSet;
import java.util.Set;

public enum AlertStatus {
    @JsonProperty("active")
    ACTIVE("active"),
    @JsonProperty("acknowledged")
    ACKNOWLEDGED("acknowledged"),
    @JsonProperty("resolved")
    RESOLVED("resolved"),
    @JsonProperty("dismissed")
    DISMISSED("dismissed"),
    @JsonProperty("snoozed")
    SNOOZED("snoozed");

    private final String value;

    AlertStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == RESOLVED || this == DISMISSED;
    }

    public boolean canTransitionTo(AlertStatus next) {
        return allowedNext().contains(next);
    }

    private Set<AlertStatus> allowedNext() {
        switch (this) {
            case ACTIVE:
                return EnumSet.of(ACKNOWLEDGED, DISMISSED, RESOLVED, SNOOZED);
            case ACKNOWLEDGED:
                return EnumSet.of(RESOLVED);
            case SNOOZED:
                return EnumSet.of(ACTIVE);
            default:
                return EnumSet.noneOf(AlertStatus.class);
        }
    }
}
