package com.alertengine.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum InteractionType {
    @JsonProperty("viewed")
    VIEWED("viewed"),
    @JsonProperty("acknowledged")
    ACKNOWLEDGED("acknowledged"),
    @JsonProperty("dismissed")
    DISMISSED("dismissed"),
    @JsonProperty("resolved")
    RESOLVED("resolved"),
    @JsonProperty("snoozed")
    SNOOZED("snoozed"),
    @JsonProperty("rated")
    RATED("rated");

    private final String value;

    InteractionType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
