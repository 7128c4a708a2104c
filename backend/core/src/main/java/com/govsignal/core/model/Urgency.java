package com.govsignal.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Urgency {
    CRITICAL("critical", "Critical"),
    HIGH("high", "High"),
    MEDIUM("medium", "Medium"),
    LOW("low", "Low");

    private final String wireName;
    private final String displayName;

    Urgency(String wireName, String displayName) {
        this.wireName = wireName;
        this.displayName = displayName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String displayName() {
        return displayName;
    }
}
