package com.govsignal.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Source {
    CONGRESS("congress", "Congress"),
    FEDERAL_REGISTER("federal_register", "FR"),
    REGULATIONS_GOV("regulations_gov", "Docket"),
    OTHER("other", "View");

    private final String wireName;
    private final String linkLabel;

    Source(String wireName, String linkLabel) {
        this.wireName = wireName;
        this.linkLabel = linkLabel;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String linkLabel() {
        return linkLabel;
    }

    @JsonCreator
    public static Source fromWire(String value) {
        if (value == null) {
            return OTHER;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Source source : values()) {
            if (source.wireName.equals(normalized)) {
                return source;
            }
        }
        return OTHER;
    }
}
