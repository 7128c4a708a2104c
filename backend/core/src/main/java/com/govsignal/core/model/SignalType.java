package com.govsignal.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SignalType {
    FINAL_RULE("final_rule", "Final Rule"),
    INTERIM_FINAL_RULE("interim_final_rule", "Interim Final Rule"),
    PROPOSED_RULE("proposed_rule", "Proposed Rule"),
    HEARING("hearing", "Hearing"),
    MARKUP("markup", "Markup"),
    BILL("bill", "Bill"),
    DOCKET("docket", "Docket"),
    NOTICE("notice", "Notice");

    private final String wireName;
    private final String displayName;

    SignalType(String wireName, String displayName) {
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
