package com.govsignal.service.digest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SectionKind {
    WATCHLIST("watchlist", "🔎", "Watchlist Alerts"),
    WHAT_CHANGED("what_changed", "📈", "What Changed"),
    INDUSTRY_SNAPSHOT("industry_snapshot", "🏭", "Industry Snapshot"),
    DEADLINES("deadlines", "⏰", "Deadlines"),
    DOCKET_SURGES("docket_surges", "📊", "Docket Surges"),
    BILL_ACTIONS("bill_actions", "📜", "Bill Actions"),
    BUNDLES("bundles", "🗂", "Bundled Notices");

    private final String wireName;
    private final String emoji;
    private final String title;

    SectionKind(String wireName, String emoji, String title) {
        this.wireName = wireName;
        this.emoji = emoji;
        this.title = title;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String emoji() {
        return emoji;
    }

    public String title() {
        return title;
    }

    @JsonCreator
    public static SectionKind fromWire(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (SectionKind kind : values()) {
            if (kind.wireName.equals(normalized) || kind.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown digest section: " + value);
    }
}
