package com.govsignal.core.model;

import java.util.List;
import java.util.Objects;

public record ScoredSignal(
        Signal signal,
        SignalType signalType,
        Urgency urgency,
        double priorityScore,
        String industryTag,
        List<String> watchlistMatches
) {
    public static final double MIN_SCORE = 0.0;
    public static final double MAX_SCORE = 10.0;

    public ScoredSignal {
        Objects.requireNonNull(signal, "signal is required");
        Objects.requireNonNull(signalType, "signalType is required");
        Objects.requireNonNull(urgency, "urgency is required");
        if (Double.isNaN(priorityScore) || priorityScore < MIN_SCORE || priorityScore > MAX_SCORE) {
            throw new IllegalArgumentException("priorityScore out of range: " + priorityScore);
        }
        industryTag = industryTag == null || industryTag.isBlank() ? "Government" : industryTag;
        watchlistMatches = watchlistMatches == null ? List.of() : List.copyOf(watchlistMatches);
    }

    public boolean watchlistHit() {
        return !watchlistMatches.isEmpty();
    }

    public boolean isBundle() {
        return signal.metrics().containsKey(MetricKeys.BUNDLED_COUNT);
    }

    public int bundledCount() {
        Object value = signal.metrics().get(MetricKeys.BUNDLED_COUNT);
        return value instanceof Number number ? number.intValue() : 0;
    }

    public String stableId() {
        return signal.stableId();
    }
}
