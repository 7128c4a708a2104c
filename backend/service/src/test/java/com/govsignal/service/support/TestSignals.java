package com.govsignal.service.support;

import com.govsignal.core.model.MetricKeys;
import com.govsignal.core.model.ScoredSignal;
import com.govsignal.core.model.Signal;
import com.govsignal.core.model.SignalType;
import com.govsignal.core.model.Source;
import com.govsignal.core.model.Urgency;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

public final class TestSignals {
    public static final Instant NOW = Instant.parse("2026-06-15T12:00:00Z");
    public static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private TestSignals() {
    }

    public static ScoredSignal scored(String sourceId, String title, double score) {
        Signal signal = Signal.builder(Source.FEDERAL_REGISTER, sourceId, NOW.minusSeconds(600))
                .title(title)
                .link("https://www.federalregister.gov/d/" + sourceId)
                .build();
        return new ScoredSignal(signal, SignalType.FINAL_RULE, Urgency.HIGH, score, "Health", List.of());
    }

    public static ScoredSignal scored(Signal signal, SignalType type, double score, String industry, List<String> matches) {
        return new ScoredSignal(signal, type, Urgency.LOW, score, industry, matches);
    }

    public static ScoredSignal bundle(String rule, int count) {
        Signal signal = Signal.builder(Source.FEDERAL_REGISTER, "bundle-" + rule + "-" + count, NOW)
                .title("Routine notices — " + count + " notices")
                .link("https://www.federalregister.gov/agencies/example")
                .metric(MetricKeys.BUNDLED_COUNT, count)
                .metric(MetricKeys.BUNDLE_RULE, rule)
                .build();
        return new ScoredSignal(signal, SignalType.NOTICE, Urgency.LOW, 2.0, "Transportation", List.of());
    }
}
