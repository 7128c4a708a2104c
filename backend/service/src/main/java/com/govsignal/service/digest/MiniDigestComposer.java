package com.govsignal.service.digest;

import com.govsignal.core.model.MetricKeys;
import com.govsignal.core.model.ScoredSignal;
import com.govsignal.core.model.SignalType;
import com.govsignal.core.util.MetricValues;
import com.govsignal.service.config.DigestConfig;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public class MiniDigestComposer {
    static final int BATCH_SIZE_THRESHOLD = 10;
    static final double HIGH_PRIORITY_SCORE = 5.0;
    static final int MAX_ITEMS = 3;

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm z", Locale.US);

    private final DigestConfig config;
    private final Clock clock;
    private final ItemFormatter formatter;

    public MiniDigestComposer(DigestConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.formatter = new ItemFormatter(config.titleLimit(), config.summaryLimit());
    }

    public boolean shouldSend(List<ScoredSignal> signals) {
        if (signals.size() >= BATCH_SIZE_THRESHOLD) {
            return true;
        }
        for (ScoredSignal signal : signals) {
            if (signal.watchlistHit() || signal.priorityScore() >= HIGH_PRIORITY_SCORE) {
                return true;
            }
            if (signal.signalType() == SignalType.DOCKET
                    && MetricValues.numberOrEmpty(signal.signal().metrics(), MetricKeys.COMMENTS_24H_DELTA_PCT)
                    .orElse(0.0) >= config.surgeThreshold()) {
                return true;
            }
        }
        return false;
    }

    public Optional<String> compose(List<ScoredSignal> signals) {
        if (signals.isEmpty() || !shouldSend(signals)) {
            return Optional.empty();
        }
        List<ScoredSignal> highPriority = new ArrayList<>();
        for (ScoredSignal signal : DigestComposer.sorted(signals)) {
            if (signal.priorityScore() >= HIGH_PRIORITY_SCORE && highPriority.size() < MAX_ITEMS) {
                highPriority.add(signal);
            }
        }
        if (highPriority.isEmpty()) {
            return Optional.empty();
        }
        List<String> lines = new ArrayList<>();
        lines.add("⚡ " + ChatMarkup.bold("Mini Signals Alert") + " — " + TIME.format(clock.instant().atZone(config.zoneId())));
        lines.add("_" + signals.size() + " signals in batch, " + highPriority.size() + " high-priority_");
        for (ScoredSignal signal : highPriority) {
            lines.addAll(formatter.format(signal, null));
        }
        return Optional.of(String.join("\n", lines));
    }
}
