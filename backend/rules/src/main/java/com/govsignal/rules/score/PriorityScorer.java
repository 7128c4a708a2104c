package com.govsignal.rules.score;

import com.govsignal.core.model.MetricKeys;
import com.govsignal.core.model.ScoredSignal;
import com.govsignal.core.model.Signal;
import com.govsignal.core.model.SignalType;
import com.govsignal.core.model.Urgency;
import com.govsignal.core.util.MetricValues;
import com.govsignal.core.util.Timestamps;
import com.govsignal.rules.classify.SignalClassifier;

import java.time.Clock;
import java.time.Instant;
import java.util.OptionalDouble;
import java.util.Set;

public class PriorityScorer {
    public static final double WATCHLIST_BONUS = 1.5;
    public static final double BUNDLE_SCORE = 2.0;

    static final double ESCALATED_ACTION_BASE = 4.0;
    static final double MAX_SURGE_BONUS = 2.0;
    static final double NEAR_DEADLINE_BONUS = 0.8;
    static final long NEAR_DEADLINE_DAYS = 3;
    static final double STALE_PENALTY = -1.0;
    static final long STALE_AFTER_DAYS = 30;

    private static final Set<String> ESCALATED_ACTIONS = Set.of("floor_vote", "conference_action");

    private final Clock clock;

    public PriorityScorer(Clock clock) {
        this.clock = clock;
    }

    public double score(Signal signal, SignalType type, Urgency urgency, boolean watchlistHit) {
        Instant now = clock.instant();
        double total = baseScore(signal, type) + urgencyBonus(urgency);

        OptionalDouble surge = MetricValues.number(signal.metrics(), MetricKeys.COMMENTS_24H_DELTA_PCT);
        if (surge.isPresent()) {
            total += surgeBonus(surge.getAsDouble());
        }
        if (signal.deadline() != null && Timestamps.daysUntil(now, signal.deadline()) <= NEAR_DEADLINE_DAYS) {
            total += NEAR_DEADLINE_BONUS;
        }
        if (watchlistHit) {
            total += WATCHLIST_BONUS;
        }
        if (Timestamps.daysSince(now, signal.timestamp()) > STALE_AFTER_DAYS) {
            total += STALE_PENALTY;
        }
        return clamp(Math.round(total * 100.0) / 100.0);
    }

    public static double baseScore(Signal signal, SignalType type) {
        if (ESCALATED_ACTIONS.contains(SignalClassifier.actionType(signal))) {
            return ESCALATED_ACTION_BASE;
        }
        return switch (type) {
            case FINAL_RULE, INTERIM_FINAL_RULE -> 5.0;
            case PROPOSED_RULE -> 3.5;
            case HEARING, MARKUP -> 3.0;
            case DOCKET -> 2.0;
            case BILL -> 1.5;
            case NOTICE -> 1.0;
        };
    }

    public static double urgencyBonus(Urgency urgency) {
        return switch (urgency) {
            case CRITICAL -> 2.0;
            case HIGH -> 1.0;
            case MEDIUM, LOW -> 0.0;
        };
    }

    public static double surgeBonus(double deltaPct) {
        if (Double.isNaN(deltaPct) || deltaPct <= 0) {
            return 0.0;
        }
        return Math.min(MAX_SURGE_BONUS, Math.sqrt(deltaPct / 100.0));
    }

    static double clamp(double value) {
        return Math.max(ScoredSignal.MIN_SCORE, Math.min(ScoredSignal.MAX_SCORE, value));
    }
}
