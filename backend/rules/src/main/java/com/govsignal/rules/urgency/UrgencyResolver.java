package com.govsignal.rules.urgency;

import com.govsignal.core.model.MetricKeys;
import com.govsignal.core.model.Signal;
import com.govsignal.core.model.SignalType;
import com.govsignal.core.model.Urgency;
import com.govsignal.core.util.MetricValues;
import com.govsignal.core.util.Timestamps;
import com.govsignal.rules.classify.SignalClassifier;

import java.time.Clock;
import java.util.Set;

// Deadlines already in the past count as inside every window.
public class UrgencyResolver {
    static final Set<String> ESCALATING_ACTIONS = Set.of("floor_vote", "conference_action");
    static final double SURGE_HIGH_PCT = 200.0;

    private final Clock clock;

    public UrgencyResolver(Clock clock) {
        this.clock = clock;
    }

    public Urgency resolve(Signal signal, SignalType type) {
        Long days = daysUntilDeadline(signal);
        if (isCritical(type, days)) {
            return Urgency.CRITICAL;
        }
        if (isHigh(signal, type, days)) {
            return Urgency.HIGH;
        }
        if (isMedium(signal, type, days)) {
            return Urgency.MEDIUM;
        }
        return Urgency.LOW;
    }

    public Long daysUntilDeadline(Signal signal) {
        return signal.deadline() == null ? null : Timestamps.daysUntil(clock.instant(), signal.deadline());
    }

    private static boolean isCritical(SignalType type, Long days) {
        return switch (type) {
            case FINAL_RULE, INTERIM_FINAL_RULE -> within(days, 30);
            case PROPOSED_RULE, HEARING, MARKUP, BILL, DOCKET, NOTICE -> false;
        };
    }

    private static boolean isHigh(Signal signal, SignalType type, Long days) {
        if (ESCALATING_ACTIONS.contains(SignalClassifier.actionType(signal))) {
            return true;
        }
        return switch (type) {
            case PROPOSED_RULE -> within(days, 14);
            case HEARING, MARKUP -> within(days, 7);
            case DOCKET -> within(days, 7)
                    || MetricValues.number(signal.metrics(), MetricKeys.COMMENTS_24H_DELTA_PCT).orElse(0.0) >= SURGE_HIGH_PCT;
            case FINAL_RULE, INTERIM_FINAL_RULE, BILL, NOTICE -> false;
        };
    }

    private static boolean isMedium(Signal signal, SignalType type, Long days) {
        return switch (type) {
            case HEARING, MARKUP -> days != null && days >= 8 && days <= 21;
            case DOCKET -> MetricValues.number(signal.metrics(), MetricKeys.COMMENT_COUNT).orElse(0.0) > 0;
            case BILL -> "committee_referral".equals(SignalClassifier.actionType(signal));
            case FINAL_RULE, INTERIM_FINAL_RULE, PROPOSED_RULE, NOTICE -> false;
        };
    }

    private static boolean within(Long days, int limit) {
        return days != null && days <= limit;
    }
}
