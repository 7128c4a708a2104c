package com.govsignal.rules.score;

import com.govsignal.core.model.MetricKeys;
import com.govsignal.core.model.Signal;
import com.govsignal.core.model.SignalType;
import com.govsignal.core.model.Source;
import com.govsignal.core.model.Urgency;
import com.govsignal.core.util.MetricFormatException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static com.govsignal.rules.support.TestSignals.CLOCK;
import static com.govsignal.rules.support.TestSignals.NOW;
import static com.govsignal.rules.support.TestSignals.signal;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PriorityScorerTest {
    private final PriorityScorer scorer = new PriorityScorer(CLOCK);

    @Test
    void baseScoreFollowsTypeWithFloorActionOverride() {
        Signal plain = signal(Source.CONGRESS, "b").build();
        Signal vote = signal(Source.CONGRESS, "v").metric(MetricKeys.ACTION_TYPE, "conference_action").build();

        assertEquals(1.5, scorer.score(plain, SignalType.BILL, Urgency.LOW, false));
        assertEquals(4.0, scorer.score(vote, SignalType.BILL, Urgency.LOW, false));
        assertEquals(1.0, scorer.score(plain, SignalType.NOTICE, Urgency.LOW, false));
        assertEquals(3.5, scorer.score(plain, SignalType.PROPOSED_RULE, Urgency.MEDIUM, false));
    }

    @Test
    void modifiersAddUpAndRoundToTwoDecimals() {
        Signal docket = signal(Source.REGULATIONS_GOV, "d")
                .metric(MetricKeys.COMMENTS_24H_DELTA_PCT, 150)
                .deadline(NOW.plus(Duration.ofDays(2)))
                .build();

        // 2.0 base + 1.0 high + sqrt(1.5) + 0.8 deadline + 1.5 watchlist
        assertEquals(6.52, scorer.score(docket, SignalType.DOCKET, Urgency.HIGH, true));
    }

    @Test
    void scoreIsClampedToTen() {
        Signal loaded = signal(Source.FEDERAL_REGISTER, "f")
                .metric(MetricKeys.COMMENTS_24H_DELTA_PCT, 10_000)
                .deadline(NOW.plus(Duration.ofDays(1)))
                .build();

        // 5.0 + 2.0 + 2.0 + 0.8 + 1.5 = 11.3 before clamping
        assertEquals(10.0, scorer.score(loaded, SignalType.FINAL_RULE, Urgency.CRITICAL, true));
    }

    @Test
    void staleSignalsLoseOnePointAndNeverGoNegative() {
        Signal stale = Signal.builder(Source.OTHER, "old", NOW.minus(Duration.ofDays(31))).build();
        Signal monthOld = Signal.builder(Source.OTHER, "edge", NOW.minus(Duration.ofDays(30))).build();

        assertEquals(0.0, scorer.score(stale, SignalType.NOTICE, Urgency.LOW, false));
        assertEquals(1.0, scorer.score(monthOld, SignalType.NOTICE, Urgency.LOW, false));
    }

    @Test
    void surgeBonusIsMonotonicAndCapped() {
        double previous = -1;
        for (int pct = 0; pct <= 1_000; pct += 25) {
            double bonus = PriorityScorer.surgeBonus(pct);
            assertTrue(bonus >= previous, "bonus dropped at " + pct);
            assertTrue(bonus <= 2.0);
            previous = bonus;
        }
        assertEquals(0.0, PriorityScorer.surgeBonus(-50));
        assertEquals(1.0, PriorityScorer.surgeBonus(100));
        assertEquals(2.0, PriorityScorer.surgeBonus(400));
        assertEquals(2.0, PriorityScorer.surgeBonus(5_000));
    }

    @Test
    void malformedSurgeMetricIsRejected() {
        Signal bad = signal(Source.REGULATIONS_GOV, "d")
                .metric(MetricKeys.COMMENTS_24H_DELTA_PCT, Map.of("value", 12))
                .build();

        assertThrows(MetricFormatException.class, () -> scorer.score(bad, SignalType.DOCKET, Urgency.LOW, false));
    }
}
