package com.govsignal.rules.group;

import com.govsignal.core.model.ScoredSignal;
import com.govsignal.core.model.Signal;
import com.govsignal.core.model.SignalType;
import com.govsignal.core.model.Source;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.govsignal.rules.support.TestSignals.NOW;
import static com.govsignal.rules.support.TestSignals.scored;
import static com.govsignal.rules.support.TestSignals.signal;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class SignalDeduplicatorTest {
    @Test
    void keepsHighestScoreInFirstSeenOrder() {
        ScoredSignal a1 = scored("a", 2.0);
        ScoredSignal b = scored("b", 5.0);
        ScoredSignal a2 = scored("a", 4.0);

        List<ScoredSignal> result = SignalDeduplicator.deduplicate(List.of(a1, b, a2));

        assertEquals(2, result.size());
        assertSame(a2, result.get(0));
        assertSame(b, result.get(1));
    }

    @Test
    void tiesKeepFirstSeen() {
        ScoredSignal first = scored("a", 3.0);
        ScoredSignal second = scored("a", 3.0);

        assertSame(first, SignalDeduplicator.deduplicate(List.of(first, second)).get(0));
    }

    @Test
    void deduplicationIsIdempotent() {
        List<ScoredSignal> input = List.of(scored("a", 1.0), scored("b", 2.0), scored("a", 6.0), scored("c", 2.0), scored("b", 2.0));

        List<ScoredSignal> once = SignalDeduplicator.deduplicate(input);
        List<ScoredSignal> twice = SignalDeduplicator.deduplicate(once);

        assertEquals(once, twice);
        assertEquals(3, once.size());
    }

    @Test
    void groupsByBillAndKeepsLatestPerGroup() {
        ScoredSignal older = scored(signal(Source.CONGRESS, "hr1-a").billId("H.R. 1").build(), SignalType.BILL, 1.5);
        ScoredSignal newer = scored(Signal.builder(Source.CONGRESS, "hr1-b", NOW).billId("H.R. 1").build(), SignalType.BILL, 1.5);
        ScoredSignal other = scored(signal(Source.CONGRESS, "s2").billId("S. 2").build(), SignalType.BILL, 1.5);
        ScoredSignal none = scored(signal(Source.CONGRESS, "x").build(), SignalType.HEARING, 3.0);

        Map<String, List<ScoredSignal>> groups = SignalDeduplicator.groupByBill(List.of(older, other, newer, none));

        assertEquals(List.of("H.R. 1", "S. 2"), List.copyOf(groups.keySet()));
        assertEquals(List.of(newer, other), SignalDeduplicator.latestPerGroup(groups));
    }

    @Test
    void docketKeyFallsBackToSourceIdPrefix() {
        ScoredSignal withDocket = scored(signal(Source.REGULATIONS_GOV, "EPA-HQ-2026-0001-0007").docketId("EPA-HQ-2026-0001").build(),
                SignalType.DOCKET, 2.0);
        ScoredSignal derived = scored(signal(Source.REGULATIONS_GOV, "EPA-HQ-2026-0001-0009").build(), SignalType.DOCKET, 2.0);
        ScoredSignal notDocket = scored(signal(Source.FEDERAL_REGISTER, "2026-1").docketId("EPA-HQ-2026-0001").build(),
                SignalType.FINAL_RULE, 5.0);

        assertEquals("EPA-HQ-2026-0001", SignalDeduplicator.docketKey(derived));
        Map<String, List<ScoredSignal>> groups = SignalDeduplicator.groupByDocket(List.of(withDocket, derived, notDocket));
        assertEquals(Map.of("EPA-HQ-2026-0001", List.of(withDocket, derived)), groups);
    }
}
