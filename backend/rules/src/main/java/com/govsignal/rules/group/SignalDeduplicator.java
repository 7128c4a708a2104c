package com.govsignal.rules.group;

import com.govsignal.core.model.ScoredSignal;
import com.govsignal.core.model.SignalType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class SignalDeduplicator {
    private SignalDeduplicator() {
    }

    // Ties keep the signal seen first.
    public static List<ScoredSignal> deduplicate(Collection<ScoredSignal> signals) {
        Map<String, ScoredSignal> byId = new LinkedHashMap<>();
        for (ScoredSignal signal : signals) {
            byId.merge(signal.stableId(), signal,
                    (kept, candidate) -> candidate.priorityScore() > kept.priorityScore() ? candidate : kept);
        }
        return new ArrayList<>(byId.values());
    }

    public static Map<String, List<ScoredSignal>> groupByBill(Collection<ScoredSignal> signals) {
        Map<String, List<ScoredSignal>> groups = new LinkedHashMap<>();
        for (ScoredSignal signal : signals) {
            String billId = signal.signal().billId();
            if (billId != null) {
                groups.computeIfAbsent(billId, ignored -> new ArrayList<>()).add(signal);
            }
        }
        return groups;
    }

    public static Map<String, List<ScoredSignal>> groupByDocket(Collection<ScoredSignal> signals) {
        Map<String, List<ScoredSignal>> groups = new LinkedHashMap<>();
        for (ScoredSignal signal : signals) {
            if (signal.signalType() == SignalType.DOCKET) {
                groups.computeIfAbsent(docketKey(signal), ignored -> new ArrayList<>()).add(signal);
            }
        }
        return groups;
    }

    // Document ids extend their docket id with a '-' sequence suffix.
    public static String docketKey(ScoredSignal signal) {
        String docketId = signal.signal().docketId();
        if (docketId != null) {
            return docketId;
        }
        String sourceId = signal.signal().sourceId();
        int dash = sourceId.lastIndexOf('-');
        return dash > 0 ? sourceId.substring(0, dash) : sourceId;
    }

    public static List<ScoredSignal> latestPerGroup(Map<String, List<ScoredSignal>> groups) {
        List<ScoredSignal> latest = new ArrayList<>();
        for (List<ScoredSignal> members : groups.values()) {
            ScoredSignal newest = null;
            for (ScoredSignal member : members) {
                if (newest == null || member.signal().timestamp().isAfter(newest.signal().timestamp())) {
                    newest = member;
                }
            }
            if (newest != null) {
                latest.add(newest);
            }
        }
        return latest;
    }
}
