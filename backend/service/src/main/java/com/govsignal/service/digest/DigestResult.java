package com.govsignal.service.digest;

import com.govsignal.core.model.ScoredSignal;

import java.util.List;

public record DigestResult(
        String text,
        int eligibleCount,
        int emittedCount,
        int overflowCount,
        List<DigestSection> sections,
        ScoredSignal outlier
) {
    public DigestResult {
        sections = List.copyOf(sections);
    }

    public boolean hasActivity() {
        return eligibleCount > 0;
    }
}
