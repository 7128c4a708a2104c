package com.govsignal.service.digest;

import com.govsignal.core.model.ScoredSignal;

import java.util.List;

public record DigestSection(
        String emoji,
        String title,
        int candidateCount,
        List<ScoredSignal> items,
        List<String> lines
) {
    public DigestSection {
        items = List.copyOf(items);
        lines = List.copyOf(lines);
    }

    public String heading() {
        return emoji + " " + ChatMarkup.bold(title) + " (" + candidateCount + "):";
    }
}
