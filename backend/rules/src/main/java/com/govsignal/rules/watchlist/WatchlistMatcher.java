package com.govsignal.rules.watchlist;

import com.govsignal.core.model.Signal;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public class WatchlistMatcher {
    private final List<String> terms;

    public WatchlistMatcher(List<String> watchlist) {
        List<String> cleaned = new ArrayList<>();
        if (watchlist != null) {
            for (String term : watchlist) {
                if (term != null && !term.isBlank()) {
                    cleaned.add(term.trim());
                }
            }
        }
        this.terms = List.copyOf(cleaned);
    }

    public List<String> match(Signal signal) {
        String text = signal.contentText();
        Set<String> matched = new LinkedHashSet<>();
        for (String term : terms) {
            if (text.contains(term.toLowerCase(Locale.ROOT))) {
                matched.add(term);
            }
        }
        return List.copyOf(matched);
    }

    public List<String> terms() {
        return terms;
    }
}
