package com.govsignal.service.digest;

import com.govsignal.core.model.ScoredSignal;
import com.govsignal.core.model.Signal;
import com.govsignal.core.util.TextWrap;

import java.util.ArrayList;
import java.util.List;

public class ItemFormatter {
    static final String BULLET = "• ";
    static final String INDENT = "  ";
    static final String SEPARATOR = " • ";
    static final String BUNDLE_LINK_LABEL = "View all";

    private final int titleLimit;
    private final int summaryLimit;

    public ItemFormatter(int titleLimit, int summaryLimit) {
        this.titleLimit = titleLimit;
        this.summaryLimit = summaryLimit;
    }

    public List<String> format(ScoredSignal scored, String extraDetail) {
        Signal signal = scored.signal();
        List<String> titleLines = TextWrap.wrapTitle(signal.title(), titleLimit);

        List<String> lines = new ArrayList<>();
        lines.add(BULLET + "[" + scored.industryTag() + "] " + scored.signalType().displayName()
                + " — " + titleLines.get(0) + SEPARATOR + scored.urgency().displayName());
        for (int i = 1; i < titleLines.size(); i++) {
            if (!titleLines.get(i).isEmpty()) {
                lines.add(INDENT + titleLines.get(i));
            }
        }

        List<String> details = new ArrayList<>();
        if (extraDetail != null && !extraDetail.isBlank()) {
            details.add(extraDetail);
        }
        if (!signal.summary().isEmpty()) {
            details.add(TextWrap.truncateSummary(signal.summary(), summaryLimit));
        }
        if (!signal.issueCodes().isEmpty()) {
            details.add("Issues: " + String.join("/", signal.issueCodes()));
        }
        String link = ChatMarkup.link(signal.link(), linkLabel(scored));
        if (!link.isEmpty()) {
            details.add(link);
        }
        if (!details.isEmpty()) {
            lines.add(INDENT + String.join(SEPARATOR, details));
        }
        return lines;
    }

    static String linkLabel(ScoredSignal scored) {
        return scored.isBundle() ? BUNDLE_LINK_LABEL : scored.signal().source().linkLabel();
    }
}
