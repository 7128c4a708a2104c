package com.govsignal.service.config;

import com.govsignal.service.digest.SectionKind;

import java.time.ZoneId;
import java.util.List;

public record DigestConfig(
        Integer hoursBack,
        Integer totalBudget,
        Integer titleLimit,
        Integer summaryLimit,
        Double whatChangedThreshold,
        Double surgeThreshold,
        Integer deadlineWindowDays,
        Integer perIndustry,
        String zone,
        List<SectionConfig> sections
) {
    public static final List<SectionConfig> DEFAULT_SECTIONS = List.of(
            new SectionConfig(SectionKind.WATCHLIST, 5, true),
            new SectionConfig(SectionKind.WHAT_CHANGED, 7, true),
            new SectionConfig(SectionKind.INDUSTRY_SNAPSHOT, 12, false),
            new SectionConfig(SectionKind.DEADLINES, 5, true),
            new SectionConfig(SectionKind.DOCKET_SURGES, 3, true),
            new SectionConfig(SectionKind.BILL_ACTIONS, 5, true),
            new SectionConfig(SectionKind.BUNDLES, 3, true)
    );

    public DigestConfig {
        hoursBack = hoursBack == null ? 24 : hoursBack;
        totalBudget = totalBudget == null ? 20 : totalBudget;
        titleLimit = titleLimit == null ? 60 : titleLimit;
        summaryLimit = summaryLimit == null ? 160 : summaryLimit;
        whatChangedThreshold = whatChangedThreshold == null ? 3.0 : whatChangedThreshold;
        surgeThreshold = surgeThreshold == null ? 200.0 : surgeThreshold;
        deadlineWindowDays = deadlineWindowDays == null ? 7 : deadlineWindowDays;
        perIndustry = perIndustry == null ? 2 : perIndustry;
        zone = zone == null || zone.isBlank() ? "America/Los_Angeles" : zone;
        sections = sections == null || sections.isEmpty() ? DEFAULT_SECTIONS : List.copyOf(sections);
        if (totalBudget < 0) {
            throw new IllegalArgumentException("totalBudget must not be negative: " + totalBudget);
        }
        if (hoursBack <= 0) {
            throw new IllegalArgumentException("hoursBack must be positive: " + hoursBack);
        }
        if (titleLimit <= 0) {
            throw new IllegalArgumentException("titleLimit must be positive: " + titleLimit);
        }
        // summaries are cut to limit - 3 characters plus "..."
        if (summaryLimit <= 3) {
            throw new IllegalArgumentException("summaryLimit must exceed 3: " + summaryLimit);
        }
        if (deadlineWindowDays < 0) {
            throw new IllegalArgumentException("deadlineWindowDays must not be negative: " + deadlineWindowDays);
        }
        if (perIndustry < 0) {
            throw new IllegalArgumentException("perIndustry must not be negative: " + perIndustry);
        }
        ZoneId.of(zone);
    }

    public static DigestConfig defaults() {
        return new DigestConfig(null, null, null, null, null, null, null, null, null, null);
    }

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }
}
