package com.govsignal.service.digest;

import com.govsignal.core.model.MetricKeys;
import com.govsignal.core.model.ScoredSignal;
import com.govsignal.core.model.SignalType;
import com.govsignal.core.model.Source;
import com.govsignal.core.util.MetricValues;
import com.govsignal.core.util.Timestamps;
import com.govsignal.rules.group.SignalDeduplicator;
import com.govsignal.service.config.DigestConfig;
import com.govsignal.service.config.SectionConfig;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.logging.Logger;

public class DigestComposer {
    private static final Logger LOGGER = Logger.getLogger(DigestComposer.class.getName());

    public static final String NO_ACTIVITY_LINE = "_No fresh government activity detected._";
    static final String OUTLIER_EMOJI = "🎯";
    static final String OUTLIER_TITLE = "Outlier";

    static final Comparator<ScoredSignal> BY_PRIORITY = Comparator
            .comparingDouble(ScoredSignal::priorityScore).reversed()
            .thenComparing((ScoredSignal s) -> s.signal().timestamp(), Comparator.reverseOrder())
            .thenComparing(ScoredSignal::stableId);

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd", Locale.US);
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm z", Locale.US);

    private final DigestConfig config;
    private final Clock clock;
    private final ItemFormatter formatter;

    public DigestComposer(DigestConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.formatter = new ItemFormatter(config.titleLimit(), config.summaryLimit());
    }

    public String compose(List<ScoredSignal> signals) {
        return composeResult(signals).text();
    }

    public DigestResult composeResult(List<ScoredSignal> signals) {
        Instant now = clock.instant();
        Set<String> emitted = new LinkedHashSet<>();
        Set<String> eligible = new LinkedHashSet<>();
        List<DigestSection> sections = new ArrayList<>();
        int remaining = config.totalBudget();

        for (SectionConfig sectionConfig : config.sections()) {
            List<ScoredSignal> fresh = new ArrayList<>();
            for (ScoredSignal candidate : candidates(sectionConfig.section(), signals, now)) {
                if (!emitted.contains(candidate.stableId())) {
                    fresh.add(candidate);
                }
            }
            if (sectionConfig.countsOverflow()) {
                fresh.forEach(signal -> eligible.add(signal.stableId()));
            }
            int take = Math.min(Math.min(sectionConfig.cap(), remaining), fresh.size());
            if (take == 0) {
                continue;
            }
            List<ScoredSignal> chosen = fresh.subList(0, take);
            List<String> lines = new ArrayList<>();
            for (ScoredSignal signal : chosen) {
                emitted.add(signal.stableId());
                eligible.add(signal.stableId());
                lines.addAll(formatter.format(signal, extraDetail(sectionConfig.section(), signal)));
            }
            remaining -= take;
            SectionKind kind = sectionConfig.section();
            sections.add(new DigestSection(kind.emoji(), kind.title(), fresh.size(), chosen, lines));
        }

        ScoredSignal outlier = null;
        if (remaining > 0) {
            outlier = signals.stream()
                    .filter(signal -> !signal.isBundle())
                    .filter(signal -> !emitted.contains(signal.stableId()))
                    .min(BY_PRIORITY)
                    .orElse(null);
            if (outlier != null) {
                emitted.add(outlier.stableId());
                eligible.add(outlier.stableId());
                sections.add(new DigestSection(OUTLIER_EMOJI, OUTLIER_TITLE, 1, List.of(outlier),
                        formatter.format(outlier, null)));
            }
        }

        int overflow = eligible.size() - emitted.size();
        LOGGER.fine(() -> "Digest composed: eligible=" + eligible.size() + " emitted=" + emitted.size()
                + " overflow=" + overflow);
        if (eligible.isEmpty()) {
            return new DigestResult(noActivity(now), 0, 0, 0, List.of(), null);
        }
        return new DigestResult(render(signals, sections, overflow, now), eligible.size(), emitted.size(),
                overflow, sections, outlier);
    }

    List<ScoredSignal> candidates(SectionKind kind, List<ScoredSignal> signals, Instant now) {
        List<ScoredSignal> regular = signals.stream().filter(signal -> !signal.isBundle()).toList();
        return switch (kind) {
            case WATCHLIST -> sorted(regular.stream().filter(ScoredSignal::watchlistHit).toList());
            case WHAT_CHANGED -> sorted(regular.stream()
                    .filter(signal -> signal.priorityScore() >= config.whatChangedThreshold())
                    .toList());
            case INDUSTRY_SNAPSHOT -> industrySnapshot(regular);
            case DEADLINES -> deadlines(regular, now);
            case DOCKET_SURGES -> docketSurges(regular);
            case BILL_ACTIONS -> sorted(SignalDeduplicator.latestPerGroup(SignalDeduplicator.groupByBill(regular)));
            case BUNDLES -> sorted(signals.stream().filter(ScoredSignal::isBundle).toList());
        };
    }

    private List<ScoredSignal> industrySnapshot(List<ScoredSignal> regular) {
        Map<String, Integer> perIndustry = new LinkedHashMap<>();
        List<ScoredSignal> picked = new ArrayList<>();
        for (ScoredSignal signal : sorted(regular)) {
            int count = perIndustry.getOrDefault(signal.industryTag(), 0);
            if (count < config.perIndustry()) {
                perIndustry.put(signal.industryTag(), count + 1);
                picked.add(signal);
            }
        }
        return picked;
    }

    private List<ScoredSignal> deadlines(List<ScoredSignal> regular, Instant now) {
        List<ScoredSignal> due = new ArrayList<>();
        for (ScoredSignal signal : regular) {
            Instant deadline = signal.signal().deadline();
            if (deadline == null) {
                continue;
            }
            long days = Timestamps.daysUntil(now, deadline);
            if (days >= 0 && days <= config.deadlineWindowDays()) {
                due.add(signal);
            }
        }
        due.sort(Comparator.comparing((ScoredSignal s) -> s.signal().deadline()).thenComparing(BY_PRIORITY));
        return due;
    }

    private List<ScoredSignal> docketSurges(List<ScoredSignal> regular) {
        Comparator<ScoredSignal> strongest = Comparator.comparingDouble(DigestComposer::surgePct).reversed()
                .thenComparing(BY_PRIORITY);
        List<ScoredSignal> surging = regular.stream()
                .filter(signal -> surgePct(signal) >= config.surgeThreshold())
                .toList();
        List<ScoredSignal> picked = new ArrayList<>();
        for (List<ScoredSignal> members : SignalDeduplicator.groupByDocket(surging).values()) {
            members.stream().min(strongest).ifPresent(picked::add);
        }
        picked.sort(strongest);
        return picked;
    }

    private String extraDetail(SectionKind kind, ScoredSignal signal) {
        return switch (kind) {
            case DEADLINES -> "Due " + DATE.format(signal.signal().deadline().atZone(zone()));
            case DOCKET_SURGES -> surgeDetail(signal);
            case WATCHLIST -> "Matches: " + String.join(", ", signal.watchlistMatches());
            case WHAT_CHANGED, INDUSTRY_SNAPSHOT, BILL_ACTIONS, BUNDLES -> null;
        };
    }

    private static String surgeDetail(ScoredSignal signal) {
        String pct = "Comments +" + Math.round(surgePct(signal)) + "%";
        OptionalDouble delta = MetricValues.numberOrEmpty(signal.signal().metrics(), MetricKeys.COMMENTS_24H_DELTA);
        return delta.isPresent() ? pct + " / +" + Math.round(delta.getAsDouble()) + " (24h)" : pct + " (24h)";
    }

    private String render(List<ScoredSignal> pool, List<DigestSection> sections, int overflow, Instant now) {
        List<String> lines = new ArrayList<>(header(pool, now));
        for (DigestSection section : sections) {
            lines.add("");
            lines.add(section.heading());
            lines.addAll(section.lines());
        }
        lines.add("");
        lines.add(footer(overflow, now));
        return String.join("\n", lines);
    }

    private List<String> header(List<ScoredSignal> pool, Instant now) {
        long bills = pool.stream().filter(signal -> signal.signalType() == SignalType.BILL).count();
        long federalRegister = pool.stream().filter(signal -> signal.signal().source() == Source.FEDERAL_REGISTER).count();
        long dockets = pool.stream().filter(signal -> signal.signalType() == SignalType.DOCKET).count();
        long watchlistHits = pool.stream().filter(ScoredSignal::watchlistHit).count();
        return List.of(
                titleLine(now),
                "Mini-stats: Bills " + bills + " · FR " + federalRegister + " · Dockets " + dockets
                        + " · Watchlist hits " + watchlistHits
        );
    }

    private String titleLine(Instant now) {
        return "🔍 " + ChatMarkup.bold("Government Signals — Daily Digest") + " ("
                + DATE.format(now.atZone(zone())) + ") · " + config.hoursBack() + "h";
    }

    private String footer(int overflow, Instant now) {
        String updated = "Updated " + TIME.format(now.atZone(zone()));
        return overflow > 0 ? "+" + overflow + " more items not shown · " + updated : updated;
    }

    private String noActivity(Instant now) {
        return String.join("\n", titleLine(now), "", NO_ACTIVITY_LINE, "", "Updated " + TIME.format(now.atZone(zone())));
    }

    private ZoneId zone() {
        return config.zoneId();
    }

    static double surgePct(ScoredSignal signal) {
        return MetricValues.numberOrEmpty(signal.signal().metrics(), MetricKeys.COMMENTS_24H_DELTA_PCT).orElse(0.0);
    }

    static List<ScoredSignal> sorted(List<ScoredSignal> signals) {
        List<ScoredSignal> copy = new ArrayList<>(signals);
        copy.sort(BY_PRIORITY);
        return copy;
    }
}
