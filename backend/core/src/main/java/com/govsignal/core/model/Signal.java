package com.govsignal.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public record Signal(
        Source source,
        String sourceId,
        String title,
        String summary,
        String link,
        Instant timestamp,
        String agency,
        List<String> issueCodes,
        String billId,
        String docketId,
        Instant deadline,
        Map<String, Object> metrics
) {
    public Signal {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        title = title == null ? "" : title.trim();
        summary = summary == null ? "" : summary.trim();
        link = link == null ? "" : link.trim();
        agency = blankToNull(agency);
        billId = blankToNull(billId);
        docketId = blankToNull(docketId);
        issueCodes = normalizeCodes(issueCodes);
        metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }

    public static Builder builder(Source source, String sourceId, Instant timestamp) {
        return new Builder(source, sourceId, timestamp);
    }

    public Builder toBuilder() {
        return new Builder(source, sourceId, timestamp)
                .title(title)
                .summary(summary)
                .link(link)
                .agency(agency)
                .issueCodes(issueCodes)
                .billId(billId)
                .docketId(docketId)
                .deadline(deadline)
                .metrics(metrics);
    }

    public String stableId() {
        return source.wireName() + ":" + sourceId;
    }

    public String contentText() {
        return (title + " " + summary + " " + (agency == null ? "" : agency)).toLowerCase(Locale.ROOT);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static List<String> normalizeCodes(List<String> codes) {
        if (codes == null || codes.isEmpty()) {
            return List.of();
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String code : codes) {
            if (code != null && !code.isBlank()) {
                unique.add(code.trim().toUpperCase(Locale.ROOT));
            }
        }
        return List.copyOf(unique);
    }

    public static final class Builder {
        private final Source source;
        private final String sourceId;
        private final Instant timestamp;
        private String title;
        private String summary;
        private String link;
        private String agency;
        private List<String> issueCodes = new ArrayList<>();
        private String billId;
        private String docketId;
        private Instant deadline;
        private final Map<String, Object> metrics = new LinkedHashMap<>();

        private Builder(Source source, String sourceId, Instant timestamp) {
            this.source = source;
            this.sourceId = sourceId;
            this.timestamp = timestamp;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder link(String link) {
            this.link = link;
            return this;
        }

        public Builder agency(String agency) {
            this.agency = agency;
            return this;
        }

        public Builder issueCodes(List<String> issueCodes) {
            this.issueCodes = issueCodes == null ? new ArrayList<>() : new ArrayList<>(issueCodes);
            return this;
        }

        public Builder billId(String billId) {
            this.billId = billId;
            return this;
        }

        public Builder docketId(String docketId) {
            this.docketId = docketId;
            return this;
        }

        public Builder deadline(Instant deadline) {
            this.deadline = deadline;
            return this;
        }

        public Builder metric(String key, Object value) {
            metrics.put(key, value);
            return this;
        }

        public Builder metrics(Map<String, Object> values) {
            metrics.clear();
            if (values != null) {
                metrics.putAll(values);
            }
            return this;
        }

        public Signal build() {
            return new Signal(
                    source,
                    sourceId,
                    title,
                    summary,
                    link,
                    timestamp,
                    agency,
                    issueCodes,
                    billId,
                    docketId,
                    deadline,
                    metrics
            );
        }
    }
}
