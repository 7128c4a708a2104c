package com.govsignal.service.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.govsignal.core.model.ScoredSignal;
import com.govsignal.core.model.Signal;
import com.govsignal.core.model.Source;
import com.govsignal.core.util.JsonUtils;
import com.govsignal.core.util.Timestamps;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

public class SignalCodec {
    private static final Logger LOGGER = Logger.getLogger(SignalCodec.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Clock clock;

    public SignalCodec(Clock clock) {
        this.clock = clock;
    }

    public List<Signal> readAll(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return fromTree(MAPPER.readTree(in), file.toString());
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading signals from " + file, e);
        }
    }

    public List<Signal> parse(String json) {
        try {
            return fromTree(MAPPER.readTree(json), "inline json");
        } catch (IOException e) {
            throw new IllegalStateException("Unable to parse signals", e);
        }
    }

    public Optional<Signal> fromNode(JsonNode node) {
        if (node == null || !node.isObject()) {
            LOGGER.warning("Skipping non-object signal record");
            return Optional.empty();
        }
        String sourceId = text(node, "sourceId");
        if (sourceId == null || sourceId.isBlank()) {
            LOGGER.warning(() -> "Skipping signal record without sourceId: " + abbreviate(node));
            return Optional.empty();
        }
        Source source = Source.fromWire(text(node, "source"));
        String label = source.wireName() + ":" + sourceId;

        Instant timestamp = parseInstant(node, "timestamp", label).orElseGet(clock::instant);
        Instant deadline = parseInstant(node, "deadline", label).orElse(null);

        return Optional.of(Signal.builder(source, sourceId, timestamp)
                .title(text(node, "title"))
                .summary(text(node, "summary"))
                .link(text(node, "link"))
                .agency(text(node, "agency"))
                .issueCodes(stringList(node.get("issueCodes")))
                .billId(text(node, "billId"))
                .docketId(text(node, "docketId"))
                .deadline(deadline)
                .metrics(metrics(node.get("metrics")))
                .build());
    }

    public static String toJson(List<ScoredSignal> signals) {
        List<StoredSignal> stored = new ArrayList<>();
        for (ScoredSignal signal : signals) {
            stored.add(StoredSignal.from(signal));
        }
        try {
            return MAPPER.writeValueAsString(stored);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize signals", e);
        }
    }

    private List<Signal> fromTree(JsonNode root, String origin) {
        if (root == null || !root.isArray()) {
            throw new IllegalStateException("Expected a JSON array of signals in " + origin);
        }
        List<Signal> signals = new ArrayList<>();
        for (JsonNode node : root) {
            fromNode(node).ifPresent(signals::add);
        }
        return signals;
    }

    private Optional<Instant> parseInstant(JsonNode node, String field, String label) {
        String raw = text(node, field);
        if (raw == null) {
            return Optional.empty();
        }
        Optional<Instant> parsed = Timestamps.parseUtc(raw);
        if (parsed.isEmpty()) {
            LOGGER.warning(() -> "Malformed " + field + " '" + raw + "' on " + label);
        }
        return parsed;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }

    private static List<String> stringList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node != null && node.isArray()) {
            for (JsonNode item : node) {
                if (item.isValueNode() && !item.isNull()) {
                    values.add(item.asText());
                }
            }
        }
        return values;
    }

    private static Map<String, Object> metrics(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        return MAPPER.convertValue(node, new TypeReference<Map<String, Object>>() {
        });
    }

    private static String abbreviate(JsonNode node) {
        String text = node.toString();
        return text.length() <= 120 ? text : text.substring(0, 120) + "...";
    }

    record StoredSignal(
            String source,
            String sourceId,
            String stableId,
            String title,
            String summary,
            String link,
            Instant timestamp,
            String agency,
            List<String> issueCodes,
            String billId,
            String docketId,
            Instant deadline,
            Map<String, Object> metrics,
            String signalType,
            String urgency,
            double priorityScore,
            String industryTag,
            List<String> watchlistMatches
    ) {
        static StoredSignal from(ScoredSignal scored) {
            Signal signal = scored.signal();
            return new StoredSignal(
                    signal.source().wireName(),
                    signal.sourceId(),
                    signal.stableId(),
                    signal.title(),
                    signal.summary(),
                    signal.link(),
                    signal.timestamp(),
                    signal.agency(),
                    signal.issueCodes(),
                    signal.billId(),
                    signal.docketId(),
                    signal.deadline(),
                    signal.metrics(),
                    scored.signalType().wireName(),
                    scored.urgency().wireName(),
                    scored.priorityScore(),
                    scored.industryTag(),
                    scored.watchlistMatches()
            );
        }
    }
}
