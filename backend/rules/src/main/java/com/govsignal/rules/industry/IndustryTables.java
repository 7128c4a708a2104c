package com.govsignal.rules.industry;

import com.fasterxml.jackson.core.type.TypeReference;
import com.govsignal.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

// Map iteration order is lookup priority.
public record IndustryTables(
        Map<String, String> issueCodes,
        Map<String, String> agencyKeywords,
        Map<String, String> topicKeywords
) {
    static final String RESOURCE = "/industry-tables.json";

    public IndustryTables {
        issueCodes = freeze(issueCodes);
        agencyKeywords = freeze(agencyKeywords);
        topicKeywords = freeze(topicKeywords);
    }

    public static IndustryTables defaults() {
        return Holder.DEFAULTS;
    }

    static IndustryTables load(String resource) {
        try (InputStream input = IndustryTables.class.getResourceAsStream(resource)) {
            if (input == null) {
                throw new IllegalStateException("Missing classpath resource " + resource);
            }
            return JsonUtils.objectMapper().readValue(input, new TypeReference<IndustryTables>() {
            });
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading industry tables from " + resource, e);
        }
    }

    private static Map<String, String> freeze(Map<String, String> table) {
        return table == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(table));
    }

    private static final class Holder {
        private static final IndustryTables DEFAULTS = load(RESOURCE);
    }
}
