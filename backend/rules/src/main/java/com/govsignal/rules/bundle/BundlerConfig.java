package com.govsignal.rules.bundle;

import com.fasterxml.jackson.core.type.TypeReference;
import com.govsignal.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

public record BundlerConfig(
        Integer minClusterSize,
        List<String> escalationKeywords,
        List<BundleRule> rules
) {
    static final String RESOURCE = "/bundle-rules.json";

    public BundlerConfig {
        minClusterSize = minClusterSize == null ? 2 : minClusterSize;
        if (minClusterSize < 2) {
            throw new IllegalArgumentException("minClusterSize must be at least 2: " + minClusterSize);
        }
        escalationKeywords = escalationKeywords == null
                ? List.of("emergency", "immediate adoption")
                : List.copyOf(escalationKeywords);
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public static BundlerConfig defaults() {
        return Holder.DEFAULTS;
    }

    static BundlerConfig load(String resource) {
        try (InputStream input = BundlerConfig.class.getResourceAsStream(resource)) {
            if (input == null) {
                throw new IllegalStateException("Missing classpath resource " + resource);
            }
            return JsonUtils.objectMapper().readValue(input, new TypeReference<BundlerConfig>() {
            });
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading bundle rules from " + resource, e);
        }
    }

    private static final class Holder {
        private static final BundlerConfig DEFAULTS = load(RESOURCE);
    }
}
