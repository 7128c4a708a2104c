package com.govsignal.core.util;

import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

public final class MetricValues {
    private MetricValues() {
    }

    public static OptionalDouble number(Map<String, Object> metrics, String key) {
        Object value = metrics.get(key);
        if (value == null) {
            return OptionalDouble.empty();
        }
        if (value instanceof Number number) {
            return OptionalDouble.of(number.doubleValue());
        }
        if (value instanceof String text) {
            if (text.isBlank()) {
                return OptionalDouble.empty();
            }
            try {
                return OptionalDouble.of(Double.parseDouble(text.trim()));
            } catch (NumberFormatException ex) {
                throw new MetricFormatException(key, value);
            }
        }
        throw new MetricFormatException(key, value);
    }

    public static OptionalDouble numberOrEmpty(Map<String, Object> metrics, String key) {
        try {
            return number(metrics, key);
        } catch (MetricFormatException ex) {
            return OptionalDouble.empty();
        }
    }

    public static Optional<String> text(Map<String, Object> metrics, String key) {
        Object value = metrics.get(key);
        if (value == null) {
            return Optional.empty();
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }
}
