package com.govsignal.core.util;

public class MetricFormatException extends IllegalArgumentException {
    private final String key;

    public MetricFormatException(String key, Object value) {
        super("Metric '" + key + "' has unexpected value of type " + value.getClass().getSimpleName());
        this.key = key;
    }

    public String key() {
        return key;
    }
}
