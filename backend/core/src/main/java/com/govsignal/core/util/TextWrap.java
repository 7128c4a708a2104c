package com.govsignal.core.util;

import java.util.List;

public final class TextWrap {
    private static final double TITLE_BREAK_RATIO = 0.6;
    private static final double SUMMARY_BREAK_RATIO = 0.8;
    private static final String ELLIPSIS = "...";

    private TextWrap() {
    }

    public static List<String> wrapTitle(String text, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        String value = text == null ? "" : text.trim();
        if (value.length() <= limit) {
            return List.of(value);
        }
        int space = value.lastIndexOf(' ', limit);
        if (space > limit * TITLE_BREAK_RATIO) {
            return List.of(value.substring(0, space), value.substring(space + 1).trim());
        }
        return List.of(value.substring(0, limit), value.substring(limit).trim());
    }

    public static String truncateSummary(String text, int limit) {
        if (limit <= ELLIPSIS.length()) {
            throw new IllegalArgumentException("limit must exceed " + ELLIPSIS.length() + ": " + limit);
        }
        String value = text == null ? "" : text.trim();
        if (value.length() <= limit) {
            return value;
        }
        int budget = limit - ELLIPSIS.length();
        int space = value.lastIndexOf(' ', budget);
        if (space > budget * SUMMARY_BREAK_RATIO) {
            return value.substring(0, space) + ELLIPSIS;
        }
        return value.substring(0, budget) + ELLIPSIS;
    }
}
