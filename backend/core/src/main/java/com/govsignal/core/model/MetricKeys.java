package com.govsignal.core.model;

public final class MetricKeys {
    public static final String COMMENTS_24H_DELTA_PCT = "comments_24h_delta_pct";
    public static final String COMMENTS_24H_DELTA = "comments_24h_delta";
    public static final String COMMENT_COUNT = "comment_count";
    public static final String DOCUMENT_TYPE = "document_type";
    public static final String ACTION_TYPE = "action_type";
    public static final String BUNDLED_COUNT = "bundledCount";
    public static final String BUNDLE_RULE = "bundleRule";

    private MetricKeys() {
    }
}
