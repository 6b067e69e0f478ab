package com.eainde.langextract.aggregation;

import java.util.Locale;

/**
 * How grounded extractions with overlapping intervals are reconciled.
 */
public enum OverlapStrategy {

    /** Keep the higher-confidence member of each overlapping pair. */
    KEEP_HIGHEST_CONFIDENCE,

    /** Keep the longer interval. */
    KEEP_LONGEST,

    /** Keep the earliest start. */
    KEEP_FIRST,

    /** Union overlapping intervals into one extraction. */
    MERGE_OVERLAPPING;

    /**
     * Accepts enum names as well as the short forms {@code highest_confidence},
     * {@code longest}, {@code first} and {@code merge}. Unknown values fall back to
     * {@link #KEEP_HIGHEST_CONFIDENCE}.
     */
    public static OverlapStrategy parse(String value) {
        if (value == null || value.isBlank()) {
            return KEEP_HIGHEST_CONFIDENCE;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return switch (normalized) {
            case "KEEP_LONGEST", "LONGEST" -> KEEP_LONGEST;
            case "KEEP_FIRST", "FIRST" -> KEEP_FIRST;
            case "MERGE_OVERLAPPING", "MERGE" -> MERGE_OVERLAPPING;
            default -> KEEP_HIGHEST_CONFIDENCE;
        };
    }
}
