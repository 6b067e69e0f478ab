package com.eainde.langextract.extraction;

import java.util.Locale;

/**
 * How an extraction's text was anchored in the source document.
 *
 * <p>Each status carries a nominal quality in {@code [0,100]}. Approximate matches compute
 * their own quality from the edit distance, so {@link #FUZZY_APPROXIMATE}'s nominal value
 * is only used when no computed score is available.</p>
 */
public enum AlignmentStatus {

    EXACT(100),
    FUZZY_CASE(85),
    FUZZY_WHITESPACE(70),
    FUZZY_APPROXIMATE(60),
    NONE(0);

    /**
     * Quality at or above which an alignment counts as well grounded.
     *
     * <p>{@link #isWellGrounded()} judges a status by its nominal quality. A single match can
     * score below its status: a match found only after stripping punctuation reports
     * {@link #FUZZY_WHITESPACE} with quality 55. For a concrete extraction use
     * {@link Extraction#isWellGrounded()}, which reads the match's own quality.</p>
     */
    public static final int WELL_GROUNDED_QUALITY = 60;

    private final int quality;

    AlignmentStatus(int quality) {
        this.quality = quality;
    }

    public int quality() {
        return quality;
    }

    /** Verdict for the nominal quality of this status, not for any particular match. */
    public boolean isWellGrounded() {
        return quality >= WELL_GROUNDED_QUALITY;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AlignmentStatus parse(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
