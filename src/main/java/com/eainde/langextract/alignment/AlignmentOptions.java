package com.eainde.langextract.alignment;

import lombok.Getter;

/**
 * Tuning knobs for {@link TextAligner}.
 *
 * <pre>
 * AlignmentOptions options = AlignmentOptions.builder()
 *         .caseSensitive(false)
 *         .ignoreWhitespace(true)
 *         .maxDistance(5)
 *         .minConfidence(0.7)
 *         .build();
 * </pre>
 */
@Getter
public final class AlignmentOptions {

    private final boolean caseSensitive;
    private final boolean ignoreWhitespace;
    private final boolean ignorePunctuation;
    /** Maximum edit distance accepted by approximate matching; 0 disables it. */
    private final int maxDistance;
    /** Minimum confidence in {@code [0,1]} an approximate match must reach. */
    private final double minConfidence;
    /** Approximate candidates kept for ranking. */
    private final int maxCandidates;
    /** Characters searched on each side of a position hint. */
    private final int windowSize;
    private final long timeoutMs;

    private AlignmentOptions(Builder b) {
        this.caseSensitive = b.caseSensitive;
        this.ignoreWhitespace = b.ignoreWhitespace;
        this.ignorePunctuation = b.ignorePunctuation;
        this.maxDistance = b.maxDistance;
        this.minConfidence = b.minConfidence;
        this.maxCandidates = b.maxCandidates;
        this.windowSize = b.windowSize;
        this.timeoutMs = b.timeoutMs;
    }

    public static AlignmentOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .caseSensitive(caseSensitive)
                .ignoreWhitespace(ignoreWhitespace)
                .ignorePunctuation(ignorePunctuation)
                .maxDistance(maxDistance)
                .minConfidence(minConfidence)
                .maxCandidates(maxCandidates)
                .windowSize(windowSize)
                .timeoutMs(timeoutMs);
    }

    /**
     * @throws AlignmentException if any option is out of range
     */
    public void validate() {
        if (maxDistance < 0) {
            throw new AlignmentException("max distance cannot be negative: " + maxDistance);
        }
        if (minConfidence < 0.0 || minConfidence > 1.0) {
            throw new AlignmentException("min confidence must be between 0.0 and 1.0: " + minConfidence);
        }
        if (maxCandidates <= 0) {
            throw new AlignmentException("max candidates must be positive: " + maxCandidates);
        }
        if (windowSize < 0) {
            throw new AlignmentException("window size cannot be negative: " + windowSize);
        }
        if (timeoutMs <= 0) {
            throw new AlignmentException("timeout must be positive: " + timeoutMs);
        }
    }

    @Override
    public String toString() {
        return "AlignmentOptions{caseSensitive=" + caseSensitive
                + ", ignoreWhitespace=" + ignoreWhitespace
                + ", ignorePunctuation=" + ignorePunctuation
                + ", maxDistance=" + maxDistance
                + ", minConfidence=" + minConfidence
                + ", maxCandidates=" + maxCandidates
                + ", windowSize=" + windowSize
                + ", timeoutMs=" + timeoutMs + "}";
    }

    public static final class Builder {
        private boolean caseSensitive = false;
        private boolean ignoreWhitespace = true;
        private boolean ignorePunctuation = false;
        private int maxDistance = 5;
        private double minConfidence = 0.7;
        private int maxCandidates = 10;
        private int windowSize = 100;
        private long timeoutMs = 5000;

        private Builder() {
        }

        public Builder caseSensitive(boolean caseSensitive) {
            this.caseSensitive = caseSensitive;
            return this;
        }

        public Builder ignoreWhitespace(boolean ignoreWhitespace) {
            this.ignoreWhitespace = ignoreWhitespace;
            return this;
        }

        public Builder ignorePunctuation(boolean ignorePunctuation) {
            this.ignorePunctuation = ignorePunctuation;
            return this;
        }

        public Builder maxDistance(int maxDistance) {
            this.maxDistance = maxDistance;
            return this;
        }

        public Builder minConfidence(double minConfidence) {
            this.minConfidence = minConfidence;
            return this;
        }

        public Builder maxCandidates(int maxCandidates) {
            this.maxCandidates = maxCandidates;
            return this;
        }

        public Builder windowSize(int windowSize) {
            this.windowSize = windowSize;
            return this;
        }

        public Builder timeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public AlignmentOptions build() {
            AlignmentOptions options = new AlignmentOptions(this);
            options.validate();
            return options;
        }
    }
}
