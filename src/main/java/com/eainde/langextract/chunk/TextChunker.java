package com.eainde.langextract.chunk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits long documents into overlapping character windows so each model call stays within
 * the context budget.
 *
 * <h3>Usage:</h3>
 * <pre>
 * TextChunker chunker = TextChunker.builder()
 *         .maxChars(8000)
 *         .overlapChars(200)
 *         .build();
 *
 * if (chunker.needsChunking(text)) {
 *     List&lt;TextChunk&gt; chunks = chunker.chunk(text);
 * }
 * </pre>
 *
 * <p>Window ends are moved back to the last whitespace inside the window when there is one,
 * so words are not cut in half. Chunk offsets always refer to the full document.</p>
 */
public class TextChunker {

    private static final Logger log = LoggerFactory.getLogger(TextChunker.class);

    private final int maxChars;
    private final int overlapChars;

    private TextChunker(Builder builder) {
        this.maxChars = builder.maxChars;
        this.overlapChars = builder.overlapChars;

        if (maxChars <= 0) {
            throw new IllegalArgumentException("maxChars must be positive: " + maxChars);
        }
        if (overlapChars < 0 || overlapChars >= maxChars) {
            throw new IllegalArgumentException(
                    "overlapChars (" + overlapChars + ") must be >= 0 and < maxChars (" + maxChars + ")");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    public boolean needsChunking(String text) {
        return text != null && text.length() > maxChars;
    }

    /**
     * @return chunks covering the whole text in order, never empty
     */
    public List<TextChunk> chunk(String text) {
        if (text == null || text.length() <= maxChars) {
            String whole = text == null ? "" : text;
            return List.of(new TextChunk(0, 0, whole.length(), whole, 1));
        }

        List<int[]> bounds = new ArrayList<>();
        int start = 0;
        while (start < text.length()) {
            int end = Math.min(start + maxChars, text.length());
            if (end < text.length()) {
                int breakAt = lastWhitespace(text, start + overlapChars + 1, end);
                if (breakAt > 0) {
                    end = breakAt;
                }
            }
            bounds.add(new int[]{start, end});
            if (end >= text.length()) {
                break;
            }
            start = Math.max(end - overlapChars, start + 1);
        }

        int total = bounds.size();
        List<TextChunk> chunks = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            int[] b = bounds.get(i);
            chunks.add(new TextChunk(i, b[0], b[1], text.substring(b[0], b[1]), total));
        }

        log.info("Document of {} chars split into {} chunks (maxChars={}, overlap={})",
                text.length(), total, maxChars, overlapChars);
        chunks.forEach(c -> log.debug("  {}", c));
        return List.copyOf(chunks);
    }

    public int getMaxChars() {
        return maxChars;
    }

    public int getOverlapChars() {
        return overlapChars;
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    /** Position just after the last whitespace in {@code [from, to)}, or -1. */
    private static int lastWhitespace(String text, int from, int to) {
        for (int i = to - 1; i >= from; i--) {
            if (Character.isWhitespace(text.charAt(i))) {
                return i + 1;
            }
        }
        return -1;
    }

    // =========================================================================
    //  Builder
    // =========================================================================

    public static class Builder {
        private int maxChars = 8000;
        private int overlapChars = 200;

        public Builder maxChars(int maxChars) {
            this.maxChars = maxChars;
            return this;
        }

        public Builder overlapChars(int overlapChars) {
            this.overlapChars = overlapChars;
            return this;
        }

        public TextChunker build() {
            return new TextChunker(this);
        }
    }
}
