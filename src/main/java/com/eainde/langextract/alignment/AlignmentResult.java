package com.eainde.langextract.alignment;

import com.eainde.langextract.document.CharInterval;
import com.eainde.langextract.extraction.AlignmentStatus;

import java.util.List;

/**
 * Outcome of aligning one extracted text against its source.
 *
 * <p>The interval is never null: an unanchored result carries {@link CharInterval#EMPTY}
 * with status {@link AlignmentStatus#NONE}.</p>
 *
 * @param interval         matched range in the source (or {@code [0,0)})
 * @param status           which strategy produced the match
 * @param quality          0-100 score; fixed per status except for approximate matches
 * @param confidence       {@code quality / 100}
 * @param extractedText    the text that was aligned
 * @param alignedText      the source text inside {@code interval}
 * @param method           name of the winning strategy, {@code "none"} if unanchored
 * @param editDistance     edit distance of the match (0 for exact and normalized matches)
 * @param attemptedMethods strategies tried, in order
 * @param elapsedMillis    wall time spent
 * @param timedOut         true if the timeout or a cancellation cut the search short
 */
public record AlignmentResult(
        CharInterval interval,
        AlignmentStatus status,
        int quality,
        double confidence,
        String extractedText,
        String alignedText,
        String method,
        int editDistance,
        List<String> attemptedMethods,
        long elapsedMillis,
        boolean timedOut
) {

    public AlignmentResult {
        attemptedMethods = attemptedMethods == null ? List.of() : List.copyOf(attemptedMethods);
    }

    static AlignmentResult none(String extractedText, List<String> attempted, long elapsedMillis, boolean timedOut) {
        return new AlignmentResult(CharInterval.EMPTY, AlignmentStatus.NONE, 0, 0.0,
                extractedText, "", "none", -1, attempted, elapsedMillis, timedOut);
    }

    public boolean isMatched() {
        return status != AlignmentStatus.NONE;
    }

    public boolean isWellGrounded() {
        return isMatched() && quality >= AlignmentStatus.WELL_GROUNDED_QUALITY;
    }

    @Override
    public String toString() {
        return "AlignmentResult{pos=" + interval + ", status=" + status.label()
                + ", quality=" + quality + ", method=" + method + "}";
    }
}
