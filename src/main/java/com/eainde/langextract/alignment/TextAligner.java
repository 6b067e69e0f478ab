package com.eainde.langextract.alignment;

import com.eainde.langextract.RequestContext;
import com.eainde.langextract.document.CharInterval;

import java.util.List;

/**
 * Locates model-produced text inside the source document.
 *
 * <p>All {@code align*} operations are total: they never throw for unmatched input and
 * always return a non-null interval.</p>
 */
public interface TextAligner {

    /**
     * Aligns one extracted text with no position hint and no outer context.
     */
    default AlignmentResult alignExtraction(String extracted, String source, AlignmentOptions options) {
        return alignExtraction(extracted, source, options, null, RequestContext.background());
    }

    /**
     * @param positionHint offset near which the match is expected, or {@code null}
     * @param context      request context; cancellation ends the search like a timeout
     */
    AlignmentResult alignExtraction(String extracted, String source, AlignmentOptions options,
                                    Integer positionHint, RequestContext context);

    /**
     * Aligns texts in order, using each accepted match's end as the hint for the next.
     */
    List<AlignmentResult> alignExtractions(List<String> extracted, String source, AlignmentOptions options,
                                           RequestContext context);

    /**
     * Runs every strategy and keeps the highest-quality result.
     */
    AlignmentResult findBestAlignment(String extracted, String source, AlignmentOptions options);

    /**
     * Confidence in {@code [0,1]} that {@code source[interval]} is the extracted text.
     *
     * @throws AlignmentException if the interval is null or outside the source
     */
    double validateAlignment(String extracted, String source, CharInterval interval);

    String name();
}
