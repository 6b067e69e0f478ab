package com.eainde.langextract.aggregation;

import com.eainde.langextract.extraction.Extraction;

import java.util.List;

/**
 * Output of one aggregation run with per-step counts.
 */
public record AggregationResult(
        List<Extraction> extractions,
        int originalCount,
        int duplicatesRemoved,
        int overlapsResolved,
        int lowConfidenceFiltered
) {

    public AggregationResult {
        extractions = List.copyOf(extractions);
    }

    public int finalCount() {
        return extractions.size();
    }
}
