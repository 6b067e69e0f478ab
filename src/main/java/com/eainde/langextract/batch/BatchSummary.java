package com.eainde.langextract.batch;

import java.time.Duration;
import java.util.List;

/**
 * Result of a batch run; {@link #results()} follows the input order.
 */
public record BatchSummary(
        List<BatchItemResult> results,
        int succeeded,
        int failed,
        int skipped,
        Duration totalDuration,
        boolean aborted
) {

    public BatchSummary {
        results = List.copyOf(results);
    }

    public int total() {
        return results.size();
    }

    public int totalExtractions() {
        return results.stream().mapToInt(BatchItemResult::extractionCount).sum();
    }

    public List<BatchItemResult> failures() {
        return results.stream().filter(r -> r.status() == BatchItemResult.Status.FAILED).toList();
    }
}
