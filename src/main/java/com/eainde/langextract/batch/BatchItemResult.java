package com.eainde.langextract.batch;

import com.eainde.langextract.pipeline.ExtractionResponse;

import java.time.Duration;

/**
 * Outcome of one batch item.
 *
 * @param response {@code null} for skipped items
 * @param error    failure message, or the skip reason
 */
public record BatchItemResult(
        String id,
        Status status,
        ExtractionResponse response,
        String error,
        Duration duration,
        int extractionCount
) {

    public enum Status {
        SUCCEEDED,
        FAILED,
        SKIPPED
    }

    static BatchItemResult success(String id, ExtractionResponse response, Duration duration) {
        return new BatchItemResult(id, Status.SUCCEEDED, response, null, duration, response.getExtractionCount());
    }

    static BatchItemResult failure(String id, ExtractionResponse response, String error, Duration duration) {
        int count = response == null ? 0 : response.getExtractionCount();
        return new BatchItemResult(id, Status.FAILED, response, error, duration, count);
    }

    static BatchItemResult skipped(String id, String reason) {
        return new BatchItemResult(id, Status.SKIPPED, null, reason, Duration.ZERO, 0);
    }

    public boolean isSuccess() {
        return status == Status.SUCCEEDED;
    }
}
