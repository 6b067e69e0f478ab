package com.eainde.langextract.pipeline;

import java.time.Duration;

/**
 * Progress snapshot of a running request.
 *
 * @param progress fraction of the whole pipeline done, in {@code [0,1]}
 */
public record ExtractionProgress(
        String requestId,
        PipelineStage stage,
        double progress,
        String message,
        Duration elapsed,
        int currentPass,
        int totalPasses,
        int currentChunk,
        int totalChunks
) {
}
