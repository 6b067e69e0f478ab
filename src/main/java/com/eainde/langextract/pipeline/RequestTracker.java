package com.eainde.langextract.pipeline;

import java.time.Duration;
import java.time.Instant;

/**
 * Live position of one running request. Written by the pipeline thread, read by the progress
 * reporter and {@code getActiveRequests()}; every field is volatile and no field is derived
 * from another, so torn reads only mix two valid positions.
 */
final class RequestTracker {

    private static final int STAGES = PipelineStage.values().length;

    private final String requestId;
    private final Instant startedAt = Instant.now();

    private volatile PipelineStage stage = PipelineStage.INITIALIZATION;
    private volatile String message = "";
    private volatile int currentPass;
    private volatile int totalPasses;
    private volatile int currentChunk;
    private volatile int totalChunks;
    private volatile boolean completed;

    RequestTracker(String requestId) {
        this.requestId = requestId;
    }

    String requestId() {
        return requestId;
    }

    void stage(PipelineStage stage, String message) {
        this.stage = stage;
        this.message = message;
    }

    void pass(int currentPass, int totalPasses) {
        this.currentPass = currentPass;
        this.totalPasses = totalPasses;
    }

    void chunk(int currentChunk, int totalChunks) {
        this.currentChunk = currentChunk;
        this.totalChunks = totalChunks;
    }

    void complete(String message) {
        this.message = message;
        this.completed = true;
    }

    ExtractionProgress snapshot() {
        return new ExtractionProgress(requestId, stage, progress(), message,
                Duration.between(startedAt, Instant.now()),
                currentPass, totalPasses, currentChunk, totalChunks);
    }

    private double progress() {
        if (completed) {
            return 1.0;
        }
        double within = 0.0;
        if (stage == PipelineStage.EXTRACTION && totalPasses > 0) {
            double chunkShare = totalChunks > 0 ? (double) Math.max(0, currentChunk - 1) / totalChunks : 0.0;
            within = (Math.max(0, currentPass - 1) + chunkShare) / totalPasses;
        }
        return Math.min(1.0, (stage.ordinal() + within) / STAGES);
    }
}
