package com.eainde.langextract.pipeline;

import java.time.Duration;
import java.time.Instant;

/**
 * One entry of a response's debug trace.
 */
public record ProcessingStep(
        PipelineStage stage,
        StepStatus status,
        Instant timestamp,
        Duration duration,
        String message
) {

    @Override
    public String toString() {
        return stage.label() + "[" + status.label() + ", " + duration.toMillis() + " ms]: " + message;
    }
}
