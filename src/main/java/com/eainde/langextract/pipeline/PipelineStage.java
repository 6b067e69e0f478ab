package com.eainde.langextract.pipeline;

import java.util.Locale;

/**
 * Pipeline stages, in execution order.
 */
public enum PipelineStage {
    INITIALIZATION,
    PREPROCESSING,
    EXTRACTION,
    AGGREGATION,
    VALIDATION,
    FINALIZATION;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
