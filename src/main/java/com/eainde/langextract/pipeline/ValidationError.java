package com.eainde.langextract.pipeline;

/**
 * An extraction dropped by schema validation.
 */
public record ValidationError(
        Integer extractionIndex,
        String extractionClass,
        String extractionText,
        String field,
        String constraint,
        String message
) {
}
