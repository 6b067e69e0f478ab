package com.eainde.langextract.pipeline;

/**
 * Receives progress updates. Called from the pipeline thread and from a background timer,
 * so implementations must be thread-safe and return quickly.
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(ExtractionProgress progress);
}
