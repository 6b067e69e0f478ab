package com.eainde.langextract.pipeline;

import com.eainde.langextract.aggregation.OverlapStrategy;
import com.eainde.langextract.alignment.AlignmentOptions;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Engine-wide defaults. Per-request settings in {@link ExtractionRequest} take precedence.
 */
@Value
@Builder(toBuilder = true)
public class EngineConfig {

    @Builder.Default
    Duration defaultTimeout = Duration.ofSeconds(60);

    /** When on, requests without an explicit pass count get one from the text length. */
    @Builder.Default
    boolean multiPassEnabled = false;
    @Builder.Default
    int maxPasses = 3;
    /** Passes stop once new extractions make up less than this share of the total. */
    @Builder.Default
    double passImprovementThreshold = 0.1;

    @Builder.Default
    boolean deduplicationEnabled = true;
    @Builder.Default
    double confidenceThreshold = 0.5;
    @Builder.Default
    OverlapStrategy overlapStrategy = OverlapStrategy.KEEP_HIGHEST_CONFIDENCE;

    @Builder.Default
    boolean progressTrackingEnabled = true;
    @Builder.Default
    Duration progressInterval = Duration.ofSeconds(1);

    /** Documents longer than this are chunked; 0 disables chunking. */
    @Builder.Default
    int chunkMaxChars = 0;
    @Builder.Default
    int chunkOverlapChars = 200;

    @Builder.Default
    AlignmentOptions alignmentOptions = AlignmentOptions.defaults();

    public static EngineConfig defaults() {
        return builder().build();
    }

    public boolean isChunkingEnabled() {
        return chunkMaxChars > 0;
    }

    /**
     * 1 pass below 5,000 characters, 2 below 10,000, else 3, capped by {@link #maxPasses}.
     */
    public int passesFor(int textLength) {
        int passes = textLength < 5_000 ? 1 : textLength < 10_000 ? 2 : 3;
        return Math.max(1, Math.min(passes, maxPasses));
    }
}
