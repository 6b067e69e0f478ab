package com.eainde.langextract.batch;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class BatchConfig {

    /** Items processed at the same time. */
    @Builder.Default
    int concurrency = 4;
    /** Failures after which submission stops, unless {@link #continueOnError}; 0 means no limit. */
    @Builder.Default
    int maxErrors = 10;
    @Builder.Default
    boolean continueOnError = false;

    public static BatchConfig defaults() {
        return builder().build();
    }
}
