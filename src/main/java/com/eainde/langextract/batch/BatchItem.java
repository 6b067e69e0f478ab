package com.eainde.langextract.batch;

import com.eainde.langextract.pipeline.ExtractionRequest;

import java.util.Objects;

/**
 * One document of a batch run.
 */
public record BatchItem(String id, ExtractionRequest request) {

    public BatchItem {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(request, "request");
    }

    public static BatchItem of(ExtractionRequest request) {
        return new BatchItem(request.getRequestId(), request);
    }
}
