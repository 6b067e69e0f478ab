package com.eainde.langextract.pipeline;

import com.eainde.langextract.LangExtractException;

/**
 * A pipeline stage failed. The cause is the original error.
 */
public class ExtractionException extends LangExtractException {

    private final PipelineStage stage;

    public ExtractionException(PipelineStage stage, Throwable cause) {
        super(stage.label() + " failed: " + cause.getMessage(), cause);
        this.stage = stage;
    }

    public ExtractionException(PipelineStage stage, String message) {
        super(stage.label() + " failed: " + message);
        this.stage = stage;
    }

    public PipelineStage getStage() {
        return stage;
    }
}
