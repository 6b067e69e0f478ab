package com.eainde.langextract.pipeline;

import com.eainde.langextract.LangExtractException;
import com.eainde.langextract.document.AnnotatedDocument;
import com.eainde.langextract.extraction.Extraction;
import com.eainde.langextract.provider.FailoverEvent;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of one pipeline run: extractions, execution metadata, quality metrics and the debug
 * trace.
 *
 * <p>The engine fills it in while the request runs and seals it when the pipeline ends, after
 * which it never changes. A failed run still carries everything accumulated before the
 * failure, so callers should read the extractions and steps even when
 * {@link #isSuccessful()} is false.</p>
 */
public final class ExtractionResponse {

    private final String requestId;
    private List<Extraction> extractions = List.of();
    private AnnotatedDocument annotatedDocument;

    private String providerUsed;
    private String modelUsed;
    private int tokensUsed;
    private int passesCompleted;

    private int extractionCount;
    private double textCoverage;
    private double confidenceScore;

    private final List<ValidationError> validationErrors = new ArrayList<>();
    private final List<ProcessingStep> steps = new ArrayList<>();
    private final List<FailoverEvent> failoverEvents = Collections.synchronizedList(new ArrayList<>());

    private LangExtractException error;
    private String errorCode;
    private Duration executionTime = Duration.ZERO;
    private volatile boolean sealed;

    ExtractionResponse(String requestId) {
        this.requestId = requestId;
    }

    // =========================================================================
    //  Read side
    // =========================================================================

    public String getRequestId() {
        return requestId;
    }

    /** Copies of the final extractions; changing them does not change the response. */
    public List<Extraction> getExtractions() {
        return extractions.stream().map(Extraction::copy).toList();
    }

    /** {@code null} unless finalization ran. */
    public AnnotatedDocument getAnnotatedDocument() {
        return annotatedDocument;
    }

    public String getProviderUsed() {
        return providerUsed;
    }

    public String getModelUsed() {
        return modelUsed;
    }

    public int getTokensUsed() {
        return tokensUsed;
    }

    public int getPassesCompleted() {
        return passesCompleted;
    }

    public int getExtractionCount() {
        return extractionCount;
    }

    /** Grounded fraction of the document, in {@code [0,1]}. */
    public double getTextCoverage() {
        return textCoverage;
    }

    /** Mean confidence of the extractions that carry one; 0 when none does. */
    public double getConfidenceScore() {
        return confidenceScore;
    }

    public List<ValidationError> getValidationErrors() {
        return Collections.unmodifiableList(validationErrors);
    }

    public List<ProcessingStep> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    public List<FailoverEvent> getFailoverEvents() {
        synchronized (failoverEvents) {
            return List.copyOf(failoverEvents);
        }
    }

    public LangExtractException getError() {
        return error;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isSuccessful() {
        return error == null;
    }

    public Duration getExecutionTime() {
        return executionTime;
    }

    public boolean isSealed() {
        return sealed;
    }

    // =========================================================================
    //  Write side (engine only)
    // =========================================================================

    void setExtractions(List<Extraction> extractions) {
        checkOpen();
        this.extractions = extractions.stream().map(Extraction::copy).toList();
        this.extractionCount = this.extractions.size();
    }

    void setAnnotatedDocument(AnnotatedDocument annotatedDocument) {
        checkOpen();
        this.annotatedDocument = annotatedDocument;
    }

    void setProviderUsed(String providerUsed, String modelUsed) {
        checkOpen();
        this.providerUsed = providerUsed;
        this.modelUsed = modelUsed;
    }

    void addTokens(int tokens) {
        checkOpen();
        this.tokensUsed += tokens;
    }

    void passCompleted() {
        checkOpen();
        this.passesCompleted++;
    }

    void setMetrics(double textCoverage, double confidenceScore) {
        checkOpen();
        this.textCoverage = textCoverage;
        this.confidenceScore = confidenceScore;
    }

    void addValidationError(ValidationError validationError) {
        checkOpen();
        validationErrors.add(validationError);
    }

    void addStep(ProcessingStep step) {
        checkOpen();
        steps.add(step);
    }

    void addFailoverEvent(FailoverEvent event) {
        checkOpen();
        failoverEvents.add(event);
    }

    void fail(LangExtractException error, String errorCode) {
        checkOpen();
        this.error = error;
        this.errorCode = errorCode;
    }

    void seal(Duration executionTime) {
        checkOpen();
        this.executionTime = executionTime;
        this.sealed = true;
    }

    private void checkOpen() {
        if (sealed) {
            throw new IllegalStateException("response " + requestId + " is sealed");
        }
    }

    @Override
    public String toString() {
        return "ExtractionResponse{id=" + requestId
                + ", successful=" + isSuccessful()
                + ", extractions=" + extractionCount
                + ", passes=" + passesCompleted
                + ", provider=" + providerUsed
                + ", coverage=" + String.format("%.2f", textCoverage)
                + ", time=" + executionTime.toMillis() + "ms}";
    }
}
