package com.eainde.langextract.pipeline;

import com.eainde.langextract.RequestContext;
import com.eainde.langextract.document.Document;
import com.eainde.langextract.extraction.ExampleData;
import com.eainde.langextract.schema.ExtractionSchema;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * One unit of pipeline work.
 *
 * <pre>
 * ExtractionRequest request = ExtractionRequest.builder()
 *         .text("John Smith works at Google Inc.")
 *         .taskDescription("Extract people and organizations")
 *         .schema(schema)
 *         .passes(2)
 *         .build();
 * </pre>
 *
 * <p>The request is immutable. Unset retry and pass counts are resolved by the engine during
 * initialization, not here, so a request can be validated and defaulted in one place.</p>
 */
public final class ExtractionRequest {

    private final String requestId;
    private final Document document;
    private final String text;
    private final String additionalContext;
    private final String taskDescription;
    private final List<ExampleData> examples;
    private final ExtractionSchema schema;
    private final String providerId;
    private final String modelId;
    private final Double temperature;
    private final Integer maxTokens;
    private final Duration timeout;
    private final Integer retryCount;
    private final Integer passes;
    private final boolean validateOutput;
    private final RequestContext context;
    private final ProgressListener progressListener;

    private ExtractionRequest(Builder b) {
        this.requestId = b.requestId != null ? b.requestId : "req_" + UUID.randomUUID().toString().replace("-", "");
        this.document = b.document;
        this.text = b.text;
        this.additionalContext = b.additionalContext;
        this.taskDescription = b.taskDescription;
        this.examples = b.examples == null ? List.of() : List.copyOf(b.examples);
        this.schema = b.schema;
        this.providerId = b.providerId;
        this.modelId = b.modelId;
        this.temperature = b.temperature;
        this.maxTokens = b.maxTokens;
        this.timeout = b.timeout;
        this.retryCount = b.retryCount;
        this.passes = b.passes;
        this.validateOutput = b.validateOutput;
        this.context = b.context;
        this.progressListener = b.progressListener;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getRequestId() {
        return requestId;
    }

    public Document getDocument() {
        return document;
    }

    public String getText() {
        return text;
    }

    public String getAdditionalContext() {
        return additionalContext;
    }

    public String getTaskDescription() {
        return taskDescription;
    }

    public List<ExampleData> getExamples() {
        return examples;
    }

    public ExtractionSchema getSchema() {
        return schema;
    }

    public String getProviderId() {
        return providerId;
    }

    public String getModelId() {
        return modelId;
    }

    public Double getTemperature() {
        return temperature;
    }

    public Integer getMaxTokens() {
        return maxTokens;
    }

    /** {@code null} means the engine's default timeout. */
    public Duration getTimeout() {
        return timeout;
    }

    /** {@code null} or negative means the default of 2. */
    public Integer getRetryCount() {
        return retryCount;
    }

    /** {@code null} or below 1 means unset. */
    public Integer getPasses() {
        return passes;
    }

    public boolean isValidateOutput() {
        return validateOutput;
    }

    public RequestContext getContext() {
        return context;
    }

    public ProgressListener getProgressListener() {
        return progressListener;
    }

    /** Text length as the heuristics see it: the document's, else the raw text's, else 0. */
    int sourceLength() {
        if (document != null) {
            return document.length();
        }
        return text == null ? 0 : text.strip().length();
    }

    @Override
    public String toString() {
        return "ExtractionRequest{id=" + requestId + ", provider=" + providerId + ", model=" + modelId
                + ", passes=" + passes + ", retryCount=" + retryCount + "}";
    }

    public static final class Builder {
        private String requestId;
        private Document document;
        private String text;
        private String additionalContext;
        private String taskDescription;
        private List<ExampleData> examples;
        private ExtractionSchema schema;
        private String providerId;
        private String modelId;
        private Double temperature;
        private Integer maxTokens;
        private Duration timeout;
        private Integer retryCount;
        private Integer passes;
        private boolean validateOutput = true;
        private RequestContext context;
        private ProgressListener progressListener;

        private Builder() {
        }

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder document(Document document) {
            this.document = document;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder additionalContext(String additionalContext) {
            this.additionalContext = additionalContext;
            return this;
        }

        public Builder taskDescription(String taskDescription) {
            this.taskDescription = taskDescription;
            return this;
        }

        public Builder examples(List<ExampleData> examples) {
            this.examples = examples;
            return this;
        }

        public Builder schema(ExtractionSchema schema) {
            this.schema = schema;
            return this;
        }

        public Builder providerId(String providerId) {
            this.providerId = providerId;
            return this;
        }

        public Builder modelId(String modelId) {
            this.modelId = modelId;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder maxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder retryCount(Integer retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder passes(Integer passes) {
            this.passes = passes;
            return this;
        }

        public Builder validateOutput(boolean validateOutput) {
            this.validateOutput = validateOutput;
            return this;
        }

        public Builder context(RequestContext context) {
            this.context = context;
            return this;
        }

        public Builder progressListener(ProgressListener progressListener) {
            this.progressListener = progressListener;
            return this;
        }

        public ExtractionRequest build() {
            return new ExtractionRequest(this);
        }
    }
}
