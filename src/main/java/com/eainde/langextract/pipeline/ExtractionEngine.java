package com.eainde.langextract.pipeline;

import com.eainde.langextract.LangExtractException;
import com.eainde.langextract.RequestCancelledException;
import com.eainde.langextract.RequestContext;
import com.eainde.langextract.aggregation.AggregationResult;
import com.eainde.langextract.aggregation.ExtractionAggregator;
import com.eainde.langextract.alignment.AlignmentResult;
import com.eainde.langextract.alignment.TextAligner;
import com.eainde.langextract.chunk.TextChunk;
import com.eainde.langextract.chunk.TextChunker;
import com.eainde.langextract.document.AnnotatedDocument;
import com.eainde.langextract.document.Document;
import com.eainde.langextract.extraction.AlignmentStatus;
import com.eainde.langextract.extraction.ExampleData;
import com.eainde.langextract.extraction.Extraction;
import com.eainde.langextract.extraction.ExtractionParser;
import com.eainde.langextract.extraction.PromptBuilder;
import com.eainde.langextract.extraction.ResponseParseException;
import com.eainde.langextract.provider.GatewayCacheStats;
import com.eainde.langextract.provider.GatewayRequest;
import com.eainde.langextract.provider.GatewayResponse;
import com.eainde.langextract.provider.ModelConfig;
import com.eainde.langextract.provider.ProviderException;
import com.eainde.langextract.provider.ProviderGateway;
import com.eainde.langextract.provider.ProviderHealthReport;
import com.eainde.langextract.schema.ExtractionSchema;
import com.eainde.langextract.schema.ResponseSchemaConverter;
import com.eainde.langextract.schema.SchemaValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Runs extraction requests through the six pipeline stages.
 *
 * <h3>Stages:</h3>
 * <pre>
 * initialization  validate the request, resolve retry and pass counts        (fatal)
 * preprocessing   build the Document, trim, reject empty text, chunk         (fatal)
 * extraction      N passes: prompt → gateway → parse → align
 *                 pass 1 failure is fatal; later failures stop the passes and keep results
 * aggregation     deduplicate → resolve overlaps → confidence filter
 * validation      schema check; invalid extractions dropped and recorded
 * finalization    AnnotatedDocument, coverage, mean confidence
 * </pre>
 *
 * <p>{@link #process(ExtractionRequest)} never throws for pipeline failures: the error is put
 * on the returned response together with everything produced before it. Each stage appends a
 * {@link ProcessingStep} to the response trace.</p>
 *
 * <p>Thread-safe: requests run on the caller's thread and share only the active-request
 * registry and the gateway's health counters.</p>
 */
@Log4j2
public class ExtractionEngine implements AutoCloseable {

    static final String MDC_REQUEST_ID = "requestId";

    private final EngineConfig config;
    private final ProviderGateway gateway;
    private final TextAligner aligner;
    private final ExtractionAggregator aggregator;
    private final ExtractionParser parser;
    private final ActiveRequestRegistry registry = new ActiveRequestRegistry();
    private final ProgressReporter progressReporter;

    public ExtractionEngine(EngineConfig config, ProviderGateway gateway, TextAligner aligner,
                            ExtractionAggregator aggregator, ObjectMapper objectMapper) {
        this.config = config == null ? EngineConfig.defaults() : config;
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.aligner = Objects.requireNonNull(aligner, "aligner");
        this.aggregator = aggregator != null ? aggregator
                : new ExtractionAggregator(this.config.getOverlapStrategy(), this.config.getConfidenceThreshold());
        this.parser = new ExtractionParser(objectMapper == null ? new ObjectMapper() : objectMapper);
        this.progressReporter = new ProgressReporter(registry);
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * Runs the pipeline. Failures are reported on the response, never thrown.
     */
    public ExtractionResponse process(ExtractionRequest request) {
        Objects.requireNonNull(request, "request");
        Instant started = Instant.now();
        ExtractionResponse response = new ExtractionResponse(request.getRequestId());
        RequestContext context = contextFor(request);
        RequestTracker tracker = new RequestTracker(request.getRequestId());
        RunState state = new RunState(request, context, tracker, response);

        String previousRequestId = MDC.get(MDC_REQUEST_ID);
        MDC.put(MDC_REQUEST_ID, request.getRequestId());
        Runnable stopTicker = () -> { };
        boolean registered = false;
        try {
            registry.register(tracker);
            registered = true;
            if (request.getProgressListener() != null && config.isProgressTrackingEnabled()) {
                stopTicker = progressReporter.start(tracker, request.getProgressListener(), context,
                        config.getProgressInterval());
            }
            log.info("Processing request {}", request);

            runStage(state, PipelineStage.INITIALIZATION, () -> initialize(state));
            runStage(state, PipelineStage.PREPROCESSING, () -> preprocess(state));
            runStage(state, PipelineStage.EXTRACTION, () -> extract(state));
            runStage(state, PipelineStage.AGGREGATION, () -> aggregate(state));
            runStage(state, PipelineStage.VALIDATION, () -> validate(state));
            runStage(state, PipelineStage.FINALIZATION, () -> finalizeResponse(state));

            tracker.complete("completed");
            notifyProgress(state);
            log.info("Request {} completed: {} extractions, {} passes, provider={}",
                    request.getRequestId(), response.getExtractionCount(), response.getPassesCompleted(),
                    response.getProviderUsed());
        } catch (LangExtractException e) {
            response.fail(e, errorCode(e));
            log.error("Request {} failed: {}", request.getRequestId(), e.getMessage());
        } finally {
            stopTicker.run();
            if (registered) {
                registry.unregister(request.getRequestId());
            }
            response.seal(Duration.between(started, Instant.now()));
            if (previousRequestId != null) {
                MDC.put(MDC_REQUEST_ID, previousRequestId);
            } else {
                MDC.remove(MDC_REQUEST_ID);
            }
        }
        return response;
    }

    /**
     * Like {@link #process(ExtractionRequest)} but throws the pipeline error, if any.
     */
    public ExtractionResponse processOrThrow(ExtractionRequest request) {
        ExtractionResponse response = process(request);
        if (!response.isSuccessful()) {
            throw response.getError();
        }
        return response;
    }

    /** Progress snapshots of the requests running right now, keyed by request id. */
    public Map<String, ExtractionProgress> getActiveRequests() {
        return registry.snapshot();
    }

    public Map<String, ProviderHealthReport> getProviderHealth() {
        return gateway.getProviderHealth();
    }

    public GatewayCacheStats getCacheStats() {
        return gateway.getCacheStats();
    }

    public EngineConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        progressReporter.close();
    }

    // =========================================================================
    //  Stage runner
    // =========================================================================

    private void runStage(RunState state, PipelineStage stage, Supplier<StageOutcome> action) {
        state.tracker.stage(stage, stage.label());
        notifyProgress(state);
        Instant start = Instant.now();
        try {
            StageOutcome outcome = action.get();
            state.response.addStep(new ProcessingStep(stage, outcome.status(), start,
                    Duration.between(start, Instant.now()), outcome.message()));
            log.debug("Stage {} {}: {}", stage.label(), outcome.status().label(), outcome.message());
        } catch (RuntimeException e) {
            state.response.addStep(new ProcessingStep(stage, StepStatus.ERROR, start,
                    Duration.between(start, Instant.now()), String.valueOf(e.getMessage())));
            if (e instanceof ExtractionException || e instanceof RequestCancelledException
                    || e instanceof RequestValidationException) {
                throw e;
            }
            if (!(e instanceof LangExtractException)) {
                log.error("Unexpected failure in stage {}", stage.label(), e);
            }
            throw new ExtractionException(stage, e);
        }
    }

    private record StageOutcome(StepStatus status, String message) {
        static StageOutcome success(String message) {
            return new StageOutcome(StepStatus.SUCCESS, message);
        }

        static StageOutcome warning(String message) {
            return new StageOutcome(StepStatus.WARNING, message);
        }

        static StageOutcome skipped(String message) {
            return new StageOutcome(StepStatus.SKIPPED, message);
        }
    }

    // =========================================================================
    //  Stages
    // =========================================================================

    // ── STEP 1: Initialization ──
    private StageOutcome initialize(RunState state) {
        ExtractionRequest request = state.request;
        boolean hasDocument = request.getDocument() != null;
        boolean hasText = request.getText() != null && !request.getText().isEmpty();
        if (!hasDocument && !hasText) {
            throw new RequestValidationException("request has no document or text");
        }
        if (request.getTaskDescription() == null || request.getTaskDescription().isBlank()) {
            throw new RequestValidationException("task description cannot be empty");
        }
        for (ExampleData example : request.getExamples()) {
            try {
                example.validate();
            } catch (IllegalArgumentException e) {
                throw new RequestValidationException("invalid example: " + e.getMessage(), e);
            }
        }

        state.retryCount = request.getRetryCount() == null || request.getRetryCount() < 0
                ? 2 : request.getRetryCount();
        if (request.getPasses() != null && request.getPasses() >= 1) {
            state.passes = request.getPasses();
        } else if (config.isMultiPassEnabled()) {
            state.passes = config.passesFor(request.sourceLength());
        } else {
            state.passes = 1;
        }
        return StageOutcome.success("passes=" + state.passes + ", retryCount=" + state.retryCount);
    }

    // ── STEP 2: Preprocessing ──
    private StageOutcome preprocess(RunState state) {
        ExtractionRequest request = state.request;
        Document document = request.getDocument() != null
                ? request.getDocument()
                : new Document(request.getText().strip(), request.getAdditionalContext());
        if (document.isEmpty()) {
            throw new RequestValidationException("document text is empty after trimming");
        }
        state.document = document;

        if (config.isChunkingEnabled()) {
            TextChunker chunker = TextChunker.builder()
                    .maxChars(config.getChunkMaxChars())
                    .overlapChars(Math.min(config.getChunkOverlapChars(), config.getChunkMaxChars() - 1))
                    .build();
            state.chunks = chunker.chunk(document.getText());
        } else {
            state.chunks = List.of(new TextChunk(0, 0, document.length(), document.getText(), 1));
        }
        return StageOutcome.success("document " + document.getDocumentId() + ": " + document.length()
                + " chars, " + state.chunks.size() + " chunk(s)");
    }

    // ── STEP 3: Extraction passes ──
    private StageOutcome extract(RunState state) {
        ModelConfig modelConfig = modelConfigFor(state.request);
        Set<String> seen = new HashSet<>();
        String stopReason = null;
        boolean laterPassFailed = false;

        for (int pass = 1; pass <= state.passes; pass++) {
            state.tracker.pass(pass, state.passes);
            List<Extraction> passExtractions;
            try {
                passExtractions = runPass(state, modelConfig, pass);
            } catch (RequestCancelledException e) {
                throw e;
            } catch (ProviderException | ResponseParseException e) {
                if (pass == 1) {
                    throw e;
                }
                laterPassFailed = true;
                stopReason = "pass " + pass + " failed: " + e.getMessage();
                log.warn("Pass {}/{} failed, keeping {} extractions from earlier passes: {}",
                        pass, state.passes, state.extractions.size(), e.getMessage());
                state.response.addStep(new ProcessingStep(PipelineStage.EXTRACTION, StepStatus.ERROR,
                        Instant.now(), Duration.ZERO, stopReason));
                break;
            }

            int newCount = 0;
            for (Extraction extraction : passExtractions) {
                if (seen.add(extraction.getExtractionClass() + '\u0000' + extraction.getExtractionText())) {
                    newCount++;
                }
                extraction.setExtractionIndex(state.extractions.size());
                state.extractions.add(extraction);
            }
            state.response.passCompleted();
            state.response.setExtractions(state.extractions);
            log.info("Pass {}/{}: {} extractions ({} new)", pass, state.passes, passExtractions.size(), newCount);

            if (pass > 1 && pass < state.passes) {
                double improvement = state.extractions.isEmpty() ? 0.0 : (double) newCount / state.extractions.size();
                if (improvement < config.getPassImprovementThreshold()) {
                    stopReason = String.format("stopped after pass %d: improvement %.3f below %.3f",
                            pass, improvement, config.getPassImprovementThreshold());
                    log.info(stopReason);
                    break;
                }
            }
        }

        String message = state.response.getPassesCompleted() + "/" + state.passes + " passes, "
                + state.extractions.size() + " extractions"
                + (stopReason == null ? "" : "; " + stopReason);
        return laterPassFailed ? StageOutcome.warning(message) : StageOutcome.success(message);
    }

    private List<Extraction> runPass(RunState state, ModelConfig modelConfig, int pass) {
        List<Extraction> passExtractions = new ArrayList<>();
        String source = state.document.getText();
        boolean chunked = state.chunks.size() > 1;

        for (TextChunk chunk : state.chunks) {
            state.context.throwIfDone();
            state.tracker.chunk(chunk.index() + 1, chunk.totalChunks());
            if (chunked) {
                notifyProgress(state);
            }

            String prompt = PromptBuilder.build(chunk.text(), state.request.getTaskDescription(),
                    state.request.getExamples(), state.request.getSchema());
            GatewayRequest gatewayRequest = new GatewayRequest(prompt, modelConfig, state.retryCount,
                    state.request.getProviderId(), pass);
            GatewayResponse answer = gateway.executeWithFailover(state.context, gatewayRequest,
                    state.response::addFailoverEvent);
            state.response.addTokens(answer.tokensUsed());
            state.response.setProviderUsed(answer.provider(),
                    answer.modelName() != null ? answer.modelName() : modelConfig.getModelName());

            int groupIndex = chunked ? chunk.index() : pass - 1;
            List<Extraction> parsed = parser.parse(answer.text(), groupIndex);
            align(state, parsed, source, chunked ? chunk.start() : null);
            passExtractions.addAll(parsed);
        }
        return passExtractions;
    }

    private void align(RunState state, List<Extraction> extractions, String source, Integer chunkStart) {
        List<AlignmentResult> results;
        if (chunkStart == null) {
            results = aligner.alignExtractions(
                    extractions.stream().map(Extraction::getExtractionText).toList(),
                    source, config.getAlignmentOptions(), state.context);
        } else {
            results = new ArrayList<>(extractions.size());
            for (Extraction extraction : extractions) {
                results.add(aligner.alignExtraction(extraction.getExtractionText(), source,
                        config.getAlignmentOptions(), chunkStart, state.context));
            }
        }

        for (int i = 0; i < extractions.size(); i++) {
            Extraction extraction = extractions.get(i);
            AlignmentResult result = results.get(i);
            if (result.isMatched()) {
                extraction.setCharInterval(result.interval());
                extraction.setAlignmentStatus(result.status());
                extraction.setAlignmentQuality(result.quality());
            } else {
                extraction.setAlignmentStatus(AlignmentStatus.NONE);
                extraction.setAlignmentQuality(0);
                log.debug("Could not align \"{}\" ({})", extraction.getExtractionText(),
                        extraction.getExtractionClass());
            }
        }
    }

    // ── STEP 4: Aggregation ──
    private StageOutcome aggregate(RunState state) {
        if (!config.isDeduplicationEnabled()) {
            return StageOutcome.skipped("deduplication disabled");
        }
        if (state.extractions.isEmpty()) {
            return StageOutcome.skipped("no extractions");
        }
        AggregationResult result = aggregator.aggregate(state.extractions, state.document.getText());
        state.extractions = new ArrayList<>(result.extractions());
        state.response.setExtractions(state.extractions);
        return StageOutcome.success(String.format(
                "%d → %d (duplicates=%d, overlaps=%d, lowConfidence=%d)",
                result.originalCount(), result.finalCount(), result.duplicatesRemoved(),
                result.overlapsResolved(), result.lowConfidenceFiltered()));
    }

    // ── STEP 5: Schema validation ──
    private StageOutcome validate(RunState state) {
        ExtractionSchema schema = state.request.getSchema();
        if (schema == null || !state.request.isValidateOutput()) {
            return StageOutcome.skipped(schema == null ? "no schema" : "validation disabled");
        }
        List<Extraction> valid = new ArrayList<>(state.extractions.size());
        int dropped = 0;
        for (Extraction extraction : state.extractions) {
            try {
                schema.validateExtraction(extraction);
                valid.add(extraction);
            } catch (SchemaValidationException e) {
                dropped++;
                state.response.addValidationError(new ValidationError(extraction.getExtractionIndex(),
                        extraction.getExtractionClass(), extraction.getExtractionText(),
                        e.getField(), e.getConstraint(), e.getMessage()));
                log.debug("Dropped invalid extraction \"{}\": {}", extraction.getExtractionText(), e.getMessage());
            }
        }
        state.extractions = valid;
        state.response.setExtractions(valid);
        if (dropped > 0) {
            return StageOutcome.warning(dropped + " extraction(s) failed schema " + schema.getName());
        }
        return StageOutcome.success(valid.size() + " extraction(s) valid");
    }

    // ── STEP 6: Finalization ──
    private StageOutcome finalizeResponse(RunState state) {
        AnnotatedDocument annotated = new AnnotatedDocument(state.document, state.extractions);
        double meanConfidence = state.extractions.stream()
                .filter(Extraction::hasConfidence)
                .mapToDouble(Extraction::getConfidence)
                .average()
                .orElse(0.0);
        state.response.setExtractions(state.extractions);
        state.response.setAnnotatedDocument(annotated);
        state.response.setMetrics(annotated.getCoverage(), meanConfidence);
        return StageOutcome.success(String.format("%d extractions, coverage=%.3f, confidence=%.3f",
                state.extractions.size(), annotated.getCoverage(), meanConfidence));
    }

    // =========================================================================
    //  Helpers
    // =========================================================================

    private RequestContext contextFor(ExtractionRequest request) {
        if (request.getContext() != null) {
            return request.getContext();
        }
        Duration timeout = request.getTimeout() != null ? request.getTimeout() : config.getDefaultTimeout();
        return RequestContext.withTimeout(timeout);
    }

    private static ModelConfig modelConfigFor(ExtractionRequest request) {
        return ModelConfig.builder()
                .modelName(request.getModelId())
                .temperature(request.getTemperature())
                .maxOutputTokens(request.getMaxTokens())
                .jsonResponse(true)
                .responseSchema(request.getSchema() == null ? null
                        : ResponseSchemaConverter.toResponseSchema(request.getSchema()))
                .build();
    }

    private void notifyProgress(RunState state) {
        ProgressListener listener = state.request.getProgressListener();
        if (listener != null && config.isProgressTrackingEnabled()) {
            ProgressReporter.notify(listener, state.tracker.snapshot());
        }
    }

    static String errorCode(LangExtractException e) {
        Throwable cause = e instanceof ExtractionException && e.getCause() != null ? e.getCause() : e;
        if (cause instanceof RequestValidationException) {
            return "VALIDATION_ERROR";
        }
        if (cause instanceof RequestCancelledException rce) {
            return rce.getReason().name();
        }
        if (cause instanceof ProviderException pe) {
            return "PROVIDER_" + pe.getType().name();
        }
        if (cause instanceof ResponseParseException) {
            return "PARSE_ERROR";
        }
        if (e instanceof ExtractionException ee) {
            return ee.getStage().name() + "_FAILED";
        }
        return "INTERNAL_ERROR";
    }

    /** Per-request working state, confined to the pipeline thread. */
    private static final class RunState {
        final ExtractionRequest request;
        final RequestContext context;
        final RequestTracker tracker;
        final ExtractionResponse response;

        int retryCount;
        int passes;
        Document document;
        List<TextChunk> chunks = List.of();
        List<Extraction> extractions = new ArrayList<>();

        RunState(ExtractionRequest request, RequestContext context, RequestTracker tracker,
                 ExtractionResponse response) {
            this.request = request;
            this.context = context;
            this.tracker = tracker;
            this.response = response;
        }
    }
}
