package com.eainde.langextract.config;

import com.eainde.langextract.aggregation.ExtractionAggregator;
import com.eainde.langextract.aggregation.OverlapStrategy;
import com.eainde.langextract.alignment.AlignmentOptions;
import com.eainde.langextract.alignment.TextAlignmentEngine;
import com.eainde.langextract.batch.BatchConfig;
import com.eainde.langextract.batch.BatchExtractionRunner;
import com.eainde.langextract.pipeline.EngineConfig;
import com.eainde.langextract.pipeline.ExtractionEngine;
import com.eainde.langextract.provider.LanguageModelClient;
import com.eainde.langextract.provider.ProviderGateway;
import com.eainde.langextract.provider.ProviderGatewayConfig;
import com.eainde.langextract.schema.SchemaLoader;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;
import org.springframework.context.support.PropertySourcesPlaceholderConfigurer;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

/**
 * Wires the extraction core from {@code langextract.properties}.
 *
 * <p>The application contributes one or more {@link LanguageModelClient} beans, typically a
 * {@link com.eainde.langextract.provider.ChatModelClient} around a langchain4j ChatModel.
 * Their bean order is the failover priority.</p>
 */
@Log4j2
@Configuration
@PropertySource(value = "classpath:langextract.properties", ignoreResourceNotFound = true)
public class LangExtractConfiguration {

    // ── Engine ──────────────────────────────────────────────────────────

    @Value("${langextract.engine.default-timeout:60s}")
    private String defaultTimeout;

    @Value("${langextract.engine.multi-pass-enabled:false}")
    private boolean multiPassEnabled;

    @Value("${langextract.engine.max-passes:3}")
    private int maxPasses;

    @Value("${langextract.engine.pass-improvement-threshold:0.1}")
    private double passImprovementThreshold;

    @Value("${langextract.engine.deduplication-enabled:true}")
    private boolean deduplicationEnabled;

    @Value("${langextract.engine.confidence-threshold:0.5}")
    private double confidenceThreshold;

    @Value("${langextract.engine.overlap-strategy:KEEP_HIGHEST_CONFIDENCE}")
    private String overlapStrategy;

    @Value("${langextract.engine.progress-tracking-enabled:true}")
    private boolean progressTrackingEnabled;

    @Value("${langextract.engine.progress-interval:1s}")
    private String progressInterval;

    @Value("${langextract.engine.chunking.max-chars:0}")
    private int chunkMaxChars;

    @Value("${langextract.engine.chunking.overlap-chars:200}")
    private int chunkOverlapChars;

    // ── Alignment ───────────────────────────────────────────────────────

    @Value("${langextract.alignment.case-sensitive:false}")
    private boolean caseSensitive;

    @Value("${langextract.alignment.ignore-whitespace:true}")
    private boolean ignoreWhitespace;

    @Value("${langextract.alignment.ignore-punctuation:false}")
    private boolean ignorePunctuation;

    @Value("${langextract.alignment.max-distance:5}")
    private int maxDistance;

    @Value("${langextract.alignment.min-confidence:0.7}")
    private double minConfidence;

    @Value("${langextract.alignment.max-candidates:10}")
    private int maxCandidates;

    @Value("${langextract.alignment.window-size:100}")
    private int windowSize;

    @Value("${langextract.alignment.timeout-ms:5000}")
    private long alignmentTimeoutMs;

    // ── Provider gateway ────────────────────────────────────────────────

    @Value("${langextract.provider.unhealthy-threshold:3}")
    private int unhealthyThreshold;

    @Value("${langextract.provider.recovery-threshold:2}")
    private int recoveryThreshold;

    @Value("${langextract.provider.backoff-initial:500ms}")
    private String backoffInitial;

    @Value("${langextract.provider.backoff-multiplier:2.0}")
    private double backoffMultiplier;

    @Value("${langextract.provider.backoff-max:8s}")
    private String backoffMax;

    @Value("${langextract.provider.call-timeout:30s}")
    private String callTimeout;

    @Value("${langextract.provider.cache.enabled:true}")
    private boolean cacheEnabled;

    @Value("${langextract.provider.cache.max-size:1000}")
    private long cacheMaxSize;

    @Value("${langextract.provider.cache.ttl:5m}")
    private String cacheTtl;

    // ── Batch ───────────────────────────────────────────────────────────

    @Value("${langextract.batch.concurrency:4}")
    private int batchConcurrency;

    @Value("${langextract.batch.max-errors:10}")
    private int batchMaxErrors;

    @Value("${langextract.batch.continue-on-error:false}")
    private boolean batchContinueOnError;

    @Bean
    public static PropertySourcesPlaceholderConfigurer langExtractPlaceholderConfigurer() {
        return new PropertySourcesPlaceholderConfigurer();
    }

    @Bean
    public ObjectMapper langExtractObjectMapper() {
        return new ObjectMapper();
    }

    @Bean
    public AlignmentOptions alignmentOptions() {
        return AlignmentOptions.builder()
                .caseSensitive(caseSensitive)
                .ignoreWhitespace(ignoreWhitespace)
                .ignorePunctuation(ignorePunctuation)
                .maxDistance(maxDistance)
                .minConfidence(minConfidence)
                .maxCandidates(maxCandidates)
                .windowSize(windowSize)
                .timeoutMs(alignmentTimeoutMs)
                .build();
    }

    @Bean
    public EngineConfig engineConfig(AlignmentOptions alignmentOptions) {
        EngineConfig config = EngineConfig.builder()
                .defaultTimeout(duration("langextract.engine.default-timeout", defaultTimeout))
                .multiPassEnabled(multiPassEnabled)
                .maxPasses(maxPasses)
                .passImprovementThreshold(passImprovementThreshold)
                .deduplicationEnabled(deduplicationEnabled)
                .confidenceThreshold(confidenceThreshold)
                .overlapStrategy(OverlapStrategy.parse(overlapStrategy))
                .progressTrackingEnabled(progressTrackingEnabled)
                .progressInterval(duration("langextract.engine.progress-interval", progressInterval))
                .chunkMaxChars(chunkMaxChars)
                .chunkOverlapChars(chunkOverlapChars)
                .alignmentOptions(alignmentOptions)
                .build();
        log.info("Engine config: {}", config);
        return config;
    }

    @Bean
    public ProviderGatewayConfig providerGatewayConfig() {
        return ProviderGatewayConfig.builder()
                .unhealthyThreshold(unhealthyThreshold)
                .recoveryThreshold(recoveryThreshold)
                .backoffInitial(duration("langextract.provider.backoff-initial", backoffInitial))
                .backoffMultiplier(backoffMultiplier)
                .backoffMax(duration("langextract.provider.backoff-max", backoffMax))
                .callTimeout(duration("langextract.provider.call-timeout", callTimeout))
                .cacheEnabled(cacheEnabled)
                .cacheMaxSize(cacheMaxSize)
                .cacheTtl(duration("langextract.provider.cache.ttl", cacheTtl))
                .build();
    }

    @Bean
    public BatchConfig batchConfig() {
        return BatchConfig.builder()
                .concurrency(batchConcurrency)
                .maxErrors(batchMaxErrors)
                .continueOnError(batchContinueOnError)
                .build();
    }

    @Bean
    public TextAlignmentEngine textAlignmentEngine() {
        return new TextAlignmentEngine();
    }

    @Bean
    public ExtractionAggregator extractionAggregator(EngineConfig engineConfig) {
        return new ExtractionAggregator(engineConfig.getOverlapStrategy(), engineConfig.getConfidenceThreshold());
    }

    @Bean
    public SchemaLoader schemaLoader(ObjectMapper langExtractObjectMapper) {
        return new SchemaLoader(langExtractObjectMapper);
    }

    @Bean
    public ProviderGateway providerGateway(List<LanguageModelClient> providers, ProviderGatewayConfig config) {
        log.info("Provider priority: {}", providers.stream().map(LanguageModelClient::name).toList());
        return new ProviderGateway(providers, config);
    }

    @Bean
    public ExtractionEngine extractionEngine(EngineConfig engineConfig, ProviderGateway providerGateway,
                                             TextAlignmentEngine textAlignmentEngine,
                                             ExtractionAggregator extractionAggregator,
                                             ObjectMapper langExtractObjectMapper) {
        return new ExtractionEngine(engineConfig, providerGateway, textAlignmentEngine,
                extractionAggregator, langExtractObjectMapper);
    }

    @Bean
    public BatchExtractionRunner batchExtractionRunner(ExtractionEngine extractionEngine, BatchConfig batchConfig) {
        return new BatchExtractionRunner(extractionEngine, batchConfig);
    }

    /**
     * Accepts {@code 500ms}, {@code 30s}, {@code 5m}, {@code 1h}, a bare number of milliseconds,
     * or ISO-8601 ({@code PT30S}).
     */
    static Duration duration(String key, String value) {
        String v = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        try {
            if (v.startsWith("p")) {
                return Duration.parse(v.toUpperCase(Locale.ROOT));
            }
            if (v.endsWith("ms")) {
                return Duration.ofMillis(Long.parseLong(v.substring(0, v.length() - 2).trim()));
            }
            if (v.endsWith("s")) {
                return Duration.ofSeconds(Long.parseLong(v.substring(0, v.length() - 1).trim()));
            }
            if (v.endsWith("m")) {
                return Duration.ofMinutes(Long.parseLong(v.substring(0, v.length() - 1).trim()));
            }
            if (v.endsWith("h")) {
                return Duration.ofHours(Long.parseLong(v.substring(0, v.length() - 1).trim()));
            }
            return Duration.ofMillis(Long.parseLong(v));
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new IllegalArgumentException("invalid duration for " + key + ": " + value, e);
        }
    }
}
