package com.eainde.langextract.provider;

import com.eainde.langextract.RequestCancelledException;
import com.eainde.langextract.RequestContext;
import com.eainde.langextract.thread.MdcAwareExecutor;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.extern.log4j.Log4j2;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Runs prompts against a prioritized list of {@link LanguageModelClient}s with retry,
 * backoff and failover.
 *
 * <h3>Per request:</h3>
 * <pre>
 * cache hit?                   → answer from cache
 * order providers              preferred → model family match → configured priority;
 *                              unhealthy ones skipped while any healthy one remains
 * for each provider:
 *   up to 1 + retryCount attempts, exponential backoff between them
 *   recoverable error          → retry, then fail over (FailoverEvent recorded)
 *   non-recoverable error      → thrown at once, no retry and no failover
 * all providers failed         → ProvidersExhaustedException
 * </pre>
 *
 * <p>Failover events describe transitions only: one per move from a provider to the next one.
 * Running out of providers raises the exception without a further event, so a single-provider
 * gateway never records any.</p>
 *
 * <p>Every attempt runs on a worker thread bounded by the configured call timeout and the
 * request deadline; cancelling the {@link RequestContext} abandons the attempt at once.</p>
 */
@Log4j2
public class ProviderGateway implements AutoCloseable {

    private final List<LanguageModelClient> providers;
    private final ProviderGatewayConfig config;
    private final Map<String, ProviderHealth> health = new LinkedHashMap<>();
    private final Executor executor;
    private final MdcAwareExecutor ownedExecutor;
    private final Cache<String, GatewayResponse> cache;

    public ProviderGateway(List<LanguageModelClient> providers, ProviderGatewayConfig config) {
        this(providers, config, null);
    }

    /**
     * @param executor runs the provider calls; {@code null} creates a private pool closed by {@link #close()}
     */
    public ProviderGateway(List<LanguageModelClient> providers, ProviderGatewayConfig config, Executor executor) {
        if (providers == null || providers.isEmpty()) {
            throw new IllegalArgumentException("at least one provider is required");
        }
        this.providers = List.copyOf(providers);
        this.config = config == null ? ProviderGatewayConfig.defaults() : config;
        for (LanguageModelClient provider : this.providers) {
            if (health.putIfAbsent(provider.name(),
                    new ProviderHealth(provider.name(), this.config.getUnhealthyThreshold(),
                            this.config.getRecoveryThreshold())) != null) {
                throw new IllegalArgumentException("duplicate provider name: " + provider.name());
            }
        }
        if (executor == null) {
            this.ownedExecutor = MdcAwareExecutor.cached("langextract-provider");
            this.executor = ownedExecutor;
        } else {
            this.ownedExecutor = null;
            this.executor = executor;
        }
        this.cache = this.config.isCacheEnabled()
                ? Caffeine.newBuilder()
                        .maximumSize(this.config.getCacheMaxSize())
                        .expireAfterWrite(this.config.getCacheTtl())
                        .recordStats()
                        .build()
                : null;
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    public GatewayResponse executeWithFailover(RequestContext context, GatewayRequest request) {
        return executeWithFailover(context, request, event -> { });
    }

    /**
     * @param failoverListener receives each failover event once its outcome is known, including
     *                         the events of a request that ends in an exception
     * @throws ProviderException           non-recoverable provider error
     * @throws ProvidersExhaustedException every provider failed with recoverable errors
     * @throws RequestCancelledException   the context was cancelled or its deadline passed
     */
    public GatewayResponse executeWithFailover(RequestContext context, GatewayRequest request,
                                               Consumer<FailoverEvent> failoverListener) {
        context.throwIfDone();

        String cacheKey = cache == null ? null : cacheKey(request);
        if (cacheKey != null) {
            GatewayResponse hit = cache.getIfPresent(cacheKey);
            if (hit != null) {
                log.debug("Cache hit for pass {} (provider {})", request.pass(), hit.provider());
                return hit.asCached();
            }
        }

        List<LanguageModelClient> candidates = orderProviders(request);
        List<FailoverEvent> events = new ArrayList<>();
        FailoverEvent pending = null;
        ProviderException lastError = null;
        int attempts = 0;
        Instant started = Instant.now();

        for (int i = 0; i < candidates.size(); i++) {
            LanguageModelClient provider = candidates.get(i);

            for (int attempt = 1; attempt <= request.attemptsPerProvider(); attempt++) {
                context.throwIfDone();
                attempts++;
                try {
                    ModelResponse answer = invoke(context, provider, request);

                    if (pending != null) {
                        pending = pending.withSuccess(true);
                        events.add(pending);
                        failoverListener.accept(pending);
                    }
                    GatewayResponse response = new GatewayResponse(answer.text(), answer.tokensUsed(),
                            provider.name(), answer.modelName(), Duration.between(started, Instant.now()),
                            attempts, false, events);
                    if (cacheKey != null) {
                        cache.put(cacheKey, response);
                    }
                    return response;
                } catch (ProviderException e) {
                    lastError = e;
                    if (!e.isRecoverable()) {
                        log.error("Provider {} failed with non-recoverable {}: {}",
                                provider.name(), e.getType(), e.getMessage());
                        if (pending != null) {
                            failoverListener.accept(pending);
                        }
                        throw e;
                    }
                    if (attempt < request.attemptsPerProvider()) {
                        Duration backoff = config.backoffFor(attempt);
                        log.warn("Provider {} attempt {}/{} failed ({}), retrying in {} ms",
                                provider.name(), attempt, request.attemptsPerProvider(), e.getType(),
                                backoff.toMillis());
                        context.await(backoff);
                    }
                }
            }

            // ── provider exhausted: fail over ──
            if (pending != null) {
                events.add(pending);
                failoverListener.accept(pending);
                pending = null;
            }
            if (i + 1 < candidates.size()) {
                String next = candidates.get(i + 1).name();
                String reason = lastError == null ? "unknown" : lastError.getType() + ": " + lastError.getMessage();
                pending = new FailoverEvent(Instant.now(), provider.name(), reason, next, false);
                log.warn("Failing over from {} to {} after {}", provider.name(), next,
                        lastError == null ? "unknown" : lastError.getType());
            }
        }

        throw new ProvidersExhaustedException(
                "all " + candidates.size() + " providers failed; last error: "
                        + (lastError == null ? "none" : lastError.getMessage()),
                lastError, events);
    }

    public Map<String, ProviderHealthReport> getProviderHealth() {
        Map<String, ProviderHealthReport> reports = new LinkedHashMap<>();
        health.forEach((name, h) -> reports.put(name, h.report()));
        return reports;
    }

    public GatewayCacheStats getCacheStats() {
        if (cache == null) {
            return new GatewayCacheStats(false, 0, 0, 0, 0);
        }
        CacheStats stats = cache.stats();
        return new GatewayCacheStats(true, cache.estimatedSize(), stats.hitCount(), stats.missCount(),
                stats.evictionCount());
    }

    public void clearCache() {
        if (cache != null) {
            cache.invalidateAll();
        }
    }

    public List<String> getProviderNames() {
        return providers.stream().map(LanguageModelClient::name).toList();
    }

    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.close();
        }
    }

    // =========================================================================
    //  Internals
    // =========================================================================

    /**
     * Preferred provider first, then providers of the model's family, then configured order.
     * Unhealthy providers are dropped unless none is healthy.
     */
    List<LanguageModelClient> orderProviders(GatewayRequest request) {
        List<LanguageModelClient> ordered = new ArrayList<>(providers.size());
        if (request.preferredProvider() != null) {
            providers.stream()
                    .filter(p -> p.name().equals(request.preferredProvider())
                            || ProviderType.parse(request.preferredProvider()).map(t -> t == p.type()).orElse(false))
                    .forEach(ordered::add);
        }
        Optional<ProviderType> family = ProviderType.forModel(request.modelConfig().getModelName());
        family.ifPresent(type -> providers.stream()
                .filter(p -> p.type() == type && !ordered.contains(p))
                .forEach(ordered::add));
        providers.stream().filter(p -> !ordered.contains(p)).forEach(ordered::add);

        List<LanguageModelClient> healthy = ordered.stream()
                .filter(p -> health.get(p.name()).isHealthy())
                .toList();
        if (healthy.isEmpty()) {
            log.warn("No healthy provider left, trying all {}", ordered.size());
            return ordered;
        }
        return healthy;
    }

    private ModelResponse invoke(RequestContext context, LanguageModelClient provider, GatewayRequest request) {
        Duration timeout = config.getCallTimeout();
        Duration remaining = context.remaining();
        if (remaining != null && remaining.compareTo(timeout) < 0) {
            timeout = remaining;
        }

        Instant start = Instant.now();
        CompletableFuture<ModelResponse> future = CompletableFuture.supplyAsync(
                () -> provider.call(request.prompt(), request.modelConfig()), executor);
        Runnable deregister = context.onCancel(() -> future.cancel(true));
        try {
            ModelResponse response = future.get(Math.max(1, timeout.toMillis()), TimeUnit.MILLISECONDS);
            health.get(provider.name()).recordSuccess(Duration.between(start, Instant.now()));
            return response;
        } catch (TimeoutException e) {
            future.cancel(true);
            context.throwIfDone();
            ProviderException timedOut = new ProviderException(ProviderErrorType.TIMEOUT, provider.name(),
                    provider.name() + " did not answer within " + timeout.toMillis() + " ms");
            recordFailure(provider, start, timedOut);
            throw timedOut;
        } catch (CancellationException e) {
            context.throwIfDone();
            ProviderException cancelled = new ProviderException(ProviderErrorType.UNKNOWN, provider.name(),
                    provider.name() + " call was cancelled", e);
            recordFailure(provider, start, cancelled);
            throw cancelled;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RequestCancelledException rce) {
                throw rce;
            }
            ProviderException failure = cause instanceof ProviderException pe
                    ? pe
                    : new ProviderException(ProviderErrorType.UNKNOWN, provider.name(),
                            provider.name() + " call failed: " + cause.getMessage(), cause);
            recordFailure(provider, start, failure);
            throw failure;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new RequestCancelledException(RequestCancelledException.Reason.CANCELED,
                    "interrupted while waiting for " + provider.name());
        } finally {
            deregister.run();
        }
    }

    private void recordFailure(LanguageModelClient provider, Instant start, ProviderException error) {
        health.get(provider.name()).recordFailure(Duration.between(start, Instant.now()),
                error.getType() + ": " + error.getMessage());
    }

    static String cacheKey(GatewayRequest request) {
        ModelConfig mc = request.modelConfig();
        String material = request.pass() + "\u0000" + mc.getModelName() + "\u0000" + mc.getTemperature()
                + "\u0000" + mc.getTopP() + "\u0000" + mc.getTopK() + "\u0000" + mc.getMaxOutputTokens()
                + "\u0000" + mc.wantsJson() + "\u0000" + mc.getResponseSchema()
                + "\u0000" + request.preferredProvider() + "\u0000" + request.prompt();
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
