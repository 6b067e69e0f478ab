package com.eainde.langextract.batch;

import com.eainde.langextract.pipeline.ExtractionEngine;
import com.eainde.langextract.pipeline.ExtractionResponse;
import com.eainde.langextract.thread.MdcAwareExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs many independent extraction requests concurrently.
 *
 * <h3>Behaviour:</h3>
 * <ul>
 *   <li>At most {@code concurrency} items run at once: submission blocks on a semaphore.</li>
 *   <li>Each item succeeds or fails on its own; a failure never interrupts its siblings.</li>
 *   <li>Once {@code maxErrors} items have failed and {@code continueOnError} is off, no more
 *       items are submitted. Items already running finish; the rest are reported as skipped.</li>
 * </ul>
 */
@Log4j2
@RequiredArgsConstructor
public class BatchExtractionRunner {

    private final ExtractionEngine engine;
    private final BatchConfig config;

    public BatchSummary run(List<BatchItem> items) {
        Instant started = Instant.now();
        int concurrency = Math.max(1, config.getConcurrency());
        Semaphore permits = new Semaphore(concurrency);
        AtomicInteger errors = new AtomicInteger();
        AtomicBoolean aborted = new AtomicBoolean();
        BatchItemResult[] results = new BatchItemResult[items.size()];
        List<CompletableFuture<Void>> running = new ArrayList<>();

        log.info("Starting batch of {} items (concurrency={}, maxErrors={}, continueOnError={})",
                items.size(), concurrency, config.getMaxErrors(), config.isContinueOnError());

        try (MdcAwareExecutor executor = MdcAwareExecutor.fixed(concurrency, "langextract-batch")) {
            for (int i = 0; i < items.size(); i++) {
                BatchItem item = items.get(i);
                if (shouldStop(errors, aborted)) {
                    results[i] = BatchItemResult.skipped(item.id(), "batch aborted after " + errors.get() + " errors");
                    continue;
                }
                try {
                    permits.acquire();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    aborted.set(true);
                    results[i] = BatchItemResult.skipped(item.id(), "batch interrupted");
                    continue;
                }
                // a sibling may have failed while we waited for the permit
                if (shouldStop(errors, aborted)) {
                    permits.release();
                    results[i] = BatchItemResult.skipped(item.id(), "batch aborted after " + errors.get() + " errors");
                    continue;
                }

                int slot = i;
                running.add(CompletableFuture.runAsync(() -> {
                    try {
                        results[slot] = runItem(item, errors);
                    } finally {
                        permits.release();
                    }
                }, executor));
            }
            CompletableFuture.allOf(running.toArray(new CompletableFuture[0])).join();
        }

        int succeeded = 0;
        int failed = 0;
        int skipped = 0;
        for (BatchItemResult result : results) {
            switch (result.status()) {
                case SUCCEEDED -> succeeded++;
                case FAILED -> failed++;
                case SKIPPED -> skipped++;
            }
        }
        Duration total = Duration.between(started, Instant.now());
        log.info("Batch finished in {} ms: {} succeeded, {} failed, {} skipped",
                total.toMillis(), succeeded, failed, skipped);
        return new BatchSummary(Arrays.asList(results), succeeded, failed, skipped, total, aborted.get());
    }

    private BatchItemResult runItem(BatchItem item, AtomicInteger errors) {
        Instant start = Instant.now();
        try {
            ExtractionResponse response = engine.process(item.request());
            Duration duration = Duration.between(start, Instant.now());
            if (response.isSuccessful()) {
                return BatchItemResult.success(item.id(), response, duration);
            }
            errors.incrementAndGet();
            log.warn("Batch item {} failed: {}", item.id(), response.getError().getMessage());
            return BatchItemResult.failure(item.id(), response, response.getError().getMessage(), duration);
        } catch (RuntimeException e) {
            errors.incrementAndGet();
            log.error("Batch item {} crashed", item.id(), e);
            return BatchItemResult.failure(item.id(), null, e.getMessage(), Duration.between(start, Instant.now()));
        }
    }

    private boolean shouldStop(AtomicInteger errors, AtomicBoolean aborted) {
        if (aborted.get()) {
            return true;
        }
        if (!config.isContinueOnError() && config.getMaxErrors() > 0 && errors.get() >= config.getMaxErrors()) {
            aborted.set(true);
            return true;
        }
        return false;
    }
}
