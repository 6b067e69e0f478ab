package com.eainde.langextract.pipeline;

import com.eainde.langextract.RequestContext;
import lombok.extern.log4j.Log4j2;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Background ticker that periodically reports progress for running requests.
 *
 * <p>Each tick checks that its request is still registered and its context still live; if
 * not, the ticker cancels itself. It only reads the {@link RequestTracker}, never pipeline
 * state.</p>
 */
@Log4j2
final class ProgressReporter implements AutoCloseable {

    private final ScheduledExecutorService scheduler;
    private final ActiveRequestRegistry registry;

    ProgressReporter(ActiveRequestRegistry registry) {
        this.registry = registry;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "langextract-progress");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * @return handle that stops the ticker; also stopped when the context is cancelled
     */
    Runnable start(RequestTracker tracker, ProgressListener listener, RequestContext context, Duration interval) {
        long period = Math.max(1, interval.toMillis());
        AtomicReference<ScheduledFuture<?>> self = new AtomicReference<>();

        ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(() -> {
            if (!registry.contains(tracker.requestId()) || context.isDone()) {
                ScheduledFuture<?> handle = self.get();
                if (handle != null) {
                    handle.cancel(false);
                }
                return;
            }
            notify(listener, tracker.snapshot());
        }, period, period, TimeUnit.MILLISECONDS);
        self.set(future);

        Runnable deregister = context.onCancel(() -> future.cancel(false));
        return () -> {
            future.cancel(false);
            deregister.run();
        };
    }

    static void notify(ProgressListener listener, ExtractionProgress progress) {
        try {
            listener.onProgress(progress);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed for {}: {}", progress.requestId(), e.getMessage());
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
