package com.eainde.langextract.thread;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executor that carries the submitting thread's MDC (request id and friends) into the worker
 * thread, so log lines written by provider calls stay correlated with their request.
 */
public class MdcAwareExecutor implements Executor, AutoCloseable {

    private final ExecutorService delegate;

    public MdcAwareExecutor(ExecutorService delegate) {
        this.delegate = delegate;
    }

    /** Unbounded pool of daemon threads, reused when idle. */
    public static MdcAwareExecutor cached(String threadPrefix) {
        return new MdcAwareExecutor(Executors.newCachedThreadPool(daemonThreads(threadPrefix)));
    }

    public static MdcAwareExecutor fixed(int threads, String threadPrefix) {
        return new MdcAwareExecutor(Executors.newFixedThreadPool(threads, daemonThreads(threadPrefix)));
    }

    @Override
    public void execute(Runnable command) {
        // Capture MDC context from the calling (parent) thread
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();

        delegate.execute(() -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            } else {
                MDC.clear();
            }
            try {
                command.run();
            } finally {
                // pooled threads are reused; put back what was there
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        });
    }

    public boolean isShutdown() {
        return delegate.isShutdown();
    }

    @Override
    public void close() {
        delegate.shutdown();
        try {
            if (!delegate.awaitTermination(5, TimeUnit.SECONDS)) {
                delegate.shutdownNow();
            }
        } catch (InterruptedException e) {
            delegate.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
