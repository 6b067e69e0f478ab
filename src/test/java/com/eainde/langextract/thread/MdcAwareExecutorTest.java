package com.eainde.langextract.thread;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class MdcAwareExecutorTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("should propagate the caller's MDC into the worker")
    void propagates() throws Exception {
        try (MdcAwareExecutor executor = MdcAwareExecutor.fixed(1, "test")) {
            MDC.put("requestId", "req_1");

            String seen = CompletableFuture.supplyAsync(() -> MDC.get("requestId"), executor)
                    .get(5, TimeUnit.SECONDS);

            assertThat(seen).isEqualTo("req_1");
        }
    }

    @Test
    @DisplayName("should not leak one task's MDC into the next task on the same thread")
    void doesNotLeak() throws Exception {
        try (MdcAwareExecutor executor = MdcAwareExecutor.fixed(1, "test")) {
            MDC.put("requestId", "req_1");
            CompletableFuture.runAsync(() -> MDC.put("extra", "x"), executor).get(5, TimeUnit.SECONDS);
            MDC.clear();

            String[] seen = CompletableFuture.supplyAsync(
                    () -> new String[]{MDC.get("requestId"), MDC.get("extra")}, executor)
                    .get(5, TimeUnit.SECONDS);

            assertThat(seen).containsOnlyNulls();
        }
    }

    @Test
    @DisplayName("worker threads are named daemons")
    void daemonThreads() throws Exception {
        try (MdcAwareExecutor executor = MdcAwareExecutor.cached("langextract-test")) {
            Thread worker = CompletableFuture.supplyAsync(Thread::currentThread, executor).get(5, TimeUnit.SECONDS);

            assertThat(worker.isDaemon()).isTrue();
            assertThat(worker.getName()).startsWith("langextract-test-");
        }
    }

    @Test
    @DisplayName("close shuts the pool down")
    void close() {
        MdcAwareExecutor executor = MdcAwareExecutor.fixed(2, "test");

        executor.close();

        assertThat(executor.isShutdown()).isTrue();
    }
}
