package com.eainde.langextract;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestContextTest {

    @Test
    @DisplayName("background context never expires")
    void background() {
        RequestContext context = RequestContext.background();

        assertThat(context.hasDeadline()).isFalse();
        assertThat(context.remaining()).isNull();
        assertThat(context.isDone()).isFalse();
        assertThatCode(context::throwIfDone).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("a past deadline reports DEADLINE_EXCEEDED")
    void expired() {
        RequestContext context = RequestContext.withDeadline(Instant.now().minusSeconds(1));

        assertThat(context.isExpired()).isTrue();
        assertThat(context.remaining()).isEqualTo(Duration.ZERO);
        assertThatThrownBy(context::throwIfDone)
                .isInstanceOfSatisfying(RequestCancelledException.class,
                        e -> assertThat(e.getReason()).isEqualTo(RequestCancelledException.Reason.DEADLINE_EXCEEDED));
    }

    @Test
    @DisplayName("cancel runs callbacks once and late registrations immediately")
    void callbacks() {
        RequestContext context = RequestContext.withTimeout(Duration.ofMinutes(1));
        AtomicInteger calls = new AtomicInteger();
        Runnable deregister = context.onCancel(calls::incrementAndGet);
        context.onCancel(calls::incrementAndGet).run();

        deregister.run();
        context.cancel();
        context.cancel();
        context.onCancel(calls::incrementAndGet);

        assertThat(calls).hasValue(1);
        assertThat(context.isCancelled()).isTrue();
        assertThatThrownBy(context::throwIfDone)
                .isInstanceOfSatisfying(RequestCancelledException.class,
                        e -> assertThat(e.getReason()).isEqualTo(RequestCancelledException.Reason.CANCELED));
    }

    @Test
    @DisplayName("await wakes up on cancellation")
    void awaitWakesUp() {
        RequestContext context = RequestContext.background();
        new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            context.cancel();
        }).start();

        long started = System.nanoTime();
        assertThatThrownBy(() -> context.await(Duration.ofSeconds(10))).isInstanceOf(RequestCancelledException.class);
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
    }
}
