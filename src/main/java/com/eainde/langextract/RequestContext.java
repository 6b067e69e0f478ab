package com.eainde.langextract;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellable, deadline-bound execution context carried by one request.
 *
 * <p>Blocking operations either poll {@link #isDone()} / {@link #throwIfDone()}, wait through
 * {@link #await(Duration)} (which wakes up on cancellation), or register a callback with
 * {@link #onCancel(Runnable)}. Deadline expiry is observed lazily: it counts as done the
 * moment {@link #remaining()} reaches zero.</p>
 */
public final class RequestContext {

    private final Instant deadline;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final CountDownLatch cancelLatch = new CountDownLatch(1);
    private final List<Runnable> cancelCallbacks = new CopyOnWriteArrayList<>();

    private RequestContext(Instant deadline) {
        this.deadline = deadline;
    }

    /** Context with no deadline. */
    public static RequestContext background() {
        return new RequestContext(null);
    }

    public static RequestContext withTimeout(Duration timeout) {
        return new RequestContext(Instant.now().plus(timeout));
    }

    public static RequestContext withDeadline(Instant deadline) {
        return new RequestContext(deadline);
    }

    public boolean hasDeadline() {
        return deadline != null;
    }

    public Instant getDeadline() {
        return deadline;
    }

    /**
     * Time left before the deadline; {@code null} if there is none, never negative.
     */
    public Duration remaining() {
        if (deadline == null) {
            return null;
        }
        Duration left = Duration.between(Instant.now(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isExpired() {
        return deadline != null && !Instant.now().isBefore(deadline);
    }

    public boolean isDone() {
        return isCancelled() || isExpired();
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            cancelLatch.countDown();
            for (Runnable callback : cancelCallbacks) {
                callback.run();
            }
        }
    }

    /**
     * Runs the callback on cancellation, immediately if already cancelled.
     *
     * @return handle that deregisters the callback
     */
    public Runnable onCancel(Runnable callback) {
        cancelCallbacks.add(callback);
        if (isCancelled() && cancelCallbacks.remove(callback)) {
            callback.run();
        }
        return () -> cancelCallbacks.remove(callback);
    }

    public void throwIfDone() {
        if (isCancelled()) {
            throw new RequestCancelledException(RequestCancelledException.Reason.CANCELED, "request canceled");
        }
        if (isExpired()) {
            throw new RequestCancelledException(RequestCancelledException.Reason.DEADLINE_EXCEEDED,
                    "request deadline exceeded");
        }
    }

    /**
     * Sleeps for the given time, waking early on cancellation, and never past the deadline.
     *
     * @throws RequestCancelledException if the context is done when the wait ends
     */
    public void await(Duration duration) {
        Duration wait = duration;
        Duration left = remaining();
        if (left != null && left.compareTo(wait) < 0) {
            wait = left;
        }
        try {
            cancelLatch.await(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RequestCancelledException(RequestCancelledException.Reason.CANCELED, "interrupted while waiting");
        }
        throwIfDone();
    }
}
