package com.eainde.langextract.provider;

import java.time.Instant;

/**
 * One switch from a failing provider to the next one in priority order.
 *
 * @param fallbackProvider {@code null} when there was nothing left to fall back to
 * @param success          whether the fallback provider went on to answer
 */
public record FailoverEvent(
        Instant timestamp,
        String originalProvider,
        String failureReason,
        String fallbackProvider,
        boolean success
) {

    FailoverEvent withSuccess(boolean succeeded) {
        return new FailoverEvent(timestamp, originalProvider, failureReason, fallbackProvider, succeeded);
    }
}
