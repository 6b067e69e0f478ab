package com.eainde.langextract.provider;

import java.time.Instant;

/**
 * Point-in-time health snapshot of one provider.
 */
public record ProviderHealthReport(
        String provider,
        boolean healthy,
        int consecutiveSuccesses,
        int consecutiveFailures,
        long totalCalls,
        long totalFailures,
        double averageLatencyMillis,
        String lastError,
        Instant lastCheck
) {

    public double errorRate() {
        return totalCalls == 0 ? 0.0 : (double) totalFailures / totalCalls;
    }
}
