package com.eainde.langextract.provider;

import java.time.Duration;
import java.time.Instant;

/**
 * Rolling health counters for one provider. A provider turns unhealthy after
 * {@code unhealthyThreshold} consecutive failures and healthy again after
 * {@code recoveryThreshold} consecutive successes.
 */
final class ProviderHealth {

    private final String provider;
    private final int unhealthyThreshold;
    private final int recoveryThreshold;

    private boolean healthy = true;
    private int consecutiveSuccesses;
    private int consecutiveFailures;
    private long totalCalls;
    private long totalFailures;
    private long totalLatencyMillis;
    private String lastError;
    private Instant lastCheck;

    ProviderHealth(String provider, int unhealthyThreshold, int recoveryThreshold) {
        this.provider = provider;
        this.unhealthyThreshold = unhealthyThreshold;
        this.recoveryThreshold = recoveryThreshold;
    }

    synchronized void recordSuccess(Duration latency) {
        totalCalls++;
        totalLatencyMillis += latency.toMillis();
        consecutiveFailures = 0;
        consecutiveSuccesses++;
        lastCheck = Instant.now();
        if (!healthy && consecutiveSuccesses >= recoveryThreshold) {
            healthy = true;
        }
    }

    synchronized void recordFailure(Duration latency, String error) {
        totalCalls++;
        totalFailures++;
        totalLatencyMillis += latency.toMillis();
        consecutiveSuccesses = 0;
        consecutiveFailures++;
        lastError = error;
        lastCheck = Instant.now();
        if (healthy && consecutiveFailures >= unhealthyThreshold) {
            healthy = false;
        }
    }

    synchronized boolean isHealthy() {
        return healthy;
    }

    synchronized ProviderHealthReport report() {
        double averageLatency = totalCalls == 0 ? 0.0 : (double) totalLatencyMillis / totalCalls;
        return new ProviderHealthReport(provider, healthy, consecutiveSuccesses, consecutiveFailures,
                totalCalls, totalFailures, averageLatency, lastError, lastCheck);
    }
}
