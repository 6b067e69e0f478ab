package com.eainde.langextract.provider;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Retry, health and cache settings for {@link ProviderGateway}.
 */
@Value
@Builder(toBuilder = true)
public class ProviderGatewayConfig {

    @Builder.Default
    int unhealthyThreshold = 3;
    @Builder.Default
    int recoveryThreshold = 2;

    @Builder.Default
    Duration backoffInitial = Duration.ofMillis(500);
    @Builder.Default
    double backoffMultiplier = 2.0;
    @Builder.Default
    Duration backoffMax = Duration.ofSeconds(8);

    /** Upper bound for one attempt; the request deadline caps it further. */
    @Builder.Default
    Duration callTimeout = Duration.ofSeconds(30);

    @Builder.Default
    boolean cacheEnabled = true;
    @Builder.Default
    long cacheMaxSize = 1000;
    @Builder.Default
    Duration cacheTtl = Duration.ofMinutes(5);

    public static ProviderGatewayConfig defaults() {
        return builder().build();
    }

    /**
     * Delay before attempt {@code attempt + 1}, where {@code attempt} counts from 1.
     */
    public Duration backoffFor(int attempt) {
        double millis = backoffInitial.toMillis() * Math.pow(backoffMultiplier, Math.max(0, attempt - 1));
        long capped = (long) Math.min(millis, backoffMax.toMillis());
        return Duration.ofMillis(Math.max(0, capped));
    }
}
