package com.eainde.langextract.provider;

import java.time.Duration;
import java.util.List;

/**
 * Successful gateway result.
 *
 * @param attempts       calls made for this request across all providers; 0 for a cache hit
 * @param failoverEvents provider switches that happened before the answer arrived
 */
public record GatewayResponse(
        String text,
        int tokensUsed,
        String provider,
        String modelName,
        Duration latency,
        int attempts,
        boolean cached,
        List<FailoverEvent> failoverEvents
) {

    public GatewayResponse {
        failoverEvents = failoverEvents == null ? List.of() : List.copyOf(failoverEvents);
    }

    GatewayResponse asCached() {
        return new GatewayResponse(text, tokensUsed, provider, modelName, Duration.ZERO, 0, true, List.of());
    }
}
