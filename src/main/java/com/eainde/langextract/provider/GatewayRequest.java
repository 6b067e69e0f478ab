package com.eainde.langextract.provider;

import java.util.Objects;

/**
 * One prompt to run through the gateway.
 *
 * @param retryCount        extra attempts per provider on recoverable errors; negative means none
 * @param preferredProvider provider name tried first, or {@code null}
 * @param pass              extraction pass number; part of the cache key so passes stay distinct
 */
public record GatewayRequest(
        String prompt,
        ModelConfig modelConfig,
        int retryCount,
        String preferredProvider,
        int pass
) {

    public GatewayRequest {
        Objects.requireNonNull(prompt, "prompt");
        modelConfig = modelConfig == null ? ModelConfig.defaults() : modelConfig;
    }

    public static GatewayRequest of(String prompt, ModelConfig modelConfig) {
        return new GatewayRequest(prompt, modelConfig, 0, null, 1);
    }

    public int attemptsPerProvider() {
        return 1 + Math.max(0, retryCount);
    }
}
