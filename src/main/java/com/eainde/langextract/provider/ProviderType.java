package com.eainde.langextract.provider;

import java.util.Locale;
import java.util.Optional;

/**
 * Known provider families. Used to route a request to the provider that serves its model id.
 */
public enum ProviderType {
    OPENAI("gpt-", "o1", "o3", "o4", "text-davinci", "chatgpt"),
    GEMINI("gemini", "models/gemini"),
    OLLAMA("llama", "mistral", "mixtral", "qwen", "phi", "gemma", "codellama", "deepseek");

    private final String[] modelPrefixes;

    ProviderType(String... modelPrefixes) {
        this.modelPrefixes = modelPrefixes;
    }

    /**
     * Detects the provider family from a model id such as {@code gpt-4o} or {@code gemini-1.5-pro}.
     * An explicit {@code family/model} or {@code family:model} prefix wins over detection.
     */
    public static Optional<ProviderType> forModel(String modelId) {
        if (modelId == null || modelId.isBlank()) {
            return Optional.empty();
        }
        String id = modelId.trim().toLowerCase(Locale.ROOT);
        for (ProviderType type : values()) {
            String family = type.name().toLowerCase(Locale.ROOT);
            if (id.startsWith(family + "/") || id.startsWith(family + ":")) {
                return Optional.of(type);
            }
        }
        for (ProviderType type : values()) {
            for (String prefix : type.modelPrefixes) {
                if (id.startsWith(prefix)) {
                    return Optional.of(type);
                }
            }
        }
        return Optional.empty();
    }

    public static Optional<ProviderType> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
