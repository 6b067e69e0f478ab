package com.eainde.langextract.provider;

/**
 * The only capability the pipeline needs from a model backend: send a prompt, get text back.
 *
 * <p>Implementations block until the backend answers and report failures as
 * {@link ProviderException} with the matching {@link ProviderErrorType}. Timeouts and
 * cancellation are enforced by {@link ProviderGateway}, which stops waiting for the call.</p>
 */
public interface LanguageModelClient {

    /** Unique provider name, used in failover events and health reports. */
    String name();

    ProviderType type();

    ModelResponse call(String prompt, ModelConfig config);
}
