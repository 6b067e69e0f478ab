package com.eainde.langextract.provider;

/**
 * Raw result of one model call.
 *
 * @param tokensUsed total tokens reported by the backend, 0 when unknown
 */
public record ModelResponse(String text, int tokensUsed, String modelName) {
}
