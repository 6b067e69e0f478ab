package com.eainde.langextract.provider;

import dev.langchain4j.model.chat.request.json.JsonSchema;
import lombok.Builder;
import lombok.Value;

/**
 * Per-call generation settings handed to a {@link LanguageModelClient}. {@code null} fields
 * leave the backend's own default in place.
 */
@Value
@Builder(toBuilder = true)
public class ModelConfig {

    String modelName;
    Double temperature;
    Double topP;
    Integer topK;
    Integer maxOutputTokens;
    /** Ask the backend for JSON output. Implied when {@link #responseSchema} is set. */
    boolean jsonResponse;
    JsonSchema responseSchema;

    public static ModelConfig defaults() {
        return builder().build();
    }

    public boolean wantsJson() {
        return jsonResponse || responseSchema != null;
    }
}
