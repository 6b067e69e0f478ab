package com.eainde.langextract.provider;

import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.request.DefaultChatRequestParameters;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;

/**
 * Maps a {@link ModelConfig} onto langchain4j request parameters, copying only what is set.
 */
public final class ModelParameterMapper {

    private ModelParameterMapper() {
    }

    public static ChatRequestParameters toRequestParameters(ModelConfig config) {
        if (config == null) {
            return ChatRequestParameters.builder().build();
        }

        DefaultChatRequestParameters.Builder<?> builder = ChatRequestParameters.builder();

        if (config.getModelName() != null) {
            builder.modelName(config.getModelName());
        }
        if (config.getMaxOutputTokens() != null) {
            builder.maxOutputTokens(config.getMaxOutputTokens());
        }
        if (config.getTemperature() != null) {
            builder.temperature(config.getTemperature());
        }
        if (config.getTopP() != null) {
            builder.topP(config.getTopP());
        }
        if (config.getTopK() != null) {
            builder.topK(config.getTopK());
        }

        // JSON mode, with the schema when the backend supports structured output
        if (config.wantsJson()) {
            ResponseFormat.Builder format = ResponseFormat.builder().type(ResponseFormatType.JSON);
            if (config.getResponseSchema() != null) {
                format.jsonSchema(config.getResponseSchema());
            }
            builder.responseFormat(format.build());
        }

        return builder.build();
    }
}
