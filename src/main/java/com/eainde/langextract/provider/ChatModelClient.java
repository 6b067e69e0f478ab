package com.eainde.langextract.provider;

import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.InvalidRequestException;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.exception.TimeoutException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.log4j.Log4j2;

import java.util.Objects;

/**
 * {@link LanguageModelClient} backed by any langchain4j {@link ChatModel}.
 *
 * <h3>Error mapping:</h3>
 * <pre>
 * TimeoutException          → TIMEOUT
 * RateLimitException        → RATE_LIMIT
 * AuthenticationException   → AUTHENTICATION
 * InvalidRequestException   → INVALID_REQUEST
 * other RetriableException  → SERVER_ERROR
 * other NonRetriableException → INVALID_REQUEST
 * anything else             → UNKNOWN
 * </pre>
 */
@Log4j2
public class ChatModelClient implements LanguageModelClient {

    private final String name;
    private final ProviderType type;
    private final ChatModel chatModel;

    public ChatModelClient(String name, ProviderType type, ChatModel chatModel) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.chatModel = Objects.requireNonNull(chatModel, "chatModel");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ProviderType type() {
        return type;
    }

    @Override
    public ModelResponse call(String prompt, ModelConfig config) {
        ChatRequest request = ChatRequest.builder()
                .messages(UserMessage.from(prompt))
                .parameters(ModelParameterMapper.toRequestParameters(config))
                .build();

        ChatResponse response;
        try {
            response = chatModel.chat(request);
        } catch (RuntimeException e) {
            throw toProviderException(e);
        }

        if (response == null || response.aiMessage() == null || response.aiMessage().text() == null) {
            throw new ProviderException(ProviderErrorType.SERVER_ERROR, name, "empty response from " + name);
        }

        TokenUsage usage = response.tokenUsage();
        int tokens = usage != null && usage.totalTokenCount() != null ? usage.totalTokenCount() : 0;
        String model = response.metadata() != null && response.metadata().modelName() != null
                ? response.metadata().modelName()
                : config == null ? null : config.getModelName();

        log.debug("{} answered: {} chars, {} tokens", name, response.aiMessage().text().length(), tokens);
        return new ModelResponse(response.aiMessage().text(), tokens, model);
    }

    ProviderException toProviderException(RuntimeException e) {
        ProviderErrorType type;
        if (e instanceof TimeoutException) {
            type = ProviderErrorType.TIMEOUT;
        } else if (e instanceof RateLimitException) {
            type = ProviderErrorType.RATE_LIMIT;
        } else if (e instanceof AuthenticationException) {
            type = ProviderErrorType.AUTHENTICATION;
        } else if (e instanceof InvalidRequestException) {
            type = ProviderErrorType.INVALID_REQUEST;
        } else if (e instanceof RetriableException) {
            type = ProviderErrorType.SERVER_ERROR;
        } else if (e instanceof NonRetriableException) {
            type = ProviderErrorType.INVALID_REQUEST;
        } else {
            type = ProviderErrorType.UNKNOWN;
        }
        return new ProviderException(type, name, name + " call failed: " + e.getMessage(), e);
    }

    @Override
    public String toString() {
        return "ChatModelClient{name=" + name + ", type=" + type + "}";
    }
}
