package com.tollgate.provider;

import com.tollgate.config.TollgateProperties;
import com.tollgate.exception.ProviderException;
import com.tollgate.model.ChatCompletionRequest;
import com.tollgate.model.ChatCompletionResponse;
import com.tollgate.model.CompletionRequest;
import com.tollgate.model.CompletionResponse;
import com.tollgate.model.Message;
import com.tollgate.model.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for providers speaking the OpenAI-style chat completion format.
 */
@Slf4j
public abstract class AbstractCompletionProvider implements CompletionProvider {

    static final double DEFAULT_TEMPERATURE = 0.7;
    static final int DEFAULT_MAX_TOKENS = 1024;
    static final double DEFAULT_TOP_P = 1.0;

    protected final WebClient webClient;
    protected final TollgateProperties.ProviderConfig config;

    protected AbstractCompletionProvider(WebClient webClient, TollgateProperties properties, LlmProvider provider) {
        this.webClient = webClient;
        this.config = properties.getProviders().get(provider.getId());

        if (!isConfigured()) {
            log.warn("API key for provider '{}' is not set. Calls to it will fail.", provider.getId());
        } else {
            log.info("Provider '{}' initialized with model {}", provider.getId(), config.getModel());
        }
    }

    /**
     * Path appended to the configured base URL.
     */
    protected abstract String completionPath();

    @Override
    public boolean isEnabled() {
        return config != null && config.isEnabled();
    }

    @Override
    public boolean isConfigured() {
        return config != null && config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    @Override
    public Mono<CompletionResponse> complete(CompletionRequest request) {
        String name = getProvider().getId();
        if (!isEnabled()) {
            return Mono.error(new ProviderException(name, "Provider " + name + " is not enabled"));
        }
        if (!isConfigured()) {
            return Mono.error(new ProviderException(name,
                    "API key for provider " + name + " is not set. Please configure it to use this provider."));
        }

        log.info("Forwarding request to {}: model={}", name, config.getModel());

        return webClient.post()
                .uri(config.getBaseUrl() + completionPath())
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .bodyValue(toChatRequest(request))
                .retrieve()
                .bodyToMono(ChatCompletionResponse.class)
                .map(this::toCompletionResponse)
                .onErrorMap(WebClientResponseException.class, e -> {
                    log.error("{} API error: status={}, body={}", name, e.getStatusCode(), e.getResponseBodyAsString());
                    return new ProviderException(name, name + " API error: " + e.getStatusCode(), e);
                })
                .doOnError(error -> log.error("Request failed for provider: {}", name, error));
    }

    /**
     * Build the wire request: optional system message, then the prompt.
     */
    ChatCompletionRequest toChatRequest(CompletionRequest request) {
        List<Message> messages = new ArrayList<>();
        if (request.getSystem() != null && !request.getSystem().isEmpty()) {
            messages.add(Message.system(request.getSystem()));
        }
        messages.add(Message.user(request.getPrompt()));

        return ChatCompletionRequest.builder()
                .model(config.getModel())
                .messages(messages)
                .temperature(request.getTemperature() != null ? request.getTemperature() : DEFAULT_TEMPERATURE)
                .maxTokens(request.getMaxTokens() != null ? request.getMaxTokens() : DEFAULT_MAX_TOKENS)
                .topP(request.getTopP() != null ? request.getTopP() : DEFAULT_TOP_P)
                .stop(request.getStopSequences())
                .build();
    }

    CompletionResponse toCompletionResponse(ChatCompletionResponse response) {
        String name = getProvider().getId();
        if (response.getChoices() == null || response.getChoices().isEmpty()
                || response.getChoices().get(0).getMessage() == null) {
            throw new ProviderException(name, name + " returned no choices");
        }

        ChatCompletionResponse.Usage usage = response.getUsage();
        TokenUsage tokens = usage == null ? TokenUsage.empty() : TokenUsage.builder()
                .inputTokens(orZero(usage.getPromptTokens()))
                .outputTokens(orZero(usage.getCompletionTokens()))
                .totalTokens(orZero(usage.getTotalTokens()))
                .build();

        return CompletionResponse.builder()
                .text(response.getChoices().get(0).getMessage().getContent())
                .usage(tokens)
                .provider(name)
                .model(response.getModel() != null ? response.getModel() : config.getModel())
                .build();
    }

    private static int orZero(Integer value) {
        return value == null ? 0 : value;
    }
}
