package com.tollgate.provider;

import com.tollgate.model.CompletionRequest;
import com.tollgate.model.CompletionResponse;
import reactor.core.publisher.Mono;

/**
 * Interface for text-generation providers.
 * Implementations handle provider-specific authentication, request/response
 * mapping and API communication.
 */
public interface CompletionProvider {

    /**
     * Which provider this adapter talks to.
     */
    LlmProvider getProvider();

    /**
     * Run a completion.
     *
     * @param request provider-neutral request
     * @return normalized response, or a {@link com.tollgate.exception.ProviderException}
     */
    Mono<CompletionResponse> complete(CompletionRequest request);

    /**
     * Check if provider is enabled in configuration.
     */
    boolean isEnabled();

    /**
     * Check if credentials are present.
     */
    boolean isConfigured();
}
