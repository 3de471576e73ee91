package com.tollgate.service;

import com.tollgate.exception.ProviderException;
import com.tollgate.model.CompletionRequest;
import com.tollgate.model.CompletionResponse;
import com.tollgate.provider.CompletionProvider;
import com.tollgate.provider.LlmProvider;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Routes completion requests to the requested provider, or the process-wide
 * default when the request doesn't name one.
 */
@Slf4j
public class ProviderService {

    private final Map<LlmProvider, CompletionProvider> providers = new EnumMap<>(LlmProvider.class);
    private final AtomicReference<LlmProvider> defaultProvider;

    public ProviderService(List<CompletionProvider> providers, LlmProvider defaultProvider) {
        providers.forEach(p -> this.providers.put(p.getProvider(), p));
        this.defaultProvider = new AtomicReference<>(defaultProvider);
        log.info("Initialized ProviderService with providers {} and default provider: {}",
                this.providers.keySet(), defaultProvider.getId());
    }

    /**
     * Forward a request to its provider.
     */
    public Mono<CompletionResponse> forward(CompletionRequest request) {
        LlmProvider target = request.getProvider() != null ? request.getProvider() : defaultProvider.get();
        CompletionProvider provider = providers.get(target);

        if (provider == null) {
            log.error("No provider registered for {}", target.getId());
            return Mono.error(new ProviderException(target.getId(),
                    "Unsupported LLM provider: " + target.getId()));
        }

        log.debug("Routing request to provider '{}'", target.getId());

        return provider.complete(request)
                .doOnSuccess(response -> log.debug("Received response from provider: {}", target.getId()))
                .doOnError(error -> log.error("LLM service error from {}: {}", target.getId(), error.getMessage()));
    }

    public LlmProvider getDefaultProvider() {
        return defaultProvider.get();
    }

    public void setDefaultProvider(LlmProvider provider) {
        if (provider == null) {
            throw new IllegalArgumentException("provider must not be null");
        }
        LlmProvider previous = defaultProvider.getAndSet(provider);
        log.info("Default LLM provider changed from {} to {}", previous.getId(), provider.getId());
    }
}
