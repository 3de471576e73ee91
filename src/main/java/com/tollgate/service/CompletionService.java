package com.tollgate.service;

import com.tollgate.cache.CacheMetrics;
import com.tollgate.cache.ResponseCache;
import com.tollgate.model.CompletionRequest;
import com.tollgate.model.ResolvedCompletion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Main completion path: cache lookup, coalescing, then provider forwarding.
 */
@Slf4j
@Service
public class CompletionService {

    private final ResponseCache responseCache;
    private final ProviderService providerService;

    public CompletionService(ResponseCache responseCache, ProviderService providerService) {
        this.responseCache = responseCache;
        this.providerService = providerService;
    }

    /**
     * Resolve a completion through the response cache.
     */
    public Mono<ResolvedCompletion> complete(CompletionRequest request) {
        if (request.getPrompt() == null || request.getPrompt().isBlank()) {
            return Mono.error(new IllegalArgumentException("Prompt cannot be empty"));
        }

        return responseCache.resolve(request, providerService::forward)
                .doOnNext(result -> log.info("Completion served from {}", result.getSource().headerValue()));
    }

    public void clearCache() {
        responseCache.clear();
    }

    public void configureCache(long ttlInSeconds, Integer maxSize) {
        responseCache.configure(ttlInSeconds, maxSize);
    }

    public CacheMetrics getCacheMetrics() {
        return responseCache.metrics();
    }
}
