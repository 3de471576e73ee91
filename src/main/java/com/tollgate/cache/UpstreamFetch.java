package com.tollgate.cache;

import com.tollgate.model.CompletionRequest;
import com.tollgate.model.CompletionResponse;
import reactor.core.publisher.Mono;

/**
 * The costly computation a {@link ResponseCache} memoizes.
 */
@FunctionalInterface
public interface UpstreamFetch {

    Mono<CompletionResponse> fetch(CompletionRequest request);
}
