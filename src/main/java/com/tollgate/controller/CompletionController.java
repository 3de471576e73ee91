package com.tollgate.controller;

import com.tollgate.model.CompletionRequest;
import com.tollgate.model.CompletionResponse;
import com.tollgate.service.CompletionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * Cached completion endpoint with cache provenance headers.
 */
@Slf4j
@RestController
@RequestMapping("/api/llm")
public class CompletionController {

    public static final String CACHE_HIT = "x-cache-hit";
    public static final String CACHE_SOURCE = "x-cache-source";
    public static final String CACHE_KEY = "x-cache-key";

    private final CompletionService completionService;

    public CompletionController(CompletionService completionService) {
        this.completionService = completionService;
    }

    @PostMapping(value = "/completions", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<CompletionResponse>> complete(@RequestBody CompletionRequest request) {
        log.info("Received completion request: provider={}, skipCache={}",
                request.getProvider(), request.isSkipCache());

        return completionService.complete(request)
                .map(resolved -> {
                    HttpHeaders headers = new HttpHeaders();
                    headers.add(CACHE_HIT, String.valueOf(resolved.isCacheHit()));
                    headers.add(CACHE_SOURCE, resolved.getSource().headerValue());
                    if (resolved.getKey() != null) {
                        headers.add(CACHE_KEY, resolved.getKey());
                    }

                    return ResponseEntity.ok()
                            .headers(headers)
                            .body(resolved.getResponse());
                });
    }
}
