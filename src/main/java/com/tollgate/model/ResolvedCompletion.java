package com.tollgate.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Completion tagged with its cache provenance.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolvedCompletion {

    private CompletionResponse response;

    private ResponseSource source;

    /**
     * Cache key, null for bypassed requests.
     */
    private String key;

    public boolean isCacheHit() {
        return source != null && source.isCacheHit();
    }
}
