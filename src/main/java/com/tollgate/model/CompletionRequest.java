package com.tollgate.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tollgate.provider.LlmProvider;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Provider-neutral text-generation request.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CompletionRequest {

    private String prompt;

    /**
     * System / instruction text sent ahead of the prompt.
     */
    private String system;

    /**
     * Explicit provider; the process-wide default applies when null.
     */
    private LlmProvider provider;

    private Double temperature;

    private Integer maxTokens;

    private Double topP;

    private List<String> stopSequences;

    /**
     * Force a fresh upstream answer, bypassing cache and coalescing.
     */
    private boolean skipCache;

    /**
     * Caller context (agent, task id...). Never part of the cache key.
     */
    private Map<String, Object> metadata;
}
