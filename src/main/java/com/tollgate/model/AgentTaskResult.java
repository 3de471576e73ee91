package com.tollgate.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Outcome of one agent task. Upstream failures are reported here with
 * {@code success=false} rather than as an error signal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AgentTaskResult {
    private boolean success;
    private String output;
    private TokenUsage tokens;
    private String error;
    private Map<String, Object> metadata;
}
