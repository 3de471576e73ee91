package com.tollgate.model;

import com.tollgate.service.AgentType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentTaskRequest {

    private AgentType agentType;

    private String input;

    /**
     * Extra context appended to the prompt.
     */
    private Map<String, Object> context;

    private boolean skipCache;
}
