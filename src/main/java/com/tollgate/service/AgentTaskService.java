package com.tollgate.service;

import com.tollgate.activity.ActivityLog;
import com.tollgate.activity.ActivityType;
import com.tollgate.activity.SystemStatsStore;
import com.tollgate.admission.AdmissionGate;
import com.tollgate.admission.CapacityExceededException;
import com.tollgate.model.AgentTaskRequest;
import com.tollgate.model.AgentTaskResult;
import com.tollgate.model.CompletionRequest;
import com.tollgate.model.ResolvedCompletion;
import com.tollgate.model.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Runs agent tasks under the admission gate.
 *
 * Each task takes a gate slot, resolves its prompt through the response
 * cache, and adds the tokens it used to the shared stats. A full gate is
 * reported to the caller as {@link CapacityExceededException}; provider
 * failures become unsuccessful results.
 */
@Slf4j
@Service
public class AgentTaskService {

    private static final int DESCRIPTION_PREVIEW = 50;

    private final AdmissionGate admissionGate;
    private final CompletionService completionService;
    private final SystemStatsStore statsStore;
    private final ActivityLog activityLog;
    private final Clock clock;

    public AgentTaskService(AdmissionGate admissionGate,
                            CompletionService completionService,
                            SystemStatsStore statsStore,
                            ActivityLog activityLog,
                            Clock clock) {
        this.admissionGate = admissionGate;
        this.completionService = completionService;
        this.statsStore = statsStore;
        this.activityLog = activityLog;
        this.clock = clock;
    }

    public Mono<AgentTaskResult> execute(AgentTaskRequest task) {
        if (task.getAgentType() == null) {
            return Mono.error(new IllegalArgumentException("agentType must be specified"));
        }
        if (task.getInput() == null || task.getInput().isBlank()) {
            return Mono.error(new IllegalArgumentException("input cannot be empty"));
        }

        AgentType agent = task.getAgentType();
        String description = describe(agent, task.getInput());

        return admissionGate.execute(description, () -> completionService.complete(toCompletionRequest(task)))
                .map(resolved -> success(agent, resolved))
                .onErrorResume(error -> !(error instanceof CapacityExceededException)
                        && !(error instanceof IllegalArgumentException),
                        error -> Mono.just(failure(agent, error)));
    }

    CompletionRequest toCompletionRequest(AgentTaskRequest task) {
        StringBuilder prompt = new StringBuilder(task.getInput());
        if (task.getContext() != null && !task.getContext().isEmpty()) {
            prompt.append("\n\nContext:");
            task.getContext().forEach((k, v) -> prompt.append("\n- ").append(k).append(": ").append(v));
        }

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("agent", task.getAgentType().getId());

        return CompletionRequest.builder()
                .prompt(prompt.toString())
                .system(task.getAgentType().getInstruction())
                .skipCache(task.isSkipCache())
                .metadata(metadata)
                .build();
    }

    private AgentTaskResult success(AgentType agent, ResolvedCompletion resolved) {
        TokenUsage tokens = resolved.getResponse().getUsage() != null
                ? resolved.getResponse().getUsage()
                : TokenUsage.empty();

        // Hits and coalesced joiners cost nothing upstream
        if (resolved.getSource().isUpstreamCall() && tokens.getTotalTokens() > 0) {
            statsStore.addApiTokensUsed(tokens.getTotalTokens());
        }

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("timestamp", clock.instant().toString());
        metadata.put("action", "process");
        metadata.put("agent", agent.getId());
        metadata.put("source", resolved.getSource().headerValue());

        return AgentTaskResult.builder()
                .success(true)
                .output(resolved.getResponse().getText())
                .tokens(tokens)
                .metadata(metadata)
                .build();
    }

    private AgentTaskResult failure(AgentType agent, Throwable error) {
        log.error("Error in {}: {}", agent.getDisplayName(), error.getMessage(), error);

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("timestamp", clock.instant().toString());
        metadata.put("action", "error_handler");
        metadata.put("agent", agent.getId());
        metadata.put("errorType", error.getClass().getSimpleName());

        try {
            activityLog.record(ActivityType.SYSTEM_ERROR,
                    agent.getDisplayName() + " failed: " + error.getMessage(), Map.of("agent", agent.getId()));
        } catch (RuntimeException e) {
            log.warn("Failed to record error activity for {}", agent.getDisplayName(), e);
        }

        return AgentTaskResult.builder()
                .success(false)
                .output("")
                .error(error.getMessage() != null ? error.getMessage() : "Unknown error")
                .metadata(metadata)
                .build();
    }

    static String describe(AgentType agent, String input) {
        String preview = input.length() > DESCRIPTION_PREVIEW
                ? input.substring(0, DESCRIPTION_PREVIEW) + "..."
                : input;
        return agent.getDisplayName() + " processing: " + preview;
    }
}
