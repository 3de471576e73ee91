package com.tollgate.controller;

import com.tollgate.admission.AdmissionGate;
import com.tollgate.admission.AdmissionStats;
import com.tollgate.model.AgentTaskRequest;
import com.tollgate.model.AgentTaskResult;
import com.tollgate.service.AgentTaskService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * Agent task execution and gate utilization.
 */
@Slf4j
@RestController
@RequestMapping("/api")
public class AgentTaskController {

    private final AgentTaskService agentTaskService;
    private final AdmissionGate admissionGate;

    public AgentTaskController(AgentTaskService agentTaskService, AdmissionGate admissionGate) {
        this.agentTaskService = agentTaskService;
        this.admissionGate = admissionGate;
    }

    @PostMapping("/agent-tasks")
    public Mono<ResponseEntity<AgentTaskResult>> execute(@RequestBody AgentTaskRequest request) {
        log.info("Agent task requested: agent={}", request.getAgentType());
        return agentTaskService.execute(request).map(ResponseEntity::ok);
    }

    @GetMapping("/thread-stats")
    public ResponseEntity<AdmissionStats> getThreadStats() {
        return ResponseEntity.ok(admissionGate.stats());
    }
}
