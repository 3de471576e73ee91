package com.tollgate.service;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Simulated agents and the role instruction each one sends upstream.
 */
public enum AgentType {
    DESIGN("design", "Design Agent",
            "You are a software design agent. Produce clear architecture and interface proposals."),
    CODING("coding", "Coding Agent",
            "You are a coding agent. Write correct, idiomatic code for the request."),
    SUPERVISION("supervision", "Supervision Agent",
            "You are a supervision agent. Review the work of other agents and point out problems."),
    DEBUG("debug", "Debug Agent",
            "You are a debugging agent. Find the root cause of the reported problem and propose a fix."),
    SELF_HEALING("self_healing", "Self-Healing Agent",
            "You are a self-healing agent. Diagnose system errors and describe a recovery plan.");

    private final String id;
    private final String displayName;
    private final String instruction;

    AgentType(String id, String displayName, String instruction) {
        this.id = id;
        this.displayName = displayName;
        this.instruction = instruction;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getInstruction() {
        return instruction;
    }

    @JsonCreator
    public static AgentType fromId(String id) {
        for (AgentType type : values()) {
            if (type.id.equalsIgnoreCase(id) || type.name().equalsIgnoreCase(id)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown agent type: " + id);
    }
}
