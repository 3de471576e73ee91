package com.tollgate.activity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ActivityType {
    API_CALL("api_call"),
    THREAD_ALLOCATION("thread_allocation"),
    THREAD_RELEASE("thread_release"),
    AGENT_STATUS_CHANGE("agent_status_change"),
    SYSTEM_ERROR("system_error");

    private final String value;

    ActivityType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
