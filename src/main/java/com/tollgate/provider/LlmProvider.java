package com.tollgate.provider;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Configured upstream text-generation providers.
 */
public enum LlmProvider {
    GROQ("groq"),
    PHIDATA("phidata");

    private final String id;

    LlmProvider(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    /**
     * Parse a provider id, case-insensitively.
     *
     * @throws IllegalArgumentException for unknown ids
     */
    @JsonCreator
    public static LlmProvider fromId(String id) {
        if (id != null) {
            for (LlmProvider provider : values()) {
                if (provider.id.equalsIgnoreCase(id.trim())) {
                    return provider;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported LLM provider: " + id + ". Expected one of "
                + Arrays.stream(values()).map(LlmProvider::getId).collect(Collectors.toList()));
    }
}
