package com.tollgate.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Token counts reported by a provider.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenUsage {
    private int inputTokens;
    private int outputTokens;
    private int totalTokens;

    public static TokenUsage empty() {
        return new TokenUsage(0, 0, 0);
    }
}
