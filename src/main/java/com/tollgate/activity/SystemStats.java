package com.tollgate.activity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SystemStats {
    private int activeThreads;
    private int threadLimit;
    private long apiTokensUsed;
    private Instant updatedAt;
}
