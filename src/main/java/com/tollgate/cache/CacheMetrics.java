package com.tollgate.cache;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Point-in-time cache telemetry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheMetrics {
    private int size;
    private double hitRate;  // 0.0-1.0
    private long hits;
    private long misses;
    private long ttlInSeconds;
    private int maxSize;
}
