package com.tollgate.activity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * One entry in the system activity timeline.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemActivity {
    private long id;
    private ActivityType type;
    private String description;
    private Map<String, Object> metadata;
    private Instant timestamp;
}
