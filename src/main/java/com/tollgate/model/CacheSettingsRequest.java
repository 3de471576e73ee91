package com.tollgate.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheSettingsRequest {
    private Integer ttlInSeconds;
    private Integer maxSize;  // optional, keeps the current capacity when null
}
