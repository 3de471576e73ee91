package com.tollgate.admission;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Gate utilization snapshot. Serialized under the thread-oriented names
 * dashboards already read.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdmissionStats {

    @JsonProperty("activeThreads")
    private int active;

    @JsonProperty("maxThreads")
    private int capacity;

    @JsonProperty("availableThreads")
    private int available;
}
