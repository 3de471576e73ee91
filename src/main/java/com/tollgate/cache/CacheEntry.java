package com.tollgate.cache;

import com.tollgate.model.CompletionResponse;
import lombok.Value;

import java.time.Instant;

/**
 * Immutable cached response. {@code sequence} breaks ties between entries
 * created within the same clock tick.
 */
@Value
public class CacheEntry {
    CompletionResponse response;
    Instant createdAt;
    Instant expiresAt;
    long sequence;

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
