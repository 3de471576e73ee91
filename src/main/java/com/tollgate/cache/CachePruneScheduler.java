package com.tollgate.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic expiry sweep for the response cache.
 */
@Slf4j
@Component
public class CachePruneScheduler {

    private final ResponseCache responseCache;

    public CachePruneScheduler(ResponseCache responseCache) {
        this.responseCache = responseCache;
    }

    @Scheduled(
            fixedRateString = "#{@tollgateProperties.cache.pruneInterval.toMillis()}",
            initialDelayString = "#{@tollgateProperties.cache.pruneInterval.toMillis()}")
    public void prune() {
        int removed = responseCache.prune();
        log.debug("Scheduled prune removed {} entries", removed);
    }
}
