package com.tollgate.controller;

import com.tollgate.cache.CacheMetrics;
import com.tollgate.model.CacheSettingsRequest;
import com.tollgate.service.CompletionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response cache management: statistics, clearing and settings.
 */
@Slf4j
@RestController
@RequestMapping("/api")
public class CacheController {

    private final CompletionService completionService;

    public CacheController(CompletionService completionService) {
        this.completionService = completionService;
    }

    @GetMapping("/llm-cache-stats")
    public ResponseEntity<CacheMetrics> getStats() {
        return ResponseEntity.ok(completionService.getCacheMetrics());
    }

    @PostMapping("/llm-cache/clear")
    public ResponseEntity<Map<String, Object>> clearCache() {
        log.info("Cache clear requested");
        completionService.clearCache();

        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "LLM cache cleared"
        ));
    }

    /**
     * Update TTL and capacity. Invalid values are rejected before the cache
     * is touched.
     */
    @PostMapping("/llm-cache/settings")
    public ResponseEntity<Map<String, Object>> updateSettings(@RequestBody CacheSettingsRequest settings) {
        if (settings.getTtlInSeconds() == null || settings.getTtlInSeconds() < 1) {
            throw new IllegalArgumentException("ttlInSeconds must be an integer >= 1");
        }
        if (settings.getMaxSize() != null && settings.getMaxSize() < 1) {
            throw new IllegalArgumentException("maxSize must be an integer >= 1");
        }

        log.info("Cache settings update requested: ttlInSeconds={}, maxSize={}",
                settings.getTtlInSeconds(), settings.getMaxSize());
        completionService.configureCache(settings.getTtlInSeconds(), settings.getMaxSize());
        CacheMetrics metrics = completionService.getCacheMetrics();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("ttlInSeconds", metrics.getTtlInSeconds());
        body.put("maxSize", metrics.getMaxSize());
        return ResponseEntity.ok(body);
    }
}
