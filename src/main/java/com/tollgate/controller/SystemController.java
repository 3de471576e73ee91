package com.tollgate.controller;

import com.tollgate.activity.ActivityLog;
import com.tollgate.activity.SystemActivity;
import com.tollgate.activity.SystemStats;
import com.tollgate.activity.SystemStatsStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
public class SystemController {

    private static final int MAX_LIMIT = 500;

    private final ActivityLog activityLog;
    private final SystemStatsStore statsStore;

    public SystemController(ActivityLog activityLog, SystemStatsStore statsStore) {
        this.activityLog = activityLog;
        this.statsStore = statsStore;
    }

    @GetMapping("/system-activities")
    public ResponseEntity<List<SystemActivity>> getActivities(@RequestParam(defaultValue = "20") int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
        return ResponseEntity.ok(activityLog.recent(Math.min(limit, MAX_LIMIT)));
    }

    @GetMapping("/system-stats")
    public ResponseEntity<SystemStats> getSystemStats() {
        return ResponseEntity.ok(statsStore.snapshot());
    }
}
