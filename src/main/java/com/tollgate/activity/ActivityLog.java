package com.tollgate.activity;

import java.util.List;
import java.util.Map;

/**
 * Append-only activity timeline shared with the dashboard.
 */
public interface ActivityLog {

    SystemActivity record(ActivityType type, String description, Map<String, Object> metadata);

    /**
     * Most recent activities, newest first.
     */
    List<SystemActivity> recent(int limit);
}
