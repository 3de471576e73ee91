package com.tollgate.activity;

import com.tollgate.admission.AdmissionListener;
import com.tollgate.admission.AdmissionStats;

import java.util.Map;

/**
 * Writes gate allocations and releases to the activity timeline.
 */
public class ActivityLogAdmissionListener implements AdmissionListener {

    private final ActivityLog activityLog;

    public ActivityLogAdmissionListener(ActivityLog activityLog) {
        this.activityLog = activityLog;
    }

    @Override
    public void onAdmitted(String description, AdmissionStats stats) {
        activityLog.record(ActivityType.THREAD_ALLOCATION, "Thread allocated for: " + description, metadata(stats));
    }

    @Override
    public void onReleased(String description, AdmissionStats stats) {
        activityLog.record(ActivityType.THREAD_RELEASE, "Thread released for: " + description, metadata(stats));
    }

    private static Map<String, Object> metadata(AdmissionStats stats) {
        return Map.of(
                "activeThreads", stats.getActive(),
                "maxThreads", stats.getCapacity());
    }
}
