package com.tollgate.config;

import com.tollgate.activity.ActivityLog;
import com.tollgate.activity.ActivityLogAdmissionListener;
import com.tollgate.activity.InMemoryActivityLog;
import com.tollgate.activity.InMemorySystemStatsStore;
import com.tollgate.activity.SystemStatsStore;
import com.tollgate.activity.UsageCounterAdmissionListener;
import com.tollgate.admission.AdmissionGate;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Admission gate and the activity/stats stores it reports to.
 */
@Configuration
public class AdmissionConfiguration {

    private final TollgateProperties properties;

    public AdmissionConfiguration(TollgateProperties properties) {
        this.properties = properties;
    }

    @Bean
    public ActivityLog activityLog(Clock clock) {
        return new InMemoryActivityLog(clock);
    }

    @Bean
    public SystemStatsStore systemStatsStore(Clock clock) {
        return new InMemorySystemStatsStore(clock, properties.getAdmission().resolveCapacity());
    }

    @Bean
    public AdmissionGate admissionGate(ActivityLog activityLog, SystemStatsStore systemStatsStore) {
        AdmissionGate gate = new AdmissionGate(
                properties.getAdmission().resolveCapacity(),
                List.of(new ActivityLogAdmissionListener(activityLog)));
        UsageCounterAdmissionListener.attach(systemStatsStore, gate);
        return gate;
    }
}
