package com.tollgate.activity;

import com.tollgate.admission.AdmissionGate;
import com.tollgate.admission.AdmissionListener;
import com.tollgate.admission.AdmissionStats;

/**
 * Mirrors the gate's active count into the shared system stats.
 *
 * The count is read from the gate at write time rather than taken from the
 * notification snapshot: overlapping releases can deliver snapshots out of
 * order, and the store must end up matching the gate.
 */
public class UsageCounterAdmissionListener implements AdmissionListener {

    private final SystemStatsStore statsStore;
    private final AdmissionGate gate;

    public UsageCounterAdmissionListener(SystemStatsStore statsStore, AdmissionGate gate) {
        this.statsStore = statsStore;
        this.gate = gate;
    }

    /**
     * Create the listener and register it on {@code gate}.
     */
    public static UsageCounterAdmissionListener attach(SystemStatsStore statsStore, AdmissionGate gate) {
        UsageCounterAdmissionListener listener = new UsageCounterAdmissionListener(statsStore, gate);
        gate.addListener(listener);
        return listener;
    }

    @Override
    public void onAdmitted(String description, AdmissionStats stats) {
        refresh();
    }

    @Override
    public void onReleased(String description, AdmissionStats stats) {
        refresh();
    }

    private void refresh() {
        statsStore.refreshActiveThreads(() -> gate.stats().getActive());
    }
}
