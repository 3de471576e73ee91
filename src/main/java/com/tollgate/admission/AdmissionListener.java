package com.tollgate.admission;

/**
 * Receives admission lifecycle notifications. Implementations must be
 * cheap; a thrown exception is logged by the gate and otherwise ignored.
 */
public interface AdmissionListener {

    void onAdmitted(String description, AdmissionStats stats);

    void onReleased(String description, AdmissionStats stats);
}
