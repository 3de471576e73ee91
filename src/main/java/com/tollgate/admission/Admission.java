package com.tollgate.admission;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle for one admitted unit of work. Releasing returns the slot to the
 * gate; only the first release has any effect.
 */
public final class Admission implements AutoCloseable {

    private final AdmissionGate gate;
    private final String description;
    private final AtomicBoolean released = new AtomicBoolean();

    Admission(AdmissionGate gate, String description) {
        this.gate = gate;
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isReleased() {
        return released.get();
    }

    public void release() {
        if (released.compareAndSet(false, true)) {
            gate.release(this);
        }
    }

    @Override
    public void close() {
        release();
    }
}
