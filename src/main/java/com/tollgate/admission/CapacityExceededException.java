package com.tollgate.admission;

import lombok.Getter;

/**
 * Thrown when the admission gate has no free slot. Callers may retry later.
 */
@Getter
public class CapacityExceededException extends RuntimeException {

    private final int active;
    private final int capacity;

    public CapacityExceededException(int active, int capacity) {
        super("Thread limit reached (" + active + "/" + capacity + "). Try again later.");
        this.active = active;
        this.capacity = capacity;
    }
}
