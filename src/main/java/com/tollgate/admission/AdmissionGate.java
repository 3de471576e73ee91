package com.tollgate.admission;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Caps the number of concurrently running costly operations.
 *
 * Admission is a compare-and-set on a single counter: a caller either gets a
 * slot immediately or is rejected immediately. There is no wait queue and no
 * fairness; rejected callers decide for themselves whether to retry.
 */
@Slf4j
public class AdmissionGate {

    private final AtomicInteger active = new AtomicInteger();
    private final int capacity;
    private final List<AdmissionListener> listeners = new CopyOnWriteArrayList<>();

    public AdmissionGate(int capacity) {
        this(capacity, List.of());
    }

    public AdmissionGate(int capacity, List<AdmissionListener> listeners) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1, got " + capacity);
        }
        this.capacity = capacity;
        this.listeners.addAll(listeners);
        log.info("Admission gate initialized with {} max threads", capacity);
    }

    /**
     * Try to take a slot without blocking.
     *
     * @param description what the slot is for, forwarded to listeners
     * @return the admission handle, or empty when every slot is taken
     */
    public Optional<Admission> tryAdmit(String description) {
        while (true) {
            int current = active.get();
            if (current >= capacity) {
                log.warn("Thread limit reached: {}/{}, rejecting: {}", current, capacity, description);
                return Optional.empty();
            }
            if (active.compareAndSet(current, current + 1)) {
                log.debug("Allocating thread for {}. Active threads: {}/{}", description, current + 1, capacity);
                Admission admission = new Admission(this, description);
                notifyListeners(description, true);
                return Optional.of(admission);
            }
        }
    }

    /**
     * Run {@code work} inside a slot. The slot is held from subscription until
     * the work completes, fails or is cancelled.
     *
     * @param description what the work is, forwarded to listeners
     * @param work deferred unit of work
     * @return the work's result, or {@link CapacityExceededException} when full
     */
    public <T> Mono<T> execute(String description, Supplier<Mono<T>> work) {
        return Mono.usingWhen(
                Mono.fromSupplier(() -> tryAdmit(description)
                        .orElseThrow(() -> new CapacityExceededException(active.get(), capacity))),
                admission -> Mono.defer(work),
                admission -> Mono.fromRunnable(admission::release),
                (admission, error) -> Mono.fromRunnable(admission::release),
                admission -> Mono.fromRunnable(admission::release));
    }

    public AdmissionStats stats() {
        int current = active.get();
        return AdmissionStats.builder()
                .active(current)
                .capacity(capacity)
                .available(capacity - current)
                .build();
    }

    public int getCapacity() {
        return capacity;
    }

    public void addListener(AdmissionListener listener) {
        listeners.add(listener);
    }

    /**
     * Called once per admission by {@link Admission#release()}.
     */
    void release(Admission admission) {
        int remaining = active.decrementAndGet();
        log.debug("Thread released for {}. Active threads: {}/{}", admission.getDescription(), remaining, capacity);
        notifyListeners(admission.getDescription(), false);
    }

    private void notifyListeners(String description, boolean admitted) {
        AdmissionStats snapshot = stats();
        for (AdmissionListener listener : listeners) {
            try {
                if (admitted) {
                    listener.onAdmitted(description, snapshot);
                } else {
                    listener.onReleased(description, snapshot);
                }
            } catch (RuntimeException e) {
                log.warn("Admission listener {} failed: {}", listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }
}
