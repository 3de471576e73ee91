package com.tollgate.activity;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.IntSupplier;

public class InMemorySystemStatsStore implements SystemStatsStore {

    private final AtomicReference<SystemStats> stats;
    private final Clock clock;

    public InMemorySystemStatsStore(Clock clock, int threadLimit) {
        this.clock = clock;
        this.stats = new AtomicReference<>(SystemStats.builder()
                .threadLimit(threadLimit)
                .updatedAt(clock.instant())
                .build());
    }

    @Override
    public void updateActiveThreads(int activeThreads) {
        stats.updateAndGet(s -> s.toBuilder()
                .activeThreads(activeThreads)
                .updatedAt(clock.instant())
                .build());
    }

    @Override
    public void refreshActiveThreads(IntSupplier source) {
        stats.updateAndGet(s -> s.toBuilder()
                .activeThreads(source.getAsInt())
                .updatedAt(clock.instant())
                .build());
    }

    @Override
    public void addApiTokensUsed(long tokens) {
        stats.updateAndGet(s -> s.toBuilder()
                .apiTokensUsed(s.getApiTokensUsed() + tokens)
                .updatedAt(clock.instant())
                .build());
    }

    @Override
    public SystemStats snapshot() {
        return stats.get();
    }
}
