package com.tollgate.activity;

import java.util.function.IntSupplier;

/**
 * Shared usage counters read by the dashboard.
 */
public interface SystemStatsStore {

    void updateActiveThreads(int activeThreads);

    /**
     * Set the active count from {@code source}, read inside the update so
     * the last write always carries the latest reading.
     */
    void refreshActiveThreads(IntSupplier source);

    void addApiTokensUsed(long tokens);

    SystemStats snapshot();
}
