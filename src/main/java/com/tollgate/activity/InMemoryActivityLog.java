package com.tollgate.activity;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded in-memory activity log; the oldest records fall off once
 * {@code capacity} is reached.
 */
@Slf4j
public class InMemoryActivityLog implements ActivityLog {

    public static final int DEFAULT_CAPACITY = 500;

    private final Deque<SystemActivity> activities = new ArrayDeque<>();
    private final AtomicLong ids = new AtomicLong();
    private final Clock clock;
    private final int capacity;

    public InMemoryActivityLog(Clock clock) {
        this(clock, DEFAULT_CAPACITY);
    }

    public InMemoryActivityLog(Clock clock, int capacity) {
        this.clock = clock;
        this.capacity = capacity;
    }

    @Override
    public SystemActivity record(ActivityType type, String description, Map<String, Object> metadata) {
        SystemActivity activity = SystemActivity.builder()
                .id(ids.incrementAndGet())
                .type(type)
                .description(description)
                .metadata(metadata == null ? Map.of() : Map.copyOf(metadata))
                .timestamp(clock.instant())
                .build();

        synchronized (activities) {
            activities.addFirst(activity);
            while (activities.size() > capacity) {
                activities.removeLast();
            }
        }
        log.debug("Activity recorded: {} - {}", type.getValue(), description);
        return activity;
    }

    @Override
    public List<SystemActivity> recent(int limit) {
        List<SystemActivity> result = new ArrayList<>();
        synchronized (activities) {
            Iterator<SystemActivity> it = activities.iterator();
            while (it.hasNext() && result.size() < limit) {
                result.add(it.next());
            }
        }
        return result;
    }
}
