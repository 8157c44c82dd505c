package com.alertengine.service.api;

import com.alertengine.core.bus.EventBus;
import com.alertengine.core.events.Event;
import com.alertengine.core.events.ProcessorTickCompleted;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counts engine events as they pass over the bus and remembers the latest background tick.
 */
public final class DiagnosticsTracker {
    private final Clock clock;
    private final LongAdder eventsEmittedTotal = new LongAdder();
    private final ConcurrentHashMap<String, LongAdder> eventsByType = new ConcurrentHashMap<>();
    private final ArrayDeque<Instant> recentEventTimestamps = new ArrayDeque<>();
    private final Object recentLock = new Object();
    private final AtomicReference<ProcessorTickCompleted> lastTick = new AtomicReference<>();

    public DiagnosticsTracker(EventBus eventBus, Clock clock) {
        this.clock = clock;
        eventBus.subscribeAll(this::onAnyEvent);
        eventBus.subscribe(ProcessorTickCompleted.class, lastTick::set);
    }

    public Map<String, Object> metricsSnapshot() {
        Map<String, Object> metrics = new HashMap<>();
        metrics.put("eventsEmittedTotal", eventsEmittedTotal.longValue());
        metrics.put("recentEventsPerMinute", recentEventsPerMinute());
        Map<String, Long> byType = new TreeMap<>();
        eventsByType.forEach((type, count) -> byType.put(type, count.longValue()));
        metrics.put("eventsByType", byType);
        metrics.put("lastTick", tickSnapshot());
        return metrics;
    }

    private Map<String, Object> tickSnapshot() {
        ProcessorTickCompleted tick = lastTick.get();
        Map<String, Object> snapshot = new HashMap<>();
        snapshot.put("completedAt", tick == null ? null : tick.timestamp().toString());
        snapshot.put("durationMillis", tick == null ? null : tick.durationMillis());
        snapshot.put("success", tick == null ? null : tick.success());
        snapshot.put("failedSteps", tick == null ? List.of() : tick.failedSteps());
        return snapshot;
    }

    private void onAnyEvent(Event event) {
        eventsEmittedTotal.increment();
        eventsByType.computeIfAbsent(event.type(), ignored -> new LongAdder()).increment();
        Instant now = clock.instant();
        synchronized (recentLock) {
            recentEventTimestamps.addLast(now);
            trimOld(now);
        }
    }

    private int recentEventsPerMinute() {
        synchronized (recentLock) {
            trimOld(clock.instant());
            return recentEventTimestamps.size();
        }
    }

    private void trimOld(Instant now) {
        Instant threshold = now.minus(1, ChronoUnit.MINUTES);
        while (!recentEventTimestamps.isEmpty() && recentEventTimestamps.peekFirst().isBefore(threshold)) {
            recentEventTimestamps.removeFirst();
        }
    }
}
