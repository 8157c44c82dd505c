package com.alertengine.engine.background;

import com.alertengine.core.bus.EventBus;
import com.alertengine.core.events.ProcessorTickCompleted;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the maintenance steps on a fixed delay. Each step is isolated: a failing step is logged and
 * reported while the others still run, and the next tick is always scheduled.
 */
public class BackgroundProcessor {
    private static final Logger LOGGER = Logger.getLogger(BackgroundProcessor.class.getName());

    private final List<ProcessorStep> steps;
    private final EventBus eventBus;
    private final Clock clock;
    private final Duration tickInterval;
    private final ReentrantLock tickLock = new ReentrantLock();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<TickReport> lastReport = new AtomicReference<>();
    private ScheduledExecutorService executor;

    public BackgroundProcessor(List<ProcessorStep> steps, EventBus eventBus, Clock clock, Duration tickInterval) {
        this.steps = List.copyOf(steps);
        this.eventBus = eventBus;
        this.clock = clock;
        this.tickInterval = tickInterval;
    }

    public synchronized void start() {
        if (running.get()) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "alert-background-processor");
            thread.setDaemon(true);
            return thread;
        });
        running.set(true);
        long intervalMillis = Math.max(100, tickInterval.toMillis());
        executor.scheduleWithFixedDelay(this::runScheduledTick, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        LOGGER.info("Background processor started interval=" + tickInterval);
    }

    /**
     * Stops scheduling new ticks and waits for an in-flight tick to finish.
     */
    public synchronized void stop() {
        if (!running.getAndSet(false)) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(Math.max(5, tickInterval.toSeconds()), TimeUnit.SECONDS)) {
                LOGGER.warning("Background processor tick did not finish in time; interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOGGER.info("Background processor stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    public TickReport lastReport() {
        return lastReport.get();
    }

    public List<String> stepNames() {
        return steps.stream().map(ProcessorStep::name).toList();
    }

    /**
     * Runs every step once. Concurrent calls are serialized.
     */
    public TickReport runTick() {
        tickLock.lock();
        try {
            Instant startedAt = clock.instant();
            long started = System.nanoTime();
            List<StepResult> results = new ArrayList<>();
            for (ProcessorStep step : steps) {
                results.add(runStep(step, startedAt));
            }
            long durationMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            TickReport report = new TickReport(startedAt, durationMillis, results);
            lastReport.set(report);
            eventBus.publish(new ProcessorTickCompleted(clock.instant(), report.success(), durationMillis,
                    report.failedSteps()));
            return report;
        } finally {
            tickLock.unlock();
        }
    }

    private void runScheduledTick() {
        try {
            runTick();
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Background tick failed", e);
        }
    }

    private StepResult runStep(ProcessorStep step, Instant now) {
        try {
            StepResult result = step.run(now);
            LOGGER.fine("Background step " + step.name() + " finished: " + result.message());
            return result;
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Background step " + step.name() + " failed", e);
            return StepResult.failure(step.name(), step.name() + " failed: " + e.getMessage());
        }
    }
}
