package com.leo.positioning.service;

import com.leo.positioning.config.NavigationProperties;
import com.leo.positioning.config.SchedulingConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Drives {@link NavigationEngine#runCycle()} at a fixed delay on the navigation scheduler.
 *
 * <p><strong>Shutdown Sequence:</strong>
 *
 * <ol>
 *   <li>Mark the scheduler stopped so no new cycle starts
 *   <li>Cancel the periodic trigger
 *   <li>Wait up to the configured timeout for the cycle in flight
 * </ol>
 *
 * <p>A failing cycle is logged and counted; the periodic task itself never terminates on error.
 */
@Slf4j
@Service
public class NavigationCycleScheduler {

    static final String METRIC_DURATION = "navigation.cycle.duration";
    static final String METRIC_FIX = "navigation.cycle.fix";
    static final String METRIC_NO_FIX = "navigation.cycle.nofix";
    static final String METRIC_ERRORS = "navigation.cycle.errors";

    private final NavigationEngine engine;
    private final NavigationStateStore stateStore;
    private final TaskScheduler taskScheduler;
    private final NavigationProperties.Cycle cycleConfig;
    private final Clock clock;

    private final Timer cycleTimer;
    private final Counter fixCounter;
    private final Counter errorCounter;
    private final Map<CycleOutcome, Counter> noFixCounters = new EnumMap<>(CycleOutcome.class);

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final ReentrantLock cycleLock = new ReentrantLock();
    private final AtomicLong cyclesCompleted = new AtomicLong();
    private final AtomicReference<Instant> lastCycleCompletedAt = new AtomicReference<>();
    private final AtomicReference<Instant> startedAt = new AtomicReference<>();
    private volatile ScheduledFuture<?> scheduledCycle;

    public NavigationCycleScheduler(
            NavigationEngine engine,
            NavigationStateStore stateStore,
            @Qualifier(SchedulingConfig.NAVIGATION_SCHEDULER) TaskScheduler taskScheduler,
            NavigationProperties properties,
            MeterRegistry meterRegistry,
            Clock clock) {
        this.engine = engine;
        this.stateStore = stateStore;
        this.taskScheduler = taskScheduler;
        this.cycleConfig = properties.getCycle();
        this.clock = clock;

        this.cycleTimer = Timer.builder(METRIC_DURATION)
            .description("Time spent in one navigation cycle")
            .register(meterRegistry);
        this.fixCounter = Counter.builder(METRIC_FIX)
            .description("Cycles that published a fix")
            .register(meterRegistry);
        this.errorCounter = Counter.builder(METRIC_ERRORS)
            .description("Cycles that ended in an unexpected error")
            .register(meterRegistry);
        for (CycleOutcome outcome : CycleOutcome.values()) {
            if (!outcome.hasFix()) {
                noFixCounters.put(outcome, Counter.builder(METRIC_NO_FIX)
                    .description("Cycles that published no new fix")
                    .tag("reason", outcome.getReason())
                    .register(meterRegistry));
            }
        }
    }

    /** Starts cycling once the application is ready, unless disabled. */
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (cycleConfig.isAutoStart()) {
            start();
        } else {
            log.info("Navigation cycle auto-start disabled");
        }
    }

    /**
     * Schedules the periodic cycle. Has no effect once running or after {@link #stop()}.
     *
     * @return true if this call started the scheduler
     */
    public boolean start() {
        if (stopped.get() || !running.compareAndSet(false, true)) {
            return false;
        }
        startedAt.set(clock.instant());
        stateStore.recordEvent("NAV: Engine started");
        scheduledCycle = taskScheduler.scheduleWithFixedDelay(
            this::tick, Duration.ofMillis(cycleConfig.getIntervalMs()));
        log.info("Navigation cycle scheduled every {}ms", cycleConfig.getIntervalMs());
        return true;
    }

    /**
     * Runs one cycle unless the scheduler has been stopped or another cycle is in flight.
     *
     * @return true if a cycle ran
     */
    public boolean tick() {
        if (stopped.get() || !cycleLock.tryLock()) {
            return false;
        }
        try {
            if (stopped.get()) {
                return false;
            }
            Timer.Sample sample = Timer.start();
            try {
                CycleOutcome outcome = engine.runCycle();
                record(outcome);
            } catch (RuntimeException e) {
                log.error("Unexpected error escaped the navigation cycle", e);
                errorCounter.increment();
            } finally {
                sample.stop(cycleTimer);
                cyclesCompleted.incrementAndGet();
                lastCycleCompletedAt.set(clock.instant());
            }
            return true;
        } finally {
            cycleLock.unlock();
        }
    }

    private void record(CycleOutcome outcome) {
        if (outcome.hasFix()) {
            fixCounter.increment();
            return;
        }
        noFixCounters.get(outcome).increment();
        if (outcome == CycleOutcome.FAILED) {
            errorCounter.increment();
        }
    }

    @EventListener
    public void onContextClosed(ContextClosedEvent event) {
        log.info("Context closed event received, stopping navigation cycle");
        stop();
    }

    @PreDestroy
    public void preDestroy() {
        stop();
    }

    /**
     * Stops cycling and waits for the cycle in flight, bounded by the shutdown timeout.
     *
     * @return true if no cycle was still running when this returned
     */
    public boolean stop() {
        if (!stopped.compareAndSet(false, true)) {
            return !cycleLock.isLocked();
        }
        running.set(false);

        ScheduledFuture<?> future = scheduledCycle;
        if (future != null) {
            future.cancel(false);
        }

        boolean drained;
        try {
            drained = cycleLock.tryLock(cycleConfig.getShutdownTimeoutMs(), TimeUnit.MILLISECONDS);
            if (drained) {
                cycleLock.unlock();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            drained = false;
        }

        if (drained) {
            log.info("Navigation cycle stopped after {} cycles", cyclesCompleted.get());
        } else {
            log.warn("Navigation cycle still running after {}ms, abandoning wait",
                cycleConfig.getShutdownTimeoutMs());
        }
        return drained;
    }

    public boolean isRunning() {
        return running.get();
    }

    public boolean isStopped() {
        return stopped.get();
    }

    public long getCyclesCompleted() {
        return cyclesCompleted.get();
    }

    /** Completion time of the most recent cycle, or null before the first one. */
    public Instant getLastCycleCompletedAt() {
        return lastCycleCompletedAt.get();
    }

    /** Time {@link #start()} succeeded, or null if never started. */
    public Instant getStartedAt() {
        return startedAt.get();
    }
}
