package com.cargo.monitor.service;

import com.cargo.monitor.config.MetricsConfig;
import com.cargo.monitor.config.MonitorConfig;
import com.cargo.monitor.model.MonitorRunResult;
import com.cargo.monitor.model.SchedulerState;
import com.cargo.monitor.model.SchedulerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the repeating monitor cycle.
 *
 * States: IDLE -> RUNNING -> IDLE while scheduled; stop() moves to STOPPING and then to
 * STOPPED once the active cycle (if any) has drained or the shutdown timeout has passed.
 *
 * At most one cycle runs at any instant. A tick or manual trigger that arrives while a
 * cycle is in flight is dropped, never queued.
 */
@Component
public class MonitorScheduler implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(MonitorScheduler.class);

    private final ExceptionMonitorService monitorService;
    private final TaskScheduler taskScheduler;
    private final TaskExecutor cycleExecutor;
    private final MonitorConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final AtomicBoolean inFlight = new AtomicBoolean(false);
    private final AtomicReference<SchedulerState> state = new AtomicReference<>(SchedulerState.IDLE);
    private final AtomicLong totalRuns = new AtomicLong();
    private final AtomicLong skippedTicks = new AtomicLong();
    private final Object drainMonitor = new Object();

    private volatile ScheduledFuture<?> scheduledTicks;
    private volatile CancellationToken activeToken;
    private volatile Duration interval;
    private volatile Instant lastRunAt;

    public MonitorScheduler(ExceptionMonitorService monitorService,
                            @Qualifier("monitorTaskScheduler") TaskScheduler taskScheduler,
                            @Qualifier("monitorCycleExecutor") TaskExecutor cycleExecutor,
                            MonitorConfig config,
                            MetricsConfig metricsConfig,
                            Clock clock) {
        this.monitorService = monitorService;
        this.taskScheduler = taskScheduler;
        this.cycleExecutor = cycleExecutor;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
        this.interval = config.getScheduler().getInterval();
    }

    // ── Lifecycle ──

    @Override
    public boolean isAutoStartup() {
        return config.getScheduler().isEnabled();
    }

    @Override
    public void start() {
        start(config.getScheduler().getInterval());
    }

    /**
     * Begin ticking every {@code interval}. Calling it on a scheduler that is already
     * ticking has no effect.
     */
    public synchronized void start(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        if (state.get() == SchedulerState.STOPPING) {
            throw new IllegalStateException("Scheduler is stopping");
        }
        if (scheduledTicks != null) {
            log.info("Exception monitor already started (interval: {})", this.interval);
            return;
        }

        state.compareAndSet(SchedulerState.STOPPED, SchedulerState.IDLE);
        this.interval = interval;
        Instant firstTick = clock.instant().plus(config.getScheduler().getInitialDelay());
        scheduledTicks = taskScheduler.scheduleAtFixedRate(this::tick, firstTick, interval);
        log.info("Starting exception monitor (interval: {}, first tick at {})", interval, firstTick);
    }

    /**
     * Stop ticking, cancel the active cycle's remaining dispatches and wait for it to
     * finish, bounded by the configured shutdown timeout.
     */
    @Override
    public void stop() {
        synchronized (this) {
            SchedulerState current = state.get();
            if (current == SchedulerState.STOPPED || current == SchedulerState.STOPPING) {
                return;
            }
            state.set(SchedulerState.STOPPING);
            log.info("Stopping exception monitor");

            if (scheduledTicks != null) {
                scheduledTicks.cancel(false);
                scheduledTicks = null;
            }
            CancellationToken token = activeToken;
            if (token != null) {
                token.cancel();
            }
        }

        boolean drained = awaitDrain(config.getScheduler().getShutdownTimeout());
        if (!drained) {
            log.warn("Active monitoring cycle did not finish within {}", config.getScheduler().getShutdownTimeout());
        }
        state.set(SchedulerState.STOPPED);
        log.info("Exception monitor stopped");
    }

    @Override
    public boolean isRunning() {
        return scheduledTicks != null;
    }

    // ── Triggers ──

    /**
     * Fired by the task scheduler. Hands the cycle to the cycle executor so the tick
     * thread is free for the next tick.
     */
    void tick() {
        if (!tryAcquire()) {
            if (isShuttingDown()) {
                return;
            }
            skippedTicks.incrementAndGet();
            metricsConfig.recordSkippedTick();
            log.warn("Near miss: previous monitoring cycle still running, skipping this tick");
            return;
        }
        if (isShuttingDown()) {
            release();
            return;
        }

        try {
            cycleExecutor.execute(() -> {
                try {
                    runCycle();
                } catch (RuntimeException e) {
                    // Keep the schedule alive whatever the cycle did
                    log.error("Error in monitoring cycle: {}", e.getMessage(), e);
                } finally {
                    release();
                }
            });
        } catch (RejectedExecutionException e) {
            release();
            log.error("Monitoring cycle could not be started: {}", e.getMessage(), e);
        }
    }

    /**
     * Run one cycle now, on the caller's thread.
     *
     * @return the cycle result, or empty when a cycle is already in flight or the
     *         scheduler is shutting down
     */
    public Optional<MonitorRunResult> triggerNow() {
        if (!tryAcquire()) {
            log.warn("Manual trigger rejected: a monitoring cycle is already running");
            return Optional.empty();
        }
        if (isShuttingDown()) {
            release();
            log.warn("Manual trigger rejected: scheduler is {}", state.get());
            return Optional.empty();
        }
        try {
            return Optional.of(runCycle());
        } finally {
            release();
        }
    }

    private MonitorRunResult runCycle() {
        CancellationToken token = new CancellationToken();
        activeToken = token;
        if (isShuttingDown()) {
            token.cancel();
        }
        state.compareAndSet(SchedulerState.IDLE, SchedulerState.RUNNING);
        try {
            MonitorRunResult result = monitorService.runOnce(token);
            totalRuns.incrementAndGet();
            lastRunAt = result.getRecord().getRunTimestamp();
            return result;
        } finally {
            activeToken = null;
            state.compareAndSet(SchedulerState.RUNNING, SchedulerState.IDLE);
        }
    }

    // ── Single-flight guard ──

    // Callers take the guard first and only then read the state, so stop() either sees
    // the guard held and waits, or the caller sees STOPPING/STOPPED and backs out.
    private boolean tryAcquire() {
        return inFlight.compareAndSet(false, true);
    }

    private void release() {
        synchronized (drainMonitor) {
            inFlight.set(false);
            drainMonitor.notifyAll();
        }
    }

    private boolean isShuttingDown() {
        SchedulerState current = state.get();
        return current == SchedulerState.STOPPING || current == SchedulerState.STOPPED;
    }

    private boolean awaitDrain(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (drainMonitor) {
            while (inFlight.get()) {
                long remainingMs = (deadline - System.nanoTime()) / 1_000_000;
                if (remainingMs <= 0) {
                    return false;
                }
                try {
                    drainMonitor.wait(remainingMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return !inFlight.get();
                }
            }
            return true;
        }
    }

    // ── Status ──

    public SchedulerState getState() {
        return state.get();
    }

    public boolean isCycleInFlight() {
        return inFlight.get();
    }

    public SchedulerStatus getStatus() {
        return SchedulerStatus.builder()
                .state(state.get())
                .started(isRunning())
                .intervalSeconds(interval.getSeconds())
                .totalRuns(totalRuns.get())
                .skippedTicks(skippedTicks.get())
                .lastRunAt(lastRunAt)
                .build();
    }
}
